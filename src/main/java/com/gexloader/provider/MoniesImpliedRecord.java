package com.gexloader.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One expiration row of the monies/implied endpoint, projected to carry fields only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MoniesImpliedRecord {

    private String expirDate;
    private Double riskFreeRate;
    private Double yieldRate;
}
