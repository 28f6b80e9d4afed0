package com.gexloader.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ORATS response envelope: {@code {"data": [...]}}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OratsResponse<T> {

    private List<T> data = new ArrayList<>();

    public List<T> dataOrEmpty() {
        return data != null ? data : List.of();
    }
}
