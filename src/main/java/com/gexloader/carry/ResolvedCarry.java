package com.gexloader.carry;

import com.gexloader.domain.model.CarryRate;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ResolvedCarry {

    private final CarryRate rate;

    /** Tier that produced the rate. */
    private final CarryTier tier;
}
