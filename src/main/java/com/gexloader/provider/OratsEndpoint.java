package com.gexloader.provider;

/**
 * ORATS datav2 endpoints used by the loader, with the field projection each one requests.
 */
public enum OratsEndpoint {
    STRIKES_PROBE("/hist/strikes", "ticker"),
    STRIKES(
            "/hist/strikes",
            "ticker,tradeDate,expirDate,dte,strike,stockPrice,callOpenInterest,putOpenInterest,gamma"),
    MONIES_IMPLIED_HIST("/hist/monies/implied", "expirDate,riskFreeRate,yieldRate"),
    MONIES_IMPLIED_LIVE("/monies/implied", "expirDate,riskFreeRate,yieldRate"),
    SUMMARIES_HIST("/hist/summaries", "riskFree30"),
    SUMMARIES_LIVE("/summaries", "riskFree30");

    private final String path;
    private final String fields;

    OratsEndpoint(String path, String fields) {
        this.path = path;
        this.fields = fields;
    }

    public String getPath() {
        return path;
    }

    public String getFields() {
        return fields;
    }
}
