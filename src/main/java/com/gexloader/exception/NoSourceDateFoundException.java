package com.gexloader.exception;

import java.time.LocalDate;
import java.util.Map;

public class NoSourceDateFoundException extends BaseException {

    public NoSourceDateFoundException(String ticker, LocalDate before, int lookbackDays) {
        super(
                ErrorCode.NO_SOURCE_DATE,
                "No trade date with data for " + ticker + " in the " + lookbackDays + " days before " + before,
                Map.of("ticker", ticker, "before", before, "lookbackDays", lookbackDays));
    }
}
