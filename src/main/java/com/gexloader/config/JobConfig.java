package com.gexloader.config;

import com.gexloader.calendar.StoredDatePolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Clock;
import java.time.ZoneId;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Run-level settings of the EOD loader, bound to the {@code gex.job} prefix.
 *
 * <p>Every option is sourced from an environment variable in application.yml
 * (TICKER, PROXY_TICKER, DTE_MAX, CONTRACT_MULTIPLIER, LOOKBACK_DAYS, JOB_TIMEZONE,
 * DATE_POLICY). Components take this object through their constructor, so tests
 * build one directly instead of touching the process environment.
 */
@Configuration
@ConfigurationProperties(prefix = "gex.job")
@Validated
@Getter
@Setter
public class JobConfig {

    /** Underlying whose strikes are loaded. */
    @NotBlank
    private String ticker = "SPX";

    /** Ticker whose carry quotes back-fill missing dividend yields. */
    @NotBlank
    private String proxyTicker = "SPY";

    /** Records whose provider DTE exceeds this are dropped. Records without a DTE are kept. */
    @Min(0)
    private int dteMax = 400;

    @Positive
    private double contractMultiplier = 100;

    /** Calendar days searched backwards for a source date with data. */
    @Min(1)
    private int lookbackDays = 7;

    /** Zone in which "today" is evaluated. */
    @NotBlank
    private String timezone = "America/New_York";

    @NotNull
    private StoredDatePolicy datePolicy = StoredDatePolicy.NEXT_BUSINESS_DAY;

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    @Bean
    public Clock clock() {
        return Clock.system(zoneId());
    }
}
