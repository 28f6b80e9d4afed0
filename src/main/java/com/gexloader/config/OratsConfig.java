package com.gexloader.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and HTTP clients for the ORATS datav2 API.
 *
 * <p>Binds to the {@code orats.*} prefix. Two {@link RestClient} beans share the base
 * URL but differ in read timeout: probes are cheap existence checks and fail fast,
 * bulk strike and carry downloads are allowed a few minutes. Neither retries.
 *
 * <p>The token may be replaced at run start by a command-line override, so it is read
 * per request rather than baked into the clients.
 */
@Configuration
@ConfigurationProperties(prefix = "orats")
@Getter
@Setter
public class OratsConfig {

    private static final Logger log = LoggerFactory.getLogger(OratsConfig.class);

    /** API token (ORATS_TOKEN). */
    private String token;

    private String baseUrl = "https://api.orats.io/datav2";

    /** HTTP connect timeout in milliseconds. */
    private int connectTimeout = 10_000;

    /** Read timeout in milliseconds for data-existence probes. */
    private int probeReadTimeout = 60_000;

    /** Read timeout in milliseconds for strike and carry downloads. */
    private int bulkReadTimeout = 180_000;

    @Bean
    public RestClient oratsProbeRestClient() {
        return buildClient(probeReadTimeout);
    }

    @Bean
    public RestClient oratsBulkRestClient() {
        return buildClient(bulkReadTimeout);
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    /** Token with everything past the first four characters hidden, for logs. */
    public String maskedToken() {
        if (token == null || token.length() < 4) {
            return "****";
        }
        return token.substring(0, 4) + "****";
    }

    private RestClient buildClient(int readTimeout) {
        log.debug("Creating ORATS RestClient: baseUrl={}, readTimeout={}ms", baseUrl, readTimeout);
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
