package com.gexloader.provider;

import com.gexloader.carry.FirstMatch;
import com.gexloader.config.JobConfig;
import com.gexloader.config.OratsConfig;
import com.gexloader.domain.model.CarryQuote;
import com.gexloader.domain.model.CarryRate;
import com.gexloader.domain.model.StrikeRecord;
import com.gexloader.exception.AuthenticationException;
import com.gexloader.exception.FetchException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link MarketDataClient} backed by the ORATS datav2 REST API.
 *
 * <p>Every request carries {@code ticker}, {@code tradeDate}, {@code fields} and
 * {@code token} query parameters, plus the token in the Authorization header. Probes go
 * through the short-timeout client, downloads through the long-timeout one. Nothing is
 * retried: a timeout surfaces immediately.
 */
@Component
public class OratsMarketDataClient implements MarketDataClient {

    private static final Logger log = LoggerFactory.getLogger(OratsMarketDataClient.class);

    private static final int MAX_BODY_LENGTH = 200;

    private static final ParameterizedTypeReference<OratsResponse<StrikeRecord>> STRIKES_TYPE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<OratsResponse<MoniesImpliedRecord>> MONIES_TYPE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<OratsResponse<SummaryRecord>> SUMMARY_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestClient probeRestClient;
    private final RestClient bulkRestClient;
    private final OratsConfig oratsConfig;
    private final JobConfig jobConfig;

    public OratsMarketDataClient(
            @Qualifier("oratsProbeRestClient") RestClient probeRestClient,
            @Qualifier("oratsBulkRestClient") RestClient bulkRestClient,
            OratsConfig oratsConfig,
            JobConfig jobConfig) {
        this.probeRestClient = probeRestClient;
        this.bulkRestClient = bulkRestClient;
        this.oratsConfig = oratsConfig;
        this.jobConfig = jobConfig;
    }

    @Override
    public boolean probeHasData(String ticker, LocalDate tradeDate) {
        try {
            OratsResponse<StrikeRecord> response =
                    get(probeRestClient, OratsEndpoint.STRIKES_PROBE, ticker, tradeDate, STRIKES_TYPE);
            return response != null && !response.dataOrEmpty().isEmpty();
        } catch (RestClientResponseException e) {
            rejectIfUnauthorized(OratsEndpoint.STRIKES_PROBE, e);
            log.warn(
                    "ORATS probe {} {} -> {} {}",
                    tradeDate,
                    ticker,
                    e.getStatusCode().value(),
                    truncate(e.getResponseBodyAsString()));
            return false;
        } catch (RestClientException e) {
            throw new FetchException(OratsEndpoint.STRIKES_PROBE.getPath(), e);
        }
    }

    @Override
    public List<StrikeRecord> fetchStrikes(String ticker, LocalDate tradeDate) {
        OratsResponse<StrikeRecord> response;
        try {
            response = get(bulkRestClient, OratsEndpoint.STRIKES, ticker, tradeDate, STRIKES_TYPE);
        } catch (RestClientResponseException e) {
            rejectIfUnauthorized(OratsEndpoint.STRIKES, e);
            throw new FetchException(
                    OratsEndpoint.STRIKES.getPath(),
                    e.getStatusCode().value(),
                    truncate(e.getResponseBodyAsString()));
        } catch (RestClientException e) {
            throw new FetchException(OratsEndpoint.STRIKES.getPath(), e);
        }

        List<StrikeRecord> records = response != null ? response.dataOrEmpty() : List.of();
        int dteMax = jobConfig.getDteMax();
        List<StrikeRecord> kept = records.stream()
                .filter(Objects::nonNull)
                .filter(r -> r.getDte() == null || r.getDte() <= dteMax)
                .toList();
        log.info(
                "Fetched {} strike records for {} {}, {} within DTE {}",
                records.size(),
                ticker,
                tradeDate,
                kept.size(),
                dteMax);
        return kept;
    }

    @Override
    public CarryQuote fetchCarryQuotes(String ticker, LocalDate tradeDate) {
        Map<LocalDate, CarryRate> rates = FirstMatch.<Map<LocalDate, CarryRate>>of(
                        () -> fetchMonies(OratsEndpoint.MONIES_IMPLIED_HIST, ticker, tradeDate),
                        () -> fetchMonies(OratsEndpoint.MONIES_IMPLIED_LIVE, ticker, tradeDate))
                .resolve()
                .orElse(Map.of());
        log.info("Carry quotes for {} {}: {} expirations", ticker, tradeDate, rates.size());
        return new CarryQuote(ticker, tradeDate, rates);
    }

    @Override
    public Optional<Double> fetchFallbackRate(String ticker, LocalDate tradeDate) {
        Optional<Double> rate = FirstMatch.<Double>of(
                        () -> fetchSummaryRate(OratsEndpoint.SUMMARIES_HIST, ticker, tradeDate),
                        () -> fetchSummaryRate(OratsEndpoint.SUMMARIES_LIVE, ticker, tradeDate))
                .resolve();
        log.info("Fallback short rate for {} {}: {}", ticker, tradeDate, rate.orElse(null));
        return rate;
    }

    private Optional<Map<LocalDate, CarryRate>> fetchMonies(OratsEndpoint endpoint, String ticker, LocalDate tradeDate) {
        Optional<OratsResponse<MoniesImpliedRecord>> response =
                getCarrySource(endpoint, ticker, tradeDate, MONIES_TYPE);
        if (response.isEmpty()) {
            return Optional.empty();
        }

        Map<LocalDate, CarryRate> rates = new LinkedHashMap<>();
        for (MoniesImpliedRecord record : response.get().dataOrEmpty()) {
            LocalDate expiration = parseDate(record.getExpirDate());
            if (expiration == null) {
                continue;
            }
            rates.putIfAbsent(expiration, new CarryRate(record.getRiskFreeRate(), record.getYieldRate()));
        }
        if (rates.isEmpty()) {
            log.warn("ORATS {} returned no carry rows for {} {}", endpoint.getPath(), ticker, tradeDate);
            return Optional.empty();
        }
        return Optional.of(rates);
    }

    private Optional<Double> fetchSummaryRate(OratsEndpoint endpoint, String ticker, LocalDate tradeDate) {
        return getCarrySource(endpoint, ticker, tradeDate, SUMMARY_TYPE)
                .flatMap(response -> response.dataOrEmpty().stream()
                        .filter(Objects::nonNull)
                        .map(SummaryRecord::getRiskFree30)
                        .filter(Objects::nonNull)
                        .findFirst());
    }

    /**
     * Calls a carry or rate endpoint. Any error other than 401 means "no data from this
     * source" and is logged, not thrown.
     */
    private <T> Optional<OratsResponse<T>> getCarrySource(
            OratsEndpoint endpoint,
            String ticker,
            LocalDate tradeDate,
            ParameterizedTypeReference<OratsResponse<T>> type) {
        try {
            return Optional.ofNullable(get(bulkRestClient, endpoint, ticker, tradeDate, type));
        } catch (RestClientResponseException e) {
            rejectIfUnauthorized(endpoint, e);
            log.warn(
                    "ORATS {} unavailable for {} {} -> {} {}",
                    endpoint.getPath(),
                    ticker,
                    tradeDate,
                    e.getStatusCode().value(),
                    truncate(e.getResponseBodyAsString()));
            return Optional.empty();
        } catch (RestClientException e) {
            log.warn("ORATS {} unavailable for {} {}: {}", endpoint.getPath(), ticker, tradeDate, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> OratsResponse<T> get(
            RestClient restClient,
            OratsEndpoint endpoint,
            String ticker,
            LocalDate tradeDate,
            ParameterizedTypeReference<OratsResponse<T>> type) {
        String token = oratsConfig.getToken();
        return restClient
                .get()
                .uri(uriBuilder -> uriBuilder
                        .path(endpoint.getPath())
                        .queryParam("ticker", ticker)
                        .queryParam("tradeDate", tradeDate.toString())
                        .queryParam("fields", endpoint.getFields())
                        .queryParam("token", token)
                        .build())
                .headers(headers -> {
                    if (token != null) {
                        headers.set(HttpHeaders.AUTHORIZATION, token);
                    }
                })
                .retrieve()
                .body(type);
    }

    private void rejectIfUnauthorized(OratsEndpoint endpoint, RestClientResponseException e) {
        if (e.getStatusCode().value() == 401) {
            throw new AuthenticationException(endpoint.getPath(), truncate(e.getResponseBodyAsString()));
        }
    }

    private static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            log.debug("Unparseable expiration '{}' in carry data", text);
            return null;
        }
    }

    static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_BODY_LENGTH ? body : body.substring(0, MAX_BODY_LENGTH);
    }
}
