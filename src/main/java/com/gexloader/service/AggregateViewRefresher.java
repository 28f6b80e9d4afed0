package com.gexloader.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the per-expiration GEX aggregate after a partition write.
 *
 * <p>Runs outside the write transaction. The raw table is authoritative and the view
 * can always be rebuilt, so a failed refresh is logged and reported, never thrown.
 */
@Service
public class AggregateViewRefresher {

    private static final Logger log = LoggerFactory.getLogger(AggregateViewRefresher.class);

    static final String VIEW_NAME = "orats_gex_by_exp";

    private final JdbcTemplate jdbcTemplate;

    public AggregateViewRefresher(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return true if the view was refreshed
     */
    public boolean refresh() {
        try {
            jdbcTemplate.execute("REFRESH MATERIALIZED VIEW " + VIEW_NAME);
            log.info("Refreshed materialized view {}", VIEW_NAME);
            return true;
        } catch (DataAccessException e) {
            log.warn("Refresh of {} failed, raw rows are committed: {}", VIEW_NAME, e.getMessage());
            return false;
        }
    }
}
