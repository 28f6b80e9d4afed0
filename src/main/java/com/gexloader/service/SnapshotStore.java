package com.gexloader.service;

import com.gexloader.domain.model.DerivedRow;
import com.gexloader.entity.StrikeGammaEntity;
import com.gexloader.entity.StrikeGammaId;
import com.gexloader.mapper.StrikeGammaMapper;
import com.gexloader.repository.jpa.StrikeGammaJpaRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Idempotent writer for strike rows.
 *
 * <p>A (ticker, stored date) partition is replaced as a unit: delete then insert inside
 * one transaction, so a failure leaves the previous partition intact and a re-run with
 * the same input produces the same row set. An empty input is a no-op and leaves any
 * existing partition in place.
 */
@Service
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final StrikeGammaJpaRepository strikeGammaJpaRepository;
    private final Clock clock;
    private final StrikeGammaMapper strikeGammaMapper = Mappers.getMapper(StrikeGammaMapper.class);

    public SnapshotStore(StrikeGammaJpaRepository strikeGammaJpaRepository, Clock clock) {
        this.strikeGammaJpaRepository = strikeGammaJpaRepository;
        this.clock = clock;
    }

    /**
     * Replaces every row of (ticker, storedDate) with {@code rows}.
     *
     * @return number of rows inserted
     * @throws IllegalArgumentException if a row belongs to another partition
     */
    @Transactional
    public int replacePartition(String ticker, LocalDate storedDate, List<DerivedRow> rows) {
        if (rows == null || rows.isEmpty()) {
            log.warn("No rows for {} {}, existing partition left untouched", ticker, storedDate);
            return 0;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Map<StrikeGammaId, StrikeGammaEntity> byKey = new LinkedHashMap<>();
        for (DerivedRow row : rows) {
            if (!ticker.equals(row.getTicker()) || !storedDate.equals(row.getTradeDate())) {
                throw new IllegalArgumentException("Row " + row.getTicker() + " " + row.getTradeDate()
                        + " does not belong to partition " + ticker + " " + storedDate);
            }
            StrikeGammaEntity entity = strikeGammaMapper.toEntity(row);
            entity.setUpdatedAt(now);
            byKey.put(entity.getId(), entity);
        }
        if (byKey.size() < rows.size()) {
            log.warn("Collapsed {} duplicate keys for {} {}", rows.size() - byKey.size(), ticker, storedDate);
        }

        int deleted = strikeGammaJpaRepository.deletePartition(ticker, storedDate);
        strikeGammaJpaRepository.saveAll(new ArrayList<>(byKey.values()));
        log.info("Replaced partition {} {}: deleted={}, inserted={}", ticker, storedDate, deleted, byKey.size());
        return byKey.size();
    }

    @Transactional(readOnly = true)
    public List<DerivedRow> loadPartition(String ticker, LocalDate storedDate) {
        return strikeGammaMapper.toDomainList(
                strikeGammaJpaRepository.findByTickerAndTradeDateOrderByExpirDateAscStrikeAsc(ticker, storedDate));
    }
}
