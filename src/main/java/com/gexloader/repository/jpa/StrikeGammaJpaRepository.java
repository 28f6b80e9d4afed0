package com.gexloader.repository.jpa;

import com.gexloader.entity.StrikeGammaEntity;
import com.gexloader.entity.StrikeGammaId;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the orats_oi_gamma table.
 * Rows are partitioned by (ticker, trade_date); writers replace a whole partition.
 */
@Repository
public interface StrikeGammaJpaRepository extends JpaRepository<StrikeGammaEntity, StrikeGammaId> {

    /** Bulk delete of one partition. Runs inside the caller's transaction. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM StrikeGammaEntity s WHERE s.ticker = :ticker AND s.tradeDate = :tradeDate")
    int deletePartition(@Param("ticker") String ticker, @Param("tradeDate") LocalDate tradeDate);

    long countByTickerAndTradeDate(String ticker, LocalDate tradeDate);

    List<StrikeGammaEntity> findByTickerAndTradeDateOrderByExpirDateAscStrikeAsc(String ticker, LocalDate tradeDate);
}
