package com.gexloader.mapper;

import com.gexloader.domain.model.DerivedRow;
import com.gexloader.entity.StrikeGammaEntity;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between DerivedRow and StrikeGammaEntity.
 * Strike and stock price widen to BigDecimal at the scale of their NUMERIC columns, so
 * two strikes that the database would store as equal also share one in-memory key;
 * updatedAt is stamped by the store.
 */
@Mapper
public interface StrikeGammaMapper {

    int STRIKE_SCALE = 4;
    int STOCK_PRICE_SCALE = 6;

    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(source = "strike", target = "strike", qualifiedByName = "strikeToColumn")
    @Mapping(source = "stockPrice", target = "stockPrice", qualifiedByName = "stockPriceToColumn")
    StrikeGammaEntity toEntity(DerivedRow row);

    DerivedRow toDomain(StrikeGammaEntity entity);

    List<DerivedRow> toDomainList(List<StrikeGammaEntity> entities);

    @Named("strikeToColumn")
    default BigDecimal strikeToColumn(Double strike) {
        return toScale(strike, STRIKE_SCALE);
    }

    @Named("stockPriceToColumn")
    default BigDecimal stockPriceToColumn(Double stockPrice) {
        return toScale(stockPrice, STOCK_PRICE_SCALE);
    }

    private static BigDecimal toScale(Double value, int scale) {
        return value != null ? BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP) : null;
    }
}
