package com.eurofolio.engine.application.dto;

import com.eurofolio.engine.domain.entity.Asset;
import com.eurofolio.engine.domain.entity.PriceData;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 자산 일봉 시세 응답
 * source: 캐시에서 읽은 건수 / API로 새로 받은 건수 / 합계
 */
@Getter
@AllArgsConstructor
public class AssetPriceResponse {

    private final List<PriceRow> data;
    private final AssetResponse asset;
    private final Source source;
    private final String warning; // 백필 실패 시에만

    public static AssetPriceResponse of(Asset asset, List<PriceData> rows, int cached, int fetched, String warning) {
        List<PriceRow> data = rows.stream()
            .map(PriceRow::from)
            .collect(Collectors.toList());
        return new AssetPriceResponse(data, AssetResponse.from(asset), new Source(cached, fetched, data.size()), warning);
    }

    @Getter
    @AllArgsConstructor
    public static class PriceRow {
        private final LocalDate date;
        private final BigDecimal open;
        private final BigDecimal high;
        private final BigDecimal low;
        private final BigDecimal close;
        private final BigDecimal adjustedClose;
        private final Long volume;

        static PriceRow from(PriceData price) {
            return new PriceRow(
                price.getTradeDate(),
                price.getOpenPrice(),
                price.getHighPrice(),
                price.getLowPrice(),
                price.getClosePrice(),
                price.getAdjustedClose(),
                price.getVolume()
            );
        }
    }

    @Getter
    @AllArgsConstructor
    public static class Source {
        private final int cached;
        private final int api;
        private final int total;
    }
}
