package com.eurofolio.engine.application.backtest.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * 자산별 목표 비중
 * - percentage: (0, 100] 구간의 백분율
 */
@Getter
@ToString
@AllArgsConstructor
@Builder
public class Allocation {

    private final String assetId;
    private final BigDecimal percentage;

    public static Allocation of(String assetId, String percentage) {
        return new Allocation(assetId, new BigDecimal(percentage));
    }
}
