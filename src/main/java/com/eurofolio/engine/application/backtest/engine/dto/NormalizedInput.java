package com.eurofolio.engine.application.backtest.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 검증을 통과한 백테스트 입력
 */
@Getter
@AllArgsConstructor
public class NormalizedInput {

    private final List<Allocation> allocations;
    private final Map<String, PriceSeries> priceSeriesByAsset;
    private final BacktestParameters parameters;
}
