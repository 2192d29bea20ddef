package com.eurofolio.engine.application.backtest.engine;

import com.eurofolio.engine.application.backtest.engine.dto.Allocation;
import com.eurofolio.engine.application.backtest.engine.dto.BacktestParameters;
import com.eurofolio.engine.application.backtest.engine.dto.NormalizedInput;
import com.eurofolio.engine.application.backtest.engine.dto.PriceSeries;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 백테스트 입력 검증
 * - 시뮬레이션 시작 전에 한 번만 검증하며, 이후 비중은 리밸런싱 전까지 자연스럽게 변동한다.
 * - 가격 데이터가 없는 자산을 임의로 제외하지 않는다 (비중 재조정은 호출 측 책임).
 */
@Component
public class BacktestInputNormalizer {

    static final BigDecimal FULL_ALLOCATION = new BigDecimal("100");
    static final BigDecimal ALLOCATION_TOLERANCE = new BigDecimal("0.01");

    public NormalizedInput normalize(List<Allocation> allocations,
                                     Map<String, PriceSeries> priceSeriesByAsset,
                                     BacktestParameters params) {
        if (allocations == null || allocations.isEmpty()) {
            throw new BacktestValidationException("Portfolio must have at least one allocation");
        }

        Set<String> assetIds = new HashSet<>();
        BigDecimal totalAllocation = BigDecimal.ZERO;
        for (Allocation allocation : allocations) {
            if (allocation == null || allocation.getAssetId() == null || allocation.getAssetId().isBlank()) {
                throw new BacktestValidationException("Allocation asset id is required");
            }
            if (!assetIds.add(allocation.getAssetId())) {
                throw new BacktestValidationException("Duplicate allocation for asset " + allocation.getAssetId());
            }
            BigDecimal percentage = allocation.getPercentage();
            if (percentage == null
                || percentage.compareTo(BigDecimal.ZERO) <= 0
                || percentage.compareTo(FULL_ALLOCATION) > 0) {
                throw new BacktestValidationException(
                    "Allocation percentage for asset " + allocation.getAssetId() + " must be in (0, 100]: " + percentage);
            }
            totalAllocation = totalAllocation.add(percentage);
        }

        if (totalAllocation.subtract(FULL_ALLOCATION).abs().compareTo(ALLOCATION_TOLERANCE) > 0) {
            throw new BacktestValidationException("Portfolio allocations must sum to 100% (was " + totalAllocation + "%)");
        }

        if (params == null) {
            throw new BacktestValidationException("Backtest parameters are required");
        }
        if (params.getInitialInvestment() == null || params.getInitialInvestment().compareTo(BigDecimal.ZERO) <= 0) {
            throw new BacktestValidationException("Initial investment must be greater than 0");
        }
        if (params.getStartDate() == null || params.getEndDate() == null) {
            throw new BacktestValidationException("Start date and end date are required");
        }
        if (!params.getStartDate().isBefore(params.getEndDate())) {
            throw new BacktestValidationException("Start date must be before end date");
        }
        if (params.getRebalanceFrequency() == null) {
            throw new BacktestValidationException("Rebalance frequency is required");
        }

        for (Allocation allocation : allocations) {
            PriceSeries series = priceSeriesByAsset == null ? null : priceSeriesByAsset.get(allocation.getAssetId());
            if (series == null || series.isEmpty()) {
                throw new MissingPriceDataException(allocation.getAssetId());
            }
        }

        return new NormalizedInput(List.copyOf(allocations), Collections.unmodifiableMap(new HashMap<>(priceSeriesByAsset)), params);
    }
}
