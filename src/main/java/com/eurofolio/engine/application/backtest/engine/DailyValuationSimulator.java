package com.eurofolio.engine.application.backtest.engine;

import com.eurofolio.engine.application.backtest.engine.dto.Allocation;
import com.eurofolio.engine.application.backtest.engine.dto.PerformancePoint;
import com.eurofolio.engine.application.backtest.engine.dto.PriceSeries;
import com.eurofolio.engine.application.backtest.engine.dto.RebalanceFrequency;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 일별 포트폴리오 평가 시뮬레이터
 * - 시작일 ~ 종료일의 모든 달력일(주말/휴일 포함)에 대해 평가액을 계산
 * - 리밸런싱은 거래비용/세금 없이 목표 비중으로 즉시 조정한다고 가정
 * - 보유 수량은 호출마다 새로 만들어지고 호출이 끝나면 버려진다
 */
@Slf4j
@Component
public class DailyValuationSimulator {

    private static final int SCALE = 8; // 평가액/수익률 정밀도
    private static final int SHARE_SCALE = 12; // 보유 수량 정밀도
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    /**
     * 시작일부터 종료일까지(포함) 하루 단위 날짜 목록
     */
    public static List<LocalDate> dateRange(LocalDate startDate, LocalDate endDate) {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate current = startDate;
        while (!current.isAfter(endDate)) {
            dates.add(current);
            current = current.plusDays(1);
        }
        return dates;
    }

    public List<PerformancePoint> simulate(List<Allocation> allocations,
                                           Map<String, PriceSeries> priceSeriesByAsset,
                                           List<LocalDate> dateRange,
                                           BigDecimal initialInvestment,
                                           RebalanceFrequency rebalanceFrequency) {
        return simulate(allocations, priceSeriesByAsset, dateRange, initialInvestment, rebalanceFrequency,
            SimulationListener.NONE);
    }

    public List<PerformancePoint> simulate(List<Allocation> allocations,
                                           Map<String, PriceSeries> priceSeriesByAsset,
                                           List<LocalDate> dateRange,
                                           BigDecimal initialInvestment,
                                           RebalanceFrequency rebalanceFrequency,
                                           SimulationListener listener) {
        List<PerformancePoint> performanceData = new ArrayList<>(dateRange.size());
        if (dateRange.isEmpty()) {
            return performanceData;
        }

        LocalDate startDate = dateRange.get(0);
        Map<String, BigDecimal> shares = new LinkedHashMap<>();

        // 1. 시작일 가격으로 최초 매수
        purchase(allocations, priceSeriesByAsset, initialInvestment, shares, startDate);
        listener.onInitialPurchase(startDate, Collections.unmodifiableMap(new LinkedHashMap<>(shares)));

        BigDecimal previousValue = initialInvestment;

        for (int i = 0; i < dateRange.size(); i++) {
            LocalDate currentDate = dateRange.get(i);
            long daysSinceStart = ChronoUnit.DAYS.between(startDate, currentDate);

            // 2. 리밸런싱 (첫날 제외)
            if (i > 0 && rebalanceFrequency.isDue(daysSinceStart)) {
                BigDecimal preRebalanceValue = calculatePortfolioValue(shares, priceSeriesByAsset, currentDate);
                purchase(allocations, priceSeriesByAsset, preRebalanceValue, shares, currentDate);
                log.debug("리밸런싱: {} ({}일차), 평가액={}", currentDate, daysSinceStart, preRebalanceValue);
                listener.onRebalance(currentDate, daysSinceStart, Collections.unmodifiableMap(new LinkedHashMap<>(shares)));
            }

            // 3. 당일 평가액 및 수익률
            BigDecimal value = calculatePortfolioValue(shares, priceSeriesByAsset, currentDate);
            BigDecimal dailyReturn = i > 0 && previousValue.signum() != 0
                ? value.subtract(previousValue).divide(previousValue, SCALE, ROUNDING)
                : BigDecimal.ZERO.setScale(SCALE);
            BigDecimal cumulativeReturn = value.subtract(initialInvestment).divide(initialInvestment, SCALE, ROUNDING);

            performanceData.add(PerformancePoint.builder()
                .date(currentDate)
                .value(value)
                .dailyReturn(dailyReturn)
                .cumulativeReturn(cumulativeReturn)
                .build());

            previousValue = value;
        }

        return performanceData;
    }

    /**
     * 목표 비중대로 보유 수량 설정 (최초 매수 및 리밸런싱 공용)
     * 가격을 찾지 못한 자산은 기존 수량을 그대로 둔다.
     */
    private void purchase(List<Allocation> allocations,
                          Map<String, PriceSeries> priceSeriesByAsset,
                          BigDecimal portfolioValue,
                          Map<String, BigDecimal> shares,
                          LocalDate date) {
        for (Allocation allocation : allocations) {
            Optional<BigDecimal> price = resolvePrice(priceSeriesByAsset, allocation.getAssetId(), date);
            if (price.isEmpty()) {
                log.debug("가격 없음: asset={}, date={}", allocation.getAssetId(), date);
                continue;
            }

            BigDecimal targetValue = allocation.getPercentage().multiply(portfolioValue)
                .divide(HUNDRED, SHARE_SCALE, ROUNDING);
            BigDecimal shareCount = targetValue.divide(price.get(), SHARE_SCALE, ROUNDING);
            shares.put(allocation.getAssetId(), shareCount);

            log.debug("asset={}: {}% = {} @ {} = {} shares",
                allocation.getAssetId(), allocation.getPercentage(), targetValue, price.get(), shareCount);
        }
    }

    /**
     * 보유 수량 × 당일 가격의 합
     */
    private BigDecimal calculatePortfolioValue(Map<String, BigDecimal> shares,
                                               Map<String, PriceSeries> priceSeriesByAsset,
                                               LocalDate date) {
        BigDecimal totalValue = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> holding : shares.entrySet()) {
            Optional<BigDecimal> price = resolvePrice(priceSeriesByAsset, holding.getKey(), date);
            if (price.isPresent()) {
                totalValue = totalValue.add(holding.getValue().multiply(price.get()));
            }
        }
        return totalValue.setScale(SCALE, ROUNDING);
    }

    private Optional<BigDecimal> resolvePrice(Map<String, PriceSeries> priceSeriesByAsset, String assetId, LocalDate date) {
        PriceSeries series = priceSeriesByAsset.get(assetId);
        if (series == null) {
            return Optional.empty();
        }
        // 0 이하 가격은 수량 계산이 불가능하므로 가격 없음으로 취급
        return series.resolve(date).filter(price -> price.signum() > 0);
    }
}
