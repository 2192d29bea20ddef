package com.eurofolio.engine.application.backtest.engine;

import com.eurofolio.engine.application.backtest.engine.dto.PerformancePoint;
import com.eurofolio.engine.application.backtest.engine.dto.PricePoint;
import com.eurofolio.engine.application.backtest.engine.dto.PriceSeries;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

final class EngineFixtures {

    private EngineFixtures() {
    }

    static BacktestEngine newEngine() {
        return new BacktestEngine(new BacktestInputNormalizer(), new DailyValuationSimulator(), newMetricsCalculator());
    }

    static PerformanceMetricsCalculator newMetricsCalculator() {
        return new PerformanceMetricsCalculator(new DrawdownAnalyzer(), new PeriodReturnCalculator());
    }

    /**
     * start부터 하루 간격의 종가 시계열
     */
    static PriceSeries dailySeries(LocalDate start, String... closes) {
        List<PricePoint> points = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            points.add(PricePoint.of(start.plusDays(i), closes[i]));
        }
        return PriceSeries.of(points);
    }

    static PriceSeries dailySeries(LocalDate start, int days, IntFunction<BigDecimal> priceOfDay) {
        List<PricePoint> points = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            points.add(new PricePoint(start.plusDays(i), priceOfDay.apply(i)));
        }
        return PriceSeries.of(points);
    }

    static PriceSeries flatSeries(LocalDate start, int days, String price) {
        BigDecimal close = new BigDecimal(price);
        return dailySeries(start, days, i -> close);
    }

    /**
     * 평가액 목록으로 일별 시계열 구성 (수익률은 시뮬레이터와 같은 방식으로 계산)
     */
    static List<PerformancePoint> pointsFromValues(LocalDate start, List<BigDecimal> values) {
        List<PerformancePoint> points = new ArrayList<>();
        BigDecimal initial = values.get(0);
        BigDecimal previous = initial;
        for (int i = 0; i < values.size(); i++) {
            BigDecimal value = values.get(i);
            BigDecimal dailyReturn = i == 0
                ? BigDecimal.ZERO.setScale(8)
                : value.subtract(previous).divide(previous, 8, RoundingMode.HALF_UP);
            points.add(PerformancePoint.builder()
                .date(start.plusDays(i))
                .value(value)
                .dailyReturn(dailyReturn)
                .cumulativeReturn(value.subtract(initial).divide(initial, 8, RoundingMode.HALF_UP))
                .build());
            previous = value;
        }
        return points;
    }

    static List<PerformancePoint> pointsFromValues(LocalDate start, String... values) {
        List<BigDecimal> decimals = new ArrayList<>();
        for (String value : values) {
            decimals.add(new BigDecimal(value));
        }
        return pointsFromValues(start, decimals);
    }
}
