package com.eurofolio.engine.application.backtest.engine;

import com.eurofolio.engine.application.backtest.engine.dto.DrawdownPeriod;
import com.eurofolio.engine.application.backtest.engine.dto.PerformancePoint;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DrawdownAnalyzerTest {

    private static final LocalDate START = LocalDate.of(2024, 5, 1);

    private final DrawdownAnalyzer analyzer = new DrawdownAnalyzer();

    @Test
    void unrecoveredDrawdownRunsToLastPoint() {
        List<PerformancePoint> points = EngineFixtures.pointsFromValues(START, "100", "120", "90", "100");

        List<DrawdownPeriod> periods = analyzer.analyzeDrawdownPeriods(points);

        assertThat(periods).hasSize(1);
        DrawdownPeriod period = periods.get(0);
        assertThat(period.getStartDate()).isEqualTo(START.plusDays(1));
        assertThat(period.getEndDate()).isEqualTo(START.plusDays(3));
        assertThat(period.isRecovered()).isFalse();
        assertThat(period.getRecoveryDate()).isNull();
        assertThat(period.getPeakValue()).isEqualByComparingTo("120");
        assertThat(period.getTroughValue()).isEqualByComparingTo("90");
        assertThat(period.getDrawdownPercentage()).isEqualByComparingTo("0.25");
        assertThat(period.getDuration()).isEqualTo(3);
        assertThat(analyzer.calculateMaxDrawdown(points)).isEqualByComparingTo("0.25");
    }

    @Test
    void separateDrawdownsAreReportedInOrder() {
        List<PerformancePoint> points = EngineFixtures.pointsFromValues(
            START, "100", "95", "101", "101", "80", "90", "110");

        List<DrawdownPeriod> periods = analyzer.analyzeDrawdownPeriods(points);

        assertThat(periods).hasSize(2);
        assertThat(periods.get(0).getStartDate()).isEqualTo(START);
        assertThat(periods.get(0).getRecoveryDate()).isEqualTo(START.plusDays(2));
        assertThat(periods.get(0).getDrawdownPercentage()).isEqualByComparingTo("0.05");
        assertThat(periods.get(1).getStartDate()).isEqualTo(START.plusDays(2));
        assertThat(periods.get(1).getTroughValue()).isEqualByComparingTo("80");
        assertThat(periods.get(1).getDuration()).isEqualTo(4);
        assertThat(periods).allSatisfy(period -> assertThat(period.isRecovered()).isTrue());
    }

    @Test
    void flatOrRisingSeriesHasNoDrawdown() {
        assertThat(analyzer.analyzeDrawdownPeriods(EngineFixtures.pointsFromValues(START, "100", "100", "105"))).isEmpty();
        assertThat(analyzer.calculateMaxDrawdown(EngineFixtures.pointsFromValues(START, "100", "100", "105")))
            .isEqualByComparingTo("0");
        assertThat(analyzer.calculateMaxDrawdown(List.of())).isEqualByComparingTo("0");
    }
}
