package com.eurofolio.engine.application.backtest.engine;

import com.eurofolio.engine.application.backtest.engine.dto.MonthlyReturn;
import com.eurofolio.engine.application.backtest.engine.dto.PerformancePoint;
import com.eurofolio.engine.application.backtest.engine.dto.YearlyReturn;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PeriodReturnCalculatorTest {

    private final PeriodReturnCalculator calculator = new PeriodReturnCalculator();

    @Test
    void monthlyReturnsCompareMonthEndValues() {
        // Given: 12/30 ~ 2/2, 월말 평가액 100(12월) → 120(1월) → 90(2월)
        List<PerformancePoint> points = new ArrayList<>(EngineFixtures.pointsFromValues(
            LocalDate.of(2023, 12, 30), "95", "100"));
        points.addAll(EngineFixtures.pointsFromValues(LocalDate.of(2024, 1, 1), "110", "120"));
        points.add(point(LocalDate.of(2024, 2, 1), "80"));
        points.add(point(LocalDate.of(2024, 2, 2), "90"));

        // When
        List<MonthlyReturn> months = calculator.generateMonthlyReturns(points);

        // Then
        assertThat(months).extracting(MonthlyReturn::getMonthName).containsExactly("Dec", "Jan", "Feb");
        assertThat(months.get(0).getReturnRate()).isEqualByComparingTo("0");
        assertThat(months.get(1).getReturnRate()).isEqualByComparingTo("0.2");
        assertThat(months.get(2).getReturnRate()).isEqualByComparingTo("-0.25");
        assertThat(months.get(1).getYear()).isEqualTo(2024);
        assertThat(months.get(1).getMonth()).isEqualTo(1);
        assertThat(months.get(1).getValue()).isEqualByComparingTo("120");
        assertThat(months.get(1).getDaysInMonth()).isEqualTo(2);
    }

    @Test
    void yearlyReturnsStartFromSecondYear() {
        List<PerformancePoint> points = List.of(
            point(LocalDate.of(2022, 6, 1), "100"),
            point(LocalDate.of(2022, 12, 31), "125"),
            point(LocalDate.of(2023, 12, 31), "150"),
            point(LocalDate.of(2024, 3, 1), "120"));

        List<YearlyReturn> years = calculator.calculateYearlyReturns(points);

        assertThat(years).extracting(YearlyReturn::getYear).containsExactly(2023, 2024);
        assertThat(years.get(0).getReturnRate()).isEqualByComparingTo("0.2");
        assertThat(years.get(1).getReturnRate()).isEqualByComparingTo("-0.2");
    }

    @Test
    void singleYearHasNoYearlyReturn() {
        assertThat(calculator.calculateYearlyReturns(
            EngineFixtures.pointsFromValues(LocalDate.of(2024, 1, 1), "100", "110"))).isEmpty();
    }

    private PerformancePoint point(LocalDate date, String value) {
        return PerformancePoint.builder()
            .date(date)
            .value(new BigDecimal(value))
            .dailyReturn(BigDecimal.ZERO)
            .cumulativeReturn(BigDecimal.ZERO)
            .build();
    }
}
