package com.eurofolio.engine.application.backtest.engine;

import com.eurofolio.engine.application.backtest.engine.dto.Allocation;
import com.eurofolio.engine.application.backtest.engine.dto.BacktestParameters;
import com.eurofolio.engine.application.backtest.engine.dto.BacktestResult;
import com.eurofolio.engine.application.backtest.engine.dto.DrawdownPeriod;
import com.eurofolio.engine.application.backtest.engine.dto.MonthlyReturn;
import com.eurofolio.engine.application.backtest.engine.dto.PerformanceMetrics;
import com.eurofolio.engine.application.backtest.engine.dto.PerformancePoint;
import com.eurofolio.engine.application.backtest.engine.dto.PriceSeries;
import com.eurofolio.engine.application.backtest.engine.dto.RebalanceFrequency;
import com.eurofolio.engine.application.backtest.engine.dto.RiskGrade;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BacktestEngineTest {

    private final BacktestEngine engine = EngineFixtures.newEngine();

    @Test
    void flatPricesKeepPortfolioValueUnchanged() {
        // Given: 60/40, 2년간 두 자산 모두 100으로 고정
        LocalDate start = LocalDate.of(2022, 1, 1);
        LocalDate end = LocalDate.of(2023, 12, 31);
        Map<String, PriceSeries> prices = Map.of(
            "A", EngineFixtures.flatSeries(start, 730, "100"),
            "B", EngineFixtures.flatSeries(start, 730, "100"));

        // When
        BacktestResult result = engine.runBacktest(
            List.of(Allocation.of("A", "60"), Allocation.of("B", "40")),
            prices,
            params(start, end, "10000", RebalanceFrequency.NEVER));

        // Then
        assertThat(result.getPerformanceData()).hasSize(730);
        assertThat(result.getPerformanceData())
            .allSatisfy(point -> assertThat(point.getValue()).isEqualByComparingTo("10000"));
        assertThat(result.getMetrics().getTotalReturn()).isEqualByComparingTo("0");
        assertThat(result.getFinalValue()).isEqualByComparingTo("10000");
    }

    @Test
    void singleAssetPathProducesExpectedValuesAndDrawdown() {
        // Given: 100 → 110 → 90 → 120
        LocalDate start = LocalDate.of(2024, 3, 1);
        Map<String, PriceSeries> prices = Map.of("A", EngineFixtures.dailySeries(start, "100", "110", "90", "120"));

        // When
        BacktestResult result = engine.runBacktest(
            List.of(Allocation.of("A", "100")),
            prices,
            params(start, start.plusDays(3), "1000", RebalanceFrequency.NEVER));

        // Then
        assertThat(result.getPerformanceData()).extracting(PerformancePoint::getValue)
            .usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("1000"), new BigDecimal("1100"), new BigDecimal("900"), new BigDecimal("1200"));

        PerformanceMetrics metrics = result.getMetrics();
        assertThat(metrics.getMaxDrawdown().doubleValue()).isCloseTo(200.0 / 1100.0, within(1e-8));
        assertThat(metrics.getTotalReturn()).isEqualByComparingTo("0.2");

        assertThat(metrics.getDrawdownPeriods()).hasSize(1);
        DrawdownPeriod period = metrics.getDrawdownPeriods().get(0);
        assertThat(period.getStartDate()).isEqualTo(start.plusDays(1));
        assertThat(period.getEndDate()).isEqualTo(start.plusDays(3));
        assertThat(period.isRecovered()).isTrue();
        assertThat(period.getRecoveryDate()).isEqualTo(start.plusDays(3));
        assertThat(period.getTroughValue()).isEqualByComparingTo("900");
        assertThat(period.getDuration()).isEqualTo(2);
    }

    @Test
    void missingTrailingPricesCarryLastKnownClose() {
        // Given: 1월 31일까지 요청, 시세는 1월 21일까지만 존재
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 1, 31);
        Map<String, PriceSeries> prices = Map.of(
            "A", EngineFixtures.dailySeries(start, 21, i -> BigDecimal.valueOf(100 + i)));

        // When
        BacktestResult result = engine.runBacktest(
            List.of(Allocation.of("A", "100")),
            prices,
            params(start, end, "1000", RebalanceFrequency.MONTHLY));

        // Then: 마지막 10일도 직전 종가(120)로 평가
        List<PerformancePoint> points = result.getPerformanceData();
        assertThat(points).hasSize(31);
        assertThat(points.get(points.size() - 1).getDate()).isEqualTo(end);
        assertThat(points.subList(20, 31))
            .allSatisfy(point -> assertThat(point.getValue()).isEqualByComparingTo("1200"));
        assertThat(points.subList(21, 31))
            .allSatisfy(point -> assertThat(point.getDailyReturn()).isEqualByComparingTo("0"));
    }

    @Test
    void constantPriceGivesNeutralMetrics() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        BacktestResult result = engine.runBacktest(
            List.of(Allocation.of("A", "100")),
            Map.of("A", EngineFixtures.flatSeries(start, 120, "42.5")),
            params(start, start.plusDays(119), "5000", RebalanceFrequency.QUARTERLY));

        PerformanceMetrics metrics = result.getMetrics();
        assertThat(metrics.getTotalReturn()).isEqualByComparingTo("0");
        assertThat(metrics.getVolatility()).isEqualByComparingTo("0");
        assertThat(metrics.getMaxDrawdown()).isEqualByComparingTo("0");
        assertThat(metrics.getSharpeRatio()).isEqualByComparingTo("0");
        assertThat(metrics.getSortinoRatio()).isEqualByComparingTo("0");
        assertThat(metrics.getCalmarRatio()).isEqualByComparingTo("0");
        assertThat(metrics.getGainToLossRatio()).isZero();
        assertThat(metrics.getRiskGrade()).isEqualTo(RiskGrade.C);
    }

    @Test
    void risingPriceHasNoDrawdownAndOnlyPositivePeriods() {
        // Given: 2년간 매일 0.5씩 상승
        LocalDate start = LocalDate.of(2023, 1, 1);
        LocalDate end = LocalDate.of(2024, 12, 31);
        int days = 731;
        Map<String, PriceSeries> prices = Map.of(
            "A", EngineFixtures.dailySeries(start, days, i -> new BigDecimal("100").add(new BigDecimal("0.5").multiply(BigDecimal.valueOf(i)))));

        // When
        BacktestResult result = engine.runBacktest(
            List.of(Allocation.of("A", "100")),
            prices,
            params(start, end, "10000", RebalanceFrequency.ANNUALLY));

        // Then
        PerformanceMetrics metrics = result.getMetrics();
        assertThat(metrics.getMaxDrawdown()).isEqualByComparingTo("0");
        assertThat(metrics.getDrawdownPeriods()).isEmpty();

        List<MonthlyReturn> months = metrics.getMonthlyReturns();
        assertThat(months).hasSize(24);
        assertThat(months.subList(1, months.size()))
            .allSatisfy(month -> assertThat(month.getReturnRate()).isPositive());
        assertThat(metrics.getPositiveMonths()).isEqualTo(23);
        assertThat(metrics.getNegativeMonths()).isZero();
        assertThat(metrics.getWinRate()).isEqualByComparingTo("1");

        assertThat(metrics.getYearlyReturns()).isNotEmpty()
            .allSatisfy(year -> assertThat(year.getReturnRate()).isPositive());
        assertThat(metrics.getGainToLossRatio()).isInfinite();
        assertThat(metrics.getUptimePercentage()).isEqualByComparingTo("1");
    }

    @Test
    void resultEchoesParameters() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        BacktestParameters params = BacktestParameters.builder()
            .portfolioId(7L)
            .startDate(start)
            .endDate(start.plusDays(9))
            .initialInvestment(new BigDecimal("2500"))
            .rebalanceFrequency(RebalanceFrequency.MONTHLY)
            .build();

        BacktestResult result = engine.runBacktest(
            List.of(Allocation.of("A", "100")),
            Map.of("A", EngineFixtures.flatSeries(start, 10, "10")),
            params);

        assertThat(result.getPortfolioId()).isEqualTo(7L);
        assertThat(result.getStartDate()).isEqualTo(start);
        assertThat(result.getEndDate()).isEqualTo(start.plusDays(9));
        assertThat(result.getInitialInvestment()).isEqualByComparingTo("2500");
        assertThat(result.getRebalanceFrequency()).isEqualTo(RebalanceFrequency.MONTHLY);
        assertThat(result.getTotalDays()).isEqualTo(10);
    }

    @Test
    void invalidInputFailsBeforeSimulation() {
        LocalDate start = LocalDate.of(2024, 1, 1);

        assertThatThrownBy(() -> engine.runBacktest(
            List.of(Allocation.of("A", "50")),
            Map.of("A", EngineFixtures.flatSeries(start, 10, "10")),
            params(start, start.plusDays(9), "1000", RebalanceFrequency.NEVER)))
            .isInstanceOf(BacktestValidationException.class);

        assertThatThrownBy(() -> engine.runBacktest(
            List.of(Allocation.of("A", "100")),
            Map.of(),
            params(start, start.plusDays(9), "1000", RebalanceFrequency.NEVER)))
            .isInstanceOf(MissingPriceDataException.class)
            .hasMessageContaining("A");
    }

    private BacktestParameters params(LocalDate start, LocalDate end, String investment, RebalanceFrequency frequency) {
        return BacktestParameters.builder()
            .portfolioId(1L)
            .startDate(start)
            .endDate(end)
            .initialInvestment(new BigDecimal(investment))
            .rebalanceFrequency(frequency)
            .build();
    }
}
