package com.eurofolio.engine.application.backtest.engine;

import com.eurofolio.engine.application.backtest.engine.dto.DrawdownPeriod;
import com.eurofolio.engine.application.backtest.engine.dto.MonthHighlight;
import com.eurofolio.engine.application.backtest.engine.dto.MonthlyReturn;
import com.eurofolio.engine.application.backtest.engine.dto.PerformanceMetrics;
import com.eurofolio.engine.application.backtest.engine.dto.PerformancePoint;
import com.eurofolio.engine.application.backtest.engine.dto.RiskGrade;
import com.eurofolio.engine.application.backtest.engine.dto.YearlyReturn;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 일별 평가 시계열 → 성과 지표 집계
 *
 * 모든 지표는 시계열만으로 계산되는 순수 함수이며, 빈 시계열이나 변동성 0 같은
 * 경계 상황에서는 예외 대신 0(손익비만 Infinity)을 반환한다.
 */
@Component
@RequiredArgsConstructor
public class PerformanceMetricsCalculator {

    static final BigDecimal RISK_FREE_RATE = new BigDecimal("0.02"); // 연 2%
    static final int TRADING_DAYS_PER_YEAR = 252; // 변동성 연환산 계수
    static final int DAYS_PER_YEAR = 365; // 수익률 연환산 기준 (달력일)

    private static final int SCALE = 8;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final DrawdownAnalyzer drawdownAnalyzer;
    private final PeriodReturnCalculator periodReturnCalculator;

    public PerformanceMetrics aggregate(List<PerformancePoint> performanceData, BigDecimal initialInvestment) {
        List<BigDecimal> dailyReturns = performanceData.stream()
            .skip(1)
            .map(point -> point.getDailyReturn() != null ? point.getDailyReturn() : BigDecimal.ZERO)
            .collect(Collectors.toList());

        // 1. 수익률
        BigDecimal finalValue = performanceData.isEmpty()
            ? initialInvestment
            : performanceData.get(performanceData.size() - 1).getValue();
        BigDecimal totalReturn = finalValue.subtract(initialInvestment).divide(initialInvestment, SCALE, ROUNDING);
        BigDecimal annualizedReturn = calculateAnnualizedReturn(totalReturn, performanceData.size());

        // 2. 변동성 및 위험 조정 수익
        BigDecimal volatility = annualizedStdDev(dailyReturns);
        BigDecimal sharpeRatio = riskAdjusted(annualizedReturn, volatility);

        List<BigDecimal> negativeReturns = dailyReturns.stream()
            .filter(r -> r.signum() < 0)
            .collect(Collectors.toList());
        BigDecimal downsideDeviation = annualizedStdDev(negativeReturns);
        BigDecimal sortinoRatio = riskAdjusted(annualizedReturn, downsideDeviation);

        // 3. 낙폭
        BigDecimal maxDrawdown = drawdownAnalyzer.calculateMaxDrawdown(performanceData);
        List<DrawdownPeriod> drawdownPeriods = drawdownAnalyzer.analyzeDrawdownPeriods(performanceData);

        BigDecimal calmarRatio = maxDrawdown.signum() > 0
            ? annualizedReturn.divide(maxDrawdown, SCALE, ROUNDING).abs()
            : BigDecimal.ZERO;
        BigDecimal recoveryFactor = maxDrawdown.signum() > 0
            ? totalReturn.divide(maxDrawdown, SCALE, ROUNDING)
            : BigDecimal.ZERO;

        int maxDrawdownDuration = drawdownPeriods.stream().mapToInt(DrawdownPeriod::getDuration).max().orElse(0);
        BigDecimal averageDrawdownDuration = drawdownPeriods.isEmpty()
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(drawdownPeriods.stream().mapToInt(DrawdownPeriod::getDuration).sum())
                .divide(BigDecimal.valueOf(drawdownPeriods.size()), SCALE, ROUNDING);

        // 4. 월/연 단위 (첫 달은 비교 대상이 없으므로 통계에서 제외)
        List<MonthlyReturn> monthlyReturns = periodReturnCalculator.generateMonthlyReturns(performanceData);
        List<BigDecimal> monthOverMonth = monthlyReturns.stream()
            .skip(1)
            .map(MonthlyReturn::getReturnRate)
            .collect(Collectors.toList());
        List<YearlyReturn> yearlyReturns = periodReturnCalculator.calculateYearlyReturns(performanceData);

        int positiveMonths = (int) monthOverMonth.stream().filter(r -> r.signum() > 0).count();
        int negativeMonths = (int) monthOverMonth.stream().filter(r -> r.signum() < 0).count();
        BigDecimal winRate = ratio(positiveMonths, monthOverMonth.size());

        // 5. 일 단위
        long positiveDays = dailyReturns.stream().filter(r -> r.signum() > 0).count();
        BigDecimal uptimePercentage = ratio(positiveDays, dailyReturns.size());

        return PerformanceMetrics.builder()
            .totalReturn(totalReturn)
            .annualizedReturn(annualizedReturn)
            .volatility(volatility)
            .downsideDeviation(downsideDeviation)
            .maxDrawdown(maxDrawdown)
            .sharpeRatio(sharpeRatio)
            .sortinoRatio(sortinoRatio)
            .calmarRatio(calmarRatio)
            .recoveryFactor(recoveryFactor)
            .riskGrade(RiskGrade.fromSharpe(sharpeRatio))
            .drawdownPeriods(drawdownPeriods)
            .averageDrawdownDuration(averageDrawdownDuration)
            .maxDrawdownDuration(maxDrawdownDuration)
            .monthlyReturns(monthlyReturns)
            .yearlyReturns(yearlyReturns)
            .positiveMonths(positiveMonths)
            .negativeMonths(negativeMonths)
            .winRate(winRate)
            .bestMonth(highlight(performanceData, monthOverMonth, Comparator.naturalOrder()))
            .worstMonth(highlight(performanceData, monthOverMonth, Comparator.reverseOrder()))
            .bestYear(yearlyReturns.stream().map(YearlyReturn::getReturnRate).max(Comparator.naturalOrder()).orElse(null))
            .worstYear(yearlyReturns.stream().map(YearlyReturn::getReturnRate).min(Comparator.naturalOrder()).orElse(null))
            .gainToLossRatio(calculateGainToLossRatio(dailyReturns))
            .uptimePercentage(uptimePercentage)
            .build();
    }

    /**
     * 연환산 수익률 = (1 + 총수익률)^(365 / 일수) - 1
     */
    private BigDecimal calculateAnnualizedReturn(BigDecimal totalReturn, int totalDays) {
        if (totalDays <= 0) {
            return BigDecimal.ZERO;
        }
        double annualized = Math.pow(1 + totalReturn.doubleValue(), (double) DAYS_PER_YEAR / totalDays) - 1;
        if (!Double.isFinite(annualized)) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(annualized).setScale(SCALE, ROUNDING);
    }

    /**
     * 모표준편차 × √252
     */
    private BigDecimal annualizedStdDev(List<BigDecimal> returns) {
        if (returns.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal count = BigDecimal.valueOf(returns.size());
        BigDecimal mean = returns.stream()
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .divide(count, 16, ROUNDING);

        // 분산 = Σ(수익률 - 평균)² / N
        BigDecimal variance = returns.stream()
            .map(r -> {
                BigDecimal diff = r.subtract(mean);
                return diff.multiply(diff);
            })
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .divide(count, 16, ROUNDING);

        double stdDev = Math.sqrt(variance.doubleValue()) * Math.sqrt(TRADING_DAYS_PER_YEAR);
        return BigDecimal.valueOf(stdDev).setScale(SCALE, ROUNDING);
    }

    /**
     * (연환산 수익률 - 무위험 수익률) / 위험, 위험이 0이면 0
     */
    private BigDecimal riskAdjusted(BigDecimal annualizedReturn, BigDecimal risk) {
        if (risk.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return annualizedReturn.subtract(RISK_FREE_RATE).divide(risk, SCALE, ROUNDING);
    }

    /**
     * 평균 수익일 수익률 / 평균 손실일 수익률의 절댓값
     */
    private double calculateGainToLossRatio(List<BigDecimal> dailyReturns) {
        List<BigDecimal> gains = new ArrayList<>();
        List<BigDecimal> losses = new ArrayList<>();
        for (BigDecimal r : dailyReturns) {
            if (r.signum() > 0) {
                gains.add(r);
            } else if (r.signum() < 0) {
                losses.add(r);
            }
        }

        if (losses.isEmpty()) {
            return gains.isEmpty() ? 0 : Double.POSITIVE_INFINITY;
        }
        if (gains.isEmpty()) {
            return 0;
        }

        double averageGain = gains.stream().mapToDouble(BigDecimal::doubleValue).average().orElse(0);
        double averageLoss = Math.abs(losses.stream().mapToDouble(BigDecimal::doubleValue).average().orElse(0));
        return averageGain / averageLoss;
    }

    /**
     * 최고(또는 최저) 월 수익률
     * 날짜는 실제 월이 아니라 월 순위에 비례한 시계열 인덱스로 근사한다.
     */
    private MonthHighlight highlight(List<PerformancePoint> performanceData,
                                     List<BigDecimal> monthOverMonth,
                                     Comparator<BigDecimal> order) {
        if (monthOverMonth.isEmpty()) {
            return MonthHighlight.none();
        }

        int selectedIndex = 0;
        for (int i = 1; i < monthOverMonth.size(); i++) {
            if (order.compare(monthOverMonth.get(i), monthOverMonth.get(selectedIndex)) > 0) {
                selectedIndex = i;
            }
        }

        int pointIndex = (int) ((long) performanceData.size() * (selectedIndex + 1) / monthOverMonth.size());
        return new MonthHighlight(
            pointIndex < performanceData.size() ? performanceData.get(pointIndex).getDate() : null,
            monthOverMonth.get(selectedIndex));
    }

    private BigDecimal ratio(long part, long whole) {
        if (whole == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(part).divide(BigDecimal.valueOf(whole), SCALE, ROUNDING);
    }
}
