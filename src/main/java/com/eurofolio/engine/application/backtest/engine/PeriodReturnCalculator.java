package com.eurofolio.engine.application.backtest.engine;

import com.eurofolio.engine.application.backtest.engine.dto.MonthlyReturn;
import com.eurofolio.engine.application.backtest.engine.dto.PerformancePoint;
import com.eurofolio.engine.application.backtest.engine.dto.YearlyReturn;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 월별/연도별 수익률 계산
 * - 각 기간의 수익률 = (해당 기간 마지막 평가액 - 직전 기간 마지막 평가액) / 직전 기간 마지막 평가액
 */
@Component
public class PeriodReturnCalculator {

    private static final int SCALE = 8;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    /**
     * 시계열에 포함된 모든 달의 수익률 (첫 달은 직전 달이 없으므로 0)
     */
    public List<MonthlyReturn> generateMonthlyReturns(List<PerformancePoint> performanceData) {
        Map<YearMonth, List<PerformancePoint>> monthlyData = new TreeMap<>();
        for (PerformancePoint point : performanceData) {
            monthlyData.computeIfAbsent(YearMonth.from(point.getDate()), key -> new ArrayList<>()).add(point);
        }

        List<MonthlyReturn> monthlyReturns = new ArrayList<>();
        BigDecimal previousValue = null;

        for (Map.Entry<YearMonth, List<PerformancePoint>> entry : monthlyData.entrySet()) {
            YearMonth month = entry.getKey();
            List<PerformancePoint> points = entry.getValue();
            BigDecimal lastValue = points.get(points.size() - 1).getValue();

            monthlyReturns.add(MonthlyReturn.builder()
                .year(month.getYear())
                .month(month.getMonthValue())
                .monthName(month.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
                .returnRate(periodReturn(previousValue, lastValue))
                .value(lastValue)
                .daysInMonth(points.size())
                .build());

            previousValue = lastValue;
        }

        return monthlyReturns;
    }

    /**
     * 연도별 수익률 (직전 연도가 있는 두 번째 연도부터)
     */
    public List<YearlyReturn> calculateYearlyReturns(List<PerformancePoint> performanceData) {
        Map<Integer, BigDecimal> lastValueByYear = new TreeMap<>();
        for (PerformancePoint point : performanceData) {
            lastValueByYear.put(point.getDate().getYear(), point.getValue());
        }

        List<YearlyReturn> yearlyReturns = new ArrayList<>();
        BigDecimal previousValue = null;

        for (Map.Entry<Integer, BigDecimal> entry : lastValueByYear.entrySet()) {
            if (previousValue != null) {
                yearlyReturns.add(new YearlyReturn(entry.getKey(), periodReturn(previousValue, entry.getValue())));
            }
            previousValue = entry.getValue();
        }

        return yearlyReturns;
    }

    private BigDecimal periodReturn(BigDecimal previousValue, BigDecimal currentValue) {
        if (previousValue == null || previousValue.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return currentValue.subtract(previousValue).divide(previousValue, SCALE, ROUNDING);
    }
}
