package com.eurofolio.engine.application.backtest.engine;

import com.eurofolio.engine.application.backtest.engine.dto.DrawdownPeriod;
import com.eurofolio.engine.application.backtest.engine.dto.PerformancePoint;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 최대 낙폭(MDD) 및 낙폭 구간 분석
 */
@Component
public class DrawdownAnalyzer {

    private static final int SCALE = 8;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    /**
     * 최대 낙폭 계산 (누적 고점 대비 하락 비율의 최댓값, 항상 0 이상)
     */
    public BigDecimal calculateMaxDrawdown(List<PerformancePoint> performanceData) {
        if (performanceData.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal peak = performanceData.get(0).getValue();
        BigDecimal maxDrawdown = BigDecimal.ZERO;

        for (PerformancePoint point : performanceData) {
            if (point.getValue().compareTo(peak) > 0) {
                peak = point.getValue();
            }
            if (peak.signum() <= 0) {
                continue;
            }

            BigDecimal drawdown = peak.subtract(point.getValue()).divide(peak, SCALE, ROUNDING);
            if (drawdown.compareTo(maxDrawdown) > 0) {
                maxDrawdown = drawdown;
            }
        }

        return maxDrawdown;
    }

    /**
     * 낙폭 구간 목록
     * - 고점 아래로 처음 내려간 시점에 구간 시작 (시작일 = 직전 고점 날짜)
     * - 고점을 넘어서는 새 고점이 나오면 회복으로 종료
     * - 시계열 끝까지 회복하지 못한 구간은 recovered=false로 포함
     */
    public List<DrawdownPeriod> analyzeDrawdownPeriods(List<PerformancePoint> performanceData) {
        List<DrawdownPeriod> periods = new ArrayList<>();
        if (performanceData.isEmpty()) {
            return periods;
        }

        BigDecimal currentPeak = performanceData.get(0).getValue();
        int peakIndex = 0;
        boolean inDrawdown = false;
        int drawdownStartIndex = 0;
        BigDecimal trough = currentPeak;

        for (int i = 1; i < performanceData.size(); i++) {
            PerformancePoint current = performanceData.get(i);

            if (current.getValue().compareTo(currentPeak) > 0) {
                // 새 고점 → 진행 중인 낙폭 구간 종료
                if (inDrawdown) {
                    periods.add(DrawdownPeriod.builder()
                        .startDate(performanceData.get(drawdownStartIndex).getDate())
                        .endDate(current.getDate())
                        .peakValue(currentPeak)
                        .troughValue(trough)
                        .drawdownPercentage(drawdownRatio(currentPeak, trough))
                        .duration(i - drawdownStartIndex)
                        .recovered(true)
                        .recoveryDate(current.getDate())
                        .build());
                    inDrawdown = false;
                }
                currentPeak = current.getValue();
                peakIndex = i;
            } else if (current.getValue().compareTo(currentPeak) < 0) {
                if (!inDrawdown) {
                    inDrawdown = true;
                    drawdownStartIndex = peakIndex;
                    trough = current.getValue();
                } else if (current.getValue().compareTo(trough) < 0) {
                    trough = current.getValue();
                }
            }
        }

        if (inDrawdown) {
            PerformancePoint last = performanceData.get(performanceData.size() - 1);
            periods.add(DrawdownPeriod.builder()
                .startDate(performanceData.get(drawdownStartIndex).getDate())
                .endDate(last.getDate())
                .peakValue(currentPeak)
                .troughValue(trough)
                .drawdownPercentage(drawdownRatio(currentPeak, trough))
                .duration(performanceData.size() - drawdownStartIndex)
                .recovered(false)
                .recoveryDate(null)
                .build());
        }

        return periods;
    }

    private BigDecimal drawdownRatio(BigDecimal peak, BigDecimal trough) {
        if (peak.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return peak.subtract(trough).divide(peak, SCALE, ROUNDING);
    }
}
