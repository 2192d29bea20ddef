package com.eurofolio.engine.application.backtest.engine;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * 시뮬레이션 중 보유 수량 변화를 관찰하기 위한 콜백
 * - 전달되는 Map은 읽기 전용 복사본
 */
public interface SimulationListener {

    SimulationListener NONE = new SimulationListener() {
    };

    default void onInitialPurchase(LocalDate date, Map<String, BigDecimal> shares) {
    }

    default void onRebalance(LocalDate date, long daysSinceStart, Map<String, BigDecimal> shares) {
    }
}
