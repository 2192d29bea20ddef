package com.eurofolio.engine.application.backtest.engine.dto;

/**
 * 리밸런싱 주기
 *
 * 달력 기준(월초/분기초)이 아니라 시작일로부터 경과 일수의 고정 나머지 연산으로 판정한다.
 * MONTHLY = 30일, QUARTERLY = 90일, ANNUALLY = 365일마다.
 */
public enum RebalanceFrequency {

    NEVER(0),
    MONTHLY(30),
    QUARTERLY(90),
    ANNUALLY(365);

    private final int intervalDays;

    RebalanceFrequency(int intervalDays) {
        this.intervalDays = intervalDays;
    }

    public int getIntervalDays() {
        return intervalDays;
    }

    /**
     * 시작일로부터 daysSinceStart일째 되는 날이 리밸런싱 대상인지 여부
     * (첫날(0일차) 제외 여부는 호출 측에서 판단)
     */
    public boolean isDue(long daysSinceStart) {
        if (this == NEVER) {
            return false;
        }
        return daysSinceStart % intervalDays == 0;
    }
}
