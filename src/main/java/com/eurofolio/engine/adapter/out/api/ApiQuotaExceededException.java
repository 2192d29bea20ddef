package com.eurofolio.engine.adapter.out.api;

/**
 * 외부 시세 API의 일일 호출 한도 초과
 */
public class ApiQuotaExceededException extends IllegalStateException {

    public ApiQuotaExceededException(int maxDailyCalls) {
        super("Daily API call limit reached (" + maxDailyCalls + " calls)");
    }
}
