package com.eurofolio.engine.adapter.out.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * 외부 시세 API 일일 호출 한도
 * - 날짜가 바뀌면 사용량을 0으로 초기화
 * - 여러 스레드(배치 백테스트)에서 동시에 호출되므로 모든 접근은 동기화
 */
@Slf4j
@Component
public class DailyApiQuota {

    private final int maxDailyCalls;
    private final Clock clock;

    private LocalDate quotaDate;
    private int usedCalls;

    public DailyApiQuota(@Value("${eodhd.api.max-daily-calls:20}") int maxDailyCalls, Clock clock) {
        if (maxDailyCalls < 0) {
            throw new IllegalArgumentException("maxDailyCalls must not be negative: " + maxDailyCalls);
        }
        this.maxDailyCalls = maxDailyCalls;
        this.clock = clock;
        this.quotaDate = LocalDate.now(clock);
    }

    /**
     * 호출 1회 차감, 한도 초과 시 false
     */
    public synchronized boolean tryAcquire() {
        resetIfNewDay();
        if (usedCalls >= maxDailyCalls) {
            return false;
        }
        usedCalls++;
        log.debug("API 호출 {}/{} ({})", usedCalls, maxDailyCalls, quotaDate);
        return true;
    }

    /**
     * 호출 1회 차감, 한도 초과 시 {@link ApiQuotaExceededException}
     */
    public void acquire() {
        if (!tryAcquire()) {
            log.warn("API 일일 호출 한도 초과: {}/{}", maxDailyCalls, maxDailyCalls);
            throw new ApiQuotaExceededException(maxDailyCalls);
        }
    }

    public synchronized int getUsedCalls() {
        resetIfNewDay();
        return usedCalls;
    }

    public synchronized int getRemainingCalls() {
        resetIfNewDay();
        return maxDailyCalls - usedCalls;
    }

    public synchronized LocalDate getQuotaDate() {
        resetIfNewDay();
        return quotaDate;
    }

    public int getMaxDailyCalls() {
        return maxDailyCalls;
    }

    private void resetIfNewDay() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(quotaDate)) {
            log.info("API 호출 한도 초기화: {} → {} (전일 사용 {}회)", quotaDate, today, usedCalls);
            quotaDate = today;
            usedCalls = 0;
        }
    }
}
