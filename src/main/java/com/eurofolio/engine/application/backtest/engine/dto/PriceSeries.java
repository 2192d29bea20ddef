package com.eurofolio.engine.application.backtest.engine.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 자산 1개의 일별 종가 시계열 (읽기 전용)
 * - 날짜가 연속일 필요는 없음 (주말/휴일 누락 허용)
 * - 같은 날짜가 중복되면 먼저 들어온 종가를 사용
 */
public final class PriceSeries {

    private final NavigableMap<LocalDate, BigDecimal> closes;

    private PriceSeries(NavigableMap<LocalDate, BigDecimal> closes) {
        this.closes = Collections.unmodifiableNavigableMap(closes);
    }

    public static PriceSeries of(List<PricePoint> points) {
        TreeMap<LocalDate, BigDecimal> closes = new TreeMap<>();
        if (points != null) {
            for (PricePoint point : points) {
                if (point == null || point.getDate() == null || point.getClosePrice() == null) {
                    continue;
                }
                closes.putIfAbsent(point.getDate(), point.getClosePrice());
            }
        }
        return new PriceSeries(closes);
    }

    public static PriceSeries empty() {
        return new PriceSeries(new TreeMap<>());
    }

    /**
     * 특정 날짜의 가격 조회
     * 1. 같은 날짜의 종가
     * 2. 없으면 가장 최근의 과거 종가 (휴일/결측 구간은 직전 종가 유지)
     * 3. 과거 데이터가 전혀 없으면 가장 가까운 미래 종가
     */
    public Optional<BigDecimal> resolve(LocalDate date) {
        Map.Entry<LocalDate, BigDecimal> previous = closes.floorEntry(date);
        if (previous != null) {
            return Optional.of(previous.getValue());
        }
        Map.Entry<LocalDate, BigDecimal> next = closes.ceilingEntry(date);
        return next != null ? Optional.of(next.getValue()) : Optional.empty();
    }

    public boolean isEmpty() {
        return closes.isEmpty();
    }

    public int size() {
        return closes.size();
    }

    public Optional<LocalDate> firstDate() {
        return closes.isEmpty() ? Optional.empty() : Optional.of(closes.firstKey());
    }

    public Optional<LocalDate> lastDate() {
        return closes.isEmpty() ? Optional.empty() : Optional.of(closes.lastKey());
    }
}
