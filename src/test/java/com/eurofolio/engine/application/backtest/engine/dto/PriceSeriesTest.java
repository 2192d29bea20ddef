package com.eurofolio.engine.application.backtest.engine.dto;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PriceSeriesTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 8);

    private final PriceSeries series = PriceSeries.of(List.of(
        PricePoint.of(MONDAY, "10.00"),
        PricePoint.of(MONDAY.plusDays(1), "10.50"),
        PricePoint.of(MONDAY.plusDays(4), "11.25")));

    @Test
    void exactDateWins() {
        assertThat(series.resolve(MONDAY.plusDays(1))).hasValueSatisfying(
            price -> assertThat(price).isEqualByComparingTo("10.50"));
    }

    @Test
    void gapUsesLatestEarlierClose() {
        assertThat(series.resolve(MONDAY.plusDays(3))).hasValueSatisfying(
            price -> assertThat(price).isEqualByComparingTo("10.50"));
        assertThat(series.resolve(MONDAY.plusDays(30))).hasValueSatisfying(
            price -> assertThat(price).isEqualByComparingTo("11.25"));
    }

    @Test
    void dateBeforeSeriesUsesNearestLaterClose() {
        assertThat(series.resolve(MONDAY.minusDays(5))).hasValueSatisfying(
            price -> assertThat(price).isEqualByComparingTo("10.00"));
    }

    @Test
    void emptySeriesResolvesNothing() {
        assertThat(PriceSeries.empty().resolve(MONDAY)).isEmpty();
        assertThat(PriceSeries.empty().isEmpty()).isTrue();
        assertThat(PriceSeries.of(null).isEmpty()).isTrue();
    }

    @Test
    void duplicateDatesKeepFirstCloseAndNullsAreIgnored() {
        PriceSeries withDuplicates = PriceSeries.of(Arrays.asList(
            PricePoint.of(MONDAY, "1"),
            null,
            PricePoint.of(MONDAY, "2")));

        assertThat(withDuplicates.size()).isEqualTo(1);
        assertThat(withDuplicates.resolve(MONDAY)).hasValueSatisfying(
            price -> assertThat(price).isEqualByComparingTo("1"));
        assertThat(series.firstDate()).contains(MONDAY);
        assertThat(series.lastDate()).contains(MONDAY.plusDays(4));
    }
}
