package com.eurofolio.engine.adapter.out.api;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EodhdApiClientTest {

    private static final String BODY = """
        [
          {"date":"2024-01-02","open":100.1,"high":101.0,"low":99.5,"close":100.8,"adjusted_close":100.8,"volume":12500,"warning":"x"},
          {"date":"2024-01-03","open":100.8,"high":102.2,"low":100.2,"close":101.9,"adjusted_close":101.9,"volume":9800}
        ]
        """;

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void fetchesDailyPricesWithQueryParameters() {
        DailyApiQuota quota = new DailyApiQuota(5, Clock.systemUTC());
        EodhdApiClient client = new EodhdApiClient(stubWebClient(HttpStatus.OK, BODY), quota, "secret");

        List<EodhdApiClient.EodhdDailyPriceDto> prices =
            client.fetchDailyPrices("VWCE.XETRA", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        assertThat(prices).hasSize(2);
        assertThat(prices.get(0).getDate()).isEqualTo("2024-01-02");
        assertThat(prices.get(0).getClose()).isEqualByComparingTo("100.8");
        assertThat(prices.get(1).getAdjustedClose()).isEqualByComparingTo("101.9");
        assertThat(prices.get(1).getVolume()).isEqualTo(9800L);

        String url = lastRequest.get().url().toString();
        assertThat(url).startsWith("https://eodhd.test/api/eod/VWCE.XETRA?")
            .contains("from=2024-01-01", "to=2024-01-31", "period=d", "fmt=json", "api_token=secret");
        assertThat(quota.getUsedCalls()).isEqualTo(1);
    }

    @Test
    void exhaustedQuotaPreventsRequest() {
        DailyApiQuota quota = new DailyApiQuota(0, Clock.systemUTC());
        EodhdApiClient client = new EodhdApiClient(stubWebClient(HttpStatus.OK, BODY), quota, "secret");

        assertThatThrownBy(() -> client.fetchDailyPrices("VWCE.XETRA", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)))
            .isInstanceOf(ApiQuotaExceededException.class);
        assertThat(lastRequest.get()).isNull();
    }

    @Test
    void errorStatusIsPropagated() {
        EodhdApiClient client = new EodhdApiClient(
            stubWebClient(HttpStatus.UNAUTHORIZED, "{\"error\":\"invalid token\"}"),
            new DailyApiQuota(5, Clock.systemUTC()), "bad");

        assertThatThrownBy(() -> client.fetchDailyPrices("VWCE.XETRA", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)))
            .isInstanceOf(WebClientResponseException.Unauthorized.class);
    }

    private WebClient stubWebClient(HttpStatus status, String body) {
        return WebClient.builder()
            .baseUrl("https://eodhd.test/api")
            .exchangeFunction(request -> {
                lastRequest.set(request);
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
    }
}
