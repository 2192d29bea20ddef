package com.eurofolio.engine.adapter.out.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * EODHD 일봉 시세 API 클라이언트
 * 호출마다 {@link DailyApiQuota}에서 1회를 차감한다.
 */
@Slf4j
@Component
public class EodhdApiClient {

    private final WebClient webClient;
    private final DailyApiQuota quota;
    private final String apiToken;

    public EodhdApiClient(WebClient eodhdWebClient,
                          DailyApiQuota quota,
                          @Value("${eodhd.api.token:demo}") String apiToken) {
        this.webClient = eodhdWebClient;
        this.quota = quota;
        this.apiToken = apiToken;
    }

    /**
     * 기간 내 일봉 조회
     * @param ticker 심볼.거래소 (예: "VWCE.XETRA")
     * @return 날짜 오름차순 일봉 목록 (데이터가 없으면 빈 목록)
     * @throws ApiQuotaExceededException 일일 호출 한도 초과
     */
    public List<EodhdDailyPriceDto> fetchDailyPrices(String ticker, LocalDate from, LocalDate to) {
        quota.acquire();

        log.info("EODHD 일봉 조회: ticker={}, {} ~ {}", ticker, from, to);

        List<EodhdDailyPriceDto> prices = webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/eod/{ticker}")
                .queryParam("from", from)
                .queryParam("to", to)
                .queryParam("period", "d")
                .queryParam("fmt", "json")
                .queryParam("api_token", apiToken)
                .build(ticker))
            .retrieve()
            .bodyToFlux(EodhdDailyPriceDto.class)
            .doOnError(error -> log.error("EODHD 조회 실패: ticker={}, {}", ticker, error.getMessage()))
            .collectList()
            .block();

        if (prices == null) {
            return List.of();
        }
        log.info("EODHD 일봉 수신: ticker={}, {}건 (남은 호출 {}회)", ticker, prices.size(), quota.getRemainingCalls());
        return prices;
    }

    @Getter
    @ToString
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EodhdDailyPriceDto {
        @JsonProperty("date")
        private String date; // yyyy-MM-dd
        @JsonProperty("open")
        private BigDecimal open;
        @JsonProperty("high")
        private BigDecimal high;
        @JsonProperty("low")
        private BigDecimal low;
        @JsonProperty("close")
        private BigDecimal close;
        @JsonProperty("adjusted_close")
        private BigDecimal adjustedClose; // 분할/배당 조정 종가
        @JsonProperty("volume")
        private Long volume;
    }
}
