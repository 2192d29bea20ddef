package com.eurofolio.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class WebClientConfig {

    /**
     * EODHD 시세 API 전용 WebClient (일봉 응답이 수년치일 수 있어 버퍼를 늘림)
     */
    @Bean
    public WebClient eodhdWebClient(WebClient.Builder builder,
                                    @Value("${eodhd.api.base-url}") String baseUrl) {
        return builder
            .baseUrl(baseUrl)
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
            .build();
    }

    /**
     * API 일일 호출 한도 계산용 시계
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
