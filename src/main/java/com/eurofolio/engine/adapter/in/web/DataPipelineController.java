package com.eurofolio.engine.adapter.in.web;

import com.eurofolio.engine.adapter.out.api.ApiQuotaExceededException;
import com.eurofolio.engine.adapter.out.api.DailyApiQuota;
import com.eurofolio.engine.application.PriceDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.LocalDate;

@Slf4j
@RestController
@RequestMapping("/api/data")
@RequiredArgsConstructor
public class DataPipelineController {

    private final PriceDataService priceDataService;
    private final DailyApiQuota apiQuota;

    /**
     * 클래스패스 CSV로 시세 적재
     * @param file 예: data/prices/vwce.csv
     */
    @PostMapping("/prices/{assetId}/import")
    public ResponseEntity<?> importPrices(@PathVariable Long assetId, @RequestParam String file) {
        log.info("[API] CSV 시세 적재 요청: asset={}, file={}", assetId, file);
        try {
            int imported = priceDataService.importFromCsv(assetId, file);
            return ResponseEntity.ok(new PriceLoadResponse(assetId, imported));
        } catch (IllegalArgumentException e) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("[API] CSV 시세 적재 실패: asset={}", assetId, e);
            return ApiResponses.error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to import prices: " + e.getMessage());
        }
    }

    /**
     * EODHD에서 시세 백필 (일일 호출 한도 1회 차감)
     */
    @PostMapping("/prices/{assetId}/fetch")
    public ResponseEntity<?> fetchPrices(@PathVariable Long assetId,
                                         @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                         @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        log.info("[API] 시세 백필 요청: asset={}, {} ~ {}", assetId, from, to);
        if (from.isAfter(to)) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, "from must not be after to");
        }
        try {
            int saved = priceDataService.fetchAndStore(assetId, from, to);
            return ResponseEntity.ok(new PriceLoadResponse(assetId, saved));
        } catch (ApiQuotaExceededException e) {
            return ApiResponses.error(HttpStatus.TOO_MANY_REQUESTS, e.getMessage());
        } catch (IllegalArgumentException e) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (WebClientException | CodecException e) {
            log.error("[API] 시세 백필 실패: asset={}", assetId, e);
            return ApiResponses.error(HttpStatus.BAD_GATEWAY, "Market data request failed: " + e.getMessage());
        }
    }

    @GetMapping("/quota")
    public ResponseEntity<QuotaStatus> getQuota() {
        return ResponseEntity.ok(new QuotaStatus(
            apiQuota.getQuotaDate(),
            apiQuota.getUsedCalls(),
            apiQuota.getRemainingCalls(),
            apiQuota.getMaxDailyCalls()
        ));
    }

    public record PriceLoadResponse(Long assetId, int saved) {}

    public record QuotaStatus(LocalDate date, int used, int remaining, int max) {}
}
