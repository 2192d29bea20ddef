package com.eurofolio.engine.adapter.in.web;

import com.eurofolio.engine.application.AssetService;
import com.eurofolio.engine.application.PriceDataService;
import com.eurofolio.engine.application.PortfolioValidationException;
import com.eurofolio.engine.application.dto.AssetRegisterRequest;
import com.eurofolio.engine.application.dto.AssetResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@Slf4j
@RestController
@RequestMapping("/api/assets")
@RequiredArgsConstructor
public class AssetController {

    private final AssetService assetService;
    private final PriceDataService priceDataService;

    @PostMapping
    public ResponseEntity<?> registerAsset(@RequestBody AssetRegisterRequest request) {
        log.info("[API] 자산 등록 요청: {}.{}", request.getSymbol(), request.getExchange());
        try {
            AssetResponse asset = assetService.register(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(asset);
        } catch (PortfolioValidationException e) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (IllegalStateException e) {
            return ApiResponses.error(HttpStatus.CONFLICT, e.getMessage());
        } catch (Exception e) {
            log.error("[API] 자산 등록 실패", e);
            return ApiResponses.error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to register asset: " + e.getMessage());
        }
    }

    @GetMapping("/{assetId}")
    public ResponseEntity<?> getAsset(@PathVariable Long assetId) {
        try {
            return ResponseEntity.ok(assetService.getAsset(assetId));
        } catch (IllegalArgumentException e) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    /**
     * 기간 내 일봉 시세 (캐시에 없는 구간은 EODHD 백필)
     */
    @GetMapping("/{assetId}/prices")
    public ResponseEntity<?> getPrices(@PathVariable Long assetId,
                                       @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                       @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        log.info("[API] 시세 조회 요청: asset={}, {} ~ {}", assetId, from, to);
        if (from.isAfter(to)) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, "from must not be after to");
        }
        try {
            return ResponseEntity.ok(priceDataService.getAssetPrices(assetId, from, to));
        } catch (IllegalArgumentException e) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            log.error("[API] 시세 조회 실패: asset={}", assetId, e);
            return ApiResponses.error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to get prices: " + e.getMessage());
        }
    }
}
