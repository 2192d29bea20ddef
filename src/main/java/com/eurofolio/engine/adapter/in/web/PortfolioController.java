package com.eurofolio.engine.adapter.in.web;

import com.eurofolio.engine.application.PortfolioService;
import com.eurofolio.engine.application.PortfolioValidationException;
import com.eurofolio.engine.application.backtest.PortfolioBacktestService;
import com.eurofolio.engine.application.backtest.dto.PortfolioBacktestRequest;
import com.eurofolio.engine.application.backtest.dto.PortfolioBacktestResponse;
import com.eurofolio.engine.application.backtest.engine.BacktestValidationException;
import com.eurofolio.engine.application.backtest.engine.MissingPriceDataException;
import com.eurofolio.engine.application.dto.PortfolioCreateRequest;
import com.eurofolio.engine.application.dto.PortfolioResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/portfolios")
@RequiredArgsConstructor
public class PortfolioController {

    private final PortfolioService portfolioService;
    private final PortfolioBacktestService portfolioBacktestService;

    @PostMapping
    public ResponseEntity<?> createPortfolio(@RequestBody PortfolioCreateRequest request) {
        log.info("[API] 포트폴리오 생성 요청: name={}", request.getName());
        try {
            PortfolioResponse portfolio = portfolioService.createPortfolio(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(portfolio);
        } catch (PortfolioValidationException e) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (IllegalArgumentException e) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            log.error("[API] 포트폴리오 생성 실패", e);
            return ApiResponses.error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to create portfolio");
        }
    }

    @GetMapping
    public ResponseEntity<?> getPortfolios() {
        return ResponseEntity.ok(portfolioService.getPortfolios());
    }

    @GetMapping("/{portfolioId}")
    public ResponseEntity<?> getPortfolio(@PathVariable Long portfolioId) {
        try {
            return ResponseEntity.ok(portfolioService.getPortfolio(portfolioId));
        } catch (IllegalArgumentException e) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    /**
     * 백테스트 실행
     * - initialInvestment 기본 10,000, rebalanceFrequency 기본 ANNUALLY
     * - 시세가 없는 자산은 제외하고 실행 (dataCompleteness로 확인)
     */
    @PostMapping("/{portfolioId}/backtest")
    public ResponseEntity<?> runBacktest(@PathVariable Long portfolioId,
                                         @RequestBody PortfolioBacktestRequest request) {
        log.info("[API] 백테스트 요청: portfolio={}, {} ~ {}, 투자금={}, 리밸런싱={}",
            portfolioId, request.getStartDate(), request.getEndDate(),
            request.getInitialInvestment(), request.getRebalanceFrequency());
        try {
            PortfolioBacktestResponse response = portfolioBacktestService.runBacktest(portfolioId, request);
            return ResponseEntity.ok(response);
        } catch (BacktestValidationException | MissingPriceDataException e) {
            log.warn("[API] 백테스트 요청 거부: portfolio={}, {}", portfolioId, e.getMessage());
            return ApiResponses.error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (IllegalArgumentException e) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            log.error("[API] 백테스트 실패: portfolio={}", portfolioId, e);
            return ApiResponses.error(HttpStatus.INTERNAL_SERVER_ERROR, "Backtest failed: " + e.getMessage());
        }
    }

    /**
     * 최근 백테스트 10건
     */
    @GetMapping("/{portfolioId}/backtest")
    public ResponseEntity<?> getBacktestHistory(@PathVariable Long portfolioId) {
        try {
            return ResponseEntity.ok(portfolioBacktestService.getBacktestHistory(portfolioId));
        } catch (IllegalArgumentException e) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            log.error("[API] 백테스트 이력 조회 실패: portfolio={}", portfolioId, e);
            return ApiResponses.error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to get backtest history");
        }
    }
}
