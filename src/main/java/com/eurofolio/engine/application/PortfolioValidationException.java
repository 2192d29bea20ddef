package com.eurofolio.engine.application;

/**
 * 포트폴리오/자산 등록 요청 검증 실패
 */
public class PortfolioValidationException extends IllegalArgumentException {

    public PortfolioValidationException(String message) {
        super(message);
    }
}
