package com.eurofolio.engine.application.backtest.engine;

/**
 * 백테스트 입력이 잘못되었을 때 (비중 합계, 투자금, 기간 등)
 */
public class BacktestValidationException extends IllegalArgumentException {

    public BacktestValidationException(String message) {
        super(message);
    }
}
