package com.signalfusion.common.exception;

/**
 * Base type for every failure the fusion pipeline surfaces to its caller.
 * Messages are prefixed with the symbol they concern: {@code "[AAPL] ..."}.
 */
public class FusionException extends RuntimeException {
    private final String symbol;

    public FusionException(String symbol, String message) {
        super("[" + symbol + "] " + message);
        this.symbol = symbol;
    }

    public FusionException(String symbol, String message, Throwable cause) {
        super("[" + symbol + "] " + message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
