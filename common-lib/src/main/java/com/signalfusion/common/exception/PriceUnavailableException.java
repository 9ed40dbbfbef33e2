package com.signalfusion.common.exception;

/** Neither the quote provider nor any specialist payload yielded a usable market price. */
public class PriceUnavailableException extends FusionException {

    public PriceUnavailableException(String symbol) {
        super(symbol, "no usable market price from quote provider or specialist payloads");
    }
}
