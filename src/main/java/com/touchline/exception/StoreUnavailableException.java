package com.touchline.exception;

/**
 * The rule store or the fire-history store could not be reached. Aborts the current
 * polling cycle; at startup it prevents the application from coming up.
 */
public class StoreUnavailableException extends BaseException {

    public StoreUnavailableException(String store, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, store + " is unavailable: " + cause.getMessage(), cause);
    }
}
