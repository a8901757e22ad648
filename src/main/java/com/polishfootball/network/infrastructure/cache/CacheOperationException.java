package com.polishfootball.network.infrastructure.cache;

public class CacheOperationException extends RuntimeException {

    public CacheOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
