package com.example.memo.core;

public class MemoCacheException extends RuntimeException {

    public MemoCacheException(String message) {
        super(message);
    }

    public MemoCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
