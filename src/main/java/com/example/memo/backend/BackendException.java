package com.example.memo.backend;

public class BackendException extends RuntimeException {

    private final String key;

    public BackendException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
