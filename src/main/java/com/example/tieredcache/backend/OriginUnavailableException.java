package com.example.tieredcache.backend;

public class OriginUnavailableException extends Exception {

    public OriginUnavailableException(String message) {
        super(message);
    }
}
