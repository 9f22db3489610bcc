package com.riskscan.connect.exception;

public class NoIdentityException extends RuntimeException {

    public NoIdentityException(String message) {
        super(message);
    }
}
