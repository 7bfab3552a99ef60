package com.codesandbox.engine.api;

/** The request body parsed but lacks a required field. */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
