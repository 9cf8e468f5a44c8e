package com.smartexam.paper.api;

public class PaperSourceException extends RuntimeException {

    public PaperSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
