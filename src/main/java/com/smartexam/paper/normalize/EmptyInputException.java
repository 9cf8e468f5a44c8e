package com.smartexam.paper.normalize;

/**
 * Raised when the text handed to the normalizer carries no content at all.
 * This is the only input the pipeline refuses; everything later degrades to defaults.
 */
public class EmptyInputException extends RuntimeException {

    public EmptyInputException(String message) {
        super(message);
    }
}
