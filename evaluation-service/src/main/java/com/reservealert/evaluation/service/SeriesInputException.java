package com.reservealert.evaluation.service;

/**
 * Raised when a request's series text contains no usable integer samples.
 */
public class SeriesInputException extends RuntimeException {

    public SeriesInputException(String message) {
        super(message);
    }
}
