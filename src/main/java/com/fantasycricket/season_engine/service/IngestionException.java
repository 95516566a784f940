package com.fantasycricket.season_engine.service;

/**
 * A batch could not be completed. Records applied before the failure stay
 * applied; resubmitting the batch is safe.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
