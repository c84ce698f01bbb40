package com.beamcut.domain;

/**
 * Base type for every input problem reported by the cutting optimizer.
 */
public class CuttingException extends RuntimeException {

    public CuttingException(String message) {
        super(message);
    }
}
