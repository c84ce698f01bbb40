package com.beamcut.domain;

/**
 * Raised before any optimization work starts when the raw length, a part or an
 * optimizer parameter is out of range.
 */
public class InvalidInputException extends CuttingException {

    public InvalidInputException(String message) {
        super(message);
    }
}
