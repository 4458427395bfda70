package com.eainde.admission.exception;

/**
 * Rejected input. Nothing was persisted.
 */
public class ValidationException extends AdmissionException {

    public ValidationException(String message) {
        super(message);
    }
}
