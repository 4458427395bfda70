package com.eainde.admission.exception;

/**
 * Base type of all failures raised by the admission pipeline.
 */
public class AdmissionException extends RuntimeException {

    public AdmissionException(String message) {
        super(message);
    }

    public AdmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
