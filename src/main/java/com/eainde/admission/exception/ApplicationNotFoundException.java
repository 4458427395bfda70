package com.eainde.admission.exception;

public class ApplicationNotFoundException extends AdmissionException {

    private final String applicationId;

    public ApplicationNotFoundException(String applicationId) {
        super("Application not found: " + applicationId);
        this.applicationId = applicationId;
    }

    public String getApplicationId() {
        return applicationId;
    }
}
