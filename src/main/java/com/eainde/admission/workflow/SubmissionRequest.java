package com.eainde.admission.workflow;

import java.util.List;

/**
 * @param entity admission entity (e.g. DE, UK); the configured default applies when null
 */
public record SubmissionRequest(
        String applicantId,
        String targetProgram,
        String entity,
        List<UploadedFile> files
) {
    public SubmissionRequest {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
