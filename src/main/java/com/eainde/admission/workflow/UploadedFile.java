package com.eainde.admission.workflow;

/**
 * One file of a submission as received from the upload surface.
 */
public record UploadedFile(String filename, String contentType, byte[] content) {

    public long size() {
        return content == null ? 0 : content.length;
    }
}
