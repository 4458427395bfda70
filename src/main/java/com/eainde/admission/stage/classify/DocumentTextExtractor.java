package com.eainde.admission.stage.classify;

import com.eainde.admission.model.DocumentDescriptor;

/**
 * Turns uploaded document bytes into plain text.
 */
public interface DocumentTextExtractor {

    /**
     * @return the document text, empty when the format carries no extractable text
     */
    String extractText(DocumentDescriptor descriptor, byte[] content);
}
