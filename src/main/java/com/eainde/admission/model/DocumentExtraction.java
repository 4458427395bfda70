package com.eainde.admission.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw structured data pulled from one classified document.
 *
 * <p>{@code data} keeps the extractor's field names; values may be null when the
 * document did not contain the field.</p>
 */
public record DocumentExtraction(
        String sourceFile,
        DocumentLabel label,
        Map<String, Object> data,
        double confidence
) {
    public DocumentExtraction {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public Object field(String name) {
        return data.get(name);
    }
}
