package com.eainde.admission.stage.extract;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface DataExtractionAssistant {

    @SystemMessage("""
        You are an expert data extraction system for university admissions.
        Be precise with grades, dates, and institution names.
        """)
    @UserMessage("""
        Document type: {{documentType}}
        Document content:
        {{content}}

        Extract the following fields:
        {{fields}}

        CRITICAL:
        - Return ONLY a valid JSON object with exactly these field names
        - No markdown code fences
        - Null for missing data (not empty string)
        """)
    String extract(@V("documentType") String documentType,
                   @V("fields") String fields,
                   @V("content") String content);
}
