package com.eainde.admission.stage.classify;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface DocumentClassificationAssistant {

    @SystemMessage("""
        You are a document classifier for university admissions.
        Return ONLY valid JSON, no markdown code fences.
        """)
    @UserMessage("""
        Classify this document into exactly one of these categories: {{labels}}

        Document filename: {{filename}}
        Document content (first characters):
        {{excerpt}}

        Consider:
        - File name patterns (transcript, cv, abitur, zeugnis, certificate, etc.)
        - Content keywords and structure
        - Academic terminology
        - Official document formats

        OUTPUT FORMAT:
        {
          "document_type": "category",
          "confidence": 0.0-1.0,
          "reasoning": "brief explanation"
        }
        """)
    String classify(@V("labels") String labels,
                    @V("filename") String filename,
                    @V("excerpt") String excerpt);
}
