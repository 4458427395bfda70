package com.eainde.admission.rag;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Answers free-text questions about admission rules from retrieved rulebook passages.
 */
public interface RulebookAssistant {

    @SystemMessage("""
        You are an expert on university admission rules and regulations.
        Answer only from the rulebook context you are given.
        Always cite the page numbers and sections you rely on.
        If the context does not contain the answer, say so clearly.
        """)
    @UserMessage("""
        Context from the admission rulebook:
        {{context}}

        Question: {{question}}

        Answer (include page references):
        """)
    String answer(@V("context") String context, @V("question") String question);
}
