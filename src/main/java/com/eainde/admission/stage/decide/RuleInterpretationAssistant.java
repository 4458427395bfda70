package com.eainde.admission.stage.decide;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface RuleInterpretationAssistant {

    @SystemMessage("""
        You are an expert admission officer applying university admission rules.
        Judge only from the rule text and the applicant profile you are given.
        Never assume facts that are not in the profile.
        Return ONLY valid JSON, no markdown code fences.
        """)
    @UserMessage("""
        TARGET PROGRAM: {{program}}
        ENTITY: {{entity}}

        APPLICANT PROFILE:
        {{profile}}

        RULE TEXT (page {{page}}):
        {{rule}}

        Decide:
        1. Does this rule govern admission to the target program for this applicant? ("required")
        2. If it is one of several alternative routes to admission, name the route ("pathway"), else null.
        3. Is the rule SATISFIED, NOT_SATISFIED, or is there INSUFFICIENT_DATA in the profile?

        OUTPUT FORMAT:
        {
          "outcome": "SATISFIED|NOT_SATISFIED|INSUFFICIENT_DATA",
          "required": true|false,
          "pathway": "route name or null",
          "confidence": 0.0-1.0,
          "reasoning": "brief explanation quoting the rule"
        }
        """)
    String evaluate(@V("program") String program,
                    @V("entity") String entity,
                    @V("profile") String profile,
                    @V("page") int page,
                    @V("rule") String rule);
}
