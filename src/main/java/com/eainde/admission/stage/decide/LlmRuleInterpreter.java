package com.eainde.admission.stage.decide;

import com.eainde.admission.exception.StageExecutionException;
import com.eainde.admission.model.ApplicantProfile;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.RuleOutcome;
import com.eainde.admission.rag.RuleChunk;
import com.eainde.admission.stage.LlmJson;
import com.eainde.admission.stage.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link RuleInterpreter} backed by a chat model.
 *
 * <p>The profile is sent as JSON without the raw per-document extractions. A response
 * that is not a JSON object or names an unknown outcome is a schema mismatch.</p>
 */
@Log4j2
public class LlmRuleInterpreter implements RuleInterpreter {

    private final RuleInterpretationAssistant assistant;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;

    public LlmRuleInterpreter(RuleInterpretationAssistant assistant, ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        this.assistant = assistant;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public RuleVerdict evaluate(RuleChunk rule, ApplicantProfile profile, String targetProgram, String entity) {
        String profileJson = describe(profile);
        String response = retryPolicy.execute(ApplicationStage.DECIDING, "interpret rule " + rule.id(),
                () -> assistant.evaluate(targetProgram, entity, profileJson, rule.page(), rule.text()));

        JsonNode json = LlmJson.parseObject(objectMapper, response)
                .orElseThrow(() -> new StageExecutionException(ApplicationStage.DECIDING,
                        "Rule interpreter returned no JSON object for " + rule.id()));
        String rawOutcome = LlmJson.text(json, "outcome");
        RuleOutcome outcome = RuleOutcome.parse(rawOutcome)
                .orElseThrow(() -> new StageExecutionException(ApplicationStage.DECIDING,
                        "Rule interpreter returned unknown outcome '" + rawOutcome + "' for " + rule.id()));

        JsonNode required = json.get("required");
        String pathway = LlmJson.text(json, "pathway");
        if (pathway != null && (pathway.isBlank() || "null".equalsIgnoreCase(pathway))) {
            pathway = null;
        }
        double confidence = Math.max(0.0, Math.min(1.0, LlmJson.number(json, "confidence", 0.0)));
        return new RuleVerdict(outcome, required != null && required.asBoolean(false), pathway,
                confidence, LlmJson.text(json, "reasoning"));
    }

    private String describe(ApplicantProfile profile) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("qualification_type", profile.qualificationType());
        view.put("normalized_grade", profile.normalizedGrade());
        view.put("grading_system", profile.gradingSystem());
        view.put("work_experience_months", profile.workExperienceMonths());
        view.put("identifiers", profile.identifiers());
        view.put("dates", profile.dates());
        view.put("missing_fields", profile.missingFields());
        view.put("low_confidence_fields", profile.lowConfidenceFields());
        try {
            return objectMapper.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new StageExecutionException(ApplicationStage.DECIDING, "Cannot serialize applicant profile", e);
        }
    }
}
