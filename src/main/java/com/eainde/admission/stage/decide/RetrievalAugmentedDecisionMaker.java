package com.eainde.admission.stage.decide;

import com.eainde.admission.model.ApplicantProfile;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.Citation;
import com.eainde.admission.model.Decision;
import com.eainde.admission.model.DecisionStatus;
import com.eainde.admission.model.DocumentLabel;
import com.eainde.admission.model.RetrievalTrace;
import com.eainde.admission.model.RuleEvaluation;
import com.eainde.admission.model.RuleOutcome;
import com.eainde.admission.rag.RetrievedChunk;
import com.eainde.admission.rag.RuleChunk;
import com.eainde.admission.rag.RuleIndex;
import com.eainde.admission.stage.RetryPolicy;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Decides an application from rulebook passages retrieved for its profile.
 *
 * <ol>
 *   <li>Query the rule index with program, entity, qualification and missing-data flags.</li>
 *   <li>Check the documents the entity requires; each missing one is a required
 *       {@code INSUFFICIENT_DATA} evaluation.</li>
 *   <li>Evaluate every retrieved passage with the {@link RuleInterpreter}.</li>
 *   <li>Compute the confidence and let the {@link AggregationPolicy} pick the status.</li>
 * </ol>
 *
 * <p>Citations are built from retrieved chunks only and are checked against the
 * retrieval trace before they leave this class.</p>
 */
@Log4j2
public class RetrievalAugmentedDecisionMaker implements DecisionMaker {

    private final RuleIndex ruleIndex;
    private final RuleInterpreter interpreter;
    private final AggregationPolicy policy;
    private final RetryPolicy retryPolicy;
    private final Map<String, List<DocumentLabel>> requiredDocuments;
    private final int topK;
    private final double reviewThreshold;
    private final double lowConfidenceCutoff;
    private final double confidencePenalty;

    public RetrievalAugmentedDecisionMaker(RuleIndex ruleIndex,
                                           RuleInterpreter interpreter,
                                           AggregationPolicy policy,
                                           RetryPolicy retryPolicy,
                                           Map<String, List<String>> requiredDocuments,
                                           int topK,
                                           double reviewThreshold,
                                           double lowConfidenceCutoff,
                                           double confidencePenalty) {
        this.ruleIndex = ruleIndex;
        this.interpreter = interpreter;
        this.policy = policy;
        this.retryPolicy = retryPolicy;
        this.requiredDocuments = normalize(requiredDocuments);
        this.topK = topK;
        this.reviewThreshold = reviewThreshold;
        this.lowConfidenceCutoff = lowConfidenceCutoff;
        this.confidencePenalty = confidencePenalty;
    }

    @Override
    public Decision execute(DecisionRequest request) {
        String query = buildQuery(request);
        List<RetrievedChunk> retrieved = retryPolicy.execute(ApplicationStage.DECIDING, "retrieve rules",
                () -> ruleIndex.query(query, topK));
        RetrievalTrace trace = new RetrievalTrace(query,
                retrieved.stream().map(r -> r.chunk().id()).collect(Collectors.toList()));
        log.info("Retrieved {} rule chunks for {}: {}", retrieved.size(), request.applicationId(), trace.chunkIds());

        List<RuleEvaluation> evaluations = new ArrayList<>();
        List<String> missingDocuments = missingDocuments(request);
        for (String label : missingDocuments) {
            evaluations.add(new RuleEvaluation(
                    "document:" + label,
                    "Applicants for entity " + request.entity() + " must provide a " + label + " document",
                    RuleOutcome.INSUFFICIENT_DATA, true, null, 1.0,
                    "No " + label + " document was provided", null));
        }
        for (RetrievedChunk hit : retrieved) {
            RuleChunk chunk = hit.chunk();
            RuleVerdict verdict = interpreter.evaluate(chunk, request.profile(), request.targetProgram(), request.entity());
            evaluations.add(new RuleEvaluation(chunk.id(), chunk.text(), verdict.outcome(), verdict.required(),
                    verdict.pathway(), verdict.confidence(), verdict.reasoning(), chunk.citation()));
        }

        double confidence = confidence(evaluations);
        DecisionStatus status = policy.aggregate(evaluations, confidence, reviewThreshold);
        List<Citation> citations = citations(evaluations, trace);

        log.info("Decision for {}: {} (confidence {}, {} citations)",
                request.applicationId(), status, String.format(Locale.ROOT, "%.2f", confidence), citations.size());
        return new Decision(status, confidence, reasoning(status, confidence, evaluations, missingDocuments),
                citations, evaluations, missingDocuments, trace);
    }

    String buildQuery(DecisionRequest request) {
        ApplicantProfile profile = request.profile();
        StringBuilder query = new StringBuilder()
                .append(request.targetProgram()).append(" admission requirements");
        if (request.entity() != null) {
            query.append(" for entity ").append(request.entity());
        }
        if (profile.qualificationType() != null) {
            query.append(", direct access with ").append(profile.qualificationType());
        }
        List<String> missing = profile.missingFields();
        if (!missing.isEmpty()) {
            query.append(", missing ").append(String.join(", ", missing));
        }
        return query.toString();
    }

    /**
     * Minimum confidence of the required evaluations, multiplied by the penalty once for
     * every required evaluation that is insufficient or below the low-confidence cutoff.
     * Zero when nothing required was evaluated.
     */
    double confidence(List<RuleEvaluation> evaluations) {
        List<RuleEvaluation> required = evaluations.stream()
                .filter(RuleEvaluation::required)
                .collect(Collectors.toList());
        if (required.isEmpty()) {
            return 0.0;
        }
        double min = required.stream().mapToDouble(RuleEvaluation::confidence).min().orElse(0.0);
        long degraded = required.stream()
                .filter(e -> e.outcome() == RuleOutcome.INSUFFICIENT_DATA || e.confidence() < lowConfidenceCutoff)
                .count();
        double value = min * Math.pow(confidencePenalty, degraded);
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private List<String> missingDocuments(DecisionRequest request) {
        String entity = request.entity() == null ? "" : request.entity().toUpperCase(Locale.ROOT);
        List<String> missing = new ArrayList<>();
        for (DocumentLabel label : requiredDocuments.getOrDefault(entity, List.of())) {
            if (!request.providedLabels().contains(label)) {
                missing.add(label.value());
            }
        }
        return missing;
    }

    private static List<Citation> citations(List<RuleEvaluation> evaluations, RetrievalTrace trace) {
        boolean anyRequired = evaluations.stream().anyMatch(e -> e.required() && e.citation() != null);
        Map<String, Citation> byChunk = new LinkedHashMap<>();
        for (RuleEvaluation evaluation : evaluations) {
            Citation citation = evaluation.citation();
            if (citation == null || (anyRequired && !evaluation.required())) {
                continue;
            }
            if (!trace.contains(citation.chunkId())) {
                log.warn("Dropping citation {} that was not part of the retrieval", citation.chunkId());
                continue;
            }
            byChunk.putIfAbsent(citation.chunkId(), citation);
        }
        return new ArrayList<>(byChunk.values());
    }

    private static String reasoning(DecisionStatus status, double confidence,
                                    List<RuleEvaluation> evaluations, List<String> missingDocuments) {
        StringBuilder text = new StringBuilder()
                .append("Decision ").append(status)
                .append(String.format(Locale.ROOT, " with confidence %.2f.", confidence));
        if (!missingDocuments.isEmpty()) {
            text.append(" Missing documents: ").append(String.join(", ", missingDocuments)).append('.');
        }
        for (RuleEvaluation evaluation : evaluations) {
            if (!evaluation.required()) {
                continue;
            }
            text.append("\n- ");
            if (evaluation.citation() != null) {
                text.append('[').append(evaluation.citation().label()).append("] ");
            }
            text.append(evaluation.outcome());
            if (evaluation.pathway() != null) {
                text.append(" (pathway ").append(evaluation.pathway()).append(')');
            }
            if (evaluation.reasoning() != null) {
                text.append(": ").append(evaluation.reasoning());
            }
        }
        return text.toString();
    }

    private static Map<String, List<DocumentLabel>> normalize(Map<String, List<String>> configured) {
        Map<String, List<DocumentLabel>> result = new LinkedHashMap<>();
        if (configured == null) {
            return result;
        }
        configured.forEach((entity, labels) -> result.put(entity.toUpperCase(Locale.ROOT),
                labels.stream().map(DocumentLabel::fromValue).distinct().collect(Collectors.toList())));
        return result;
    }
}
