package com.eainde.admission.stage.classify;

import com.eainde.admission.exception.StageExecutionException;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.ClassifiedDocument;
import com.eainde.admission.model.DocumentDescriptor;
import com.eainde.admission.model.DocumentLabel;
import com.eainde.admission.repository.DocumentStore;
import com.eainde.admission.stage.LlmJson;
import com.eainde.admission.stage.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifies documents with a chat model from their filename and the beginning of their text.
 *
 * <p>Labels outside the vocabulary, confidences below the threshold and unparsable
 * answers all fall back to {@link DocumentLabel#OTHER}; only a missing blob, a model
 * that keeps failing or a bundle without a single confident label fail the stage.</p>
 */
@Log4j2
public class LlmDocumentClassifier implements Classifier {

    static final double UNPARSABLE_CONFIDENCE = 0.1;

    private final DocumentClassificationAssistant assistant;
    private final DocumentTextExtractor textExtractor;
    private final DocumentStore documentStore;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final double confidenceThreshold;
    private final int excerptLength;

    public LlmDocumentClassifier(DocumentClassificationAssistant assistant,
                                 DocumentTextExtractor textExtractor,
                                 DocumentStore documentStore,
                                 ObjectMapper objectMapper,
                                 RetryPolicy retryPolicy,
                                 double confidenceThreshold,
                                 int excerptLength) {
        this.assistant = assistant;
        this.textExtractor = textExtractor;
        this.documentStore = documentStore;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.confidenceThreshold = confidenceThreshold;
        this.excerptLength = excerptLength;
    }

    @Override
    public List<ClassifiedDocument> execute(List<DocumentDescriptor> documents) {
        List<ClassifiedDocument> classified = new ArrayList<>(documents.size());
        for (DocumentDescriptor document : documents) {
            classified.add(classify(document));
        }
        boolean anyConfident = classified.stream().anyMatch(c -> c.confidence() >= confidenceThreshold);
        if (!anyConfident) {
            throw new StageExecutionException(ApplicationStage.CLASSIFYING,
                    "No documents classified with sufficient confidence");
        }
        return classified;
    }

    ClassifiedDocument classify(DocumentDescriptor document) {
        byte[] content = documentStore.get(document.documentId())
                .orElseThrow(() -> new StageExecutionException(ApplicationStage.CLASSIFYING,
                        "Content of document " + document.documentId() + " is missing"));
        String text = textExtractor.extractText(document, content);
        String excerpt = text.length() > excerptLength ? text.substring(0, excerptLength) : text;

        String response = retryPolicy.execute(ApplicationStage.CLASSIFYING, "classify " + document.filename(),
                () -> assistant.classify(DocumentLabel.vocabulary(), document.filename(), excerpt));

        ClassifiedDocument result = interpret(document, response);
        log.info("Classified {} as {} (confidence {})", document.filename(), result.label().value(), result.confidence());
        return result;
    }

    private ClassifiedDocument interpret(DocumentDescriptor document, String response) {
        Optional<JsonNode> parsed = LlmJson.parseObject(objectMapper, response);
        if (parsed.isEmpty()) {
            log.warn("Unparsable classification response for {}", document.filename());
            return new ClassifiedDocument(document, DocumentLabel.OTHER, UNPARSABLE_CONFIDENCE,
                    "Classification response could not be parsed");
        }
        JsonNode json = parsed.get();
        String rawType = LlmJson.text(json, "document_type");
        double confidence = clamp(LlmJson.number(json, "confidence", UNPARSABLE_CONFIDENCE));
        String reasoning = LlmJson.text(json, "reasoning");

        DocumentLabel label = DocumentLabel.fromValue(rawType);
        if (label == DocumentLabel.OTHER && rawType != null && !"other".equalsIgnoreCase(rawType.trim())) {
            reasoning = "Unrecognized type '" + rawType + "'" + (reasoning == null ? "" : "; " + reasoning);
        }
        if (confidence < confidenceThreshold && label != DocumentLabel.OTHER) {
            reasoning = "Below confidence threshold for " + label.value() + (reasoning == null ? "" : "; " + reasoning);
            label = DocumentLabel.OTHER;
        }
        return new ClassifiedDocument(document, label, confidence, reasoning);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
