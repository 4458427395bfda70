package com.eainde.admission.stage.extract;

import com.eainde.admission.exception.StageExecutionException;
import com.eainde.admission.model.ApplicantProfile;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.ClassifiedDocument;
import com.eainde.admission.model.DocumentDescriptor;
import com.eainde.admission.model.DocumentExtraction;
import com.eainde.admission.repository.DocumentStore;
import com.eainde.admission.stage.LlmJson;
import com.eainde.admission.stage.RetryPolicy;
import com.eainde.admission.stage.classify.DocumentTextExtractor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts template fields from each classified document with a chat model and
 * assembles the applicant profile.
 */
@Log4j2
public class LlmDataExtractor implements Extractor {

    private final DataExtractionAssistant assistant;
    private final DocumentTextExtractor textExtractor;
    private final DocumentStore documentStore;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final ProfileAssembler assembler;
    private final double minConfidence;

    public LlmDataExtractor(DataExtractionAssistant assistant,
                            DocumentTextExtractor textExtractor,
                            DocumentStore documentStore,
                            ObjectMapper objectMapper,
                            RetryPolicy retryPolicy,
                            ProfileAssembler assembler,
                            double minConfidence) {
        this.assistant = assistant;
        this.textExtractor = textExtractor;
        this.documentStore = documentStore;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.assembler = assembler;
        this.minConfidence = minConfidence;
    }

    @Override
    public ApplicantProfile execute(List<ClassifiedDocument> documents) {
        List<DocumentExtraction> extractions = new ArrayList<>(documents.size());
        for (ClassifiedDocument document : documents) {
            extractions.add(extract(document));
        }
        boolean anyUsable = extractions.stream().anyMatch(e -> e.confidence() > minConfidence);
        if (!anyUsable) {
            throw new StageExecutionException(ApplicationStage.EXTRACTING,
                    "No data extracted with sufficient confidence");
        }
        ApplicantProfile profile = assembler.assemble(extractions);
        log.info("Assembled profile: qualification={}, grade={}, missing={}",
                profile.qualificationType(), profile.normalizedGrade(), profile.missingFields());
        return profile;
    }

    DocumentExtraction extract(ClassifiedDocument classified) {
        DocumentDescriptor document = classified.document();
        ExtractionTemplate template = ExtractionTemplate.forLabel(classified.label());
        byte[] content = documentStore.get(document.documentId())
                .orElseThrow(() -> new StageExecutionException(ApplicationStage.EXTRACTING,
                        "Content of document " + document.documentId() + " is missing"));
        String text = textExtractor.extractText(document, content);

        String response = retryPolicy.execute(ApplicationStage.EXTRACTING, "extract " + document.filename(),
                () -> assistant.extract(classified.label().value(), template.instructions(), text));

        Optional<JsonNode> parsed = LlmJson.parseObject(objectMapper, response);
        if (parsed.isEmpty()) {
            log.warn("Unparsable extraction response for {}", document.filename());
            return new DocumentExtraction(document.filename(), classified.label(), Map.of(), 0.0);
        }
        Map<String, Object> data = toData(template, parsed.get());
        double confidence = template.confidence(data);
        log.debug("Extracted {} fields from {} (confidence {})", data.size(), document.filename(), confidence);
        return new DocumentExtraction(document.filename(), classified.label(), data, confidence);
    }

    private Map<String, Object> toData(ExtractionTemplate template, JsonNode json) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (String field : template.fields()) {
            data.put(field, null);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            data.put(entry.getKey(), toValue(entry.getValue()));
        }
        return data;
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            return text.isEmpty() || "null".equalsIgnoreCase(text) ? null : text;
        }
        return objectMapper.convertValue(node, Object.class);
    }
}
