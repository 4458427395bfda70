package com.eainde.admission.config;

import com.eainde.admission.rag.LocalHashingEmbeddingModel;
import com.eainde.admission.rag.RuleIndex;
import com.eainde.admission.rag.RuleIndexFileStore;
import com.eainde.admission.rag.RulebookAssistant;
import com.eainde.admission.rag.RulebookChunker;
import com.eainde.admission.rag.RulebookLoader;
import com.eainde.admission.rag.RulebookService;
import com.eainde.admission.repository.ApplicationRepository;
import com.eainde.admission.repository.DocumentStore;
import com.eainde.admission.repository.InMemoryApplicationRepository;
import com.eainde.admission.repository.InMemoryDocumentStore;
import com.eainde.admission.stage.RetryPolicy;
import com.eainde.admission.stage.classify.Classifier;
import com.eainde.admission.stage.classify.DocumentClassificationAssistant;
import com.eainde.admission.stage.classify.DocumentTextExtractor;
import com.eainde.admission.stage.classify.LlmDocumentClassifier;
import com.eainde.admission.stage.classify.PdfBoxDocumentTextExtractor;
import com.eainde.admission.stage.decide.DecisionMaker;
import com.eainde.admission.stage.decide.LlmRuleInterpreter;
import com.eainde.admission.stage.decide.RetrievalAugmentedDecisionMaker;
import com.eainde.admission.stage.decide.RuleInterpretationAssistant;
import com.eainde.admission.stage.decide.RuleInterpreter;
import com.eainde.admission.stage.extract.DataExtractionAssistant;
import com.eainde.admission.stage.extract.Extractor;
import com.eainde.admission.stage.extract.LlmDataExtractor;
import com.eainde.admission.stage.extract.ProfileAssembler;
import com.eainde.admission.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.service.AiServices;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the stage executors, the rule index and the worker pool from {@link AdmissionProperties}.
 */
@Configuration
@EnableConfigurationProperties(AdmissionProperties.class)
public class AdmissionConfig {

    // =========================================================================
    //  Infrastructure
    // =========================================================================

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public ApplicationRepository applicationRepository() {
        return new InMemoryApplicationRepository();
    }

    @Bean
    public DocumentStore documentStore() {
        return new InMemoryDocumentStore();
    }

    @Bean
    public MdcAwareExecutor admissionExecutor(AdmissionProperties properties) {
        AdmissionProperties.Workflow workflow = properties.getWorkflow();
        return new MdcAwareExecutor(workflow.getMaxConcurrentApplications(), "admission-worker",
                workflow.getShutdownTimeout());
    }

    @Bean
    public RetryPolicy retryPolicy(AdmissionProperties properties) {
        return RetryPolicy.from(properties.getRetry());
    }

    // =========================================================================
    //  Rulebook
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean(EmbeddingModel.class)
    public EmbeddingModel embeddingModel(AdmissionProperties properties) {
        return new LocalHashingEmbeddingModel(properties.getRules().getEmbeddingDimension());
    }

    @Bean
    public RulebookChunker rulebookChunker(AdmissionProperties properties) {
        return RulebookChunker.builder()
                .chunkSize(properties.getRules().getChunkSize())
                .overlap(properties.getRules().getChunkOverlap())
                .build();
    }

    @Bean
    public RuleIndex ruleIndex(EmbeddingModel embeddingModel, RulebookChunker chunker, Clock clock) {
        return new RuleIndex(embeddingModel, chunker, clock);
    }

    @Bean
    public RulebookService rulebookService(RuleIndex ruleIndex,
                                           RulebookChunker chunker,
                                           ObjectMapper objectMapper,
                                           ChatModel chatModel,
                                           AdmissionProperties properties) {
        RulebookAssistant assistant = AiServices.builder(RulebookAssistant.class)
                .chatModel(chatModel)
                .build();
        return new RulebookService(ruleIndex, new RulebookLoader(chunker), new RuleIndexFileStore(objectMapper),
                assistant, properties.getRules());
    }

    // =========================================================================
    //  Stages
    // =========================================================================

    @Bean
    public DocumentTextExtractor documentTextExtractor() {
        return new PdfBoxDocumentTextExtractor();
    }

    @Bean
    public Classifier classifier(ChatModel chatModel,
                                 DocumentTextExtractor textExtractor,
                                 DocumentStore documentStore,
                                 ObjectMapper objectMapper,
                                 RetryPolicy retryPolicy,
                                 AdmissionProperties properties) {
        DocumentClassificationAssistant assistant = AiServices.builder(DocumentClassificationAssistant.class)
                .chatModel(chatModel)
                .build();
        AdmissionProperties.Classification settings = properties.getClassification();
        return new LlmDocumentClassifier(assistant, textExtractor, documentStore, objectMapper, retryPolicy,
                settings.getConfidenceThreshold(), settings.getExcerptLength());
    }

    @Bean
    public Extractor extractor(ChatModel chatModel,
                               DocumentTextExtractor textExtractor,
                               DocumentStore documentStore,
                               ObjectMapper objectMapper,
                               RetryPolicy retryPolicy,
                               AdmissionProperties properties) {
        DataExtractionAssistant assistant = AiServices.builder(DataExtractionAssistant.class)
                .chatModel(chatModel)
                .build();
        AdmissionProperties.Extraction settings = properties.getExtraction();
        return new LlmDataExtractor(assistant, textExtractor, documentStore, objectMapper, retryPolicy,
                new ProfileAssembler(settings.getLowConfidenceThreshold()), settings.getMinConfidence());
    }

    @Bean
    public RuleInterpreter ruleInterpreter(ChatModel chatModel, ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        RuleInterpretationAssistant assistant = AiServices.builder(RuleInterpretationAssistant.class)
                .chatModel(chatModel)
                .build();
        return new LlmRuleInterpreter(assistant, objectMapper, retryPolicy);
    }

    @Bean
    public DecisionMaker decisionMaker(RuleIndex ruleIndex,
                                       RuleInterpreter ruleInterpreter,
                                       RetryPolicy retryPolicy,
                                       AdmissionProperties properties) {
        AdmissionProperties.Decision settings = properties.getDecision();
        return new RetrievalAugmentedDecisionMaker(ruleIndex, ruleInterpreter, settings.getAggregation().policy(),
                retryPolicy, settings.getRequiredDocuments(), settings.getTopK(), settings.getReviewThreshold(),
                settings.getLowConfidenceCutoff(), settings.getConfidencePenalty());
    }
}
