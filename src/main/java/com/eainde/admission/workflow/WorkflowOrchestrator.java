package com.eainde.admission.workflow;

import com.eainde.admission.config.AdmissionProperties;
import com.eainde.admission.exception.ApplicationNotFoundException;
import com.eainde.admission.exception.ValidationException;
import com.eainde.admission.model.AgentLogEntry;
import com.eainde.admission.model.ApplicationRecord;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.DocumentDescriptor;
import com.eainde.admission.repository.ApplicationRepository;
import com.eainde.admission.repository.DocumentStore;
import com.eainde.admission.stage.classify.PdfBoxDocumentTextExtractor;
import com.eainde.admission.state.AdmissionState;
import com.eainde.admission.thread.MdcAwareExecutor;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Entry point of the admission pipeline.
 *
 * <p>{@link #submit(SubmissionRequest)} validates and persists a new application in
 * {@link ApplicationStage#READY} and hands it to the worker pool; it never waits for a
 * stage. Each worker runs one graph invocation per application, so stages of one
 * application run in order while different applications run in parallel. Callers follow
 * progress through {@link #getStatus(String)}.</p>
 */
@Log4j2
@Service
public class WorkflowOrchestrator {

    public static final String MDC_APPLICATION_ID = "applicationId";
    static final String AGENT = "Workflow";

    private final ApplicationRepository repository;
    private final DocumentStore documentStore;
    private final CompiledGraph<AdmissionState> workflow;
    private final MdcAwareExecutor executor;
    private final StageCommitter committer;
    private final Clock clock;
    private final String defaultEntity;

    public WorkflowOrchestrator(ApplicationRepository repository,
                                DocumentStore documentStore,
                                @Qualifier("admissionWorkflow") CompiledGraph<AdmissionState> workflow,
                                MdcAwareExecutor executor,
                                StageCommitter committer,
                                Clock clock,
                                AdmissionProperties properties) {
        this.repository = repository;
        this.documentStore = documentStore;
        this.workflow = workflow;
        this.executor = executor;
        this.committer = committer;
        this.clock = clock;
        this.defaultEntity = properties.getWorkflow().getDefaultEntity();
    }

    /**
     * Stores the uploaded files, creates the application and schedules its processing.
     *
     * @return the new application id
     * @throws ValidationException when the request is incomplete or contains no PDF
     */
    public String submit(SubmissionRequest request) {
        validate(request);
        String entity = request.entity() == null || request.entity().isBlank()
                ? defaultEntity
                : request.entity().trim().toUpperCase(Locale.ROOT);

        List<DocumentDescriptor> documents = new ArrayList<>();
        for (UploadedFile file : request.files()) {
            String documentId = newDocumentId();
            documentStore.put(documentId, file.content());
            documents.add(new DocumentDescriptor(documentId, file.filename(), file.contentType(), file.size()));
        }

        String applicationId = create(request.applicantId(), request.targetProgram(), entity, documents,
                Map.of("documents", documents.size()));
        log.info("Application {} submitted by {} for {} ({} documents)",
                applicationId, request.applicantId(), request.targetProgram(), documents.size());
        schedule(applicationId);
        return applicationId;
    }

    /**
     * @throws ApplicationNotFoundException for unknown ids
     */
    public ApplicationStatus getStatus(String applicationId) {
        return repository.findById(applicationId)
                .map(ApplicationStatus::from)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
    }

    public List<ApplicationSummary> listApplications() {
        return repository.findAll().stream()
                .map(ApplicationSummary::from)
                .collect(Collectors.toList());
    }

    /**
     * Starts a fresh application from the inputs of one that ended in ERROR. The failed
     * application keeps its state and gets a {@code resubmitted} event.
     *
     * @return the new application id
     * @throws ValidationException when the application is not in ERROR
     */
    public String resubmit(String applicationId) {
        ApplicationRecord failed = repository.findById(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
        if (failed.currentStage() != ApplicationStage.ERROR) {
            throw new ValidationException("Only applications in ERROR can be resubmitted; "
                    + applicationId + " is " + failed.currentStage());
        }

        List<DocumentDescriptor> documents = new ArrayList<>();
        for (DocumentDescriptor original : failed.documents()) {
            byte[] content = documentStore.get(original.documentId())
                    .orElseThrow(() -> new ValidationException(
                            "Content of document " + original.documentId() + " is no longer available"));
            String documentId = newDocumentId();
            documentStore.put(documentId, content);
            documents.add(new DocumentDescriptor(documentId, original.filename(), original.contentType(),
                    original.sizeBytes()));
        }

        String newId = create(failed.applicantId(), failed.targetProgram(), failed.entity(), documents,
                Map.of("documents", documents.size(), "resubmittedFrom", applicationId));
        committer.record(applicationId, AGENT, "resubmitted", Map.of("newApplicationId", newId));
        log.info("Application {} resubmitted as {}", applicationId, newId);
        schedule(newId);
        return newId;
    }

    private String create(String applicantId, String targetProgram, String entity,
                          List<DocumentDescriptor> documents, Map<String, Object> details) {
        while (true) {
            String applicationId = newApplicationId();
            Instant now = clock.instant();
            ApplicationRecord record = ApplicationRecord
                    .create(applicationId, applicantId, targetProgram, entity, documents, now)
                    .appendEvent(new AgentLogEntry(now, AGENT, "submitted", details));
            try {
                repository.create(record);
                return applicationId;
            } catch (IllegalStateException e) {
                log.debug("Application id {} already taken, generating another", applicationId);
            }
        }
    }

    /**
     * @throws RejectedExecutionException when the worker pool is shut down; the application
     *         is moved to ERROR first
     */
    private void schedule(String applicationId) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_APPLICATION_ID, applicationId)) {
            executor.execute(() -> advance(applicationId));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected application {}", applicationId, e);
            committer.fail(applicationId, ApplicationStage.READY, "Scheduling rejected: worker pool is shut down");
            throw e;
        }
    }

    void advance(String applicationId) {
        try {
            workflow.invoke(Map.of(AdmissionState.APPLICATION_ID, applicationId),
                    RunnableConfig.builder().threadId(applicationId).build());
        } catch (Exception e) {
            log.error("Workflow run for {} aborted", applicationId, e);
            ApplicationStage stage = repository.findById(applicationId)
                    .map(ApplicationRecord::currentStage)
                    .orElse(ApplicationStage.READY);
            String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            committer.fail(applicationId, stage, "Workflow aborted: " + detail);
        }
    }

    private static void validate(SubmissionRequest request) {
        if (request == null) {
            throw new ValidationException("Submission must not be null");
        }
        if (request.applicantId() == null || request.applicantId().isBlank()) {
            throw new ValidationException("Applicant id is required");
        }
        if (request.targetProgram() == null || request.targetProgram().isBlank()) {
            throw new ValidationException("Target program is required");
        }
        if (request.files().isEmpty()) {
            throw new ValidationException("At least one document is required");
        }
        boolean anyPdf = false;
        for (UploadedFile file : request.files()) {
            if (file == null || file.filename() == null || file.filename().isBlank()) {
                throw new ValidationException("Every document needs a filename");
            }
            if (file.size() == 0) {
                throw new ValidationException("Document " + file.filename() + " is empty");
            }
            DocumentDescriptor candidate = new DocumentDescriptor(null, file.filename(), file.contentType(), file.size());
            anyPdf |= PdfBoxDocumentTextExtractor.isPdf(candidate, file.content());
        }
        if (!anyPdf) {
            throw new ValidationException("At least one PDF document is required");
        }
    }

    private static String newApplicationId() {
        return "APP-" + hex(8);
    }

    private static String newDocumentId() {
        return "DOC-" + hex(6);
    }

    private static String hex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length).toUpperCase(Locale.ROOT);
    }
}
