package com.eainde.admission.nodes;

import com.eainde.admission.exception.ApplicationNotFoundException;
import com.eainde.admission.exception.StageExecutionException;
import com.eainde.admission.model.ApplicationRecord;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.repository.ApplicationRepository;
import com.eainde.admission.state.AdmissionState;
import com.eainde.admission.workflow.StageCommitter;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one stage for the application named in the graph state.
 *
 * <p>Nodes never complete exceptionally: a failure is turned into an {@code error} route
 * carrying the failing stage and its detail, and {@link HandleErrorNode} commits it.</p>
 */
public abstract class AbstractStageNode implements AsyncNodeAction<AdmissionState> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final ApplicationRepository repository;
    protected final StageCommitter committer;

    protected AbstractStageNode(ApplicationRepository repository, StageCommitter committer) {
        this.repository = repository;
        this.committer = committer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AdmissionState state) {
        String applicationId = state.getApplicationId();
        try {
            run(load(applicationId));
            return CompletableFuture.completedFuture(AdmissionState.proceed());
        } catch (StageExecutionException e) {
            log.warn("{} failed for {}: {}", e.getStage(), applicationId, e.getMessage());
            return CompletableFuture.completedFuture(
                    AdmissionState.failure(e.getStage().name(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {} for {}", stage(), applicationId, e);
            String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return CompletableFuture.completedFuture(AdmissionState.failure(stage().name(), detail));
        }
    }

    /**
     * Executes the stage and commits its output together with the next stage.
     */
    protected abstract void run(ApplicationRecord record);

    /**
     * The stage reported when this node fails unexpectedly.
     */
    protected abstract ApplicationStage stage();

    protected ApplicationRecord load(String applicationId) {
        return repository.findById(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
    }
}
