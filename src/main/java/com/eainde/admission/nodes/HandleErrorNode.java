package com.eainde.admission.nodes;

import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.state.AdmissionState;
import com.eainde.admission.workflow.StageCommitter;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Commits the failure reported by a stage node and ends the run.
 */
@Log4j2
@Component
public class HandleErrorNode implements AsyncNodeAction<AdmissionState> {

    private final StageCommitter committer;

    public HandleErrorNode(StageCommitter committer) {
        this.committer = committer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AdmissionState state) {
        ApplicationStage stage = parseStage(state.getFailedStage());
        committer.fail(state.getApplicationId(), stage, state.getErrorDetail());
        return CompletableFuture.completedFuture(Map.of());
    }

    private static ApplicationStage parseStage(String raw) {
        if (raw == null) {
            return ApplicationStage.READY;
        }
        try {
            return ApplicationStage.valueOf(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown failed stage '{}' reported, recording READY", raw);
            return ApplicationStage.READY;
        }
    }
}
