package com.eainde.admission.edges;

import com.eainde.admission.state.AdmissionState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Routes to the next stage unless the previous node reported a failure.
 */
@Component
public class StageRoutingEdge implements AsyncEdgeAction<AdmissionState> {

    @Override
    public CompletableFuture<String> apply(AdmissionState state) {
        String next = AdmissionState.ERROR.equals(state.getRoute())
                ? AdmissionState.ERROR
                : AdmissionState.CONTINUE;
        return CompletableFuture.completedFuture(next);
    }
}
