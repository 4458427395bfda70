package com.eainde.admission.state;

import org.bsc.langgraph4j.state.AgentState;

import java.util.Map;

/**
 * Graph state of one admission run. It only carries the application id and routing
 * markers; stage outputs live in the application repository.
 */
public class AdmissionState extends AgentState {

    public static final String APPLICATION_ID = "applicationId";
    public static final String ROUTE = "route";
    public static final String FAILED_STAGE = "failedStage";
    public static final String ERROR_DETAIL = "errorDetail";

    public static final String CONTINUE = "continue";
    public static final String ERROR = "error";

    public AdmissionState(Map<String, Object> initData) {
        super(initData);
    }

    public String getApplicationId() { return (String) this.data().get(APPLICATION_ID); }
    public String getRoute() { return (String) this.data().get(ROUTE); }
    public String getFailedStage() { return (String) this.data().get(FAILED_STAGE); }
    public String getErrorDetail() { return (String) this.data().get(ERROR_DETAIL); }

    public static Map<String, Object> proceed() {
        return Map.of(ROUTE, CONTINUE);
    }

    public static Map<String, Object> failure(String stage, String detail) {
        return Map.of(
                ROUTE, ERROR,
                FAILED_STAGE, stage,
                ERROR_DETAIL, detail == null ? "unknown error" : detail);
    }
}
