package com.eainde.admission.workflow;

import com.eainde.admission.edges.StageRoutingEdge;
import com.eainde.admission.nodes.ClassifyDocumentsNode;
import com.eainde.admission.nodes.ExtractDataNode;
import com.eainde.admission.nodes.HandleErrorNode;
import com.eainde.admission.nodes.MakeDecisionNode;
import com.eainde.admission.state.AdmissionState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * classify_documents → extract_data → make_decision, with every stage able to branch
 * to handle_error.
 */
@Component
public class AdmissionWorkflowGraph {

    public static final String CLASSIFY_DOCUMENTS = "classify_documents";
    public static final String EXTRACT_DATA = "extract_data";
    public static final String MAKE_DECISION = "make_decision";
    public static final String HANDLE_ERROR = "handle_error";

    private final ClassifyDocumentsNode classifyNode;
    private final ExtractDataNode extractNode;
    private final MakeDecisionNode decisionNode;
    private final HandleErrorNode errorNode;
    private final StageRoutingEdge routingEdge;

    public AdmissionWorkflowGraph(ClassifyDocumentsNode classifyNode,
                                  ExtractDataNode extractNode,
                                  MakeDecisionNode decisionNode,
                                  HandleErrorNode errorNode,
                                  StageRoutingEdge routingEdge) {
        this.classifyNode = classifyNode;
        this.extractNode = extractNode;
        this.decisionNode = decisionNode;
        this.errorNode = errorNode;
        this.routingEdge = routingEdge;
    }

    @Bean("admissionWorkflow")
    public CompiledGraph<AdmissionState> build() throws GraphStateException {

        StateGraph<AdmissionState> workflow = new StateGraph<>(AdmissionState::new);

        workflow.addNode(CLASSIFY_DOCUMENTS, classifyNode);
        workflow.addNode(EXTRACT_DATA, extractNode);
        workflow.addNode(MAKE_DECISION, decisionNode);
        workflow.addNode(HANDLE_ERROR, errorNode);

        workflow.addEdge(START, CLASSIFY_DOCUMENTS);

        workflow.addConditionalEdges(CLASSIFY_DOCUMENTS, routingEdge,
                Map.of(AdmissionState.CONTINUE, EXTRACT_DATA, AdmissionState.ERROR, HANDLE_ERROR));
        workflow.addConditionalEdges(EXTRACT_DATA, routingEdge,
                Map.of(AdmissionState.CONTINUE, MAKE_DECISION, AdmissionState.ERROR, HANDLE_ERROR));
        workflow.addConditionalEdges(MAKE_DECISION, routingEdge,
                Map.of(AdmissionState.CONTINUE, END, AdmissionState.ERROR, HANDLE_ERROR));

        workflow.addEdge(HANDLE_ERROR, END);

        return workflow.compile();
    }
}
