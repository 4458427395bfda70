package com.eainde.admission.nodes;

import com.eainde.admission.model.ApplicationRecord;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.ClassifiedDocument;
import com.eainde.admission.model.Decision;
import com.eainde.admission.repository.ApplicationRepository;
import com.eainde.admission.stage.decide.DecisionMaker;
import com.eainde.admission.stage.decide.DecisionRequest;
import com.eainde.admission.workflow.StageCommitter;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class MakeDecisionNode extends AbstractStageNode {

    private final DecisionMaker decisionMaker;

    public MakeDecisionNode(ApplicationRepository repository, StageCommitter committer, DecisionMaker decisionMaker) {
        super(repository, committer);
        this.decisionMaker = decisionMaker;
    }

    @Override
    protected void run(ApplicationRecord record) {
        DecisionRequest request = new DecisionRequest(
                record.id(),
                record.profile(),
                record.targetProgram(),
                record.entity(),
                record.classifiedDocuments().stream().map(ClassifiedDocument::label).collect(Collectors.toSet()));

        Decision decision = decisionMaker.execute(request);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", decision.status().name());
        details.put("confidence", decision.confidence());
        details.put("citations", decision.citations().size());
        committer.commit(record.id(), (current, now) -> current.withDecision(decision, now),
                "AdmissionAgent", "make_decision", details);
    }

    @Override
    protected ApplicationStage stage() {
        return ApplicationStage.DECIDING;
    }
}
