package com.eainde.admission.nodes;

import com.eainde.admission.model.ApplicationRecord;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.ClassifiedDocument;
import com.eainde.admission.repository.ApplicationRepository;
import com.eainde.admission.stage.classify.Classifier;
import com.eainde.admission.workflow.StageCommitter;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ClassifyDocumentsNode extends AbstractStageNode {

    private final Classifier classifier;

    public ClassifyDocumentsNode(ApplicationRepository repository, StageCommitter committer, Classifier classifier) {
        super(repository, committer);
        this.classifier = classifier;
    }

    @Override
    protected void run(ApplicationRecord record) {
        committer.commit(record.id(), (current, now) -> current.startClassification(now),
                "Workflow", "start_classification", Map.of("documents", record.documents().size()));

        List<ClassifiedDocument> classified = classifier.execute(record.documents());

        Map<String, Object> labels = new LinkedHashMap<>();
        for (ClassifiedDocument document : classified) {
            labels.put(document.document().documentId(), document.label().value());
        }
        committer.commit(record.id(), (current, now) -> current.withClassification(classified, now),
                "DocumentClassifier", "classify_documents", labels);
    }

    @Override
    protected ApplicationStage stage() {
        return ApplicationStage.CLASSIFYING;
    }
}
