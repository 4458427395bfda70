package com.eainde.admission.nodes;

import com.eainde.admission.model.ApplicantProfile;
import com.eainde.admission.model.ApplicationRecord;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.repository.ApplicationRepository;
import com.eainde.admission.stage.extract.Extractor;
import com.eainde.admission.workflow.StageCommitter;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ExtractDataNode extends AbstractStageNode {

    private final Extractor extractor;

    public ExtractDataNode(ApplicationRepository repository, StageCommitter committer, Extractor extractor) {
        super(repository, committer);
        this.extractor = extractor;
    }

    @Override
    protected void run(ApplicationRecord record) {
        ApplicantProfile profile = extractor.execute(record.classifiedDocuments());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("documents", profile.extractions().size());
        details.put("confidence", profile.confidence());
        details.put("missingFields", profile.missingFields());
        committer.commit(record.id(), (current, now) -> current.withProfile(profile, now),
                "DataExtractor", "extract_data", details);
    }

    @Override
    protected ApplicationStage stage() {
        return ApplicationStage.EXTRACTING;
    }
}
