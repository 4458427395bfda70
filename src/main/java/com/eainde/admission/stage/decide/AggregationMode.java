package com.eainde.admission.stage.decide;

public enum AggregationMode {
    /** Every required rule must be satisfied. */
    STRICT,
    /** Mandatory rules must hold and at least one pathway must be fully satisfied. */
    ALTERNATIVE_PATHWAYS;

    public AggregationPolicy policy() {
        return this == STRICT ? new StrictAggregationPolicy() : new AlternativePathwayAggregationPolicy();
    }
}
