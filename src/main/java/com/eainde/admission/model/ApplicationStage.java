package com.eainde.admission.model;

/**
 * Processing stages of an admission application.
 *
 * <p>Stages advance one step at a time in declaration order up to
 * {@link #DECISION_MADE}. {@link #ERROR} is reachable once from any
 * non-terminal stage. Terminal stages never transition again.</p>
 */
public enum ApplicationStage {
    READY,
    CLASSIFYING,
    EXTRACTING,
    DECIDING,
    DECISION_MADE,
    ERROR;

    public boolean isTerminal() {
        return this == DECISION_MADE || this == ERROR;
    }

    public boolean canTransitionTo(ApplicationStage next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == ERROR) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
