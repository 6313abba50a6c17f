package uk.gegc.examengine.features.session.domain.model;

/**
 * Lifecycle of an exam session. Transitions only move to a strictly higher rank,
 * so FINISHED and TIMEOUT never regress.
 */
public enum SessionStatus {
    IN_PROGRESS(0),
    FINISHED(1),
    TIMEOUT(1);

    private final int rank;

    SessionStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank > IN_PROGRESS.rank;
    }

    public boolean canTransitionTo(SessionStatus target) {
        return target != null && target.rank > this.rank;
    }
}
