package uk.gegc.examengine.features.result.application;

public interface PassingPolicy {

    boolean isPassed(SessionOutcome outcome);
}
