package uk.gegc.examengine.features.session.application;

public record SweepResult(int expired, int errors) {
}
