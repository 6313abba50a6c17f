package uk.gegc.examengine.features.exam.domain.model;

/**
 * The fixed, ordered choice letters of a multiple-choice question.
 * Option texts are stored as a list; the ordinal of a letter is its index in that list.
 */
public enum AnswerOption {
    A, B, C, D, E;

    private static final AnswerOption[] VALUES = values();

    public static final int MAX_OPTIONS = VALUES.length;

    public static AnswerOption fromIndex(int index) {
        if (index < 0 || index >= VALUES.length) {
            throw new IllegalArgumentException("Option index out of range: " + index);
        }
        return VALUES[index];
    }
}
