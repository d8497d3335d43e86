package uk.gegc.quizforge.features.generation.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum AnswerLetter {
    A, B, C, D;

    public int index() {
        return ordinal();
    }

    /**
     * Parses "C", "c", "C)" or "C. Paris" into a letter.
     */
    public static Optional<AnswerLetter> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (value.length() > 1 && Character.isLetterOrDigit(value.charAt(1))) {
            return Optional.empty();
        }
        return switch (value.charAt(0)) {
            case 'A' -> Optional.of(A);
            case 'B' -> Optional.of(B);
            case 'C' -> Optional.of(C);
            case 'D' -> Optional.of(D);
            default -> Optional.empty();
        };
    }
}
