package com.example.mediaagent.config;

import java.util.List;

/**
 * Resultado da verificação de validade das preferências de download.
 */
public final class ValidityCheck {
    private final boolean valid;
    private final List<String> details;

    private ValidityCheck(boolean valid, List<String> details) {
        this.valid = valid;
        this.details = List.copyOf(details);
    }

    public static ValidityCheck ok() {
        return new ValidityCheck(true, List.of());
    }

    public static ValidityCheck of(List<String> problems) {
        return new ValidityCheck(problems.isEmpty(), problems);
    }

    public boolean valid() {
        return valid;
    }

    public List<String> details() {
        return details;
    }

    /** Texto para diagnóstico, uma linha por problema. */
    public String text() {
        return String.join("\n", details);
    }
}
