package com.example.mediaagent.media;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Descrição de um problema associado a um arquivo (falha de cópia, aviso de renomeação, etc).
 */
public final class ProblemDetail {
    private final String title;
    private final String details;

    @JsonCreator
    public ProblemDetail(@JsonProperty("title") String title,
                         @JsonProperty("details") String details) {
        this.title = Objects.requireNonNull(title, "title");
        this.details = details == null ? "" : details;
    }

    @JsonProperty("title")
    public String title() {
        return title;
    }

    @JsonProperty("details")
    public String details() {
        return details;
    }

    @Override
    public String toString() {
        return details.isEmpty() ? title : title + ": " + details;
    }
}
