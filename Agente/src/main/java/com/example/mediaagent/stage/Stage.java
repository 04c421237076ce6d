package com.example.mediaagent.stage;

import java.util.Locale;

/**
 * Estágios do pipeline, cada um com seu tipo de worker.
 */
public enum Stage {
    SCAN,
    COPY,
    RENAME,
    BACKUP,
    OFFLOAD;

    /** Nome usado para lançar o worker (argumento do processo filho). */
    public String workerKind() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Stage fromWorkerKind(String kind) {
        return valueOf(kind.trim().toUpperCase(Locale.ROOT));
    }
}
