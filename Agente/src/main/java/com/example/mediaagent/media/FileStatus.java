package com.example.mediaagent.media;

/**
 * Ciclo de vida de um {@link MediaFile} dentro do pipeline.
 */
public enum FileStatus {
    DISCOVERED,
    THUMBNAIL_PENDING,
    DOWNLOAD_PENDING,
    COPIED,
    RENAMED,
    DOWNLOADED,
    DOWNLOADED_WITH_WARNING,
    DOWNLOAD_FAILED,
    BACKUP_PROBLEM,
    DOWNLOAD_AND_BACKUP_FAILED;

    /** Arquivo ainda pode ser marcado para download. */
    public boolean isAvailable() {
        return this == DISCOVERED || this == THUMBNAIL_PENDING;
    }

    public boolean isTerminal() {
        return switch (this) {
            case DOWNLOADED, DOWNLOADED_WITH_WARNING, DOWNLOAD_FAILED,
                 BACKUP_PROBLEM, DOWNLOAD_AND_BACKUP_FAILED -> true;
            default -> false;
        };
    }

    public boolean isFailure() {
        return this == DOWNLOAD_FAILED || this == DOWNLOAD_AND_BACKUP_FAILED;
    }

    public boolean isWarning() {
        return this == DOWNLOADED_WITH_WARNING || this == BACKUP_PROBLEM;
    }
}
