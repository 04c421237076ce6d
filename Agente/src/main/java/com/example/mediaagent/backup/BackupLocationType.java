package com.example.mediaagent.backup;

import com.example.mediaagent.media.FileType;
import java.util.EnumSet;
import java.util.Set;

/**
 * Capacidade de um destino de backup.
 */
public enum BackupLocationType {
    PHOTOS(EnumSet.of(FileType.PHOTO)),
    VIDEOS(EnumSet.of(FileType.VIDEO)),
    PHOTOS_AND_VIDEOS(EnumSet.of(FileType.PHOTO, FileType.VIDEO));

    private final Set<FileType> accepted;

    BackupLocationType(Set<FileType> accepted) {
        this.accepted = accepted;
    }

    public boolean accepts(FileType type) {
        return accepted.contains(type);
    }

    public static BackupLocationType of(boolean photos, boolean videos) {
        if (photos && videos) return PHOTOS_AND_VIDEOS;
        if (photos) return PHOTOS;
        if (videos) return VIDEOS;
        throw new IllegalArgumentException("Destino sem nenhum tipo de arquivo");
    }
}
