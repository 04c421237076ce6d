package com.example.mediaagent.media;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Tipo de mídia reconhecido pelo agente.
 *
 * A classificação é feita pela extensão do arquivo. Tabelas por tipo
 * (pastas de destino, identificadores de backup, templates) usam
 * {@link java.util.EnumMap} com esta enum como chave.
 */
public enum FileType {
    PHOTO("foto", "fotos"),
    VIDEO("video", "videos");

    private static final Set<String> PHOTO_EXTENSIONS = Set.of(
            "jpg", "jpeg", "jpe", "tif", "tiff", "png", "heic", "heif", "webp",
            "cr2", "cr3", "crw", "nef", "nrw", "arw", "srf", "sr2", "orf", "rw2",
            "raf", "dng", "pef", "srw", "x3f", "3fr", "mef", "mos", "mrw", "erf",
            "kdc", "dcr", "raw", "rwl", "iiq", "fff");

    private static final Set<String> VIDEO_EXTENSIONS = Set.of(
            "mov", "mp4", "m4v", "avi", "mts", "m2ts", "mpg", "mpeg", "3gp",
            "mkv", "wmv", "mod", "tod", "webm");

    private final String singular;
    private final String plural;

    FileType(String singular, String plural) {
        this.singular = singular;
        this.plural = plural;
    }

    public String singular() {
        return singular;
    }

    public String plural() {
        return plural;
    }

    /**
     * Classifica um nome de arquivo pela extensão (case-insensitive).
     * Retorna vazio para arquivos que não são fotos nem vídeos.
     */
    public static Optional<FileType> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        if (dot <= 0 || dot == lower.length() - 1) {
            return Optional.empty();
        }
        String ext = lower.substring(dot + 1);
        if (PHOTO_EXTENSIONS.contains(ext)) {
            return Optional.of(PHOTO);
        }
        if (VIDEO_EXTENSIONS.contains(ext)) {
            return Optional.of(VIDEO);
        }
        return Optional.empty();
    }
}
