package com.example.mediaagent.media;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot imutável de um arquivo descoberto no scan.
 *
 * É a forma serializável do arquivo trocada com os workers; o estado mutável
 * (status, caminhos de destino) fica em {@link MediaFile}, no lado do orquestrador.
 *
 * O identificador é determinístico (dispositivo + caminho relativo + mtime), de modo
 * que um novo scan do mesmo dispositivo não duplica arquivos.
 */
public final class MediaFileData {
    private final String uniqueId;
    private final int deviceId;
    private final FileType fileType;
    private final String sourcePath;
    private final String relativePath;
    private final String name;
    private final long size;
    private final long modificationTime;

    @JsonCreator
    public MediaFileData(@JsonProperty("uniqueId") String uniqueId,
                         @JsonProperty("deviceId") int deviceId,
                         @JsonProperty("fileType") FileType fileType,
                         @JsonProperty("sourcePath") String sourcePath,
                         @JsonProperty("relativePath") String relativePath,
                         @JsonProperty("name") String name,
                         @JsonProperty("size") long size,
                         @JsonProperty("modificationTime") long modificationTime) {
        this.uniqueId = Objects.requireNonNull(uniqueId, "uniqueId");
        this.deviceId = deviceId;
        this.fileType = Objects.requireNonNull(fileType, "fileType");
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
        this.name = Objects.requireNonNull(name, "name");
        this.size = size;
        this.modificationTime = modificationTime;
    }

    public static String uniqueIdFor(int deviceId, String relativePath, long modificationTime) {
        return deviceId + ":" + relativePath.replace('\\', '/') + "@" + modificationTime;
    }

    @JsonProperty("uniqueId") public String uniqueId() { return uniqueId; }
    @JsonProperty("deviceId") public int deviceId() { return deviceId; }
    @JsonProperty("fileType") public FileType fileType() { return fileType; }
    @JsonProperty("sourcePath") public String sourcePath() { return sourcePath; }
    @JsonProperty("relativePath") public String relativePath() { return relativePath; }
    @JsonProperty("name") public String name() { return name; }
    @JsonProperty("size") public long size() { return size; }
    @JsonProperty("modificationTime") public long modificationTime() { return modificationTime; }

    public Instant modifiedAt() {
        return Instant.ofEpochMilli(modificationTime);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MediaFileData)) return false;
        return uniqueId.equals(((MediaFileData) o).uniqueId);
    }

    @Override
    public int hashCode() {
        return uniqueId.hashCode();
    }

    @Override
    public String toString() {
        return "MediaFileData{" + uniqueId + ", " + fileType + ", " + size + " bytes}";
    }
}
