package com.example.mediaagent.backup;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Destino de backup resolvido. Chaveado pelo caminho.
 */
public final class BackupDevice {
    private final int id;
    private final Path path;
    private final BackupLocationType type;
    private final String mountName;

    BackupDevice(int id, Path path, BackupLocationType type, String mountName) {
        this.id = id;
        this.path = Objects.requireNonNull(path, "path");
        this.type = Objects.requireNonNull(type, "type");
        this.mountName = mountName;
    }

    /** Identificador do worker de backup associado a este destino. */
    public int id() { return id; }
    public Path path() { return path; }
    public BackupLocationType type() { return type; }

    public Optional<String> mountName() {
        return Optional.ofNullable(mountName);
    }

    public String displayName() {
        if (mountName != null) {
            return mountName;
        }
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }

    @Override
    public String toString() {
        return "BackupDevice{" + id + ", " + path + ", " + type + "}";
    }
}
