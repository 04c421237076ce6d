package com.example.mediaagent.backup;

import com.example.mediaagent.config.AppConfig;
import com.example.mediaagent.media.FileType;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuração de backup: autodetecção por subpastas identificadoras ou destinos manuais.
 */
public final class BackupSettings {
    private final boolean enabled;
    private final boolean autodetect;
    private final Map<FileType, String> identifiers;
    private final Map<FileType, Path> manualLocations;
    private final boolean overwriteDuplicates;

    private BackupSettings(Builder b) {
        this.enabled = b.enabled;
        this.autodetect = b.autodetect;
        this.identifiers = new EnumMap<>(b.identifiers);
        this.manualLocations = new EnumMap<>(b.manualLocations);
        this.overwriteDuplicates = b.overwriteDuplicates;
    }

    public static BackupSettings from(AppConfig config) {
        Builder b = builder()
                .enabled(config.backupFiles())
                .autodetect(config.backupDeviceAutodetection())
                .identifier(FileType.PHOTO, config.photoBackupIdentifier())
                .identifier(FileType.VIDEO, config.videoBackupIdentifier())
                .overwriteDuplicates(config.backupDuplicateOverwrite());
        config.backupPhotoLocation().ifPresent(p -> b.manualLocation(FileType.PHOTO, p));
        config.backupVideoLocation().ifPresent(p -> b.manualLocation(FileType.VIDEO, p));
        return b.build();
    }

    public static BackupSettings disabled() {
        return builder().enabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean enabled() { return enabled; }
    public boolean autodetect() { return autodetect; }
    public boolean overwriteDuplicates() { return overwriteDuplicates; }

    public String identifier(FileType type) {
        return identifiers.get(type);
    }

    public Optional<Path> manualLocation(FileType type) {
        return Optional.ofNullable(manualLocations.get(type));
    }

    public static final class Builder {
        private boolean enabled;
        private boolean autodetect = true;
        private final Map<FileType, String> identifiers = new EnumMap<>(FileType.class);
        private final Map<FileType, Path> manualLocations = new EnumMap<>(FileType.class);
        private boolean overwriteDuplicates;

        private Builder() {
            identifiers.put(FileType.PHOTO, "photos");
            identifiers.put(FileType.VIDEO, "videos");
        }

        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }
        public Builder autodetect(boolean autodetect) { this.autodetect = autodetect; return this; }
        public Builder overwriteDuplicates(boolean overwrite) { this.overwriteDuplicates = overwrite; return this; }

        public Builder identifier(FileType type, String identifier) {
            identifiers.put(type, Objects.requireNonNull(identifier, "identifier"));
            return this;
        }

        public Builder manualLocation(FileType type, Path location) {
            manualLocations.put(type, Objects.requireNonNull(location, "location"));
            return this;
        }

        public BackupSettings build() {
            return new BackupSettings(this);
        }
    }
}
