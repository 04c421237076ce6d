package com.example.mediaagent.config;

import com.example.mediaagent.backup.BackupSettings;
import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.NamingTemplate;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Preferências de download resolvidas a partir do {@link AppConfig}.
 *
 * Imutável: o orquestrador recebe uma instância por sessão.
 */
public final class DownloadSettings {

    private final Map<FileType, Path> downloadFolders;
    private final Map<FileType, String> subfolderTemplates;
    private final Map<FileType, String> renameTemplates;
    private final BackupSettings backup;
    private final List<String> ignoredPaths;
    private final Path thisComputerPath;
    private final String jobCode;
    private final boolean autoDownloadAtStartup;
    private final boolean autoDownloadUponDeviceInsertion;
    private final boolean autoExit;
    private final boolean autoExitForce;
    private final boolean autoUnmount;
    private final boolean moveFiles;
    private final boolean verifyFiles;
    private final String hashAlgorithm;
    private final int chunkSize;
    private final Duration timeRemainingMinInterval;
    private final long proximityGapSeconds;

    private DownloadSettings(Builder b) {
        this.downloadFolders = new EnumMap<>(b.downloadFolders);
        this.subfolderTemplates = new EnumMap<>(b.subfolderTemplates);
        this.renameTemplates = new EnumMap<>(b.renameTemplates);
        this.backup = Objects.requireNonNull(b.backup, "backup");
        this.ignoredPaths = List.copyOf(b.ignoredPaths);
        this.thisComputerPath = b.thisComputerPath;
        this.jobCode = b.jobCode;
        this.autoDownloadAtStartup = b.autoDownloadAtStartup;
        this.autoDownloadUponDeviceInsertion = b.autoDownloadUponDeviceInsertion;
        this.autoExit = b.autoExit;
        this.autoExitForce = b.autoExitForce;
        this.autoUnmount = b.autoUnmount;
        this.moveFiles = b.moveFiles;
        this.verifyFiles = b.verifyFiles;
        this.hashAlgorithm = b.hashAlgorithm;
        this.chunkSize = b.chunkSize;
        this.timeRemainingMinInterval = b.timeRemainingMinInterval;
        this.proximityGapSeconds = b.proximityGapSeconds;
    }

    public static DownloadSettings from(AppConfig config) {
        Builder b = builder()
                .downloadFolder(FileType.PHOTO, config.photoDownloadFolder())
                .downloadFolder(FileType.VIDEO, config.videoDownloadFolder())
                .subfolderTemplate(FileType.PHOTO, config.photoSubfolderTemplate())
                .subfolderTemplate(FileType.VIDEO, config.videoSubfolderTemplate())
                .renameTemplate(FileType.PHOTO, config.photoRenameTemplate())
                .renameTemplate(FileType.VIDEO, config.videoRenameTemplate())
                .backup(BackupSettings.from(config))
                .ignoredPaths(config.ignoredPaths())
                .autoDownloadAtStartup(config.autoDownloadAtStartup())
                .autoDownloadUponDeviceInsertion(config.autoDownloadUponDeviceInsertion())
                .autoExit(config.autoExit())
                .autoExitForce(config.autoExitForce())
                .autoUnmount(config.autoUnmount())
                .moveFiles(config.moveFiles())
                .verifyFiles(config.verifyFile())
                .hashAlgorithm(config.hashAlgorithm())
                .chunkSize(config.chunkSizeBytes())
                .timeRemainingMinInterval(config.timeRemainingMinInterval())
                .proximityGapSeconds(config.proximityGapSeconds());
        config.thisComputerPath().ifPresent(b::thisComputerPath);
        config.jobCode().ifPresent(b::jobCode);
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path downloadFolder(FileType type) { return downloadFolders.get(type); }
    public String subfolderTemplate(FileType type) { return subfolderTemplates.get(type); }
    public String renameTemplate(FileType type) { return renameTemplates.get(type); }
    public Map<FileType, Path> downloadFolders() { return Map.copyOf(downloadFolders); }
    public BackupSettings backup() { return backup; }
    public List<String> ignoredPaths() { return ignoredPaths; }
    public Optional<Path> thisComputerPath() { return Optional.ofNullable(thisComputerPath); }
    public Optional<String> jobCode() { return Optional.ofNullable(jobCode); }
    public boolean autoDownloadAtStartup() { return autoDownloadAtStartup; }
    public boolean autoDownloadUponDeviceInsertion() { return autoDownloadUponDeviceInsertion; }
    public boolean autoExit() { return autoExit; }
    public boolean autoExitForce() { return autoExitForce; }
    public boolean autoUnmount() { return autoUnmount; }
    public boolean moveFiles() { return moveFiles; }
    public boolean verifyFiles() { return verifyFiles; }
    public String hashAlgorithm() { return hashAlgorithm; }
    public int chunkSize() { return chunkSize; }
    public Duration timeRemainingMinInterval() { return timeRemainingMinInterval; }
    public long proximityGapSeconds() { return proximityGapSeconds; }

    /**
     * Algum template (nome ou subpasta) usa o código de trabalho?
     */
    public boolean jobCodeRequired() {
        for (FileType t : FileType.values()) {
            if (NamingTemplate.fileName(renameTemplates.get(t)).usesJobCode()
                    || NamingTemplate.subfolder(subfolderTemplates.get(t)).usesJobCode()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Verifica templates de todos os tipos.
     */
    public ValidityCheck checkValidity() {
        List<String> problems = new ArrayList<>();
        for (FileType t : FileType.values()) {
            NamingTemplate.fileName(renameTemplates.get(t)).problems()
                    .forEach(p -> problems.add("Nome de " + t.plural() + ": " + p));
            NamingTemplate.subfolder(subfolderTemplates.get(t)).problems()
                    .forEach(p -> problems.add("Subpasta de " + t.plural() + ": " + p));
        }
        return ValidityCheck.of(problems);
    }

    /**
     * Pastas de download inexistentes ou sem permissão de escrita, apenas para os tipos
     * que serão baixados.
     */
    public List<Path> invalidDownloadFolders(Set<FileType> types) {
        List<Path> invalid = new ArrayList<>();
        for (FileType t : types) {
            Path folder = downloadFolders.get(t);
            if (folder == null || !Files.isDirectory(folder) || !Files.isWritable(folder)) {
                if (folder != null && !invalid.contains(folder)) {
                    invalid.add(folder);
                }
            }
        }
        return invalid;
    }

    public static final class Builder {
        private final Map<FileType, Path> downloadFolders = new EnumMap<>(FileType.class);
        private final Map<FileType, String> subfolderTemplates = new EnumMap<>(FileType.class);
        private final Map<FileType, String> renameTemplates = new EnumMap<>(FileType.class);
        private BackupSettings backup = BackupSettings.disabled();
        private List<String> ignoredPaths = List.of(".Trash", ".thumbnails");
        private Path thisComputerPath;
        private String jobCode;
        private boolean autoDownloadAtStartup;
        private boolean autoDownloadUponDeviceInsertion;
        private boolean autoExit;
        private boolean autoExitForce;
        private boolean autoUnmount;
        private boolean moveFiles;
        private boolean verifyFiles = true;
        private String hashAlgorithm = "SHA-256";
        private int chunkSize = 1024 * 1024;
        private Duration timeRemainingMinInterval = Duration.ofSeconds(1);
        private long proximityGapSeconds = 3600;

        private Builder() {
            for (FileType t : FileType.values()) {
                subfolderTemplates.put(t, "{date:yyyy}/{date:yyyyMMdd}");
                renameTemplates.put(t, "{name}{ext}");
            }
        }

        public Builder downloadFolder(FileType type, Path folder) { downloadFolders.put(type, folder); return this; }
        public Builder subfolderTemplate(FileType type, String template) { subfolderTemplates.put(type, template); return this; }
        public Builder renameTemplate(FileType type, String template) { renameTemplates.put(type, template); return this; }
        public Builder backup(BackupSettings backup) { this.backup = backup; return this; }
        public Builder ignoredPaths(List<String> ignoredPaths) { this.ignoredPaths = ignoredPaths; return this; }
        public Builder thisComputerPath(Path path) { this.thisComputerPath = path; return this; }
        public Builder jobCode(String jobCode) { this.jobCode = jobCode; return this; }
        public Builder autoDownloadAtStartup(boolean v) { this.autoDownloadAtStartup = v; return this; }
        public Builder autoDownloadUponDeviceInsertion(boolean v) { this.autoDownloadUponDeviceInsertion = v; return this; }
        public Builder autoExit(boolean v) { this.autoExit = v; return this; }
        public Builder autoExitForce(boolean v) { this.autoExitForce = v; return this; }
        public Builder autoUnmount(boolean v) { this.autoUnmount = v; return this; }
        public Builder moveFiles(boolean v) { this.moveFiles = v; return this; }
        public Builder verifyFiles(boolean v) { this.verifyFiles = v; return this; }
        public Builder hashAlgorithm(String v) { this.hashAlgorithm = v; return this; }
        public Builder chunkSize(int v) { this.chunkSize = v; return this; }
        public Builder timeRemainingMinInterval(Duration v) { this.timeRemainingMinInterval = v; return this; }
        public Builder proximityGapSeconds(long v) { this.proximityGapSeconds = v; return this; }

        public DownloadSettings build() {
            for (FileType t : FileType.values()) {
                if (!downloadFolders.containsKey(t)) {
                    throw new IllegalStateException("Pasta de download ausente para " + t.plural());
                }
            }
            return new DownloadSettings(this);
        }
    }
}
