package com.example.mediaagent.orchestrator;

import com.example.mediaagent.backup.BackupDeviceCollection;
import com.example.mediaagent.config.DownloadSettings;
import com.example.mediaagent.config.PreferencesStore;
import com.example.mediaagent.device.CameraKey;
import com.example.mediaagent.device.DeviceCollection;
import com.example.mediaagent.jobcode.JobCode;
import com.example.mediaagent.media.MediaFileCollection;
import com.example.mediaagent.progress.DownloadTracker;
import com.example.mediaagent.progress.TimeRemaining;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Todo o estado mutável do orquestrador num único objeto. Acessado apenas na
 * thread do loop de eventos.
 */
final class OrchestratorContext {

    private final DownloadSettings settings;
    private final PreferencesStore preferences;
    private final DeviceCollection devices = new DeviceCollection();
    private final MediaFileCollection files = new MediaFileCollection();
    private final BackupDeviceCollection backups;
    private final DownloadTracker tracker = new DownloadTracker();
    private final TimeRemaining timeRemaining;
    private final JobCode jobCode;

    /** Dispositivos com cópia em andamento. */
    private final Set<Integer> activeDownloads = new LinkedHashSet<>();
    /** Dispositivos que entraram no ciclo de download atual. */
    private final Set<Integer> cycleParticipants = new LinkedHashSet<>();
    private final Map<Integer, List<Path>> tempDirs = new LinkedHashMap<>();
    /** Câmera aguardando desmontagem antes do scan, com o dispositivo correspondente. */
    private final Map<CameraKey, Integer> scanUnmounts = new HashMap<>();
    /** Câmeras aguardando desmontagem antes do download. */
    private final Set<CameraKey> downloadUnmounts = new LinkedHashSet<>();
    private final Set<Integer> unmountFailed = new LinkedHashSet<>();
    private final Set<Integer> scanErrors = new LinkedHashSet<>();
    private final Set<Integer> autoStart = new LinkedHashSet<>();
    private final Map<Integer, String> fileTypesText = new HashMap<>();

    private boolean summaryNotification;
    private boolean paused;
    private boolean sequencesPending;
    private boolean shuttingDown;
    private boolean terminated;

    OrchestratorContext(DownloadSettings settings, PreferencesStore preferences, JobCode jobCode) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.preferences = Objects.requireNonNull(preferences, "preferences");
        this.jobCode = Objects.requireNonNull(jobCode, "jobCode");
        this.backups = new BackupDeviceCollection(settings.backup());
        this.timeRemaining = new TimeRemaining(settings.timeRemainingMinInterval());
    }

    DownloadSettings settings() { return settings; }
    PreferencesStore preferences() { return preferences; }
    DeviceCollection devices() { return devices; }
    MediaFileCollection files() { return files; }
    BackupDeviceCollection backups() { return backups; }
    DownloadTracker tracker() { return tracker; }
    TimeRemaining timeRemaining() { return timeRemaining; }
    JobCode jobCode() { return jobCode; }

    Set<Integer> activeDownloads() { return activeDownloads; }
    Set<Integer> cycleParticipants() { return cycleParticipants; }
    Map<CameraKey, Integer> scanUnmounts() { return scanUnmounts; }
    Set<CameraKey> downloadUnmounts() { return downloadUnmounts; }
    Set<Integer> unmountFailed() { return unmountFailed; }
    Set<Integer> scanErrors() { return scanErrors; }
    Set<Integer> autoStart() { return autoStart; }

    boolean backupEnabled() {
        return settings.backup().enabled();
    }

    void addTempDirs(int deviceId, List<Path> dirs) {
        tempDirs.computeIfAbsent(deviceId, k -> new ArrayList<>()).addAll(dirs);
    }

    /** Remove e devolve os diretórios temporários registrados de um dispositivo. */
    List<Path> takeTempDirs(int deviceId) {
        List<Path> dirs = tempDirs.remove(deviceId);
        return dirs == null ? List.of() : dirs;
    }

    List<Path> takeAllTempDirs() {
        List<Path> all = new ArrayList<>();
        tempDirs.values().forEach(all::addAll);
        tempDirs.clear();
        return all;
    }

    String fileTypesText(int deviceId) {
        return fileTypesText.getOrDefault(deviceId, "arquivos");
    }

    void setFileTypesText(int deviceId, String text) {
        fileTypesText.put(deviceId, text);
    }

    boolean summaryNotification() { return summaryNotification; }
    void setSummaryNotification(boolean v) { this.summaryNotification = v; }
    boolean paused() { return paused; }
    void setPaused(boolean v) { this.paused = v; }
    boolean sequencesPending() { return sequencesPending; }
    void setSequencesPending(boolean v) { this.sequencesPending = v; }
    boolean shuttingDown() { return shuttingDown; }
    void setShuttingDown(boolean v) { this.shuttingDown = v; }
    boolean terminated() { return terminated; }
    void setTerminated(boolean v) { this.terminated = v; }

    /** Zera o estado do ciclo de download concluído. */
    void endCycle() {
        cycleParticipants.clear();
        fileTypesText.clear();
        unmountFailed.clear();
        summaryNotification = false;
        tracker.purgeAll();
        timeRemaining.clear();
    }
}
