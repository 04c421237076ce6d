package com.example.mediaagent.stage;

import com.example.mediaagent.worker.WorkerLauncher;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Os cinco gerenciadores de estágio usados pelo orquestrador.
 */
public final class StageManagers implements AutoCloseable {

    private final ScanManager scan;
    private final CopyFilesManager copy;
    private final RenameMoveFileManager rename;
    private final BackupManager backup;
    private final OffloadManager offload;

    public StageManagers(ScanManager scan, CopyFilesManager copy, RenameMoveFileManager rename,
                         BackupManager backup, OffloadManager offload) {
        this.scan = Objects.requireNonNull(scan, "scan");
        this.copy = Objects.requireNonNull(copy, "copy");
        this.rename = Objects.requireNonNull(rename, "rename");
        this.backup = Objects.requireNonNull(backup, "backup");
        this.offload = Objects.requireNonNull(offload, "offload");
    }

    /**
     * Cria os gerenciadores sobre o lançador informado.
     *
     * @param graces período de tolerância por estágio
     * @param events destino de todos os eventos (normalmente o loop do orquestrador)
     */
    public static StageManagers create(WorkerLauncher launcher, Map<Stage, Duration> graces,
                                       Consumer<PipelineEvent> events) {
        return new StageManagers(
                ScanManager.create(launcher, grace(graces, Stage.SCAN), events),
                CopyFilesManager.create(launcher, grace(graces, Stage.COPY), events),
                RenameMoveFileManager.create(launcher, grace(graces, Stage.RENAME), events),
                BackupManager.create(launcher, grace(graces, Stage.BACKUP), events),
                OffloadManager.create(launcher, grace(graces, Stage.OFFLOAD), events));
    }

    private static Duration grace(Map<Stage, Duration> graces, Stage stage) {
        Duration d = graces.get(stage);
        if (d == null) {
            throw new IllegalArgumentException("Periodo de tolerancia ausente para " + stage);
        }
        return d;
    }

    public ScanManager scan() { return scan; }
    public CopyFilesManager copy() { return copy; }
    public RenameMoveFileManager rename() { return rename; }
    public BackupManager backup() { return backup; }
    public OffloadManager offload() { return offload; }

    public List<StageManager<?, ?>> all() {
        return List.of(scan, copy, rename, backup, offload);
    }

    /** Pede STOP a todos de uma vez, depois espera e força estágio por estágio. */
    public void shutdown() {
        for (StageManager<?, ?> m : all()) {
            m.stopAll();
        }
        for (StageManager<?, ?> m : all()) {
            m.shutdown();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
