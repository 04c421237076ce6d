package com.example.mediaagent.stage;

import com.example.mediaagent.worker.WorkerEvent;
import com.example.mediaagent.worker.WorkerMessage;
import java.util.Objects;
import java.util.Optional;

/**
 * Resultado de qualquer estágio, marcado com um {@link Kind}.
 *
 * Todos os canais entregam seus eventos ao loop do orquestrador como PipelineEvent;
 * o orquestrador trata cada Kind num único switch.
 */
public final class PipelineEvent {

    public enum Kind {
        FILES_FOUND(Stage.SCAN, ScanMessages.FilesFound.class),
        SCAN_PROBLEM(Stage.SCAN, ScanMessages.ScanProblem.class),
        DEVICE_INFO(Stage.SCAN, ScanMessages.DeviceInfo.class),
        SCAN_FINISHED(Stage.SCAN, null),
        TEMP_DIRS(Stage.COPY, CopyMessages.TempDirs.class),
        BYTES_COPIED(Stage.COPY, CopyMessages.BytesCopied.class),
        FILE_COPIED(Stage.COPY, CopyMessages.FileCopied.class),
        COPY_FINISHED(Stage.COPY, null),
        FILE_RENAMED(Stage.RENAME, RenameMessages.FileRenamed.class),
        SEQUENCES_UPDATED(Stage.RENAME, RenameMessages.SequencesUpdate.class),
        RENAME_FINISHED(Stage.RENAME, null),
        BACKUP_BYTES(Stage.BACKUP, BackupMessages.BackupBytes.class),
        FILE_BACKED_UP(Stage.BACKUP, BackupMessages.FileBackedUp.class),
        BACKUP_FINISHED(Stage.BACKUP, null),
        PROXIMITY_GROUPS(Stage.OFFLOAD, OffloadMessages.ProximityGroups.class),
        OFFLOAD_FINISHED(Stage.OFFLOAD, null);

        private final Stage stage;
        private final Class<? extends WorkerMessage> payloadType;

        Kind(Stage stage, Class<? extends WorkerMessage> payloadType) {
            this.stage = stage;
            this.payloadType = payloadType;
        }

        public Stage stage() {
            return stage;
        }

        /** Evento de término de worker (sem payload). */
        public boolean isFinished() {
            return payloadType == null;
        }

        static Kind of(Stage stage, WorkerMessage payload) {
            for (Kind k : values()) {
                if (k.stage == stage && k.payloadType != null && k.payloadType.isInstance(payload)) {
                    return k;
                }
            }
            throw new IllegalArgumentException("Resultado desconhecido do estagio " + stage + ": "
                    + payload.getClass().getName());
        }

        static Kind finished(Stage stage) {
            for (Kind k : values()) {
                if (k.stage == stage && k.payloadType == null) {
                    return k;
                }
            }
            throw new IllegalArgumentException("Estagio sem evento de termino: " + stage);
        }
    }

    private final Kind kind;
    private final Integer deviceId;
    private final WorkerMessage payload;
    private final boolean unexpected;

    private PipelineEvent(Kind kind, Integer deviceId, WorkerMessage payload, boolean unexpected) {
        this.kind = kind;
        this.deviceId = deviceId;
        this.payload = payload;
        this.unexpected = unexpected;
    }

    public static PipelineEvent result(Integer deviceId, WorkerMessage payload, Stage stage) {
        Objects.requireNonNull(payload, "payload");
        return new PipelineEvent(Kind.of(stage, payload), deviceId, payload, false);
    }

    public static PipelineEvent finished(Stage stage, Integer deviceId, boolean unexpected) {
        return new PipelineEvent(Kind.finished(stage), deviceId, null, unexpected);
    }

    /** Converte o evento de um canal do estágio informado. */
    public static PipelineEvent from(Stage stage, WorkerEvent<? extends WorkerMessage> event) {
        Integer deviceId = event.deviceId().orElse(null);
        if (event.kind() == WorkerEvent.Kind.FINISHED) {
            return finished(stage, deviceId, event.unexpected());
        }
        return result(deviceId, event.payload(), stage);
    }

    public Kind kind() { return kind; }
    public boolean unexpected() { return unexpected; }

    public Optional<Integer> deviceId() {
        return Optional.ofNullable(deviceId);
    }

    /** Dispositivo do evento; falha se ausente. */
    public int requireDeviceId() {
        if (deviceId == null) {
            throw new IllegalStateException("Evento " + kind + " sem dispositivo");
        }
        return deviceId;
    }

    public <T extends WorkerMessage> T payload(Class<T> type) {
        return type.cast(payload);
    }

    @Override
    public String toString() {
        return "PipelineEvent{" + kind + ", device=" + deviceId + (unexpected ? ", unexpected" : "") + "}";
    }
}
