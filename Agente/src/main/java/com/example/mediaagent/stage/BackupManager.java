package com.example.mediaagent.stage;

import com.example.mediaagent.backup.BackupDevice;
import com.example.mediaagent.stage.BackupMessages.BackupArguments;
import com.example.mediaagent.stage.BackupMessages.BackupFile;
import com.example.mediaagent.stage.BackupMessages.Request;
import com.example.mediaagent.stage.BackupMessages.Result;
import com.example.mediaagent.worker.PooledWorkerChannel;
import com.example.mediaagent.worker.WorkerChannel;
import com.example.mediaagent.worker.WorkerLauncher;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Um worker por destino de backup. A chave do canal é o id do destino, não o do
 * dispositivo de origem; os resultados trazem o dispositivo de origem.
 */
public final class BackupManager extends StageManager<Request, Result> {

    public BackupManager(WorkerChannel<Request, Result> channel) {
        super(Stage.BACKUP, channel);
    }

    public static BackupManager create(WorkerLauncher launcher, Duration grace, Consumer<PipelineEvent> events) {
        return new BackupManager(new PooledWorkerChannel<>(Stage.BACKUP.workerKind(), launcher, Result.class,
                grace, sinkFor(Stage.BACKUP, events)));
    }

    public void addDestination(BackupDevice destination) {
        channel.start(destination.id(), new BackupArguments(destination.id(), destination.path().toString(),
                destination.displayName()));
    }

    public boolean backupFile(int destinationId, BackupFile request) {
        return channel.send(destinationId, request);
    }

    public void removeDestination(int destinationId) {
        channel.stop(destinationId);
    }
}
