package com.example.mediaagent.stage;

import com.example.mediaagent.stage.RenameMessages.DownloadCompleted;
import com.example.mediaagent.stage.RenameMessages.DownloadStarted;
import com.example.mediaagent.stage.RenameMessages.RenameFile;
import com.example.mediaagent.stage.RenameMessages.Request;
import com.example.mediaagent.stage.RenameMessages.Result;
import com.example.mediaagent.worker.SingletonWorkerChannel;
import com.example.mediaagent.worker.WorkerChannel;
import com.example.mediaagent.worker.WorkerLauncher;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Worker único de renomear/mover, compartilhado por todos os dispositivos.
 */
public final class RenameMoveFileManager extends StageManager<Request, Result> {

    public RenameMoveFileManager(WorkerChannel<Request, Result> channel) {
        super(Stage.RENAME, channel);
    }

    public static RenameMoveFileManager create(WorkerLauncher launcher, Duration grace, Consumer<PipelineEvent> events) {
        return new RenameMoveFileManager(new SingletonWorkerChannel<>(Stage.RENAME.workerKind(), launcher,
                Result.class, grace, sinkFor(Stage.RENAME, events)));
    }

    /** Início de um ciclo de download; lança o worker se necessário. */
    public void downloadStarted(int deviceId, DownloadStarted settings) {
        channel.start(deviceId, settings);
    }

    public boolean renameFile(int deviceId, RenameFile request) {
        return channel.send(deviceId, request);
    }

    /**
     * Fim do ciclo: o worker responde com os contadores de sequência.
     *
     * @return false se o worker não está vivo (não haverá resposta)
     */
    public boolean downloadCompleted() {
        return channel.send(null, new DownloadCompleted());
    }
}
