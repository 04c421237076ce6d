package com.example.mediaagent.stage;

import com.example.mediaagent.stage.OffloadMessages.AssignProximityGroups;
import com.example.mediaagent.stage.OffloadMessages.Request;
import com.example.mediaagent.stage.OffloadMessages.Result;
import com.example.mediaagent.stage.OffloadMessages.TimedFile;
import com.example.mediaagent.worker.SingletonWorkerChannel;
import com.example.mediaagent.worker.WorkerChannel;
import com.example.mediaagent.worker.WorkerLauncher;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Worker único para o cálculo de proximidade temporal.
 */
public final class OffloadManager extends StageManager<Request, Result> {

    /** Chave das requisições da sessão inteira; ids de dispositivo começam em 1. */
    static final int SESSION = 0;

    public OffloadManager(WorkerChannel<Request, Result> channel) {
        super(Stage.OFFLOAD, channel);
    }

    public static OffloadManager create(WorkerLauncher launcher, Duration grace, Consumer<PipelineEvent> events) {
        return new OffloadManager(new SingletonWorkerChannel<>(Stage.OFFLOAD.workerKind(), launcher,
                Result.class, grace, sinkFor(Stage.OFFLOAD, events)));
    }

    public void assignProximityGroups(List<TimedFile> files, long gapSeconds) {
        channel.start(SESSION, new AssignProximityGroups(files, gapSeconds));
    }
}
