package com.example.mediaagent.stage;

import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.stage.CopyMessages.CopyFilesArguments;
import com.example.mediaagent.stage.CopyMessages.Request;
import com.example.mediaagent.stage.CopyMessages.Result;
import com.example.mediaagent.worker.PooledWorkerChannel;
import com.example.mediaagent.worker.WorkerChannel;
import com.example.mediaagent.worker.WorkerControl;
import com.example.mediaagent.worker.WorkerLauncher;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Um worker de cópia por dispositivo, encerrado ao fim da cópia.
 */
public final class CopyFilesManager extends StageManager<Request, Result> {

    public CopyFilesManager(WorkerChannel<Request, Result> channel) {
        super(Stage.COPY, channel);
    }

    public static CopyFilesManager create(WorkerLauncher launcher, Duration grace, Consumer<PipelineEvent> events) {
        return new CopyFilesManager(new PooledWorkerChannel<>(Stage.COPY.workerKind(), launcher, Result.class,
                grace, sinkFor(Stage.COPY, events)));
    }

    public void startCopy(int deviceId, List<MediaFileData> files, Map<FileType, String> downloadFolders,
                          boolean verify, String hashAlgorithm, int chunkSize) {
        channel.start(deviceId, new CopyFilesArguments(deviceId, files, downloadFolders, verify, hashAlgorithm, chunkSize));
    }

    public void pause() {
        channel.control(null, WorkerControl.PAUSE);
    }

    public void resume() {
        channel.control(null, WorkerControl.RESUME);
    }
}
