package com.example.mediaagent.stage;

import com.example.mediaagent.device.Device;
import com.example.mediaagent.stage.ScanMessages.Request;
import com.example.mediaagent.stage.ScanMessages.ResumeScan;
import com.example.mediaagent.stage.ScanMessages.Result;
import com.example.mediaagent.stage.ScanMessages.ScanArguments;
import com.example.mediaagent.worker.PooledWorkerChannel;
import com.example.mediaagent.worker.WorkerChannel;
import com.example.mediaagent.worker.WorkerLauncher;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Um worker de scan por dispositivo.
 */
public final class ScanManager extends StageManager<Request, Result> {

    static final int BATCH_SIZE = 50;

    public ScanManager(WorkerChannel<Request, Result> channel) {
        super(Stage.SCAN, channel);
    }

    public static ScanManager create(WorkerLauncher launcher, Duration grace, Consumer<PipelineEvent> events) {
        return new ScanManager(new PooledWorkerChannel<>(Stage.SCAN.workerKind(), launcher, Result.class,
                grace, sinkFor(Stage.SCAN, events)));
    }

    public void startScan(Device device, String root, List<String> ignoredPaths) {
        channel.start(device.id(), new ScanArguments(device.id(), device.descriptor(), root, ignoredPaths, BATCH_SIZE));
    }

    /**
     * Repete o scan no mesmo worker, que ficou aguardando após o erro.
     *
     * @return false se o worker já não existe
     */
    public boolean retry(int deviceId) {
        return channel.send(deviceId, new ResumeScan());
    }
}
