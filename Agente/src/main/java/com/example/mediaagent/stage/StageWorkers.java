package com.example.mediaagent.stage;

import com.example.mediaagent.worker.StageWorker;
import com.example.mediaagent.worker.WorkerFactory;

/**
 * Fábrica dos workers de cada estágio, usada pelos dois modos de execução.
 */
public final class StageWorkers implements WorkerFactory {

    @Override
    public StageWorker<?, ?> create(String kind) {
        switch (Stage.fromWorkerKind(kind)) {
            case SCAN:
                return new ScanWorker();
            case COPY:
                return new CopyFilesWorker();
            case RENAME:
                return new RenameMoveFileWorker();
            case BACKUP:
                return new BackupFileWorker();
            case OFFLOAD:
                return new OffloadWorker();
            default:
                throw new IllegalArgumentException("Estagio sem worker: " + kind);
        }
    }
}
