package com.example.mediaagent.worker;

import java.io.IOException;

/**
 * Estratégia de execução dos workers: processo filho ou thread.
 */
public interface WorkerLauncher {

    <Q extends WorkerMessage, R extends WorkerMessage> WorkerHandle<Q> launch(
            String kind, String name, Class<R> resultType, WorkerListener<R> listener) throws IOException;
}
