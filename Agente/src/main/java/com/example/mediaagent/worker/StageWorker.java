package com.example.mediaagent.worker;

import java.io.IOException;

/**
 * Lógica de um estágio, executada dentro do worker (thread ou processo filho).
 *
 * Falhas por arquivo devem virar resultados; exceções propagadas encerram o worker
 * e são reportadas ao orquestrador como término inesperado.
 */
public interface StageWorker<Q extends WorkerMessage, R extends WorkerMessage> {

    void handle(Integer deviceId, Q request, WorkerContext<R> context) throws IOException, InterruptedException;
}
