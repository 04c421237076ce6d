package com.example.mediaagent.worker;

import java.io.IOException;
import java.time.Duration;

/**
 * Referência a um worker em execução.
 */
public interface WorkerHandle<Q extends WorkerMessage> {

    void submit(Integer deviceId, Q request) throws IOException;

    void control(WorkerControl control) throws IOException;

    boolean isAlive();

    /** @return true se o worker terminou dentro do prazo */
    boolean awaitExit(Duration timeout) throws InterruptedException;

    /** Encerramento forçado. */
    void destroy();
}
