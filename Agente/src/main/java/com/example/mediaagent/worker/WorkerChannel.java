package com.example.mediaagent.worker;

import java.time.Duration;
import java.util.Set;

/**
 * Canal assíncrono e bidirecional com workers de um estágio.
 *
 * Resultados chegam fora de ordem entre dispositivos e são entregues ao sink do canal
 * sem reordenação. O fim de cada worker é reportado uma única vez como
 * {@link WorkerEvent.Kind#FINISHED}; um worker que morre não é relançado.
 *
 * Duas estratégias: {@link PooledWorkerChannel} (um worker por dispositivo)
 * e {@link SingletonWorkerChannel} (um worker para todos os dispositivos).
 */
public interface WorkerChannel<Q extends WorkerMessage, R extends WorkerMessage> extends AutoCloseable {

    /** Inicia (ou seleciona) o worker do dispositivo e enfileira a requisição. */
    void start(int deviceId, Q request);

    /**
     * Enfileira uma requisição para um worker já iniciado.
     *
     * @param deviceId dispositivo; pode ser null em canais singleton
     * @return false se não há worker vivo para receber
     */
    boolean send(Integer deviceId, Q request);

    /** Envia PAUSE/RESUME (ou STOP) a um worker. */
    boolean control(Integer deviceId, WorkerControl control);

    /** Pede o encerramento de um worker; força após o período de tolerância. */
    void stop(int deviceId);

    void stopAll();

    /** Mata imediatamente todo worker ainda vivo. */
    void forceTerminate();

    boolean isRunning(int deviceId);

    Set<Integer> running();

    Duration gracePeriod();

    /**
     * Para todos, espera até o período de tolerância e força o que restar.
     * Bloqueante; usado no encerramento do agente.
     */
    default void shutdown() {
        stopAll();
        forceTerminate();
    }

    @Override
    default void close() {
        shutdown();
    }
}
