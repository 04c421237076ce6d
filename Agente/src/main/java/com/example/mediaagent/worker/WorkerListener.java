package com.example.mediaagent.worker;

/**
 * Callbacks do lançador para o canal, chamados em threads de I/O.
 */
public interface WorkerListener<R> {

    void onMessage(Integer deviceId, R result);

    /**
     * Chamado uma única vez quando o worker termina.
     *
     * @param abnormal saída por exceção, interrupção ou código != 0
     */
    void onExit(boolean abnormal);
}
