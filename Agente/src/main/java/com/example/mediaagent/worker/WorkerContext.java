package com.example.mediaagent.worker;

/**
 * O que um {@link StageWorker} enxerga do seu ambiente de execução.
 */
public interface WorkerContext<R extends WorkerMessage> {

    /** Envia um resultado ao orquestrador. */
    void emit(Integer deviceId, R result);

    /** STOP recebido: o worker deve encerrar o trabalho atual o quanto antes. */
    boolean stopRequested();

    /**
     * Bloqueia enquanto o worker estiver em pausa.
     *
     * @return false se um STOP chegou (durante ou antes da pausa)
     */
    boolean pausePoint() throws InterruptedException;

    /** Marca o trabalho como concluído; o worker sai após a requisição atual. */
    void finish();
}
