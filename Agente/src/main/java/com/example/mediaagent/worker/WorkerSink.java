package com.example.mediaagent.worker;

/**
 * Recebe os eventos de um canal. Chamado nas threads de I/O do canal;
 * implementações repassam para o loop de eventos do orquestrador.
 */
@FunctionalInterface
public interface WorkerSink<R> {

    void accept(WorkerEvent<R> event);
}
