package com.example.mediaagent.worker;

/**
 * Cria a lógica de um estágio a partir do seu nome (ex.: "scan", "copy").
 */
@FunctionalInterface
public interface WorkerFactory {

    StageWorker<?, ?> create(String kind);
}
