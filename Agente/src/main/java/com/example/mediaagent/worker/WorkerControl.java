package com.example.mediaagent.worker;

/**
 * Comandos de controle aplicados ao worker fora da fila de requisições.
 */
public enum WorkerControl {
    STOP,
    PAUSE,
    RESUME
}
