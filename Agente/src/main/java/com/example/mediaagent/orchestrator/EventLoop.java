package com.example.mediaagent.orchestrator;

import java.time.Duration;

/**
 * Loop de thread única que detém todo o estado do orquestrador.
 * Qualquer alteração de estado é submetida por {@link #execute}.
 */
public interface EventLoop extends AutoCloseable {

    void execute(Runnable task);

    void schedule(Runnable task, Duration delay);

    void scheduleAtFixedRate(Runnable task, Duration period);

    @Override
    void close();
}
