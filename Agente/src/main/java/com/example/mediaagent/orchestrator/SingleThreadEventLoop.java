package com.example.mediaagent.orchestrator;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventLoop} sobre um {@code ScheduledExecutorService} de uma thread.
 *
 * Exceções de uma tarefa são registradas e não derrubam o loop; tarefas submetidas
 * depois do fechamento são descartadas.
 */
public final class SingleThreadEventLoop implements EventLoop {

    private static final Logger log = LoggerFactory.getLogger(SingleThreadEventLoop.class);

    private final ScheduledExecutorService executor;

    public SingleThreadEventLoop(String name) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Loop encerrado; tarefa descartada");
        }
    }

    @Override
    public void schedule(Runnable task, Duration delay) {
        try {
            executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Loop encerrado; agendamento descartado");
        }
    }

    @Override
    public void scheduleAtFixedRate(Runnable task, Duration period) {
        try {
            executor.scheduleAtFixedRate(guarded(task), period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Loop encerrado; agendamento descartado");
        }
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Erro no loop do orquestrador: {}", e.getMessage(), e);
            }
        };
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
