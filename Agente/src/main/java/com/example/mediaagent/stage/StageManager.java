package com.example.mediaagent.stage;

import com.example.mediaagent.worker.WorkerChannel;
import com.example.mediaagent.worker.WorkerMessage;
import com.example.mediaagent.worker.WorkerSink;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Base dos gerenciadores de estágio: guarda o canal e converte os eventos do canal
 * em {@link PipelineEvent} para o orquestrador.
 */
public abstract class StageManager<Q extends WorkerMessage, R extends WorkerMessage> implements AutoCloseable {

    protected final Stage stage;
    protected final WorkerChannel<Q, R> channel;

    protected StageManager(Stage stage, WorkerChannel<Q, R> channel) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    static <R extends WorkerMessage> WorkerSink<R> sinkFor(Stage stage, Consumer<PipelineEvent> events) {
        return event -> events.accept(PipelineEvent.from(stage, event));
    }

    public Stage stage() {
        return stage;
    }

    public boolean isRunning(int key) {
        return channel.isRunning(key);
    }

    public Set<Integer> running() {
        return channel.running();
    }

    public void stop(int key) {
        channel.stop(key);
    }

    public void stopAll() {
        channel.stopAll();
    }

    public void forceTerminate() {
        channel.forceTerminate();
    }

    /** Bloqueia até o período de tolerância do estágio. */
    public void shutdown() {
        channel.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }
}
