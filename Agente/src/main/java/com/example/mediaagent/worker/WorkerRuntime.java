package com.example.mediaagent.worker;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Loop do lado do worker: consome requisições da fila e aplica controles
 * (STOP/PAUSE/RESUME) imediatamente, mesmo durante uma requisição longa.
 *
 * Compartilhado pelo modo thread e pelo processo filho.
 */
public final class WorkerRuntime<Q extends WorkerMessage, R extends WorkerMessage> implements WorkerContext<R> {

    /** Destino dos resultados. */
    @FunctionalInterface
    public interface Output<R> {
        void emit(Integer deviceId, R result);
    }

    private final StageWorker<Q, R> worker;
    private final Output<R> output;
    private final BlockingQueue<WorkerEnvelope> inbox = new LinkedBlockingQueue<>();
    private final Object pauseLock = new Object();
    private volatile boolean stopRequested;
    private volatile boolean paused;
    private volatile boolean finished;

    public WorkerRuntime(StageWorker<Q, R> worker, Output<R> output) {
        this.worker = Objects.requireNonNull(worker, "worker");
        this.output = Objects.requireNonNull(output, "output");
    }

    /**
     * Entrega uma mensagem vinda do orquestrador. Thread-safe.
     */
    public void deliver(WorkerEnvelope envelope) {
        if (envelope.kind() == WorkerEnvelope.Kind.CONTROL) {
            apply(envelope.control());
            if (envelope.control() == WorkerControl.STOP) {
                inbox.add(envelope);
            }
        } else if (envelope.kind() == WorkerEnvelope.Kind.REQUEST) {
            inbox.add(envelope);
        }
    }

    private void apply(WorkerControl control) {
        synchronized (pauseLock) {
            switch (control) {
                case STOP:
                    stopRequested = true;
                    break;
                case PAUSE:
                    paused = true;
                    break;
                case RESUME:
                    paused = false;
                    break;
                default:
                    throw new IllegalArgumentException("Controle desconhecido: " + control);
            }
            pauseLock.notifyAll();
        }
    }

    /**
     * Executa até STOP ou {@link #finish()}. Exceções do worker propagam.
     */
    @SuppressWarnings("unchecked")
    public void run() throws Exception {
        while (!stopRequested && !finished) {
            WorkerEnvelope envelope = inbox.take();
            if (envelope.kind() != WorkerEnvelope.Kind.REQUEST || stopRequested) {
                continue;
            }
            worker.handle(envelope.deviceId(), (Q) envelope.payload(), this);
        }
    }

    @Override
    public void emit(Integer deviceId, R result) {
        output.emit(deviceId, result);
    }

    @Override
    public boolean stopRequested() {
        return stopRequested;
    }

    @Override
    public boolean pausePoint() throws InterruptedException {
        synchronized (pauseLock) {
            while (paused && !stopRequested) {
                pauseLock.wait();
            }
        }
        return !stopRequested;
    }

    @Override
    public void finish() {
        finished = true;
    }
}
