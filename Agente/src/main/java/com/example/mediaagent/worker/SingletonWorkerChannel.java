package com.example.mediaagent.worker;

import java.time.Duration;
import java.util.Set;

/**
 * Um único worker para todos os dispositivos, vivo durante toda a sessão.
 * Requisições são serializadas pelo worker e marcadas com o dispositivo de origem.
 * Usado por renomear/mover e pelo agrupamento por proximidade temporal.
 */
public final class SingletonWorkerChannel<Q extends WorkerMessage, R extends WorkerMessage> extends AbstractWorkerChannel<Q, R> {

    private static final int KEY = 0;

    public SingletonWorkerChannel(String kind, WorkerLauncher launcher, Class<R> resultType,
                                  Duration gracePeriod, WorkerSink<R> sink) {
        super(kind, launcher, resultType, gracePeriod, sink);
    }

    /**
     * Lança o worker se ainda não estiver vivo. Um worker que morreu não é relançado
     * automaticamente; esta chamada explícita é o único caminho.
     */
    public synchronized boolean launch() {
        if (handles.containsKey(KEY)) {
            return true;
        }
        return launch(KEY, kind, false) != null;
    }

    @Override
    public void start(int deviceId, Q request) {
        if (launch()) {
            submit(KEY, deviceId, request);
        }
    }

    @Override
    public boolean send(Integer deviceId, Q request) {
        return submit(KEY, deviceId, request);
    }

    @Override
    public boolean control(Integer deviceId, WorkerControl control) {
        return sendControl(KEY, control);
    }

    /** O worker é compartilhado: parar um dispositivo não encerra o worker. */
    @Override
    public void stop(int deviceId) {
        // nada a fazer
    }

    @Override
    public boolean isRunning(int deviceId) {
        return handles.containsKey(KEY);
    }

    public boolean isRunning() {
        return handles.containsKey(KEY);
    }

    @Override
    public Set<Integer> running() {
        return handles.containsKey(KEY) ? Set.of(KEY) : Set.of();
    }

    @Override
    protected Integer finishedKey(int key) {
        return null;
    }
}
