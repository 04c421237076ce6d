package com.example.mediaagent.worker;

import java.time.Duration;
import java.util.Set;

/**
 * Um worker por dispositivo, criado sob demanda e encerrado quando o trabalho termina.
 * Usado por scan, cópia e backup (neste, a chave é o destino de backup).
 */
public final class PooledWorkerChannel<Q extends WorkerMessage, R extends WorkerMessage> extends AbstractWorkerChannel<Q, R> {

    public PooledWorkerChannel(String kind, WorkerLauncher launcher, Class<R> resultType,
                               Duration gracePeriod, WorkerSink<R> sink) {
        super(kind, launcher, resultType, gracePeriod, sink);
    }

    @Override
    public void start(int deviceId, Q request) {
        if (!handles.containsKey(deviceId)) {
            if (launch(deviceId, kind + "-" + deviceId, true) == null) {
                return;
            }
        }
        submit(deviceId, deviceId, request);
    }

    @Override
    public boolean send(Integer deviceId, Q request) {
        if (deviceId == null) {
            throw new IllegalArgumentException("Canal pooled exige o dispositivo");
        }
        return submit(deviceId, deviceId, request);
    }

    @Override
    public boolean control(Integer deviceId, WorkerControl control) {
        if (deviceId == null) {
            boolean any = false;
            for (Integer key : Set.copyOf(handles.keySet())) {
                any |= sendControl(key, control);
            }
            return any;
        }
        return sendControl(deviceId, control);
    }

    @Override
    public void stop(int deviceId) {
        stopKey(deviceId);
    }

    @Override
    public boolean isRunning(int deviceId) {
        return handles.containsKey(deviceId);
    }

    @Override
    public Set<Integer> running() {
        return Set.copyOf(handles.keySet());
    }

    @Override
    protected Integer finishedKey(int key) {
        return key;
    }
}
