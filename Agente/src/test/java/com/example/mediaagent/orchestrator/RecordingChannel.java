package com.example.mediaagent.orchestrator;

import com.example.mediaagent.worker.WorkerChannel;
import com.example.mediaagent.worker.WorkerControl;
import com.example.mediaagent.worker.WorkerMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Canal sem workers: guarda as requisições para o teste inspecionar. Os resultados
 * são injetados direto em {@link DownloadOrchestrator#dispatch}.
 */
final class RecordingChannel<Q extends WorkerMessage, R extends WorkerMessage> implements WorkerChannel<Q, R> {

    final List<Integer> started = new ArrayList<>();
    final List<Q> requests = new ArrayList<>();
    final List<WorkerControl> controls = new ArrayList<>();
    final List<Integer> stopped = new ArrayList<>();
    final Set<Integer> running = new LinkedHashSet<>();
    boolean accepting = true;
    boolean shutDown;

    @Override
    public void start(int deviceId, Q request) {
        started.add(deviceId);
        running.add(deviceId);
        requests.add(request);
    }

    @Override
    public boolean send(Integer deviceId, Q request) {
        if (!accepting) {
            return false;
        }
        requests.add(request);
        return true;
    }

    @Override
    public boolean control(Integer deviceId, WorkerControl control) {
        controls.add(control);
        return true;
    }

    @Override
    public void stop(int deviceId) {
        stopped.add(deviceId);
        running.remove(deviceId);
    }

    @Override
    public void stopAll() {
        running.clear();
    }

    @Override
    public void forceTerminate() {
    }

    @Override
    public boolean isRunning(int deviceId) {
        return running.contains(deviceId);
    }

    @Override
    public Set<Integer> running() {
        return Set.copyOf(running);
    }

    @Override
    public Duration gracePeriod() {
        return Duration.ZERO;
    }

    @Override
    public void shutdown() {
        shutDown = true;
        running.clear();
    }

    <T extends Q> List<T> of(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Q q : requests) {
            if (type.isInstance(q)) {
                out.add(type.cast(q));
            }
        }
        return out;
    }
}
