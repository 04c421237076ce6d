package com.example.mediaagent.worker;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base comum dos canais: registro de workers por chave, STOP com encerramento forçado
 * agendado e tradução dos callbacks do lançador em {@link WorkerEvent}.
 */
abstract class AbstractWorkerChannel<Q extends WorkerMessage, R extends WorkerMessage> implements WorkerChannel<Q, R> {

    private static final Logger log = LoggerFactory.getLogger(AbstractWorkerChannel.class);

    protected final String kind;
    protected final WorkerLauncher launcher;
    protected final Class<R> resultType;
    protected final WorkerSink<R> sink;
    private final Duration gracePeriod;
    protected final Map<Integer, WorkerHandle<Q>> handles = new ConcurrentHashMap<>();
    private final Set<Integer> stopping = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService reaper;

    AbstractWorkerChannel(String kind, WorkerLauncher launcher, Class<R> resultType,
                          Duration gracePeriod, WorkerSink<R> sink) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.resultType = Objects.requireNonNull(resultType, "resultType");
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.reaper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, kind + "-reaper");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Lança um worker registrado sob {@code key}. Falha de lançamento vira FINISHED inesperado.
     *
     * @param tagResults quando true, resultados sem dispositivo recebem {@code key}
     */
    protected WorkerHandle<Q> launch(int key, String name, boolean tagResults) {
        AtomicReference<WorkerHandle<Q>> self = new AtomicReference<>();
        AtomicBoolean exited = new AtomicBoolean();
        WorkerListener<R> listener = new WorkerListener<>() {
            @Override
            public void onMessage(Integer deviceId, R result) {
                Integer tag = deviceId == null && tagResults ? Integer.valueOf(key) : deviceId;
                sink.accept(WorkerEvent.result(tag, result));
            }

            @Override
            public void onExit(boolean abnormal) {
                exited.set(true);
                WorkerHandle<Q> handle = self.get();
                if (handle != null) {
                    handles.remove(key, handle);
                }
                boolean requested = stopping.remove(key);
                boolean unexpected = abnormal && !requested;
                if (unexpected) {
                    log.warn("Worker {} terminou inesperadamente", name);
                }
                sink.accept(WorkerEvent.finished(finishedKey(key), unexpected));
            }
        };
        try {
            WorkerHandle<Q> handle = launcher.launch(kind, name, resultType, listener);
            self.set(handle);
            handles.put(key, handle);
            if (exited.get()) {
                handles.remove(key, handle);
            }
            return handle;
        } catch (IOException e) {
            log.error("Falha ao iniciar worker {}: {}", name, e.getMessage());
            sink.accept(WorkerEvent.finished(finishedKey(key), true));
            return null;
        }
    }

    /** Dispositivo informado no FINISHED de um worker registrado sob {@code key}. */
    protected abstract Integer finishedKey(int key);

    protected boolean submit(int key, Integer deviceId, Q request) {
        WorkerHandle<Q> handle = handles.get(key);
        if (handle == null || !handle.isAlive()) {
            log.warn("Worker {} indisponivel; requisicao descartada", kind + "-" + key);
            return false;
        }
        try {
            handle.submit(deviceId, request);
            return true;
        } catch (IOException e) {
            log.warn("Falha ao enviar requisicao ao worker {}-{}: {}", kind, key, e.getMessage());
            return false;
        }
    }

    protected boolean sendControl(int key, WorkerControl control) {
        WorkerHandle<Q> handle = handles.get(key);
        if (handle == null) {
            return false;
        }
        try {
            handle.control(control);
            return true;
        } catch (IOException e) {
            log.warn("Falha ao enviar {} ao worker {}-{}: {}", control, kind, key, e.getMessage());
            return false;
        }
    }

    protected void stopKey(int key) {
        WorkerHandle<Q> handle = handles.get(key);
        if (handle == null) {
            return;
        }
        stopping.add(key);
        sendControl(key, WorkerControl.STOP);
        reaper.schedule(() -> {
            if (handles.get(key) == handle && handle.isAlive()) {
                log.warn("Worker {}-{} nao encerrou em {} ms; forcando", kind, key, gracePeriod.toMillis());
                handle.destroy();
            }
        }, gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void stopAll() {
        for (Integer key : Set.copyOf(handles.keySet())) {
            stopKey(key);
        }
    }

    @Override
    public void forceTerminate() {
        for (Map.Entry<Integer, WorkerHandle<Q>> e : Map.copyOf(handles).entrySet()) {
            if (e.getValue().isAlive()) {
                stopping.add(e.getKey());
                e.getValue().destroy();
            }
        }
    }

    @Override
    public void shutdown() {
        stopAll();
        long deadline = System.nanoTime() + gracePeriod.toNanos();
        for (WorkerHandle<Q> handle : Map.copyOf(handles).values()) {
            long remaining = Math.max(1, deadline - System.nanoTime());
            try {
                handle.awaitExit(Duration.ofNanos(remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        forceTerminate();
        reaper.shutdownNow();
    }

    @Override
    public Duration gracePeriod() {
        return gracePeriod;
    }
}
