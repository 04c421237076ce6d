package com.example.mediaagent.worker;

import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executa cada worker numa thread daemon da própria JVM.
 *
 * Usado em testes e quando WORKER_MODE=thread. Os payloads são entregues sem serialização.
 */
public final class ThreadWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(ThreadWorkerLauncher.class);

    private final WorkerFactory factory;

    public ThreadWorkerLauncher(WorkerFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    @SuppressWarnings("unchecked")
    public <Q extends WorkerMessage, R extends WorkerMessage> WorkerHandle<Q> launch(
            String kind, String name, Class<R> resultType, WorkerListener<R> listener) {
        StageWorker<Q, R> worker = (StageWorker<Q, R>) factory.create(kind);
        WorkerRuntime<Q, R> runtime = new WorkerRuntime<>(worker,
                (deviceId, result) -> listener.onMessage(deviceId, resultType.cast(result)));
        Thread thread = new Thread(() -> {
            boolean abnormal = true;
            try {
                runtime.run();
                abnormal = false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Worker {} interrompido", name);
            } catch (Exception e) {
                log.error("Worker {} falhou: {}", name, e.getMessage(), e);
            } finally {
                listener.onExit(abnormal);
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return new ThreadHandle<>(thread, runtime);
    }

    private static final class ThreadHandle<Q extends WorkerMessage> implements WorkerHandle<Q> {
        private final Thread thread;
        private final WorkerRuntime<Q, ?> runtime;

        ThreadHandle(Thread thread, WorkerRuntime<Q, ?> runtime) {
            this.thread = thread;
            this.runtime = runtime;
        }

        @Override
        public void submit(Integer deviceId, Q request) {
            runtime.deliver(WorkerEnvelope.request(deviceId, request));
        }

        @Override
        public void control(WorkerControl control) {
            runtime.deliver(WorkerEnvelope.control(control));
        }

        @Override
        public boolean isAlive() {
            return thread.isAlive();
        }

        @Override
        public boolean awaitExit(Duration timeout) throws InterruptedException {
            thread.join(Math.max(1, timeout.toMillis()));
            return !thread.isAlive();
        }

        @Override
        public void destroy() {
            thread.interrupt();
        }
    }
}
