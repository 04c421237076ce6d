package com.example.mediaagent.worker;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executa cada worker numa JVM filha.
 *
 * Protocolo: uma linha JSON por {@link WorkerEnvelope} no stdin (requisições/controles)
 * e no stdout (resultados). O stderr do filho é herdado, então os logs do worker
 * aparecem junto dos logs do agente.
 */
public final class ProcessWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    private final String mainClass;
    private final List<String> jvmOptions;
    private final MessageCodec codec;

    public ProcessWorkerLauncher(String mainClass, List<String> jvmOptions) {
        this.mainClass = Objects.requireNonNull(mainClass, "mainClass");
        this.jvmOptions = List.copyOf(jvmOptions);
        this.codec = new MessageCodec();
    }

    @Override
    public <Q extends WorkerMessage, R extends WorkerMessage> WorkerHandle<Q> launch(
            String kind, String name, Class<R> resultType, WorkerListener<R> listener) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(mainClass);
        command.add(kind);
        command.add(name);

        Process process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        log.debug("Worker {} iniciado (pid={})", name, process.pid());

        ProcessHandleImpl<Q> handle = new ProcessHandleImpl<>(process, codec);
        Thread reader = new Thread(() -> readLoop(process, name, resultType, listener), name + "-reader");
        reader.setDaemon(true);
        reader.start();
        return handle;
    }

    private <R> void readLoop(Process process, String name, Class<R> resultType, WorkerListener<R> listener) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                WorkerEnvelope envelope;
                try {
                    envelope = codec.decode(line);
                } catch (IOException e) {
                    log.warn("Linha invalida do worker {}: {}", name, e.getMessage());
                    continue;
                }
                if (envelope.kind() == WorkerEnvelope.Kind.RESULT && envelope.payload() != null) {
                    listener.onMessage(envelope.deviceId(), resultType.cast(envelope.payload()));
                }
            }
        } catch (IOException e) {
            log.debug("Leitura do worker {} encerrada: {}", name, e.getMessage());
        }

        boolean abnormal;
        try {
            int code = process.waitFor();
            abnormal = code != 0;
            if (abnormal) {
                log.warn("Worker {} terminou com codigo {}", name, code);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abnormal = true;
        }
        listener.onExit(abnormal);
    }

    private static final class ProcessHandleImpl<Q extends WorkerMessage> implements WorkerHandle<Q> {
        private final Process process;
        private final MessageCodec codec;
        private final BufferedWriter writer;

        ProcessHandleImpl(Process process, MessageCodec codec) {
            this.process = process;
            this.codec = codec;
            this.writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        }

        @Override
        public void submit(Integer deviceId, Q request) throws IOException {
            write(WorkerEnvelope.request(deviceId, request));
        }

        @Override
        public void control(WorkerControl control) throws IOException {
            write(WorkerEnvelope.control(control));
        }

        private synchronized void write(WorkerEnvelope envelope) throws IOException {
            writer.write(codec.encode(envelope));
            writer.newLine();
            writer.flush();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public boolean awaitExit(Duration timeout) throws InterruptedException {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public void destroy() {
            process.destroyForcibly();
        }
    }
}
