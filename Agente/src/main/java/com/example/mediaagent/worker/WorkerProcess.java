package com.example.mediaagent.worker;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lado filho do protocolo de {@link ProcessWorkerLauncher}.
 *
 * Lê envelopes do stdin numa thread daemon e executa o {@link WorkerRuntime} na thread atual.
 * Fim do stdin (pai encerrou) equivale a STOP.
 */
public final class WorkerProcess {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcess.class);

    private final MessageCodec codec = new MessageCodec();
    private final String name;

    public WorkerProcess(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * @return código de saída do processo (0 em término normal)
     */
    public <Q extends WorkerMessage, R extends WorkerMessage> int run(StageWorker<Q, R> worker,
                                                                    InputStream in,
                                                                    PrintStream out) {
        WorkerRuntime<Q, R> runtime = new WorkerRuntime<>(worker, (deviceId, result) -> {
            try {
                String line = codec.encode(WorkerEnvelope.result(deviceId, result));
                synchronized (out) {
                    out.println(line);
                    out.flush();
                }
            } catch (IOException e) {
                throw new IllegalStateException("Falha ao serializar resultado", e);
            }
        });

        Thread reader = new Thread(() -> readLoop(in, runtime), name + "-stdin");
        reader.setDaemon(true);
        reader.start();

        try {
            runtime.run();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 2;
        } catch (Exception e) {
            log.error("Worker {} falhou: {}", name, e.getMessage(), e);
            return 1;
        }
    }

    private void readLoop(InputStream in, WorkerRuntime<?, ?> runtime) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    runtime.deliver(codec.decode(line));
                } catch (IOException e) {
                    log.warn("Mensagem invalida recebida pelo worker {}: {}", name, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.debug("stdin do worker {} encerrado: {}", name, e.getMessage());
        }
        runtime.deliver(WorkerEnvelope.control(WorkerControl.STOP));
    }
}
