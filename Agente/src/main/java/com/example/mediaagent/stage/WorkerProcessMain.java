package com.example.mediaagent.stage;

import com.example.mediaagent.worker.StageWorker;
import com.example.mediaagent.worker.WorkerProcess;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Ponto de entrada da JVM filha de um worker.
 *
 * Uso: {@code WorkerProcessMain <estagio> <nome>}. O stdout é reservado ao protocolo;
 * qualquer escrita acidental em System.out é desviada para o stderr.
 */
public final class WorkerProcessMain {

    private static final Logger LOGGER = Logger.getLogger(WorkerProcessMain.class.getName());

    private WorkerProcessMain() {}

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("uso: WorkerProcessMain <scan|copy|rename|backup|offload> [nome]");
            System.exit(64);
        }
        configureLogging();
        String kind = args[0];
        String name = args.length > 1 ? args[1] : kind;

        PrintStream protocol = System.out;
        System.setOut(System.err);

        StageWorker<?, ?> worker = new StageWorkers().create(kind);
        LOGGER.fine(() -> "Worker " + name + " iniciado");
        int code = new WorkerProcess(name).run(worker, System.in, protocol);
        protocol.flush();
        System.exit(code);
    }

    private static void configureLogging() {
        try (InputStream in = WorkerProcessMain.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Falha ao carregar logging.properties: " + e.getMessage());
        }
    }
}
