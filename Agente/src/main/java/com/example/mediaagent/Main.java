package com.example.mediaagent;

import com.example.mediaagent.config.AppConfig;
import com.example.mediaagent.config.DownloadSettings;
import com.example.mediaagent.config.JsonPreferencesStore;
import com.example.mediaagent.device.DeviceDescriptor;
import com.example.mediaagent.device.DeviceMonitor;
import com.example.mediaagent.orchestrator.DownloadOrchestrator;
import com.example.mediaagent.orchestrator.LoggingPresentationListener;
import com.example.mediaagent.orchestrator.SingleThreadEventLoop;
import com.example.mediaagent.stage.ScanMessages.ScanErrorCode;
import com.example.mediaagent.stage.Stage;
import com.example.mediaagent.stage.StageManagers;
import com.example.mediaagent.stage.StageWorkers;
import com.example.mediaagent.stage.WorkerProcessMain;
import com.example.mediaagent.worker.ProcessWorkerLauncher;
import com.example.mediaagent.worker.ThreadWorkerLauncher;
import com.example.mediaagent.worker.WorkerLauncher;
import java.io.Console;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entrada headless do agente de ingestão. Cada argumento é uma pasta ou volume de origem;
 * THIS_COMPUTER_PATH entra como origem local.
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        new Main().run(args);
    }

    public void run(String[] args) throws Exception {
        configureLogging();
        AppConfig config = AppConfig.load();
        Logger.getLogger("com.example.mediaagent").setLevel(julLevel(config.logLevel()));

        DownloadSettings settings = DownloadSettings.from(config);
        JsonPreferencesStore preferences = JsonPreferencesStore.open(config.stateFile());

        WorkerLauncher launcher = "thread".equals(config.workerMode())
                ? new ThreadWorkerLauncher(new StageWorkers())
                : new ProcessWorkerLauncher(WorkerProcessMain.class.getName(), List.of());

        Map<Stage, Duration> graces = new EnumMap<>(Stage.class);
        graces.put(Stage.SCAN, config.scanGracePeriod());
        graces.put(Stage.COPY, config.copyGracePeriod());
        graces.put(Stage.RENAME, config.renameGracePeriod());
        graces.put(Stage.BACKUP, config.backupGracePeriod());
        graces.put(Stage.OFFLOAD, config.offloadGracePeriod());

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<DownloadOrchestrator> ref = new AtomicReference<>();
        SingleThreadEventLoop loop = new SingleThreadEventLoop("orchestrator");
        ExecutorService housekeeping = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "housekeeping");
            t.setDaemon(true);
            return t;
        });

        DownloadOrchestrator orchestrator = new DownloadOrchestrator(
                settings,
                preferences,
                events -> StageManagers.create(launcher, graces, events),
                DeviceMonitor.none(),
                new HeadlessListener(ref, latch),
                loop,
                housekeeping);
        ref.set(orchestrator);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            orchestrator.shutdown();
            try {
                latch.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            loop.close();
            housekeeping.shutdown();
        }));

        orchestrator.start();
        for (String arg : args) {
            Path source = Path.of(arg).toAbsolutePath().normalize();
            if (!Files.isDirectory(source)) {
                LOGGER.warning(() -> "Origem ignorada (nao e diretorio): " + source);
                continue;
            }
            orchestrator.deviceAdded(DeviceDescriptor.volume(source.toString(), null, List.of(), false));
        }
        if (settings.autoDownloadAtStartup() || settings.autoDownloadUponDeviceInsertion()) {
            LOGGER.info("Download automatico habilitado");
        } else {
            LOGGER.info("Defina AUTO_DOWNLOAD_AT_STARTUP ou AUTO_DOWNLOAD_UPON_DEVICE_INSERTION para baixar sem interacao");
        }

        LOGGER.info("Agente de ingestao iniciado.");
        latch.await();
        loop.close();
        housekeeping.shutdown();
    }

    /** Aceita os nomes do slf4j (DEBUG, TRACE) além dos do JUL. */
    static Level julLevel(String name) {
        switch (name) {
            case "TRACE":
                return Level.FINEST;
            case "DEBUG":
                return Level.FINE;
            case "WARN":
                return Level.WARNING;
            case "ERROR":
                return Level.SEVERE;
            default:
                try {
                    return Level.parse(name);
                } catch (IllegalArgumentException e) {
                    LOGGER.warning(() -> "AGENT_LOG_LEVEL invalido: " + name + "; usando INFO");
                    return Level.INFO;
                }
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Falha ao carregar logging.properties: " + e.getMessage());
        }
    }

    /**
     * Apresentação do terminal: logs, código de trabalho lido do console e erros de
     * scan resolvidos ignorando o dispositivo.
     */
    private static final class HeadlessListener extends LoggingPresentationListener {

        private final AtomicReference<DownloadOrchestrator> orchestrator;
        private final CountDownLatch terminated;

        HeadlessListener(AtomicReference<DownloadOrchestrator> orchestrator, CountDownLatch terminated) {
            this.orchestrator = orchestrator;
            this.terminated = terminated;
        }

        @Override
        public void promptForJobCode(List<String> previousCodes, boolean rememberDefault) {
            Console console = System.console();
            if (console == null) {
                super.promptForJobCode(previousCodes, rememberDefault);
                orchestrator.get().jobCodeCancelled();
                return;
            }
            Thread reader = new Thread(() -> {
                String hint = previousCodes.isEmpty() ? "" : " " + previousCodes;
                String code = console.readLine("JOB_CODE%s: ", hint);
                if (code == null || code.isBlank()) {
                    orchestrator.get().jobCodeCancelled();
                } else {
                    orchestrator.get().jobCodeEntered(code.trim(), rememberDefault);
                }
            }, "job-code-prompt");
            reader.setDaemon(true);
            reader.start();
        }

        @Override
        public void scanErrorPrompt(int deviceId, ScanErrorCode code, String message) {
            super.scanErrorPrompt(deviceId, code, message);
            orchestrator.get().resolveScanError(deviceId, false);
        }

        @Override
        public void terminated() {
            super.terminated();
            terminated.countDown();
        }
    }
}
