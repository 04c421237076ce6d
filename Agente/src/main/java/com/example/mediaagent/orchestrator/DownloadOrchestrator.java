package com.example.mediaagent.orchestrator;

import com.example.mediaagent.backup.BackupDevice;
import com.example.mediaagent.backup.BackupDeviceCollection;
import com.example.mediaagent.backup.BackupLocationType;
import com.example.mediaagent.config.DownloadSettings;
import com.example.mediaagent.config.PreferencesStore;
import com.example.mediaagent.config.ValidityCheck;
import com.example.mediaagent.device.CameraKey;
import com.example.mediaagent.device.Device;
import com.example.mediaagent.device.DeviceCollection;
import com.example.mediaagent.device.DeviceDescriptor;
import com.example.mediaagent.device.DeviceKind;
import com.example.mediaagent.device.DeviceMonitor;
import com.example.mediaagent.device.DeviceState;
import com.example.mediaagent.jobcode.JobCode;
import com.example.mediaagent.media.DownloadStats;
import com.example.mediaagent.media.FileStatus;
import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFile;
import com.example.mediaagent.media.MediaFileCollection;
import com.example.mediaagent.media.MediaFileCollection.DownloadFiles;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.media.ProblemDetail;
import com.example.mediaagent.progress.DownloadTracker;
import com.example.mediaagent.progress.DownloadTracker.DeviceSummary;
import com.example.mediaagent.progress.TimeRemainingFormatter;
import com.example.mediaagent.stage.BackupMessages.BackupBytes;
import com.example.mediaagent.stage.BackupMessages.BackupFile;
import com.example.mediaagent.stage.BackupMessages.FileBackedUp;
import com.example.mediaagent.stage.CopyMessages.BytesCopied;
import com.example.mediaagent.stage.CopyMessages.FileCopied;
import com.example.mediaagent.stage.CopyMessages.TempDirs;
import com.example.mediaagent.stage.OffloadMessages.ProximityGroups;
import com.example.mediaagent.stage.OffloadMessages.TimedFile;
import com.example.mediaagent.stage.PipelineEvent;
import com.example.mediaagent.stage.RenameMessages.DownloadStarted;
import com.example.mediaagent.stage.RenameMessages.FileRenamed;
import com.example.mediaagent.stage.RenameMessages.RenameFile;
import com.example.mediaagent.stage.RenameMessages.SequencesUpdate;
import com.example.mediaagent.stage.ScanMessages.DeviceInfo;
import com.example.mediaagent.stage.ScanMessages.FilesFound;
import com.example.mediaagent.stage.ScanMessages.ScanErrorCode;
import com.example.mediaagent.stage.ScanMessages.ScanProblem;
import com.example.mediaagent.stage.StageManagers;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orquestrador de downloads: um pipeline por dispositivo (scan, cópia, renomear/mover,
 * backup) coordenado com os workers de cada estágio.
 *
 * Todo o estado vive em {@link OrchestratorContext} e só é alterado na thread do
 * {@link EventLoop}. Os métodos públicos podem ser chamados de qualquer thread: apenas
 * enfileiram a operação no loop. Os resultados dos workers chegam como
 * {@link PipelineEvent} e são tratados num único ponto, {@link #dispatch}.
 */
public final class DownloadOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DownloadOrchestrator.class);

    static final Duration TIME_REMAINING_REFRESH = Duration.ofSeconds(1);
    static final Duration SEQUENCES_SAVE_TIMEOUT = Duration.ofSeconds(5);

    private final OrchestratorContext ctx;
    private final StageManagers stages;
    private final DeviceMonitor monitor;
    private final PresentationListener ui;
    private final EventLoop loop;
    private final Housekeeping housekeeping;

    /**
     * @param stageFactory recebe o destino dos eventos dos workers e cria os gerenciadores
     * @param housekeeping executor das limpezas em disco (temporários, arquivos de origem)
     */
    public DownloadOrchestrator(DownloadSettings settings,
                                PreferencesStore preferences,
                                Function<Consumer<PipelineEvent>, StageManagers> stageFactory,
                                DeviceMonitor monitor,
                                PresentationListener ui,
                                EventLoop loop,
                                Executor housekeeping) {
        this.ui = Objects.requireNonNull(ui, "ui");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.housekeeping = new Housekeeping(housekeeping);
        JobCode jobCode = new JobCode(preferences, ui, settings.jobCodeRequired());
        this.ctx = new OrchestratorContext(settings, preferences, jobCode);
        this.stages = Objects.requireNonNull(stageFactory.apply(this::post), "stages");
    }

    // ---------------------------------------------------------------------
    // API pública (qualquer thread)
    // ---------------------------------------------------------------------

    /**
     * Prepara a sessão: código de trabalho configurado, destinos de backup manuais,
     * a pasta local ("Este Computador") e a atualização periódica do tempo restante.
     */
    public void start() {
        loop.execute(this::doStart);
        loop.scheduleAtFixedRate(this::refreshTimeRemaining, TIME_REMAINING_REFRESH);
    }

    /** Um dispositivo foi detectado (câmera, volume ou caminho local). */
    public void deviceAdded(DeviceDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        loop.execute(() -> addDevice(descriptor, ctx.settings().autoDownloadUponDeviceInsertion()));
    }

    public void deviceRemoved(int deviceId) {
        loop.execute(() -> removeDevice(deviceId));
    }

    /** Um volume foi desmontado: pode ser uma origem ou um destino de backup. */
    public void volumeUnmounted(Path path) {
        Objects.requireNonNull(path, "path");
        loop.execute(() -> handleVolumeUnmounted(path));
    }

    /** Um volume foi montado; se tiver as pastas identificadoras, vira destino de backup. */
    public void backupVolumeMounted(Path path, String mountName) {
        Objects.requireNonNull(path, "path");
        loop.execute(() -> handleBackupVolumeMounted(path, mountName));
    }

    /** Resultado assíncrono de {@link DeviceMonitor#unmountCamera}. */
    public void cameraUnmounted(CameraKey camera, boolean success, boolean downloadStarting) {
        Objects.requireNonNull(camera, "camera");
        loop.execute(() -> handleCameraUnmounted(camera, success, downloadStarting));
    }

    /** Baixa os arquivos disponíveis de todos os dispositivos prontos. */
    public void startDownload() {
        loop.execute(() -> startDownload(null));
    }

    public void startDownload(int deviceId) {
        loop.execute(() -> startDownload(Set.of(deviceId)));
    }

    public void pauseDownload() {
        loop.execute(this::pause);
    }

    public void resumeDownload() {
        loop.execute(this::resume);
    }

    /** Resposta do usuário ao erro de scan: tentar de novo ou ignorar o dispositivo. */
    public void resolveScanError(int deviceId, boolean retry) {
        loop.execute(() -> handleScanErrorDecision(deviceId, retry));
    }

    public void jobCodeEntered(String code, boolean remember) {
        Objects.requireNonNull(code, "code");
        loop.execute(() -> handleJobCodeEntered(code, remember));
    }

    public void jobCodeCancelled() {
        loop.execute(() -> {
            List<Integer> dropped = ctx.jobCode().cancel();
            log.info("Codigo de trabalho cancelado; {} dispositivos sem download", dropped.size());
        });
    }

    /**
     * Encerra o orquestrador. Se um download foi interrompido, espera os contadores de
     * sequência serem gravados antes de encerrar os workers.
     */
    public void shutdown() {
        loop.execute(this::beginShutdown);
    }

    @Override
    public void close() {
        shutdown();
    }

    /** Entrada dos eventos de todos os canais. */
    void post(PipelineEvent event) {
        loop.execute(() -> dispatch(event));
    }

    OrchestratorContext context() {
        return ctx;
    }

    // ---------------------------------------------------------------------
    // Despacho dos resultados dos workers
    // ---------------------------------------------------------------------

    void dispatch(PipelineEvent event) {
        if (ctx.terminated()) {
            log.debug("Evento ignorado apos encerramento: {}", event);
            return;
        }
        switch (event.kind()) {
            case FILES_FOUND:
                filesFound(event.requireDeviceId(), event.payload(FilesFound.class));
                break;
            case SCAN_PROBLEM:
                scanProblem(event.requireDeviceId(), event.payload(ScanProblem.class));
                break;
            case DEVICE_INFO:
                deviceInfo(event.requireDeviceId(), event.payload(DeviceInfo.class));
                break;
            case SCAN_FINISHED:
                scanFinished(event.requireDeviceId(), event.unexpected());
                break;
            case TEMP_DIRS:
                tempDirs(event.requireDeviceId(), event.payload(TempDirs.class));
                break;
            case BYTES_COPIED:
                bytesCopied(event.requireDeviceId(), event.payload(BytesCopied.class));
                break;
            case FILE_COPIED:
                fileCopied(event.requireDeviceId(), event.payload(FileCopied.class));
                break;
            case COPY_FINISHED:
                copyFinished(event.requireDeviceId(), event.unexpected());
                break;
            case FILE_RENAMED:
                fileRenamed(event.payload(FileRenamed.class));
                break;
            case SEQUENCES_UPDATED:
                sequencesUpdated(event.payload(SequencesUpdate.class));
                break;
            case RENAME_FINISHED:
                renameFinished(event.unexpected());
                break;
            case BACKUP_BYTES:
                backupBytes(event.payload(BackupBytes.class));
                break;
            case FILE_BACKED_UP:
                fileBackedUp(event.payload(FileBackedUp.class));
                break;
            case BACKUP_FINISHED:
                backupFinished(event.requireDeviceId(), event.unexpected());
                break;
            case PROXIMITY_GROUPS:
                ui.proximityGroups(event.payload(ProximityGroups.class).groups());
                break;
            case OFFLOAD_FINISHED:
                if (event.unexpected()) {
                    log.warn("Worker de proximidade temporal terminou inesperadamente");
                }
                break;
            default:
                throw new IllegalStateException("Evento nao tratado: " + event.kind());
        }
    }

    // ---------------------------------------------------------------------
    // Dispositivos e scan
    // ---------------------------------------------------------------------

    private void doStart() {
        DownloadSettings settings = ctx.settings();
        ctx.jobCode().setRequiredForNaming(settings.jobCodeRequired());
        settings.jobCode().ifPresent(code -> ctx.jobCode().set(code, false));
        if (ctx.backupEnabled() && !settings.backup().autodetect()) {
            for (BackupDevice dest : ctx.backups().setupManualBackup()) {
                stages.backup().addDestination(dest);
            }
            backupCountsChanged();
        }
        settings.thisComputerPath().ifPresent(path ->
                addDevice(DeviceDescriptor.localPath(path.toString()), settings.autoDownloadAtStartup()));
    }

    private void addDevice(DeviceDescriptor descriptor, boolean autoStart) {
        if (ctx.shuttingDown()) {
            return;
        }
        DeviceCollection devices = ctx.devices();
        Optional<CameraKey> camera = descriptor.cameraKey();
        if (camera.isPresent()) {
            if (devices.idForCamera(camera.get()).isPresent()) {
                log.debug("Camera {} ja registrada", camera.get());
                return;
            }
        } else {
            if (devices.idForPath(descriptor.path()).isPresent()) {
                log.debug("Caminho {} ja registrado", descriptor.path());
                return;
            }
            if (descriptor.kind() == DeviceKind.VOLUME) {
                Path path = Path.of(descriptor.path());
                Optional<BackupLocationType> backupType = ctx.backups().isBackupPath(path);
                if (backupType.isPresent()) {
                    addBackupDestination(path, backupType.get(), descriptor.displayName());
                    return;
                }
            }
        }

        int id = devices.add(descriptor);
        Device device = devices.get(id);
        if (autoStart) {
            ctx.autoStart().add(id);
        }
        ui.deviceAdded(device);

        if (camera.isPresent()) {
            CameraKey key = camera.get();
            if (ctx.scanUnmounts().containsKey(key)) {
                log.warn("Desmontagem da camera {} ja em negociacao", key);
                return;
            }
            if (monitor.unmountCamera(key, false)) {
                log.debug("Aguardando desmontagem da camera {} antes do scan", key);
                ctx.scanUnmounts().put(key, id);
                return;
            }
        }
        startScan(id);
    }

    private void startScan(int id) {
        Device device = ctx.devices().get(id);
        setState(id, DeviceState.SCANNING);
        Optional<String> root = scanRoot(device);
        if (root.isEmpty()) {
            handleScanError(id, ScanErrorCode.INACCESSIBLE, device.displayName() + " nao esta acessivel");
            return;
        }
        stages.scan().startScan(device, root.get(), ctx.settings().ignoredPaths());
    }

    private Optional<String> scanRoot(Device device) {
        if (device.kind() == DeviceKind.CAMERA) {
            return device.descriptor().cameraKey()
                    .flatMap(monitor::cameraAccessPath)
                    .map(Path::toString);
        }
        return Optional.ofNullable(device.descriptor().path());
    }

    private void filesFound(int id, FilesFound found) {
        Optional<Device> device = ctx.devices().find(id);
        if (device.isEmpty()) {
            return;
        }
        int added = 0;
        for (MediaFileData data : found.files()) {
            if (ctx.files().add(data)) {
                device.get().counter().add(data.fileType(), data.size());
                added++;
            }
        }
        if (added < found.files().size()) {
            log.debug("Dispositivo {}: {} arquivos ja conhecidos ignorados", id, found.files().size() - added);
        }
        ui.scanProgress(device.get());
    }

    private void scanProblem(int id, ScanProblem problem) {
        if (!ctx.devices().contains(id)) {
            return;
        }
        handleScanError(id, problem.code(), problem.message());
    }

    private void handleScanError(int id, ScanErrorCode code, String message) {
        setState(id, DeviceState.ERROR);
        ctx.scanErrors().add(id);
        String title = code == ScanErrorCode.LOCKED ? "Arquivos inacessiveis" : "Dispositivo inacessivel";
        ui.diagnostic(Severity.SERIOUS, title, message);
        ui.scanErrorPrompt(id, code, message);
    }

    private void handleScanErrorDecision(int id, boolean retry) {
        if (!ctx.scanErrors().remove(id)) {
            log.debug("Nenhum erro de scan pendente para o dispositivo {}", id);
            return;
        }
        if (!retry) {
            log.info("Dispositivo {} ignorado pelo usuario", id);
            stages.scan().stop(id);
            removeDevice(id);
            return;
        }
        setState(id, DeviceState.SCANNING);
        if (!stages.scan().retry(id)) {
            log.info("Worker de scan do dispositivo {} nao existe mais; iniciando novo", id);
            startScan(id);
        }
    }

    private void deviceInfo(int id, DeviceInfo info) {
        Optional<Device> device = ctx.devices().find(id);
        if (device.isEmpty()) {
            return;
        }
        if (info.displayName() != null && !info.displayName().isBlank()) {
            device.get().setDisplayName(info.displayName());
        }
        device.get().setStorage(info.totalSpace(), info.freeSpace());
        ui.deviceInfoUpdated(device.get());
    }

    private void scanFinished(int id, boolean unexpected) {
        Optional<Device> device = ctx.devices().find(id);
        if (device.isEmpty() || device.get().state() != DeviceState.SCANNING) {
            return;
        }
        if (unexpected) {
            handleScanError(id, ScanErrorCode.INACCESSIBLE, "O scan de " + device.get().displayName()
                    + " terminou inesperadamente");
            return;
        }
        setState(id, DeviceState.SCANNED);
        log.info("Scan de {} concluido: {}", device.get().displayName(), device.get().counter().summary());
        generateProximityGroups();
        if (ctx.autoStart().remove(id)) {
            startDownload(Set.of(id));
        }
    }

    private void removeDevice(int id) {
        DeviceCollection devices = ctx.devices();
        if (!devices.contains(id)) {
            return;
        }
        ctx.scanErrors().remove(id);
        ctx.autoStart().remove(id);
        ctx.jobCode().forget(id);
        ctx.scanUnmounts().values().removeIf(v -> v == id);
        if (stages.scan().isRunning(id)) {
            stages.scan().stop(id);
        }
        if (stages.copy().isRunning(id)) {
            stages.copy().stop(id);
        }
        if (ctx.activeDownloads().remove(id)) {
            log.warn("Dispositivo {} removido durante o download", id);
        }
        ctx.timeRemaining().remove(id);
        ctx.tracker().removeDevice(id);
        boolean filesRemoved = ctx.files().removeDevice(id, true) > 0;
        devices.remove(id);
        ui.deviceRemoved(id);
        if (filesRemoved) {
            generateProximityGroups();
        }
        checkCycleComplete();
    }

    private void handleVolumeUnmounted(Path path) {
        Optional<Integer> id = ctx.devices().idForPath(path.toString());
        if (id.isPresent()) {
            removeDevice(id.get());
            return;
        }
        removeBackupDestination(path);
    }

    private void handleCameraUnmounted(CameraKey camera, boolean success, boolean downloadStarting) {
        if (downloadStarting) {
            if (!ctx.downloadUnmounts().remove(camera)) {
                return;
            }
            if (!success) {
                ctx.devices().idForCamera(camera).ifPresent(ctx.unmountFailed()::add);
                ui.diagnostic(Severity.SERIOUS, "Falha ao desmontar camera",
                        "Nao foi possivel liberar " + camera + "; os arquivos dela nao serao baixados");
            }
            if (ctx.downloadUnmounts().isEmpty()) {
                startDownloadPhase2();
            }
            return;
        }
        Integer id = ctx.scanUnmounts().remove(camera);
        if (id == null || !ctx.devices().contains(id)) {
            return;
        }
        if (success) {
            startScan(id);
        } else {
            setState(id, DeviceState.SCANNING);
            handleScanError(id, ScanErrorCode.LOCKED, "A camera " + camera + " esta em uso por outro programa");
        }
    }

    private void generateProximityGroups() {
        List<TimedFile> timed = new ArrayList<>();
        for (MediaFile f : ctx.files().all()) {
            timed.add(new TimedFile(f.uniqueId(), f.data().modificationTime()));
        }
        stages.offload().assignProximityGroups(timed, ctx.settings().proximityGapSeconds());
    }

    // ---------------------------------------------------------------------
    // Código de trabalho
    // ---------------------------------------------------------------------

    private void handleJobCodeEntered(String code, boolean remember) {
        List<Integer> released = ctx.jobCode().accept(code, remember);
        savePreferences();
        if (!released.isEmpty()) {
            startDownload(new LinkedHashSet<>(released));
        }
    }

    // ---------------------------------------------------------------------
    // Início do download
    // ---------------------------------------------------------------------

    private boolean readyForDownload(int id, Set<Integer> only) {
        if (only != null && !only.contains(id)) {
            return false;
        }
        if (ctx.activeDownloads().contains(id)) {
            return false;
        }
        Optional<Device> device = ctx.devices().find(id);
        if (device.isEmpty()) {
            return false;
        }
        DeviceState state = device.get().state();
        return state == DeviceState.SCANNED || state == DeviceState.COMPLETED
                || state == DeviceState.DOWNLOAD_PENDING;
    }

    /**
     * Fase 1: escolhe os arquivos, pede o código de trabalho se necessário e negocia a
     * desmontagem das câmeras. A fase 2 começa quando nenhuma desmontagem está pendente.
     */
    private void startDownload(Set<Integer> only) {
        if (ctx.shuttingDown()) {
            return;
        }
        DownloadFiles download = ctx.files().filesMarkedForDownload(id -> readyForDownload(id, only));
        if (download.isEmpty()) {
            log.info("Nenhum arquivo disponivel para download");
            return;
        }
        if (ctx.jobCode().needToPrompt()) {
            for (Integer id : download.files().keySet()) {
                ctx.jobCode().request(id);
            }
            return;
        }
        for (Integer id : download.files().keySet()) {
            setState(id, DeviceState.DOWNLOAD_PENDING);
            ctx.unmountFailed().remove(id);
            Device device = ctx.devices().get(id);
            Optional<CameraKey> camera = device.descriptor().cameraKey();
            if (camera.isPresent() && !ctx.downloadUnmounts().contains(camera.get())
                    && monitor.unmountCamera(camera.get(), true)) {
                ctx.downloadUnmounts().add(camera.get());
            }
        }
        if (ctx.downloadUnmounts().isEmpty()) {
            startDownloadPhase2();
        } else {
            log.debug("{} cameras precisam ser desmontadas antes do download", ctx.downloadUnmounts().size());
        }
    }

    private void startDownloadPhase2() {
        DownloadFiles download = ctx.files().filesMarkedForDownload(id ->
                ctx.devices().find(id).map(d -> d.state() == DeviceState.DOWNLOAD_PENDING).orElse(false)
                        && !ctx.activeDownloads().contains(id)
                        && !ctx.unmountFailed().contains(id));
        if (download.isEmpty()) {
            return;
        }
        DownloadSettings settings = ctx.settings();

        List<Path> invalid = settings.invalidDownloadFolders(download.types());
        if (!invalid.isEmpty()) {
            String msg = invalid.size() > 1
                    ? "Estas pastas de download sao invalidas: " + invalid
                    : "Esta pasta de download e invalida: " + invalid.get(0);
            ui.diagnostic(Severity.CRITICAL, "O download nao pode prosseguir", msg);
            return;
        }
        ValidityCheck validity = settings.checkValidity();
        if (!validity.valid()) {
            ui.diagnostic(Severity.CRITICAL, "O download nao pode prosseguir", validity.text());
            return;
        }

        BackupDeviceCollection backups = ctx.backups();
        if (ctx.backupEnabled()) {
            for (FileType type : download.types()) {
                if (backups.count(type) == 0) {
                    log.warn("Nenhum destino de backup valido para {}", type.plural());
                    ui.diagnostic(Severity.WARNING, "Problema de backup",
                            "Nenhum destino de backup contem uma pasta valida para " + type.plural());
                }
            }
        }
        ctx.tracker().setBackupDestinations(backups.countsByType());

        boolean newCycle = ctx.cycleParticipants().isEmpty();
        for (List<MediaFile> list : download.files().values()) {
            ctx.files().markDownloadPending(list);
        }
        ui.prefsEnabled(false);

        if (newCycle) {
            LocalDate today = LocalDate.now();
            PreferencesStore prefs = ctx.preferences();
            int first = download.files().keySet().iterator().next();
            stages.rename().downloadStarted(first, new DownloadStarted(
                    foldersAsText(settings.downloadFolders()),
                    templates(settings, true),
                    templates(settings, false),
                    prefs.storedSequenceNo(),
                    today.toString(),
                    prefs.downloadsToday(today)));
        }

        for (Map.Entry<Integer, List<MediaFile>> e : download.files().entrySet()) {
            downloadFiles(e.getKey(), e.getValue(), download.stats().get(e.getKey()));
        }
    }

    private void downloadFiles(int id, List<MediaFile> files, DownloadStats stats) {
        setState(id, DeviceState.DOWNLOADING);
        DownloadSettings settings = ctx.settings();
        DownloadTracker tracker = ctx.tracker();

        tracker.initStats(id, stats);
        long size = tracker.sizeToCopy(id) + tracker.sizeToBackup(id);
        ctx.timeRemaining().add(id, size);

        ctx.activeDownloads().add(id);
        ctx.cycleParticipants().add(id);
        if (ctx.activeDownloads().size() > 1) {
            ctx.setSummaryNotification(true);
        }
        ctx.setFileTypesText(id, fileTypesText(stats));

        Map<FileType, String> folders = new EnumMap<>(FileType.class);
        List<MediaFileData> data = new ArrayList<>();
        for (MediaFile f : files) {
            folders.put(f.fileType(), settings.downloadFolder(f.fileType()).toString());
            data.add(f.data());
        }
        log.info("Baixando {} arquivos de {}", files.size(), ctx.devices().get(id).displayName());
        stages.copy().startCopy(id, data, folders, settings.verifyFiles(), settings.hashAlgorithm(),
                settings.chunkSize());
    }

    private static String fileTypesText(DownloadStats stats) {
        if (stats.photos() > 0 && stats.videos() > 0) {
            return FileType.PHOTO.plural() + " e " + FileType.VIDEO.plural();
        }
        return stats.videos() > 0 ? FileType.VIDEO.plural() : FileType.PHOTO.plural();
    }

    private static Map<FileType, String> foldersAsText(Map<FileType, Path> folders) {
        Map<FileType, String> out = new EnumMap<>(FileType.class);
        folders.forEach((type, path) -> out.put(type, path.toString()));
        return out;
    }

    private static Map<FileType, String> templates(DownloadSettings settings, boolean subfolder) {
        Map<FileType, String> out = new EnumMap<>(FileType.class);
        for (FileType t : FileType.values()) {
            out.put(t, subfolder ? settings.subfolderTemplate(t) : settings.renameTemplate(t));
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Cópia
    // ---------------------------------------------------------------------

    private void tempDirs(int id, TempDirs dirs) {
        List<Path> paths = new ArrayList<>();
        for (String d : new LinkedHashSet<>(dirs.dirs().values())) {
            paths.add(Path.of(d));
        }
        ctx.addTempDirs(id, paths);
    }

    private void bytesCopied(int id, BytesCopied copied) {
        ctx.tracker().setTotalBytesCopied(id, copied.total());
        if (copied.skipped()) {
            ctx.timeRemaining().skip(id, copied.chunk());
        } else {
            ctx.timeRemaining().update(id, copied.chunk());
        }
        reportProgress(id, false);
    }

    private void fileCopied(int id, FileCopied copied) {
        Optional<MediaFile> found = ctx.files().get(copied.uniqueId());
        if (found.isEmpty()) {
            return;
        }
        MediaFile file = found.get();
        file.setDownloadCount(copied.downloadCount());
        if (!copied.succeeded()) {
            file.setProblem(copied.problem().orElse(new ProblemDetail("Falha ao copiar", file.name())));
            afterRename(file, false, "");
            return;
        }
        file.setStatus(FileStatus.COPIED);
        file.setTempPath(copied.tempPath());
        String deviceName = ctx.devices().find(id).map(Device::displayName).orElse("");
        RenameFile request = new RenameFile(file.data(), copied.tempPath(), copied.downloadCount(),
                ctx.jobCode().current(), deviceName);
        if (!stages.rename().renameFile(id, request)) {
            file.setProblem(new ProblemDetail("Falha ao mover arquivo", "Worker de renomeacao indisponivel"));
            afterRename(file, false, "");
        }
    }

    private void copyFinished(int id, boolean unexpected) {
        if (!unexpected) {
            return;
        }
        List<MediaFile> pending = new ArrayList<>();
        for (MediaFile f : ctx.files().filesForDevice(id)) {
            if (f.status() == FileStatus.DOWNLOAD_PENDING) {
                pending.add(f);
            }
        }
        log.error("Worker de copia do dispositivo {} terminou inesperadamente; {} arquivos falharam", id, pending.size());
        DownloadTracker tracker = ctx.tracker();
        for (MediaFile f : pending) {
            tracker.setTotalBytesCopied(id, tracker.bytesCopied(id) + f.size());
            ctx.timeRemaining().skip(id, f.size());
            f.setProblem(new ProblemDetail("Falha ao copiar", "O worker de copia terminou inesperadamente"));
            afterRename(f, false, "");
        }
    }

    // ---------------------------------------------------------------------
    // Renomear/mover
    // ---------------------------------------------------------------------

    private void fileRenamed(FileRenamed renamed) {
        Optional<MediaFile> found = ctx.files().get(renamed.uniqueId());
        if (found.isEmpty()) {
            return;
        }
        MediaFile file = found.get();
        file.setTempPath(null);
        renamed.problem().ifPresent(file::setProblem);
        if (renamed.succeeded()) {
            file.setStatus(FileStatus.RENAMED);
            file.setDownloadPath(renamed.downloadPath());
            renamed.problem().ifPresent(p -> ui.diagnostic(Severity.WARNING, p.title(), p.details()));
        }
        afterRename(file, renamed.succeeded(), renamed.subfolder() == null ? "" : renamed.subfolder());
    }

    /**
     * Depois do renomear (ou de uma falha antes dele): envia aos destinos de backup do
     * tipo do arquivo, ou conclui o arquivo.
     */
    private void afterRename(MediaFile file, boolean succeeded, String subfolder) {
        if (ctx.backupEnabled() && ctx.backups().backupPossible(file.fileType())) {
            backupFile(file, succeeded, subfolder);
        } else {
            fileDownloadFinished(file, succeeded);
        }
    }

    private void renameFinished(boolean unexpected) {
        if (unexpected) {
            List<MediaFile> stuck = new ArrayList<>();
            for (MediaFile f : ctx.files().all()) {
                if (f.status() == FileStatus.COPIED) {
                    stuck.add(f);
                }
            }
            log.error("Worker de renomeacao terminou inesperadamente; {} arquivos falharam", stuck.size());
            for (MediaFile f : stuck) {
                f.setProblem(new ProblemDetail("Falha ao mover arquivo", "O worker de renomeacao terminou inesperadamente"));
                afterRename(f, false, "");
            }
        }
        if (ctx.sequencesPending()) {
            ctx.setSequencesPending(false);
            if (ctx.shuttingDown()) {
                finishShutdown();
            }
        }
    }

    private void sequencesUpdated(SequencesUpdate update) {
        ctx.preferences().updateSequences(update.storedSequenceNo(), LocalDate.parse(update.day()),
                update.downloadsToday());
        savePreferences();
        log.debug("Valores de sequencia gravados nas preferencias");
        ctx.setSequencesPending(false);
        if (ctx.shuttingDown()) {
            finishShutdown();
        }
    }

    // ---------------------------------------------------------------------
    // Backup
    // ---------------------------------------------------------------------

    private void backupFile(MediaFile file, boolean succeeded, String subfolder) {
        DownloadSettings settings = ctx.settings();
        List<BackupDevice> destinations = ctx.backups().matching(file.fileType());
        Set<Integer> ids = new LinkedHashSet<>();
        for (BackupDevice d : destinations) {
            ids.add(d.id());
        }
        ctx.tracker().expectBackups(file.uniqueId(), file.deviceId(), ids);

        String identifier = settings.backup().autodetect() ? settings.backup().identifier(file.fileType()) : null;
        BackupFile request = new BackupFile(file.data(), file.downloadPath().orElse(null), subfolder, identifier,
                succeeded, settings.backup().overwriteDuplicates(), settings.verifyFiles(), settings.hashAlgorithm());
        for (BackupDevice d : destinations) {
            log.debug("Backup de {} para {}", file.name(), d.path());
            if (!stages.backup().backupFile(d.id(), request)) {
                ctx.tracker().incrementBytesBackedUp(file.deviceId(), file.size());
                ctx.timeRemaining().skip(file.deviceId(), file.size());
                backupResult(file, d.id(), false, succeeded,
                        new ProblemDetail("Falha no backup", "Destino " + d.displayName() + " indisponivel"));
            }
        }
    }

    private void backupBytes(BackupBytes bytes) {
        int id = bytes.sourceDeviceId();
        ctx.tracker().incrementBytesBackedUp(id, bytes.chunk());
        ctx.timeRemaining().update(id, bytes.chunk());
        reportProgress(id, false);
    }

    private void fileBackedUp(FileBackedUp result) {
        Optional<MediaFile> file = ctx.files().get(result.uniqueId());
        if (file.isEmpty()) {
            // dispositivo removido durante o backup
            ctx.tracker().fileBackedUp(result.uniqueId(), result.destinationId(), result.succeeded());
            checkCycleComplete();
            return;
        }
        backupResult(file.get(), result.destinationId(), result.succeeded(), result.doBackup(),
                result.problem().orElse(null));
    }

    private void backupResult(MediaFile file, int destinationId, boolean succeeded, boolean doBackup,
                              ProblemDetail problem) {
        if (doBackup && !succeeded) {
            file.setBackupProblem(true);
            if (ctx.backups().count(file.fileType()) > 1) {
                ProblemDetail p = problem != null ? problem : new ProblemDetail("Falha no backup", file.name());
                ui.diagnostic(Severity.SERIOUS, p.title(), p.details());
            } else if (problem != null && file.problem().isEmpty()) {
                file.setProblem(problem);
            }
        }
        if (ctx.tracker().fileBackedUp(file.uniqueId(), destinationId, succeeded)) {
            log.debug("{} nao sera enviado a mais nenhum destino", file.name());
            fileDownloadFinished(file, file.downloadPath().isPresent());
        }
    }

    private void backupFinished(int destinationId, boolean unexpected) {
        Optional<BackupDevice> dest = ctx.backups().byId(destinationId);
        if (unexpected && dest.isPresent()) {
            ui.diagnostic(Severity.SERIOUS, "Falha no backup",
                    "O worker de backup de " + dest.get().displayName() + " terminou inesperadamente");
            ctx.backups().remove(dest.get().path());
            backupCountsChanged();
        }
        failPendingBackups(destinationId, "Destino de backup indisponivel");
    }

    /** Arquivos ainda esperando um destino que sumiu contam como backup falho. */
    private void failPendingBackups(int destinationId, String reason) {
        boolean orphans = false;
        for (String uid : ctx.tracker().filesAwaitingBackupFrom(destinationId)) {
            Optional<MediaFile> file = ctx.files().get(uid);
            if (file.isEmpty()) {
                ctx.tracker().fileBackedUp(uid, destinationId, false);
                orphans = true;
                continue;
            }
            ctx.tracker().incrementBytesBackedUp(file.get().deviceId(), file.get().size());
            ctx.timeRemaining().skip(file.get().deviceId(), file.get().size());
            backupResult(file.get(), destinationId, false, true, new ProblemDetail("Falha no backup", reason));
        }
        if (orphans) {
            checkCycleComplete();
        }
    }

    private void handleBackupVolumeMounted(Path path, String mountName) {
        ctx.backups().isBackupPath(path).ifPresent(type -> addBackupDestination(path, type, mountName));
    }

    private void addBackupDestination(Path path, BackupLocationType type, String mountName) {
        Optional<BackupDevice> added = ctx.backups().add(path, type, mountName);
        if (added.isEmpty()) {
            return;
        }
        stages.backup().addDestination(added.get());
        backupCountsChanged();
    }

    private void removeBackupDestination(Path path) {
        Optional<BackupDevice> removed = ctx.backups().remove(path);
        if (removed.isEmpty()) {
            return;
        }
        stages.backup().removeDestination(removed.get().id());
        backupCountsChanged();
        failPendingBackups(removed.get().id(), removed.get().displayName() + " foi removido");
    }

    private void backupCountsChanged() {
        BackupDeviceCollection backups = ctx.backups();
        ctx.tracker().setBackupDestinations(backups.countsByType());
        ui.backupDestinationsChanged(backups.photoDestinationCount(), backups.videoDestinationCount());
    }

    // ---------------------------------------------------------------------
    // Conclusão
    // ---------------------------------------------------------------------

    /** Arquivo copiado, renomeado e (se aplicável) enviado a todos os destinos de backup. */
    private void fileDownloadFinished(MediaFile file, boolean succeeded) {
        int id = file.deviceId();
        FileStatus status = file.finalStatus(succeeded);
        file.setStatus(status);
        DownloadTracker tracker = ctx.tracker();

        if (!succeeded && ctx.backups().count(file.fileType()) <= 1) {
            ProblemDetail p = file.problem().orElse(new ProblemDetail("Falha no download", file.name()));
            ui.diagnostic(Severity.SERIOUS, p.title(), p.details());
        } else if (succeeded && ctx.settings().moveFiles()) {
            tracker.addToAutoDelete(id, file.data().sourcePath());
        }
        tracker.fileDownloaded(id, file.fileType(), status);

        boolean completed = tracker.isTracking(id) && tracker.allFilesDownloaded(id)
                && (!ctx.backupEnabled() || tracker.allFilesBackedUp(id));
        reportProgress(id, completed);
        ui.overallProgress(tracker.overallPercentComplete());
        if (downloadIsRunning()) {
            updateTimeRemaining();
        }
        if (completed && ctx.activeDownloads().contains(id)) {
            deviceDownloadCompleted(id);
        } else if (!ctx.devices().contains(id)) {
            // último backup de um dispositivo já removido
            checkCycleComplete();
        }
    }

    private void deviceDownloadCompleted(int id) {
        Device device = ctx.devices().get(id);
        setState(id, DeviceState.COMPLETED);
        DownloadTracker tracker = ctx.tracker();

        housekeeping.purgeTempDirs(ctx.takeTempDirs(id));
        if (ctx.settings().moveFiles()) {
            housekeeping.deleteSourceFiles(tracker.filesToAutoDelete(id));
            tracker.clearAutoDelete(id);
        }
        ctx.activeDownloads().remove(id);
        ctx.timeRemaining().remove(id);

        String title = device.kind() == DeviceKind.PATH ? "Media Agent" : device.displayName();
        ui.notification(title, tracker.deviceSummary(id).message());

        int remaining = ctx.files().filesRemaining(id);
        if (remaining == 0 && ctx.settings().autoUnmount() && device.kind() == DeviceKind.VOLUME) {
            monitor.unmountVolume(Path.of(device.descriptor().path()));
        }
        checkCycleComplete();
    }

    /** Há arquivo sendo copiado, renomeado ou enviado para backup? */
    private boolean downloadIsRunning() {
        if (!ctx.activeDownloads().isEmpty()) {
            return true;
        }
        return ctx.backupEnabled() && !ctx.tracker().allFilesBackedUp();
    }

    /**
     * Conclusão global: todos os dispositivos do ciclo estão concluídos ou removidos e
     * não há backup pendente.
     */
    private void checkCycleComplete() {
        if (ctx.cycleParticipants().isEmpty() || downloadIsRunning()) {
            return;
        }
        for (int id : ctx.cycleParticipants()) {
            Optional<Device> d = ctx.devices().find(id);
            if (d.isPresent() && d.get().state() != DeviceState.COMPLETED) {
                return;
            }
        }
        DownloadTracker tracker = ctx.tracker();
        DeviceSummary summary = tracker.sessionSummary();
        log.info("Download concluido: {}", summary.message());

        housekeeping.purgeTempDirs(ctx.takeAllTempDirs());
        ui.prefsEnabled(true);
        if (ctx.summaryNotification()) {
            ui.notification("Todos os downloads concluidos", summary.message());
        }
        ui.downloadCompleted(summary);
        ui.timeRemaining("");

        ctx.setSequencesPending(stages.rename().downloadCompleted());

        boolean exit = (ctx.settings().autoExit() && tracker.noErrorsOrWarnings())
                || ctx.settings().autoExitForce();
        exit = exit && !ctx.files().filesRemainToDownload();

        ctx.endCycle();
        ctx.jobCode().reset();
        ctx.settings().jobCode().ifPresent(code -> ctx.jobCode().set(code, false));

        if (exit) {
            log.info("Saida automatica apos o download");
            beginShutdown();
        }
    }

    private void reportProgress(int id, boolean completed) {
        DownloadTracker tracker = ctx.tracker();
        if (!tracker.isTracking(id)) {
            return;
        }
        int done = tracker.downloadCount(id);
        int total = tracker.filesInDownload(id);
        StringBuilder text = new StringBuilder()
                .append(done).append(" de ").append(total).append(' ').append(ctx.fileTypesText(id));
        if (completed) {
            int remaining = ctx.files().filesRemaining(id);
            if (remaining > 0) {
                text.append(" (").append(remaining).append(" restantes)");
            }
        }
        ui.deviceProgress(id, tracker.percentComplete(id), text.toString());
    }

    // ---------------------------------------------------------------------
    // Pausa e tempo restante
    // ---------------------------------------------------------------------

    private void pause() {
        if (ctx.paused()) {
            return;
        }
        ctx.setPaused(true);
        stages.copy().pause();
        ctx.timeRemaining().pause();
        log.info("Download pausado");
    }

    private void resume() {
        if (!ctx.paused()) {
            return;
        }
        ctx.setPaused(false);
        ctx.timeRemaining().resume();
        stages.copy().resume();
        log.info("Download retomado");
    }

    private void refreshTimeRemaining() {
        if (!ctx.terminated() && downloadIsRunning()) {
            updateTimeRemaining();
        }
    }

    private void updateTimeRemaining() {
        OptionalLong secs = ctx.timeRemaining().timeRemainingSeconds();
        if (secs.isPresent()) {
            ui.timeRemaining(TimeRemainingFormatter.format(secs.getAsLong()));
        }
    }

    // ---------------------------------------------------------------------
    // Encerramento
    // ---------------------------------------------------------------------

    private void beginShutdown() {
        if (ctx.shuttingDown()) {
            return;
        }
        ctx.setShuttingDown(true);
        log.info("Encerrando orquestrador");
        stages.scan().stopAll();
        stages.copy().stopAll();
        if (!ctx.cycleParticipants().isEmpty() && !ctx.sequencesPending()) {
            ctx.setSequencesPending(stages.rename().downloadCompleted());
        }
        if (ctx.sequencesPending()) {
            log.debug("Aguardando gravacao dos valores de sequencia");
            loop.schedule(() -> {
                if (!ctx.terminated()) {
                    log.warn("Valores de sequencia nao recebidos em {} ms; encerrando",
                            SEQUENCES_SAVE_TIMEOUT.toMillis());
                    finishShutdown();
                }
            }, SEQUENCES_SAVE_TIMEOUT);
            return;
        }
        finishShutdown();
    }

    private void finishShutdown() {
        if (ctx.terminated()) {
            return;
        }
        ctx.setTerminated(true);
        housekeeping.purgeTempDirs(ctx.takeAllTempDirs());
        savePreferences();
        stages.shutdown();
        ui.terminated();
    }

    private void savePreferences() {
        try {
            ctx.preferences().save();
        } catch (IOException e) {
            log.error("Falha ao gravar preferencias: {}", e.getMessage());
            ui.diagnostic(Severity.SERIOUS, "Falha ao gravar preferencias", e.getMessage());
        }
    }

    private void setState(int id, DeviceState state) {
        DeviceState before = ctx.devices().get(id).state();
        ctx.devices().transition(id, state);
        if (before != state) {
            ui.deviceStateChanged(id, state);
        }
    }

    /** Visão somente leitura dos dispositivos, para testes e diagnóstico. */
    Collection<Device> devices() {
        return ctx.devices().devices();
    }
}
