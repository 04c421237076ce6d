package com.example.mediaagent.orchestrator;

import com.example.mediaagent.backup.BackupSettings;
import com.example.mediaagent.config.DownloadSettings;
import com.example.mediaagent.config.JsonPreferencesStore;
import com.example.mediaagent.device.CameraKey;
import com.example.mediaagent.device.Device;
import com.example.mediaagent.device.DeviceDescriptor;
import com.example.mediaagent.device.DeviceState;
import com.example.mediaagent.media.FileStatus;
import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.progress.DownloadTracker.DeviceSummary;
import com.example.mediaagent.stage.BackupManager;
import com.example.mediaagent.stage.BackupMessages;
import com.example.mediaagent.stage.BackupMessages.BackupFile;
import com.example.mediaagent.stage.BackupMessages.FileBackedUp;
import com.example.mediaagent.stage.CopyFilesManager;
import com.example.mediaagent.stage.CopyMessages;
import com.example.mediaagent.stage.CopyMessages.CopyFilesArguments;
import com.example.mediaagent.stage.CopyMessages.FileCopied;
import com.example.mediaagent.stage.OffloadManager;
import com.example.mediaagent.stage.OffloadMessages;
import com.example.mediaagent.stage.PipelineEvent;
import com.example.mediaagent.stage.RenameMessages;
import com.example.mediaagent.stage.RenameMessages.DownloadCompleted;
import com.example.mediaagent.stage.RenameMessages.DownloadStarted;
import com.example.mediaagent.stage.RenameMessages.FileRenamed;
import com.example.mediaagent.stage.RenameMessages.RenameFile;
import com.example.mediaagent.stage.RenameMessages.SequencesUpdate;
import com.example.mediaagent.stage.RenameMoveFileManager;
import com.example.mediaagent.stage.ScanManager;
import com.example.mediaagent.stage.ScanMessages;
import com.example.mediaagent.stage.ScanMessages.FilesFound;
import com.example.mediaagent.stage.ScanMessages.ResumeScan;
import com.example.mediaagent.stage.ScanMessages.ScanErrorCode;
import com.example.mediaagent.stage.ScanMessages.ScanProblem;
import com.example.mediaagent.stage.Stage;
import com.example.mediaagent.stage.StageManagers;
import com.example.mediaagent.worker.WorkerControl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DownloadOrchestratorTest {

    @TempDir
    Path tmp;

    private final RecordingChannel<ScanMessages.Request, ScanMessages.Result> scan = new RecordingChannel<>();
    private final RecordingChannel<CopyMessages.Request, CopyMessages.Result> copy = new RecordingChannel<>();
    private final RecordingChannel<RenameMessages.Request, RenameMessages.Result> rename = new RecordingChannel<>();
    private final RecordingChannel<BackupMessages.Request, BackupMessages.Result> backup = new RecordingChannel<>();
    private final RecordingChannel<OffloadMessages.Request, OffloadMessages.Result> offload = new RecordingChannel<>();
    private final RecordingListener ui = new RecordingListener();

    private JsonPreferencesStore preferences;
    private RecordingMonitor monitor;
    private Path photos;

    @BeforeEach
    void setUp() throws Exception {
        preferences = JsonPreferencesStore.open(tmp.resolve("state.json"));
        monitor = new RecordingMonitor(tmp.resolve("cameras"));
        photos = Files.createDirectories(tmp.resolve("Fotos"));
    }

    private DownloadSettings.Builder settings() {
        return DownloadSettings.builder()
                .downloadFolder(FileType.PHOTO, photos)
                .downloadFolder(FileType.VIDEO, photos);
    }

    private DownloadOrchestrator orchestrator(DownloadSettings settings) {
        DownloadOrchestrator orchestrator = new DownloadOrchestrator(
                settings,
                preferences,
                events -> new StageManagers(new ScanManager(scan), new CopyFilesManager(copy),
                        new RenameMoveFileManager(rename), new BackupManager(backup), new OffloadManager(offload)),
                monitor,
                ui,
                new DirectEventLoop(),
                Runnable::run);
        orchestrator.start();
        return orchestrator;
    }

    /** Adiciona um cartão e conclui o scan com um arquivo. */
    private int scannedCard(DownloadOrchestrator orchestrator, String name) {
        Path card = tmp.resolve(name);
        orchestrator.deviceAdded(DeviceDescriptor.volume(card.toString(), name, List.of(), true));
        int id = ui.added.get(ui.added.size() - 1);
        orchestrator.dispatch(PipelineEvent.result(id, new FilesFound(List.of(photo(id, name)), 1, 0, 100, 0), Stage.SCAN));
        orchestrator.dispatch(PipelineEvent.finished(Stage.SCAN, id, false));
        return id;
    }

    /** Cartão com uma foto e um vídeo, já escaneado. */
    private int scannedCardWithVideo(DownloadOrchestrator orchestrator, String name) {
        Path card = tmp.resolve(name);
        orchestrator.deviceAdded(DeviceDescriptor.volume(card.toString(), name, List.of(), true));
        int id = ui.added.get(ui.added.size() - 1);
        orchestrator.dispatch(PipelineEvent.result(id, new FilesFound(List.of(photo(id, name), video(id, name)),
                1, 1, 100, 300), Stage.SCAN));
        orchestrator.dispatch(PipelineEvent.finished(Stage.SCAN, id, false));
        return id;
    }

    private static final CameraKey CAMERA = new CameraKey("Canon EOS R6", "usb:001,004");

    /** Câmera cujo scan começou; devolve o id. */
    private int addCamera(DownloadOrchestrator orchestrator) {
        orchestrator.deviceAdded(DeviceDescriptor.camera(CAMERA.model(), CAMERA.port()));
        return ui.added.get(ui.added.size() - 1);
    }

    private void finishScan(DownloadOrchestrator orchestrator, int id, String name) {
        orchestrator.dispatch(PipelineEvent.result(id, new FilesFound(List.of(photo(id, name)), 1, 0, 100, 0), Stage.SCAN));
        orchestrator.dispatch(PipelineEvent.finished(Stage.SCAN, id, false));
    }

    private MediaFileData video(int id, String card) {
        String relative = "DCIM/MVI_0002.MOV";
        return new MediaFileData(MediaFileData.uniqueIdFor(id, relative, 2000L), id, FileType.VIDEO,
                tmp.resolve(card).resolve(relative).toString(), relative, "MVI_0002.MOV", 300, 2000L);
    }

    private MediaFileData photo(int id, String card) {
        String relative = "DCIM/IMG_0001.JPG";
        return new MediaFileData(MediaFileData.uniqueIdFor(id, relative, 1000L), id, FileType.PHOTO,
                tmp.resolve(card).resolve(relative).toString(), relative, "IMG_0001.JPG", 100, 1000L);
    }

    private DeviceState state(DownloadOrchestrator orchestrator, int id) {
        for (Device d : orchestrator.devices()) {
            if (d.id() == id) {
                return d.state();
            }
        }
        throw new AssertionError("Dispositivo " + id + " ausente");
    }

    /** Cópia e renomeação bem-sucedidas do único arquivo do dispositivo. */
    private void downloadOneFile(DownloadOrchestrator orchestrator, int id, String card) {
        String uid = photo(id, card).uniqueId();
        orchestrator.dispatch(PipelineEvent.result(id, new FileCopied(uid, true, photos.resolve(".tmp/x").toString(), 1, null), Stage.COPY));
        orchestrator.dispatch(PipelineEvent.result(id, new FileRenamed(uid, true, photos.resolve("2024/IMG_0001.JPG").toString(),
                "2024", 1, null), Stage.RENAME));
    }

    private void copiedAndRenamed(DownloadOrchestrator orchestrator, MediaFileData file, int count) {
        int id = file.deviceId();
        orchestrator.dispatch(PipelineEvent.result(id, new FileCopied(file.uniqueId(), true,
                photos.resolve(".tmp/" + file.name()).toString(), count, null), Stage.COPY));
        orchestrator.dispatch(PipelineEvent.result(id, new FileRenamed(file.uniqueId(), true,
                photos.resolve("2024/" + file.name()).toString(), "2024", count, null), Stage.RENAME));
    }

    private PipelineEvent backedUp(int destination, MediaFileData file, boolean succeeded) {
        String path = succeeded ? tmp.resolve("copia").resolve(file.name()).toString() : null;
        return PipelineEvent.result(destination, new FileBackedUp(destination, file.uniqueId(), file.deviceId(),
                succeeded, true, path, null), Stage.BACKUP);
    }

    private FileStatus status(DownloadOrchestrator orchestrator, MediaFileData file) {
        return orchestrator.context().files().get(file.uniqueId()).orElseThrow().status();
    }

    private DownloadSettings.Builder manualPhotoBackup(Path destination) {
        return settings().backup(BackupSettings.builder()
                .enabled(true)
                .autodetect(false)
                .manualLocation(FileType.PHOTO, destination)
                .build());
    }

    @Test
    void fullCycleCompletesAndPersistsSequences() throws Exception {
        DownloadOrchestrator orchestrator = orchestrator(settings().build());
        int id = scannedCard(orchestrator, "cartao");
        assertEquals(DeviceState.SCANNED, state(orchestrator, id));
        assertEquals(1, offload.started.size());

        orchestrator.startDownload();

        assertEquals(DeviceState.DOWNLOADING, state(orchestrator, id));
        assertEquals(1, rename.of(DownloadStarted.class).size());
        CopyFilesArguments args = copy.of(CopyFilesArguments.class).get(0);
        assertEquals(1, args.files().size());
        assertEquals(photos.toString(), args.downloadFolders().get(FileType.PHOTO));
        assertEquals(List.of(false), ui.prefsEnabled);

        downloadOneFile(orchestrator, id, "cartao");

        assertEquals(1, rename.of(RenameFile.class).size());
        assertEquals(DeviceState.COMPLETED, state(orchestrator, id));
        assertEquals(List.of(false, true), ui.prefsEnabled);
        assertEquals(1, ui.completed.size());
        assertEquals(1, ui.completed.get(0).photosDownloaded());
        assertEquals(1, rename.of(DownloadCompleted.class).size());

        String today = LocalDate.now().toString();
        orchestrator.dispatch(PipelineEvent.result(null, new SequencesUpdate(12, today, 3), Stage.RENAME));

        assertEquals(12, preferences.storedSequenceNo());
        assertTrue(Files.exists(tmp.resolve("state.json")));
    }

    @Test
    void devicesWaitingForJobCodeShareOnePrompt() {
        DownloadOrchestrator orchestrator = orchestrator(settings()
                .renameTemplate(FileType.PHOTO, "{jobcode}_{name}{ext}")
                .build());
        int first = scannedCard(orchestrator, "cartao1");
        int second = scannedCard(orchestrator, "cartao2");

        orchestrator.startDownload();

        assertEquals(1, ui.jobCodePrompts);
        assertTrue(copy.started.isEmpty());

        orchestrator.jobCodeEntered("Casamento", false);

        assertEquals(List.of(first, second), copy.started);
        assertEquals(DeviceState.DOWNLOADING, state(orchestrator, first));
        assertEquals(DeviceState.DOWNLOADING, state(orchestrator, second));
    }

    @Test
    void scanRetryKeepsDeviceId() {
        DownloadOrchestrator orchestrator = orchestrator(settings().build());
        orchestrator.deviceAdded(DeviceDescriptor.volume(tmp.resolve("cartao").toString(), "cartao", List.of(), true));
        int id = ui.added.get(0);

        orchestrator.dispatch(PipelineEvent.result(id, new ScanProblem(ScanErrorCode.LOCKED, "sem permissao"), Stage.SCAN));
        assertEquals(DeviceState.ERROR, state(orchestrator, id));
        assertEquals(List.of(id), ui.scanErrors);

        orchestrator.resolveScanError(id, true);
        assertEquals(DeviceState.SCANNING, state(orchestrator, id));
        assertEquals(1, scan.of(ResumeScan.class).size());

        orchestrator.dispatch(PipelineEvent.result(id, new ScanProblem(ScanErrorCode.LOCKED, "sem permissao"), Stage.SCAN));
        scan.accepting = false;
        orchestrator.resolveScanError(id, true);

        assertEquals(List.of(id, id), scan.started);
        assertEquals(1, orchestrator.devices().size());
    }

    @Test
    void ignoringScanErrorRemovesDevice() {
        DownloadOrchestrator orchestrator = orchestrator(settings().build());
        orchestrator.deviceAdded(DeviceDescriptor.volume(tmp.resolve("cartao").toString(), "cartao", List.of(), true));
        int id = ui.added.get(0);
        orchestrator.dispatch(PipelineEvent.result(id, new ScanProblem(ScanErrorCode.INACCESSIBLE, "sumiu"), Stage.SCAN));

        orchestrator.resolveScanError(id, false);

        assertTrue(orchestrator.devices().isEmpty());
        assertEquals(List.of(id), ui.removed);
    }

    @Test
    void removingDeviceTwiceIsHarmless() {
        DownloadOrchestrator orchestrator = orchestrator(settings().build());
        int id = scannedCard(orchestrator, "cartao");

        orchestrator.deviceRemoved(id);
        orchestrator.deviceRemoved(id);

        assertEquals(List.of(id), ui.removed);
        assertTrue(orchestrator.devices().isEmpty());
    }

    @Test
    void removingLastActiveDeviceEndsCycle() {
        DownloadOrchestrator orchestrator = orchestrator(settings().build());
        int first = scannedCard(orchestrator, "cartao1");
        int second = scannedCard(orchestrator, "cartao2");
        orchestrator.startDownload();

        downloadOneFile(orchestrator, first, "cartao1");
        assertEquals(DeviceState.COMPLETED, state(orchestrator, first));
        assertTrue(ui.completed.isEmpty());

        orchestrator.deviceRemoved(second);

        assertEquals(List.of(second), copy.stopped);
        assertEquals(1, ui.completed.size());
        assertEquals(true, ui.prefsEnabled.get(ui.prefsEnabled.size() - 1));
    }

    @Test
    void pauseAndResumeReachCopyWorkers() {
        DownloadOrchestrator orchestrator = orchestrator(settings().build());
        scannedCard(orchestrator, "cartao");
        orchestrator.startDownload();

        orchestrator.pauseDownload();
        orchestrator.pauseDownload();
        orchestrator.resumeDownload();

        assertEquals(List.of(WorkerControl.PAUSE, WorkerControl.RESUME), copy.controls);
    }

    @Test
    void invalidDownloadFolderBlocksDownload() throws Exception {
        DownloadOrchestrator orchestrator = orchestrator(settings()
                .downloadFolder(FileType.PHOTO, tmp.resolve("nao-existe"))
                .build());
        int id = scannedCard(orchestrator, "cartao");

        orchestrator.startDownload();

        assertTrue(copy.started.isEmpty());
        assertEquals(List.of(Severity.CRITICAL), ui.diagnostics);
        assertEquals(DeviceState.DOWNLOAD_PENDING, state(orchestrator, id));
    }

    @Test
    void shutdownWaitsForSequencesOfInterruptedCycle() {
        DownloadOrchestrator orchestrator = orchestrator(settings().build());
        scannedCard(orchestrator, "cartao");
        orchestrator.startDownload();

        orchestrator.shutdown();

        assertFalse(ui.terminated);
        assertEquals(1, rename.of(DownloadCompleted.class).size());

        orchestrator.dispatch(PipelineEvent.result(null, new SequencesUpdate(1, LocalDate.now().toString(), 1), Stage.RENAME));

        assertTrue(ui.terminated);
        assertTrue(rename.shutDown);
        assertTrue(copy.shutDown);
    }

    @Test
    void idleShutdownTerminatesImmediately() {
        DownloadOrchestrator orchestrator = orchestrator(settings().build());

        orchestrator.shutdown();

        assertTrue(ui.terminated);
        orchestrator.deviceAdded(DeviceDescriptor.volume(tmp.resolve("cartao").toString(), "cartao", List.of(), true));
        assertTrue(ui.added.isEmpty());
    }

    @Test
    void removedDeviceEndsCycleWhenItsLastBackupArrives() {
        DownloadOrchestrator orchestrator = orchestrator(manualPhotoBackup(tmp.resolve("copia")).build());
        assertEquals(List.of(1), backup.started);
        int id = scannedCard(orchestrator, "cartao");
        orchestrator.startDownload();
        MediaFileData file = photo(id, "cartao");
        copiedAndRenamed(orchestrator, file, 1);
        assertEquals(1, backup.of(BackupFile.class).size());
        assertEquals(DeviceState.DOWNLOADING, state(orchestrator, id));

        orchestrator.deviceRemoved(id);
        assertTrue(ui.completed.isEmpty());

        orchestrator.dispatch(backedUp(1, file, true));

        assertEquals(1, ui.completed.size());
        assertEquals(true, ui.prefsEnabled.get(ui.prefsEnabled.size() - 1));
        assertEquals(1, rename.of(DownloadCompleted.class).size());
    }

    @Test
    void videoWaitsOnlyForDestinationsThatAcceptVideos() throws Exception {
        Path photosOnly = tmp.resolve("hd1");
        Files.createDirectories(photosOnly.resolve("photos"));
        Path both = tmp.resolve("hd2");
        Files.createDirectories(both.resolve("photos"));
        Files.createDirectories(both.resolve("videos"));
        DownloadOrchestrator orchestrator = orchestrator(settings()
                .backup(BackupSettings.builder().enabled(true).build())
                .build());
        orchestrator.backupVolumeMounted(photosOnly, "HD1");
        orchestrator.backupVolumeMounted(both, "HD2");
        assertEquals(List.of(1, 2), backup.started);
        assertEquals("2/1", ui.backupCounts.get(ui.backupCounts.size() - 1));

        int id = scannedCardWithVideo(orchestrator, "cartao");
        orchestrator.startDownload();
        MediaFileData photo = photo(id, "cartao");
        MediaFileData video = video(id, "cartao");
        copiedAndRenamed(orchestrator, photo, 1);
        copiedAndRenamed(orchestrator, video, 2);

        List<BackupFile> sent = backup.of(BackupFile.class);
        assertEquals(3, sent.size());
        assertEquals("videos", sent.get(2).identifier());

        orchestrator.dispatch(backedUp(2, video, true));
        assertEquals(FileStatus.DOWNLOADED, status(orchestrator, video));
        assertEquals(DeviceState.DOWNLOADING, state(orchestrator, id));

        orchestrator.dispatch(backedUp(1, photo, true));
        assertEquals(DeviceState.DOWNLOADING, state(orchestrator, id));
        orchestrator.dispatch(backedUp(2, photo, true));

        assertEquals(FileStatus.DOWNLOADED, status(orchestrator, photo));
        assertEquals(DeviceState.COMPLETED, state(orchestrator, id));
        assertEquals(1, ui.completed.get(0).photosDownloaded());
        assertEquals(1, ui.completed.get(0).videosDownloaded());
    }

    @Test
    void downloadWithoutBackupDestinationWarnsAndProceeds() {
        DownloadOrchestrator orchestrator = orchestrator(settings()
                .backup(BackupSettings.builder().enabled(true).build())
                .build());
        int id = scannedCard(orchestrator, "cartao");

        orchestrator.startDownload();
        assertEquals(List.of(Severity.WARNING), ui.diagnostics);
        assertEquals(List.of(id), copy.started);

        downloadOneFile(orchestrator, id, "cartao");

        assertTrue(backup.of(BackupFile.class).isEmpty());
        assertEquals(DeviceState.COMPLETED, state(orchestrator, id));
    }

    @Test
    void destinationRemovedMidDownloadFailsItsPendingBackups() {
        Path destination = tmp.resolve("copia");
        DownloadOrchestrator orchestrator = orchestrator(manualPhotoBackup(destination).build());
        int id = scannedCard(orchestrator, "cartao");
        orchestrator.startDownload();
        MediaFileData file = photo(id, "cartao");
        copiedAndRenamed(orchestrator, file, 1);

        orchestrator.volumeUnmounted(destination);

        assertEquals(List.of(1), backup.stopped);
        assertEquals("0/0", ui.backupCounts.get(ui.backupCounts.size() - 1));
        assertEquals(FileStatus.BACKUP_PROBLEM, status(orchestrator, file));
        assertEquals(DeviceState.COMPLETED, state(orchestrator, id));
        assertEquals(1, ui.completed.size());
    }

    @Test
    void backupWorkerCrashFailsPendingBackups() {
        DownloadOrchestrator orchestrator = orchestrator(manualPhotoBackup(tmp.resolve("copia")).build());
        int id = scannedCard(orchestrator, "cartao");
        orchestrator.startDownload();
        MediaFileData file = photo(id, "cartao");
        copiedAndRenamed(orchestrator, file, 1);

        orchestrator.dispatch(PipelineEvent.finished(Stage.BACKUP, 1, true));

        assertEquals(List.of(Severity.SERIOUS), ui.diagnostics);
        assertEquals("0/0", ui.backupCounts.get(ui.backupCounts.size() - 1));
        assertEquals(FileStatus.BACKUP_PROBLEM, status(orchestrator, file));
        assertEquals(DeviceState.COMPLETED, state(orchestrator, id));
    }

    @Test
    void cameraScanWaitsForUnmount() {
        monitor.mountedBeforeScan = true;
        DownloadOrchestrator orchestrator = orchestrator(settings().build());
        int id = addCamera(orchestrator);

        assertEquals(List.of(CAMERA), monitor.scanUnmounts);
        assertTrue(scan.started.isEmpty());
        assertEquals(DeviceState.REGISTERED, state(orchestrator, id));

        orchestrator.deviceAdded(DeviceDescriptor.camera(CAMERA.model(), CAMERA.port()));
        assertEquals(1, ui.added.size());
        assertEquals(1, monitor.scanUnmounts.size());

        orchestrator.cameraUnmounted(CAMERA, true, false);
        assertEquals(List.of(id), scan.started);
        assertEquals(DeviceState.SCANNING, state(orchestrator, id));

        orchestrator.cameraUnmounted(CAMERA, true, false);
        assertEquals(List.of(id), scan.started);
    }

    @Test
    void failedUnmountBeforeScanReportsLockedCamera() {
        monitor.mountedBeforeScan = true;
        DownloadOrchestrator orchestrator = orchestrator(settings().build());
        int id = addCamera(orchestrator);

        orchestrator.cameraUnmounted(CAMERA, false, false);

        assertTrue(scan.started.isEmpty());
        assertEquals(DeviceState.ERROR, state(orchestrator, id));
        assertEquals(List.of(id), ui.scanErrors);
        assertEquals(List.of(ScanErrorCode.LOCKED), ui.scanErrorCodes);
    }

    @Test
    void downloadWaitsForCameraUnmount() {
        monitor.mountedBeforeDownload = true;
        DownloadOrchestrator orchestrator = orchestrator(settings().build());
        int camera = addCamera(orchestrator);
        assertEquals(List.of(camera), scan.started);
        finishScan(orchestrator, camera, "camera");
        int card = scannedCard(orchestrator, "cartao");

        orchestrator.startDownload();

        assertEquals(List.of(CAMERA), monitor.downloadUnmounts);
        assertTrue(copy.started.isEmpty());
        assertEquals(DeviceState.DOWNLOAD_PENDING, state(orchestrator, camera));
        assertEquals(DeviceState.DOWNLOAD_PENDING, state(orchestrator, card));

        orchestrator.cameraUnmounted(CAMERA, true, true);

        assertEquals(2, copy.started.size());
        assertTrue(copy.started.containsAll(List.of(camera, card)));
    }

    @Test
    void failedUnmountBeforeDownloadSkipsOnlyTheCamera() {
        monitor.mountedBeforeDownload = true;
        DownloadOrchestrator orchestrator = orchestrator(settings().build());
        int camera = addCamera(orchestrator);
        finishScan(orchestrator, camera, "camera");
        int card = scannedCard(orchestrator, "cartao");
        orchestrator.startDownload();

        orchestrator.cameraUnmounted(CAMERA, false, true);

        assertEquals(List.of(card), copy.started);
        assertEquals(List.of(Severity.SERIOUS), ui.diagnostics);
        assertEquals(DeviceState.DOWNLOAD_PENDING, state(orchestrator, camera));

        downloadOneFile(orchestrator, card, "cartao");
        assertEquals(1, ui.completed.size());
    }

    /** Executa tudo na thread do teste; agendamentos não disparam. */
    private static final class DirectEventLoop implements EventLoop {

        @Override
        public void execute(Runnable task) {
            task.run();
        }

        @Override
        public void schedule(Runnable task, Duration delay) {
        }

        @Override
        public void scheduleAtFixedRate(Runnable task, Duration period) {
        }

        @Override
        public void close() {
        }
    }

    private static final class RecordingListener implements PresentationListener {
        final List<Integer> added = new ArrayList<>();
        final List<Integer> removed = new ArrayList<>();
        final List<Integer> scanErrors = new ArrayList<>();
        final List<ScanErrorCode> scanErrorCodes = new ArrayList<>();
        final List<String> backupCounts = new ArrayList<>();
        final List<Boolean> prefsEnabled = new ArrayList<>();
        final List<DeviceSummary> completed = new ArrayList<>();
        final List<Severity> diagnostics = new ArrayList<>();
        int jobCodePrompts;
        boolean terminated;

        @Override
        public void deviceAdded(Device device) {
            added.add(device.id());
        }

        @Override
        public void deviceRemoved(int deviceId) {
            removed.add(deviceId);
        }

        @Override
        public void scanErrorPrompt(int deviceId, ScanErrorCode code, String message) {
            scanErrors.add(deviceId);
            scanErrorCodes.add(code);
        }

        @Override
        public void backupDestinationsChanged(int photoDestinations, int videoDestinations) {
            backupCounts.add(photoDestinations + "/" + videoDestinations);
        }

        @Override
        public void prefsEnabled(boolean enabled) {
            prefsEnabled.add(enabled);
        }

        @Override
        public void downloadCompleted(DeviceSummary summary) {
            completed.add(summary);
        }

        @Override
        public void diagnostic(Severity severity, String title, String details) {
            diagnostics.add(severity);
        }

        @Override
        public void promptForJobCode(List<String> previousCodes, boolean rememberDefault) {
            jobCodePrompts++;
        }

        @Override
        public void terminated() {
            terminated = true;
        }
    }
}
