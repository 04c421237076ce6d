package com.example.mediaagent.orchestrator;

import com.example.mediaagent.device.CameraKey;
import com.example.mediaagent.device.DeviceMonitor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Monitor falso: registra os pedidos de desmontagem. As respostas são entregues pelo
 * teste via {@link DownloadOrchestrator#cameraUnmounted}.
 */
final class RecordingMonitor implements DeviceMonitor {

    final List<CameraKey> scanUnmounts = new ArrayList<>();
    final List<CameraKey> downloadUnmounts = new ArrayList<>();
    final List<Path> unmountedVolumes = new ArrayList<>();
    boolean mountedBeforeScan;
    boolean mountedBeforeDownload;
    private final Path cameraRoot;

    RecordingMonitor(Path cameraRoot) {
        this.cameraRoot = cameraRoot;
    }

    @Override
    public boolean unmountCamera(CameraKey camera, boolean downloadStarting) {
        if (downloadStarting) {
            downloadUnmounts.add(camera);
            return mountedBeforeDownload;
        }
        scanUnmounts.add(camera);
        return mountedBeforeScan;
    }

    @Override
    public Optional<Path> cameraAccessPath(CameraKey camera) {
        return Optional.of(cameraRoot.resolve(camera.model()));
    }

    @Override
    public void unmountVolume(Path path) {
        unmountedVolumes.add(path);
    }
}
