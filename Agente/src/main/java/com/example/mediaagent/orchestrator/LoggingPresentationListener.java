package com.example.mediaagent.orchestrator;

import com.example.mediaagent.device.Device;
import com.example.mediaagent.device.DeviceState;
import com.example.mediaagent.progress.DownloadTracker.DeviceSummary;
import com.example.mediaagent.stage.OffloadMessages.ProximityGroup;
import com.example.mediaagent.stage.ScanMessages.ScanErrorCode;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Apresentação do modo headless: tudo vira log.
 */
public class LoggingPresentationListener implements PresentationListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingPresentationListener.class);

    private long lastOverall = -1;

    @Override
    public void deviceAdded(Device device) {
        log.info("Dispositivo {} adicionado: {}", device.id(), device.displayName());
    }

    @Override
    public void deviceRemoved(int deviceId) {
        log.info("Dispositivo {} removido", deviceId);
    }

    @Override
    public void deviceStateChanged(int deviceId, DeviceState state) {
        log.debug("Dispositivo {} -> {}", deviceId, state);
    }

    @Override
    public void deviceInfoUpdated(Device device) {
        log.debug("Dispositivo {}: {}", device.id(), device.displayName());
    }

    @Override
    public void deviceProgress(int deviceId, double percent, String statusText) {
        log.debug("Dispositivo {}: {} ({})", deviceId, statusText, percentText(percent));
    }

    @Override
    public void overallProgress(double percent) {
        long rounded = Math.round(percent * 100);
        if (rounded != lastOverall && rounded % 10 == 0) {
            log.info("Progresso geral: {}%", rounded);
        }
        lastOverall = rounded;
    }

    @Override
    public void timeRemaining(String text) {
        if (!text.isEmpty()) {
            log.debug(text);
        }
    }

    @Override
    public void notification(String title, String message) {
        log.info("{}: {}", title, message);
    }

    @Override
    public void diagnostic(Severity severity, String title, String details) {
        if (severity == Severity.WARNING) {
            log.warn("{}: {}", title, details);
        } else {
            log.error("[{}] {}: {}", severity, title, details);
        }
    }

    @Override
    public void backupDestinationsChanged(int photoDestinations, int videoDestinations) {
        log.info("Destinos de backup: {} para fotos, {} para videos", photoDestinations, videoDestinations);
    }

    @Override
    public void proximityGroups(List<ProximityGroup> groups) {
        log.debug("{} grupos de proximidade temporal", groups.size());
    }

    @Override
    public void promptForJobCode(List<String> previousCodes, boolean rememberDefault) {
        log.warn("Codigo de trabalho necessario para os nomes configurados (defina JOB_CODE)");
    }

    @Override
    public void scanErrorPrompt(int deviceId, ScanErrorCode code, String message) {
        log.warn("Dispositivo {} com erro de leitura ({}): {}", deviceId, code, message);
    }

    @Override
    public void downloadCompleted(DeviceSummary summary) {
        log.info("Download concluido: {}", summary.message());
    }

    @Override
    public void terminated() {
        log.info("Orquestrador encerrado");
    }

    private static String percentText(double percent) {
        return String.format(Locale.ROOT, "%.0f%%", percent * 100);
    }
}
