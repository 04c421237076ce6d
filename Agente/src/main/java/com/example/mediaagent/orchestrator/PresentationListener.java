package com.example.mediaagent.orchestrator;

import com.example.mediaagent.device.Device;
import com.example.mediaagent.device.DeviceState;
import com.example.mediaagent.jobcode.JobCodePrompt;
import com.example.mediaagent.progress.DownloadTracker.DeviceSummary;
import com.example.mediaagent.stage.OffloadMessages.ProximityGroup;
import com.example.mediaagent.stage.ScanMessages.ScanErrorCode;
import java.util.List;

/**
 * Eventos de saída para a camada de apresentação. Todos chegam na thread do
 * orquestrador e não devem bloquear; as respostas do usuário voltam pelos métodos
 * públicos de {@link DownloadOrchestrator}.
 */
public interface PresentationListener extends JobCodePrompt {

    default void deviceAdded(Device device) {}

    default void deviceRemoved(int deviceId) {}

    default void deviceStateChanged(int deviceId, DeviceState state) {}

    /** Nome de exibição ou espaço em disco atualizados pelo scan. */
    default void deviceInfoUpdated(Device device) {}

    /** Contadores de arquivos encontrados até agora. */
    default void scanProgress(Device device) {}

    /**
     * @param percent fração [0, 1]
     * @param statusText ex.: "3 de 205 fotos e videos (202 restantes)"
     */
    default void deviceProgress(int deviceId, double percent, String statusText) {}

    default void overallProgress(double percent) {}

    /** Texto vazio quando não há estimativa. */
    default void timeRemaining(String text) {}

    default void notification(String title, String message) {}

    default void diagnostic(Severity severity, String title, String details) {}

    /** Preferências e nova leitura ficam bloqueadas durante um download. */
    default void prefsEnabled(boolean enabled) {}

    default void backupDestinationsChanged(int photoDestinations, int videoDestinations) {}

    default void proximityGroups(List<ProximityGroup> groups) {}

    @Override
    default void promptForJobCode(List<String> previousCodes, boolean rememberDefault) {}

    /**
     * Pede ao usuário tentar de novo ou ignorar o dispositivo. A resposta volta por
     * {@link DownloadOrchestrator#resolveScanError(int, boolean)}.
     */
    default void scanErrorPrompt(int deviceId, ScanErrorCode code, String message) {}

    default void downloadCompleted(DeviceSummary summary) {}

    /** O orquestrador terminou o encerramento. */
    default void terminated() {}
}
