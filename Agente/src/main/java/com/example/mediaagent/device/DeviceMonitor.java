package com.example.mediaagent.device;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Colaborador de descoberta de dispositivos e montagens.
 *
 * Eventos de inserção/remoção chegam ao orquestrador pelos métodos
 * {@code deviceAdded}/{@code deviceRemoved}; este contrato cobre as operações
 * que o orquestrador pede ao sistema operacional.
 */
public interface DeviceMonitor {

    /**
     * Pede ao SO que libere a montagem automática de uma câmera. Assíncrono:
     * o resultado chega depois por {@code DownloadOrchestrator#cameraUnmounted}.
     *
     * @return false se nenhuma montagem existia (nada a negociar)
     */
    boolean unmountCamera(CameraKey camera, boolean downloadStarting);

    /**
     * Caminho pelo qual os arquivos de uma câmera podem ser lidos.
     */
    Optional<Path> cameraAccessPath(CameraKey camera);

    /**
     * Desmonta um volume após o download (se configurado).
     */
    void unmountVolume(Path path);

    /**
     * Monitor sem câmeras nem desmontagem, usado no modo headless.
     */
    static DeviceMonitor none() {
        return new DeviceMonitor() {
            @Override
            public boolean unmountCamera(CameraKey camera, boolean downloadStarting) {
                return false;
            }

            @Override
            public Optional<Path> cameraAccessPath(CameraKey camera) {
                return Optional.empty();
            }

            @Override
            public void unmountVolume(Path path) {
                // sem suporte a desmontagem
            }
        };
    }
}
