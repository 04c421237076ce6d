package com.example.mediaagent.device;

/**
 * Origem de mídia: câmera (acesso via protocolo, montada pelo SO), volume montado ou caminho local.
 */
public enum DeviceKind {
    CAMERA,
    VOLUME,
    PATH
}
