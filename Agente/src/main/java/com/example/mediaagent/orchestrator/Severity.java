package com.example.mediaagent.orchestrator;

/**
 * Gravidade de um diagnóstico enviado à apresentação.
 */
public enum Severity {
    /** Problema num arquivo que ainda foi baixado. */
    WARNING,
    /** Falha num arquivo; o restante do download continua. */
    SERIOUS,
    /** Configuração impede o início do download. */
    CRITICAL
}
