package com.example.mediaagent.worker;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Marcador dos payloads trocados com workers (requisições e resultados).
 *
 * Implementações devem ser imutáveis: no modo processo são serializadas,
 * no modo thread o mesmo objeto é entregue ao outro lado.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.CLASS, include = JsonTypeInfo.As.PROPERTY, property = "@type")
public interface WorkerMessage {
}
