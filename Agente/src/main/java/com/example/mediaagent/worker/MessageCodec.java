package com.example.mediaagent.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;

/**
 * Codifica envelopes como JSON de uma linha (NDJSON) para o canal stdin/stdout dos workers.
 */
public final class MessageCodec {

    private final ObjectMapper mapper;

    public MessageCodec() {
        this.mapper = new ObjectMapper()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(WorkerEnvelope envelope) throws JsonProcessingException {
        return mapper.writeValueAsString(envelope);
    }

    public WorkerEnvelope decode(String line) throws IOException {
        return mapper.readValue(line, WorkerEnvelope.class);
    }
}
