package com.example.mediaagent.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Uma linha do protocolo entre orquestrador e worker.
 *
 * REQUEST e RESULT carregam um payload; CONTROL carrega um {@link WorkerControl}.
 * {@code deviceId} identifica o dispositivo a que a mensagem se refere.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkerEnvelope {

    public enum Kind { REQUEST, CONTROL, RESULT }

    private final Kind kind;
    private final Integer deviceId;
    private final WorkerControl control;
    private final WorkerMessage payload;

    @JsonCreator
    public WorkerEnvelope(@JsonProperty("kind") Kind kind,
                          @JsonProperty("deviceId") Integer deviceId,
                          @JsonProperty("control") WorkerControl control,
                          @JsonProperty("payload") WorkerMessage payload) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.deviceId = deviceId;
        this.control = control;
        this.payload = payload;
    }

    public static WorkerEnvelope request(Integer deviceId, WorkerMessage payload) {
        return new WorkerEnvelope(Kind.REQUEST, deviceId, null, Objects.requireNonNull(payload, "payload"));
    }

    public static WorkerEnvelope result(Integer deviceId, WorkerMessage payload) {
        return new WorkerEnvelope(Kind.RESULT, deviceId, null, Objects.requireNonNull(payload, "payload"));
    }

    public static WorkerEnvelope control(WorkerControl control) {
        return new WorkerEnvelope(Kind.CONTROL, null, Objects.requireNonNull(control, "control"), null);
    }

    @JsonProperty("kind") public Kind kind() { return kind; }
    @JsonProperty("deviceId") public Integer deviceId() { return deviceId; }
    @JsonProperty("control") public WorkerControl control() { return control; }
    @JsonProperty("payload") public WorkerMessage payload() { return payload; }
}
