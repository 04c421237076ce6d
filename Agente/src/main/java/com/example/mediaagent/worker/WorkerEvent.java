package com.example.mediaagent.worker;

import java.util.Objects;
import java.util.Optional;

/**
 * Evento entregue pelo canal ao seu sink: um resultado ou o fim de um worker.
 *
 * {@code unexpected} só é verdadeiro em FINISHED quando o worker saiu sem ter sido
 * parado nem ter concluído o trabalho (crash, exceção não tratada, código de saída != 0).
 */
public final class WorkerEvent<R> {

    public enum Kind { RESULT, FINISHED }

    private final Kind kind;
    private final Integer deviceId;
    private final R payload;
    private final boolean unexpected;

    private WorkerEvent(Kind kind, Integer deviceId, R payload, boolean unexpected) {
        this.kind = kind;
        this.deviceId = deviceId;
        this.payload = payload;
        this.unexpected = unexpected;
    }

    public static <R> WorkerEvent<R> result(Integer deviceId, R payload) {
        return new WorkerEvent<>(Kind.RESULT, deviceId, Objects.requireNonNull(payload, "payload"), false);
    }

    public static <R> WorkerEvent<R> finished(Integer deviceId, boolean unexpected) {
        return new WorkerEvent<>(Kind.FINISHED, deviceId, null, unexpected);
    }

    public Kind kind() { return kind; }
    public boolean unexpected() { return unexpected; }

    /** Dispositivo do resultado, ou do worker (pooled). Vazio para o fim de um worker singleton. */
    public Optional<Integer> deviceId() {
        return Optional.ofNullable(deviceId);
    }

    public R payload() {
        if (kind != Kind.RESULT) {
            throw new IllegalStateException("Evento sem payload: " + kind);
        }
        return payload;
    }

    @Override
    public String toString() {
        return kind == Kind.RESULT
                ? "WorkerEvent{RESULT, device=" + deviceId + ", " + payload.getClass().getSimpleName() + "}"
                : "WorkerEvent{FINISHED, device=" + deviceId + ", unexpected=" + unexpected + "}";
    }
}
