package com.example.mediaagent.device;

import java.util.Objects;

/**
 * Par (modelo, porta) que identifica uma câmera conectada.
 */
public final class CameraKey {
    private final String model;
    private final String port;

    public CameraKey(String model, String port) {
        this.model = Objects.requireNonNull(model, "model");
        this.port = Objects.requireNonNull(port, "port");
    }

    public String model() { return model; }
    public String port() { return port; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CameraKey)) return false;
        CameraKey other = (CameraKey) o;
        return model.equals(other.model) && port.equals(other.port);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, port);
    }

    @Override
    public String toString() {
        return model + " @ " + port;
    }
}
