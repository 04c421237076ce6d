package com.example.mediaagent.device;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Descrição de um dispositivo como reportado pelo monitor de dispositivos/montagens.
 *
 * Câmeras são identificadas por (modelo, porta); volumes e caminhos locais pelo caminho.
 */
public final class DeviceDescriptor {
    private final DeviceKind kind;
    private final String path;
    private final String cameraModel;
    private final String cameraPort;
    private final String displayName;
    private final List<String> iconNames;
    private final boolean ejectable;

    @JsonCreator
    public DeviceDescriptor(@JsonProperty("kind") DeviceKind kind,
                            @JsonProperty("path") String path,
                            @JsonProperty("cameraModel") String cameraModel,
                            @JsonProperty("cameraPort") String cameraPort,
                            @JsonProperty("displayName") String displayName,
                            @JsonProperty("iconNames") List<String> iconNames,
                            @JsonProperty("ejectable") boolean ejectable) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.path = path;
        this.cameraModel = cameraModel;
        this.cameraPort = cameraPort;
        this.displayName = displayName;
        this.iconNames = iconNames == null ? List.of() : List.copyOf(iconNames);
        this.ejectable = ejectable;
        if (kind == DeviceKind.CAMERA) {
            Objects.requireNonNull(cameraModel, "cameraModel");
            Objects.requireNonNull(cameraPort, "cameraPort");
        } else {
            Objects.requireNonNull(path, "path");
        }
    }

    public static DeviceDescriptor camera(String model, String port) {
        return new DeviceDescriptor(DeviceKind.CAMERA, null, model, port, model, List.of("camera-photo"), true);
    }

    public static DeviceDescriptor volume(String path, String displayName, List<String> iconNames, boolean ejectable) {
        return new DeviceDescriptor(DeviceKind.VOLUME, path, null, null, displayName, iconNames, ejectable);
    }

    public static DeviceDescriptor localPath(String path) {
        return new DeviceDescriptor(DeviceKind.PATH, path, null, null, null, List.of("folder"), false);
    }

    @JsonProperty("kind") public DeviceKind kind() { return kind; }
    @JsonProperty("path") public String path() { return path; }
    @JsonProperty("cameraModel") public String cameraModel() { return cameraModel; }
    @JsonProperty("cameraPort") public String cameraPort() { return cameraPort; }
    @JsonProperty("iconNames") public List<String> iconNames() { return iconNames; }
    @JsonProperty("ejectable") public boolean ejectable() { return ejectable; }

    @JsonProperty("displayName")
    public String displayName() {
        return displayName;
    }

    /**
     * Nome amigável: o informado pelo monitor, ou o último segmento do caminho.
     */
    public String name() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        if (kind == DeviceKind.CAMERA) {
            return cameraModel;
        }
        String normalized = path.replace('\\', '/');
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 && slash < normalized.length() - 1 ? normalized.substring(slash + 1) : normalized;
    }

    public Optional<CameraKey> cameraKey() {
        return kind == DeviceKind.CAMERA ? Optional.of(new CameraKey(cameraModel, cameraPort)) : Optional.empty();
    }

    @Override
    public String toString() {
        return kind == DeviceKind.CAMERA
                ? "camera " + cameraModel + " @ " + cameraPort
                : kind.name().toLowerCase() + " " + path;
    }
}
