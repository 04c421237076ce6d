package com.example.mediaagent.device;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Dispositivo registrado. Mantido exclusivamente pela {@link DeviceCollection}.
 */
public final class Device {
    private final int id;
    private final DeviceDescriptor descriptor;
    private final FileTypeCounter counter = new FileTypeCounter();
    private DeviceState state = DeviceState.REGISTERED;
    private String displayName;
    private Long storageSpace;
    private Long storageFree;

    Device(int id, DeviceDescriptor descriptor) {
        this.id = id;
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.displayName = descriptor.name();
    }

    public int id() { return id; }
    public DeviceDescriptor descriptor() { return descriptor; }
    public DeviceKind kind() { return descriptor.kind(); }
    public DeviceState state() { return state; }
    public FileTypeCounter counter() { return counter; }

    void setState(DeviceState state) {
        this.state = state;
    }

    public String displayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        if (displayName != null && !displayName.isBlank()) {
            this.displayName = displayName;
        }
    }

    public void setStorage(long total, long free) {
        this.storageSpace = total;
        this.storageFree = free;
    }

    public OptionalLong storageSpace() {
        return storageSpace == null ? OptionalLong.empty() : OptionalLong.of(storageSpace);
    }

    public OptionalLong storageFree() {
        return storageFree == null ? OptionalLong.empty() : OptionalLong.of(storageFree);
    }

    public boolean isCamera() {
        return descriptor.kind() == DeviceKind.CAMERA;
    }

    @Override
    public String toString() {
        return "Device{" + id + ", " + displayName + ", " + state + "}";
    }
}
