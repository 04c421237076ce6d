package com.example.mediaagent.device;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Estados do pipeline de um dispositivo.
 *
 * <pre>
 * REGISTERED -> SCANNING -> SCANNED -> DOWNLOAD_PENDING -> DOWNLOADING -> COMPLETED
 *                  |  ^
 *                  v  |  (retry)
 *                 ERROR
 * qualquer estado -> REMOVED
 * </pre>
 *
 * COMPLETED volta a DOWNLOAD_PENDING quando restam arquivos não baixados no dispositivo
 * (download parcial seguido de novo download).
 */
public enum DeviceState {
    REGISTERED,
    SCANNING,
    SCANNED,
    DOWNLOAD_PENDING,
    DOWNLOADING,
    COMPLETED,
    ERROR,
    REMOVED;

    private static final Map<DeviceState, Set<DeviceState>> TRANSITIONS = new EnumMap<>(DeviceState.class);

    static {
        TRANSITIONS.put(REGISTERED, EnumSet.of(SCANNING, REMOVED));
        TRANSITIONS.put(SCANNING, EnumSet.of(SCANNED, ERROR, REMOVED));
        TRANSITIONS.put(ERROR, EnumSet.of(SCANNING, REMOVED));
        TRANSITIONS.put(SCANNED, EnumSet.of(DOWNLOAD_PENDING, REMOVED));
        TRANSITIONS.put(DOWNLOAD_PENDING, EnumSet.of(DOWNLOADING, REMOVED));
        TRANSITIONS.put(DOWNLOADING, EnumSet.of(COMPLETED, REMOVED));
        TRANSITIONS.put(COMPLETED, EnumSet.of(DOWNLOAD_PENDING, REMOVED));
        TRANSITIONS.put(REMOVED, EnumSet.noneOf(DeviceState.class));
    }

    public boolean canTransitionTo(DeviceState next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return this == REMOVED;
    }
}
