package com.example.mediaagent.device;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeviceStateTest {

    @Test
    void everyStateCanBeRemoved() {
        for (DeviceState s : DeviceState.values()) {
            if (s != DeviceState.REMOVED) {
                assertTrue(s.canTransitionTo(DeviceState.REMOVED), s.name());
            }
        }
    }

    @Test
    void removedIsTerminal() {
        assertTrue(DeviceState.REMOVED.isTerminal());
        for (DeviceState s : DeviceState.values()) {
            assertFalse(DeviceState.REMOVED.canTransitionTo(s), s.name());
        }
    }

    @Test
    void completedDeviceMayDownloadAgain() {
        assertTrue(DeviceState.COMPLETED.canTransitionTo(DeviceState.DOWNLOAD_PENDING));
        assertFalse(DeviceState.DOWNLOAD_PENDING.canTransitionTo(DeviceState.SCANNED));
        assertFalse(DeviceState.SCANNED.canTransitionTo(DeviceState.DOWNLOADING));
    }
}
