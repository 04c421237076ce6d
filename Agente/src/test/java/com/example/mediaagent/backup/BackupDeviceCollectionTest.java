package com.example.mediaagent.backup;

import com.example.mediaagent.media.FileType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackupDeviceCollectionTest {

    @TempDir
    Path tmp;

    private static BackupSettings autodetect() {
        return BackupSettings.builder().enabled(true).autodetect(true).build();
    }

    @Test
    void detectsCapabilityFromIdentifierFolders() throws IOException {
        Path both = Files.createDirectories(tmp.resolve("both"));
        Files.createDirectories(both.resolve("photos"));
        Files.createDirectories(both.resolve("videos"));
        Path photosOnly = Files.createDirectories(tmp.resolve("photosOnly"));
        Files.createDirectories(photosOnly.resolve("photos"));
        Path none = Files.createDirectories(tmp.resolve("none"));

        BackupDeviceCollection backups = new BackupDeviceCollection(autodetect());

        assertEquals(Optional.of(BackupLocationType.PHOTOS_AND_VIDEOS), backups.isBackupPath(both));
        assertEquals(Optional.of(BackupLocationType.PHOTOS), backups.isBackupPath(photosOnly));
        assertTrue(backups.isBackupPath(none).isEmpty());
    }

    @Test
    void disabledBackupNeverMatches() throws IOException {
        Path both = Files.createDirectories(tmp.resolve("both"));
        Files.createDirectories(both.resolve("photos"));

        BackupDeviceCollection backups = new BackupDeviceCollection(BackupSettings.disabled());

        assertTrue(backups.isBackupPath(both).isEmpty());
    }

    @Test
    void countsFollowAddAndRemove() {
        BackupDeviceCollection backups = new BackupDeviceCollection(autodetect());
        Path a = tmp.resolve("a");
        Path b = tmp.resolve("b");

        backups.add(a, BackupLocationType.PHOTOS, "Disco A");
        backups.add(b, BackupLocationType.PHOTOS_AND_VIDEOS, null);
        assertEquals(2, backups.photoDestinationCount());
        assertEquals(1, backups.videoDestinationCount());

        assertTrue(backups.add(a, BackupLocationType.PHOTOS, "Disco A").isEmpty(), "readicionar nao muda nada");
        assertEquals(2, backups.size());

        backups.remove(b);
        assertEquals(1, backups.photoDestinationCount());
        assertEquals(0, backups.videoDestinationCount());
        assertTrue(backups.backupPossible(FileType.PHOTO));
        assertTrue(!backups.backupPossible(FileType.VIDEO));
        assertEquals("Disco A", backups.get(a).orElseThrow().displayName());
    }

    @Test
    void readdingWithNewCapabilityKeepsId() {
        BackupDeviceCollection backups = new BackupDeviceCollection(autodetect());
        Path a = tmp.resolve("a");

        int id = backups.add(a, BackupLocationType.PHOTOS, null).orElseThrow().id();
        BackupDevice updated = backups.add(a, BackupLocationType.PHOTOS_AND_VIDEOS, null).orElseThrow();

        assertEquals(id, updated.id());
        assertEquals(1, backups.size());
        assertEquals(1, backups.videoDestinationCount());
    }

    @Test
    void manualSamePathBecomesSingleDestination() {
        Path shared = tmp.resolve("shared");
        BackupSettings settings = BackupSettings.builder()
                .enabled(true)
                .autodetect(false)
                .manualLocation(FileType.PHOTO, shared)
                .manualLocation(FileType.VIDEO, shared)
                .build();
        BackupDeviceCollection backups = new BackupDeviceCollection(settings);

        List<BackupDevice> added = backups.setupManualBackup();

        assertEquals(1, added.size());
        assertEquals(BackupLocationType.PHOTOS_AND_VIDEOS, added.get(0).type());
        assertEquals(Optional.of(BackupLocationType.PHOTOS_AND_VIDEOS), backups.isBackupPath(shared));
    }

    @Test
    void manualDistinctPaths() {
        BackupSettings settings = BackupSettings.builder()
                .enabled(true)
                .autodetect(false)
                .manualLocation(FileType.PHOTO, tmp.resolve("p"))
                .manualLocation(FileType.VIDEO, tmp.resolve("v"))
                .build();
        BackupDeviceCollection backups = new BackupDeviceCollection(settings);

        assertEquals(2, backups.setupManualBackup().size());
        assertEquals(1, backups.photoDestinationCount());
        assertEquals(1, backups.videoDestinationCount());
        assertTrue(backups.isBackupPath(tmp.resolve("other")).isEmpty());
    }
}
