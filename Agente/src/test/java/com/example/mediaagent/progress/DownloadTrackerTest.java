package com.example.mediaagent.progress;

import com.example.mediaagent.media.DownloadStats;
import com.example.mediaagent.media.FileStatus;
import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFile;
import com.example.mediaagent.media.MediaFileData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DownloadTrackerTest {

    private DownloadTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new DownloadTracker();
    }

    private static MediaFile file(int device, String name, FileType type, long size) {
        return new MediaFile(new MediaFileData(device + ":" + name, device, type, "/src/" + name, name, name, size, 0L));
    }

    private static DownloadStats stats(MediaFile... files) {
        DownloadStats s = new DownloadStats();
        for (MediaFile f : files) {
            s.add(f);
        }
        return s;
    }

    @Test
    void copiedHalfOfBytesIsFiftyPercent() {
        tracker.setBackupDestinations(Map.of(FileType.PHOTO, 1, FileType.VIDEO, 0));
        tracker.initStats(1, stats(file(1, "a.jpg", FileType.PHOTO, 100)));

        assertEquals(100, tracker.sizeToCopy(1));
        assertEquals(100, tracker.sizeToBackup(1));

        tracker.setTotalBytesCopied(1, 100);
        assertEquals(0.5, tracker.percentComplete(1), 1e-9);

        tracker.incrementBytesBackedUp(1, 100);
        assertEquals(1.0, tracker.percentComplete(1), 1e-9);
    }

    @Test
    void bytesNeverExceedPlannedSize() {
        tracker.initStats(1, stats(file(1, "a.jpg", FileType.PHOTO, 100)));
        tracker.setTotalBytesCopied(1, 500);
        tracker.incrementBytesBackedUp(1, 500);

        assertEquals(100, tracker.bytesCopied(1));
        assertEquals(0, tracker.bytesBackedUp(1));
        assertEquals(1.0, tracker.percentComplete(1), 1e-9);
    }

    @Test
    void overallPercentIsWeightedByBytes() {
        tracker.initStats(1, stats(file(1, "a.jpg", FileType.PHOTO, 300)));
        tracker.initStats(2, stats(file(2, "b.jpg", FileType.PHOTO, 100)));

        tracker.setTotalBytesCopied(2, 100);

        assertEquals(0.25, tracker.overallPercentComplete(), 1e-9);
    }

    @Test
    void videoIsFullyBackedUpAfterItsOnlyDestinationResponds() {
        // destino 1 aceita fotos, destino 2 aceita fotos e videos
        tracker.setBackupDestinations(Map.of(FileType.PHOTO, 2, FileType.VIDEO, 1));
        MediaFile video = file(1, "clip.mov", FileType.VIDEO, 1000);
        tracker.initStats(1, stats(video));
        tracker.expectBackups(video.uniqueId(), 1, Set.of(2));

        assertFalse(tracker.allFilesBackedUp(1));
        assertTrue(tracker.fileBackedUp(video.uniqueId(), 2, true));
        assertTrue(tracker.fullyBackedUp(video.uniqueId()));
        assertEquals(1, tracker.successfulBackups(video.uniqueId()));
        assertTrue(tracker.allFilesBackedUp());
    }

    @Test
    void photoWaitsForEveryDestination() {
        MediaFile photo = file(1, "a.jpg", FileType.PHOTO, 10);
        tracker.expectBackups(photo.uniqueId(), 1, Set.of(1, 2));

        assertFalse(tracker.fileBackedUp(photo.uniqueId(), 1, true));
        assertEquals(List.of(photo.uniqueId()), tracker.filesAwaitingBackupFrom(2));
        assertTrue(tracker.fileBackedUp(photo.uniqueId(), 2, false));
        assertTrue(tracker.fileBackedUpToAllLocations(photo.uniqueId()));
        assertFalse(tracker.fullyBackedUp(photo.uniqueId()));
        assertFalse(tracker.fileBackedUp(photo.uniqueId(), 2, true), "resposta repetida e ignorada");
    }

    @Test
    void countsOutcomesAndBuildsSummary() {
        MediaFile a = file(1, "a.jpg", FileType.PHOTO, 10);
        MediaFile b = file(1, "b.jpg", FileType.PHOTO, 10);
        MediaFile c = file(1, "c.mov", FileType.VIDEO, 10);
        tracker.initStats(1, stats(a, b, c));

        tracker.fileDownloaded(1, FileType.PHOTO, FileStatus.DOWNLOADED);
        tracker.fileDownloaded(1, FileType.PHOTO, FileStatus.DOWNLOAD_FAILED);
        assertFalse(tracker.allFilesDownloaded(1));
        tracker.fileDownloaded(1, FileType.VIDEO, FileStatus.DOWNLOADED_WITH_WARNING);

        assertTrue(tracker.allFilesDownloaded(1));
        assertEquals(3, tracker.downloadCount(1));
        DownloadTracker.DeviceSummary summary = tracker.deviceSummary(1);
        assertEquals(2, summary.downloaded());
        assertEquals(2, summary.problems());
        assertEquals("1 foto e 1 video baixados, 1 falha, 1 aviso", summary.message());
        assertFalse(tracker.noErrorsOrWarnings());

        tracker.purgeAll();
        assertTrue(tracker.noErrorsOrWarnings());
        assertFalse(tracker.isTracking(1));
    }

    @Test
    void autoDeleteListIsPerDevice() {
        tracker.initStats(1, stats(file(1, "a.jpg", FileType.PHOTO, 10)));
        tracker.addToAutoDelete(1, "/src/a.jpg");
        tracker.addToAutoDelete(2, "/src/ignored.jpg");

        assertEquals(List.of("/src/a.jpg"), tracker.filesToAutoDelete(1));
        assertTrue(tracker.filesToAutoDelete(2).isEmpty());
        tracker.clearAutoDelete(1);
        assertTrue(tracker.filesToAutoDelete(1).isEmpty());
    }
}
