package com.example.mediaagent.stage;

import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.stage.RenameMessages.DownloadCompleted;
import com.example.mediaagent.stage.RenameMessages.DownloadStarted;
import com.example.mediaagent.stage.RenameMessages.FileRenamed;
import com.example.mediaagent.stage.RenameMessages.RenameFile;
import com.example.mediaagent.stage.RenameMessages.Result;
import com.example.mediaagent.stage.RenameMessages.SequencesUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RenameMoveFileWorkerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 9);
    private static final long SHOT = Instant.parse("2024-03-09T14:30:00Z").toEpochMilli();

    @TempDir
    Path tmp;

    private Path photos;
    private Path temp;
    private RenameMoveFileWorker worker;
    private RecordingContext<Result> context;

    @BeforeEach
    void setUp() throws Exception {
        photos = Files.createDirectories(tmp.resolve("Fotos"));
        temp = Files.createDirectories(photos.resolve(CopyFilesWorker.TEMP_PREFIX + "x"));
        worker = new RenameMoveFileWorker(() -> TODAY, ZoneOffset.UTC);
        context = new RecordingContext<>();
    }

    private DownloadStarted started(int sequence, String day, int downloadsToday) {
        return new DownloadStarted(
                Map.of(FileType.PHOTO, photos.toString()),
                Map.of(FileType.PHOTO, "{date:yyyy}/{date:yyyyMMdd}"),
                Map.of(FileType.PHOTO, "{jobcode}_{seq}{ext}"),
                sequence, day, downloadsToday);
    }

    private RenameFile renameFile(String name, String content) throws Exception {
        Path copied = temp.resolve("000001-" + name);
        Files.writeString(copied, content);
        MediaFileData file = new MediaFileData(MediaFileData.uniqueIdFor(1, name, SHOT), 1, FileType.PHOTO,
                "/card/" + name, name, name, content.length(), SHOT);
        return new RenameFile(file, copied.toString(), 1, "Casamento", "EOS R6");
    }

    @Test
    void renameBeforeDownloadStartedFails() throws Exception {
        worker.handle(1, renameFile("IMG_0001.JPG", "a"), context);

        FileRenamed renamed = context.of(FileRenamed.class).get(0);
        assertFalse(renamed.succeeded());
        assertNull(renamed.downloadPath());
        assertTrue(renamed.problem().isPresent());
    }

    @Test
    void movesIntoTemplatedSubfolderAndAdvancesSequence() throws Exception {
        worker.handle(null, started(41, "2024-03-09", 3), context);
        worker.handle(1, renameFile("IMG_0001.JPG", "a"), context);

        FileRenamed renamed = context.of(FileRenamed.class).get(0);
        assertTrue(renamed.succeeded());
        assertEquals("2024/20240309", renamed.subfolder());
        Path target = photos.resolve("2024/20240309/Casamento_0042.jpg");
        assertEquals(target.toString(), renamed.downloadPath());
        assertEquals("a", Files.readString(target));
        assertTrue(renamed.problem().isEmpty());

        worker.handle(null, new DownloadCompleted(), context);
        SequencesUpdate update = context.of(SequencesUpdate.class).get(0);
        assertEquals(42, update.storedSequenceNo());
        assertEquals("2024-03-09", update.day());
        assertEquals(4, update.downloadsToday());
    }

    @Test
    void collisionGetsSuffixAndWarning() throws Exception {
        Path folder = Files.createDirectories(photos.resolve("2024/20240309"));
        Files.writeString(folder.resolve("Casamento_0001.jpg"), "antigo");
        worker.handle(null, started(0, "2024-03-09", 0), context);

        worker.handle(1, renameFile("IMG_0001.JPG", "novo"), context);

        FileRenamed renamed = context.of(FileRenamed.class).get(0);
        assertTrue(renamed.succeeded());
        assertEquals(folder.resolve("Casamento_0001_1.jpg").toString(), renamed.downloadPath());
        assertTrue(renamed.problem().isPresent());
        assertEquals("antigo", Files.readString(folder.resolve("Casamento_0001.jpg")));
    }

    @Test
    void downloadsTodayResetsOnNewDay() {
        worker.handle(null, started(10, "2024-03-08", 7), context);
        worker.handle(null, new DownloadCompleted(), context);

        SequencesUpdate update = context.of(SequencesUpdate.class).get(0);
        assertEquals(10, update.storedSequenceNo());
        assertEquals("2024-03-09", update.day());
        assertEquals(0, update.downloadsToday());
    }
}
