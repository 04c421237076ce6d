package com.example.mediaagent.stage;

import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.stage.CopyMessages.BytesCopied;
import com.example.mediaagent.stage.CopyMessages.CopyFilesArguments;
import com.example.mediaagent.stage.CopyMessages.FileCopied;
import com.example.mediaagent.stage.CopyMessages.Result;
import com.example.mediaagent.stage.CopyMessages.TempDirs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CopyFilesWorkerTest {

    @TempDir
    Path tmp;

    private Path card;
    private Path photos;
    private RecordingContext<Result> context;

    @BeforeEach
    void setUp() throws Exception {
        card = Files.createDirectories(tmp.resolve("card/DCIM"));
        photos = tmp.resolve("Fotos");
        context = new RecordingContext<>();
    }

    private MediaFileData file(String name, byte[] content) throws Exception {
        Path source = card.resolve(name);
        Files.write(source, content);
        return new MediaFileData(MediaFileData.uniqueIdFor(1, "DCIM/" + name, 1000L), 1, FileType.PHOTO,
                source.toString(), "DCIM/" + name, name, content.length, 1000L);
    }

    @Test
    void copiesIntoHiddenTempDirInsideDownloadFolder() throws Exception {
        byte[] content = "imagem".getBytes(StandardCharsets.UTF_8);
        MediaFileData photo = file("IMG_0001.JPG", content);

        new CopyFilesWorker().handle(1, new CopyFilesArguments(1, List.of(photo),
                Map.of(FileType.PHOTO, photos.toString()), true, "SHA-256", 4), context);

        TempDirs dirs = context.of(TempDirs.class).get(0);
        Path temp = Path.of(dirs.dirs().get(FileType.PHOTO));
        assertEquals(photos, temp.getParent());
        assertTrue(temp.getFileName().toString().startsWith(CopyFilesWorker.TEMP_PREFIX));

        FileCopied copied = context.of(FileCopied.class).get(0);
        assertTrue(copied.succeeded());
        assertEquals(1, copied.downloadCount());
        assertEquals(photo.uniqueId(), copied.uniqueId());
        assertTrue(copied.tempPath().startsWith(temp.toString()));
        assertEquals("imagem", Files.readString(Path.of(copied.tempPath())));
        assertEquals(1000L, Files.getLastModifiedTime(Path.of(copied.tempPath())).toMillis());

        List<BytesCopied> bytes = context.of(BytesCopied.class);
        assertEquals(content.length, bytes.get(bytes.size() - 1).total());
        assertTrue(context.finished);
    }

    @Test
    void missingSourceFailsButStillAccountsItsBytes() throws Exception {
        MediaFileData good = file("IMG_0001.JPG", new byte[10]);
        MediaFileData gone = file("IMG_0002.JPG", new byte[20]);
        Files.delete(Path.of(gone.sourcePath()));

        new CopyFilesWorker().handle(1, new CopyFilesArguments(1, List.of(good, gone),
                Map.of(FileType.PHOTO, photos.toString()), false, "SHA-256", 1024), context);

        List<FileCopied> copied = context.of(FileCopied.class);
        assertEquals(2, copied.size());
        assertTrue(copied.get(0).succeeded());
        assertFalse(copied.get(1).succeeded());
        assertNull(copied.get(1).tempPath());
        assertTrue(copied.get(1).problem().isPresent());

        List<BytesCopied> bytes = context.of(BytesCopied.class);
        BytesCopied credited = bytes.get(bytes.size() - 1);
        assertEquals(30, credited.total());
        assertEquals(20, credited.chunk());
        assertTrue(credited.skipped());
        assertFalse(bytes.get(0).skipped());
    }

    @Test
    void stopLeavesRemainingFilesUntouched() throws Exception {
        MediaFileData photo = file("IMG_0001.JPG", new byte[5]);
        context.stop = true;

        new CopyFilesWorker().handle(1, new CopyFilesArguments(1, List.of(photo),
                Map.of(FileType.PHOTO, photos.toString()), false, "SHA-256", 1024), context);

        assertTrue(context.of(FileCopied.class).isEmpty());
        assertTrue(context.finished);
    }
}
