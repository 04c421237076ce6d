package com.example.mediaagent.stage;

import com.example.mediaagent.device.DeviceDescriptor;
import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.stage.ScanMessages.DeviceInfo;
import com.example.mediaagent.stage.ScanMessages.FilesFound;
import com.example.mediaagent.stage.ScanMessages.Result;
import com.example.mediaagent.stage.ScanMessages.ResumeScan;
import com.example.mediaagent.stage.ScanMessages.ScanArguments;
import com.example.mediaagent.stage.ScanMessages.ScanErrorCode;
import com.example.mediaagent.stage.ScanMessages.ScanProblem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScanWorkerTest {

    @TempDir
    Path tmp;

    private RecordingContext<Result> context;

    @BeforeEach
    void setUp() {
        context = new RecordingContext<>();
    }

    private ScanArguments args(Path root, int batchSize) {
        return new ScanArguments(4, DeviceDescriptor.volume(root.toString(), "Cartao", List.of(), true),
                root.toString(), List.of(".Trashes"), batchSize);
    }

    @Test
    void findsMediaInBatchesAndSkipsIgnoredFolders() throws Exception {
        Path dcim = Files.createDirectories(tmp.resolve("DCIM/100CANON"));
        Files.write(dcim.resolve("IMG_0001.JPG"), new byte[3]);
        Files.write(dcim.resolve("IMG_0002.jpg"), new byte[4]);
        Files.write(dcim.resolve("MVI_0003.MP4"), new byte[10]);
        Files.writeString(dcim.resolve("notas.txt"), "x");
        Path trash = Files.createDirectories(tmp.resolve(".trashes"));
        Files.write(trash.resolve("IMG_9999.JPG"), new byte[1]);

        new ScanWorker().handle(4, args(tmp, 2), context);

        List<FilesFound> batches = context.of(FilesFound.class);
        assertEquals(2, batches.size());
        List<MediaFileData> files = batches.stream()
                .flatMap(b -> b.files().stream())
                .collect(Collectors.toList());
        assertEquals(3, files.size());
        assertTrue(files.stream().allMatch(f -> f.deviceId() == 4));
        assertTrue(files.stream().noneMatch(f -> f.name().equals("IMG_9999.JPG")));
        assertEquals(1, files.stream().filter(f -> f.fileType() == FileType.VIDEO).count());
        assertTrue(files.stream().anyMatch(f -> f.relativePath().equals("DCIM/100CANON/IMG_0001.JPG")));

        FilesFound last = batches.get(batches.size() - 1);
        assertEquals(2, last.photos());
        assertEquals(1, last.videos());

        assertEquals("Cartao", context.of(DeviceInfo.class).get(0).displayName());
        assertTrue(context.finished);
    }

    @Test
    void missingRootReportsProblemAndRetryFindsFiles() throws Exception {
        Path root = tmp.resolve("cartao");
        ScanWorker worker = new ScanWorker();

        worker.handle(4, args(root, 50), context);

        ScanProblem problem = context.of(ScanProblem.class).get(0);
        assertEquals(ScanErrorCode.INACCESSIBLE, problem.code());
        assertFalse(context.finished);

        Files.createDirectories(root);
        Files.write(root.resolve("IMG_0001.JPG"), new byte[2]);
        worker.handle(4, new ResumeScan(), context);

        assertEquals(1, context.of(FilesFound.class).get(0).files().size());
        assertTrue(context.finished);
    }

    @Test
    void resumeWithoutArgumentsIsRejected() {
        assertThrows(IllegalStateException.class, () -> new ScanWorker().handle(4, new ResumeScan(), context));
    }
}
