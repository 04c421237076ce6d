package com.example.mediaagent.worker;

import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.media.ProblemDetail;
import com.example.mediaagent.stage.CopyMessages.CopyFilesArguments;
import com.example.mediaagent.stage.CopyMessages.FileCopied;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    @Test
    void envelopeIsSingleLineWithTypeInformation() throws IOException {
        MediaFileData file = new MediaFileData("1:DCIM/a.jpg@10", 1, FileType.PHOTO, "/m/DCIM/a.jpg",
                "DCIM/a.jpg", "a.jpg", 2048, 10);
        CopyFilesArguments args = new CopyFilesArguments(1, List.of(file),
                Map.of(FileType.PHOTO, "/home/u/Fotos"), true, "SHA-256", 65536);

        String line = codec.encode(WorkerEnvelope.request(1, args));

        assertFalse(line.contains("\n"));
        assertTrue(line.contains("@type"));
        WorkerEnvelope decoded = codec.decode(line);
        assertEquals(WorkerEnvelope.Kind.REQUEST, decoded.kind());
        CopyFilesArguments back = assertInstanceOf(CopyFilesArguments.class, decoded.payload());
        assertEquals(file, back.files().get(0));
        assertEquals("/home/u/Fotos", back.downloadFolders().get(FileType.PHOTO));
    }

    @Test
    void failedResultKeepsProblem() throws IOException {
        FileCopied failed = new FileCopied("1:a.jpg@1", false, null, 3,
                new ProblemDetail("Falha ao copiar", "disco cheio"));

        WorkerEnvelope decoded = codec.decode(codec.encode(WorkerEnvelope.result(1, failed)));

        FileCopied back = assertInstanceOf(FileCopied.class, decoded.payload());
        assertFalse(back.succeeded());
        assertNull(back.tempPath());
        assertEquals("disco cheio", back.problem().orElseThrow().details());
    }

    @Test
    void controlEnvelopeHasNoPayload() throws IOException {
        WorkerEnvelope decoded = codec.decode(codec.encode(WorkerEnvelope.control(WorkerControl.PAUSE)));

        assertEquals(WorkerEnvelope.Kind.CONTROL, decoded.kind());
        assertEquals(WorkerControl.PAUSE, decoded.control());
        assertNull(decoded.payload());
    }

    @Test
    void unknownPropertiesAreIgnored() throws IOException {
        WorkerEnvelope decoded = codec.decode("{\"kind\":\"CONTROL\",\"control\":\"STOP\",\"extra\":1}");
        assertEquals(WorkerControl.STOP, decoded.control());
    }
}
