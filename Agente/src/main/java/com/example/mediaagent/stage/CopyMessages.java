package com.example.mediaagent.stage;

import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.media.ProblemDetail;
import com.example.mediaagent.worker.WorkerMessage;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mensagens do estágio de cópia.
 */
public final class CopyMessages {

    private CopyMessages() {}

    public interface Request extends WorkerMessage {}

    public interface Result extends WorkerMessage {}

    /**
     * Copia os arquivos marcados de um dispositivo para diretórios temporários
     * dentro das pastas de download.
     */
    public static final class CopyFilesArguments implements Request {
        private final int deviceId;
        private final List<MediaFileData> files;
        private final Map<FileType, String> downloadFolders;
        private final boolean verify;
        private final String hashAlgorithm;
        private final int chunkSize;

        @JsonCreator
        public CopyFilesArguments(@JsonProperty("deviceId") int deviceId,
                                  @JsonProperty("files") List<MediaFileData> files,
                                  @JsonProperty("downloadFolders") Map<FileType, String> downloadFolders,
                                  @JsonProperty("verify") boolean verify,
                                  @JsonProperty("hashAlgorithm") String hashAlgorithm,
                                  @JsonProperty("chunkSize") int chunkSize) {
            this.deviceId = deviceId;
            this.files = List.copyOf(Objects.requireNonNull(files, "files"));
            this.downloadFolders = Map.copyOf(Objects.requireNonNull(downloadFolders, "downloadFolders"));
            this.verify = verify;
            this.hashAlgorithm = hashAlgorithm == null ? "SHA-256" : hashAlgorithm;
            this.chunkSize = chunkSize <= 0 ? 1024 * 1024 : chunkSize;
        }

        @JsonProperty("deviceId") public int deviceId() { return deviceId; }
        @JsonProperty("files") public List<MediaFileData> files() { return files; }
        @JsonProperty("downloadFolders") public Map<FileType, String> downloadFolders() { return downloadFolders; }
        @JsonProperty("verify") public boolean verify() { return verify; }
        @JsonProperty("hashAlgorithm") public String hashAlgorithm() { return hashAlgorithm; }
        @JsonProperty("chunkSize") public int chunkSize() { return chunkSize; }
    }

    /** Diretórios temporários criados para o dispositivo, por tipo. */
    public static final class TempDirs implements Result {
        private final Map<FileType, String> dirs;

        @JsonCreator
        public TempDirs(@JsonProperty("dirs") Map<FileType, String> dirs) {
            this.dirs = dirs == null ? Map.of() : Map.copyOf(dirs);
        }

        @JsonProperty("dirs") public Map<FileType, String> dirs() { return dirs; }
    }

    /** Progresso em bytes: {@code total} é o acumulado do dispositivo. */
    public static final class BytesCopied implements Result {
        private final long chunk;
        private final long total;
        private final boolean skipped;

        @JsonCreator
        public BytesCopied(@JsonProperty("chunk") long chunk,
                           @JsonProperty("total") long total,
                           @JsonProperty("skipped") boolean skipped) {
            this.chunk = chunk;
            this.total = total;
            this.skipped = skipped;
        }

        public BytesCopied(long chunk, long total) {
            this(chunk, total, false);
        }

        @JsonProperty("chunk") public long chunk() { return chunk; }
        @JsonProperty("total") public long total() { return total; }
        /** Bytes de um arquivo que falhou: contam no progresso, mas não foram transferidos. */
        @JsonProperty("skipped") public boolean skipped() { return skipped; }
    }

    /** Resultado final da cópia de um arquivo. */
    public static final class FileCopied implements Result {
        private final String uniqueId;
        private final boolean succeeded;
        private final String tempPath;
        private final int downloadCount;
        private final ProblemDetail problem;

        @JsonCreator
        public FileCopied(@JsonProperty("uniqueId") String uniqueId,
                          @JsonProperty("succeeded") boolean succeeded,
                          @JsonProperty("tempPath") String tempPath,
                          @JsonProperty("downloadCount") int downloadCount,
                          @JsonProperty("problem") ProblemDetail problem) {
            this.uniqueId = Objects.requireNonNull(uniqueId, "uniqueId");
            this.succeeded = succeeded;
            this.tempPath = tempPath;
            this.downloadCount = downloadCount;
            this.problem = problem;
        }

        @JsonProperty("uniqueId") public String uniqueId() { return uniqueId; }
        @JsonProperty("succeeded") public boolean succeeded() { return succeeded; }
        @JsonProperty("tempPath") public String tempPath() { return tempPath; }
        @JsonProperty("downloadCount") public int downloadCount() { return downloadCount; }
        @JsonProperty("problem") public ProblemDetail problemOrNull() { return problem; }

        public Optional<ProblemDetail> problem() {
            return Optional.ofNullable(problem);
        }
    }
}
