package com.example.mediaagent.stage;

import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.media.ProblemDetail;
import com.example.mediaagent.worker.WorkerMessage;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import java.util.Optional;

/**
 * Mensagens do estágio de backup. Há um worker por destino de backup;
 * os resultados carregam o dispositivo de origem do arquivo para roteamento.
 */
public final class BackupMessages {

    private BackupMessages() {}

    public interface Request extends WorkerMessage {}

    public interface Result extends WorkerMessage {}

    /** Primeira requisição de um worker: qual destino ele atende. */
    public static final class BackupArguments implements Request {
        private final int destinationId;
        private final String path;
        private final String displayName;

        @JsonCreator
        public BackupArguments(@JsonProperty("destinationId") int destinationId,
                               @JsonProperty("path") String path,
                               @JsonProperty("displayName") String displayName) {
            this.destinationId = destinationId;
            this.path = Objects.requireNonNull(path, "path");
            this.displayName = displayName;
        }

        @JsonProperty("destinationId") public int destinationId() { return destinationId; }
        @JsonProperty("path") public String path() { return path; }
        @JsonProperty("displayName") public String displayName() { return displayName; }
    }

    /**
     * Copia um arquivo já renomeado para o destino.
     * Com {@code doBackup=false} o worker apenas confirma (o download do arquivo falhou),
     * mantendo a contabilidade de respostas por destino.
     */
    public static final class BackupFile implements Request {
        private final MediaFileData file;
        private final String downloadPath;
        private final String subfolder;
        private final String identifier;
        private final boolean doBackup;
        private final boolean overwrite;
        private final boolean verify;
        private final String hashAlgorithm;

        @JsonCreator
        public BackupFile(@JsonProperty("file") MediaFileData file,
                          @JsonProperty("downloadPath") String downloadPath,
                          @JsonProperty("subfolder") String subfolder,
                          @JsonProperty("identifier") String identifier,
                          @JsonProperty("doBackup") boolean doBackup,
                          @JsonProperty("overwrite") boolean overwrite,
                          @JsonProperty("verify") boolean verify,
                          @JsonProperty("hashAlgorithm") String hashAlgorithm) {
            this.file = Objects.requireNonNull(file, "file");
            this.downloadPath = downloadPath;
            this.subfolder = subfolder == null ? "" : subfolder;
            this.identifier = identifier;
            this.doBackup = doBackup;
            this.overwrite = overwrite;
            this.verify = verify;
            this.hashAlgorithm = hashAlgorithm == null ? "SHA-256" : hashAlgorithm;
        }

        @JsonProperty("file") public MediaFileData file() { return file; }
        @JsonProperty("downloadPath") public String downloadPath() { return downloadPath; }
        @JsonProperty("subfolder") public String subfolder() { return subfolder; }
        /** Subpasta identificadora (destinos autodetectados); null em destinos manuais. */
        @JsonProperty("identifier") public String identifier() { return identifier; }
        @JsonProperty("doBackup") public boolean doBackup() { return doBackup; }
        @JsonProperty("overwrite") public boolean overwrite() { return overwrite; }
        @JsonProperty("verify") public boolean verify() { return verify; }
        @JsonProperty("hashAlgorithm") public String hashAlgorithm() { return hashAlgorithm; }
    }

    /** Bytes enviados ao destino para um arquivo do dispositivo {@code sourceDeviceId}. */
    public static final class BackupBytes implements Result {
        private final int sourceDeviceId;
        private final long chunk;

        @JsonCreator
        public BackupBytes(@JsonProperty("sourceDeviceId") int sourceDeviceId,
                           @JsonProperty("chunk") long chunk) {
            this.sourceDeviceId = sourceDeviceId;
            this.chunk = chunk;
        }

        @JsonProperty("sourceDeviceId") public int sourceDeviceId() { return sourceDeviceId; }
        @JsonProperty("chunk") public long chunk() { return chunk; }
    }

    public static final class FileBackedUp implements Result {
        private final int destinationId;
        private final String uniqueId;
        private final int sourceDeviceId;
        private final boolean succeeded;
        private final boolean doBackup;
        private final String backupPath;
        private final ProblemDetail problem;

        @JsonCreator
        public FileBackedUp(@JsonProperty("destinationId") int destinationId,
                            @JsonProperty("uniqueId") String uniqueId,
                            @JsonProperty("sourceDeviceId") int sourceDeviceId,
                            @JsonProperty("succeeded") boolean succeeded,
                            @JsonProperty("doBackup") boolean doBackup,
                            @JsonProperty("backupPath") String backupPath,
                            @JsonProperty("problem") ProblemDetail problem) {
            this.destinationId = destinationId;
            this.uniqueId = Objects.requireNonNull(uniqueId, "uniqueId");
            this.sourceDeviceId = sourceDeviceId;
            this.succeeded = succeeded;
            this.doBackup = doBackup;
            this.backupPath = backupPath;
            this.problem = problem;
        }

        @JsonProperty("destinationId") public int destinationId() { return destinationId; }
        @JsonProperty("uniqueId") public String uniqueId() { return uniqueId; }
        @JsonProperty("sourceDeviceId") public int sourceDeviceId() { return sourceDeviceId; }
        @JsonProperty("succeeded") public boolean succeeded() { return succeeded; }
        @JsonProperty("doBackup") public boolean doBackup() { return doBackup; }
        @JsonProperty("backupPath") public String backupPath() { return backupPath; }
        @JsonProperty("problem") public ProblemDetail problemOrNull() { return problem; }

        public Optional<ProblemDetail> problem() {
            return Optional.ofNullable(problem);
        }
    }
}
