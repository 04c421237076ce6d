package com.example.mediaagent.stage;

import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.media.ProblemDetail;
import com.example.mediaagent.worker.WorkerMessage;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mensagens do estágio de renomear/mover.
 */
public final class RenameMessages {

    private RenameMessages() {}

    public interface Request extends WorkerMessage {}

    public interface Result extends WorkerMessage {}

    /**
     * Início de um ciclo de download: templates, pastas e contadores de sequência atuais.
     */
    public static final class DownloadStarted implements Request {
        private final Map<FileType, String> downloadFolders;
        private final Map<FileType, String> subfolderTemplates;
        private final Map<FileType, String> renameTemplates;
        private final int storedSequenceNo;
        private final String day;
        private final int downloadsToday;

        @JsonCreator
        public DownloadStarted(@JsonProperty("downloadFolders") Map<FileType, String> downloadFolders,
                               @JsonProperty("subfolderTemplates") Map<FileType, String> subfolderTemplates,
                               @JsonProperty("renameTemplates") Map<FileType, String> renameTemplates,
                               @JsonProperty("storedSequenceNo") int storedSequenceNo,
                               @JsonProperty("day") String day,
                               @JsonProperty("downloadsToday") int downloadsToday) {
            this.downloadFolders = Map.copyOf(Objects.requireNonNull(downloadFolders, "downloadFolders"));
            this.subfolderTemplates = Map.copyOf(Objects.requireNonNull(subfolderTemplates, "subfolderTemplates"));
            this.renameTemplates = Map.copyOf(Objects.requireNonNull(renameTemplates, "renameTemplates"));
            this.storedSequenceNo = storedSequenceNo;
            this.day = Objects.requireNonNull(day, "day");
            this.downloadsToday = downloadsToday;
        }

        @JsonProperty("downloadFolders") public Map<FileType, String> downloadFolders() { return downloadFolders; }
        @JsonProperty("subfolderTemplates") public Map<FileType, String> subfolderTemplates() { return subfolderTemplates; }
        @JsonProperty("renameTemplates") public Map<FileType, String> renameTemplates() { return renameTemplates; }
        @JsonProperty("storedSequenceNo") public int storedSequenceNo() { return storedSequenceNo; }
        @JsonProperty("day") public String day() { return day; }
        @JsonProperty("downloadsToday") public int downloadsToday() { return downloadsToday; }
    }

    /** Fim do ciclo: o worker responde com {@link SequencesUpdate}. */
    public static final class DownloadCompleted implements Request {
        @JsonCreator
        public DownloadCompleted() {
        }
    }

    /**
     * Move um arquivo do diretório temporário para o destino final.
     */
    public static final class RenameFile implements Request {
        private final MediaFileData file;
        private final String tempPath;
        private final int downloadCount;
        private final String jobCode;
        private final String deviceName;

        @JsonCreator
        public RenameFile(@JsonProperty("file") MediaFileData file,
                          @JsonProperty("tempPath") String tempPath,
                          @JsonProperty("downloadCount") int downloadCount,
                          @JsonProperty("jobCode") String jobCode,
                          @JsonProperty("deviceName") String deviceName) {
            this.file = Objects.requireNonNull(file, "file");
            this.tempPath = Objects.requireNonNull(tempPath, "tempPath");
            this.downloadCount = downloadCount;
            this.jobCode = jobCode == null ? "" : jobCode;
            this.deviceName = deviceName == null ? "" : deviceName;
        }

        @JsonProperty("file") public MediaFileData file() { return file; }
        @JsonProperty("tempPath") public String tempPath() { return tempPath; }
        @JsonProperty("downloadCount") public int downloadCount() { return downloadCount; }
        @JsonProperty("jobCode") public String jobCode() { return jobCode; }
        @JsonProperty("deviceName") public String deviceName() { return deviceName; }
    }

    /** Resultado final de renomear/mover um arquivo. */
    public static final class FileRenamed implements Result {
        private final String uniqueId;
        private final boolean succeeded;
        private final String downloadPath;
        private final String subfolder;
        private final int downloadCount;
        private final ProblemDetail problem;

        @JsonCreator
        public FileRenamed(@JsonProperty("uniqueId") String uniqueId,
                           @JsonProperty("succeeded") boolean succeeded,
                           @JsonProperty("downloadPath") String downloadPath,
                           @JsonProperty("subfolder") String subfolder,
                           @JsonProperty("downloadCount") int downloadCount,
                           @JsonProperty("problem") ProblemDetail problem) {
            this.uniqueId = Objects.requireNonNull(uniqueId, "uniqueId");
            this.succeeded = succeeded;
            this.downloadPath = downloadPath;
            this.subfolder = subfolder == null ? "" : subfolder;
            this.downloadCount = downloadCount;
            this.problem = problem;
        }

        @JsonProperty("uniqueId") public String uniqueId() { return uniqueId; }
        @JsonProperty("succeeded") public boolean succeeded() { return succeeded; }
        @JsonProperty("downloadPath") public String downloadPath() { return downloadPath; }
        /** Subpasta relativa à pasta de download, reutilizada nos destinos de backup. */
        @JsonProperty("subfolder") public String subfolder() { return subfolder; }
        @JsonProperty("downloadCount") public int downloadCount() { return downloadCount; }
        @JsonProperty("problem") public ProblemDetail problemOrNull() { return problem; }

        public Optional<ProblemDetail> problem() {
            return Optional.ofNullable(problem);
        }
    }

    /** Contadores de sequência ao fim do ciclo, para persistir. */
    public static final class SequencesUpdate implements Result {
        private final int storedSequenceNo;
        private final String day;
        private final int downloadsToday;

        @JsonCreator
        public SequencesUpdate(@JsonProperty("storedSequenceNo") int storedSequenceNo,
                               @JsonProperty("day") String day,
                               @JsonProperty("downloadsToday") int downloadsToday) {
            this.storedSequenceNo = storedSequenceNo;
            this.day = Objects.requireNonNull(day, "day");
            this.downloadsToday = downloadsToday;
        }

        @JsonProperty("storedSequenceNo") public int storedSequenceNo() { return storedSequenceNo; }
        @JsonProperty("day") public String day() { return day; }
        @JsonProperty("downloadsToday") public int downloadsToday() { return downloadsToday; }
    }
}
