package com.example.mediaagent.stage;

import com.example.mediaagent.device.DeviceDescriptor;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.worker.WorkerMessage;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * Mensagens do estágio de scan.
 */
public final class ScanMessages {

    private ScanMessages() {}

    public interface Request extends WorkerMessage {}

    public interface Result extends WorkerMessage {}

    /** Motivo de um scan interrompido que pode ser repetido. */
    public enum ScanErrorCode {
        /** Dispositivo em uso por outro processo ou sem permissão. */
        LOCKED,
        /** Dispositivo não acessível (desconectado, caminho inexistente). */
        INACCESSIBLE
    }

    /**
     * Inicia o scan de um dispositivo a partir de {@code root}.
     */
    public static final class ScanArguments implements Request {
        private final int deviceId;
        private final DeviceDescriptor device;
        private final String root;
        private final List<String> ignoredPaths;
        private final int batchSize;

        @JsonCreator
        public ScanArguments(@JsonProperty("deviceId") int deviceId,
                             @JsonProperty("device") DeviceDescriptor device,
                             @JsonProperty("root") String root,
                             @JsonProperty("ignoredPaths") List<String> ignoredPaths,
                             @JsonProperty("batchSize") int batchSize) {
            this.deviceId = deviceId;
            this.device = Objects.requireNonNull(device, "device");
            this.root = Objects.requireNonNull(root, "root");
            this.ignoredPaths = ignoredPaths == null ? List.of() : List.copyOf(ignoredPaths);
            this.batchSize = batchSize <= 0 ? 50 : batchSize;
        }

        @JsonProperty("deviceId") public int deviceId() { return deviceId; }
        @JsonProperty("device") public DeviceDescriptor device() { return device; }
        @JsonProperty("root") public String root() { return root; }
        @JsonProperty("ignoredPaths") public List<String> ignoredPaths() { return ignoredPaths; }
        @JsonProperty("batchSize") public int batchSize() { return batchSize; }
    }

    /** Repete o scan após um erro (o usuário escolheu tentar de novo). */
    public static final class ResumeScan implements Request {
        @JsonCreator
        public ResumeScan() {
        }
    }

    /**
     * Lote de arquivos encontrados e contadores acumulados do scan.
     */
    public static final class FilesFound implements Result {
        private final List<MediaFileData> files;
        private final int photos;
        private final int videos;
        private final long photosSize;
        private final long videosSize;

        @JsonCreator
        public FilesFound(@JsonProperty("files") List<MediaFileData> files,
                          @JsonProperty("photos") int photos,
                          @JsonProperty("videos") int videos,
                          @JsonProperty("photosSize") long photosSize,
                          @JsonProperty("videosSize") long videosSize) {
            this.files = files == null ? List.of() : List.copyOf(files);
            this.photos = photos;
            this.videos = videos;
            this.photosSize = photosSize;
            this.videosSize = videosSize;
        }

        @JsonProperty("files") public List<MediaFileData> files() { return files; }
        @JsonProperty("photos") public int photos() { return photos; }
        @JsonProperty("videos") public int videos() { return videos; }
        @JsonProperty("photosSize") public long photosSize() { return photosSize; }
        @JsonProperty("videosSize") public long videosSize() { return videosSize; }
    }

    public static final class ScanProblem implements Result {
        private final ScanErrorCode code;
        private final String message;

        @JsonCreator
        public ScanProblem(@JsonProperty("code") ScanErrorCode code,
                           @JsonProperty("message") String message) {
            this.code = Objects.requireNonNull(code, "code");
            this.message = message == null ? "" : message;
        }

        @JsonProperty("code") public ScanErrorCode code() { return code; }
        @JsonProperty("message") public String message() { return message; }
    }

    /** Nome e espaço do dispositivo, enviados ao fim do scan. */
    public static final class DeviceInfo implements Result {
        private final String displayName;
        private final long totalSpace;
        private final long freeSpace;

        @JsonCreator
        public DeviceInfo(@JsonProperty("displayName") String displayName,
                          @JsonProperty("totalSpace") long totalSpace,
                          @JsonProperty("freeSpace") long freeSpace) {
            this.displayName = displayName;
            this.totalSpace = totalSpace;
            this.freeSpace = freeSpace;
        }

        @JsonProperty("displayName") public String displayName() { return displayName; }
        @JsonProperty("totalSpace") public long totalSpace() { return totalSpace; }
        @JsonProperty("freeSpace") public long freeSpace() { return freeSpace; }
    }
}
