package com.example.mediaagent.stage;

import com.example.mediaagent.worker.WorkerMessage;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * Mensagens do worker de agrupamento por proximidade temporal.
 */
public final class OffloadMessages {

    private OffloadMessages() {}

    public interface Request extends WorkerMessage {}

    public interface Result extends WorkerMessage {}

    public static final class TimedFile {
        private final String uniqueId;
        private final long modificationTime;

        @JsonCreator
        public TimedFile(@JsonProperty("uniqueId") String uniqueId,
                         @JsonProperty("modificationTime") long modificationTime) {
            this.uniqueId = Objects.requireNonNull(uniqueId, "uniqueId");
            this.modificationTime = modificationTime;
        }

        @JsonProperty("uniqueId") public String uniqueId() { return uniqueId; }
        @JsonProperty("modificationTime") public long modificationTime() { return modificationTime; }
    }

    /** Agrupa arquivos cujo intervalo entre capturas consecutivas não passa de {@code gapSeconds}. */
    public static final class AssignProximityGroups implements Request {
        private final List<TimedFile> files;
        private final long gapSeconds;

        @JsonCreator
        public AssignProximityGroups(@JsonProperty("files") List<TimedFile> files,
                                     @JsonProperty("gapSeconds") long gapSeconds) {
            this.files = List.copyOf(Objects.requireNonNull(files, "files"));
            this.gapSeconds = gapSeconds;
        }

        @JsonProperty("files") public List<TimedFile> files() { return files; }
        @JsonProperty("gapSeconds") public long gapSeconds() { return gapSeconds; }
    }

    public static final class ProximityGroup {
        private final long start;
        private final long end;
        private final List<String> uniqueIds;

        @JsonCreator
        public ProximityGroup(@JsonProperty("start") long start,
                              @JsonProperty("end") long end,
                              @JsonProperty("uniqueIds") List<String> uniqueIds) {
            this.start = start;
            this.end = end;
            this.uniqueIds = List.copyOf(Objects.requireNonNull(uniqueIds, "uniqueIds"));
        }

        @JsonProperty("start") public long start() { return start; }
        @JsonProperty("end") public long end() { return end; }
        @JsonProperty("uniqueIds") public List<String> uniqueIds() { return uniqueIds; }
    }

    public static final class ProximityGroups implements Result {
        private final List<ProximityGroup> groups;

        @JsonCreator
        public ProximityGroups(@JsonProperty("groups") List<ProximityGroup> groups) {
            this.groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
        }

        @JsonProperty("groups") public List<ProximityGroup> groups() { return groups; }
    }
}
