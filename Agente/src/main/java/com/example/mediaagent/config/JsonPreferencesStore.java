package com.example.mediaagent.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PreferencesStore} persistido em JSON (Jackson).
 *
 * Escrita atômica: grava em arquivo temporário no mesmo diretório e move por cima.
 * Arquivo corrompido é ignorado na leitura (começa com estado vazio).
 */
public final class JsonPreferencesStore implements PreferencesStore {

    private static final Logger log = LoggerFactory.getLogger(JsonPreferencesStore.class);

    private final Path path;
    private final ObjectMapper mapper;
    private State state;

    private JsonPreferencesStore(Path path, ObjectMapper mapper, State state) {
        this.path = path;
        this.mapper = mapper;
        this.state = state;
    }

    public static JsonPreferencesStore open(Path path) {
        Objects.requireNonNull(path, "path");
        ObjectMapper mapper = new ObjectMapper();
        State state = State.empty();
        if (Files.exists(path)) {
            try {
                state = mapper.readValue(path.toFile(), State.class);
            } catch (IOException e) {
                log.warn("Preferencias ilegiveis em {}, usando padroes: {}", path, e.getMessage());
            }
        }
        return new JsonPreferencesStore(path, mapper, state);
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized List<String> jobCodes() {
        return List.copyOf(state.jobCodes);
    }

    @Override
    public synchronized void setJobCodes(List<String> codes) {
        state = state.withJobCodes(codes);
    }

    @Override
    public synchronized boolean rememberJobCode() {
        return state.rememberJobCode;
    }

    @Override
    public synchronized void setRememberJobCode(boolean remember) {
        state = state.withRemember(remember);
    }

    @Override
    public synchronized int storedSequenceNo() {
        return state.storedSequenceNo;
    }

    @Override
    public synchronized int downloadsToday(LocalDate today) {
        return today.toString().equals(state.downloadsTodayDate) ? state.downloadsToday : 0;
    }

    @Override
    public synchronized void updateSequences(int storedSequenceNo, LocalDate day, int downloadsToday) {
        state = state.withSequences(storedSequenceNo, day.toString(), downloadsToday);
    }

    @Override
    public synchronized void save() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, ".preferences-", ".json.tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Preferencias gravadas em {}", path);
    }

    /**
     * Conteúdo do arquivo de preferências.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class State {
        @JsonProperty("jobCodes")
        private final List<String> jobCodes;
        @JsonProperty("rememberJobCode")
        private final boolean rememberJobCode;
        @JsonProperty("storedSequenceNo")
        private final int storedSequenceNo;
        @JsonProperty("downloadsTodayDate")
        private final String downloadsTodayDate;
        @JsonProperty("downloadsToday")
        private final int downloadsToday;

        @JsonCreator
        State(@JsonProperty("jobCodes") List<String> jobCodes,
              @JsonProperty("rememberJobCode") Boolean rememberJobCode,
              @JsonProperty("storedSequenceNo") int storedSequenceNo,
              @JsonProperty("downloadsTodayDate") String downloadsTodayDate,
              @JsonProperty("downloadsToday") int downloadsToday) {
            this.jobCodes = jobCodes == null ? List.of() : List.copyOf(jobCodes);
            this.rememberJobCode = rememberJobCode == null || rememberJobCode;
            this.storedSequenceNo = storedSequenceNo;
            this.downloadsTodayDate = downloadsTodayDate;
            this.downloadsToday = downloadsToday;
        }

        static State empty() {
            return new State(new ArrayList<>(), true, 0, null, 0);
        }

        State withJobCodes(List<String> codes) {
            return new State(codes, rememberJobCode, storedSequenceNo, downloadsTodayDate, downloadsToday);
        }

        State withRemember(boolean remember) {
            return new State(jobCodes, remember, storedSequenceNo, downloadsTodayDate, downloadsToday);
        }

        State withSequences(int seq, String date, int today) {
            return new State(jobCodes, rememberJobCode, seq, date, today);
        }
    }
}
