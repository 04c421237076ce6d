package com.example.mediaagent.media;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.IntPredicate;

/**
 * Coleção de arquivos descobertos, indexada pelo identificador único.
 *
 * Não é thread-safe: só o orquestrador a acessa.
 */
public final class MediaFileCollection {

    private final Map<String, MediaFile> files = new LinkedHashMap<>();

    /**
     * Adiciona um arquivo. Retorna false se o identificador já existia
     * (ex.: novo scan do mesmo dispositivo após um retry).
     */
    public boolean add(MediaFileData data) {
        Objects.requireNonNull(data, "data");
        if (files.containsKey(data.uniqueId())) {
            return false;
        }
        files.put(data.uniqueId(), new MediaFile(data));
        return true;
    }

    public Optional<MediaFile> get(String uniqueId) {
        return Optional.ofNullable(files.get(uniqueId));
    }

    public int size() {
        return files.size();
    }

    public Collection<MediaFile> all() {
        return List.copyOf(files.values());
    }

    public List<MediaFile> filesForDevice(int deviceId) {
        List<MediaFile> out = new ArrayList<>();
        for (MediaFile f : files.values()) {
            if (f.deviceId() == deviceId) {
                out.add(f);
            }
        }
        return out;
    }

    /**
     * Arquivos ainda disponíveis para download, agrupados por dispositivo.
     *
     * @param eligibleDevice filtro de dispositivos (ex.: apenas os que estão Scanned)
     */
    public DownloadFiles filesMarkedForDownload(IntPredicate eligibleDevice) {
        Map<Integer, List<MediaFile>> byDevice = new TreeMap<>();
        Map<Integer, DownloadStats> stats = new TreeMap<>();
        Set<FileType> types = EnumSet.noneOf(FileType.class);
        for (MediaFile f : files.values()) {
            if (!f.status().isAvailable() || !eligibleDevice.test(f.deviceId())) {
                continue;
            }
            byDevice.computeIfAbsent(f.deviceId(), k -> new ArrayList<>()).add(f);
            stats.computeIfAbsent(f.deviceId(), k -> new DownloadStats()).add(f);
            types.add(f.fileType());
        }
        return new DownloadFiles(byDevice, stats, types);
    }

    public void markDownloadPending(Collection<MediaFile> pending) {
        for (MediaFile f : pending) {
            f.setStatus(FileStatus.DOWNLOAD_PENDING);
        }
    }

    /** Quantidade de arquivos do dispositivo que ainda não foram baixados. */
    public int filesRemaining(int deviceId) {
        int n = 0;
        for (MediaFile f : files.values()) {
            if (f.deviceId() == deviceId && f.status().isAvailable()) {
                n++;
            }
        }
        return n;
    }

    public boolean filesRemainToDownload() {
        for (MediaFile f : files.values()) {
            if (f.status().isAvailable()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Remove os arquivos de um dispositivo.
     *
     * @param keepProcessed mantém arquivos que já saíram do estado disponível
     * @return quantidade removida
     */
    public int removeDevice(int deviceId, boolean keepProcessed) {
        int before = files.size();
        files.values().removeIf(f -> f.deviceId() == deviceId
                && (!keepProcessed || f.status().isAvailable()));
        return before - files.size();
    }

    /**
     * Resultado de {@link #filesMarkedForDownload}.
     */
    public static final class DownloadFiles {
        private final Map<Integer, List<MediaFile>> files;
        private final Map<Integer, DownloadStats> stats;
        private final Set<FileType> types;

        DownloadFiles(Map<Integer, List<MediaFile>> files,
                      Map<Integer, DownloadStats> stats,
                      Set<FileType> types) {
            this.files = files;
            this.stats = stats;
            this.types = types;
        }

        public Map<Integer, List<MediaFile>> files() { return files; }
        public Map<Integer, DownloadStats> stats() { return stats; }
        public Set<FileType> types() { return types; }

        public boolean isEmpty() {
            return files.isEmpty();
        }
    }
}
