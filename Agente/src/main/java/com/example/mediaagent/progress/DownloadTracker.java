package com.example.mediaagent.progress;

import com.example.mediaagent.media.DownloadStats;
import com.example.mediaagent.media.FileStatus;
import com.example.mediaagent.media.FileType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Contabilidade de progresso dos downloads ativos.
 *
 * Por dispositivo: bytes a copiar e a enviar para backup, bytes já copiados e enviados,
 * contadores de arquivos baixados/falhos/com aviso por tipo.
 * Por arquivo: quais destinos de backup ainda devem responder e quantos responderam com sucesso.
 *
 * Percentual do dispositivo = (copiado + backup) / (a copiar + a fazer backup).
 * Percentual global = média ponderada pelo total de bytes de cada dispositivo.
 *
 * Usado apenas na thread do orquestrador.
 */
public final class DownloadTracker {

    private final Map<Integer, DeviceStats> devices = new LinkedHashMap<>();
    private final Map<String, PendingBackup> backups = new HashMap<>();
    private final Map<FileType, Integer> destinationsPerType = new EnumMap<>(FileType.class);
    private final SessionTotals totals = new SessionTotals();

    public DownloadTracker() {
        for (FileType t : FileType.values()) {
            destinationsPerType.put(t, 0);
        }
    }

    /**
     * Atualiza o número de destinos de backup por tipo (contagem atual do resolvedor).
     */
    public void setBackupDestinations(Map<FileType, Integer> counts) {
        for (FileType t : FileType.values()) {
            destinationsPerType.put(t, counts.getOrDefault(t, 0));
        }
    }

    public int backupDestinations(FileType type) {
        return destinationsPerType.get(type);
    }

    /**
     * Inicia a contabilidade de um dispositivo para o lote informado.
     */
    public void initStats(int deviceId, DownloadStats stats) {
        Objects.requireNonNull(stats, "stats");
        DeviceStats s = new DeviceStats();
        s.filesInDownload = stats.totalFiles();
        s.sizeToCopy = stats.totalSize();
        s.sizeToBackup = stats.sizeToBackup(destinationsPerType);
        devices.put(deviceId, s);
    }

    public boolean isTracking(int deviceId) {
        return devices.containsKey(deviceId);
    }

    public long sizeToCopy(int deviceId) {
        DeviceStats s = devices.get(deviceId);
        return s == null ? 0 : s.sizeToCopy;
    }

    public long sizeToBackup(int deviceId) {
        DeviceStats s = devices.get(deviceId);
        return s == null ? 0 : s.sizeToBackup;
    }

    /** Total acumulado reportado pelo worker de cópia. */
    public void setTotalBytesCopied(int deviceId, long total) {
        DeviceStats s = devices.get(deviceId);
        if (s != null) {
            s.bytesCopied = Math.min(total, s.sizeToCopy);
        }
    }

    public void incrementBytesBackedUp(int deviceId, long chunk) {
        DeviceStats s = devices.get(deviceId);
        if (s != null) {
            s.bytesBackedUp = Math.min(s.bytesBackedUp + chunk, s.sizeToBackup);
        }
    }

    public long bytesCopied(int deviceId) {
        DeviceStats s = devices.get(deviceId);
        return s == null ? 0 : s.bytesCopied;
    }

    public long bytesBackedUp(int deviceId) {
        DeviceStats s = devices.get(deviceId);
        return s == null ? 0 : s.bytesBackedUp;
    }

    /**
     * Percentual [0, 1] do dispositivo.
     */
    public double percentComplete(int deviceId) {
        DeviceStats s = devices.get(deviceId);
        if (s == null) {
            return 0.0;
        }
        long total = s.sizeToCopy + s.sizeToBackup;
        if (total == 0) {
            return s.downloadCount >= s.filesInDownload ? 1.0 : 0.0;
        }
        return (double) (s.bytesCopied + s.bytesBackedUp) / total;
    }

    /**
     * Percentual [0, 1] de todos os dispositivos, ponderado pelos bytes de cada um.
     */
    public double overallPercentComplete() {
        long done = 0;
        long total = 0;
        for (DeviceStats s : devices.values()) {
            done += s.bytesCopied + s.bytesBackedUp;
            total += s.sizeToCopy + s.sizeToBackup;
        }
        return total == 0 ? 0.0 : (double) done / total;
    }

    // ---- backups por arquivo ----

    /**
     * Registra de quais destinos (ids de worker de backup) um arquivo aguarda resultado.
     */
    public void expectBackups(String uniqueId, int deviceId, Set<Integer> destinationIds) {
        backups.put(uniqueId, new PendingBackup(deviceId, destinationIds));
    }

    /**
     * Registra o resultado de um destino para um arquivo.
     *
     * @return true se foi o último destino pendente do arquivo
     */
    public boolean fileBackedUp(String uniqueId, int destinationId, boolean succeeded) {
        PendingBackup p = backups.get(uniqueId);
        if (p == null || !p.pending.remove(destinationId)) {
            return false;
        }
        if (succeeded) {
            p.succeeded.add(destinationId);
        } else {
            p.failed.add(destinationId);
        }
        return p.pending.isEmpty();
    }

    /** Todos os destinos esperados já responderam (com sucesso ou falha). */
    public boolean fileBackedUpToAllLocations(String uniqueId) {
        PendingBackup p = backups.get(uniqueId);
        return p == null || p.pending.isEmpty();
    }

    /**
     * Arquivo totalmente em backup: todos os destinos esperados responderam com sucesso.
     * Sem destinos esperados, é verdadeiro.
     */
    public boolean fullyBackedUp(String uniqueId) {
        PendingBackup p = backups.get(uniqueId);
        return p == null || (p.pending.isEmpty() && p.failed.isEmpty());
    }

    public int successfulBackups(String uniqueId) {
        PendingBackup p = backups.get(uniqueId);
        return p == null ? 0 : p.succeeded.size();
    }

    /** Arquivos ainda aguardando resposta de um destino. */
    public List<String> filesAwaitingBackupFrom(int destinationId) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, PendingBackup> e : backups.entrySet()) {
            if (e.getValue().pending.contains(destinationId)) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    public boolean allFilesBackedUp(int deviceId) {
        for (PendingBackup p : backups.values()) {
            if (p.deviceId == deviceId && !p.pending.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    public boolean allFilesBackedUp() {
        for (PendingBackup p : backups.values()) {
            if (!p.pending.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    // ---- contadores por arquivo ----

    /**
     * Registra o status final de um arquivo do dispositivo.
     */
    public void fileDownloaded(int deviceId, FileType type, FileStatus status) {
        DeviceStats s = devices.get(deviceId);
        if (s == null) {
            return;
        }
        s.downloadCount++;
        if (status.isFailure()) {
            s.failures.merge(type, 1, Integer::sum);
            totals.failures.merge(type, 1, Integer::sum);
        } else {
            s.downloaded.merge(type, 1, Integer::sum);
            totals.downloaded.merge(type, 1, Integer::sum);
        }
        if (status.isWarning()) {
            s.warnings++;
            totals.warnings++;
        }
    }

    public int downloadCount(int deviceId) {
        DeviceStats s = devices.get(deviceId);
        return s == null ? 0 : s.downloadCount;
    }

    public int filesInDownload(int deviceId) {
        DeviceStats s = devices.get(deviceId);
        return s == null ? 0 : s.filesInDownload;
    }

    /** Todos os arquivos do lote do dispositivo chegaram a um status final. */
    public boolean allFilesDownloaded(int deviceId) {
        DeviceStats s = devices.get(deviceId);
        return s != null && s.downloadCount >= s.filesInDownload;
    }

    public DeviceSummary deviceSummary(int deviceId) {
        DeviceStats s = devices.get(deviceId);
        if (s == null) {
            return new DeviceSummary(0, 0, 0, 0, 0);
        }
        return new DeviceSummary(
                s.downloaded.getOrDefault(FileType.PHOTO, 0),
                s.downloaded.getOrDefault(FileType.VIDEO, 0),
                s.failures.getOrDefault(FileType.PHOTO, 0),
                s.failures.getOrDefault(FileType.VIDEO, 0),
                s.warnings);
    }

    public DeviceSummary sessionSummary() {
        return new DeviceSummary(
                totals.downloaded.getOrDefault(FileType.PHOTO, 0),
                totals.downloaded.getOrDefault(FileType.VIDEO, 0),
                totals.failures.getOrDefault(FileType.PHOTO, 0),
                totals.failures.getOrDefault(FileType.VIDEO, 0),
                totals.warnings);
    }

    public boolean noErrorsOrWarnings() {
        return sessionSummary().problems() == 0;
    }

    // ---- arquivos a apagar na origem (modo mover) ----

    public void addToAutoDelete(int deviceId, String sourcePath) {
        DeviceStats s = devices.get(deviceId);
        if (s != null) {
            s.autoDelete.add(sourcePath);
        }
    }

    public List<String> filesToAutoDelete(int deviceId) {
        DeviceStats s = devices.get(deviceId);
        return s == null ? List.of() : List.copyOf(s.autoDelete);
    }

    public void clearAutoDelete(int deviceId) {
        DeviceStats s = devices.get(deviceId);
        if (s != null) {
            s.autoDelete.clear();
        }
    }

    public void removeDevice(int deviceId) {
        devices.remove(deviceId);
        backups.values().removeIf(p -> p.deviceId == deviceId && p.pending.isEmpty());
    }

    /** Zera tudo ao fim de um ciclo de download. */
    public void purgeAll() {
        devices.clear();
        backups.clear();
        totals.downloaded.clear();
        totals.failures.clear();
        totals.warnings = 0;
    }

    private static final class DeviceStats {
        int filesInDownload;
        long sizeToCopy;
        long sizeToBackup;
        long bytesCopied;
        long bytesBackedUp;
        int downloadCount;
        int warnings;
        final Map<FileType, Integer> downloaded = new EnumMap<>(FileType.class);
        final Map<FileType, Integer> failures = new EnumMap<>(FileType.class);
        final Set<String> autoDelete = new LinkedHashSet<>();
    }

    private static final class PendingBackup {
        final int deviceId;
        final Set<Integer> pending;
        final Set<Integer> succeeded = new HashSet<>();
        final Set<Integer> failed = new HashSet<>();

        PendingBackup(int deviceId, Set<Integer> expected) {
            this.deviceId = deviceId;
            this.pending = new HashSet<>(expected);
        }
    }

    private static final class SessionTotals {
        final Map<FileType, Integer> downloaded = new EnumMap<>(FileType.class);
        final Map<FileType, Integer> failures = new EnumMap<>(FileType.class);
        int warnings;
    }

    /**
     * Contadores finais de um dispositivo ou da sessão.
     */
    public static final class DeviceSummary {
        private final int photosDownloaded;
        private final int videosDownloaded;
        private final int photoFailures;
        private final int videoFailures;
        private final int warnings;

        public DeviceSummary(int photosDownloaded, int videosDownloaded,
                             int photoFailures, int videoFailures, int warnings) {
            this.photosDownloaded = photosDownloaded;
            this.videosDownloaded = videosDownloaded;
            this.photoFailures = photoFailures;
            this.videoFailures = videoFailures;
            this.warnings = warnings;
        }

        public int photosDownloaded() { return photosDownloaded; }
        public int videosDownloaded() { return videosDownloaded; }
        public int photoFailures() { return photoFailures; }
        public int videoFailures() { return videoFailures; }
        public int warnings() { return warnings; }

        public int downloaded() {
            return photosDownloaded + videosDownloaded;
        }

        public int problems() {
            return photoFailures + videoFailures + warnings;
        }

        /** Mensagem de resumo, ex.: "10 fotos e 2 videos baixados, 1 falha". */
        public String message() {
            StringBuilder sb = new StringBuilder();
            sb.append(plural(photosDownloaded, "foto", "fotos"))
                    .append(" e ")
                    .append(plural(videosDownloaded, "video", "videos"))
                    .append(" baixados");
            int failures = photoFailures + videoFailures;
            if (failures > 0) {
                sb.append(", ").append(plural(failures, "falha", "falhas"));
            }
            if (warnings > 0) {
                sb.append(", ").append(plural(warnings, "aviso", "avisos"));
            }
            return sb.toString();
        }

        private static String plural(int n, String one, String many) {
            return n + " " + (n == 1 ? one : many);
        }

        @Override
        public String toString() {
            return message();
        }
    }
}
