package com.example.mediaagent.backup;

import com.example.mediaagent.media.FileType;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolve e mantém os destinos de backup da sessão.
 *
 * Regras:
 * - Autodetecção: um caminho é destino se tiver subpastas identificadoras graváveis
 *   (uma por tipo de arquivo). As duas presentes resultam em fotos e vídeos.
 * - Manual: o caminho é comparado literalmente com os destinos configurados.
 * - Uma entrada por caminho; readicionar com a mesma capacidade não altera contadores.
 *
 * Os contadores por tipo são sempre calculados a partir das entradas atuais,
 * já que destinos podem aparecer e sumir durante a sessão.
 */
public final class BackupDeviceCollection {

    private static final Logger log = LoggerFactory.getLogger(BackupDeviceCollection.class);

    private final BackupSettings settings;
    private final Map<Path, BackupDevice> devices = new LinkedHashMap<>();
    private int nextId = 1;

    public BackupDeviceCollection(BackupSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public BackupSettings settings() {
        return settings;
    }

    /**
     * Determina a capacidade de um caminho candidato, ou vazio se não é destino de backup.
     */
    public Optional<BackupLocationType> isBackupPath(Path path) {
        Objects.requireNonNull(path, "path");
        if (!settings.enabled()) {
            return Optional.empty();
        }
        Path normalized = path.toAbsolutePath().normalize();
        boolean photos;
        boolean videos;
        if (settings.autodetect()) {
            photos = writableIdentifierFolder(normalized, FileType.PHOTO);
            videos = writableIdentifierFolder(normalized, FileType.VIDEO);
        } else {
            photos = matchesManual(normalized, FileType.PHOTO);
            videos = matchesManual(normalized, FileType.VIDEO);
        }
        if (!photos && !videos) {
            return Optional.empty();
        }
        return Optional.of(BackupLocationType.of(photos, videos));
    }

    private boolean writableIdentifierFolder(Path root, FileType type) {
        Path folder = root.resolve(settings.identifier(type));
        return Files.isDirectory(folder) && Files.isWritable(folder);
    }

    private boolean matchesManual(Path path, FileType type) {
        return settings.manualLocation(type)
                .map(p -> p.toAbsolutePath().normalize().equals(path))
                .orElse(false);
    }

    /**
     * Adiciona (ou atualiza) um destino.
     *
     * @return o destino, ou vazio se o caminho já estava registrado com a mesma capacidade
     */
    public Optional<BackupDevice> add(Path path, BackupLocationType type, String mountName) {
        Path key = path.toAbsolutePath().normalize();
        BackupDevice existing = devices.get(key);
        if (existing != null && existing.type() == type) {
            return Optional.empty();
        }
        int id = existing != null ? existing.id() : nextId++;
        BackupDevice device = new BackupDevice(id, key, type, mountName);
        devices.put(key, device);
        log.info("Destino de backup {}: {} ({})", existing == null ? "adicionado" : "atualizado", key, type);
        return Optional.of(device);
    }

    /**
     * Registra os destinos manuais configurados. Caminhos iguais para fotos e vídeos
     * viram um único destino de fotos e vídeos.
     */
    public List<BackupDevice> setupManualBackup() {
        List<BackupDevice> added = new ArrayList<>();
        if (!settings.enabled() || settings.autodetect()) {
            return added;
        }
        Optional<Path> photos = settings.manualLocation(FileType.PHOTO).map(p -> p.toAbsolutePath().normalize());
        Optional<Path> videos = settings.manualLocation(FileType.VIDEO).map(p -> p.toAbsolutePath().normalize());
        if (photos.isPresent() && photos.equals(videos)) {
            add(photos.get(), BackupLocationType.PHOTOS_AND_VIDEOS, null).ifPresent(added::add);
            return added;
        }
        photos.flatMap(p -> add(p, BackupLocationType.PHOTOS, null)).ifPresent(added::add);
        videos.flatMap(p -> add(p, BackupLocationType.VIDEOS, null)).ifPresent(added::add);
        return added;
    }

    public Optional<BackupDevice> remove(Path path) {
        BackupDevice removed = devices.remove(path.toAbsolutePath().normalize());
        if (removed != null) {
            log.info("Destino de backup removido: {}", removed.path());
        }
        return Optional.ofNullable(removed);
    }

    public Optional<BackupDevice> get(Path path) {
        return Optional.ofNullable(devices.get(path.toAbsolutePath().normalize()));
    }

    public Optional<BackupDevice> byId(int id) {
        for (BackupDevice d : devices.values()) {
            if (d.id() == id) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    public Collection<BackupDevice> all() {
        return List.copyOf(devices.values());
    }

    public int size() {
        return devices.size();
    }

    public List<BackupDevice> matching(FileType type) {
        List<BackupDevice> out = new ArrayList<>();
        for (BackupDevice d : devices.values()) {
            if (d.type().accepts(type)) {
                out.add(d);
            }
        }
        return out;
    }

    public int count(FileType type) {
        return matching(type).size();
    }

    public int photoDestinationCount() {
        return count(FileType.PHOTO);
    }

    public int videoDestinationCount() {
        return count(FileType.VIDEO);
    }

    /** Número de destinos por tipo, para cálculo do volume de backup. */
    public Map<FileType, Integer> countsByType() {
        Map<FileType, Integer> counts = new EnumMap<>(FileType.class);
        for (FileType t : FileType.values()) {
            counts.put(t, count(t));
        }
        return counts;
    }

    public boolean backupPossible(FileType type) {
        return count(type) > 0;
    }
}
