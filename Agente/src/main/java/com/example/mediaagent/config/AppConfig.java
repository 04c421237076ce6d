package com.example.mediaagent.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Configuração do agente de ingestão de mídia.
 *
 * Ordem de resolução de cada chave: override em runtime, variável de ambiente,
 * system property e por último o arquivo .env. Os getters tipados aplicam limites
 * e valores padrão; valores inválidos em chaves obrigatórias falham na leitura.
 * Os tempos de encerramento dos workers são configuráveis por estágio.
 */
public final class AppConfig {

    // Chaves

    /** Pasta de destino das fotos. Padrão $HOME/Pictures. */
    public static final String PHOTO_DOWNLOAD_FOLDER = "PHOTO_DOWNLOAD_FOLDER";
    /** Pasta de destino dos vídeos. Padrão $HOME/Videos. */
    public static final String VIDEO_DOWNLOAD_FOLDER = "VIDEO_DOWNLOAD_FOLDER";
    /** Caminho local ("Este Computador") usado como origem. Opcional. */
    public static final String THIS_COMPUTER_PATH = "THIS_COMPUTER_PATH";

    public static final String BACKUP_FILES = "BACKUP_FILES";
    public static final String BACKUP_DEVICE_AUTODETECTION = "BACKUP_DEVICE_AUTODETECTION";
    /** Nome da subpasta que marca um volume como destino de backup de fotos. */
    public static final String PHOTO_BACKUP_IDENTIFIER = "PHOTO_BACKUP_IDENTIFIER";
    /** Nome da subpasta que marca um volume como destino de backup de vídeos. */
    public static final String VIDEO_BACKUP_IDENTIFIER = "VIDEO_BACKUP_IDENTIFIER";
    public static final String BACKUP_PHOTO_LOCATION = "BACKUP_PHOTO_LOCATION";
    public static final String BACKUP_VIDEO_LOCATION = "BACKUP_VIDEO_LOCATION";
    public static final String BACKUP_DUPLICATE_OVERWRITE = "BACKUP_DUPLICATE_OVERWRITE";

    public static final String AUTO_DOWNLOAD_AT_STARTUP = "AUTO_DOWNLOAD_AT_STARTUP";
    public static final String AUTO_DOWNLOAD_UPON_DEVICE_INSERTION = "AUTO_DOWNLOAD_UPON_DEVICE_INSERTION";
    public static final String AUTO_EXIT = "AUTO_EXIT";
    public static final String AUTO_EXIT_FORCE = "AUTO_EXIT_FORCE";
    public static final String AUTO_UNMOUNT = "AUTO_UNMOUNT";
    /** Quando true, arquivos de origem são apagados ao fim do download (semântica de mover). */
    public static final String MOVE_FILES = "MOVE_FILES";
    public static final String VERIFY_FILE = "VERIFY_FILE";

    public static final String PHOTO_SUBFOLDER_TEMPLATE = "PHOTO_SUBFOLDER_TEMPLATE";
    public static final String VIDEO_SUBFOLDER_TEMPLATE = "VIDEO_SUBFOLDER_TEMPLATE";
    public static final String PHOTO_RENAME_TEMPLATE = "PHOTO_RENAME_TEMPLATE";
    public static final String VIDEO_RENAME_TEMPLATE = "VIDEO_RENAME_TEMPLATE";
    /** Código de trabalho pré-definido (útil em modo headless). */
    public static final String JOB_CODE = "JOB_CODE";
    /** Nomes de pastas ignoradas durante o scan, separados por vírgula. */
    public static final String IGNORED_PATHS = "IGNORED_PATHS";

    /** "process" (JVM filha por worker) ou "thread" (worker na mesma JVM). */
    public static final String WORKER_MODE = "WORKER_MODE";
    public static final String WORKER_GRACE_MS_SCAN = "WORKER_GRACE_MS_SCAN";
    public static final String WORKER_GRACE_MS_COPY = "WORKER_GRACE_MS_COPY";
    public static final String WORKER_GRACE_MS_RENAME = "WORKER_GRACE_MS_RENAME";
    public static final String WORKER_GRACE_MS_BACKUP = "WORKER_GRACE_MS_BACKUP";
    public static final String WORKER_GRACE_MS_OFFLOAD = "WORKER_GRACE_MS_OFFLOAD";

    public static final String TIME_REMAINING_MIN_INTERVAL_MS = "TIME_REMAINING_MIN_INTERVAL_MS";
    public static final String PROXIMITY_GAP_SECONDS = "PROXIMITY_GAP_SECONDS";
    /** Arquivo JSON com estado persistido (códigos de trabalho, sequências). */
    public static final String AGENT_STATE_FILE = "AGENT_STATE_FILE";
    public static final String HASH_ALGORITHM = "HASH_ALGORITHM";
    public static final String CHUNK_SIZE_KB = "CHUNK_SIZE_KB";
    public static final String AGENT_LOG_LEVEL = "AGENT_LOG_LEVEL";

    // Estado

    /**
     * Overrides aplicados em runtime; vencem todas as outras fontes.
     */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    /** Valores efetivos carregados. */
    private final ConcurrentHashMap<String, String> values;

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /** Junta system properties, ambiente (que as sobrescreve) e .env (só chaves ausentes). */
    public static AppConfig load() {
        Map<String, String> resolved = new ConcurrentHashMap<>();
        System.getProperties().stringPropertyNames().forEach(name -> {
            String value = System.getProperty(name);
            if (value != null) {
                resolved.put(name, value);
            }
        });
        resolved.putAll(System.getenv());
        Dotenv.configure().ignoreIfMissing().load().entries()
                .forEach(entry -> resolved.putIfAbsent(entry.getKey(), entry.getValue()));
        return new AppConfig(resolved);
    }

    /**
     * Cria uma configuração a partir de valores já resolvidos (usado nos testes).
     */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // Acesso

    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    public String require(String key) {
        return find(key).orElseThrow(() -> new IllegalStateException("Configuração obrigatória ausente: " + key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Seta/remove override em runtime. Se value==null, remove o override.
     */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // Getters do domínio

    public Path photoDownloadFolder() {
        return Path.of(getOrDefault(PHOTO_DOWNLOAD_FOLDER, userHome() + "/Pictures"));
    }

    public Path videoDownloadFolder() {
        return Path.of(getOrDefault(VIDEO_DOWNLOAD_FOLDER, userHome() + "/Videos"));
    }

    public Optional<Path> thisComputerPath() {
        return find(THIS_COMPUTER_PATH).map(Path::of);
    }

    public boolean backupFiles() { return bool(BACKUP_FILES, false); }
    public boolean backupDeviceAutodetection() { return bool(BACKUP_DEVICE_AUTODETECTION, true); }
    public String photoBackupIdentifier() { return identifier(PHOTO_BACKUP_IDENTIFIER, "photos"); }
    public String videoBackupIdentifier() { return identifier(VIDEO_BACKUP_IDENTIFIER, "videos"); }
    public Optional<Path> backupPhotoLocation() { return find(BACKUP_PHOTO_LOCATION).map(Path::of); }
    public Optional<Path> backupVideoLocation() { return find(BACKUP_VIDEO_LOCATION).map(Path::of); }
    public boolean backupDuplicateOverwrite() { return bool(BACKUP_DUPLICATE_OVERWRITE, false); }

    public boolean autoDownloadAtStartup() { return bool(AUTO_DOWNLOAD_AT_STARTUP, false); }
    public boolean autoDownloadUponDeviceInsertion() { return bool(AUTO_DOWNLOAD_UPON_DEVICE_INSERTION, false); }
    public boolean autoExit() { return bool(AUTO_EXIT, false); }
    public boolean autoExitForce() { return bool(AUTO_EXIT_FORCE, false); }
    public boolean autoUnmount() { return bool(AUTO_UNMOUNT, false); }
    public boolean moveFiles() { return bool(MOVE_FILES, false); }
    public boolean verifyFile() { return bool(VERIFY_FILE, true); }

    public String photoSubfolderTemplate() { return getOrDefault(PHOTO_SUBFOLDER_TEMPLATE, "{date:yyyy}/{date:yyyyMMdd}"); }
    public String videoSubfolderTemplate() { return getOrDefault(VIDEO_SUBFOLDER_TEMPLATE, "{date:yyyy}/{date:yyyyMMdd}"); }
    public String photoRenameTemplate() { return getOrDefault(PHOTO_RENAME_TEMPLATE, "{name}{ext}"); }
    public String videoRenameTemplate() { return getOrDefault(VIDEO_RENAME_TEMPLATE, "{name}{ext}"); }

    public Optional<String> jobCode() { return find(JOB_CODE); }

    /**
     * Nomes de pastas ignoradas durante o scan (ex.: lixeiras, caches de miniaturas).
     */
    public List<String> ignoredPaths() {
        String raw = getOrDefault(IGNORED_PATHS, ".Trash,.thumbnails");
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * Modo dos workers: "process" (padrão) ou "thread".
     * Qualquer outro valor falha cedo.
     */
    public String workerMode() {
        String v = getOrDefault(WORKER_MODE, "process").trim().toLowerCase(Locale.ROOT);
        if (!v.equals("process") && !v.equals("thread")) {
            throw new IllegalStateException("WORKER_MODE inválido: use 'process' ou 'thread'");
        }
        return v;
    }

    public Duration scanGracePeriod() { return graceConfig(WORKER_GRACE_MS_SCAN, 2000); }
    public Duration copyGracePeriod() { return graceConfig(WORKER_GRACE_MS_COPY, 1000); }
    public Duration renameGracePeriod() { return graceConfig(WORKER_GRACE_MS_RENAME, 500); }
    public Duration backupGracePeriod() { return graceConfig(WORKER_GRACE_MS_BACKUP, 1000); }
    public Duration offloadGracePeriod() { return graceConfig(WORKER_GRACE_MS_OFFLOAD, 500); }

    /**
     * Intervalo mínimo entre amostras de taxa de transferência (ms).
     * Limites: [100, 60000]. Padrão 1000.
     */
    public Duration timeRemainingMinInterval() {
        return Duration.ofMillis(longConfig(TIME_REMAINING_MIN_INTERVAL_MS, 1000, 100, 60_000));
    }

    /**
     * Intervalo (s) que separa dois grupos de proximidade temporal. Padrão 1h.
     */
    public long proximityGapSeconds() {
        return longConfig(PROXIMITY_GAP_SECONDS, 3600, 1, 7L * 24 * 3600);
    }

    public Path stateFile() {
        return find(AGENT_STATE_FILE)
                .map(Path::of)
                .orElseGet(() -> Path.of(userHome(), ".mediaagent", "preferences.json"));
    }

    public String hashAlgorithm() {
        return getOrDefault(HASH_ALGORITHM, "SHA-256");
    }

    /**
     * Tamanho do bloco de cópia (bytes). Limites: [4 KB, 64 MB].
     */
    public int chunkSizeBytes() {
        return intConfig(CHUNK_SIZE_KB, 1024, 4, 64 * 1024) * 1024;
    }

    public String logLevel() {
        return getOrDefault(AGENT_LOG_LEVEL, "INFO").toUpperCase(Locale.ROOT);
    }

    // Conversões

    /** true, 1 ou yes (sem diferenciar caixa) contam como verdadeiro. */
    public boolean bool(String key, boolean def) {
        String raw = getOrDefault(key, Boolean.toString(def));
        return raw.equalsIgnoreCase("true")
                || raw.equalsIgnoreCase("1")
                || raw.equalsIgnoreCase("yes");
    }

    private String identifier(String key, String def) {
        String v = getOrDefault(key, def);
        if (v.contains("/") || v.contains("\\")) {
            throw new IllegalStateException(key + " deve ser um nome de pasta simples: " + v);
        }
        return v;
    }

    private Duration graceConfig(String key, long defMillis) {
        return Duration.ofMillis(longConfig(key, defMillis, 100, 60_000));
    }

    /** Long limitado a [min, max]; texto inválido devolve o padrão. */
    private long longConfig(String key, long def, long min, long max) {
        String raw = getOrDefault(key, Long.toString(def));
        try {
            long v = Long.parseLong(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** Int limitado a [min, max]; texto inválido devolve o padrão. */
    private int intConfig(String key, int def, int min, int max) {
        String raw = getOrDefault(key, Integer.toString(def));
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private static String userHome() {
        return System.getProperty("user.home");
    }

    // toString

    @Override
    public String toString() {
        String mode = safe(this::workerMode);
        return "AppConfig{" +
                "photos=" + safe(() -> photoDownloadFolder().toString()) +
                ", videos=" + safe(() -> videoDownloadFolder().toString()) +
                ", thisComputer=" + thisComputerPath().map(Path::toString).orElse("unset") +
                ", backup=" + backupFiles() +
                ", backupAutodetect=" + backupDeviceAutodetection() +
                ", workers=" + mode +
                ", move=" + moveFiles() +
                ", verify=" + verifyFile() +
                ", jobCode=" + (jobCode().isPresent() ? "set" : "unset") +
                "}";
    }

    /** Getter que lança vira "error:Tipo" no toString. */
    private static String safe(SupplierLike supplier) {
        try { return supplier.get(); } catch (Throwable t) { return "error:" + t.getClass().getSimpleName(); }
    }

    @FunctionalInterface
    private interface SupplierLike { String get(); }
}
