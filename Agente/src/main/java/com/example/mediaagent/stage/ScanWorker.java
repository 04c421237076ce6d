package com.example.mediaagent.stage;

import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.stage.ScanMessages.DeviceInfo;
import com.example.mediaagent.stage.ScanMessages.FilesFound;
import com.example.mediaagent.stage.ScanMessages.Request;
import com.example.mediaagent.stage.ScanMessages.Result;
import com.example.mediaagent.stage.ScanMessages.ResumeScan;
import com.example.mediaagent.stage.ScanMessages.ScanArguments;
import com.example.mediaagent.stage.ScanMessages.ScanErrorCode;
import com.example.mediaagent.stage.ScanMessages.ScanProblem;
import com.example.mediaagent.worker.StageWorker;
import com.example.mediaagent.worker.WorkerContext;
import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Varre um dispositivo procurando fotos e vídeos.
 *
 * Características:
 * - Usa {@link Files#walkFileTree} sem seguir links (evita loops e "vazamento" para outros volumes);
 * - Pula pastas ignoradas (lixeiras, caches de miniaturas) pelo nome;
 * - Emite arquivos em lotes com os contadores acumulados do dispositivo;
 * - Erros pontuais (um arquivo ilegível) são logados e o scan continua.
 *
 * Se a raiz não puder ser aberta, emite {@link ScanProblem} e aguarda: um {@link ResumeScan}
 * tenta de novo com os mesmos argumentos, um STOP encerra o worker.
 */
public final class ScanWorker implements StageWorker<Request, Result> {

    private static final Logger log = LoggerFactory.getLogger(ScanWorker.class);

    private ScanArguments arguments;

    @Override
    public void handle(Integer deviceId, Request request, WorkerContext<Result> context) throws IOException {
        if (request instanceof ScanArguments) {
            arguments = (ScanArguments) request;
        } else if (request instanceof ResumeScan) {
            if (arguments == null) {
                throw new IllegalStateException("ResumeScan recebido antes de ScanArguments");
            }
            log.info("Repetindo scan do dispositivo {}", arguments.deviceId());
        } else {
            throw new IllegalArgumentException("Requisicao de scan desconhecida: " + request.getClass().getName());
        }
        if (attempt(context)) {
            context.finish();
        }
    }

    /**
     * @return true se o scan terminou (com ou sem arquivos); false se parou num erro recuperável
     */
    private boolean attempt(WorkerContext<Result> context) throws IOException {
        ScanArguments args = arguments;
        Path root = Path.of(args.root());
        int deviceId = args.deviceId();

        if (!Files.exists(root)) {
            context.emit(deviceId, new ScanProblem(ScanErrorCode.INACCESSIBLE,
                    "Dispositivo inacessivel: " + root));
            return false;
        }
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            context.emit(deviceId, new ScanProblem(ScanErrorCode.LOCKED,
                    "Sem permissao de leitura em " + root));
            return false;
        }

        Set<String> ignored = args.ignoredPaths().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        Batcher batcher = new Batcher(deviceId, args.batchSize(), context);
        IOException[] rootFailure = new IOException[1];

        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (context.stopRequested()) {
                        return FileVisitResult.TERMINATE;
                    }
                    if (!dir.equals(root)) {
                        Path name = dir.getFileName();
                        if (name != null && ignored.contains(name.toString().toLowerCase(Locale.ROOT))) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (context.stopRequested()) {
                        return FileVisitResult.TERMINATE;
                    }
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    String name = file.getFileName().toString();
                    Optional<FileType> type = FileType.fromFileName(name);
                    if (type.isEmpty()) {
                        return FileVisitResult.CONTINUE;
                    }
                    String relative = root.relativize(file).toString().replace('\\', '/');
                    long mtime = attrs.lastModifiedTime().toMillis();
                    batcher.add(new MediaFileData(
                            MediaFileData.uniqueIdFor(deviceId, relative, mtime),
                            deviceId,
                            type.get(),
                            file.toAbsolutePath().toString(),
                            relative,
                            name,
                            attrs.size(),
                            mtime));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    if (file.equals(root)) {
                        rootFailure[0] = exc;
                        return FileVisitResult.TERMINATE;
                    }
                    log.warn("Falha ao acessar {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    if (exc != null) {
                        log.warn("Erro ao finalizar diretorio {}: {}", dir, exc.getMessage());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (FileSystemLoopException loop) {
            throw new IOException("Loop de sistema de arquivos detectado (symlink): " + loop.getFile(), loop);
        }

        if (rootFailure[0] != null) {
            ScanErrorCode code = rootFailure[0] instanceof NoSuchFileException
                    ? ScanErrorCode.INACCESSIBLE
                    : ScanErrorCode.LOCKED;
            context.emit(deviceId, new ScanProblem(code, rootFailure[0].getMessage()));
            return false;
        }
        if (context.stopRequested()) {
            return true;
        }

        batcher.flush();
        context.emit(deviceId, deviceInfo(root, args));
        log.info("Scan do dispositivo {} concluido: {} arquivos", deviceId, batcher.total());
        return true;
    }

    private DeviceInfo deviceInfo(Path root, ScanArguments args) {
        long total = 0;
        long free = 0;
        try {
            FileStore store = Files.getFileStore(root);
            total = store.getTotalSpace();
            free = store.getUsableSpace();
        } catch (IOException e) {
            log.debug("Espaco do dispositivo indisponivel: {}", e.getMessage());
        }
        return new DeviceInfo(args.device().name(), total, free);
    }

    /**
     * Acumula arquivos e emite {@link FilesFound} a cada lote completo.
     */
    private static final class Batcher {
        private final int deviceId;
        private final int batchSize;
        private final WorkerContext<Result> context;
        private final List<MediaFileData> pending = new ArrayList<>();
        private int photos;
        private int videos;
        private long photosSize;
        private long videosSize;

        Batcher(int deviceId, int batchSize, WorkerContext<Result> context) {
            this.deviceId = deviceId;
            this.batchSize = batchSize;
            this.context = context;
        }

        void add(MediaFileData file) {
            if (file.fileType() == FileType.PHOTO) {
                photos++;
                photosSize += file.size();
            } else {
                videos++;
                videosSize += file.size();
            }
            pending.add(file);
            if (pending.size() >= batchSize) {
                flush();
            }
        }

        void flush() {
            if (pending.isEmpty()) {
                return;
            }
            context.emit(deviceId, new FilesFound(pending, photos, videos, photosSize, videosSize));
            pending.clear();
        }

        int total() {
            return photos + videos;
        }
    }
}
