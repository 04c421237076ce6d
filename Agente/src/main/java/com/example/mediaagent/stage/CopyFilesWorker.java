package com.example.mediaagent.stage;

import com.example.mediaagent.media.FileType;
import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.media.ProblemDetail;
import com.example.mediaagent.stage.CopyMessages.BytesCopied;
import com.example.mediaagent.stage.CopyMessages.CopyFilesArguments;
import com.example.mediaagent.stage.CopyMessages.FileCopied;
import com.example.mediaagent.stage.CopyMessages.Request;
import com.example.mediaagent.stage.CopyMessages.Result;
import com.example.mediaagent.stage.CopyMessages.TempDirs;
import com.example.mediaagent.worker.StageWorker;
import com.example.mediaagent.worker.WorkerContext;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copia os arquivos de um dispositivo para diretórios temporários ocultos dentro das
 * pastas de download. O worker de renomear/mover tira os arquivos de lá depois.
 *
 * Falha num arquivo vira {@link FileCopied} com {@code succeeded=false}; os bytes que
 * faltaram são somados ao progresso para que o total do dispositivo feche.
 */
public final class CopyFilesWorker implements StageWorker<Request, Result> {

    private static final Logger log = LoggerFactory.getLogger(CopyFilesWorker.class);

    /** Prefixo dos diretórios temporários criados dentro das pastas de download. */
    public static final String TEMP_PREFIX = ".mediaagent-";

    @Override
    public void handle(Integer deviceId, Request request, WorkerContext<Result> context) throws IOException {
        if (!(request instanceof CopyFilesArguments)) {
            throw new IllegalArgumentException("Requisicao de copia desconhecida: " + request.getClass().getName());
        }
        CopyFilesArguments args = (CopyFilesArguments) request;
        int device = args.deviceId();
        FileTransfer transfer = new FileTransfer(args.chunkSize(), args.hashAlgorithm());

        Map<FileType, Path> tempDirs = createTempDirs(args);
        Map<FileType, String> reported = new EnumMap<>(FileType.class);
        tempDirs.forEach((type, dir) -> reported.put(type, dir.toString()));
        context.emit(device, new TempDirs(reported));

        long[] total = {0};
        int downloadCount = 0;
        for (MediaFileData file : args.files()) {
            if (context.stopRequested()) {
                log.info("Copia do dispositivo {} interrompida", device);
                break;
            }
            downloadCount++;
            long before = total[0];
            Path tempDir = tempDirs.get(file.fileType());
            ProblemDetail problem;
            if (tempDir == null) {
                problem = new ProblemDetail("Pasta de download indisponivel",
                        args.downloadFolders().get(file.fileType()));
            } else {
                Path target = tempDir.resolve(String.format(Locale.ROOT, "%06d-%s", downloadCount, file.name()));
                try {
                    problem = copyOne(file, target, transfer, args.verify(), context, chunk -> {
                        total[0] += chunk;
                        context.emit(device, new BytesCopied(chunk, total[0]));
                    });
                } catch (InterruptedIOException e) {
                    Files.deleteIfExists(target);
                    if (context.stopRequested()) {
                        break;
                    }
                    problem = new ProblemDetail("Copia interrompida", file.sourcePath());
                }
                if (problem == null) {
                    context.emit(device, new FileCopied(file.uniqueId(), true, target.toString(), downloadCount, null));
                    continue;
                }
                Files.deleteIfExists(target);
            }
            long missing = file.size() - (total[0] - before);
            if (missing > 0) {
                total[0] += missing;
                context.emit(device, new BytesCopied(missing, total[0], true));
            }
            log.warn("Falha ao copiar {}: {}", file.sourcePath(), problem);
            context.emit(device, new FileCopied(file.uniqueId(), false, null, downloadCount, problem));
        }
        context.finish();
    }

    private ProblemDetail copyOne(MediaFileData file, Path target, FileTransfer transfer, boolean verify,
                                  WorkerContext<Result> context, java.util.function.LongConsumer onChunk)
            throws InterruptedIOException {
        Path source = Path.of(file.sourcePath());
        try {
            transfer.copy(source, target, context, onChunk);
            if (verify && !transfer.sameContent(source, target)) {
                return new ProblemDetail("Verificacao falhou", "Conteudo copiado difere da origem: " + file.name());
            }
            Files.setLastModifiedTime(target, FileTime.fromMillis(file.modificationTime()));
            return null;
        } catch (InterruptedIOException e) {
            throw e;
        } catch (IOException e) {
            return new ProblemDetail("Falha ao copiar arquivo", e.getMessage());
        }
    }

    /**
     * Um diretório temporário por pasta de download distinta. Pastas que não podem
     * ser usadas ficam de fora (os arquivos daquele tipo falham).
     */
    private Map<FileType, Path> createTempDirs(CopyFilesArguments args) {
        Map<FileType, Path> dirs = new EnumMap<>(FileType.class);
        Map<String, Path> byFolder = new HashMap<>();
        for (MediaFileData f : args.files()) {
            FileType type = f.fileType();
            if (dirs.containsKey(type)) {
                continue;
            }
            String folder = args.downloadFolders().get(type);
            if (folder == null) {
                continue;
            }
            Path existing = byFolder.get(folder);
            if (existing != null) {
                dirs.put(type, existing);
                continue;
            }
            try {
                Path parent = Path.of(folder);
                Files.createDirectories(parent);
                Path temp = Files.createTempDirectory(parent, TEMP_PREFIX);
                byFolder.put(folder, temp);
                dirs.put(type, temp);
            } catch (IOException e) {
                log.error("Nao foi possivel criar diretorio temporario em {}: {}", folder, e.getMessage());
            }
        }
        return dirs;
    }
}
