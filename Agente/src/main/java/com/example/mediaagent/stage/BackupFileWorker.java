package com.example.mediaagent.stage;

import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.media.ProblemDetail;
import com.example.mediaagent.stage.BackupMessages.BackupArguments;
import com.example.mediaagent.stage.BackupMessages.BackupBytes;
import com.example.mediaagent.stage.BackupMessages.BackupFile;
import com.example.mediaagent.stage.BackupMessages.FileBackedUp;
import com.example.mediaagent.stage.BackupMessages.Request;
import com.example.mediaagent.stage.BackupMessages.Result;
import com.example.mediaagent.worker.StageWorker;
import com.example.mediaagent.worker.WorkerContext;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker de um destino de backup. Copia cada arquivo já renomeado para
 * {@code <destino>/<identificador>/<subpasta>/<nome>}.
 *
 * Todo {@link BackupFile} recebe exatamente um {@link FileBackedUp}, inclusive quando
 * o backup não é feito, para que o orquestrador feche a contagem por destino.
 */
public final class BackupFileWorker implements StageWorker<Request, Result> {

    private static final Logger log = LoggerFactory.getLogger(BackupFileWorker.class);

    private BackupArguments destination;

    @Override
    public void handle(Integer deviceId, Request request, WorkerContext<Result> context) throws IOException {
        if (request instanceof BackupArguments) {
            destination = (BackupArguments) request;
            log.info("Worker de backup pronto para {}", destination.path());
            return;
        }
        if (!(request instanceof BackupFile)) {
            throw new IllegalArgumentException("Requisicao de backup desconhecida: " + request.getClass().getName());
        }
        if (destination == null) {
            throw new IllegalStateException("BackupFile recebido antes de BackupArguments");
        }
        BackupFile backup = (BackupFile) request;
        MediaFileData file = backup.file();
        int source = file.deviceId();

        if (!backup.doBackup() || backup.downloadPath() == null) {
            context.emit(source, new BackupBytes(source, file.size()));
            context.emit(source, new FileBackedUp(destination.destinationId(), file.uniqueId(), source,
                    false, false, null, null));
            return;
        }

        Path downloaded = Path.of(backup.downloadPath());
        Path folder = Path.of(destination.path());
        if (backup.identifier() != null && !backup.identifier().isBlank()) {
            folder = folder.resolve(backup.identifier());
        }
        if (!backup.subfolder().isEmpty()) {
            folder = folder.resolve(backup.subfolder());
        }
        Path target = folder.resolve(downloaded.getFileName().toString());

        long[] sent = {0};
        ProblemDetail problem = null;
        try {
            Files.createDirectories(folder);
            if (Files.exists(target) && !backup.overwrite()) {
                log.info("Backup de {} ignorado: ja existe em {}", file.name(), target);
            } else {
                FileTransfer transfer = new FileTransfer(1024 * 1024, backup.hashAlgorithm());
                transfer.copy(downloaded, target, context, chunk -> {
                    sent[0] += chunk;
                    context.emit(source, new BackupBytes(source, chunk));
                });
                if (backup.verify() && !transfer.sameContent(downloaded, target)) {
                    problem = new ProblemDetail("Verificacao do backup falhou", target.toString());
                } else {
                    Files.setLastModifiedTime(target, FileTime.fromMillis(file.modificationTime()));
                }
            }
        } catch (InterruptedIOException e) {
            problem = new ProblemDetail("Backup interrompido", target.toString());
        } catch (IOException e) {
            problem = new ProblemDetail("Falha no backup para " + destination.displayName(), e.getMessage());
        }

        if (problem != null) {
            Files.deleteIfExists(target);
            log.warn("Backup de {} falhou: {}", file.name(), problem);
        }
        long missing = file.size() - sent[0];
        if (missing > 0) {
            context.emit(source, new BackupBytes(source, missing));
        }
        context.emit(source, new FileBackedUp(destination.destinationId(), file.uniqueId(), source,
                problem == null, true, problem == null ? target.toString() : null, problem));
    }
}
