package com.example.mediaagent.stage;

import com.example.mediaagent.media.MediaFileData;
import com.example.mediaagent.media.NamingTemplate;
import com.example.mediaagent.media.ProblemDetail;
import com.example.mediaagent.stage.RenameMessages.DownloadCompleted;
import com.example.mediaagent.stage.RenameMessages.DownloadStarted;
import com.example.mediaagent.stage.RenameMessages.FileRenamed;
import com.example.mediaagent.stage.RenameMessages.RenameFile;
import com.example.mediaagent.stage.RenameMessages.Request;
import com.example.mediaagent.stage.RenameMessages.Result;
import com.example.mediaagent.stage.RenameMessages.SequencesUpdate;
import com.example.mediaagent.worker.StageWorker;
import com.example.mediaagent.worker.WorkerContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker único que move arquivos do diretório temporário para o destino final,
 * aplicando os templates de subpasta e de nome.
 *
 * Mantém os contadores de sequência da sessão; ao receber {@link DownloadCompleted}
 * devolve os valores em {@link SequencesUpdate} para o orquestrador persistir.
 */
public final class RenameMoveFileWorker implements StageWorker<Request, Result> {

    private static final Logger log = LoggerFactory.getLogger(RenameMoveFileWorker.class);

    private final Supplier<LocalDate> today;
    private final ZoneId zone;
    private DownloadStarted settings;
    private int sequence;
    private LocalDate day;
    private int downloadsToday;

    public RenameMoveFileWorker() {
        this(LocalDate::now, ZoneId.systemDefault());
    }

    RenameMoveFileWorker(Supplier<LocalDate> today, ZoneId zone) {
        this.today = today;
        this.zone = zone;
    }

    @Override
    public void handle(Integer deviceId, Request request, WorkerContext<Result> context) {
        if (request instanceof DownloadStarted) {
            settings = (DownloadStarted) request;
            sequence = settings.storedSequenceNo();
            day = LocalDate.parse(settings.day());
            downloadsToday = settings.downloadsToday();
            rollDay();
            log.debug("Ciclo de download iniciado (sequencia={}, hoje={})", sequence, downloadsToday);
        } else if (request instanceof RenameFile) {
            context.emit(deviceId, rename((RenameFile) request));
        } else if (request instanceof DownloadCompleted) {
            rollDay();
            LocalDate current = day != null ? day : today.get();
            context.emit(null, new SequencesUpdate(sequence, current.toString(), downloadsToday));
        } else {
            throw new IllegalArgumentException("Requisicao de renomeacao desconhecida: " + request.getClass().getName());
        }
    }

    private void rollDay() {
        LocalDate now = today.get();
        if (day == null || !day.equals(now)) {
            day = now;
            downloadsToday = 0;
        }
    }

    private FileRenamed rename(RenameFile request) {
        MediaFileData file = request.file();
        if (settings == null) {
            return new FileRenamed(file.uniqueId(), false, null, null, request.downloadCount(),
                    new ProblemDetail("Download nao iniciado", "Arquivo recebido fora de um ciclo de download"));
        }
        rollDay();
        String subfolder = "";
        try {
            NamingTemplate.Context ctx = new NamingTemplate.Context(
                    file.modifiedAt(), zone, file.name(), sequence + 1, downloadsToday + 1,
                    request.jobCode(), request.deviceName());
            subfolder = NamingTemplate.subfolder(settings.subfolderTemplates().get(file.fileType())).render(ctx);
            String name = NamingTemplate.fileName(settings.renameTemplates().get(file.fileType())).render(ctx);
            if (name.isBlank()) {
                name = file.name();
            }

            Path folder = Path.of(settings.downloadFolders().get(file.fileType())).resolve(subfolder);
            Files.createDirectories(folder);
            Path target = folder.resolve(name);
            ProblemDetail problem = null;
            if (Files.exists(target)) {
                target = uniqueName(folder, name);
                problem = new ProblemDetail("Arquivo com mesmo nome ja existe",
                        name + " salvo como " + target.getFileName());
            }
            Files.move(Path.of(request.tempPath()), target, StandardCopyOption.ATOMIC_MOVE);
            sequence++;
            downloadsToday++;
            return new FileRenamed(file.uniqueId(), true, target.toString(), subfolder, request.downloadCount(), problem);
        } catch (IOException | DateTimeException | IllegalArgumentException e) {
            log.warn("Falha ao mover {}: {}", file.name(), e.getMessage());
            return new FileRenamed(file.uniqueId(), false, null, subfolder, request.downloadCount(),
                    new ProblemDetail("Falha ao mover arquivo", e.getMessage()));
        }
    }

    /**
     * Acrescenta _1, _2, ... antes da extensão até achar um nome livre.
     */
    static Path uniqueName(Path folder, String name) {
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        for (int i = 1; ; i++) {
            Path candidate = folder.resolve(base + "_" + i + ext);
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }
}
