package com.example.mediaagent.orchestrator;

import com.example.mediaagent.stage.CopyFilesWorker;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Limpeza em disco fora da thread do orquestrador: diretórios temporários dos
 * downloads e arquivos de origem no modo mover.
 */
final class Housekeeping {

    private static final Logger log = LoggerFactory.getLogger(Housekeeping.class);

    private final Executor executor;

    Housekeeping(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    void purgeTempDirs(List<Path> dirs) {
        if (dirs.isEmpty()) {
            return;
        }
        List<Path> copy = List.copyOf(dirs);
        executor.execute(() -> copy.forEach(Housekeeping::deleteTempDir));
    }

    void deleteSourceFiles(List<String> paths) {
        if (paths.isEmpty()) {
            return;
        }
        List<String> copy = List.copyOf(paths);
        executor.execute(() -> {
            int deleted = 0;
            for (String p : copy) {
                try {
                    if (Files.deleteIfExists(Path.of(p))) {
                        deleted++;
                    }
                } catch (IOException e) {
                    log.warn("Nao foi possivel apagar {} na origem: {}", p, e.getMessage());
                }
            }
            log.info("{} arquivos apagados na origem", deleted);
        });
    }

    /**
     * Apaga um diretório temporário e seu conteúdo. Só aceita diretórios criados pelo
     * worker de cópia.
     */
    static void deleteTempDir(Path dir) {
        Path name = dir.getFileName();
        if (name == null || !name.toString().startsWith(CopyFilesWorker.TEMP_PREFIX)) {
            log.error("Recusando apagar {}: nao e um diretorio temporario do agente", dir);
            return;
        }
        if (!Files.isDirectory(dir)) {
            return;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.deleteIfExists(d);
                    return FileVisitResult.CONTINUE;
                }
            });
            log.debug("Diretorio temporario {} removido", dir);
        } catch (IOException e) {
            log.error("Erro ao apagar diretorio temporario {}: {}", dir, e.getMessage());
        }
    }
}
