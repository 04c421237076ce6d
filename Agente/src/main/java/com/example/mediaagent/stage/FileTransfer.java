package com.example.mediaagent.stage;

import com.example.mediaagent.worker.WorkerContext;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.function.LongConsumer;

/**
 * Cópia em blocos com progresso, pausa e verificação por hash, compartilhada pelos
 * workers de cópia e de backup.
 */
final class FileTransfer {

    private static final HexFormat HEX = HexFormat.of();

    private final int chunkSize;
    private final String hashAlgorithm;

    FileTransfer(int chunkSize, String hashAlgorithm) {
        this.chunkSize = chunkSize;
        this.hashAlgorithm = hashAlgorithm;
    }

    /**
     * Copia {@code source} para {@code target} (criando ou truncando), reportando cada bloco.
     * Respeita PAUSE entre blocos; STOP interrompe com {@link InterruptedIOException}.
     *
     * @return bytes copiados
     */
    long copy(Path source, Path target, WorkerContext<?> context, LongConsumer onChunk) throws IOException {
        byte[] buffer = new byte[chunkSize];
        long copied = 0;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(source));
             OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE,
                     StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                copied += read;
                onChunk.accept(read);
                waitIfPaused(context);
            }
        }
        return copied;
    }

    /**
     * Compara o conteúdo de dois arquivos pelo hash configurado.
     */
    boolean sameContent(Path a, Path b) throws IOException {
        return hash(a).equals(hash(b));
    }

    /**
     * Hash de conteúdo em blocos de 64KB.
     */
    String hash(Path path) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[64 * 1024];
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HEX.formatHex(digest.digest());
    }

    private MessageDigest newDigest() throws IOException {
        try {
            return MessageDigest.getInstance(hashAlgorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IOException("Algoritmo de hash indisponível no sistema: " + hashAlgorithm, e);
        }
    }

    private static void waitIfPaused(WorkerContext<?> context) throws IOException {
        try {
            if (!context.pausePoint()) {
                throw new InterruptedIOException("Copia interrompida (STOP)");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Copia interrompida");
        }
    }
}
