package com.example.mediaagent.media;

import java.util.Objects;
import java.util.Optional;

/**
 * Arquivo rastreado pelo pipeline. Mutável, pertence à {@link MediaFileCollection}
 * e só é alterado na thread do orquestrador.
 */
public final class MediaFile {
    private final MediaFileData data;
    private FileStatus status = FileStatus.DISCOVERED;
    private ProblemDetail problem;
    private String tempPath;
    private String downloadPath;
    private int downloadCount;
    private boolean backupProblem;

    public MediaFile(MediaFileData data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    public MediaFileData data() { return data; }
    public String uniqueId() { return data.uniqueId(); }
    public int deviceId() { return data.deviceId(); }
    public FileType fileType() { return data.fileType(); }
    public long size() { return data.size(); }
    public String name() { return data.name(); }

    public FileStatus status() {
        return status;
    }

    public void setStatus(FileStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public Optional<ProblemDetail> problem() {
        return Optional.ofNullable(problem);
    }

    public void setProblem(ProblemDetail problem) {
        this.problem = problem;
    }

    public Optional<String> tempPath() {
        return Optional.ofNullable(tempPath);
    }

    public void setTempPath(String tempPath) {
        this.tempPath = tempPath;
    }

    public Optional<String> downloadPath() {
        return Optional.ofNullable(downloadPath);
    }

    public void setDownloadPath(String downloadPath) {
        this.downloadPath = downloadPath;
    }

    public int downloadCount() {
        return downloadCount;
    }

    public void setDownloadCount(int downloadCount) {
        this.downloadCount = downloadCount;
    }

    public boolean backupProblem() {
        return backupProblem;
    }

    public void setBackupProblem(boolean backupProblem) {
        this.backupProblem = backupProblem;
    }

    /**
     * Status final do arquivo combinando o resultado de download com o de backup.
     */
    public FileStatus finalStatus(boolean downloadSucceeded) {
        if (!downloadSucceeded) {
            return backupProblem ? FileStatus.DOWNLOAD_AND_BACKUP_FAILED : FileStatus.DOWNLOAD_FAILED;
        }
        if (backupProblem) {
            return FileStatus.BACKUP_PROBLEM;
        }
        return problem != null ? FileStatus.DOWNLOADED_WITH_WARNING : FileStatus.DOWNLOADED;
    }
}
