package com.example.mediaagent.media;

import java.util.Map;

/**
 * Totais de um lote de download de um dispositivo, separados por tipo.
 */
public final class DownloadStats {
    private int photos;
    private int videos;
    private long photosSize;
    private long videosSize;

    public void add(MediaFile file) {
        if (file.fileType() == FileType.PHOTO) {
            photos++;
            photosSize += file.size();
        } else {
            videos++;
            videosSize += file.size();
        }
    }

    public int photos() { return photos; }
    public int videos() { return videos; }
    public long photosSize() { return photosSize; }
    public long videosSize() { return videosSize; }

    public int count(FileType type) {
        return type == FileType.PHOTO ? photos : videos;
    }

    public long size(FileType type) {
        return type == FileType.PHOTO ? photosSize : videosSize;
    }

    public int totalFiles() {
        return photos + videos;
    }

    public long totalSize() {
        return photosSize + videosSize;
    }

    /**
     * Bytes que serão enviados a backups, dado o número de destinos por tipo.
     */
    public long sizeToBackup(Map<FileType, Integer> destinationsPerType) {
        return photosSize * destinationsPerType.getOrDefault(FileType.PHOTO, 0)
                + videosSize * destinationsPerType.getOrDefault(FileType.VIDEO, 0);
    }
}
