package com.example.mediaagent.device;

import com.example.mediaagent.media.FileType;
import java.util.EnumMap;
import java.util.Map;

/**
 * Contadores de arquivos descobertos (quantidade e bytes) por tipo.
 */
public final class FileTypeCounter {
    private final Map<FileType, Integer> counts = new EnumMap<>(FileType.class);
    private final Map<FileType, Long> sizes = new EnumMap<>(FileType.class);

    public void add(FileType type, long size) {
        counts.merge(type, 1, Integer::sum);
        sizes.merge(type, size, Long::sum);
    }

    public int count(FileType type) {
        return counts.getOrDefault(type, 0);
    }

    public long size(FileType type) {
        return sizes.getOrDefault(type, 0L);
    }

    public int total() {
        return count(FileType.PHOTO) + count(FileType.VIDEO);
    }

    public long totalSize() {
        return size(FileType.PHOTO) + size(FileType.VIDEO);
    }

    /**
     * Texto curto para a interface, ex.: "12 fotos e 2 videos".
     */
    public String summary() {
        int photos = count(FileType.PHOTO);
        int videos = count(FileType.VIDEO);
        String p = photos == 1 ? "1 foto" : photos + " fotos";
        String v = videos == 1 ? "1 video" : videos + " videos";
        if (photos > 0 && videos > 0) {
            return p + " e " + v;
        }
        if (videos > 0) {
            return v;
        }
        return p;
    }
}
