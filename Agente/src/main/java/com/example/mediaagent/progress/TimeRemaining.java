package com.example.mediaagent.progress;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.LongSupplier;

/**
 * Estimativa de tempo restante por dispositivo.
 *
 * Cada dispositivo acumula bytes transferidos; a taxa só é recalculada quando pelo menos
 * {@code minInterval} se passou desde a última amostra, para suavizar rajadas curtas.
 * O tempo restante global é o do dispositivo mais lento, já que os downloads correm em paralelo.
 *
 * Em pausa, bytes continuam sendo somados mas nenhuma taxa é calculada; ao retomar,
 * a marca de tempo de cada dispositivo é refeita para não contar o tempo parado.
 */
public final class TimeRemaining {

    private final Map<Integer, Entry> entries = new LinkedHashMap<>();
    private final long minIntervalNanos;
    private final LongSupplier nanoClock;
    private boolean paused;

    public TimeRemaining(Duration minInterval) {
        this(minInterval, System::nanoTime);
    }

    public TimeRemaining(Duration minInterval, LongSupplier nanoClock) {
        this.minIntervalNanos = Objects.requireNonNull(minInterval, "minInterval").toNanos();
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /**
     * Começa a estimar um dispositivo com {@code size} bytes a transferir.
     */
    public void add(int deviceId, long size) {
        Entry e = new Entry(size);
        e.timeMark = nanoClock.getAsLong();
        entries.put(deviceId, e);
    }

    public boolean contains(int deviceId) {
        return entries.containsKey(deviceId);
    }

    /**
     * Soma bytes transferidos (cópia ou backup) ao dispositivo.
     */
    public void update(int deviceId, long bytes) {
        Entry e = entries.get(deviceId);
        if (e == null || bytes <= 0) {
            return;
        }
        e.downloaded = Math.min(e.size, e.downloaded + bytes);
        if (paused) {
            return;
        }
        long now = nanoClock.getAsLong();
        long elapsed = now - e.timeMark;
        if (elapsed >= minIntervalNanos) {
            double seconds = elapsed / 1_000_000_000.0;
            e.rate = (e.downloaded - e.sizeMark) / seconds;
            e.timeMark = now;
            e.sizeMark = e.downloaded;
        }
    }

    /**
     * Desconta bytes que não serão transferidos (arquivo que falhou) sem afetar a taxa.
     */
    public void skip(int deviceId, long bytes) {
        Entry e = entries.get(deviceId);
        if (e == null || bytes <= 0) {
            return;
        }
        long credited = Math.min(e.size - e.downloaded, bytes);
        e.downloaded += credited;
        e.sizeMark += credited;
    }

    /**
     * Tempo restante em segundos, arredondado. Vazio quando ainda não há taxa medida.
     * Zero quando não há bytes pendentes.
     */
    public OptionalLong timeRemainingSeconds() {
        double worst = -1;
        boolean anyOutstanding = false;
        for (Entry e : entries.values()) {
            long outstanding = e.size - e.downloaded;
            if (outstanding <= 0) {
                continue;
            }
            anyOutstanding = true;
            if (e.rate > 0) {
                worst = Math.max(worst, outstanding / e.rate);
            }
        }
        if (!anyOutstanding) {
            return OptionalLong.of(0);
        }
        if (worst < 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Math.round(worst));
    }

    public void pause() {
        paused = true;
    }

    /** Retoma e refaz as marcas de tempo de todos os dispositivos. */
    public void resume() {
        paused = false;
        long now = nanoClock.getAsLong();
        for (Entry e : entries.values()) {
            e.timeMark = now;
            e.sizeMark = e.downloaded;
        }
    }

    public void remove(int deviceId) {
        entries.remove(deviceId);
    }

    public void clear() {
        entries.clear();
        paused = false;
    }

    private static final class Entry {
        final long size;
        long downloaded;
        long sizeMark;
        long timeMark;
        double rate;

        Entry(long size) {
            this.size = size;
        }
    }
}
