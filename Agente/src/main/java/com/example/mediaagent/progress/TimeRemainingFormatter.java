package com.example.mediaagent.progress;

import java.util.Locale;

/**
 * Converte segundos restantes em texto aproximado.
 */
public final class TimeRemainingFormatter {

    private TimeRemainingFormatter() {}

    public static String format(long seconds) {
        if (seconds <= 0) {
            return "";
        }
        if (seconds == 1) {
            return "Cerca de 1 segundo restante";
        }
        if (seconds < 60) {
            return "Cerca de " + seconds + " segundos restantes";
        }
        if (seconds == 60) {
            return "Cerca de 1 minuto restante";
        }
        return String.format(Locale.ROOT, "Cerca de %d:%02d minutos restantes", seconds / 60, seconds % 60);
    }
}
