package com.example.mediaagent.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonPreferencesStoreTest {

    @TempDir
    Path tmp;

    @Test
    void persistsAcrossReopen() throws IOException {
        Path file = tmp.resolve("state/preferences.json");
        JsonPreferencesStore store = JsonPreferencesStore.open(file);
        LocalDate day = LocalDate.of(2024, 3, 9);

        store.setJobCodes(List.of("Casamento", "Formatura"));
        store.setRememberJobCode(false);
        store.updateSequences(42, day, 3);
        store.save();

        JsonPreferencesStore reopened = JsonPreferencesStore.open(file);
        assertEquals(List.of("Casamento", "Formatura"), reopened.jobCodes());
        assertFalse(reopened.rememberJobCode());
        assertEquals(42, reopened.storedSequenceNo());
        assertEquals(3, reopened.downloadsToday(day));
    }

    @Test
    void downloadsTodayResetsOnAnotherDay() {
        JsonPreferencesStore store = JsonPreferencesStore.open(tmp.resolve("p.json"));
        store.updateSequences(1, LocalDate.of(2024, 3, 9), 5);

        assertEquals(0, store.downloadsToday(LocalDate.of(2024, 3, 10)));
    }

    @Test
    void unreadableFileStartsEmpty() throws IOException {
        Path file = tmp.resolve("p.json");
        Files.writeString(file, "{ nao e json", StandardCharsets.UTF_8);

        JsonPreferencesStore store = JsonPreferencesStore.open(file);

        assertTrue(store.jobCodes().isEmpty());
        assertTrue(store.rememberJobCode());
        assertEquals(0, store.storedSequenceNo());
    }
}
