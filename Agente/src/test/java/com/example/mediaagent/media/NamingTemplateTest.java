package com.example.mediaagent.media;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NamingTemplateTest {

    private static final Instant SHOT = Instant.parse("2024-03-09T14:30:00Z");

    private static NamingTemplate.Context context(String fileName) {
        return new NamingTemplate.Context(SHOT, ZoneOffset.UTC, fileName, 7, 2, "Casamento", "EOS R6");
    }

    @Test
    void rendersSubfolderByDate() {
        NamingTemplate t = NamingTemplate.subfolder("{date:yyyy}/{date:yyyyMMdd}");
        assertEquals("2024/20240309", t.render(context("IMG_0001.CR3")));
    }

    @Test
    void rendersFileNameWithSequenceAndJobCode() {
        NamingTemplate t = NamingTemplate.fileName("{jobcode}-{seq}-{today}_{name}{ext}");
        assertEquals("Casamento-0007-2_IMG_0001.cr3", t.render(context("IMG_0001.CR3")));
        assertTrue(t.usesJobCode());
        assertTrue(t.usesSequence());
    }

    @Test
    void fileNameCannotCreateFolders() {
        NamingTemplate t = NamingTemplate.fileName("{device}/{name}{ext}");
        assertEquals("EOS R6_a.jpg", t.render(new NamingTemplate.Context(SHOT, ZoneOffset.UTC, "a.jpg", 1, 1, "", "EOS R6")));
    }

    @Test
    void subfolderCannotEscapeDownloadFolder() {
        NamingTemplate t = NamingTemplate.subfolder("/{jobcode}/x");
        String out = t.render(new NamingTemplate.Context(SHOT, ZoneOffset.UTC, "a.jpg", 1, 1, "..", ""));
        assertFalse(out.startsWith("/"));
        assertFalse(out.contains(".."));
    }

    @Test
    void reportsUnknownTokensAndBadPatterns() {
        assertEquals(1, NamingTemplate.fileName("{bogus}{ext}").problems().size());
        assertEquals(1, NamingTemplate.subfolder("{date:bb}").problems().size());
        assertEquals(1, NamingTemplate.fileName(" ").problems().size());
        assertTrue(NamingTemplate.fileName("{name}{ext}").problems().isEmpty());
        assertFalse(NamingTemplate.fileName("{name}{ext}").usesJobCode());
    }
}
