package de.alive.inboxscan.unsubscribe;

import de.alive.inboxscan.domain.UnsubscribeOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileUnsubscribeOutcomeLogTest {

    @TempDir
    Path tempDir;

    @Test
    void append_WritesOneLinePerOutcome() throws Exception {
        // given
        Path file = tempDir.resolve("logs").resolve("unsubscribe_log.txt");
        FileUnsubscribeOutcomeLog log = new FileUnsubscribeOutcomeLog(file);
        Instant at = Instant.parse("2024-03-01T10:15:30Z");

        // when
        log.append(new UnsubscribeOutcome("shopco.com", "abc123", at, UnsubscribeOutcome.Result.SUCCESS,
                "HTTP 200 after 1 attempt(s)", 1));
        log.append(new UnsubscribeOutcome("news.example", "t-9", at, UnsubscribeOutcome.Result.MANUAL_REQUIRED,
                "line one\nline two", 0));

        // then
        assertEquals(List.of(
                "2024-03-01T10:15:30Z | shopco.com | abc123 | SUCCESS | HTTP 200 after 1 attempt(s)",
                "2024-03-01T10:15:30Z | news.example | t-9 | MANUAL_REQUIRED | line one line two"
        ), Files.readAllLines(file, StandardCharsets.UTF_8));
        assertEquals(2, log.entries().size());
    }

    @Test
    void append_ExistingLog_IsExtendedNotReplaced() throws Exception {
        // given
        Path file = tempDir.resolve("unsubscribe_log.txt");
        Files.writeString(file, "earlier entry" + System.lineSeparator(), StandardCharsets.UTF_8);

        // when
        new FileUnsubscribeOutcomeLog(file).append(new UnsubscribeOutcome("a.com", "1", Instant.EPOCH,
                UnsubscribeOutcome.Result.FAILED, "HTTP 404 after 1 attempt(s)", 1));

        // then
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("earlier entry", lines.get(0));
        assertTrue(lines.get(1).endsWith("| FAILED | HTTP 404 after 1 attempt(s)"));
    }
}
