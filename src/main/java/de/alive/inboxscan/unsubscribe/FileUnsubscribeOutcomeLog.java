package de.alive.inboxscan.unsubscribe;

import de.alive.inboxscan.domain.UnsubscribeOutcome;
import de.alive.inboxscan.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one line per attempt: {@code timestamp | domain | token | result | detail}. Each line is
 * written and flushed as soon as the attempt finishes.
 */
@Slf4j
public class FileUnsubscribeOutcomeLog implements UnsubscribeOutcomeLog {

    static final String SEPARATOR = " | ";

    private final Path file;
    private final List<UnsubscribeOutcome> entries = new ArrayList<>();

    public FileUnsubscribeOutcomeLog(@NotNull Path file) {
        this.file = file;
    }

    @Override
    public synchronized void append(@NotNull UnsubscribeOutcome outcome) {
        String line = format(outcome) + System.lineSeparator();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new PersistenceException("Cannot append to outcome log: " + e.getMessage(), file,
                    PersistenceException.Operation.WRITE_OUTCOME_LOG, e);
        }
        entries.add(outcome);
    }

    @NotNull
    @Override
    public synchronized List<UnsubscribeOutcome> entries() {
        return List.copyOf(entries);
    }

    static String format(UnsubscribeOutcome outcome) {
        return String.join(SEPARATOR,
                DateTimeFormatter.ISO_INSTANT.format(outcome.attemptedAt()),
                outcome.domain(),
                outcome.token(),
                outcome.result().name(),
                outcome.detail().replace('\n', ' ').replace('\r', ' '));
    }
}
