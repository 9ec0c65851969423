package de.alive.inboxscan.store;

import de.alive.inboxscan.exception.PersistenceException;
import de.alive.inboxscan.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

@Slf4j
public class FileScannedIdStore implements ScannedIdStore {

    private final Path file;
    private final Set<String> ids = new LinkedHashSet<>();

    public FileScannedIdStore(@NotNull Path file) {
        this.file = file;
    }

    @NotNull
    @Override
    public synchronized Set<String> load() throws PersistenceException {
        ids.clear();
        ids.addAll(readFile());
        log.info("{} Loaded {} previously scanned message ids from {}", LogUtils.SAVE_EMOJI, ids.size(), file);
        return Set.copyOf(ids);
    }

    @Override
    public synchronized boolean contains(@NotNull String messageId) {
        return ids.contains(messageId);
    }

    @Override
    public synchronized void merge(@NotNull Collection<String> messageIds) {
        messageIds.stream()
                .filter(id -> id != null && !id.isBlank())
                .map(String::trim)
                .forEach(ids::add);
    }

    @Override
    public synchronized void persist(@NotNull Set<String> messageIds) throws PersistenceException {
        merge(messageIds);

        // Another run may have written in the meantime
        Set<String> union = new TreeSet<>(readFile());
        union.addAll(ids);

        Path temp = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // Write next to the target so the move stays on one file system
            temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (String id : union) {
                    writer.write(id);
                    writer.newLine();
                }
            }
            moveIntoPlace(temp);
            log.info("{} Persisted {} scanned message ids to {}", LogUtils.SAVE_EMOJI, union.size(), file);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PersistenceException("Cannot persist scanned ids: " + e.getMessage(), file,
                    PersistenceException.Operation.PERSIST_SCANNED_IDS, e);
        }
    }

    @NotNull
    @Override
    public synchronized Set<String> snapshot() {
        return Set.copyOf(ids);
    }

    public Path getFile() {
        return file;
    }

    private Set<String> readFile() {
        if (!Files.exists(file)) {
            return Set.of();
        }
        try {
            Set<String> loaded = new LinkedHashSet<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String id = line.trim();
                if (!id.isEmpty()) {
                    loaded.add(id);
                }
            }
            return loaded;
        } catch (IOException e) {
            throw new PersistenceException("Cannot read scanned ids: " + e.getMessage(), file,
                    PersistenceException.Operation.LOAD_SCANNED_IDS, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("{} Could not remove temporary file {}: {}", LogUtils.WARNING_EMOJI, temp, e.getMessage());
        }
    }
}
