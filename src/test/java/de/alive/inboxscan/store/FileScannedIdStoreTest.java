package de.alive.inboxscan.store;

import de.alive.inboxscan.exception.PersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileScannedIdStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void load_MissingFile_ReturnsEmptySet() {
        FileScannedIdStore store = new FileScannedIdStore(tempDir.resolve("previously_scanned.txt"));

        assertTrue(store.load().isEmpty());
        assertFalse(store.contains("<a@x>"));
    }

    @Test
    void persist_ThenLoadInNewInstance_ContainsIds() {
        // given
        Path file = tempDir.resolve("previously_scanned.txt");
        FileScannedIdStore store = new FileScannedIdStore(file);
        store.load();

        // when
        store.persist(Set.of("<b@x>", "<a@x>"));

        // then
        FileScannedIdStore reloaded = new FileScannedIdStore(file);
        assertEquals(Set.of("<a@x>", "<b@x>"), reloaded.load());
        assertTrue(reloaded.contains("<a@x>"));
    }

    @Test
    void persist_WithoutPriorLoad_KeepsIdsAlreadyOnDisk() throws IOException {
        // given
        Path file = tempDir.resolve("previously_scanned.txt");
        Files.write(file, List.of("<old-1@x>", "", "  <old-2@x>  "), StandardCharsets.UTF_8);
        FileScannedIdStore store = new FileScannedIdStore(file);

        // when
        store.persist(Set.of("<new@x>"));

        // then
        assertEquals(List.of("<new@x>", "<old-1@x>", "<old-2@x>"), Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    @Test
    void persist_Repeatedly_NeverShrinks() {
        // given
        Path file = tempDir.resolve("previously_scanned.txt");
        FileScannedIdStore first = new FileScannedIdStore(file);
        first.persist(Set.of("<a@x>", "<b@x>"));

        // when
        FileScannedIdStore second = new FileScannedIdStore(file);
        second.persist(Set.of("<c@x>"));
        second.persist(Set.of());

        // then
        assertEquals(Set.of("<a@x>", "<b@x>", "<c@x>"), new FileScannedIdStore(file).load());
    }

    @Test
    void persist_LeavesNoTemporaryFiles() throws IOException {
        // given
        FileScannedIdStore store = new FileScannedIdStore(tempDir.resolve("previously_scanned.txt"));

        // when
        store.persist(Set.of("<a@x>"));

        // then
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(tempDir.resolve("previously_scanned.txt")), files.toList());
        }
    }

    @Test
    void persist_UnwritableLocation_ThrowsPersistenceException() throws IOException {
        // given
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        FileScannedIdStore store = new FileScannedIdStore(blocker.resolve("previously_scanned.txt"));

        // when
        PersistenceException exception = assertThrows(PersistenceException.class,
                () -> store.persist(Set.of("<a@x>")));

        // then
        assertEquals(PersistenceException.Operation.PERSIST_SCANNED_IDS, exception.getOperation());
        assertEquals("", Files.readString(blocker));
    }

    @Test
    void merge_BlankIds_AreIgnored() {
        FileScannedIdStore store = new FileScannedIdStore(tempDir.resolve("ids.txt"));

        store.merge(List.of(" <a@x> ", "", "  "));

        assertEquals(Set.of("<a@x>"), store.snapshot());
    }
}
