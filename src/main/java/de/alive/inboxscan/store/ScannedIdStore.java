package de.alive.inboxscan.store;

import de.alive.inboxscan.exception.PersistenceException;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Set;

/**
 * Set of message identifiers processed by earlier scans. Identifiers are only ever added.
 */
public interface ScannedIdStore {

    // Reads the persisted identifiers, replacing any in-memory state.
    @NotNull Set<String> load() throws PersistenceException;

    boolean contains(@NotNull String messageId);

    // Adds identifiers in memory; nothing is written until persist(Set).
    void merge(@NotNull Collection<String> messageIds);

    /**
     * Writes the union of what is already persisted, the in-memory set and {@code messageIds}.
     * A failed write leaves the previously persisted state untouched.
     */
    void persist(@NotNull Set<String> messageIds) throws PersistenceException;

    @NotNull Set<String> snapshot();
}
