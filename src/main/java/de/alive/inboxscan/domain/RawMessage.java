package de.alive.inboxscan.domain;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Arrays;

public record RawMessage(long uid, @NotNull Instant arrivalDate, byte[] rawBytes) {

    public RawMessage {
        if (arrivalDate == null) {
            throw new IllegalArgumentException("Arrival date cannot be null");
        }
        rawBytes = rawBytes == null ? new byte[0] : rawBytes.clone();
    }

    @Override
    public byte[] rawBytes() {
        return rawBytes.clone();
    }

    public int size() {
        return rawBytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawMessage other)) return false;
        return uid == other.uid
                && arrivalDate.equals(other.arrivalDate)
                && Arrays.equals(rawBytes, other.rawBytes);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(uid) + arrivalDate.hashCode();
    }

    @Override
    public String toString() {
        return String.format("RawMessage{uid=%d, arrival=%s, size=%d}", uid, arrivalDate, rawBytes.length);
    }
}
