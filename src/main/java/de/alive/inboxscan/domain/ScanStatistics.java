package de.alive.inboxscan.domain;

import de.alive.inboxscan.util.LogUtils;

import java.util.concurrent.atomic.AtomicInteger;

public class ScanStatistics {
    private final AtomicInteger currentProgress = new AtomicInteger(0);
    private final AtomicInteger processed = new AtomicInteger(0);
    private final AtomicInteger alreadyScanned = new AtomicInteger(0);
    private final AtomicInteger decodeErrors = new AtomicInteger(0);
    private final AtomicInteger personalized = new AtomicInteger(0);
    private final int candidates;
    private final long startTimeMs;

    public ScanStatistics(int candidates) throws IllegalArgumentException {
        if (candidates < 0)
            throw new IllegalArgumentException("Candidate count cannot be negative");
        this.candidates = candidates;
        this.startTimeMs = System.currentTimeMillis();
    }

    public String formattedProgress() {
        return LogUtils.formatProgress(currentProgress.get(), candidates, startTimeMs);
    }

    public void incrementProgress() {
        currentProgress.incrementAndGet();
    }

    public void recordProcessed() { processed.incrementAndGet(); }
    public void recordAlreadyScanned() { alreadyScanned.incrementAndGet(); }
    public void recordDecodeError() { decodeErrors.incrementAndGet(); }
    public void recordPersonalized() { personalized.incrementAndGet(); }

    public int currentProgress() { return currentProgress.get(); }
    public int candidates() { return candidates; }
    public int processed() { return processed.get(); }
    public int alreadyScanned() { return alreadyScanned.get(); }
    public int decodeErrors() { return decodeErrors.get(); }
    public int personalized() { return personalized.get(); }
    public long startTimeMs() { return startTimeMs; }

    public String summary() {
        return String.format("%d candidates, %d new, %d already scanned, %d decode errors, %d personalized",
                candidates, processed.get(), alreadyScanned.get(), decodeErrors.get(), personalized.get());
    }
}
