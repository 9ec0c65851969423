package de.alive.inboxscan.service.config;

import de.alive.inboxscan.classification.NamePolicy;
import de.alive.inboxscan.classification.Taxonomy;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Immutable settings threaded through the scanner, classifier and unsubscribe executor.
 */
@Data
@Builder(toBuilder = true)
public class ScanConfiguration {

    // Classification
    private final String scannedName;
    private final NamePolicy namePolicy;
    private final Taxonomy taxonomy;

    // Scan window
    private final int lookbackMonths;
    private final int unsubscribeLookbackDays;

    // Unsubscribe requests
    private final Duration requestTimeout;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    // Files
    private final Path outputDirectory;
    private final Path scannedIdsFile;
    private final Path outcomeLogFile;

    // Progress reporting
    private final int progressReportInterval;

    public static final int DEFAULT_LOOKBACK_MONTHS = 12;
    public static final int DEFAULT_UNSUBSCRIBE_LOOKBACK_DAYS = 30;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(15);
    public static final int DEFAULT_PROGRESS_REPORT_INTERVAL = 100;
    public static final String SCANNED_IDS_FILE_NAME = "previously_scanned.txt";
    public static final String OUTCOME_LOG_FILE_NAME = "unsubscribe_log.txt";

    public static ScanConfiguration forProduction(String scannedName, Path outputDirectory) {
        return ScanConfiguration.builder()
                .scannedName(scannedName)
                .namePolicy(NamePolicy.SUBSTRING)
                .taxonomy(Taxonomy.defaultTaxonomy())
                .lookbackMonths(DEFAULT_LOOKBACK_MONTHS)
                .unsubscribeLookbackDays(DEFAULT_UNSUBSCRIBE_LOOKBACK_DAYS)
                .requestTimeout(DEFAULT_REQUEST_TIMEOUT)
                .maxAttempts(DEFAULT_MAX_ATTEMPTS)
                .initialBackoff(DEFAULT_INITIAL_BACKOFF)
                .maxBackoff(DEFAULT_MAX_BACKOFF)
                .outputDirectory(outputDirectory)
                .scannedIdsFile(outputDirectory.resolve(SCANNED_IDS_FILE_NAME))
                .outcomeLogFile(outputDirectory.resolve(OUTCOME_LOG_FILE_NAME))
                .progressReportInterval(DEFAULT_PROGRESS_REPORT_INTERVAL)
                .build();
    }

    public static ScanConfiguration forTesting(String scannedName, Path outputDirectory) {
        return forProduction(scannedName, outputDirectory).toBuilder()
                .requestTimeout(Duration.ofSeconds(2))
                .initialBackoff(Duration.ofMillis(10))
                .maxBackoff(Duration.ofMillis(50))
                .progressReportInterval(10)
                .build();
    }

    public void validate() {
        if (scannedName == null || scannedName.isBlank()) {
            throw new IllegalArgumentException("Scanned name cannot be null or empty");
        }
        if (namePolicy == null) {
            throw new IllegalArgumentException("Name policy cannot be null");
        }
        if (taxonomy == null) {
            throw new IllegalArgumentException("Taxonomy cannot be null");
        }
        if (lookbackMonths <= 0) {
            throw new IllegalArgumentException("Lookback months must be positive");
        }
        if (unsubscribeLookbackDays <= 0) {
            throw new IllegalArgumentException("Unsubscribe lookback days must be positive");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("Max attempts must be positive");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("Initial backoff cannot be negative");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("Max backoff must not be below initial backoff");
        }
        if (outputDirectory == null || scannedIdsFile == null || outcomeLogFile == null) {
            throw new IllegalArgumentException("Output paths cannot be null");
        }
        if (progressReportInterval <= 0) {
            throw new IllegalArgumentException("Progress report interval must be positive");
        }
    }

    public String getConfigurationSummary() {
        return String.format(
                "Name policy: %s, Lookback: %d months, Unsubscribe lookback: %d days, Timeout: %ds, Attempts: %d, Output: %s",
                namePolicy, lookbackMonths, unsubscribeLookbackDays,
                requestTimeout.toSeconds(), maxAttempts, outputDirectory
        );
    }
}
