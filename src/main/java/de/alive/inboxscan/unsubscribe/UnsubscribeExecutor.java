package de.alive.inboxscan.unsubscribe;

import de.alive.inboxscan.domain.UnsubscribeInfo;
import de.alive.inboxscan.domain.UnsubscribeOutcome;
import de.alive.inboxscan.domain.UnsubscribeSelection;
import de.alive.inboxscan.domain.UnsubscribeState;
import de.alive.inboxscan.exception.MailConnectionException;
import de.alive.inboxscan.exception.UnsubscribeException;
import de.alive.inboxscan.service.config.ScanConfiguration;
import de.alive.inboxscan.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Works through the user's selection one row at a time. Each actionable row moves
 * {@code PENDING -> LOCATING -> EXECUTING} and ends in one terminal state, and every attempt is appended
 * to the outcome log before the next row starts.
 */
@Slf4j
public class UnsubscribeExecutor {

    private static final int MAX_LOGGED_URL = 120;

    private final UnsubscribeTokenLocator locator;
    private final UnsubscribeHttpClient httpClient;
    private final UnsubscribeOutcomeLog outcomeLog;
    private final ScanConfiguration config;
    private final Clock clock;

    private final Map<String, UnsubscribeState> states = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Set<String> succeededDomains = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public UnsubscribeExecutor(@NotNull UnsubscribeTokenLocator locator,
                               @NotNull UnsubscribeHttpClient httpClient,
                               @NotNull UnsubscribeOutcomeLog outcomeLog,
                               @NotNull ScanConfiguration config,
                               @NotNull Clock clock) {
        this.locator = locator;
        this.httpClient = httpClient;
        this.outcomeLog = outcomeLog;
        this.config = config;
        this.clock = clock;
    }

    public UnsubscribeExecutor(@NotNull UnsubscribeTokenLocator locator,
                               @NotNull UnsubscribeOutcomeLog outcomeLog,
                               @NotNull ScanConfiguration config) {
        this(locator, new UnsubscribeHttpClient(config.getRequestTimeout()), outcomeLog, config, Clock.systemUTC());
    }

    /**
     * Emits one outcome per attempted row. Rows that are not selected for both deletion and unsubscribe
     * produce nothing.
     */
    public Flux<UnsubscribeOutcome> execute(@NotNull List<UnsubscribeSelection> selections) {
        return Flux.fromIterable(selections)
                .filter(this::isSelected)
                .doOnNext(row -> states.putIfAbsent(row.domain(), UnsubscribeState.PENDING))
                .concatMap(row -> Mono.defer(() -> process(row)));
    }

    /**
     * Blocking variant for the command line entry point.
     */
    public List<UnsubscribeOutcome> run(@NotNull List<UnsubscribeSelection> selections) {
        log.info("{} Processing {} selection rows", LogUtils.ROCKET_EMOJI, selections.size());
        List<UnsubscribeOutcome> outcomes = execute(selections).collectList().block();
        List<UnsubscribeOutcome> result = outcomes != null ? outcomes : List.of();
        logSummary(result);
        return result;
    }

    /**
     * Stops issuing further requests. Outcomes already logged stay as they are; a request in flight
     * finishes but is not retried.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("{} Unsubscribe run cancelled, no further requests will be sent", LogUtils.STOP_EMOJI);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Optional<UnsubscribeState> getState(@NotNull String domain) {
        return Optional.ofNullable(states.get(domain));
    }

    public Map<String, UnsubscribeState> getStates() {
        synchronized (states) {
            return Map.copyOf(states);
        }
    }

    private boolean isSelected(UnsubscribeSelection row) {
        if (!row.isActionable()) {
            log.debug("Skipping row {} ({}): delete={}, unsubscribe available={}",
                    row.rowNumber(), row.domain(), row.delete(), row.unsubscribeAvailable());
            return false;
        }
        return true;
    }

    private Mono<UnsubscribeOutcome> process(UnsubscribeSelection row) {
        if (cancelled.get()) {
            log.debug("Not processing row {} ({}), run was cancelled", row.rowNumber(), row.domain());
            return Mono.empty();
        }
        if (succeededDomains.contains(row.domain())) {
            log.info("{} Already unsubscribed from {} in this run, skipping row {}",
                    LogUtils.SUCCESS_EMOJI, row.domain(), row.rowNumber());
            return Mono.empty();
        }

        // Locate
        Instant attemptedAt = clock.instant();
        states.put(row.domain(), UnsubscribeState.LOCATING);

        Optional<UnsubscribeInfo> located;
        try {
            located = locator.locate(row.domain(), row.token());
        } catch (MailConnectionException e) {
            log.error("{} Mailbox search failed for {}: {}", LogUtils.ERROR_EMOJI, row.domain(), e.getMessage());
            // later rows would hit the same broken session
            if (!e.isRecoverable()) {
                cancel();
            }
            return Mono.fromCallable(() -> record(row, attemptedAt, UnsubscribeOutcome.Result.FAILED,
                    "Mailbox search failed: " + e.getMessage(), 0));
        }

        if (located.isEmpty()) {
            log.warn("{} No message from the last {} days carries token for {}",
                    LogUtils.WARNING_EMOJI, config.getUnsubscribeLookbackDays(), row.domain());
            return Mono.fromCallable(() -> record(row, attemptedAt, UnsubscribeOutcome.Result.MANUAL_REQUIRED,
                    "No message within the last " + config.getUnsubscribeLookbackDays()
                            + " days carries this token", 0));
        }

        // Execute, mailto cannot be automated
        UnsubscribeInfo info = located.get();
        if (!info.isAutomatable()) {
            log.info("{} {} only offers a mailto unsubscribe: {}",
                    LogUtils.EMAIL_EMOJI, row.domain(), LogUtils.truncateText(info.url(), MAX_LOGGED_URL));
            return Mono.fromCallable(() -> record(row, attemptedAt, UnsubscribeOutcome.Result.MANUAL_REQUIRED,
                    "Unsubscribe by mail required: " + info.url(), 0));
        }

        states.put(row.domain(), UnsubscribeState.EXECUTING);
        log.info("{} Requesting unsubscribe for {}: {}",
                LogUtils.LINK_EMOJI, row.domain(), LogUtils.truncateText(info.url(), MAX_LOGGED_URL));
        return request(row, info, attemptedAt);
    }

    private Mono<UnsubscribeOutcome> request(UnsubscribeSelection row, UnsubscribeInfo info, Instant attemptedAt) {
        AtomicInteger attempts = new AtomicInteger();

        return Mono.fromCallable(() -> {
                    attempts.incrementAndGet();
                    return httpClient.get(info.url());
                })
                .retryWhen(Retry.backoff(Math.max(0, config.getMaxAttempts() - 1), config.getInitialBackoff())
                        .maxBackoff(config.getMaxBackoff())
                        .jitter(0.2)
                        .filter(this::shouldRetry)
                        .doBeforeRetry(signal -> log.warn("{} Retry {} for {}: {}",
                                LogUtils.PROCESS_EMOJI, signal.totalRetries() + 1, row.domain(), signal.failure().getMessage()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .map(status -> record(row, attemptedAt, UnsubscribeOutcome.Result.SUCCESS,
                        "HTTP " + status + " after " + attempts.get() + " attempt(s)", attempts.get()))
                .onErrorResume(UnsubscribeException.class, e -> Mono.fromCallable(() ->
                        record(row, attemptedAt, UnsubscribeOutcome.Result.FAILED,
                                e.getMessage() + " after " + attempts.get() + " attempt(s)", attempts.get())));
    }

    private boolean shouldRetry(Throwable error) {
        return !cancelled.get()
                && error instanceof UnsubscribeException
                && ((UnsubscribeException) error).isRetryable();
    }

    private UnsubscribeOutcome record(UnsubscribeSelection row, Instant attemptedAt,
                                      UnsubscribeOutcome.Result result, String detail, int attempts) {
        UnsubscribeOutcome outcome = new UnsubscribeOutcome(row.domain(), row.token(), attemptedAt, result, detail, attempts);
        outcomeLog.append(outcome);
        states.put(row.domain(), UnsubscribeState.of(result));
        if (outcome.isSuccess()) {
            succeededDomains.add(row.domain());
            log.info("{} Unsubscribed from {} ({})", LogUtils.SUCCESS_EMOJI, row.domain(), detail);
        } else {
            log.info("{} {} for {}: {}", result == UnsubscribeOutcome.Result.FAILED ? LogUtils.ERROR_EMOJI : LogUtils.WARNING_EMOJI,
                    result, row.domain(), detail);
        }
        return outcome;
    }

    private void logSummary(List<UnsubscribeOutcome> outcomes) {
        long success = outcomes.stream().filter(UnsubscribeOutcome::isSuccess).count();
        long manual = outcomes.stream().filter(o -> o.result() == UnsubscribeOutcome.Result.MANUAL_REQUIRED).count();
        long failed = outcomes.size() - success - manual;
        log.info("{} Unsubscribe run finished: {} succeeded, {} failed, {} need manual action{}",
                LogUtils.CHART_EMOJI, success, failed, manual, cancelled.get() ? " (cancelled)" : "");
    }
}
