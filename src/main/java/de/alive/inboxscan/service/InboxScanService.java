package de.alive.inboxscan.service;

import de.alive.inboxscan.classification.MessageClassifier;
import de.alive.inboxscan.domain.Classification;
import de.alive.inboxscan.domain.DecodeResult;
import de.alive.inboxscan.domain.NormalizedMessage;
import de.alive.inboxscan.domain.RawMessage;
import de.alive.inboxscan.domain.ScanResult;
import de.alive.inboxscan.domain.ScanStatistics;
import de.alive.inboxscan.exception.MailConnectionException;
import de.alive.inboxscan.infrastructure.MailboxSource;
import de.alive.inboxscan.infrastructure.MessageDecoder;
import de.alive.inboxscan.service.config.ScanConfiguration;
import de.alive.inboxscan.store.ScannedIdStore;
import de.alive.inboxscan.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Sequential scan pipeline: fetch, decode, classify, skip already scanned ids, aggregate.
 * The scan itself writes nothing; {@link #commit(ScanResult)} records the processed ids once
 * the caller has handled the result.
 */
@Slf4j
public class InboxScanService {

    private final MailboxSource mailbox;
    private final MessageDecoder decoder;
    private final MessageClassifier classifier;
    private final ScannedIdStore scannedIdStore;
    private final ScanConfiguration configuration;
    private final Clock clock;

    public InboxScanService(@NotNull MailboxSource mailbox,
                            @NotNull ScannedIdStore scannedIdStore,
                            @NotNull ScanConfiguration configuration) {
        this(mailbox, new MessageDecoder(), new MessageClassifier(configuration), scannedIdStore, configuration,
                Clock.systemDefaultZone());
    }

    public InboxScanService(@NotNull MailboxSource mailbox,
                            @NotNull MessageDecoder decoder,
                            @NotNull MessageClassifier classifier,
                            @NotNull ScannedIdStore scannedIdStore,
                            @NotNull ScanConfiguration configuration,
                            @NotNull Clock clock) {
        this.mailbox = mailbox;
        this.decoder = decoder;
        this.classifier = classifier;
        this.scannedIdStore = scannedIdStore;
        this.configuration = configuration;
        this.clock = clock;
    }

    @NotNull
    public Mono<ScanResult> scan() {
        return Mono.fromCallable(this::prepare)
                .flatMap(run -> Flux.fromIterable(run.uids)
                        .concatMap(uid -> Mono.fromCallable(() -> mailbox.fetch(uid)).flatMap(Mono::justOrEmpty))
                        .doOnNext(raw -> process(run, raw))
                        .then(Mono.fromCallable(() -> finish(run))))
                .doOnError(error -> log.error("{} Scan aborted, no message ids were marked as scanned: {}",
                        LogUtils.ERROR_EMOJI, error.getMessage()));
    }

    // Marks the ids processed by result as scanned
    public void commit(@NotNull ScanResult result) {
        scannedIdStore.persist(result.newlyScannedIds());
        log.info("{} Marked {} new message ids as scanned", LogUtils.SAVE_EMOJI, result.newlyScannedIds().size());
    }

    private ScanRun prepare() throws MailConnectionException {
        scannedIdStore.load();
        LocalDate since = LocalDate.now(clock).minusMonths(configuration.getLookbackMonths());

        // a UID listed twice must only be processed once
        Set<Long> uids = new LinkedHashSet<>(mailbox.listCandidateUids(since));
        log.info("{} Scanning {} messages since {}", LogUtils.ROCKET_EMOJI, uids.size(), since);
        return new ScanRun(new ArrayList<>(uids));
    }

    private void process(ScanRun run, RawMessage raw) {
        run.statistics.incrementProgress();
        try {
            // Decode
            DecodeResult decoded = decoder.decode(raw);
            if (!decoded.isOk()) {
                run.statistics.recordDecodeError();
                log.warn("{} Skipping message {}: {}", LogUtils.WARNING_EMOJI, raw.uid(), decoded.failureReason());
                return;
            }

            // Skip ids from earlier runs and duplicates within this one
            NormalizedMessage message = decoded.message();
            String messageId = message.getMessageId();
            if (scannedIdStore.contains(messageId) || !run.processedIds.add(messageId)) {
                run.statistics.recordAlreadyScanned();
                return;
            }

            // Classify and aggregate
            Classification classification = classifier.classify(message);
            run.aggregator.accept(message, classification);
            run.statistics.recordProcessed();
            if (classification.personalized()) {
                run.statistics.recordPersonalized();
                log.info("{} Personalized message from {}", LogUtils.EMAIL_EMOJI,
                        LogUtils.maskEmail(message.getSenderAddress()));
            }
        } finally {
            if (run.statistics.currentProgress() % configuration.getProgressReportInterval() == 0) {
                log.info("{} Progress: {}", LogUtils.CHART_EMOJI, run.statistics.formattedProgress());
            }
        }
    }

    private ScanResult finish(ScanRun run) {
        log.info("{} Scan finished: {} in {}", LogUtils.SUCCESS_EMOJI, run.statistics.summary(),
                LogUtils.formatDurationMs(run.statistics.startTimeMs()));
        return new ScanResult(run.aggregator.snapshot(), run.aggregator.personalizedRecords(),
                run.processedIds, run.statistics);
    }

    private static final class ScanRun {
        private final List<Long> uids;
        private final Set<String> processedIds = new LinkedHashSet<>();
        private final DomainAggregator aggregator = new DomainAggregator();
        private final ScanStatistics statistics;

        private ScanRun(List<Long> uids) {
            this.uids = uids;
            this.statistics = new ScanStatistics(uids.size());
        }
    }
}
