package de.alive.inboxscan.classification;

import de.alive.inboxscan.domain.CategoryTag;
import de.alive.inboxscan.domain.Classification;
import de.alive.inboxscan.domain.NormalizedMessage;
import de.alive.inboxscan.domain.UnsubscribeInfo;
import de.alive.inboxscan.service.config.ScanConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.util.Set;

@Slf4j
public class MessageClassifier {

    private final Taxonomy taxonomy;
    private final PersonalizationDetector personalizationDetector;
    private final UnsubscribeLinkExtractor linkExtractor;

    public MessageClassifier(@NotNull ScanConfiguration configuration) {
        this(configuration.getTaxonomy(),
                new PersonalizationDetector(configuration.getScannedName(), configuration.getNamePolicy()),
                new UnsubscribeLinkExtractor());
    }

    public MessageClassifier(@NotNull Taxonomy taxonomy,
                             @NotNull PersonalizationDetector personalizationDetector,
                             @NotNull UnsubscribeLinkExtractor linkExtractor) {
        this.taxonomy = taxonomy;
        this.personalizationDetector = personalizationDetector;
        this.linkExtractor = linkExtractor;
    }

    @NotNull
    public Classification classify(@NotNull NormalizedMessage message) {
        Set<CategoryTag> categories = taxonomy.categorize(message);
        boolean personalized = personalizationDetector.isPersonalized(message);
        UnsubscribeInfo unsubscribe = linkExtractor.extract(message).orElse(null);

        if (log.isDebugEnabled()) {
            log.debug("Classified {} from {}: categories={}, personalized={}, unsubscribe={}",
                    message.getMessageId(), message.getSenderDomain(), categories, personalized,
                    unsubscribe != null ? unsubscribe.mechanism() : "none");
        }
        return new Classification(categories, personalized, unsubscribe);
    }
}
