package de.alive.inboxscan.classification;

import de.alive.inboxscan.domain.CategoryTag;
import de.alive.inboxscan.domain.NormalizedMessage;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable mapping of category tags to match rules. Categories are evaluated in enum order.
 */
public final class Taxonomy {

    private final Map<CategoryTag, Set<MatchRule>> rules;

    private Taxonomy(Map<CategoryTag, Set<MatchRule>> rules) {
        EnumMap<CategoryTag, Set<MatchRule>> copy = new EnumMap<>(CategoryTag.class);
        rules.forEach((tag, tagRules) -> copy.put(tag, Collections.unmodifiableSet(new LinkedHashSet<>(tagRules))));
        this.rules = Collections.unmodifiableMap(copy);
    }

    public static Taxonomy defaultTaxonomy() {
        return builder()
                .keywords(CategoryTag.SOCIAL_MEDIA, "facebook", "twitter", "instagram", "linkedin", "tiktok",
                        "reddit", "snapchat", "pinterest")
                .keywords(CategoryTag.SHOPPING, "amazon", "ebay", "etsy", "shop", "walmart", "target", "bestbuy",
                        "aliexpress")
                .keywords(CategoryTag.FINANCE, "paypal", "stripe", "bank", "credit", "venmo", "cashapp", "coinbase",
                        "crypto")
                .rule(CategoryTag.FINANCE, MatchRule.inDomain("wise.com"))
                .keywords(CategoryTag.CLOUD_SERVICES, "google", "dropbox", "icloud", "onedrive", "protonmail", "mega.nz")
                .rule(CategoryTag.CLOUD_SERVICES, MatchRule.inDomain("box.com"))
                .keywords(CategoryTag.SUBSCRIPTION_SERVICES, "netflix", "spotify", "hulu", "disney", "prime",
                        "youtube", "paramount", "peacock", "apple")
                .keywords(CategoryTag.GAMING, "steam", "epicgames", "origin", "uplay", "playstation", "xbox",
                        "nintendo", "battle.net")
                .keywords(CategoryTag.PROFESSIONAL, "slack", "zoom", "teams", "asana", "jira", "trello", "github",
                        "gitlab")
                .keywords(CategoryTag.TRAVEL, "airbnb", "booking", "expedia", "uber", "lyft", "airline", "hotel")
                .rule(CategoryTag.ACCOUNTS, MatchRule.inSubject("account"))
                .rule(CategoryTag.ACCOUNTS, MatchRule.inSubject("subscription"))
                .rule(CategoryTag.ACCOUNTS, MatchRule.inSubject("login"))
                .rule(CategoryTag.ACCOUNTS, MatchRule.inSubject("welcome"))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<CategoryTag> categorize(@NotNull NormalizedMessage message) {
        EnumSet<CategoryTag> matched = EnumSet.noneOf(CategoryTag.class);
        rules.forEach((tag, tagRules) -> {
            for (MatchRule rule : tagRules) {
                if (rule.matches(message)) {
                    matched.add(tag);
                    break;
                }
            }
        });
        return matched;
    }

    public Set<MatchRule> rulesFor(CategoryTag tag) {
        return rules.getOrDefault(tag, Set.of());
    }

    public Set<CategoryTag> categories() {
        return rules.keySet();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        rules.forEach((tag, tagRules) -> tagRules.forEach(rule -> builder.rule(tag, rule)));
        return builder;
    }

    @Override
    public String toString() {
        return rules.entrySet().stream()
                .map(e -> e.getKey().getDisplayName() + "=" + e.getValue().size())
                .collect(Collectors.joining(", ", "Taxonomy{", "}"));
    }

    public static final class Builder {
        private final EnumMap<CategoryTag, Set<MatchRule>> rules = new EnumMap<>(CategoryTag.class);

        private Builder() {
        }

        public Builder rule(CategoryTag tag, MatchRule rule) {
            rules.computeIfAbsent(tag, t -> new LinkedHashSet<>()).add(rule);
            return this;
        }

        public Builder keywords(CategoryTag tag, String... keywords) {
            Arrays.stream(keywords).map(MatchRule::anywhere).forEach(rule -> rule(tag, rule));
            return this;
        }

        public Builder clear(CategoryTag tag) {
            rules.remove(tag);
            return this;
        }

        public Taxonomy build() {
            return new Taxonomy(rules);
        }
    }
}
