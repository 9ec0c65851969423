package de.alive.inboxscan.service;

import de.alive.inboxscan.MessageFixtures;
import de.alive.inboxscan.domain.CategoryTag;
import de.alive.inboxscan.domain.Classification;
import de.alive.inboxscan.domain.DomainRecord;
import de.alive.inboxscan.domain.NormalizedMessage;
import de.alive.inboxscan.domain.UnsubscribeInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DomainAggregatorTest {

    private static final Classification FINANCE = new Classification(Set.of(CategoryTag.FINANCE), false, null);

    private DomainAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new DomainAggregator();
    }

    @Test
    void accept_TwoSendersSameDomain_OneRecord() {
        // given
        NormalizedMessage alerts = MessageFixtures.message("alerts@bank.com", "Statement", "");
        NormalizedMessage promo = MessageFixtures.message("promo@bank.com", "Offer", "");

        // when
        aggregator.accept(alerts, FINANCE);
        aggregator.accept(alerts, FINANCE);
        aggregator.accept(promo, FINANCE);

        // then
        DomainRecord record = aggregator.find("bank.com").orElseThrow();
        assertEquals(3, record.getTotalEmails());
        assertEquals(2, record.getUniqueSenders().size());
        assertEquals(List.of("alerts@bank.com", "promo@bank.com"), record.getSenderList());
        assertTrue(record.isReportable());
        assertEquals(1, aggregator.domainCount());
    }

    @Test
    void accept_ManyMessages_TotalMatchesCount() {
        for (int i = 0; i < 25; i++) {
            aggregator.accept(MessageFixtures.message("user" + (i % 5) + "@shop.example", "", ""), FINANCE);
        }

        DomainRecord record = aggregator.find("shop.example").orElseThrow();
        assertEquals(25, record.getTotalEmails());
        assertEquals(5, record.getUniqueSenders().size());
    }

    @Test
    void accept_SingleMessage_NotReportable() {
        aggregator.accept(MessageFixtures.message("once@rare.example", "", ""), FINANCE);

        assertFalse(aggregator.find("rare.example").orElseThrow().isReportable());
    }

    @Test
    void accept_CategoriesAreUnioned() {
        aggregator.accept(MessageFixtures.message("a@mixed.example", "", ""), FINANCE);
        aggregator.accept(MessageFixtures.message("a@mixed.example", "", ""),
                new Classification(Set.of(CategoryTag.TRAVEL), false, null));

        assertEquals(Set.of(CategoryTag.FINANCE, CategoryTag.TRAVEL),
                aggregator.find("mixed.example").orElseThrow().getCategories());
    }

    @Test
    void accept_LatestUnsubscribeInfoWins() {
        // given
        UnsubscribeInfo first = new UnsubscribeInfo("https://news.example/unsub?t=one", "one", UnsubscribeInfo.Mechanism.HTTP);
        UnsubscribeInfo second = new UnsubscribeInfo("https://news.example/unsub?t=two", "two", UnsubscribeInfo.Mechanism.HTTP);
        Instant t1 = Instant.parse("2024-01-01T00:00:00Z");
        Instant t2 = Instant.parse("2024-02-01T00:00:00Z");
        Instant t3 = Instant.parse("2024-03-01T00:00:00Z");

        // when
        aggregator.accept(MessageFixtures.messageFrom("a@news.example").arrivalDate(t1).build(),
                new Classification(Set.of(), false, first));
        aggregator.accept(MessageFixtures.messageFrom("a@news.example").arrivalDate(t2).build(),
                new Classification(Set.of(), false, second));
        aggregator.accept(MessageFixtures.messageFrom("a@news.example").arrivalDate(t3).build(),
                new Classification(Set.of(), false, null));

        // then
        DomainRecord record = aggregator.find("news.example").orElseThrow();
        assertEquals("two", record.getUnsubscribe().map(UnsubscribeInfo::token).orElse(null));
        assertEquals(t2, record.getLastUpdated());
    }

    @Test
    void accept_PersonalizedMessage_RecordedWithHeaders() {
        NormalizedMessage message = MessageFixtures.messageFrom("tom@friends.example")
                .senderName("Tom")
                .rawHeaderBlock("From: Tom <tom@friends.example>\nSubject: Hi")
                .build();

        aggregator.accept(message, new Classification(Set.of(), true, null));

        assertEquals(1, aggregator.personalizedRecords().size());
        assertEquals("Tom", aggregator.personalizedRecords().get(0).senderName());
        assertEquals("tom@friends.example", aggregator.personalizedRecords().get(0).senderAddress());
    }

    @Test
    void snapshot_ReturnsFrozenCopies() {
        NormalizedMessage message = MessageFixtures.message("a@bank.com", "", "");
        aggregator.accept(message, FINANCE);

        DomainRecord snapshot = aggregator.snapshot().get(0);

        assertTrue(snapshot.isFrozen());
        assertThrows(IllegalStateException.class, () -> snapshot.fold(message, FINANCE));
        aggregator.accept(message, FINANCE);
        assertEquals(1, snapshot.getTotalEmails());
    }

    @Test
    void fold_MessageFromOtherDomain_IsRejected() {
        DomainRecord record = DomainRecord.seed(MessageFixtures.message("a@bank.com", "", ""), FINANCE);

        assertThrows(IllegalArgumentException.class,
                () -> record.fold(MessageFixtures.message("a@other.com", "", ""), FINANCE));
    }
}
