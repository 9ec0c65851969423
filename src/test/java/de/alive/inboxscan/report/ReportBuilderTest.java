package de.alive.inboxscan.report;

import de.alive.inboxscan.MessageFixtures;
import de.alive.inboxscan.domain.CategoryTag;
import de.alive.inboxscan.domain.Classification;
import de.alive.inboxscan.domain.DomainRecord;
import de.alive.inboxscan.domain.PersonalizedRecord;
import de.alive.inboxscan.domain.UnsubscribeInfo;
import de.alive.inboxscan.domain.UnsubscribeSelection;
import de.alive.inboxscan.exception.PersistenceException;
import de.alive.inboxscan.unsubscribe.SelectionReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReportBuilderTest {

    private static final String DOMAIN_HEADER =
            "Domain,Categories,Unique Senders,Total Emails,Sender List,Unsubscribe URL,Token,Last Updated";

    private ReportBuilder reportBuilder;
    private DomainRecord bank;
    private DomainRecord single;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        reportBuilder = new ReportBuilder();

        UnsubscribeInfo info = new UnsubscribeInfo("https://bank.com/unsub?t=abc", "abc", UnsubscribeInfo.Mechanism.HTTP);
        Classification finance = new Classification(Set.of(CategoryTag.FINANCE, CategoryTag.ACCOUNTS), false, info);
        bank = DomainRecord.seed(MessageFixtures.message("alerts@bank.com", "", ""), finance);
        bank.fold(MessageFixtures.message("promo@bank.com", "", ""), finance);
        bank.fold(MessageFixtures.message("alerts@bank.com", "", ""), finance);

        single = DomainRecord.seed(MessageFixtures.message("hello@once.example", "", ""),
                new Classification(Set.of(), false, null));
    }

    @Test
    void renderDomainReport_OnlyDomainsWithAtLeastTwoEmails() {
        // when
        String csv = reportBuilder.renderDomainReport(List.of(single, bank));

        // then
        assertEquals(DOMAIN_HEADER + "\n"
                        + "bank.com,Finance; Accounts,2,3,alerts@bank.com; promo@bank.com,"
                        + "https://bank.com/unsub?t=abc,abc,2024-03-01 10:15:30\n",
                csv);
    }

    @Test
    void renderDomainReport_SortedByTotalEmailsThenDomain() {
        // given
        Classification none = new Classification(Set.of(), false, null);
        DomainRecord alpha = DomainRecord.seed(MessageFixtures.message("a@alpha.example", "", ""), none);
        alpha.fold(MessageFixtures.message("a@alpha.example", "", ""), none);
        DomainRecord zulu = DomainRecord.seed(MessageFixtures.message("z@zulu.example", "", ""), none);
        zulu.fold(MessageFixtures.message("z@zulu.example", "", ""), none);

        // when
        String[] lines = reportBuilder.renderDomainReport(List.of(zulu, alpha, bank)).split("\n");

        // then
        assertEquals(4, lines.length);
        assertTrue(lines[1].startsWith("bank.com,"));
        assertTrue(lines[2].startsWith("alpha.example,"));
        assertTrue(lines[3].startsWith("zulu.example,"));
    }

    @Test
    void renderDomainReport_NoReportableDomains_HeaderOnly() {
        assertEquals(DOMAIN_HEADER + "\n", reportBuilder.renderDomainReport(List.of(single)));
    }

    @Test
    void renderPersonalizedReport_MultiLineHeaderIsQuoted() {
        // given
        PersonalizedRecord record = new PersonalizedRecord("Tom, Jr.", "tom@friends.example",
                "From: tom@friends.example\nSubject: Hi");

        // when
        String csv = reportBuilder.renderPersonalizedReport(List.of(record));

        // then
        assertEquals("Sender Name,Email Address,Full Header\n"
                + "\"Tom, Jr.\",tom@friends.example,\"From: tom@friends.example\nSubject: Hi\"\n", csv);
    }

    @Test
    void renderSelectionTemplate_DefaultsDeleteToNo() {
        // when
        String csv = reportBuilder.renderSelectionTemplate(List.of(bank));

        // then
        String[] lines = csv.split("\n");
        assertEquals(DOMAIN_HEADER + ",Delete,List-Unsubscribe", lines[0]);
        assertTrue(lines[1].endsWith(",no,yes"));
    }

    @Test
    void renderSelectionTemplate_MessagesWithoutSender_AreLeftOut() {
        // given
        Classification none = new Classification(Set.of(), false, null);
        DomainRecord anonymous = DomainRecord.seed(MessageFixtures.message("", "", ""), none);
        anonymous.fold(MessageFixtures.message("", "", ""), none);

        // when
        String csv = reportBuilder.renderSelectionTemplate(List.of(anonymous, bank));

        // then
        String[] lines = csv.split("\n");
        assertEquals(2, lines.length);
        assertTrue(lines[1].startsWith("bank.com,"));
    }

    @Test
    void renderSelectionTemplate_IsAcceptedBySelectionReader() throws Exception {
        // given
        Classification none = new Classification(Set.of(), false, null);
        DomainRecord anonymous = DomainRecord.seed(MessageFixtures.message("", "", ""), none);
        anonymous.fold(MessageFixtures.message("", "", ""), none);
        DomainRecord plain = DomainRecord.seed(MessageFixtures.message("a@plain.example", "", ""), none);
        plain.fold(MessageFixtures.message("b@plain.example", "", ""), none);

        // when
        String csv = reportBuilder.renderSelectionTemplate(List.of(anonymous, bank, plain));
        List<UnsubscribeSelection> selections = new SelectionReader().read(new StringReader(csv));

        // then
        assertEquals(2, selections.size());
        assertEquals("bank.com", selections.get(0).domain());
        assertEquals("abc", selections.get(0).token());
        assertTrue(selections.get(0).unsubscribeAvailable());
        assertFalse(selections.get(0).delete());
        assertEquals("plain.example", selections.get(1).domain());
        assertFalse(selections.get(1).unsubscribeAvailable());
    }

    @Test
    void writeDomainReport_WritesTimestampedFile() throws IOException {
        // when
        Path file = reportBuilder.writeDomainReport(List.of(bank), tempDir, Instant.parse("2024-05-06T07:08:09Z"));

        // then
        assertEquals(tempDir.resolve("domain_analysis_20240506_070809.csv"), file);
        assertTrue(Files.readString(file, StandardCharsets.UTF_8).startsWith(DOMAIN_HEADER));
    }

    @Test
    void writeReport_UnwritableDirectory_ThrowsPersistenceException() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));

        PersistenceException exception = assertThrows(PersistenceException.class,
                () -> reportBuilder.writePersonalizedReport(List.of(), blocker, Instant.EPOCH));

        assertEquals(PersistenceException.Operation.WRITE_REPORT, exception.getOperation());
    }
}
