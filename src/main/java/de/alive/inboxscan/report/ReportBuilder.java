package de.alive.inboxscan.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import de.alive.inboxscan.domain.CategoryTag;
import de.alive.inboxscan.domain.DomainRecord;
import de.alive.inboxscan.domain.PersonalizedRecord;
import de.alive.inboxscan.domain.UnsubscribeInfo;
import de.alive.inboxscan.exception.PersistenceException;
import de.alive.inboxscan.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders scan results into the personalized-senders, domain-analysis and unsubscribe-selection CSV tables.
 */
@Slf4j
public class ReportBuilder {

    public static final String LIST_DELIMITER = "; ";
    public static final DateTimeFormatter LAST_UPDATED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
    public static final DateTimeFormatter FILE_TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private static final Comparator<DomainRecord> REPORT_ORDER = Comparator
            .comparingInt(DomainRecord::getTotalEmails).reversed()
            .thenComparing(DomainRecord::getDomain);

    // quote only values that contain a separator, quote or line break
    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    @NotNull
    public String renderPersonalizedReport(@NotNull List<PersonalizedRecord> records) {
        List<PersonalizedRow> rows = records.stream()
                .map(r -> new PersonalizedRow(r.senderName(), r.senderAddress(), r.rawHeaderBlock()))
                .toList();
        return render(rows, PersonalizedRow.class);
    }

    @NotNull
    public String renderDomainReport(@NotNull List<DomainRecord> records) {
        return render(reportable(records).stream().map(ReportBuilder::toDomainRow).toList(), DomainRow.class);
    }

    @NotNull
    public String renderSelectionTemplate(@NotNull List<DomainRecord> records) {
        List<SelectionRow> rows = reportable(records).stream()
                .map(record -> SelectionRow.of(toDomainRow(record), record.getUnsubscribe()
                        .map(UnsubscribeInfo::isAutomatable)
                        .orElse(false)))
                .toList();
        return render(rows, SelectionRow.class);
    }

    public Path writePersonalizedReport(@NotNull List<PersonalizedRecord> records, @NotNull Path directory,
                                        @NotNull Instant timestamp) {
        return write(directory.resolve("personalized_senders_" + FILE_TIMESTAMP_FORMAT.format(timestamp) + ".csv"),
                renderPersonalizedReport(records));
    }

    public Path writeDomainReport(@NotNull List<DomainRecord> records, @NotNull Path directory,
                                  @NotNull Instant timestamp) {
        return write(directory.resolve("domain_analysis_" + FILE_TIMESTAMP_FORMAT.format(timestamp) + ".csv"),
                renderDomainReport(records));
    }

    public Path writeSelectionTemplate(@NotNull List<DomainRecord> records, @NotNull Path directory,
                                       @NotNull Instant timestamp) {
        return write(directory.resolve("unsubscribe_selection_" + FILE_TIMESTAMP_FORMAT.format(timestamp) + ".csv"),
                renderSelectionTemplate(records));
    }

    static List<DomainRecord> reportable(List<DomainRecord> records) {
        return records.stream()
                .filter(DomainRecord::isReportable)
                .sorted(REPORT_ORDER)
                .toList();
    }

    static String joinCategories(DomainRecord record) {
        return record.getCategories().stream()
                .sorted()
                .map(CategoryTag::getDisplayName)
                .collect(Collectors.joining(LIST_DELIMITER));
    }

    private static DomainRow toDomainRow(DomainRecord record) {
        return new DomainRow(
                record.getDomain(),
                joinCategories(record),
                record.getUniqueSenders().size(),
                record.getTotalEmails(),
                String.join(LIST_DELIMITER, record.getSenderList()),
                record.getUnsubscribe().map(UnsubscribeInfo::url).orElse(""),
                record.getUnsubscribe().map(UnsubscribeInfo::token).orElse(""),
                LAST_UPDATED_FORMAT.format(record.getLastUpdated())
        );
    }

    private <T> String render(List<T> rows, Class<T> rowType) {
        CsvSchema schema = mapper.schemaFor(rowType).withHeader();
        if (rows.isEmpty()) {
            return headerLine(schema);
        }
        try {
            return mapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render " + rowType.getSimpleName() + " rows", e);
        }
    }

    private static String headerLine(CsvSchema schema) {
        List<String> names = new ArrayList<>();
        for (CsvSchema.Column column : schema) {
            names.add(column.getName());
        }
        return String.join(String.valueOf(schema.getColumnSeparator()), names) + new String(schema.getLineSeparator());
    }

    private Path write(Path file, String content) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
            log.info("{} Report written to {}", LogUtils.SAVE_EMOJI, file);
            return file;
        } catch (IOException e) {
            throw new PersistenceException("Cannot write report: " + e.getMessage(), file,
                    PersistenceException.Operation.WRITE_REPORT, e);
        }
    }

    @JsonPropertyOrder({"Sender Name", "Email Address", "Full Header"})
    record PersonalizedRow(
            @JsonProperty("Sender Name") String senderName,
            @JsonProperty("Email Address") String emailAddress,
            @JsonProperty("Full Header") String fullHeader) {
    }

    @JsonPropertyOrder({"Domain", "Categories", "Unique Senders", "Total Emails", "Sender List",
            "Unsubscribe URL", "Token", "Last Updated"})
    record DomainRow(
            @JsonProperty("Domain") String domain,
            @JsonProperty("Categories") String categories,
            @JsonProperty("Unique Senders") int uniqueSenders,
            @JsonProperty("Total Emails") int totalEmails,
            @JsonProperty("Sender List") String senderList,
            @JsonProperty("Unsubscribe URL") String unsubscribeUrl,
            @JsonProperty("Token") String token,
            @JsonProperty("Last Updated") String lastUpdated) {
    }

    @JsonPropertyOrder({"Domain", "Categories", "Unique Senders", "Total Emails", "Sender List",
            "Unsubscribe URL", "Token", "Last Updated", "Delete", "List-Unsubscribe"})
    record SelectionRow(
            @JsonProperty("Domain") String domain,
            @JsonProperty("Categories") String categories,
            @JsonProperty("Unique Senders") int uniqueSenders,
            @JsonProperty("Total Emails") int totalEmails,
            @JsonProperty("Sender List") String senderList,
            @JsonProperty("Unsubscribe URL") String unsubscribeUrl,
            @JsonProperty("Token") String token,
            @JsonProperty("Last Updated") String lastUpdated,
            @JsonProperty("Delete") String delete,
            @JsonProperty("List-Unsubscribe") String listUnsubscribe) {

        static SelectionRow of(DomainRow row, boolean automatable) {
            return new SelectionRow(row.domain(), row.categories(), row.uniqueSenders(), row.totalEmails(),
                    row.senderList(), row.unsubscribeUrl(), row.token(), row.lastUpdated(),
                    "no", automatable ? "yes" : "no");
        }
    }
}
