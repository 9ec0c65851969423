package de.alive.inboxscan.unsubscribe;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import de.alive.inboxscan.domain.UnsubscribeSelection;
import de.alive.inboxscan.exception.InvalidSelectionException;
import de.alive.inboxscan.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the user-edited unsubscribe selection CSV. Any malformed row rejects the whole file.
 */
@Slf4j
public class SelectionReader {

    static final String DOMAIN = "Domain";
    static final String UNSUBSCRIBE_URL = "Unsubscribe URL";
    static final String TOKEN = "Token";
    static final String DELETE = "Delete";
    static final String LIST_UNSUBSCRIBE = "List-Unsubscribe";

    private static final List<String> REQUIRED_COLUMNS = List.of(DOMAIN, UNSUBSCRIBE_URL, TOKEN, DELETE, LIST_UNSUBSCRIBE);

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    @NotNull
    public List<UnsubscribeSelection> read(@NotNull Path file) throws InvalidSelectionException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<UnsubscribeSelection> selections = read(reader);
            log.info("Read {} selection rows from {}", selections.size(), file);
            return selections;
        } catch (IOException e) {
            throw new PersistenceException("Cannot read selection file: " + e.getMessage(), file,
                    PersistenceException.Operation.READ_SELECTION, e);
        }
    }

    @NotNull
    public List<UnsubscribeSelection> read(@NotNull Reader reader) throws InvalidSelectionException, IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<UnsubscribeSelection> selections = new ArrayList<>();

        try (MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(reader)) {

            CsvSchema header = null;
            int rowNumber = 0;
            while (true) {
                Map<String, String> row;
                try {
                    if (!rows.hasNextValue()) {
                        break;
                    }
                    row = rows.nextValue();
                } catch (IOException | RuntimeJsonMappingException e) {
                    throw new InvalidSelectionException("Malformed CSV: " + e.getMessage(), rowNumber + 1, e);
                }
                rowNumber++;

                if (header == null) {
                    header = (CsvSchema) rows.getParserSchema();
                    validateHeader(header);
                }
                selections.add(toSelection(row, rowNumber));
            }

            // header-only file
            if (header == null) {
                CsvSchema parsed = (CsvSchema) rows.getParserSchema();
                if (parsed != null && parsed.size() > 0) {
                    validateHeader(parsed);
                }
            }
        }
        return selections;
    }

    private void validateHeader(CsvSchema header) throws InvalidSelectionException {
        for (String column : REQUIRED_COLUMNS) {
            if (header == null || header.column(column) == null) {
                throw new InvalidSelectionException("Missing required column '" + column + "'", 0);
            }
        }
    }

    private UnsubscribeSelection toSelection(Map<String, String> row, int rowNumber) throws InvalidSelectionException {
        for (String column : REQUIRED_COLUMNS) {
            if (row.get(column) == null) {
                throw new InvalidSelectionException("Missing value for column '" + column + "'", rowNumber);
            }
        }

        String domain = row.get(DOMAIN).trim();
        boolean delete = UnsubscribeSelection.isAffirmative(row.get(DELETE));
        boolean available = UnsubscribeSelection.isAffirmative(row.get(LIST_UNSUBSCRIBE));

        // unselected rows are never acted on, so only selected ones must be complete
        if (delete && available) {
            if (domain.isEmpty()) {
                throw new InvalidSelectionException("Domain is empty", rowNumber);
            }
            if (row.get(TOKEN).isBlank()) {
                throw new InvalidSelectionException("Selected row for " + domain + " has no token", rowNumber);
            }
        }

        return new UnsubscribeSelection(rowNumber, domain, row.get(UNSUBSCRIBE_URL).trim(), row.get(TOKEN).trim(),
                delete, available);
    }
}
