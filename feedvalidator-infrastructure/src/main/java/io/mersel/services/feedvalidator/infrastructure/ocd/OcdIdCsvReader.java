package io.mersel.services.feedvalidator.infrastructure.ocd;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads OCD-ID catalogue files: a CSV table with a header row, an {@code id} column and
 * usually a {@code name} column.
 */
@Component
public class OcdIdCsvReader {

    private static final String ID_COLUMN = "id";
    private static final String NAME_COLUMN = "name";

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Reads the catalogue into an ordered OCD-ID to name map.
     *
     * @throws IOException the file cannot be read, is not CSV, has no {@code id} column
     *                     or lists no identifier
     */
    public Map<String, String> read(Path file) throws IOException {
        List<Map<String, String>> rows;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            MappingIterator<Map<String, String>> iterator = csvMapper.readerForMapOf(String.class)
                    .with(CsvSchema.emptySchema().withHeader())
                    .readValues(reader);
            rows = iterator.readAll();
        }
        if (rows.isEmpty()) {
            throw new IOException("OCD-ID catalogue is empty: " + file);
        }
        if (!rows.get(0).containsKey(ID_COLUMN)) {
            throw new IOException("OCD-ID catalogue has no '" + ID_COLUMN + "' column: " + file);
        }

        Map<String, String> entries = new LinkedHashMap<>();
        for (Map<String, String> row : rows) {
            String id = row.get(ID_COLUMN);
            if (id == null || id.isBlank()) {
                continue;
            }
            String name = row.get(NAME_COLUMN);
            entries.putIfAbsent(id.trim(), name == null ? "" : name.trim());
        }
        if (entries.isEmpty()) {
            throw new IOException("OCD-ID catalogue lists no identifier: " + file);
        }
        return entries;
    }

    /**
     * Content check of a freshly downloaded catalogue.
     *
     * @return number of identifiers in the file
     * @throws IOException the file is empty or not a valid catalogue
     */
    public int verify(Path file) throws IOException {
        if (!Files.isRegularFile(file) || Files.size(file) == 0) {
            throw new IOException("Downloaded OCD-ID catalogue is empty");
        }
        return read(file).size();
    }
}
