package com.motaz.insight.engine.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.motaz.insight.engine.model.RawRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header-first CSV file. Every value is read as text; typing is the
 * normalizer's job. Lines whose column count does not match the header are
 * skipped with a warning.
 */
@Slf4j
public class CsvRecordSource implements RecordSource {

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private final String name;
    private final Path path;
    private final Clock clock;

    public CsvRecordSource(String name, Path path) {
        this(name, path, Clock.systemUTC());
    }

    public CsvRecordSource(String name, Path path, Clock clock) {
        this.name = name;
        this.path = path;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<RawRecord> read() {
        Instant ingestedAt = clock.instant();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<String[]> rows = MAPPER.readerFor(String[].class).readValues(reader)) {
            if (!rows.hasNext()) {
                throw new SourceReadException("CSV source " + name + " at " + path + " is empty");
            }
            String[] header = trimAll(rows.next());
            List<RawRecord> records = new ArrayList<>();
            int line = 1;
            int skipped = 0;
            while (rows.hasNext()) {
                String[] row = rows.next();
                line++;
                if (row.length != header.length) {
                    skipped++;
                    log.warn("stage=ingest record={}#{} action=skip_line reason=expected_{}_columns_got_{}",
                            name, line, header.length, row.length);
                    continue;
                }
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < header.length; i++) {
                    values.put(header[i], row[i]);
                }
                records.add(new RawRecord(name, line - 1, ingestedAt, values));
            }
            log.info("Read {} records from {} ({} malformed lines skipped)", records.size(), path, skipped);
            return records;
        } catch (SourceReadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new SourceReadException("Failed to read CSV source " + name + " at " + path, e);
        }
    }

    private static String[] trimAll(String[] values) {
        String[] trimmed = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            trimmed[i] = values[i].trim();
        }
        return trimmed;
    }
}
