package com.delta.creatoringest.ingest.source;

import com.delta.creatoringest.config.IngestProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the ordered list of channel handles. Rows with a blank handle keep their position
 * because checkpoint offsets index into this list; fully empty lines are skipped.
 */
@Component
public class HandleListReader {
    private static final Logger log = LoggerFactory.getLogger(HandleListReader.class);

    private final IngestProperties properties;

    public HandleListReader(IngestProperties properties) {
        this.properties = properties;
    }

    public List<String> readHandles() {
        return readHandles(resolvePath(properties.getInput().getCsvPath()), properties.getInput().getHandleColumn());
    }

    public List<String> readHandles(Path csvPath, String preferredColumn) {
        if (!Files.isRegularFile(csvPath)) {
            throw new InputSourceException("Input list not found at " + csvPath);
        }
        List<CSVRecord> records;
        List<String> headers;
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            headers = parser.getHeaderNames();
            records = parser.getRecords();
        } catch (IOException | RuntimeException e) {
            throw new InputSourceException("Failed to read input list " + csvPath + ": " + rootMessage(e), e);
        }

        String column = findHandleColumn(headers, records, preferredColumn);
        if (column == null) {
            throw new InputSourceException("No @handle column found in " + csvPath);
        }

        List<String> handles = new ArrayList<>(records.size());
        for (CSVRecord record : records) {
            String value = record.isSet(column) ? record.get(column) : "";
            handles.add(value == null ? "" : value.trim());
        }
        log.info("Loaded {} handles from {} (column {})", handles.size(), csvPath, column);
        return handles;
    }

    private String findHandleColumn(List<String> headers, List<CSVRecord> records, String preferredColumn) {
        if (preferredColumn != null && !preferredColumn.isBlank()) {
            for (String header : headers) {
                if (header != null && header.trim().equalsIgnoreCase(preferredColumn.trim())) {
                    return header;
                }
            }
        }
        for (String header : headers) {
            if (header == null) {
                continue;
            }
            for (CSVRecord record : records) {
                if (record.isSet(header) && record.get(header).trim().startsWith("@")) {
                    log.info("Handle column '{}' not present, using '{}' which holds @handles", preferredColumn, header);
                    return header;
                }
            }
        }
        return null;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }

    private String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.toString() : current.getMessage();
    }
}
