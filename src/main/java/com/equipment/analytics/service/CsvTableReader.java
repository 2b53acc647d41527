package com.equipment.analytics.service;

import com.equipment.analytics.exception.MalformedInputException;
import com.equipment.analytics.model.RawTable;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads uploaded CSV bytes into a {@link RawTable}.
 *
 * Content is decoded as UTF-8 and falls back to ISO-8859-1 with a warning when
 * the bytes are not valid UTF-8. The first non-blank line is the header; every
 * following line becomes one row keyed by header cell, including blank lines so
 * that row numbers reported later match the file.
 *
 * Column validation is not done here; see {@link DatasetBuilder}.
 */
@Singleton
public class CsvTableReader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    static final String LATIN1_FALLBACK_WARNING = "File was not UTF-8 encoded, used latin-1 encoding.";

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Parses CSV content.
     *
     * @param content raw file bytes
     * @return header and rows in file order
     * @throws MalformedInputException if the content is empty or not valid CSV
     */
    public RawTable read(byte[] content) {
        if (content == null || content.length == 0) {
            throw new MalformedInputException("The uploaded file is empty.");
        }

        List<String> warnings = new ArrayList<>();
        String text = decode(content, warnings);
        if (text.isBlank()) {
            throw new MalformedInputException("The uploaded file is empty.");
        }

        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(text)) {
            while (it.hasNextValue()) {
                lines.add(it.nextValue());
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            log.warn("CSV parse failed after {} lines: {}", lines.size(), e.getMessage());
            throw new MalformedInputException("Failed to parse CSV: " + e.getMessage(), e);
        }

        int headerIndex = 0;
        while (headerIndex < lines.size() && isBlank(lines.get(headerIndex))) {
            headerIndex++;
        }
        if (headerIndex == lines.size()) {
            throw new MalformedInputException("The uploaded file has no header row.");
        }

        String[] header = lines.get(headerIndex);
        List<Map<String, ?>> rows = new ArrayList<>();
        for (int i = headerIndex + 1; i < lines.size(); i++) {
            rows.add(toRow(header, lines.get(i)));
        }

        log.info("Read CSV columns={} rows={} warnings={}", header.length, rows.size(), warnings.size());
        return new RawTable(Arrays.asList(header), rows, warnings);
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private static String decode(byte[] content, List<String> warnings) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            log.info("Content is not valid UTF-8, decoding as ISO-8859-1");
            warnings.add(LATIN1_FALLBACK_WARNING);
            text = new String(content, StandardCharsets.ISO_8859_1);
        }
        // BOM written by spreadsheet exports
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        return text;
    }

    private static Map<String, String> toRow(String[] header, String[] cells) {
        Map<String, String> row = new LinkedHashMap<>();
        int width = Math.min(header.length, cells.length);
        for (int i = 0; i < width; i++) {
            row.put(header[i], cells[i]);
        }
        return row;
    }

    private static boolean isBlank(String[] cells) {
        for (String cell : cells) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
