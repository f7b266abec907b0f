package com.kmg.pageocr.service;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes schemaless CSV: each row is an array of cells, quoted only where a cell needs it.
 * Section titles are written as single-cell rows.
 */
@Component
public class CsvReportWriter {
    private static final String[] BLANK_ROW = {""};

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    public static String[] blankRow() {
        return BLANK_ROW.clone();
    }

    public void write(Path target, List<String[]> rows) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 SequenceWriter sequence = csvMapper.writerFor(String[].class)
                         .with(CsvSchema.emptySchema())
                         .writeValues(writer)) {
                for (String[] row : rows) {
                    sequence.write(row);
                }
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }
}
