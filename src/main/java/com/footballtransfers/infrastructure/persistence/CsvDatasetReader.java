package com.footballtransfers.infrastructure.persistence;

import com.footballtransfers.domain.model.TransferRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a dataset file back into records.
 */
public class CsvDatasetReader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .build();

    public List<TransferRecord> read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            if (!parser.getHeaderNames().equals(Arrays.asList(TransferCsvSchema.HEADER))) {
                throw new IOException("Unexpected header in " + file + ": " + parser.getHeaderNames());
            }
            List<TransferRecord> records = new ArrayList<>();
            for (CSVRecord row : parser) {
                try {
                    records.add(TransferCsvSchema.fromRow(row));
                } catch (IllegalArgumentException e) {
                    throw new IOException("Invalid row " + row.getRecordNumber() + " in " + file + ": " + e.getMessage(), e);
                }
            }
            return records;
        }
    }
}
