package com.footballtransfers.infrastructure.persistence;

import com.footballtransfers.domain.error.DatasetWriteException;
import com.footballtransfers.domain.model.TransferRecord;
import com.footballtransfers.domain.ports.DatasetWriter;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Writes {@code {outputDir}/{league}/{season}.csv}.
 *
 * The file is written to a temporary sibling and renamed over the previous
 * version, so readers never see a truncated dataset. Rows are sorted by
 * {@link TransferCsvSchema#ROW_ORDER} and lines end with '\n', so identical
 * input yields byte-identical files.
 */
public class CsvDatasetWriter implements DatasetWriter {

    private static final Logger logger = LoggerFactory.getLogger(CsvDatasetWriter.class);

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader(TransferCsvSchema.HEADER)
        .setRecordSeparator("\n")
        .build();

    private static final Set<PosixFilePermission> PUBLISHED_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private final Path outputDir;

    public CsvDatasetWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Path pathFor(String league, int season) {
        return outputDir.resolve(league).resolve(season + ".csv");
    }

    @Override
    public Path write(String league, int season, List<TransferRecord> records) throws DatasetWriteException {
        Path target = pathFor(league, season);
        List<TransferRecord> sorted = new ArrayList<>(records);
        sorted.sort(TransferCsvSchema.ROW_ORDER);

        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "." + season + "-", ".csv.tmp");

            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
                for (TransferRecord record : sorted) {
                    printer.printRecord(TransferCsvSchema.toRow(record));
                }
            }

            applyPublishedPermissions(temp, target);
            moveIntoPlace(temp, target);
            logger.info("Wrote {} records to {}", sorted.size(), target);
            return target;
        } catch (IOException e) {
            deleteQuietly(temp);
            logger.error("Failed to write dataset {}", target, e);
            throw new DatasetWriteException("Failed to write " + target, e);
        }
    }

    /**
     * Temp files are created owner-only; the published file keeps the previous
     * version's permissions, or gets {@code rw-r--r--} when it is new.
     */
    private static void applyPublishedPermissions(Path temp, Path target) throws IOException {
        if (!Files.getFileStore(temp).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(target)
            ? Files.getPosixFilePermissions(target)
            : PUBLISHED_PERMISSIONS;
        Files.setPosixFilePermissions(temp, permissions);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}
