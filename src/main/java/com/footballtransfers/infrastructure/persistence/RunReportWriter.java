package com.footballtransfers.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.footballtransfers.application.usecase.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes the run report as pretty-printed JSON next to the datasets.
 */
public class RunReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(RunReportWriter.class);
    private static final ObjectMapper OBJECT_MAPPER;

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private final Path reportFile;

    public RunReportWriter(Path reportFile) {
        this.reportFile = reportFile;
    }

    public Path write(RunReport report) throws IOException {
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = reportFile.resolveSibling(reportFile.getFileName() + ".tmp");
        OBJECT_MAPPER.writeValue(temp.toFile(), report);
        Files.move(temp, reportFile, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Run report written to {}", reportFile);
        return reportFile;
    }

    static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }
}
