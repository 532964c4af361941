package com.footballtransfers.infrastructure.persistence;

import com.footballtransfers.domain.model.RawPage;
import com.footballtransfers.domain.model.ScrapeContext;
import com.footballtransfers.domain.ports.PageQuarantine;
import com.footballtransfers.infrastructure.normalization.NormalizationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves unrecognized pages as {@code {dir}/{league}/{season}/{window}-{club}.html},
 * preceded by an HTML comment with the source URL and the reason.
 */
public class FileSystemPageQuarantine implements PageQuarantine {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemPageQuarantine.class);

    private final Path quarantineDir;

    public FileSystemPageQuarantine(Path quarantineDir) {
        this.quarantineDir = quarantineDir;
    }

    @Override
    public Path quarantine(RawPage page, String reason) throws IOException {
        ScrapeContext context = page.context();
        Path target = quarantineDir
            .resolve(context.league())
            .resolve(String.valueOf(context.season()))
            .resolve(context.window().getCanonicalKey() + "-" + NormalizationUtils.fileSlug(context.club().name()) + ".html");
        Files.createDirectories(target.getParent());

        String banner = "<!-- quarantined: " + sanitize(reason) + " | source: " + sanitize(page.url())
            + " | fetched: " + page.fetchedAt() + " -->\n";
        Files.writeString(target, banner + page.body(), StandardCharsets.UTF_8);
        logger.warn("Quarantined {} to {}: {}", page.url(), target, reason);
        return target;
    }

    private static String sanitize(String text) {
        return text == null ? "" : text.replace("--", "- -");
    }
}
