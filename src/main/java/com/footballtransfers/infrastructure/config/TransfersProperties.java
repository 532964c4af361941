package com.footballtransfers.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Settings under {@code transfers.*}. Unset values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "transfers")
public record TransfersProperties(
        String baseUrl,
        String outputDir,
        String quarantineDir,
        String reportFile,
        List<League> leagues,
        List<Integer> seasons,
        List<String> windows,
        Fetch fetch,
        Integer workerThreads,
        boolean forcePartial,
        Boolean runOnStartup
) {

    public TransfersProperties {
        baseUrl = baseUrl == null ? "https://www.transfermarkt.com" : baseUrl;
        outputDir = outputDir == null ? "data" : outputDir;
        quarantineDir = quarantineDir == null ? "quarantine" : quarantineDir;
        reportFile = reportFile == null ? "data/run-report.json" : reportFile;
        leagues = leagues == null ? List.of() : List.copyOf(leagues);
        seasons = seasons == null || seasons.isEmpty() ? List.of(2024) : List.copyOf(seasons);
        windows = windows == null || windows.isEmpty() ? List.of("summer", "winter") : List.copyOf(windows);
        fetch = fetch == null ? new Fetch(null, null, null, null, null, null, null, null) : fetch;
        workerThreads = workerThreads == null ? 4 : workerThreads;
        runOnStartup = runOnStartup == null ? Boolean.TRUE : runOnStartup;
    }

    public record League(String slug, String code, List<Club> clubs) {

        public League {
            clubs = clubs == null ? List.of() : List.copyOf(clubs);
        }
    }

    public record Club(String slug, String id, String name, List<String> aliases) {

        public Club {
            aliases = aliases == null ? List.of() : List.copyOf(aliases);
        }
    }

    public record Fetch(
            Integer maxConcurrent,
            Duration minDelay,
            Integer maxAttempts,
            Duration baseBackoff,
            Duration maxBackoff,
            Duration defaultCooldown,
            Duration connectTimeout,
            Duration responseTimeout
    ) {

        public Fetch {
            maxConcurrent = maxConcurrent == null ? 4 : maxConcurrent;
            minDelay = minDelay == null ? Duration.ofSeconds(2) : minDelay;
            maxAttempts = maxAttempts == null ? 4 : maxAttempts;
            baseBackoff = baseBackoff == null ? Duration.ofSeconds(1) : baseBackoff;
            maxBackoff = maxBackoff == null ? Duration.ofSeconds(30) : maxBackoff;
            defaultCooldown = defaultCooldown == null ? Duration.ofSeconds(60) : defaultCooldown;
            connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
            responseTimeout = responseTimeout == null ? Duration.ofSeconds(30) : responseTimeout;
        }
    }
}
