package com.footballtransfers.infrastructure.config;

import com.footballtransfers.application.usecase.ScrapePlan;
import com.footballtransfers.application.usecase.ScrapeTransfersUseCase;
import com.footballtransfers.domain.model.ClubRef;
import com.footballtransfers.domain.model.LeagueRef;
import com.footballtransfers.domain.model.RunCancellation;
import com.footballtransfers.domain.model.Window;
import com.footballtransfers.domain.service.TransferReconciler;
import com.footballtransfers.infrastructure.normalization.TransferRowNormalizer;
import com.footballtransfers.infrastructure.persistence.CsvDatasetWriter;
import com.footballtransfers.infrastructure.persistence.FileSystemPageQuarantine;
import com.footballtransfers.infrastructure.persistence.RunReportWriter;
import com.footballtransfers.infrastructure.scraper.ApacheHttpTransport;
import com.footballtransfers.infrastructure.scraper.HostRateLimiter;
import com.footballtransfers.infrastructure.scraper.HttpPageFetcher;
import com.footballtransfers.infrastructure.scraper.RetryPolicy;
import com.footballtransfers.infrastructure.scraper.Sleeper;
import com.footballtransfers.infrastructure.scraper.transfermarkt.TransferTableExtractor;
import com.footballtransfers.infrastructure.scraper.transfermarkt.TransfermarktClubDirectory;
import com.footballtransfers.infrastructure.scraper.transfermarkt.TransfermarktUrls;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Random;

/**
 * Wires the pipeline from {@link TransfersProperties}.
 */
@Configuration
public class TransfersConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RunCancellation runCancellation() {
        return new RunCancellation();
    }

    @Bean(destroyMethod = "close")
    public ApacheHttpTransport httpTransport(TransfersProperties props) {
        TransfersProperties.Fetch fetch = props.fetch();
        return new ApacheHttpTransport(fetch.connectTimeout(), fetch.responseTimeout(), fetch.maxConcurrent());
    }

    @Bean
    public HostRateLimiter hostRateLimiter(TransfersProperties props, Clock clock) {
        return new HostRateLimiter(props.fetch().minDelay(), props.fetch().maxConcurrent(), clock, Sleeper.SYSTEM);
    }

    @Bean
    public RetryPolicy retryPolicy(TransfersProperties props) {
        TransfersProperties.Fetch fetch = props.fetch();
        return new RetryPolicy(fetch.maxAttempts(), fetch.baseBackoff(), fetch.maxBackoff());
    }

    @Bean
    public TransfermarktUrls transfermarktUrls(TransfersProperties props) {
        return new TransfermarktUrls(props.baseUrl());
    }

    @Bean
    public HttpPageFetcher httpPageFetcher(ApacheHttpTransport transport,
                                           HostRateLimiter rateLimiter,
                                           RetryPolicy retryPolicy,
                                           TransfermarktUrls urls,
                                           RunCancellation cancellation,
                                           TransfersProperties props,
                                           Clock clock) {
        return new HttpPageFetcher(transport, rateLimiter, retryPolicy, props.fetch().defaultCooldown(),
            urls, cancellation, clock, Sleeper.SYSTEM, new Random());
    }

    @Bean
    public TransfermarktClubDirectory clubDirectory(HttpPageFetcher fetcher, TransfermarktUrls urls) {
        return new TransfermarktClubDirectory(fetcher, urls);
    }

    @Bean
    public TransferTableExtractor transferTableExtractor() {
        return new TransferTableExtractor();
    }

    @Bean
    public TransferRowNormalizer transferRowNormalizer() {
        return new TransferRowNormalizer();
    }

    @Bean
    public TransferReconciler transferReconciler() {
        return new TransferReconciler();
    }

    @Bean
    public CsvDatasetWriter csvDatasetWriter(TransfersProperties props) {
        return new CsvDatasetWriter(Path.of(props.outputDir()));
    }

    @Bean
    public FileSystemPageQuarantine pageQuarantine(TransfersProperties props) {
        return new FileSystemPageQuarantine(Path.of(props.quarantineDir()));
    }

    @Bean
    public RunReportWriter runReportWriter(TransfersProperties props) {
        return new RunReportWriter(Path.of(props.reportFile()));
    }

    @Bean(destroyMethod = "shutdown")
    public ScrapeTransfersUseCase scrapeTransfersUseCase(TransfermarktClubDirectory clubDirectory,
                                                         HttpPageFetcher fetcher,
                                                         TransferTableExtractor extractor,
                                                         TransferRowNormalizer normalizer,
                                                         TransferReconciler reconciler,
                                                         CsvDatasetWriter datasetWriter,
                                                         FileSystemPageQuarantine quarantine,
                                                         RunCancellation cancellation,
                                                         TransfersProperties props,
                                                         Clock clock) {
        return new ScrapeTransfersUseCase(clubDirectory, fetcher, extractor, normalizer, reconciler,
            datasetWriter, quarantine, cancellation, clock, props.workerThreads());
    }

    @Bean
    public ScrapePlan scrapePlan(TransfersProperties props) {
        return toPlan(props);
    }

    static ScrapePlan toPlan(TransfersProperties props) {
        if (props.leagues().isEmpty()) {
            throw new IllegalStateException("No league configured under transfers.leagues");
        }
        List<LeagueRef> leagues = props.leagues().stream()
            .map(l -> new LeagueRef(l.slug(), l.code(), l.clubs().stream()
                .map(c -> new ClubRef(c.slug(), c.id(), c.name(), c.aliases()))
                .toList()))
            .toList();
        List<Window> windows = props.windows().stream().map(Window::fromString).distinct().toList();
        List<Integer> seasons = props.seasons().stream().distinct().toList();
        return new ScrapePlan(leagues, seasons, windows, props.forcePartial());
    }
}
