package com.footballtransfers.application.usecase;

import com.footballtransfers.domain.error.DatasetWriteException;
import com.footballtransfers.domain.error.ExtractionException;
import com.footballtransfers.domain.error.FetchException;
import com.footballtransfers.domain.error.NormalizationException;
import com.footballtransfers.domain.error.ReconciliationConflict;
import com.footballtransfers.domain.model.ClubRef;
import com.footballtransfers.domain.model.LeagueRef;
import com.footballtransfers.domain.model.RawPage;
import com.footballtransfers.domain.model.RawRow;
import com.footballtransfers.domain.model.RunCancellation;
import com.footballtransfers.domain.model.ScrapeContext;
import com.footballtransfers.domain.model.TransferRecord;
import com.footballtransfers.domain.model.Window;
import com.footballtransfers.domain.ports.ClubDirectory;
import com.footballtransfers.domain.ports.DatasetWriter;
import com.footballtransfers.domain.ports.PageFetcher;
import com.footballtransfers.domain.ports.PageQuarantine;
import com.footballtransfers.domain.ports.RowNormalizer;
import com.footballtransfers.domain.ports.TransferExtractor;
import com.footballtransfers.domain.service.TransferReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs the whole pipeline: for every league and season, fetch each club's
 * pages on a bounded worker pool, extract and normalize them as they arrive,
 * then reconcile and write the season once all of its jobs have finished.
 *
 * Failures stay at the level they happen: a bad row is dropped, a bad page is
 * skipped or quarantined, a failed write loses only that season.
 */
public class ScrapeTransfersUseCase {

    private static final Logger logger = LoggerFactory.getLogger(ScrapeTransfersUseCase.class);

    private final ClubDirectory clubDirectory;
    private final PageFetcher pageFetcher;
    private final TransferExtractor extractor;
    private final RowNormalizer normalizer;
    private final TransferReconciler reconciler;
    private final DatasetWriter datasetWriter;
    private final PageQuarantine quarantine;
    private final RunCancellation cancellation;
    private final Clock clock;
    private final ExecutorService executorService;

    public ScrapeTransfersUseCase(ClubDirectory clubDirectory,
                                  PageFetcher pageFetcher,
                                  TransferExtractor extractor,
                                  RowNormalizer normalizer,
                                  TransferReconciler reconciler,
                                  DatasetWriter datasetWriter,
                                  PageQuarantine quarantine,
                                  RunCancellation cancellation,
                                  Clock clock,
                                  int workerThreads) {
        this.clubDirectory = clubDirectory;
        this.pageFetcher = pageFetcher;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.reconciler = reconciler;
        this.datasetWriter = datasetWriter;
        this.quarantine = quarantine;
        this.cancellation = cancellation;
        this.clock = clock;
        this.executorService = Executors.newFixedThreadPool(Math.max(1, workerThreads));
    }

    private enum JobStatus { SUCCEEDED, FAILED, QUARANTINED, NOT_RUN }

    private record JobResult(ScrapeContext context, JobStatus status, List<TransferRecord> records) {

        static JobResult of(ScrapeContext context, JobStatus status) {
            return new JobResult(context, status, List.of());
        }
    }

    private record SeasonRun(LeagueRef league, int season, List<CompletableFuture<JobResult>> jobs) {}

    /**
     * Executes the plan and returns what happened.
     */
    public RunReport execute(ScrapePlan plan) {
        RunReport.Builder report = new RunReport.Builder(clock.instant());
        logger.info("Starting transfer scrape for {} leagues, seasons {}, windows {}",
            plan.leagues().size(), plan.seasons(), plan.windows());

        List<SeasonRun> seasonRuns = new ArrayList<>();
        for (LeagueRef league : plan.leagues()) {
            for (int season : plan.seasons()) {
                SeasonRun run = submitSeason(plan, league, season, report);
                if (run != null) {
                    seasonRuns.add(run);
                }
            }
        }

        for (SeasonRun run : seasonRuns) {
            // Join barrier: reconciliation needs every club's page of the season.
            CompletableFuture.allOf(run.jobs().toArray(new CompletableFuture[0])).join();
            finishSeason(plan, run, report);
        }

        RunReport result = report.build(clock.instant(), cancellation.isCancelled());
        logSummary(result);
        return result;
    }

    private SeasonRun submitSeason(ScrapePlan plan, LeagueRef league, int season, RunReport.Builder report) {
        if (cancellation.isCancelled()) {
            report.season(new RunReport.SeasonOutcome(league.slug(), season, RunReport.SeasonStatus.SKIPPED_INCOMPLETE,
                null, 0, 0, 0, "Run cancelled before the season started"));
            return null;
        }

        List<ClubRef> clubs;
        try {
            clubs = clubDirectory.clubsFor(league, season);
        } catch (FetchException | ExtractionException e) {
            logger.warn("Could not list clubs for {} {}: {}", league.slug(), season, e.getMessage());
            report.season(new RunReport.SeasonOutcome(league.slug(), season, RunReport.SeasonStatus.SKIPPED_NO_DATA,
                null, 0, 0, 0, "Club discovery failed: " + e.getMessage()));
            return null;
        }

        List<CompletableFuture<JobResult>> jobs = new ArrayList<>();
        for (Window window : plan.windows()) {
            for (ClubRef club : clubs) {
                ScrapeContext context = new ScrapeContext(league.slug(), season, window, club, clubs);
                jobs.add(CompletableFuture.supplyAsync(() -> runJob(context, report), executorService));
            }
        }
        logger.info("Queued {} club jobs for {} {}", jobs.size(), league.slug(), season);
        return new SeasonRun(league, season, jobs);
    }

    private JobResult runJob(ScrapeContext context, RunReport.Builder report) {
        if (cancellation.isCancelled()) {
            return JobResult.of(context, JobStatus.NOT_RUN);
        }
        try {
            RawPage page;
            try {
                page = pageFetcher.fetch(context);
            } catch (FetchException e) {
                if (e.getKind() == FetchException.Kind.CANCELLED) {
                    return JobResult.of(context, JobStatus.NOT_RUN);
                }
                logger.warn("Skipping {}: {}", context.describe(), e.getMessage());
                report.skippedPage(context, e);
                return JobResult.of(context, JobStatus.FAILED);
            }

            List<RawRow> rows;
            try {
                rows = extractor.extract(page);
            } catch (ExtractionException e) {
                quarantine(page, e.getMessage(), report);
                return JobResult.of(context, JobStatus.QUARANTINED);
            }

            List<TransferRecord> records = new ArrayList<>();
            for (RawRow row : rows) {
                try {
                    records.add(normalizer.normalize(row, context));
                } catch (NormalizationException e) {
                    logger.warn("Dropping row {} of {}: {}", row.getRowIndex(), context.describe(), e.getMessage());
                    report.droppedRow(context, row.getRowIndex(), e);
                }
            }
            logger.debug("{}: {} rows, {} records", context.describe(), rows.size(), records.size());
            return new JobResult(context, JobStatus.SUCCEEDED, records);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure in job {}", context.describe(), e);
            report.skippedPage(context, new FetchException(FetchException.Kind.TERMINAL, -1, null,
                "Unexpected failure: " + e.getMessage(), e));
            return JobResult.of(context, JobStatus.FAILED);
        }
    }

    private void quarantine(RawPage page, String reason, RunReport.Builder report) {
        String file = null;
        try {
            Path path = quarantine.quarantine(page, reason);
            file = path.toString();
        } catch (IOException e) {
            logger.error("Could not quarantine {}", page.url(), e);
        }
        report.quarantinedPage(page.context(), page.url(), file, reason);
    }

    private void finishSeason(ScrapePlan plan, SeasonRun run, RunReport.Builder report) {
        String league = run.league().slug();
        List<JobResult> results = run.jobs().stream().map(CompletableFuture::join).toList();

        long notRun = results.stream().filter(r -> r.status() == JobStatus.NOT_RUN).count();
        long succeeded = results.stream().filter(r -> r.status() == JobStatus.SUCCEEDED).count();

        if (notRun > 0 && !plan.forcePartial()) {
            logger.warn("Not writing {} {}: {} of {} jobs did not run", league, run.season(), notRun, results.size());
            report.season(new RunReport.SeasonOutcome(league, run.season(), RunReport.SeasonStatus.SKIPPED_INCOMPLETE,
                null, 0, 0, 0, notRun + " of " + results.size() + " club jobs did not run"));
            return;
        }
        if (succeeded == 0) {
            logger.warn("Not writing {} {}: no club page could be fetched and read", league, run.season());
            report.season(new RunReport.SeasonOutcome(league, run.season(), RunReport.SeasonStatus.SKIPPED_NO_DATA,
                null, 0, 0, 0, "No club page could be fetched and read"));
            return;
        }

        List<TransferRecord> records = new ArrayList<>();
        results.forEach(r -> records.addAll(r.records()));

        TransferReconciler.Result reconciled = reconciler.reconcile(records);
        for (ReconciliationConflict conflict : reconciled.conflicts()) {
            report.conflict(league, run.season(), conflict);
        }

        try {
            Path file = datasetWriter.write(league, run.season(), reconciled.records());
            report.season(new RunReport.SeasonOutcome(league, run.season(), RunReport.SeasonStatus.WRITTEN,
                file.toString(), records.size(), reconciled.pairedTransfers(), reconciled.unpairedRecords(), null));
        } catch (DatasetWriteException e) {
            logger.error("Dataset for {} {} was not written", league, run.season(), e);
            report.season(new RunReport.SeasonOutcome(league, run.season(), RunReport.SeasonStatus.WRITE_FAILED,
                null, records.size(), reconciled.pairedTransfers(), reconciled.unpairedRecords(), e.getMessage()));
        }
    }

    private void logSummary(RunReport report) {
        logger.info("Run finished{}: {} seasons written, {} skipped, {} failed to write",
            report.cancelled() ? " (cancelled)" : "",
            report.countSeasons(RunReport.SeasonStatus.WRITTEN),
            report.countSeasons(RunReport.SeasonStatus.SKIPPED_INCOMPLETE)
                + report.countSeasons(RunReport.SeasonStatus.SKIPPED_NO_DATA),
            report.countSeasons(RunReport.SeasonStatus.WRITE_FAILED));
        logger.info("Skipped club pages: {}, quarantined pages: {}, dropped rows: {}, resolved conflicts: {}",
            report.skippedPages().size(), report.quarantinedPages().size(),
            report.droppedRows().size(), report.conflicts().size());
        for (RunReport.SkippedPage page : report.skippedPages()) {
            logger.info("  skipped {}/{}/{}/{}: {}", page.league(), page.season(), page.window(), page.club(), page.reason());
        }
        for (RunReport.QuarantinedPage page : report.quarantinedPages()) {
            logger.info("  quarantined {}/{}/{}/{}: {}", page.league(), page.season(), page.window(), page.club(), page.reason());
        }
    }

    /**
     * Stops the worker pool, waiting briefly for running jobs.
     */
    public void shutdown() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
