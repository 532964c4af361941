package com.footballtransfers.application.usecase;

import com.footballtransfers.domain.error.FetchException;
import com.footballtransfers.domain.error.NormalizationException;
import com.footballtransfers.domain.error.ReconciliationConflict;
import com.footballtransfers.domain.model.ScrapeContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * End-of-run audit trail: skipped clubs, quarantined pages, dropped rows,
 * resolved conflicts and the outcome of every season.
 */
public record RunReport(
    Instant startedAt,
    Instant finishedAt,
    boolean cancelled,
    List<SeasonOutcome> seasons,
    List<SkippedPage> skippedPages,
    List<QuarantinedPage> quarantinedPages,
    List<DroppedRow> droppedRows,
    List<Conflict> conflicts
) {

    public enum SeasonStatus {
        WRITTEN,
        /** Cancellation left jobs unrun and partial output was not forced. */
        SKIPPED_INCOMPLETE,
        /** No page of the season could be fetched and read. */
        SKIPPED_NO_DATA,
        WRITE_FAILED
    }

    public record SeasonOutcome(
        String league,
        int season,
        SeasonStatus status,
        String file,
        int records,
        int pairedTransfers,
        int unpairedRecords,
        String reason
    ) {}

    public record SkippedPage(String league, int season, String window, String club,
                              String kind, int statusCode, String reason) {}

    public record QuarantinedPage(String league, int season, String window, String club,
                                  String url, String file, String reason) {}

    public record DroppedRow(String league, int season, String window, String club,
                             int row, String label, String value, String reason) {}

    public record Conflict(String league, int season, String window, String playerId,
                           String clubA, String clubB, String field,
                           String inValue, String outValue, String resolved) {}

    public int countSeasons(SeasonStatus status) {
        return (int) seasons.stream().filter(s -> s.status() == status).count();
    }

    /**
     * Thread-safe collector used while a run is in progress.
     */
    public static class Builder {

        private final Instant startedAt;
        private final List<SeasonOutcome> seasons = new ArrayList<>();
        private final List<SkippedPage> skippedPages = new ArrayList<>();
        private final List<QuarantinedPage> quarantinedPages = new ArrayList<>();
        private final List<DroppedRow> droppedRows = new ArrayList<>();
        private final List<Conflict> conflicts = new ArrayList<>();

        public Builder(Instant startedAt) {
            this.startedAt = startedAt;
        }

        public synchronized void season(SeasonOutcome outcome) {
            seasons.add(outcome);
        }

        public synchronized void skippedPage(ScrapeContext context, FetchException e) {
            skippedPages.add(new SkippedPage(context.league(), context.season(), context.window().getCanonicalKey(),
                context.club().name(), e.getKind().name(), e.getStatusCode(), e.getMessage()));
        }

        public synchronized void quarantinedPage(ScrapeContext context, String url, String file, String reason) {
            quarantinedPages.add(new QuarantinedPage(context.league(), context.season(),
                context.window().getCanonicalKey(), context.club().name(), url, file, reason));
        }

        public synchronized void droppedRow(ScrapeContext context, int row, NormalizationException e) {
            droppedRows.add(new DroppedRow(context.league(), context.season(), context.window().getCanonicalKey(),
                context.club().name(), row, e.getLabel(), e.getValue(), e.getMessage()));
        }

        public synchronized void conflict(String league, int season, ReconciliationConflict conflict) {
            conflicts.add(new Conflict(league, season, conflict.key().window().getCanonicalKey(),
                conflict.key().playerId(), conflict.key().clubA(), conflict.key().clubB(), conflict.field(),
                conflict.inValue(), conflict.outValue(), conflict.resolved()));
        }

        public synchronized RunReport build(Instant finishedAt, boolean cancelled) {
            return new RunReport(startedAt, finishedAt, cancelled,
                List.copyOf(seasons), List.copyOf(skippedPages), List.copyOf(quarantinedPages),
                List.copyOf(droppedRows), List.copyOf(conflicts));
        }
    }
}
