package com.footballtransfers.application.usecase;

import com.footballtransfers.domain.error.DatasetWriteException;
import com.footballtransfers.domain.error.ExtractionException;
import com.footballtransfers.domain.error.FetchException;
import com.footballtransfers.domain.model.ClubRef;
import com.footballtransfers.domain.model.LeagueRef;
import com.footballtransfers.domain.model.Movement;
import com.footballtransfers.domain.model.RawCell;
import com.footballtransfers.domain.model.RawPage;
import com.footballtransfers.domain.model.RawRow;
import com.footballtransfers.domain.model.ReconciliationStatus;
import com.footballtransfers.domain.model.RunCancellation;
import com.footballtransfers.domain.model.ScrapeContext;
import com.footballtransfers.domain.model.TransferRecord;
import com.footballtransfers.domain.model.Window;
import com.footballtransfers.domain.ports.ClubDirectory;
import com.footballtransfers.domain.ports.DatasetWriter;
import com.footballtransfers.domain.ports.PageFetcher;
import com.footballtransfers.domain.ports.PageQuarantine;
import com.footballtransfers.domain.ports.TransferExtractor;
import com.footballtransfers.domain.service.TransferReconciler;
import com.footballtransfers.infrastructure.normalization.TransferRowNormalizer;
import com.footballtransfers.infrastructure.persistence.CsvDatasetWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScrapeTransfersUseCase.
 */
class ScrapeTransfersUseCaseTest {

    private static final ClubRef ARSENAL = new ClubRef("fc-arsenal", "11", "Arsenal FC", List.of("Arsenal"));
    private static final ClubRef CHELSEA = new ClubRef("fc-chelsea", "631", "Chelsea FC", List.of("Chelsea"));
    private static final LeagueRef PREMIER_LEAGUE = new LeagueRef("premier-league", "GB1");
    private static final LeagueRef LA_LIGA = new LeagueRef("laliga", "ES1");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-09-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path outputDir;

    private TestClubDirectory clubDirectory;
    private TestPageFetcher fetcher;
    private TestQuarantine quarantine;
    private RecordingWriter writer;
    private RunCancellation cancellation;
    private final List<ScrapeTransfersUseCase> useCases = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clubDirectory = new TestClubDirectory();
        clubDirectory.clubs.put(PREMIER_LEAGUE.slug(), List.of(ARSENAL, CHELSEA));
        fetcher = new TestPageFetcher();
        quarantine = new TestQuarantine();
        writer = new RecordingWriter();
        cancellation = new RunCancellation();

        // Merino: Chelsea -> Arsenal, reported by both clubs
        fetcher.page(ARSENAL, Window.SUMMER, row(Movement.IN, 0, "338424", "Mikel Merino", "Chelsea", "€32.00m"));
        fetcher.page(CHELSEA, Window.SUMMER, row(Movement.OUT, 0, "338424", "Mikel Merino", "Arsenal", "€30.00m"));
        // Sterling: Chelsea -> Arsenal on loan in winter, only Arsenal's page has it
        fetcher.page(ARSENAL, Window.WINTER, row(Movement.IN, 0, "134425", "Raheem Sterling", "Chelsea", "loan transfer"));
        fetcher.page(CHELSEA, Window.WINTER);
    }

    @AfterEach
    void tearDown() {
        useCases.forEach(ScrapeTransfersUseCase::shutdown);
    }

    private ScrapeTransfersUseCase useCase(DatasetWriter datasetWriter, int workers) {
        ScrapeTransfersUseCase useCase = new ScrapeTransfersUseCase(clubDirectory, fetcher, new TestExtractor(fetcher),
            new TransferRowNormalizer(), new TransferReconciler(), datasetWriter, quarantine, cancellation, CLOCK,
            workers);
        useCases.add(useCase);
        return useCase;
    }

    private static ScrapePlan plan(LeagueRef... leagues) {
        return new ScrapePlan(List.of(leagues), List.of(2024), List.of(Window.SUMMER, Window.WINTER), false);
    }

    @Test
    void testExecuteSuccess() {
        RunReport report = useCase(writer, 4).execute(plan(PREMIER_LEAGUE));

        assertFalse(report.cancelled());
        assertEquals(1, report.seasons().size());
        RunReport.SeasonOutcome season = report.seasons().get(0);
        assertEquals(RunReport.SeasonStatus.WRITTEN, season.status());
        assertEquals(3, season.records());
        assertEquals(1, season.pairedTransfers());
        assertEquals(1, season.unpairedRecords());

        List<TransferRecord> written = writer.written.get("premier-league/2024");
        assertEquals(3, written.size());
        TransferRecord merinoIn = find(written, "338424", Movement.IN);
        TransferRecord merinoOut = find(written, "338424", Movement.OUT);
        assertEquals("Chelsea FC", merinoIn.getDealingClub());
        assertEquals("Arsenal FC", merinoOut.getDealingClub());
        assertEquals(ReconciliationStatus.PAIRED, merinoIn.getReconciliationStatus());
        // the buying club's fee wins
        assertEquals(32_000_000L, merinoOut.getFee());

        assertEquals(1, report.conflicts().size());
        assertEquals("fee", report.conflicts().get(0).field());
        assertTrue(report.skippedPages().isEmpty());
        assertTrue(report.quarantinedPages().isEmpty());
    }

    @Test
    void testFailuresStayWithTheirPage() {
        fetcher.fail(ARSENAL, Window.WINTER, new FetchException(FetchException.Kind.TERMINAL, 404, "u", "HTTP status 404"));
        fetcher.broken(CHELSEA, Window.WINTER);

        RunReport report = useCase(writer, 4).execute(plan(PREMIER_LEAGUE));

        assertEquals(RunReport.SeasonStatus.WRITTEN, report.seasons().get(0).status());
        assertEquals(2, writer.written.get("premier-league/2024").size());

        assertEquals(1, report.skippedPages().size());
        RunReport.SkippedPage skipped = report.skippedPages().get(0);
        assertEquals("Arsenal FC", skipped.club());
        assertEquals("winter", skipped.window());
        assertEquals("TERMINAL", skipped.kind());
        assertEquals(404, skipped.statusCode());

        assertEquals(1, report.quarantinedPages().size());
        assertEquals("Chelsea FC", report.quarantinedPages().get(0).club());
        assertEquals(1, quarantine.pages.size());
    }

    @Test
    void testBadRowIsDroppedAndCounted() {
        RawRow bad = row(Movement.IN, 1, "999", "Unknown Age", "Chelsea", "-");
        Map<String, RawCell> cells = new LinkedHashMap<>(bad.cells());
        cells.put("Age", RawCell.ofText("n/a"));
        fetcher.page(ARSENAL, Window.SUMMER,
            row(Movement.IN, 0, "338424", "Mikel Merino", "Chelsea", "€32.00m"),
            new RawRow("Arrivals", Movement.IN, 1, cells));

        RunReport report = useCase(writer, 2).execute(plan(PREMIER_LEAGUE));

        assertEquals(3, writer.written.get("premier-league/2024").size());
        assertEquals(1, report.droppedRows().size());
        RunReport.DroppedRow dropped = report.droppedRows().get(0);
        assertEquals("Age", dropped.label());
        assertEquals("n/a", dropped.value());
        assertEquals(1, dropped.row());
    }

    @Test
    void testNothingFetchedMeansNoFile() {
        FetchException failure = new FetchException(FetchException.Kind.TRANSIENT, 503, "u", "Server error 503");
        for (ClubRef club : List.of(ARSENAL, CHELSEA)) {
            for (Window window : Window.values()) {
                fetcher.fail(club, window, failure);
            }
        }

        RunReport report = useCase(writer, 4).execute(plan(PREMIER_LEAGUE));

        assertEquals(RunReport.SeasonStatus.SKIPPED_NO_DATA, report.seasons().get(0).status());
        assertTrue(writer.written.isEmpty());
        assertEquals(4, report.skippedPages().size());
    }

    @Test
    void testCancelledBeforeStartWritesNothing() {
        cancellation.cancel();

        RunReport report = useCase(writer, 4).execute(plan(PREMIER_LEAGUE));

        assertTrue(report.cancelled());
        assertEquals(RunReport.SeasonStatus.SKIPPED_INCOMPLETE, report.seasons().get(0).status());
        assertTrue(writer.written.isEmpty());
        assertTrue(fetcher.fetched.isEmpty());
    }

    @Test
    void testCancelledMidRunSkipsIncompleteSeason() {
        fetcher.cancelAfterFirstFetch = cancellation;

        RunReport report = useCase(writer, 1).execute(plan(PREMIER_LEAGUE));

        assertTrue(report.cancelled());
        assertEquals(1, fetcher.fetched.size());
        assertEquals(RunReport.SeasonStatus.SKIPPED_INCOMPLETE, report.seasons().get(0).status());
        assertTrue(writer.written.isEmpty());
    }

    @Test
    void testForcePartialWritesWhatWasFetched() {
        fetcher.cancelAfterFirstFetch = cancellation;
        ScrapePlan partial = new ScrapePlan(List.of(PREMIER_LEAGUE), List.of(2024),
            List.of(Window.SUMMER, Window.WINTER), true);

        RunReport report = useCase(writer, 1).execute(partial);

        assertEquals(RunReport.SeasonStatus.WRITTEN, report.seasons().get(0).status());
        assertEquals(1, writer.written.get("premier-league/2024").size());
    }

    @Test
    void testClubDiscoveryFailureSkipsOnlyThatLeague() {
        clubDirectory.failing.add(LA_LIGA.slug());

        RunReport report = useCase(writer, 4).execute(plan(LA_LIGA, PREMIER_LEAGUE));

        assertEquals(2, report.seasons().size());
        assertEquals(RunReport.SeasonStatus.SKIPPED_NO_DATA, report.seasons().get(0).status());
        assertEquals("laliga", report.seasons().get(0).league());
        assertEquals(RunReport.SeasonStatus.WRITTEN, report.seasons().get(1).status());
    }

    @Test
    void testWriteFailureIsReported() {
        writer.failing = true;

        RunReport report = useCase(writer, 4).execute(plan(PREMIER_LEAGUE));

        RunReport.SeasonOutcome season = report.seasons().get(0);
        assertEquals(RunReport.SeasonStatus.WRITE_FAILED, season.status());
        assertNull(season.file());
        assertEquals(1, report.countSeasons(RunReport.SeasonStatus.WRITE_FAILED));
    }

    @Test
    void testRepeatedRunsProduceIdenticalFiles() throws Exception {
        CsvDatasetWriter csv = new CsvDatasetWriter(outputDir);

        useCase(csv, 4).execute(plan(PREMIER_LEAGUE));
        byte[] first = Files.readAllBytes(csv.pathFor("premier-league", 2024));
        useCase(csv, 1).execute(plan(PREMIER_LEAGUE));
        byte[] second = Files.readAllBytes(csv.pathFor("premier-league", 2024));

        assertArrayEquals(first, second);
    }

    private static TransferRecord find(List<TransferRecord> records, String playerId, Movement movement) {
        return records.stream()
            .filter(r -> r.getPlayerId().equals(playerId) && r.getMovement() == movement)
            .findFirst()
            .orElseThrow();
    }

    /**
     * Builds a raw club-page row the way the extractor reports it.
     */
    private static RawRow row(Movement movement, int index, String playerId, String name, String dealingClub, String fee) {
        Map<String, RawCell> cells = new LinkedHashMap<>();
        cells.put(movement == Movement.IN ? "In" : "Out", new RawCell(name,
            List.of(new RawCell.Link(name, "/" + playerId + "/profil/spieler/" + playerId)), List.of(), List.of()));
        cells.put("Position", RawCell.ofText("Central Midfield"));
        cells.put("Age", RawCell.ofText("28"));
        cells.put("Nat.", new RawCell("", List.of(), List.of(), List.of("Spain")));
        cells.put("Market value", RawCell.ofText("€50.00m"));
        cells.put(movement == Movement.IN ? "Left" : "Joined", new RawCell(dealingClub, List.of(), List.of(), List.of("England")));
        cells.put("Fee", RawCell.ofText(fee));
        return new RawRow(movement == Movement.IN ? "Arrivals" : "Departures", movement, index, cells);
    }

    private static String key(ClubRef club, Window window) {
        return club.slug() + "/" + window.getCanonicalKey();
    }

    /**
     * Club directory backed by a map.
     */
    private static class TestClubDirectory implements ClubDirectory {
        private final Map<String, List<ClubRef>> clubs = new HashMap<>();
        private final Set<String> failing = new HashSet<>();

        @Override
        public List<ClubRef> clubsFor(LeagueRef league, int season) throws FetchException {
            if (failing.contains(league.slug())) {
                throw new FetchException(FetchException.Kind.TERMINAL, 404, "overview", "HTTP status 404");
            }
            return clubs.getOrDefault(league.slug(), List.of());
        }
    }

    /**
     * Fetcher serving scripted rows; the page URL carries the key the extractor looks rows up by.
     */
    private static class TestPageFetcher implements PageFetcher {
        private final Map<String, List<RawRow>> rows = new ConcurrentHashMap<>();
        private final Map<String, FetchException> failures = new ConcurrentHashMap<>();
        private final Set<String> broken = ConcurrentHashMap.newKeySet();
        private final List<String> fetched = Collections.synchronizedList(new ArrayList<>());
        private volatile RunCancellation cancelAfterFirstFetch;

        void page(ClubRef club, Window window, RawRow... pageRows) {
            rows.put(key(club, window), List.of(pageRows));
        }

        void fail(ClubRef club, Window window, FetchException failure) {
            failures.put(key(club, window), failure);
        }

        void broken(ClubRef club, Window window) {
            broken.add(key(club, window));
        }

        @Override
        public RawPage fetch(ScrapeContext context) throws FetchException {
            String key = key(context.club(), context.window());
            fetched.add(key);
            if (cancelAfterFirstFetch != null) {
                cancelAfterFirstFetch.cancel();
            }
            FetchException failure = failures.get(key);
            if (failure != null) {
                throw failure;
            }
            return new RawPage(context, "https://test.example/" + key, 200, "<html></html>", CLOCK.instant());
        }
    }

    /**
     * Extractor returning the rows scripted for the fetched page.
     */
    private static class TestExtractor implements TransferExtractor {
        private final TestPageFetcher fetcher;

        TestExtractor(TestPageFetcher fetcher) {
            this.fetcher = fetcher;
        }

        @Override
        public List<RawRow> extract(RawPage page) throws ExtractionException {
            String key = page.url().substring("https://test.example/".length());
            if (fetcher.broken.contains(key)) {
                throw new ExtractionException("No transfer table on " + page.url());
            }
            return fetcher.rows.getOrDefault(key, List.of());
        }
    }

    private static class TestQuarantine implements PageQuarantine {
        private final List<RawPage> pages = Collections.synchronizedList(new ArrayList<>());

        @Override
        public Path quarantine(RawPage page, String reason) throws IOException {
            pages.add(page);
            return Path.of("quarantine", page.context().club().slug() + ".html");
        }
    }

    /**
     * Writer keeping records in memory; can be told to fail.
     */
    private static class RecordingWriter implements DatasetWriter {
        private final Map<String, List<TransferRecord>> written = new ConcurrentHashMap<>();
        private volatile boolean failing;

        @Override
        public Path write(String league, int season, List<TransferRecord> records) throws DatasetWriteException {
            if (failing) {
                throw new DatasetWriteException("disk full", new IOException("No space left on device"));
            }
            written.put(league + "/" + season, List.copyOf(records));
            return Path.of("data", league, season + ".csv");
        }
    }
}
