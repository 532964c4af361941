package com.footballtransfers.infrastructure.runner;

import com.footballtransfers.application.usecase.RunReport;
import com.footballtransfers.application.usecase.ScrapePlan;
import com.footballtransfers.application.usecase.ScrapeTransfersUseCase;
import com.footballtransfers.domain.model.RunCancellation;
import com.footballtransfers.infrastructure.config.TransfersProperties;
import com.footballtransfers.infrastructure.persistence.RunReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs the configured scrape once the application has started.
 *
 * An interrupt (Ctrl+C, SIGTERM) cancels the run: no new page is requested,
 * seasons already complete are still written and the report is saved.
 */
@Component
public class TransfersRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(TransfersRunner.class);

    private final ScrapeTransfersUseCase useCase;
    private final ScrapePlan plan;
    private final RunReportWriter reportWriter;
    private final RunCancellation cancellation;
    private final TransfersProperties props;

    private volatile int exitCode;

    public TransfersRunner(ScrapeTransfersUseCase useCase,
                           ScrapePlan plan,
                           RunReportWriter reportWriter,
                           RunCancellation cancellation,
                           TransfersProperties props) {
        this.useCase = useCase;
        this.plan = plan;
        this.reportWriter = reportWriter;
        this.cancellation = cancellation;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.runOnStartup()) {
            logger.info("transfers.run-on-startup is false, nothing to do");
            return;
        }

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            if (finished.getCount() > 0) {
                logger.warn("Shutdown requested, cancelling the run");
                cancellation.cancel();
                awaitQuietly(finished);
            }
        }, "transfers-cancel");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            RunReport report = useCase.execute(plan);
            exitCode = exitCodeFor(report);
            writeReport(report);
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    private void writeReport(RunReport report) {
        try {
            reportWriter.write(report);
        } catch (IOException e) {
            logger.error("Could not write run report", e);
            exitCode = 1;
        }
    }

    static int exitCodeFor(RunReport report) {
        if (report.countSeasons(RunReport.SeasonStatus.WRITE_FAILED) > 0) {
            return 1;
        }
        if (report.countSeasons(RunReport.SeasonStatus.WRITTEN) == 0) {
            return 2;
        }
        return 0;
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            if (!latch.await(2, TimeUnit.MINUTES)) {
                logger.warn("Run did not finish within two minutes of cancellation");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // already shutting down; the hook is running or has run
            logger.debug("Shutdown in progress, hook left registered");
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
