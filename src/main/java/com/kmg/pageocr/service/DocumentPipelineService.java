package com.kmg.pageocr.service;

import com.kmg.pageocr.config.PipelineConfig;
import com.kmg.pageocr.engine.DocumentHandle;
import com.kmg.pageocr.engine.PageRasterizer;
import com.kmg.pageocr.model.ArtifactLayout;
import com.kmg.pageocr.model.DocumentRunResult;
import com.kmg.pageocr.model.PageFailure;
import com.kmg.pageocr.model.PageRange;
import com.kmg.pageocr.model.PageSelection;
import com.kmg.pageocr.model.PageUnit;
import com.kmg.pageocr.model.ReportOutcome;
import com.kmg.pageocr.model.RunTally;
import com.kmg.pageocr.model.SelectionMode;
import com.kmg.pageocr.model.SourceDocument;
import com.kmg.pageocr.repo.PageArtifactRepository;
import com.kmg.pageocr.repo.RunReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One full cycle for a single document: validate, resolve pending pages, schedule them, then
 * aggregate and write the run report.
 */
@Service
public class DocumentPipelineService {
    private static final Logger log = LoggerFactory.getLogger(DocumentPipelineService.class);

    public static final String OUTPUT_SUFFIX = "_processed";

    private final PageRasterizer rasterizer;
    private final PageArtifactRepository artifactRepository;
    private final PageUnitResolver resolver;
    private final PipelineScheduler scheduler;
    private final AggregationService aggregationService;
    private final RunReportRepository runReportRepository;

    public DocumentPipelineService(
            PageRasterizer rasterizer,
            PageArtifactRepository artifactRepository,
            PageUnitResolver resolver,
            PipelineScheduler scheduler,
            AggregationService aggregationService,
            RunReportRepository runReportRepository
    ) {
        this.rasterizer = rasterizer;
        this.artifactRepository = artifactRepository;
        this.resolver = resolver;
        this.scheduler = scheduler;
        this.aggregationService = aggregationService;
        this.runReportRepository = runReportRepository;
    }

    /**
     * Default output folder of a document: {@code <sanitized stem>_processed} under {@code outputRoot}.
     */
    public static Path outputDirectoryFor(Path outputRoot, Path document) {
        return outputRoot.resolve(outputNameFor(document));
    }

    public static String outputNameFor(Path document) {
        return sanitize(stem(document)) + OUTPUT_SUFFIX;
    }

    static String stem(Path document) {
        String name = document.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static String sanitize(String name) {
        String sanitized = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return sanitized.isEmpty() ? "document" : sanitized;
    }

    public static boolean isPdf(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    public DocumentRunResult run(Path pdf, Path outputDir, PageSelection selection, PipelineConfig config) {
        OffsetDateTime startedAt = OffsetDateTime.now(ZoneOffset.UTC);
        SourceDocument document = inspect(pdf, config);
        ArtifactLayout layout = new ArtifactLayout(outputDir.toAbsolutePath().normalize(), config.imageFormat());

        try {
            artifactRepository.prepare(layout);
        } catch (IOException e) {
            throw new PipelineSetupException("Cannot create output directory " + layout.root() + ": " + e.getMessage(), e);
        }

        int lastCompleted = resolver.lastCompletedPage(layout);
        PageRange workRange;
        try {
            workRange = selection.workRange(document.pageCount(), lastCompleted);
        } catch (IllegalArgumentException e) {
            throw new PipelineSetupException(e.getMessage(), e);
        }

        log.info("Document: {} ({} pages, {} dpi, language '{}')",
                document.name(), document.pageCount(), document.dpi(), document.languageHint());
        log.info("Output: {}", layout.root());
        if (selection.mode() == SelectionMode.RESUME) {
            log.info("Last completed page: {}", lastCompleted);
        }

        List<PageUnit> pending = resolver.pendingUnits(document, layout, workRange);
        if (workRange.isEmpty()) {
            log.info("All {} pages already processed, nothing to schedule", document.pageCount());
        } else {
            log.info("Pages {}: {} pending, {} already complete", workRange, pending.size(), workRange.size() - pending.size());
        }

        RunTally tally = scheduler.run(pending, config);
        logSummary(document, tally);

        List<ReportOutcome> reports = List.of();
        if (tally.successCount() > 0) {
            reports = aggregationService.aggregate(layout, selection.reportRange(document.pageCount()));
        } else {
            log.info("No page succeeded in this run, skipping aggregation");
        }

        DocumentRunResult result = new DocumentRunResult(document, layout.root(), workRange, pending.size(), tally, reports);
        runReportRepository.write(layout, toRunReport(result, selection, startedAt));
        return result;
    }

    private SourceDocument inspect(Path pdf, PipelineConfig config) {
        if (!Files.exists(pdf)) {
            throw new PipelineSetupException("Input file not found: " + pdf);
        }
        if (!Files.isRegularFile(pdf) || !isPdf(pdf)) {
            throw new PipelineSetupException("Not a PDF file: " + pdf);
        }

        int pageCount;
        try (DocumentHandle handle = rasterizer.open(pdf)) {
            pageCount = handle.pageCount();
        } catch (PageRasterizer.RenderException e) {
            throw new PipelineSetupException("Cannot read PDF " + pdf.getFileName() + ": " + e.getMessage(), e);
        }
        if (pageCount <= 0) {
            throw new PipelineSetupException("PDF contains 0 pages: " + pdf.getFileName());
        }
        return new SourceDocument(pdf.toAbsolutePath().normalize(), pageCount, config.language(), config.dpi());
    }

    private void logSummary(SourceDocument document, RunTally tally) {
        log.info("PROCESSING SUMMARY for {}: submitted={}, succeeded={}, failed={}, skipped={}, elapsed={}s",
                document.name(), tally.submitted(), tally.successCount(), tally.failureCount(), tally.skippedCount(),
                String.format(Locale.ROOT, "%.2f", tally.elapsed().toMillis() / 1000.0));

        List<PageFailure> failures = tally.failures();
        if (failures.isEmpty()) {
            return;
        }
        StringBuilder report = new StringBuilder("DETAILED FAILURE REPORT (").append(failures.size()).append(" page(s))");
        for (PageFailure failure : failures) {
            report.append("\n  Page ").append(failure.pageIndex()).append(": ").append(failure.message());
        }
        log.warn(report.toString());
    }

    private Map<String, Object> toRunReport(DocumentRunResult result, PageSelection selection, OffsetDateTime startedAt) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("document", result.document().path().toString());
        report.put("outputDir", result.outputDir().toString());
        report.put("pageCount", result.document().pageCount());
        report.put("mode", selection.mode().name());
        report.put("workRange", result.workRange().isEmpty() ? null : result.workRange().toString());
        report.put("pendingPages", result.pendingPages());
        report.put("startedAt", startedAt.toString());
        report.put("endedAt", OffsetDateTime.now(ZoneOffset.UTC).toString());

        RunTally tally = result.tally();
        Map<String, Object> tallyReport = new LinkedHashMap<>();
        tallyReport.put("submitted", tally.submitted());
        tallyReport.put("success", tally.successCount());
        tallyReport.put("failure", tally.failureCount());
        tallyReport.put("skipped", tally.skippedCount());
        tallyReport.put("elapsedMillis", tally.elapsed().toMillis());
        report.put("tally", tallyReport);

        List<Map<String, Object>> failures = new ArrayList<>();
        for (PageFailure failure : tally.failures()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("page", failure.pageIndex());
            entry.put("error", failure.message());
            failures.add(entry);
        }
        report.put("failures", failures);

        List<Map<String, Object>> reports = new ArrayList<>();
        for (ReportOutcome outcome : result.reports()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("pass", outcome.pass());
            entry.put("status", outcome.status().name());
            entry.put("path", outcome.path() == null ? null : outcome.path().toString());
            entry.put("pagesUsed", outcome.pagesUsed());
            entry.put("skippedPages", outcome.skippedPages());
            entry.put("detail", outcome.detail());
            reports.add(entry);
        }
        report.put("reports", reports);
        return report;
    }
}
