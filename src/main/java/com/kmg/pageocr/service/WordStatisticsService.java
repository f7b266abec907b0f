package com.kmg.pageocr.service;

import com.kmg.pageocr.model.ArtifactLayout;
import com.kmg.pageocr.model.PageRange;
import com.kmg.pageocr.model.PageText;
import com.kmg.pageocr.model.ReportOutcome;
import com.kmg.pageocr.model.WordStat;
import com.kmg.pageocr.repo.PageArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word frequency report over the recognized pages of a document.
 */
@Service
public class WordStatisticsService {
    private static final Logger log = LoggerFactory.getLogger(WordStatisticsService.class);

    public static final String PASS = "words";

    private static final Pattern WORD = Pattern.compile("\\b[a-z0-9]+\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int MIN_WORD_LENGTH = 3;

    private final PageArtifactRepository artifactRepository;
    private final CsvReportWriter csvWriter;

    public WordStatisticsService(PageArtifactRepository artifactRepository, CsvReportWriter csvWriter) {
        this.artifactRepository = artifactRepository;
        this.csvWriter = csvWriter;
    }

    public ReportOutcome generate(ArtifactLayout layout, PageRange range) throws IOException {
        WordReport report = analyze(artifactRepository.readPages(layout, range));
        if (report.totalWords() == 0) {
            return ReportOutcome.empty(PASS, report.skippedPages(), "no words found in " + range);
        }

        csvWriter.write(layout.wordReportPath(), toRows(report));
        log.info("Word report: {} words, {} unique, written to {}",
                report.totalWords(), report.words().size(), layout.wordReportPath());
        return ReportOutcome.written(PASS, layout.wordReportPath(), report.pagesAnalyzed(), report.skippedPages());
    }

    public WordReport analyze(List<PageText> pages) {
        OccurrenceCounter counter = new OccurrenceCounter();
        Map<Integer, Integer> perPage = new TreeMap<>();
        List<Integer> skipped = new ArrayList<>();
        int totalWords = 0;

        for (PageText page : pages) {
            if (!page.usable()) {
                skipped.add(page.pageIndex());
                continue;
            }
            int pageWords = 0;
            for (String word : tokenize(page.content())) {
                counter.add(word, page.pageIndex());
                pageWords++;
            }
            perPage.put(page.pageIndex(), pageWords);
            totalWords += pageWords;
        }

        List<WordStat> words = counter.ranked().stream()
                .map(ranked -> new WordStat(ranked.key(), ranked.count(), ranked.pages()))
                .toList();
        return new WordReport(totalWords, perPage.size(), perPage, words, skipped);
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() >= MIN_WORD_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private List<String[]> toRows(WordReport report) {
        List<String[]> rows = new ArrayList<>();
        rows.add(new String[]{"=== DOCUMENT SUMMARY ==="});
        rows.add(new String[]{"Type", "Value"});
        rows.add(new String[]{"Total Words", String.valueOf(report.totalWords())});
        rows.add(new String[]{"Total Pages Analyzed", String.valueOf(report.pagesAnalyzed())});
        rows.add(new String[]{"Unique Words", String.valueOf(report.words().size())});
        rows.add(CsvReportWriter.blankRow());

        rows.add(new String[]{"=== PER-PAGE WORD COUNTS ==="});
        rows.add(new String[]{"Page Number", "Word Count"});
        report.perPageCounts().forEach((page, count) ->
                rows.add(new String[]{String.valueOf(page), String.valueOf(count)}));
        rows.add(CsvReportWriter.blankRow());

        rows.add(new String[]{"=== WORD OCCURRENCE DETAILS ==="});
        rows.add(new String[]{"Word", "Total Occurrences", "Pages"});
        for (WordStat stat : report.words()) {
            rows.add(new String[]{stat.word(), String.valueOf(stat.totalOccurrences()),
                    OccurrenceCounter.formatPages(stat.pages())});
        }
        return rows;
    }

    /**
     * @param perPageCounts words per analyzed page, ascending by page
     * @param words         ranked by descending count, ties in first-seen order
     */
    public record WordReport(int totalWords, int pagesAnalyzed, Map<Integer, Integer> perPageCounts,
                             List<WordStat> words, List<Integer> skippedPages) {
    }
}
