package com.siteready.audit.scoring;

import com.siteready.audit.model.AggregatedScores;
import com.siteready.audit.model.ContentReport;
import com.siteready.audit.model.ContextFileReport;
import com.siteready.audit.model.PageScore;
import com.siteready.audit.model.RobotsReport;
import com.siteready.audit.model.StructuredDataItem;
import com.siteready.audit.model.StructuredDataReport;
import com.siteready.audit.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ScoreAggregator {
    static final String NO_PAGES_SUMMARY = "No pages audited successfully";

    public AggregatedScores aggregate(List<PageScore> pages, RobotsReport robots, ContextFileReport contextFile) {
        double siteWide = robots.score() + contextFile.score();
        List<PageScore> successful = pages.stream().filter(PageScore::isSuccessful).toList();
        if (successful.isEmpty()) {
            return new AggregatedScores(
                StructuredDataReport.empty(NO_PAGES_SUMMARY),
                ContentReport.empty(NO_PAGES_SUMMARY),
                ReadinessScoring.round1(siteWide)
            );
        }

        int totalWeight = 0;
        List<StructuredDataItem> items = new ArrayList<>();
        int blocks = 0;
        double structuredSum = 0;
        double contentSum = 0;
        long words = 0;
        long chars = 0;
        boolean headings = false;
        boolean lists = false;
        boolean code = false;
        int headingCount = 0;
        boolean hierarchyValid = true;
        double gradeSum = 0;
        int graded = 0;
        int chunkCount = 0;
        int avgChunkWords = 0;
        int sweetSpot = 0;
        double answerFirstSum = 0;

        for (PageScore page : successful) {
            int weight = pageWeight(page.url());
            totalWeight += weight;
            StructuredDataReport structured = page.structuredData();
            items.addAll(structured.items());
            blocks += structured.blocksFound();
            structuredSum += structured.score() * weight;

            ContentReport content = page.content();
            contentSum += content.score() * weight;
            words += content.wordCount();
            chars += content.charCount();
            headings |= content.hasHeadings();
            lists |= content.hasLists();
            code |= content.hasCodeBlocks();
            headingCount += content.headingCount();
            hierarchyValid &= content.headingHierarchyValid();
            if (content.readabilityGrade() != null) {
                gradeSum += content.readabilityGrade();
                graded++;
            }
            chunkCount += content.chunkCount();
            avgChunkWords += content.avgChunkWords();
            sweetSpot += content.chunksInSweetSpot();
            answerFirstSum += content.answerFirstRatio();
        }

        int n = successful.size();
        double structuredScore = ReadinessScoring.round1(structuredSum / totalWeight);
        double contentScore = ReadinessScoring.round1(contentSum / totalWeight);
        int avgWords = (int) (words / n);

        StructuredDataReport structuredData = new StructuredDataReport(
            blocks,
            items,
            structuredScore,
            blocks + " JSON-LD block(s) across " + n + " pages (weighted avg score " + structuredScore + ")"
        );
        ContentReport content = new ContentReport(
            avgWords,
            (int) (chars / n),
            headings,
            lists,
            code,
            headingCount / n,
            hierarchyValid,
            graded == 0 ? null : ReadinessScoring.round1(gradeSum / graded),
            chunkCount / n,
            avgChunkWords / n,
            sweetSpot / n,
            ReadinessScoring.round2(answerFirstSum / n),
            contentScore,
            "avg " + avgWords + " words across " + n + " pages (weighted avg score " + contentScore + ")"
        );
        return new AggregatedScores(
            structuredData,
            content,
            ReadinessScoring.round1(siteWide + structuredScore + contentScore)
        );
    }

    /**
     * 3 for the root and single-segment paths, 2 for two segments, 1 for anything deeper.
     */
    public static int pageWeight(String url) {
        int depth = UrlUtils.pathDepth(url);
        if (depth <= 1) {
            return 3;
        }
        if (depth == 2) {
            return 2;
        }
        return 1;
    }
}
