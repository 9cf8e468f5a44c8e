package com.smartexam.paper;

import com.smartexam.paper.config.AnalysisSettings;
import com.smartexam.paper.domain.DomainModels.Crispness;
import com.smartexam.paper.domain.DomainModels.Difficulty;
import com.smartexam.paper.domain.DomainModels.QuestionNode;
import com.smartexam.paper.dsl.DslModels.PaperHeader;
import com.smartexam.paper.semantic.QuestionClassifier;
import com.smartexam.paper.semantic.SemanticAnalyzer;
import com.smartexam.paper.semantic.SemanticModels.*;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.smartexam.paper.semantic.SemanticModels.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SemanticAnalyzerTest {
    @Autowired
    private SemanticAnalyzer analyzer;
    @Autowired
    private QuestionClassifier classifier;

    private final AnalysisSettings settings = AnalysisSettings.defaults();

    @Test
    void hardKeywordsWinOverEasyAndMedium() {
        assertEquals(Difficulty.HARD, classifier.difficulty("Define a grammar and design its parser"));
        assertEquals(Difficulty.HARD, classifier.difficulty("List and EVALUATE the options"));
        assertEquals(Difficulty.MEDIUM, classifier.difficulty("State and explain Newton's laws"));
        assertEquals(Difficulty.EASY, classifier.difficulty("Name the OSI layers"));
        assertEquals(Difficulty.MEDIUM, classifier.difficulty("What is a heap?"));
    }

    @Test
    void matchesInflectedKeywords() {
        assertEquals(Difficulty.HARD, classifier.difficulty("Write a program implementing a stack"));
        assertEquals(Difficulty.HARD, classifier.difficulty("Designing a lexer"));
        assertEquals(Difficulty.EASY, classifier.difficulty("Listing the layers"));
        assertEquals(Difficulty.MEDIUM, classifier.difficulty("Briefly compared with B-trees, why are heaps used?"));
    }

    @Test
    void classifiesCrispness() {
        String verbose = "word ".repeat(101);
        assertEquals(Crispness.VERBOSE, classifier.crispness(verbose + "etc", settings));
        assertEquals(Crispness.AMBIGUOUS, classifier.crispness("Discuss sorting algorithms etc.", settings));
        assertEquals(Crispness.AMBIGUOUS, classifier.crispness("Mention protocols and so on", settings));
        assertEquals(Crispness.CRISP, classifier.crispness("Sketch a binary tree and fetch its root", settings));
    }

    @Test
    void marksValidationComparesSumWithDeclaredTotal() {
        List<QuestionNode> nodes = List.of(node("Explain stacks", 10), node("Define queue", 5));

        SemanticReport fail = analyzer.analyze(nodes, header(20, 0), "", "", settings);
        MarksCheck marks = (MarksCheck) fail.check(MARKS_VALIDATION);
        assertEquals(CheckStatus.FAIL, marks.status());
        assertEquals(15, marks.calculatedTotal());
        assertEquals(5, marks.difference());
        assertTrue(fail.warnings().contains("Marks sum mismatch: Marks mismatch: 5 marks difference"));
        assertTrue(fail.suggestions().contains("Review and correct the marks allocation to match the declared total"));

        SemanticReport pass = analyzer.analyze(nodes, header(15, 0), "", "", settings);
        assertEquals(CheckStatus.PASS, pass.check(MARKS_VALIDATION).status());
        assertEquals(15, nodes.stream().mapToInt(QuestionNode::marks).sum());

        SemanticReport undeclared = analyzer.analyze(nodes, header(0, 0), "", "", settings);
        assertEquals(CheckStatus.PASS, undeclared.check(MARKS_VALIDATION).status());
    }

    @Test
    void estimatesTimeWithBufferAndSuggestsDirection() {
        List<QuestionNode> hard = List.of(node("Design a compiler", 10), node("Implement a hash table", 10));

        SemanticReport below = analyzer.analyze(hard, header(20, 180), "", "", settings);
        TimeCheck time = (TimeCheck) below.check(TIME_ESTIMATION);
        assertEquals(88, time.estimatedTime());
        assertEquals(CheckStatus.WARN, time.status());
        assertTrue(below.suggestions().contains("Consider adding more questions or increasing difficulty"));
        assertTrue(below.warnings().contains("Time allocation mismatch: 92 minutes difference"));

        SemanticReport above = analyzer.analyze(hard, header(20, 30), "", "", settings);
        assertTrue(above.suggestions().contains("Consider increasing allotted time or reducing question complexity"));

        SemanticReport close = analyzer.analyze(hard, header(20, 100), "", "", settings);
        assertEquals(CheckStatus.PASS, close.check(TIME_ESTIMATION).status());

        SemanticReport tolerant = analyzer.analyze(hard, header(20, 180), "", "", settings.withTimeTolerance(100));
        assertEquals(CheckStatus.PASS, tolerant.check(TIME_ESTIMATION).status());
    }

    @Test
    void reportsTimeGapEvenWithoutDeclaredTime() {
        List<QuestionNode> medium = List.of(node("Explain paging", 10), node("Describe segmentation", 10));

        SemanticReport report = analyzer.analyze(medium, header(20, 0), "", "", settings);
        TimeCheck time = (TimeCheck) report.check(TIME_ESTIMATION);

        assertEquals(CheckStatus.PASS, time.status());
        assertEquals(66, time.estimatedTime());
        assertEquals(66, time.difference());
        assertTrue(report.warnings().contains("Time allocation mismatch: 66 minutes difference"));
        assertTrue(report.suggestions().contains("Consider increasing allotted time or reducing question complexity"));
        assertEquals(85, report.crispnessScore());
    }

    @Test
    void passesBalancedDifficultyDistribution() {
        List<QuestionNode> nodes = new ArrayList<>();
        for (int i = 0; i < 3; i++) nodes.add(node("Define term " + i, 2));
        for (int i = 0; i < 5; i++) nodes.add(node("Explain concept " + i, 5));
        for (int i = 0; i < 2; i++) nodes.add(node("Design system " + i, 10));

        DifficultyCheck check = (DifficultyCheck) analyzer.analyze(nodes, header(0, 0), "", "", settings).check(DIFFICULTY_DISTRIBUTION);

        assertEquals(CheckStatus.PASS, check.status());
        assertEquals(30.0, check.easyPercentage());
        assertEquals(50.0, check.mediumPercentage());
        assertEquals(20.0, check.hardPercentage());
        assertEquals(nodes.size(), check.easyCount() + check.mediumCount() + check.hardCount());
    }

    @Test
    void suggestsFixesForViolatedDifficultyBounds() {
        SemanticReport allHard = analyzer.analyze(List.of(node("Design a cache", 5), node("Construct a DFA", 5)),
                header(0, 0), "", "", settings);
        assertEquals(CheckStatus.WARN, allHard.check(DIFFICULTY_DISTRIBUTION).status());
        assertTrue(allHard.suggestions().contains("Add more easy-level questions (define, state, list)"));
        assertTrue(allHard.suggestions().contains("Reduce hard-level questions for better balance"));
        assertFalse(allHard.suggestions().contains("Add more hard-level questions (design, construct, analyze)"));

        SemanticReport allEasy = analyzer.analyze(List.of(node("Define a set", 5), node("List primes", 5), node("Explain maps", 5)),
                header(0, 0), "", "", settings);
        DifficultyCheck check = (DifficultyCheck) allEasy.check(DIFFICULTY_DISTRIBUTION);
        assertEquals(66.7, check.easyPercentage());
        assertEquals(33.3, check.mediumPercentage());
        assertTrue(allEasy.suggestions().contains("Reduce easy-level questions and add more challenging ones"));
        assertTrue(allEasy.suggestions().contains("Add more hard-level questions (design, construct, analyze)"));
    }

    @Test
    void difficultyBandsAreConfigurable() {
        List<QuestionNode> nodes = List.of(node("Design a cache", 5), node("Construct a DFA", 5));
        AnalysisSettings relaxed = settings.withDifficultyBands(0, 100, 0, 100, 0, 100);

        assertEquals(CheckStatus.PASS, analyzer.analyze(nodes, header(0, 0), "", "", relaxed).check(DIFFICULTY_DISTRIBUTION).status());
    }

    @Test
    void measuresSyllabusCoverage() {
        String source = "Q1. Explain stacks\nQ2. Compare queues and trees";

        SemanticReport partial = analyzer.analyze(List.of(node("Explain stacks", 5)), header(0, 0), source,
                "Stacks, Queues; Trees: Graphs\nSorting, BST", settings);
        CoverageCheck coverage = (CoverageCheck) partial.check(SYLLABUS_COVERAGE);
        assertEquals(CheckStatus.WARN, coverage.status());
        assertEquals(List.of("Stacks", "Queues", "Trees"), coverage.coveredTopics());
        assertEquals(List.of("Graphs", "Sorting"), coverage.uncoveredTopics());
        assertEquals(60.0, coverage.coveragePercentage());
        assertTrue(partial.warnings().contains("Syllabus topics not covered: Graphs, Sorting"));

        SemanticReport full = analyzer.analyze(List.of(node("Explain stacks", 5)), header(0, 0), source, "stacks, queues, trees", settings);
        assertEquals(CheckStatus.PASS, full.check(SYLLABUS_COVERAGE).status());

        assertEquals(CheckStatus.SKIP, analyzer.analyze(List.of(node("x", 1)), header(0, 0), source, null, settings).check(SYLLABUS_COVERAGE).status());
        CheckResult noTopics = analyzer.analyze(List.of(node("x", 1)), header(0, 0), source, "a, b; cd", settings).check(SYLLABUS_COVERAGE);
        assertEquals(CheckStatus.SKIP, noTopics.status());
        assertEquals("Could not extract topics from syllabus", noTopics.message());
    }

    @Test
    void reportsVerboseAndAmbiguousQuestions() {
        List<QuestionNode> nodes = List.of(
                node("word ".repeat(120), 5),
                node("Describe something about trees", 5),
                node("Explain heaps", 5));

        SemanticReport report = analyzer.analyze(nodes, header(15, 0), "", "", settings);
        CrispnessCheck check = (CrispnessCheck) report.check(CRISPNESS_ANALYSIS);

        assertEquals(1, check.crispCount());
        assertEquals(1, check.verboseCount());
        assertEquals(1, check.ambiguousCount());
        assertEquals(33.3, check.crispnessPercentage());
        assertEquals(CheckStatus.WARN, check.status());
        assertTrue(report.suggestions().contains("Simplify 1 verbose question(s)"));
        assertTrue(report.suggestions().contains("Clarify 1 ambiguous question(s)"));
    }

    @Test
    void scoresByDeductingPenalties() {
        List<QuestionNode> nodes = List.of(node("Explain stacks.", 10), node("Define a queue.", 10));
        SemanticReport report = analyzer.analyze(nodes, header(20, 180), "", "", settings);

        // time WARN and difficulty WARN, everything crisp
        assertEquals(75, report.crispnessScore());

        List<QuestionNode> vague = List.of(node("Design something", 10), node("Create anything", 10));
        SemanticReport worst = analyzer.analyze(vague, header(5, 500), "", "", settings);
        assertEquals(100 - 20 - 10 - 15 - 30, worst.crispnessScore());
    }

    @Test
    void scoreStaysWithinBoundsForAnyInput() {
        List<List<QuestionNode>> inputs = List.of(
                List.of(),
                List.of(node("", 0)),
                List.of(node("word ".repeat(500), 1000)),
                List.of(node("Define etc", 3), node("Implement something", 90), node("Explain", 1)));
        for (List<QuestionNode> nodes : inputs) {
            for (PaperHeader header : List.of(header(0, 0), header(1, 1), header(100, 180), header(-5, -5))) {
                int score = analyzer.analyze(nodes, header, "", "topic one, topic two", settings).crispnessScore();
                assertTrue(score >= 0 && score <= 100, "score out of range: " + score);
            }
        }
    }

    @Test
    void neverFailsOnEmptyQuestionList() {
        SemanticReport report = assertDoesNotThrow(() -> analyzer.analyze(List.of(), header(20, 60), "", null, settings));

        assertEquals(CheckStatus.SKIP, report.check(DIFFICULTY_DISTRIBUTION).status());
        assertEquals(CheckStatus.SKIP, report.check(CRISPNESS_ANALYSIS).status());
        assertEquals(CheckStatus.SKIP, report.check(SYLLABUS_COVERAGE).status());
        assertEquals(0.0, ((CrispnessCheck) report.check(CRISPNESS_ANALYSIS)).crispnessPercentage());
        assertEquals(0, report.statistics().get("total_questions"));
        // marks FAIL and time WARN only; skipped checks cost nothing
        assertEquals(100 - 20 - 10, report.crispnessScore());
    }

    @Test
    void mergeOnlyAddsFindings() {
        SemanticReport report = analyzer.analyze(List.of(node("Explain stacks.", 10)), header(10, 0), "", "", settings);
        MarksCheck replacement = new MarksCheck(CheckStatus.FAIL, "other", 0, 0, 0);
        CheckResult extra = CoverageCheck.skipped("reviewed manually");

        SemanticReport merged = report.merge(
                Map.of(MARKS_VALIDATION, replacement, "manual_review", extra),
                List.of("Reviewer note"),
                List.of("Reviewer suggestion"));

        assertSame(report.check(MARKS_VALIDATION), merged.check(MARKS_VALIDATION));
        assertSame(extra, merged.check("manual_review"));
        assertEquals(6, merged.checks().size());
        assertEquals("Reviewer note", merged.warnings().get(merged.warnings().size() - 1));
        assertEquals("Reviewer suggestion", merged.suggestions().get(merged.suggestions().size() - 1));
        assertEquals(report.crispnessScore(), merged.crispnessScore());
        assertEquals(5, report.checks().size());
    }

    private QuestionNode node(String text, int marks) {
        return classifier.classify(text, marks, 0, List.of(), settings);
    }

    private PaperHeader header(int totalMarks, int totalTime) {
        return new PaperHeader("Test", totalMarks, totalTime, "");
    }
}
