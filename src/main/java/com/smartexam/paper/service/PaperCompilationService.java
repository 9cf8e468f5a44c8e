package com.smartexam.paper.service;

import com.smartexam.paper.config.AnalysisSettings;
import com.smartexam.paper.domain.DomainModels.PaperAst;
import com.smartexam.paper.dsl.DslFormatter;
import com.smartexam.paper.dsl.DslModels.DslDocument;
import com.smartexam.paper.export.AstDotRenderer;
import com.smartexam.paper.normalize.TextNormalizer;
import com.smartexam.paper.optimize.PaperOptimizer;
import com.smartexam.paper.optimize.PaperOptimizer.OptimizationChange;
import com.smartexam.paper.optimize.PaperOptimizer.OptimizationResult;
import com.smartexam.paper.parser.AstBuilder;
import com.smartexam.paper.parser.MarkupTokenizer;
import com.smartexam.paper.parser.ParserDtos.Token;
import com.smartexam.paper.semantic.SemanticAnalyzer;
import com.smartexam.paper.semantic.SemanticModels.SemanticReport;
import com.smartexam.paper.semantic.SyllabusTopics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline entry point: normalize, format, tokenize, build, analyze, optimize.
 * Each stage consumes the complete output of the previous one; all run state is local to a call.
 */
@Service
public class PaperCompilationService {
    private static final Logger log = LoggerFactory.getLogger(PaperCompilationService.class);

    private final TextNormalizer normalizer;
    private final DslFormatter formatter;
    private final MarkupTokenizer tokenizer;
    private final AstBuilder astBuilder;
    private final SemanticAnalyzer analyzer;
    private final PaperOptimizer optimizer;
    private final AstDotRenderer dotRenderer;
    private final AnalysisSettings defaultSettings;

    public PaperCompilationService(TextNormalizer normalizer,
                                   DslFormatter formatter,
                                   MarkupTokenizer tokenizer,
                                   AstBuilder astBuilder,
                                   SemanticAnalyzer analyzer,
                                   PaperOptimizer optimizer,
                                   AstDotRenderer dotRenderer,
                                   AnalysisSettings defaultSettings) {
        this.normalizer = normalizer;
        this.formatter = formatter;
        this.tokenizer = tokenizer;
        this.astBuilder = astBuilder;
        this.analyzer = analyzer;
        this.optimizer = optimizer;
        this.dotRenderer = dotRenderer;
        this.defaultSettings = defaultSettings;
    }

    public PaperCompilationResult compile(PaperInput input) {
        return compile(input, defaultSettings);
    }

    public PaperCompilationResult compile(PaperInput input, AnalysisSettings settings) {
        List<StageTrace> stages = new ArrayList<>();

        String cleanText = normalizer.normalize(input.content());
        stages.add(trace("normalize", cleanText.lines().count() + " lines"));

        DslDocument dsl = formatter.format(cleanText, input.syllabusPath(), settings);
        stages.add(trace("format", dsl.questions().size() + " questions"));

        List<Token> tokens = tokenizer.tokenize(dsl.markup());
        stages.add(trace("tokenize", tokens.size() + " tokens"));

        List<String> topics = SyllabusTopics.extract(input.syllabus(), settings);
        PaperAst ast = astBuilder.build(tokens, topics, settings);
        stages.add(trace("build_ast", ast.size() + " nodes" + (ast.synthesized() ? " (synthesized)" : "")));

        SemanticReport report = analyzer.analyze(ast.questions(), dsl.header(), cleanText, input.syllabus(), settings);
        stages.add(trace("semantic_analysis", report.warnings().size() + " warnings, score " + report.crispnessScore()));

        OptimizationResult optimized = optimizer.optimize(ast, report);
        stages.add(trace("optimize", optimized.changes().size() + " changes"));

        log.info("Compiled paper '{}': {} questions, score {}",
                dsl.header().subject(), optimized.ast().size(), report.crispnessScore());
        return new PaperCompilationResult(cleanText, dsl, tokens, optimized.ast(), report, optimized.changes(), stages);
    }

    public String renderAst(PaperInput input) {
        PaperCompilationResult result = compile(input);
        return dotRenderer.render(result.dsl().header().subject(), result.ast());
    }

    private StageTrace trace(String stage, String detail) {
        log.debug("Stage {} done: {}", stage, detail);
        return new StageTrace(stage, detail);
    }

    public record PaperInput(String content, String syllabus, String syllabusPath) {}

    public record StageTrace(String stage, String detail) {}

    public record PaperCompilationResult(String cleanText,
                                         DslDocument dsl,
                                         List<Token> tokens,
                                         PaperAst ast,
                                         SemanticReport report,
                                         List<OptimizationChange> optimizationLog,
                                         List<StageTrace> stages) {}
}
