package com.smartexam.paper.optimize;

import com.smartexam.paper.domain.DomainModels.PaperAst;
import com.smartexam.paper.semantic.SemanticModels.SemanticReport;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Optimization stage of the pipeline. Rewrites nothing yet: the AST is returned as given with an
 * empty change log.
 */
@Component
public class PaperOptimizer {

    public OptimizationResult optimize(PaperAst ast, SemanticReport report) {
        return new OptimizationResult(ast, List.of());
    }

    public record OptimizationChange(String code, String message) {}

    public record OptimizationResult(PaperAst ast, List<OptimizationChange> changes) {}
}
