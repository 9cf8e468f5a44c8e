package com.smartexam.paper.api;

import com.smartexam.paper.normalize.EmptyInputException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(EmptyInputException.class)
    public ResponseEntity<ProblemDetail> handleEmptyInput(EmptyInputException ex, HttpServletRequest request) {
        logger.warn("Rejected paper content on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(problem("Content Error", ex.getMessage(), request));
    }

    @ExceptionHandler(PaperSourceException.class)
    public ResponseEntity<ProblemDetail> handleUnreadableSource(PaperSourceException ex, HttpServletRequest request) {
        logger.warn("Unreadable upload on {}", request.getRequestURI(), ex);
        return ResponseEntity.badRequest().body(problem("Unreadable Source", ex.getMessage(), request));
    }

    private ProblemDetail problem(String title, String detail, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle(title);
        problem.setInstance(URI.create(request.getRequestURI()));
        return problem;
    }
}
