package com.bakureserve.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // 400 - @RequestBody 검증 실패
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleInvalid(MethodArgumentNotValidException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        List<Map<String, Object>> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> {
                    Map<String, Object> error = new HashMap<>();
                    error.put("field", fe.getField());
                    error.put("rejected", fe.getRejectedValue());
                    error.put("reason", fe.getDefaultMessage());
                    return error;
                })
                .collect(Collectors.toList());
        ProblemDetail pd = base(status, "Request body is invalid.", req);
        pd.setTitle("Validation failed");
        pd.setProperty("errors", errors);
        log.warn("400 Validation {} -> {}", req.getRequestURI(), errors);
        return ResponseEntity.status(status).body(pd);
    }

    // 400 - 잘못된 인자 / 읽을 수 없는 본문
    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail pd = base(status, ex.getMessage(), req);
        pd.setTitle("Bad Request");
        log.warn("400 {} -> {}", req.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(status).body(pd);
    }

    // 404 - 세션/프롬프트/식당 없음
    @ExceptionHandler(ConciergeNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(ConciergeNotFoundException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.NOT_FOUND;
        ProblemDetail pd = base(status, ex.getMessage(), req);
        pd.setTitle("Not Found");
        log.warn("404 {} -> {}", req.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(status).body(pd);
    }

    // 500 - 스택 트레이스는 로그에만 남김
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemDetail pd = base(status, "Unexpected server error.", req);
        pd.setTitle("Internal Server Error");
        log.error("500 at {}", req.getRequestURI(), ex);
        return ResponseEntity.status(status).body(pd);
    }

    private ProblemDetail base(HttpStatus status, String detail, HttpServletRequest req) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setProperty("path", req.getRequestURI());
        pd.setProperty("timestamp", OffsetDateTime.now().toString());
        return pd;
    }
}
