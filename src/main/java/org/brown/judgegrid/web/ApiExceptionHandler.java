package org.brown.judgegrid.web;

import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.service.InvalidSubmissionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 요청 오류 -> HTTP 400 매핑
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidSubmissionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSubmission(InvalidSubmissionException e) {
        log.warn("[REJECT][VALIDATION] {}", e.getMessage());
        return badRequest(e.getErrors());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("[REJECT][JSON_PARSE] {}", e.getMostSpecificCause().getMessage());
        return badRequest(List.of("request body is not valid JSON"));
    }

    private ResponseEntity<Map<String, Object>> badRequest(List<String> errors) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Validation failed");
        body.put("errors", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
