package com.meisai.mapping.exception;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MeisaiException.class)
    public ResponseEntity<Map<String, Object>> handleMeisai(MeisaiException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.error("{}: {}", ex.getKind(), ex.getMessage(), ex);
        } else if (ex.getKind() == ErrorKind.MAPPING_CONFLICT) {
            log.info("{}: {} {}", ex.getKind(), ex.getMessage(), ex.getContext());
        } else {
            log.debug("{}: {}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(body(ex.getKind(), ex.getMessage(), ex.getContext()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(body(ErrorKind.VALIDATION_ERROR, ex.getMessage(), Map.of()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        if (kind.isNotFound()) {
            return HttpStatus.NOT_FOUND;
        }
        return switch (kind) {
            case VALIDATION_ERROR, ROW_PARSE_ERROR -> HttpStatus.BAD_REQUEST;
            case MAPPING_CONFLICT -> HttpStatus.CONFLICT;
            case STREAM_ERROR -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STORAGE_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Map<String, Object> body(ErrorKind kind, String message, Map<String, Object> context) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("error", kind.name());
        body.put("message", message);
        body.put("context", context);
        return body;
    }
}
