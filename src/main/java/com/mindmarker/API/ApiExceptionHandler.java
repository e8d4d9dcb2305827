package com.mindmarker.API;

import com.mindmarker.error.CompileException;
import com.mindmarker.error.QualityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns pipeline failures into JSON errors carrying the machine-readable kind.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(CompileException.class)
    public ResponseEntity<Map<String, Object>> handleCompile(CompileException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("Compilation failed: {}", e.getMessage(), e);
        } else {
            log.info("Compilation refused ({}): {}", e.getKind(), e.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("kind", e.getKind().name());
        if (e instanceof QualityException) {
            body.put("issues", ((QualityException) e).getReport().getIssues());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleTooLarge(MaxUploadSizeExceededException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Upload too large");
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(body);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, Object>> handleIo(IOException e) {
        log.error("Could not read upload", e);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Could not read upload: " + e.getMessage());
        return ResponseEntity.internalServerError().body(body);
    }

    static HttpStatus statusFor(CompileException e) {
        switch (e.getKind()) {
            case DECODE:
            case DIMENSION:
            case FORMAT:
                return HttpStatus.BAD_REQUEST;
            case QUALITY:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
