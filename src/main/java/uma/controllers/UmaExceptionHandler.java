package uma.controllers;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uma.errors.UmaException;

/**
 * Renders protocol failures as {@code {"status":"ERROR","reason":...,"code":...}} with the code's HTTP status.
 */
@RestControllerAdvice
@Slf4j
public class UmaExceptionHandler {

    @ExceptionHandler(UmaException.class)
    public ResponseEntity<Map<String, Object>> handleUmaException(UmaException e) {
        log.debug("Responding to code={} reason={}", e.getErrorCode(), e.getReason());
        return ResponseEntity.status(e.toHttpStatusCode())
            .contentType(MediaType.APPLICATION_JSON)
            .body(e.toErrorBody());
    }
}
