package aquabase.app.api;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import aquabase.app.error.AutomationException;
import aquabase.app.error.ConflictException;
import aquabase.app.error.DependencyException;
import aquabase.app.error.ValidationException;
import aquabase.app.provider.Metrics;

/**
 * Maps domain errors onto HTTP statuses by their kind.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @Autowired
    private Logger log;

    @ExceptionHandler(AutomationException.class)
    public ResponseEntity<Map<String, Object>> handleAutomation(AutomationException e) {
        final Map<String, Object> body = errorBody(e.getMessage());
        body.put("kind", e.getKind().name());
        if (e instanceof ConflictException) {
            body.put("reason", ((ConflictException) e).getReason().name());
            body.put("ownership", ((ConflictException) e).getOwnership().name());
        } else if (e instanceof DependencyException) {
            body.put("dependents", ((DependencyException) e).getDependents());
        }
        log.warn("{}: {}", e.getKind(), e.getMessage());
        Metrics.getInstance().postMetric("api_error", Map.of("kind", e.getKind().name().toLowerCase()));
        return ResponseEntity.status(e.getKind().getHttpStatus()).body(body);
    }

    /**
     * Validation raised while reading the body, such as an unknown operator, keeps
     * its own message.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        final Throwable root = ExceptionUtils.getRootCause(e);
        final String message = root instanceof ValidationException ? root.getMessage() : "Malformed request body";
        log.warn("Unreadable request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(message));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(MethodArgumentNotValidException e) {
        final String message = e.getBindingResult().getFieldErrors().stream()
            .map(f -> f.getField() + " " + f.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request");
        return ResponseEntity.badRequest().body(errorBody(message));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingOwner(MissingRequestHeaderException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(errorBody("Missing header " + e.getHeaderName()));
    }

    private static Map<String, Object> errorBody(String message) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return body;
    }
}
