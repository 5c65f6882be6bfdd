package me.go_gradually.voiceinterview.presentation.shared.error;

import me.go_gradually.voiceinterview.application.setup.model.SetupStepException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionException;

@RestControllerAdvice
public class ApiExceptionHandler {
    @ExceptionHandler(SetupStepException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> setupStepFailed(SetupStepException e) {
        return Map.of(
                "code", e.timedOut() ? "SETUP_STEP_TIMEOUT" : "SETUP_STEP_FAILED",
                "step", e.step() == null ? "unknown" : e.step().code(),
                "message", e.getMessage() == null ? "Setup failed" : e.getMessage()
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> invalidRequest(MethodArgumentNotValidException e) {
        return Map.of("message", "Invalid request");
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(Exception e) {
        return Map.of("message", e.getMessage() == null ? "Bad request" : e.getMessage());
    }

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, String> notFound(Exception e) {
        return Map.of("message", e.getMessage() == null ? "Not found" : e.getMessage());
    }

    /**
     * Async handlers can surface failures wrapped in a CompletionException.
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<?> unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof SetupStepException stepException) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(setupStepFailed(stepException));
        }
        if (cause instanceof NoSuchElementException) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(notFound((Exception) cause));
        }
        if (cause instanceof IllegalArgumentException || cause instanceof IllegalStateException) {
            return ResponseEntity.badRequest().body(badRequest((Exception) cause));
        }
        String message = cause == null || cause.getMessage() == null ? "Request failed" : cause.getMessage();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("message", message));
    }
}
