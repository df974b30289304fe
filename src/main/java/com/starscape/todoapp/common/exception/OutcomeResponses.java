package com.starscape.todoapp.common.exception;

import com.starscape.todoapp.common.domain.Outcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.function.Function;

/**
 * Maps domain outcomes onto HTTP responses. Pure translation: no logging, no retries.
 */
public final class OutcomeResponses {

    private OutcomeResponses() {
    }

    public static <T, R> ResponseEntity<?> toResponse(
            Outcome<T> outcome, HttpStatus successStatus, Function<? super T, R> body) {
        return switch (outcome.kind()) {
            case OK -> ResponseEntity.status(successStatus).body(body.apply(outcome.value()));
            case INVALID -> GlobalExceptionHandler.respond(
                    HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", outcome.reason(), null);
            case CONFLICT -> GlobalExceptionHandler.respond(
                    HttpStatus.CONFLICT, "CONFLICT", outcome.reason(), null);
            case NOT_FOUND -> GlobalExceptionHandler.respond(
                    HttpStatus.NOT_FOUND, "NOT_FOUND", outcome.reason(), null);
        };
    }

    public static <T, R> ResponseEntity<?> ok(Outcome<T> outcome, Function<? super T, R> body) {
        return toResponse(outcome, HttpStatus.OK, body);
    }

    public static <T, R> ResponseEntity<?> created(Outcome<T> outcome, Function<? super T, R> body) {
        return toResponse(outcome, HttpStatus.CREATED, body);
    }

    public static ResponseEntity<?> notFound(String reason) {
        return GlobalExceptionHandler.respond(HttpStatus.NOT_FOUND, "NOT_FOUND", reason, null);
    }
}
