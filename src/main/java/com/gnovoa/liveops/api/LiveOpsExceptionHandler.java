package com.gnovoa.liveops.api;

import com.gnovoa.liveops.api.dto.ErrorResponse;
import com.gnovoa.liveops.core.InvalidTournamentException;
import com.gnovoa.liveops.core.LiveOpsException;
import com.gnovoa.liveops.core.NotFoundException;
import com.gnovoa.liveops.core.SolverFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.concurrent.CompletionException;

@RestControllerAdvice
public class LiveOpsExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LiveOpsExceptionHandler.class);

    @ExceptionHandler(LiveOpsException.class)
    public ResponseEntity<ErrorResponse> handle(LiveOpsException ex) {
        HttpStatus status = statusOf(ex);
        log.info("Rejected command: {} ({})", ex.getMessage(), ex.code());
        return ResponseEntity.status(status).body(new ErrorResponse(ex.code(), ex.getMessage(), ex.details()));
    }

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<ErrorResponse> handle(CompletionException ex) {
        if (ex.getCause() instanceof LiveOpsException cause) {
            return handle(cause);
        }
        log.error("Asynchronous command failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("internal_error", "Unexpected failure", List.of()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handle(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse("bad_request", ex.getMessage(), List.of()));
    }

    static HttpStatus statusOf(LiveOpsException ex) {
        if (ex instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (ex instanceof InvalidTournamentException) return HttpStatus.BAD_REQUEST;
        if (ex instanceof SolverFailureException s) {
            return "solver_infeasible".equals(s.code()) ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.CONFLICT;
    }
}
