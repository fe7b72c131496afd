package com.mk.fx.qa.evidence.resource;

import com.mk.fx.qa.evidence.cfg.ErrorResponse;
import com.mk.fx.qa.evidence.model.EvidenceStateException;
import java.io.IOException;
import java.io.UncheckedIOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid Argument", ex.getMessage()));
  }

  @ExceptionHandler(EvidenceStateException.class)
  public ResponseEntity<ErrorResponse> handleState(EvidenceStateException ex) {
    log.warn("Invalid lifecycle call: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ErrorResponse("Conflict", ex.getMessage()));
  }

  @ExceptionHandler({IOException.class, UncheckedIOException.class})
  public ResponseEntity<ErrorResponse> handleStorage(Exception ex) {
    log.error("Evidence storage failure", ex);
    return ResponseEntity.internalServerError()
        .body(new ErrorResponse("Storage Error", ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unhandled exception", ex);
    return ResponseEntity.internalServerError()
        .body(new ErrorResponse("Server Error", ex.getMessage()));
  }
}
