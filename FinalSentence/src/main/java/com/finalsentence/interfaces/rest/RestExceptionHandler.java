package com.finalsentence.interfaces.rest;

import com.finalsentence.dto.ErrorMessage;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RestExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

  // room or player not found (404)
  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ErrorMessage> notFound(NoSuchElementException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorMessage(e.getMessage()));
  }

  // room full, round already running (409)
  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorMessage> conflict(IllegalStateException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorMessage(e.getMessage()));
  }

  @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
  public ResponseEntity<ErrorMessage> badRequest(Exception e) {
    return ResponseEntity.badRequest().body(new ErrorMessage(e.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorMessage> unexpected(Exception e) {
    log.error("Unhandled request failure", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorMessage("Internal server error"));
  }
}
