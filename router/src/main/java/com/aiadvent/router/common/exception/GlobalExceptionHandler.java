package com.aiadvent.router.common.exception;

import com.aiadvent.router.dispatch.exception.AllCandidatesFailedException;
import com.aiadvent.router.dispatch.exception.RequestValidationException;
import com.aiadvent.router.dispatch.exception.RoutingConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    return badRequest("Validation failed", resolveValidationMessage(ex));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadablePayload(HttpMessageNotReadableException ex) {
    return badRequest("Validation failed", "Malformed request payload");
  }

  @ExceptionHandler(RequestValidationException.class)
  public ResponseEntity<ProblemDetail> handleRequestValidation(RequestValidationException ex) {
    return badRequest("Validation failed", ex.getMessage());
  }

  @ExceptionHandler(RoutingConfigurationException.class)
  public ResponseEntity<ProblemDetail> handleRoutingConfiguration(
      RoutingConfigurationException ex) {
    return badRequest("Invalid routing options", ex.getMessage());
  }

  @ExceptionHandler(AllCandidatesFailedException.class)
  public ResponseEntity<ProblemDetail> handleAllCandidatesFailed(AllCandidatesFailedException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("All candidates failed");
    problem.setDetail(ex.getMessage());
    problem.setProperty("fingerprint", ex.fingerprint());
    problem.setProperty("attemptedCandidates", ex.attemptedCandidates());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private ResponseEntity<ProblemDetail> badRequest(String title, String detail) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return ResponseEntity.badRequest().body(problem);
  }

  private String resolveValidationMessage(Exception ex) {
    if (ex instanceof MethodArgumentNotValidException methodArgumentNotValidException) {
      return methodArgumentNotValidException.getBindingResult().getFieldErrors().stream()
          .findFirst()
          .map(
              error ->
                  error.getDefaultMessage() != null
                      ? error.getDefaultMessage()
                      : "Invalid request payload")
          .orElse("Invalid request payload");
    }
    if (ex instanceof BindException bindException) {
      return bindException.getBindingResult().getAllErrors().stream()
          .findFirst()
          .map(
              error ->
                  error.getDefaultMessage() != null
                      ? error.getDefaultMessage()
                      : "Invalid request payload")
          .orElse("Invalid request payload");
    }
    return "Invalid request payload";
  }
}
