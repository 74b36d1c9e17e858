package org.devops.customers.rest;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.devops.customers.exception.CustomerConflictException;
import org.devops.customers.exception.CustomerNotFoundException;
import org.devops.customers.exception.CustomerServiceException;
import org.devops.customers.exception.ServiceUnavailableException;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler that translates exceptions into RFC 7807 Problem Details.
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
@RequestMapping(
    produces = {MediaType.APPLICATION_JSON_VALUE, MediaType.APPLICATION_PROBLEM_JSON_VALUE})
public class ExceptionTranslator {

  private static final String ERROR_BASE_URL = "https://api.example.com/errors/";
  private static final String ERROR_CODE = "errorCode";
  private static final String TIMESTAMP = "timestamp";
  private static final int MAX_STACK_TRACE_LENGTH = 5000;
  private final Environment env;

  /** Custom exceptions raised by the service layer */
  @ExceptionHandler(CustomerNotFoundException.class)
  public ResponseEntity<ProblemDetail> handleCustomerNotFound(
      RuntimeException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.NOT_FOUND, "Customer Not Found", ex, request);
  }

  @ExceptionHandler(CustomerConflictException.class)
  public ResponseEntity<ProblemDetail> handleCustomerConflict(
      RuntimeException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.CONFLICT, "Customer Conflict", ex, request);
  }

  @ExceptionHandler(ServiceUnavailableException.class)
  public ResponseEntity<ProblemDetail> handleServiceUnavailable(
      RuntimeException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex, request);
  }

  @ExceptionHandler(CustomerServiceException.class)
  public ResponseEntity<ProblemDetail> handleServiceGeneric(
      RuntimeException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Error", ex, request);
  }

  /** GENERIC SPRING EXCEPTIONS */

  /**
   * Handles bean validation failures on a request body. Each rejected field is listed with its
   * rejected value and message.
   */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ProblemDetail> handleValidationException(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Validation Error", ex, request);
    problemDetail.setDetail("Invalid customer: " + ex.getBindingResult().getFieldErrorCount()
        + " field(s) rejected");
    problemDetail.setProperty(
        "errors",
        ex.getBindingResult().getFieldErrors().stream()
            .map(
                error ->
                    Map.of(
                        "field", Optional.ofNullable(error.getField()).orElse("unknown"),
                        "rejectedValue",
                            Optional.ofNullable(error.getRejectedValue())
                                .map(Object::toString)
                                .orElse("null"),
                        "message",
                            Optional.ofNullable(error.getDefaultMessage()).orElse("No message"),
                        "errorCode", Optional.ofNullable(error.getCode()).orElse("UNKNOWN_CODE")))
            .toList());
    return ResponseEntity.badRequest().body(problemDetail);
  }

  /** Handles a missing, empty or malformed JSON request body. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleJsonParseError(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Malformed JSON", ex, request);
    String errorDetail =
        Optional.ofNullable(ex.getMostSpecificCause())
            .map(cause -> "JSON parsing error: " + cause.getMessage())
            .orElse("Malformed JSON input: " + ex.getMessage());

    problemDetail.setDetail(errorDetail);
    return ResponseEntity.badRequest().body(problemDetail);
  }

  /**
   * Handles constraint violations raised by the service when it validates a replacement customer.
   * Rendered like a rejected request body.
   */
  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ProblemDetail> handleConstraintViolation(
      ConstraintViolationException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Validation Error", ex, request);
    var violations = Optional.ofNullable(ex.getConstraintViolations()).orElse(Set.of());
    problemDetail.setDetail("Invalid customer: " + violations.size() + " field(s) rejected");
    problemDetail.setProperty(
        "errors",
        violations.stream()
            .sorted(Comparator.comparing(
                (ConstraintViolation<?> violation) -> violation.getPropertyPath().toString()))
            .map(
                violation ->
                    Map.of(
                        "field", violation.getPropertyPath().toString(),
                        "rejectedValue", String.valueOf(violation.getInvalidValue()),
                        "message", Optional.ofNullable(violation.getMessage()).orElse("No message"),
                        "errorCode", constraintName(violation)))
            .toList());
    return ResponseEntity.badRequest().body(problemDetail);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex, request);
  }

  /** Handles unsupported HTTP methods, e.g. POST on the service root. */
  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", ex, request);
    ResponseEntity.BodyBuilder response = ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED);
    if (ex.getSupportedHttpMethods() != null) {
      response.allow(ex.getSupportedHttpMethods().toArray(new HttpMethod[0]));
    }
    return response.body(problemDetail);
  }

  /** Handles a missing or non-JSON Content-Type on endpoints that consume JSON. */
  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
    ProblemDetail problemDetail = createBaseProblemDetail(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UNSUPPORTED_MEDIA_TYPE", ex, request);
    problemDetail.setDetail("Content-Type must be " + MediaType.APPLICATION_JSON_VALUE);
    return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).body(problemDetail);
  }

  @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
  public ResponseEntity<ProblemDetail> handleMediaTypeNotAccepted(
      HttpMediaTypeNotAcceptableException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.NOT_ACCEPTABLE, "NOT_ACCEPTABLE", ex, request);
  }

  /** Handles path variables and query parameters that cannot be converted, e.g. a non-numeric id. */
  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ProblemDetail> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Invalid Parameter", ex, request);

    problemDetail.setProperty("parameter", ex.getName());
    problemDetail.setProperty(
        "expectedType",
        ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "Unknown");
    problemDetail.setProperty("invalidValue", String.valueOf(ex.getValue()));

    return ResponseEntity.badRequest().body(problemDetail);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ProblemDetail> handleNoResource(
      NoResourceFoundException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.NOT_FOUND, "Not Found", ex, request);
  }

  /**
   * Catch-all handler for all other exceptions, returning a 500 Internal Server Error.
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(
      Exception ex, HttpServletRequest request) {
    log.error("Unexpected error occurred", ex);
    return buildErrorResponse(
        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex, request);
  }

  private String constraintName(ConstraintViolation<?> violation) {
    if (violation.getConstraintDescriptor() == null) {
      return "UNKNOWN_CODE";
    }
    return violation.getConstraintDescriptor().getAnnotation().annotationType().getSimpleName();
  }

  private ResponseEntity<ProblemDetail> buildErrorResponse(
      HttpStatus status, String title, Exception ex, HttpServletRequest request) {
    ProblemDetail problemDetail = createBaseProblemDetail(status, title, ex, request);
    return ResponseEntity.status(status).body(problemDetail);
  }

  private ProblemDetail createBaseProblemDetail(
      HttpStatus status, String title, Exception ex, HttpServletRequest request) {
    log.debug("Rendering {} for {} {}: {}", status.value(), request.getMethod(),
        request.getRequestURI(), ex.getMessage());
    ProblemDetail problemDetail = ProblemDetail.forStatus(status);
    problemDetail.setTitle(title);
    problemDetail.setDetail(ex.getMessage());
    problemDetail.setType(URI.create(ERROR_BASE_URL + status.value()));
    problemDetail.setInstance(URI.create(request.getRequestURI()));
    problemDetail.setProperty(ERROR_CODE, title.toUpperCase().replace(" ", "_"));
    problemDetail.setProperty(TIMESTAMP, Instant.now());

    addDebugInfo(problemDetail, ex);
    addRequestMetadata(problemDetail, request);

    return problemDetail;
  }

  /** Adds the exception class and a truncated stack trace under the dev profile. */
  private void addDebugInfo(ProblemDetail detail, Exception ex) {
    if (env.acceptsProfiles(Profiles.of("dev"))) {
      detail.setProperty("exception", ex.getClass().getName());
      String fullStackTrace = ExceptionUtils.getStackTrace(ex);
      String truncatedStackTrace =
          fullStackTrace.length() > MAX_STACK_TRACE_LENGTH
              ? fullStackTrace.substring(0, MAX_STACK_TRACE_LENGTH) + "..."
              : fullStackTrace;
      detail.setProperty("stackTrace", truncatedStackTrace);
    }
  }

  private void addRequestMetadata(ProblemDetail detail, HttpServletRequest request) {
    Map<String, String> metadata =
        Map.of(
            "clientIp", Optional.ofNullable(request.getRemoteAddr()).orElse(""),
            "httpMethod", request.getMethod(),
            "requestPath", request.getRequestURI(),
            "userAgent", Optional.ofNullable(request.getHeader("User-Agent")).orElse(""),
            "requestId", Optional.ofNullable(request.getHeader("X-Request-Id")).orElse(""),
            "forwardedFor", Optional.ofNullable(request.getHeader("X-Forwarded-For")).orElse(""),
            "protocol", Optional.ofNullable(request.getProtocol()).orElse(""),
            "scheme", Optional.ofNullable(request.getScheme()).orElse(""),
            "isSecure", String.valueOf(request.isSecure()));
    detail.setProperty("request", metadata);
  }
}
