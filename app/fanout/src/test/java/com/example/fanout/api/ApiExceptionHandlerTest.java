package com.example.fanout.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.fanout.service.InvalidNotificationException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void handleInvalidRequestReturns400() {
    final var response = handler.handleInvalidRequest(new InvalidNotificationException("bad"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).isEqualTo(new ApiErrorResponse("BAD_REQUEST", "bad"));
  }

  @Test
  void handleValidationReturns400() {
    final var response = handler.handleValidation((MethodArgumentNotValidException) null);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().code()).isEqualTo("VALIDATION_ERROR");
  }

  @Test
  void handleAccessDeniedReturns403() {
    final var response =
        handler.handleAccessDenied(new NotificationAccessDeniedException("tenant"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(response.getBody().message()).contains("tenant");
  }

  @Test
  void handleStorageReturns503WithoutLeakingCause() {
    final var response = handler.handleStorage(new QueryTimeoutException("select took too long"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().code()).isEqualTo("STORAGE_UNAVAILABLE");
    assertThat(response.getBody().message()).doesNotContain("select");
  }

  @Test
  void handleStorageReturns503ForConnectionFailure() {
    final var response =
        handler.handleStorage(new DataAccessResourceFailureException("connection refused"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
  }

  @Test
  void handleStorageRejectedReturns500ForConstraintViolation() {
    final var response =
        handler.handleStorageRejected(
            new DataIntegrityViolationException(
                "ERROR: value too long for type character varying(255)"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo("INTERNAL_ERROR");
    assertThat(response.getBody().message()).doesNotContain("varying");
  }

  @Test
  void handleRuntimeReturns500() {
    final var response = handler.handleRuntime(new IllegalStateException("oops"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo("INTERNAL_ERROR");
  }
}
