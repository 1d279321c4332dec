package com.example.fanout.api;

import com.example.fanout.service.InvalidNotificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidNotificationException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidNotificationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiErrorResponse.of(ApiErrorCode.BAD_REQUEST, ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiErrorResponse.of(ApiErrorCode.VALIDATION_ERROR, "request validation failed"));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingRequestHeaderException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleMalformed(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiErrorResponse.of(ApiErrorCode.BAD_REQUEST, "malformed request"));
  }

  @ExceptionHandler(NotificationAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(NotificationAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(ApiErrorResponse.of(ApiErrorCode.FORBIDDEN, ex.getMessage()));
  }

  // 再試行で回復しうる障害のみ 503 とする
  @ExceptionHandler({TransientDataAccessException.class, DataAccessResourceFailureException.class})
  public ResponseEntity<ApiErrorResponse> handleStorage(DataAccessException ex) {
    logger.error("notification storage unavailable", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ApiErrorResponse.of(ApiErrorCode.STORAGE_UNAVAILABLE, "notification storage unavailable"));
  }

  // 制約違反などは再試行しても失敗するため 500。SQL を含むメッセージは返さない
  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleStorageRejected(DataAccessException ex) {
    logger.error("notification storage rejected the request", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiErrorResponse.of(ApiErrorCode.INTERNAL_ERROR, "notification storage error"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled notification api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiErrorResponse.of(ApiErrorCode.INTERNAL_ERROR, ex.getMessage()));
  }
}
