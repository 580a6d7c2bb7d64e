/*
 * Where: notification service API
 * What: maps inbox and contest catalog exceptions to HTTP responses
 * Why: callers tell an unknown notification or contest (404) from a malformed request (400)
 */
package com.cplite.notification.api;

import com.cplite.notification.service.ContestNotFoundException;
import com.cplite.notification.service.NotificationNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(NotificationNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(NotificationNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.NOTIFICATION_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(ContestNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleContestNotFound(ContestNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.CONTEST_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return ResponseEntity.badRequest()
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, ex.getName() + " is malformed"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return ResponseEntity.badRequest()
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, ex.getMessage()));
  }
}
