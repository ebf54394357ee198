package com.scholary.audio.upload.api;

import com.scholary.audio.upload.assembly.AssemblyException;
import com.scholary.audio.upload.objectstore.ObjectStoreException;
import java.io.IOException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Converts exceptions to {@link ErrorResponse} bodies.
 *
 * <p>Typed assembly errors keep their code so clients can tell "restart the upload" from "retry
 * the call".
 */
@RestControllerAdvice(basePackages = "com.scholary.audio.upload")
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(AssemblyException.class)
  public ResponseEntity<ErrorResponse> handleAssemblyException(AssemblyException ex) {
    HttpStatus status = statusFor(ex.getErrorCode());
    LOGGER.warn("Assembly error: {} - {}", ex.getErrorCode(), ex.getMessage());
    return ResponseEntity.status(status)
        .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), ex.isRetryable()));
  }

  @ExceptionHandler(ObjectStoreException.class)
  public ResponseEntity<ErrorResponse> handleObjectStoreException(ObjectStoreException ex) {
    if (ex.isNotFound()) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(new ErrorResponse("NotFound", ex.getMessage(), false));
    }
    LOGGER.warn("Storage error: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ErrorResponse("StorageFailure", ex.getMessage(), true));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return invalidRequest(message);
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
    return invalidRequest(ex.getMessage());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException ex) {
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(new ErrorResponse("ChunkTooLarge", ex.getMessage(), false));
  }

  @ExceptionHandler(IOException.class)
  public ResponseEntity<ErrorResponse> handleIoFailure(IOException ex) {
    LOGGER.error("I/O failure while handling request", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("IoFailure", ex.getMessage(), true));
  }

  private static ResponseEntity<ErrorResponse> invalidRequest(String message) {
    LOGGER.warn("Invalid request: {}", message);
    return ResponseEntity.badRequest().body(new ErrorResponse("InvalidRequest", message, false));
  }

  static HttpStatus statusFor(String errorCode) {
    return switch (errorCode) {
      case "NoChunksFound" -> HttpStatus.NOT_FOUND;
      case "PartCountMismatch" -> HttpStatus.BAD_REQUEST;
      case "AssemblyInProgress" -> HttpStatus.CONFLICT;
      case "AssemblyTimeout" -> HttpStatus.GATEWAY_TIMEOUT;
      case "StorageFailure" -> HttpStatus.BAD_GATEWAY;
      default -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }
}
