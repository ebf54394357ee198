package com.scholary.audio.upload.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>This is a runtime exception because storage failures are handled at the edges: the receiver
 * reports them to the caller and the assembler turns them into a retryable storage failure after
 * running its cleanup.
 */
public class ObjectStoreException extends RuntimeException {

  private final boolean notFound;

  public ObjectStoreException(String message) {
    this(message, null, false);
  }

  public ObjectStoreException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public ObjectStoreException(String message, Throwable cause, boolean notFound) {
    super(message, cause);
    this.notFound = notFound;
  }

  public static ObjectStoreException notFound(String message, Throwable cause) {
    return new ObjectStoreException(message, cause, true);
  }

  /** True when the failure was caused by a missing object. */
  public boolean isNotFound() {
    return notFound;
  }
}
