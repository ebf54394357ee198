package com.scholary.audio.upload.catalog;

/** Exception thrown when a catalog write fails. */
public class CatalogException extends RuntimeException {

  public CatalogException(String message) {
    super(message);
  }

  public CatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
