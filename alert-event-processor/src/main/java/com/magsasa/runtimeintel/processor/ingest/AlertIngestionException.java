package com.magsasa.runtimeintel.processor.ingest;

/** An external alert payload that cannot be normalized. */
public class AlertIngestionException extends RuntimeException {

  public AlertIngestionException(String message) {
    super(message);
  }
}
