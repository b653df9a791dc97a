package com.magsasa.runtimeintel.detector;

/** A metric sample that cannot be accepted, for example a non finite value. */
public class SampleIngestionException extends RuntimeException {

  public SampleIngestionException(String message) {
    super(message);
  }
}
