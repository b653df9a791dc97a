package com.magsasa.runtimeintel.annotation;

public class AnnotationWriteException extends RuntimeException {

  public AnnotationWriteException(String message) {
    super(message);
  }

  public AnnotationWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
