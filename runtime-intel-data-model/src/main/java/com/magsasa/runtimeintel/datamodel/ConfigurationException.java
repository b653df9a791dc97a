package com.magsasa.runtimeintel.datamodel;

/** Raised when detector, routing, channel or annotation configuration cannot be used. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
