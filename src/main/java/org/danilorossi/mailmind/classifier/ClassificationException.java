package org.danilorossi.mailmind.classifier;

public class ClassificationException extends Exception {

  public ClassificationException(final String message) {
    super(message);
  }

  public ClassificationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
