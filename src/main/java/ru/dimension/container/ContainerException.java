package ru.dimension.container;

/**
 * Root of all failures raised by the container. Every failure is a programming or
 * configuration error, so the hierarchy is unchecked and nothing is retried.
 */
public class ContainerException extends RuntimeException {

  public ContainerException(String message) {
    super(message);
  }

  public ContainerException(String message, Throwable cause) {
    super(message, cause);
  }
}
