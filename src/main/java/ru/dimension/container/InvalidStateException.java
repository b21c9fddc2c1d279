package ru.dimension.container;

/**
 * An operation was invoked out of lifecycle order (lookup before setup, registration
 * after setup), or an internal invariant was broken.
 */
public class InvalidStateException extends ContainerException {

  public InvalidStateException(String message) {
    super(message);
  }
}
