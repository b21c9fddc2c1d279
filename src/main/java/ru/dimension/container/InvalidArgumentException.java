package ru.dimension.container;

/**
 * Caller passed something the container cannot work with: a null key,
 * an abstract type, a non-invocable executable.
 */
public class InvalidArgumentException extends ContainerException {

  public InvalidArgumentException(String message) {
    super(message);
  }
}
