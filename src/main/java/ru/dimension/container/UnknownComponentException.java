package ru.dimension.container;

public class UnknownComponentException extends ContainerException {

  public UnknownComponentException(String message) {
    super(message);
  }
}
