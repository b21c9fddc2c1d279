package ru.dimension.container;

public class TypeMismatchException extends ContainerException {

  public TypeMismatchException(String message) {
    super(message);
  }
}
