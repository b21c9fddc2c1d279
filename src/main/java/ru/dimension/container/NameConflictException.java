package ru.dimension.container;

public class NameConflictException extends ContainerException {

  private final String componentName;

  public NameConflictException(String componentName) {
    super("Component by the name '" + componentName + "' is already defined");
    this.componentName = componentName;
  }

  public String componentName() {
    return componentName;
  }
}
