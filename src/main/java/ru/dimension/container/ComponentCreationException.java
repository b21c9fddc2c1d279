package ru.dimension.container;

/**
 * A component constructor threw a checked exception.
 */
public class ComponentCreationException extends ContainerException {

  public ComponentCreationException(String componentName, Class<?> componentType, Throwable cause) {
    super("Failed to instantiate component '" + componentName + "' of type " + componentType.getName(), cause);
  }
}
