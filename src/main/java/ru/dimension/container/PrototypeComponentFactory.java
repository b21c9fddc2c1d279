package ru.dimension.container;

import java.lang.reflect.Constructor;
import java.util.List;

/**
 * Builds a new component on every request.
 */
public final class PrototypeComponentFactory<T> extends CreatingComponentFactory<T> {

  PrototypeComponentFactory(String componentName,
                            Class<T> componentType,
                            Constructor<?> constructor,
                            List<Requirement> requirements) {
    super(componentName, componentType, constructor, requirements);
  }

  @Override
  public T produce(ResolutionContext context) {
    return createComponent(context);
  }

  @Override
  public Scope scope() {
    return Scope.PROTOTYPE;
  }
}
