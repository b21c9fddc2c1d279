package ru.dimension.container;

/**
 * Always returns the instance it was created with.
 */
public final class StaticComponentFactory<T> extends ComponentFactory<T> {

  private final T instance;

  private StaticComponentFactory(String componentName, Class<T> componentType, T instance) {
    super(componentName, componentType);
    this.instance = instance;
  }

  @SuppressWarnings("unchecked")
  public static <T> StaticComponentFactory<T> of(String componentName, T instance) {
    if (instance == null) {
      throw new InvalidArgumentException("Instance of component '" + componentName + "' must be non-null");
    }
    return new StaticComponentFactory<>(componentName, (Class<T>) instance.getClass(), instance);
  }

  @Override
  public T produce(ResolutionContext context) {
    return instance;
  }

  @Override
  public boolean isReady() {
    return true;
  }
}
