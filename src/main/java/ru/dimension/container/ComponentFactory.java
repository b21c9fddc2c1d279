package ru.dimension.container;

/**
 * Produces the instance of one component.
 *
 * @param <T> component type
 */
public abstract class ComponentFactory<T> {

  private final String componentName;
  private final Class<T> componentType;

  protected ComponentFactory(String componentName, Class<T> componentType) {
    this.componentName = ComponentKey.requireName(componentName);
    if (componentType == null) {
      throw new InvalidArgumentException("Component type must be non-null");
    }
    this.componentType = componentType;
  }

  /**
   * Returns an instance of the component, building it if this factory creates instances.
   *
   * @param context resolution in progress on the calling thread
   */
  public abstract T produce(ResolutionContext context);

  /**
   * Resolves this factory's requirements against {@code repository}. Called once by
   * {@link Container#setup()}; factories without requirements do nothing.
   */
  public void wire(Repository repository) {}

  public abstract boolean isReady();

  /**
   * Whether the produced component can be used where {@code type} is expected.
   */
  public boolean isTypeOf(Class<?> type) {
    return Requirement.isTypeCompatible(type, componentType);
  }

  public final String componentName() {
    return componentName;
  }

  public final Class<T> componentType() {
    return componentType;
  }

  @Override
  public String toString() {
    return "[" + getClass().getSimpleName() + "] " + componentName + ": " + componentType.getName();
  }
}
