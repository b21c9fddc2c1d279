package ru.dimension.container;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dimension container: registry of lazily built, constructor-injected components.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>register types and instances ({@code registerType}, {@code registerInstance});</li>
 *   <li>call {@link #setup()} once - every requirement is bound to a factory here;</li>
 *   <li>look components up by name or type ({@code getComponent}).</li>
 * </ol>
 *
 * The container registers itself under {@link #CONTAINER_COMPONENT_NAME} (or the name
 * given to the builder), so components may depend on it.
 *
 * <p>Lookups are thread-safe once {@link #setup()} has returned.
 */
public class Container {

  public static final String CONTAINER_COMPONENT_NAME = "container";

  private static final Logger log = LoggerFactory.getLogger(Container.class);

  private final Repository repository = new Repository();
  private final CycleDetector cycleDetector = new CycleDetector();
  private final ComponentNamingStrategy namingStrategy;
  private final String containerName;

  private volatile boolean setUp;

  public Container() {
    this(SnakeCaseNamingStrategy.INSTANCE, CONTAINER_COMPONENT_NAME);
  }

  public Container(ComponentNamingStrategy namingStrategy, String containerName) {
    this.namingStrategy = Objects.requireNonNull(namingStrategy, "namingStrategy");
    this.containerName = ComponentKey.requireName(containerName);
    registerInstance(this, this.containerName);
  }

  // =========================================================================
  // Registration
  // =========================================================================

  public Container registerType(Class<?> componentType) {
    return registerType(componentType, null, Scope.SINGLETON);
  }

  public Container registerType(Class<?> componentType, String componentName) {
    return registerType(componentType, componentName, Scope.SINGLETON);
  }

  /**
   * Registers {@code componentType}, taking its requirements from its injection constructor.
   *
   * @param componentName name of the component, or {@code null} to derive it from the type
   * @throws NameConflictException if the name is already taken
   * @throws InvalidArgumentException if the type cannot be built by the container
   */
  public Container registerType(Class<?> componentType, String componentName, Scope scope) {
    Constructor<?> ctor = Requirements.injectionConstructor(componentType);
    return register(componentType, componentName, scope, ctor, Requirements.extract(ctor));
  }

  /**
   * Registers {@code componentType} with requirements given by the caller. The constructor
   * whose parameter types are the requirement types is used.
   */
  public Container registerType(Class<?> componentType,
                                String componentName,
                                Scope scope,
                                List<Requirement> requirements) {
    Objects.requireNonNull(requirements, "requirements");
    Constructor<?> ctor = Requirements.constructorFor(componentType, requirements);
    return register(componentType, componentName, scope, ctor, requirements);
  }

  public Container registerPrototype(Class<?> componentType) {
    return registerType(componentType, null, Scope.PROTOTYPE);
  }

  public Container registerPrototype(Class<?> componentType, String componentName) {
    return registerType(componentType, componentName, Scope.PROTOTYPE);
  }

  /**
   * Registers several singleton types, each under its derived name. Nothing is registered
   * if any argument is null.
   */
  public Container registerTypes(Class<?> first, Class<?>... rest) {
    List<Class<?>> all = new ArrayList<>();
    all.add(first);
    if (rest != null) {
      all.addAll(Arrays.asList(rest));
    }

    for (int idx = 0; idx < all.size(); idx++) {
      if (all.get(idx) == null) {
        throw new InvalidArgumentException("Invalid argument #" + idx + ": expected a type, got null");
      }
    }

    for (Class<?> componentType : all) {
      registerType(componentType);
    }
    return this;
  }

  public Container registerInstance(Object instance, String componentName) {
    checkRegistrationOpen();
    StaticComponentFactory<?> factory = StaticComponentFactory.of(componentName, instance);
    repository.register(factory.componentName(), factory);
    log.debug("Registered instance '{}' of type {}", factory.componentName(), factory.componentType().getName());
    return this;
  }

  private <T> Container register(Class<T> componentType,
                                 String componentName,
                                 Scope scope,
                                 Constructor<?> ctor,
                                 List<Requirement> requirements) {
    checkRegistrationOpen();
    Objects.requireNonNull(scope, "scope");
    String name = componentName != null ? componentName : namingStrategy.toComponentName(componentType);

    CreatingComponentFactory<T> factory =
        CreatingComponentFactory.create(scope, name, componentType, ctor, requirements);
    repository.register(factory.componentName(), factory);
    log.debug("Registered {} '{}' of type {} with requirements {}",
              scope, factory.componentName(), componentType.getName(), requirements);
    return this;
  }

  private void checkRegistrationOpen() {
    if (setUp) {
      throw new InvalidStateException("Container is already set up; register components before setup()");
    }
  }

  // =========================================================================
  // Lifecycle
  // =========================================================================

  /**
   * Wires every registered factory, in registration order. Must be called exactly once,
   * after all registrations and before any lookup.
   *
   * <p>All requirements are resolved before any factory is changed: the first failure
   * aborts setup and leaves every factory unwired, so setup may be retried after the
   * registrations are fixed.
   */
  public synchronized void setup() {
    if (setUp) {
      throw new InvalidStateException("Container is already set up");
    }
    List<CreatingComponentFactory.Wiring> wirings = new ArrayList<>();
    for (Repository.Entry entry : repository.entries()) {
      if (entry.factory() instanceof CreatingComponentFactory<?> creating) {
        wirings.add(creating.resolve(repository));
      }
    }
    for (CreatingComponentFactory.Wiring wiring : wirings) {
      wiring.commit();
    }
    setUp = true;
    log.info("Container set up with {} components", repository.size());
  }

  public boolean isSetUp() {
    return setUp;
  }

  // =========================================================================
  // Lookup
  // =========================================================================

  public Object getComponent(ComponentKey key) {
    if (key instanceof ComponentKey.ByName byName) {
      return getComponent(byName.name());
    }
    if (key instanceof ComponentKey.ByType byType) {
      return getComponent(byType.type());
    }
    throw new InvalidArgumentException("Unsupported key: " + key);
  }

  /**
   * @throws UnknownComponentException if no component has this name
   */
  public Object getComponent(String componentName) {
    String name = ComponentKey.requireName(componentName);
    ComponentFactory<?> factory = repository.findByName(name)
        .orElseThrow(() -> new UnknownComponentException("Unknown component: " + name));
    return produce(factory);
  }

  /**
   * @throws UnknownComponentException if no component has this type
   * @throws AmbiguousComponentException if several components have this type
   */
  public <T> T getComponent(Class<T> componentType) {
    if (componentType == null) {
      throw new InvalidArgumentException("Component type must be non-null");
    }
    ComponentFactory<?> factory = repository.findUnique(componentType).factory();
    return cast(produce(factory), componentType);
  }

  /**
   * Name lookup with a type check.
   *
   * @throws TypeMismatchException if the named component is not a {@code componentType}
   */
  public <T> T getComponent(String componentName, Class<T> componentType) {
    String name = ComponentKey.requireName(componentName);
    if (componentType == null) {
      throw new InvalidArgumentException("Component type must be non-null");
    }
    ComponentFactory<?> factory = repository.findByName(name)
        .orElseThrow(() -> new UnknownComponentException("Unknown component: " + name));
    if (!factory.isTypeOf(componentType)) {
      throw new TypeMismatchException("Component '" + name + "' is a " + factory.componentType().getName()
                                          + ", not a " + componentType.getName());
    }
    return cast(produce(factory), componentType);
  }

  // int.class cannot cast an Integer; cast through the wrapper
  @SuppressWarnings("unchecked")
  private static <T> T cast(Object component, Class<T> componentType) {
    return (T) Requirement.wrapPrimitive(componentType).cast(component);
  }

  private Object produce(ComponentFactory<?> factory) {
    return cycleDetector.resolve(factory::produce);
  }

  public boolean exists(ComponentKey key) {
    if (key instanceof ComponentKey.ByName byName) {
      return repository.exists(byName.name());
    }
    if (key instanceof ComponentKey.ByType byType) {
      return repository.exists(byType.type());
    }
    throw new InvalidArgumentException("Unsupported key: " + key);
  }

  public boolean exists(String componentName) {
    return repository.exists(componentName);
  }

  public boolean exists(Class<?> componentType) {
    return repository.exists(componentType);
  }

  /**
   * Registered component names in registration order, the container itself included.
   */
  public List<String> componentNames() {
    return repository.entries().stream().map(Repository.Entry::name).toList();
  }

  public String containerName() {
    return containerName;
  }

  @Override
  public String toString() {
    return "Container{" + containerName + ", components=" + repository.size() + ", setUp=" + setUp + "}";
  }
}
