package ru.dimension.container;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for factories that build components by calling a constructor with the components
 * their requirements resolve to.
 *
 * <p>Requirements are bound to other factories once, in {@link #wire(Repository)}; the
 * dependency graph is fixed from then on.
 */
public abstract class CreatingComponentFactory<T> extends ComponentFactory<T> {

  private static final Logger log = LoggerFactory.getLogger(CreatingComponentFactory.class);

  private final List<Requirement> requirements;
  private final MethodHandle constructor;
  // component type of a trailing varargs parameter that no requirement covers
  private final Class<?> varArgsType;

  private volatile List<ComponentFactory<?>> dependencies;
  private volatile List<String> dependencyNames = List.of();

  protected CreatingComponentFactory(String componentName,
                                     Class<T> componentType,
                                     Constructor<?> constructor,
                                     List<Requirement> requirements) {
    super(componentName, componentType);
    if (constructor == null || constructor.getDeclaringClass() != componentType) {
      throw new InvalidArgumentException(
          "Constructor " + constructor + " does not belong to " + componentType.getName());
    }
    this.requirements = List.copyOf(requirements);
    this.varArgsType = varArgsType(constructor, this.requirements.size());
    this.constructor = unreflectConstructor(componentType, constructor);
  }

  public static <T> CreatingComponentFactory<T> create(Scope scope,
                                                       String componentName,
                                                       Class<T> componentType,
                                                       Constructor<?> constructor,
                                                       List<Requirement> requirements) {
    return switch (scope) {
      case SINGLETON -> new SingletonComponentFactory<>(componentName, componentType, constructor, requirements);
      case PROTOTYPE -> new PrototypeComponentFactory<>(componentName, componentType, constructor, requirements);
    };
  }

  public abstract Scope scope();

  public final List<Requirement> requirements() {
    return requirements;
  }

  /**
   * Names of the components the requirements were wired to, in requirement order.
   * Empty before wiring.
   */
  public final List<String> dependencyNames() {
    return dependencyNames;
  }

  @Override
  public final boolean isReady() {
    return dependencies != null;
  }

  @Override
  public final void wire(Repository repository) {
    resolve(repository).commit();
  }

  /**
   * Binds every requirement to a factory without changing this factory. The result
   * takes effect only once {@link Wiring#commit()} is called.
   *
   * @throws InvalidStateException if this factory is already wired
   */
  final Wiring resolve(Repository repository) {
    checkNotWired();

    List<ComponentFactory<?>> factories = new ArrayList<>(requirements.size());
    List<String> names = new ArrayList<>(requirements.size());

    for (int idx = 0; idx < requirements.size(); idx++) {
      Requirement req = requirements.get(idx);
      String name = null;
      ComponentFactory<?> factory = null;

      if (req.isNamed()) {
        Optional<ComponentFactory<?>> byName = repository.findByName(req.name());
        if (byName.isPresent()) {
          factory = byName.get();
          if (!factory.isTypeOf(req.type())) {
            throw new TypeMismatchException(
                componentType().getName() + " (parameter #" + idx + ") expected requirement '" + req.name()
                    + "' of type " + req.type().getName() + " but got " + factory.componentType().getName());
          }
          name = req.name();
        }
      }

      if (factory == null) {
        Repository.Entry entry = repository.findUnique(req.type());
        name = entry.name();
        factory = entry.factory();
      }

      factories.add(factory);
      names.add(name);
    }

    return new Wiring(this, List.copyOf(factories), List.copyOf(names));
  }

  private synchronized void commit(Wiring wiring) {
    checkNotWired();
    this.dependencyNames = wiring.names();
    this.dependencies = wiring.dependencies();
    log.debug("Wired component '{}' -> {}", componentName(), wiring.names());
  }

  private void checkNotWired() {
    if (dependencies != null) {
      throw new InvalidStateException("Component '" + componentName() + "' is already wired");
    }
  }

  /**
   * Resolved requirements of one factory, not yet applied.
   */
  record Wiring(CreatingComponentFactory<?> factory, List<ComponentFactory<?>> dependencies, List<String> names) {
    void commit() {
      factory.commit(this);
    }
  }

  /**
   * Builds a new instance. The component name stays on the resolution stack while its
   * dependencies are produced and its constructor runs.
   */
  protected final T createComponent(ResolutionContext context) {
    try (ResolutionContext.Guard guard = context.guard(componentName())) {
      List<ComponentFactory<?>> deps = dependencies;
      if (deps == null) {
        throw new InvalidStateException(
            "Factory of component '" + componentName() + "' is not initialized; call Container.setup() first");
      }

      Object[] args = new Object[deps.size() + (varArgsType != null ? 1 : 0)];
      for (int i = 0; i < deps.size(); i++) {
        args[i] = deps.get(i).produce(context);
      }
      if (varArgsType != null) {
        args[args.length - 1] = Array.newInstance(varArgsType, 0);
      }
      return instantiate(args);
    }
  }

  private T instantiate(Object[] args) {
    try {
      return componentType().cast(constructor.invokeWithArguments(args));
    } catch (Throwable t) {
      if (t instanceof RuntimeException re) throw re;
      if (t instanceof Error e) throw e;
      throw new ComponentCreationException(componentName(), componentType(), t);
    }
  }

  private static Class<?> varArgsType(Constructor<?> constructor, int requirementCount) {
    int paramCount = constructor.getParameterCount();
    if (requirementCount == paramCount) return null;
    if (constructor.isVarArgs() && requirementCount == paramCount - 1) {
      return constructor.getParameterTypes()[paramCount - 1].getComponentType();
    }
    throw new InvalidArgumentException(
        "Constructor " + constructor + " takes " + paramCount + " parameters but "
            + requirementCount + " requirements were given");
  }

  private static MethodHandle unreflectConstructor(Class<?> clazz, Constructor<?> ctor) {
    try {
      MethodHandles.Lookup lookup = MethodHandles.lookup();
      MethodHandles.Lookup privateLookup = MethodHandles.privateLookupIn(clazz, lookup);
      return privateLookup.unreflectConstructor(ctor).asFixedArity();
    } catch (IllegalAccessException e) {
      throw new InvalidArgumentException("Cannot access constructor of " + clazz.getName() + ": " + e.getMessage());
    }
  }
}
