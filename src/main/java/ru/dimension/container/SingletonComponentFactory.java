package ru.dimension.container;

import java.lang.reflect.Constructor;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds its component on first request and returns the same instance afterwards.
 *
 * <p>Creation is serialized per factory (double-checked locking), so concurrent first
 * requests build exactly one instance.
 */
public final class SingletonComponentFactory<T> extends CreatingComponentFactory<T> {

  private static final Logger log = LoggerFactory.getLogger(SingletonComponentFactory.class);

  private volatile T instance;

  SingletonComponentFactory(String componentName,
                            Class<T> componentType,
                            Constructor<?> constructor,
                            List<Requirement> requirements) {
    super(componentName, componentType, constructor, requirements);
  }

  @Override
  public T produce(ResolutionContext context) {
    T r = instance;
    if (r == null) {
      synchronized (this) {
        r = instance;
        if (r == null) {
          instance = r = createComponent(context);
          log.debug("Created singleton '{}' of type {}", componentName(), componentType().getName());
        }
      }
    }
    return r;
  }

  /**
   * Whether the singleton has been built.
   */
  public boolean isCreated() {
    return instance != null;
  }

  @Override
  public Scope scope() {
    return Scope.SINGLETON;
  }
}
