package ru.dimension.container;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for configuring a {@link Container}.
 *
 * <pre>
 *   Container container = DimensionContainer.builder()
 *       .type(PrintService.class)
 *       .prototype(PrintJob.class)
 *       .instance(config, "config")
 *       .buildAndSetup();
 * </pre>
 */
public final class DimensionContainer {

  private DimensionContainer() {}

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private ComponentNamingStrategy namingStrategy = SnakeCaseNamingStrategy.INSTANCE;
    private String containerName = Container.CONTAINER_COMPONENT_NAME;

    // applied in declaration order, so registration order follows the builder calls
    private final List<Registration> registrations = new ArrayList<>();

    /**
     * Strategy deriving component names for types registered without one.
     * Default is {@link SnakeCaseNamingStrategy}.
     */
    public Builder namingStrategy(ComponentNamingStrategy namingStrategy) {
      this.namingStrategy = Objects.requireNonNull(namingStrategy, "namingStrategy");
      return this;
    }

    /**
     * Name under which the container registers itself. Default is {@code "container"}.
     */
    public Builder containerName(String containerName) {
      this.containerName = ComponentKey.requireName(containerName);
      return this;
    }

    public Builder type(Class<?> componentType) {
      return type(componentType, null);
    }

    public Builder type(Class<?> componentType, String componentName) {
      Objects.requireNonNull(componentType, "componentType");
      registrations.add(c -> c.registerType(componentType, componentName, Scope.SINGLETON));
      return this;
    }

    /**
     * Adds several singleton types under their derived names. Nothing is added if any
     * argument is null.
     */
    public Builder types(Class<?>... componentTypes) {
      if (componentTypes == null) {
        throw new InvalidArgumentException("Expected component types, got null");
      }
      for (int idx = 0; idx < componentTypes.length; idx++) {
        if (componentTypes[idx] == null) {
          throw new InvalidArgumentException("Invalid argument #" + idx + ": expected a type, got null");
        }
      }
      for (Class<?> t : componentTypes) {
        type(t);
      }
      return this;
    }

    public Builder prototype(Class<?> componentType) {
      return prototype(componentType, null);
    }

    public Builder prototype(Class<?> componentType, String componentName) {
      Objects.requireNonNull(componentType, "componentType");
      registrations.add(c -> c.registerType(componentType, componentName, Scope.PROTOTYPE));
      return this;
    }

    public Builder instance(Object instance, String componentName) {
      Objects.requireNonNull(instance, "instance");
      registrations.add(c -> c.registerInstance(instance, componentName));
      return this;
    }

    /**
     * Registers everything declared so far; the returned container is not set up yet.
     */
    public Container build() {
      Container container = new Container(namingStrategy, containerName);
      for (Registration r : registrations) {
        r.apply(container);
      }
      return container;
    }

    public Container buildAndSetup() {
      Container container = build();
      container.setup();
      return container;
    }
  }

  @FunctionalInterface
  private interface Registration {
    void apply(Container container);
  }
}
