package ru.dimension.container;

import java.util.Map;

/**
 * A declared dependency of a component: an optional requested name and the type the
 * dependency must satisfy.
 */
public record Requirement(String name, Class<?> type) {

  private static final Map<Class<?>, Class<?>> PRIMITIVE_TO_WRAPPER = Map.of(
      boolean.class, Boolean.class,
      byte.class, Byte.class,
      char.class, Character.class,
      short.class, Short.class,
      int.class, Integer.class,
      long.class, Long.class,
      float.class, Float.class,
      double.class, Double.class
  );

  public Requirement {
    name = ComponentKey.normalizeName(name);
    if (type == null) {
      throw new InvalidArgumentException("Requirement type must be non-null");
    }
  }

  public static Requirement named(String name, Class<?> type) {
    return new Requirement(ComponentKey.requireName(name), type);
  }

  public static Requirement ofType(Class<?> type) {
    return new Requirement(null, type);
  }

  public boolean isNamed() {
    return name != null;
  }

  /**
   * Whether a component of {@code providedType} can be passed where this requirement is declared.
   * Primitive requirement types accept their wrapper.
   */
  public boolean isSatisfiedBy(Class<?> providedType) {
    return isTypeCompatible(type, providedType);
  }

  static boolean isTypeCompatible(Class<?> targetType, Class<?> providedType) {
    if (targetType.isAssignableFrom(providedType)) return true;

    Class<?> t = targetType.isPrimitive() ? wrapPrimitive(targetType) : targetType;
    Class<?> p = providedType.isPrimitive() ? wrapPrimitive(providedType) : providedType;

    return t.isAssignableFrom(p);
  }

  /**
   * The wrapper of a primitive type; any other type unchanged.
   */
  static Class<?> wrapPrimitive(Class<?> c) {
    Class<?> w = PRIMITIVE_TO_WRAPPER.get(c);
    return (w != null) ? w : c;
  }

  @Override
  public String toString() {
    return "Requirement{" + type.getName() + (name != null ? ", name=" + name : "") + "}";
  }
}
