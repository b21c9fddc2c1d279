package ru.dimension.container;

/**
 * Lookup key: either a component name or a component type.
 */
public sealed interface ComponentKey permits ComponentKey.ByName, ComponentKey.ByType {

  static ByName of(String name) {
    return new ByName(name);
  }

  static ByType of(Class<?> type) {
    return new ByType(type);
  }

  record ByName(String name) implements ComponentKey {
    public ByName {
      name = normalizeName(name);
      if (name == null) {
        throw new InvalidArgumentException("Component name must be non-blank");
      }
    }

    @Override
    public String toString() {
      return "ByName{" + name + "}";
    }
  }

  record ByType(Class<?> type) implements ComponentKey {
    public ByType {
      if (type == null) {
        throw new InvalidArgumentException("Component type must be non-null");
      }
    }

    @Override
    public String toString() {
      return "ByType{" + type.getName() + "}";
    }
  }

  /**
   * Trims the name; blank or null names become {@code null}.
   */
  static String normalizeName(String name) {
    if (name == null) return null;
    String n = name.trim();
    return n.isEmpty() ? null : n;
  }

  static String requireName(String name) {
    String n = normalizeName(name);
    if (n == null) {
      throw new InvalidArgumentException("Component name must be non-blank");
    }
    return n;
  }
}
