package ru.dimension.container;

import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Derives the ordered requirement list of a component from its constructor signature.
 *
 * <p>Parameter name resolution order:
 * <ol>
 *   <li>{@code @Named} value, if present and non-blank;</li>
 *   <li>the reflected parameter name, when the class was compiled with {@code -parameters};</li>
 *   <li>none - the requirement is resolved by type only.</li>
 * </ol>
 *
 * Implicit and synthetic parameters (the enclosing instance of an inner class, for example)
 * and a trailing varargs parameter are not requirements.
 */
public final class Requirements {

  private Requirements() {}

  public static List<Requirement> of(Requirement... requirements) {
    if (requirements == null) return List.of();
    for (int i = 0; i < requirements.length; i++) {
      if (requirements[i] == null) {
        throw new InvalidArgumentException("Requirement #" + i + " is null");
      }
    }
    return List.of(requirements);
  }

  /**
   * Requirements of the injection constructor of {@code type}.
   *
   * @see #injectionConstructor(Class)
   */
  public static List<Requirement> forType(Class<?> type) {
    return extract(injectionConstructor(type));
  }

  public static List<Requirement> extract(Executable executable) {
    if (executable == null) {
      throw new InvalidArgumentException("Expected a constructor or method, got null");
    }
    if (Modifier.isAbstract(executable.getModifiers())) {
      throw new InvalidArgumentException("Cannot extract requirements of abstract method " + executable);
    }

    Parameter[] params = executable.getParameters();
    List<Requirement> out = new ArrayList<>(params.length);
    for (int i = 0; i < params.length; i++) {
      Parameter p = params[i];
      if (p.isImplicit() || p.isSynthetic()) continue;
      if (executable.isVarArgs() && i == params.length - 1) continue;

      String qualifier = readNamed(p.getAnnotation(Named.class));
      Class<?> type = p.getType();
      if (qualifier == null && isMultiValued(type)) {
        throw new InvalidArgumentException(
            "Collection injection is not supported: parameter #" + i + " of " + executable
                + " has type " + type.getName() + "; qualify it with @Named to inject a single component");
      }

      String name = qualifier != null ? qualifier : (p.isNamePresent() ? p.getName() : null);
      out.add(new Requirement(name, type));
    }
    return List.copyOf(out);
  }

  /**
   * Selects the constructor used to build {@code type}: the single {@code @Inject}
   * constructor, else the only declared constructor, else the no-arg constructor.
   */
  public static Constructor<?> injectionConstructor(Class<?> type) {
    checkInstantiable(type);

    Constructor<?>[] ctors = type.getDeclaredConstructors();
    Constructor<?> inject = null;

    for (Constructor<?> c : ctors) {
      if (c.isAnnotationPresent(Inject.class)) {
        if (inject != null) {
          throw new InvalidArgumentException("Multiple @Inject constructors in " + type.getName());
        }
        inject = c;
      }
    }
    if (inject != null) return inject;

    if (ctors.length == 1) return ctors[0];

    return Arrays.stream(ctors)
        .filter(c -> c.getParameterCount() == 0)
        .findFirst()
        .orElseThrow(() -> new InvalidArgumentException(
            "No @Inject, single or no-arg constructor in " + type.getName()));
  }

  /**
   * Constructor of {@code type} whose parameters are exactly the types of {@code requirements}.
   */
  public static Constructor<?> constructorFor(Class<?> type, List<Requirement> requirements) {
    checkInstantiable(type);
    Class<?>[] parameterTypes = requirements.stream().map(Requirement::type).toArray(Class<?>[]::new);
    try {
      return type.getDeclaredConstructor(parameterTypes);
    } catch (NoSuchMethodException e) {
      throw new InvalidArgumentException(
          "No constructor " + type.getSimpleName() + Arrays.toString(parameterTypes) + " in " + type.getName());
    }
  }

  static void checkInstantiable(Class<?> type) {
    if (type == null) {
      throw new InvalidArgumentException("Component type must be non-null");
    }
    if (type.isPrimitive() || type.isArray() || type.isInterface() || type.isEnum()) {
      throw new InvalidArgumentException("Not an instantiable class: " + type.getName());
    }
    if (Modifier.isAbstract(type.getModifiers())) {
      throw new InvalidArgumentException("Cannot instantiate abstract class " + type.getName());
    }
    if (type.isAnonymousClass() || type.isLocalClass()
        || (type.isMemberClass() && !Modifier.isStatic(type.getModifiers()))) {
      throw new InvalidArgumentException(
          type.getName() + " needs an enclosing instance; declare it as a top-level or static nested class");
    }
  }

  private static boolean isMultiValued(Class<?> type) {
    return Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type);
  }

  private static String readNamed(Named named) {
    if (named == null) return null;
    return ComponentKey.normalizeName(named.value());
  }
}
