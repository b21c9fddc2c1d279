package ru.dimension.container;

/**
 * {@code PrintService -> print_service}: an underscore before each interior uppercase
 * letter, everything lowercased.
 */
public final class SnakeCaseNamingStrategy implements ComponentNamingStrategy {

  public static final SnakeCaseNamingStrategy INSTANCE = new SnakeCaseNamingStrategy();

  @Override
  public String toComponentName(Class<?> type) {
    if (type == null) {
      throw new InvalidArgumentException("Type must be non-null");
    }
    String simpleName = type.getSimpleName();
    if (simpleName.isEmpty()) {
      throw new InvalidArgumentException(
          "Cannot derive a component name for anonymous type " + type.getName() + "; register it with a name");
    }

    StringBuilder sb = new StringBuilder(simpleName.length() + 4);
    for (int i = 0; i < simpleName.length(); i++) {
      char ch = simpleName.charAt(i);
      if (Character.isUpperCase(ch)) {
        if (sb.length() > 0) sb.append('_');
        sb.append(Character.toLowerCase(ch));
      } else {
        sb.append(ch);
      }
    }
    return sb.toString();
  }
}
