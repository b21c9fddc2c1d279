package ru.dimension.container;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import ru.dimension.container.beans.InjectableComponent;
import ru.dimension.container.beans.SampleClass;
import ru.dimension.container.beans.cycle.A;

class SnakeCaseNamingStrategyTest {

  static class PrintService {}

  private final ComponentNamingStrategy strategy = SnakeCaseNamingStrategy.INSTANCE;

  @Test
  void pascalCaseBecomesSnakeCase() {
    assertEquals("print_service", strategy.toComponentName(PrintService.class));
    assertEquals("sample_class", strategy.toComponentName(SampleClass.class));
    assertEquals("injectable_component", strategy.toComponentName(InjectableComponent.class));
    assertEquals("a", strategy.toComponentName(A.class));
  }

  @Test
  void anonymousTypesHaveNoName() {
    Object anonymous = new Object() {};

    assertThrows(InvalidArgumentException.class, () -> strategy.toComponentName(anonymous.getClass()));
    assertThrows(InvalidArgumentException.class, () -> strategy.toComponentName(null));
  }
}
