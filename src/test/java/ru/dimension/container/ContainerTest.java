package ru.dimension.container;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.dimension.container.beans.CheckedFailureBean;
import ru.dimension.container.beans.EnglishGreeter;
import ru.dimension.container.beans.FrenchGreeter;
import ru.dimension.container.beans.Greeter;
import ru.dimension.container.beans.GreeterConsumer;
import ru.dimension.container.beans.InjectableComponent;
import ru.dimension.container.beans.InjectableContainer;
import ru.dimension.container.beans.LoudEnglishGreeter;
import ru.dimension.container.beans.PrototypeBean;
import ru.dimension.container.beans.QualifiedGreeterConsumer;
import ru.dimension.container.beans.SampleClass;
import ru.dimension.container.beans.SelfLookupBean;
import ru.dimension.container.beans.TextHolder;
import ru.dimension.container.beans.UncheckedFailureBean;
import ru.dimension.container.beans.VarArgsBean;
import ru.dimension.container.beans.cycle.A;
import ru.dimension.container.beans.cycle.B;
import ru.dimension.container.beans.cycle.C;

class ContainerTest {

  private Container container;

  @BeforeEach
  void setUp() {
    container = new Container();
  }

  @Nested
  @DisplayName("Registration")
  class RegistrationTests {

    @Test
    @DisplayName("Registered components exist before setup")
    void existsRightAfterRegistration() {
      container.registerType(SampleClass.class);
      container.registerInstance("Hello, world", "message");

      assertTrue(container.exists("sample_class"));
      assertTrue(container.exists("message"));
      assertTrue(container.exists(SampleClass.class));
      assertTrue(container.exists(ComponentKey.of("message")));
      assertTrue(container.exists(ComponentKey.of(String.class)));
      assertFalse(container.exists("nothing"));
      assertFalse(container.exists(Greeter.class));
    }

    @Test
    @DisplayName("Duplicate names fail regardless of component kind")
    void duplicateNamesConflict() {
      container.registerType(SampleClass.class);

      assertThrows(NameConflictException.class, () -> container.registerType(EnglishGreeter.class, "sample_class"));
      assertThrows(NameConflictException.class, () -> container.registerInstance(42, "sample_class"));
      assertThrows(NameConflictException.class, () -> container.registerType(SampleClass.class));
    }

    @Test
    @DisplayName("The container's own name is taken")
    void containerNameIsReserved() {
      NameConflictException ex = assertThrows(
          NameConflictException.class,
          () -> container.registerInstance("other", Container.CONTAINER_COMPONENT_NAME));
      assertEquals("container", ex.componentName());
    }

    @Test
    @DisplayName("Bulk registration derives names and rejects null before registering anything")
    void bulkRegistration() {
      container.registerTypes(A.class, B.class, C.class);
      assertEquals(List.of("container", "a", "b", "c"), container.componentNames());

      Container other = new Container();
      assertThrows(InvalidArgumentException.class, () -> other.registerTypes(SampleClass.class, (Class<?>) null));
      assertFalse(other.exists("sample_class"));
    }

    @Test
    @DisplayName("Types that cannot be instantiated are rejected at registration")
    void nonInstantiableTypes() {
      assertThrows(InvalidArgumentException.class, () -> container.registerType(Greeter.class));
      assertThrows(InvalidArgumentException.class, () -> container.registerType(null));
      assertThrows(InvalidArgumentException.class, () -> container.registerInstance(null, "nothing"));
      assertThrows(InvalidArgumentException.class, () -> container.registerInstance("x", " "));
    }

    @Test
    @DisplayName("Registering after setup fails")
    void registrationClosedAfterSetup() {
      container.setup();

      assertThrows(InvalidStateException.class, () -> container.registerType(SampleClass.class));
      assertThrows(InvalidStateException.class, () -> container.registerInstance("x", "x"));
      assertThrows(InvalidStateException.class, () -> container.setup());
    }
  }

  @Nested
  @DisplayName("Lookup")
  class LookupTests {

    @Test
    @DisplayName("Static instance is returned as registered")
    void staticInstance() {
      String obj = "Hello, world !!!";
      container.registerInstance(obj, "message");
      container.setup();

      assertSame(obj, container.getComponent("message"));
      assertSame(obj, container.getComponent("message", CharSequence.class));
    }

    @Test
    @DisplayName("Type registration produces an instance of that type")
    void dynamicallyCreatedSingleton() {
      container.registerType(SampleClass.class);
      container.setup();

      Object result = container.getComponent(SampleClass.class);
      assertEquals(SampleClass.class, result.getClass());
      assertSame(result, container.getComponent(ComponentKey.of("sample_class")));
    }

    @Test
    @DisplayName("Unknown name or type fails after setup")
    void unknownComponents() {
      container.setup();

      assertThrows(UnknownComponentException.class, () -> container.getComponent("non_existing"));
      assertThrows(UnknownComponentException.class, () -> container.getComponent(SampleClass.class));
      assertThrows(UnknownComponentException.class, () -> container.getComponent(ComponentKey.of(Greeter.class)));
    }

    @Test
    @DisplayName("A type with several implementations is ambiguous")
    void ambiguousType() {
      container.registerType(EnglishGreeter.class);
      container.registerType(FrenchGreeter.class);
      container.setup();

      AmbiguousComponentException ex =
          assertThrows(AmbiguousComponentException.class, () -> container.getComponent(Greeter.class));
      assertEquals(List.of("english_greeter", "french_greeter"), ex.candidates());
      assertEquals(Greeter.class, ex.requestedType());

      // each concrete type is still unique
      assertEquals("Bonjour, you", container.getComponent(FrenchGreeter.class).greet("you"));
    }

    @Test
    @DisplayName("An exact type match wins over subtypes")
    void exactTypeWins() {
      container.registerType(EnglishGreeter.class);
      container.registerType(LoudEnglishGreeter.class);
      container.setup();

      assertEquals(EnglishGreeter.class, container.getComponent(EnglishGreeter.class).getClass());
      assertEquals(LoudEnglishGreeter.class, container.getComponent(LoudEnglishGreeter.class).getClass());
    }

    @Test
    @DisplayName("Typed name lookup checks the component type")
    void typedNameLookup() {
      container.registerInstance(42, "answer");
      container.setup();

      assertEquals(Integer.valueOf(42), container.getComponent("answer", Integer.class));
      assertThrows(TypeMismatchException.class, () -> container.getComponent("answer", String.class));
    }

    @Test
    @DisplayName("Primitive type lookup returns the boxed component")
    void primitiveTypeLookup() {
      container.registerInstance(42, "answer");
      container.setup();

      assertTrue(container.exists(int.class));
      assertEquals(Integer.valueOf(42), container.getComponent(int.class));
      assertEquals(Integer.valueOf(42), container.getComponent("answer", int.class));
      assertEquals(Integer.valueOf(42), container.getComponent(ComponentKey.of(int.class)));
    }

    @Test
    @DisplayName("Creating factories fail before setup")
    void lookupBeforeSetup() {
      container.registerType(SampleClass.class);
      container.registerInstance("ready", "message");

      assertThrows(InvalidStateException.class, () -> container.getComponent(SampleClass.class));
      assertEquals("ready", container.getComponent("message"));
    }
  }

  @Nested
  @DisplayName("Injection")
  class InjectionTests {

    @Test
    @DisplayName("Requirement resolved by name")
    void injectByName() {
      container.registerType(SampleClass.class, "sampleClass");
      container.registerType(InjectableComponent.class);
      container.setup();

      InjectableComponent result = container.getComponent(InjectableComponent.class);

      assertEquals(SampleClass.class, result.val.getClass());
      assertSame(container.getComponent("sampleClass"), result.val);
    }

    @Test
    @DisplayName("Requirement falls back to type when its name is not registered")
    void injectByType() {
      container.registerType(SampleClass.class, "abc");
      container.registerType(InjectableComponent.class);
      container.setup();

      InjectableComponent result = container.getComponent(InjectableComponent.class);

      assertEquals(SampleClass.class, result.val.getClass());
    }

    @Test
    @DisplayName("The container itself can be injected")
    void injectContainer() {
      container.registerType(InjectableContainer.class);
      container.setup();

      InjectableContainer result = container.getComponent(InjectableContainer.class);

      assertSame(container, result.container);
    }

    @Test
    @DisplayName("@Named picks one of several implementations")
    void qualifiedRequirement() {
      container.registerType(EnglishGreeter.class, "english");
      container.registerType(FrenchGreeter.class, "french");
      container.registerType(QualifiedGreeterConsumer.class);
      container.setup();

      QualifiedGreeterConsumer consumer = container.getComponent(QualifiedGreeterConsumer.class);
      assertInstanceOf(FrenchGreeter.class, consumer.greeter);
    }

    @Test
    @DisplayName("Unqualified requirement on several implementations fails setup")
    void ambiguousRequirement() {
      container.registerType(EnglishGreeter.class);
      container.registerType(FrenchGreeter.class);
      container.registerType(GreeterConsumer.class);

      assertThrows(AmbiguousComponentException.class, () -> container.setup());
      assertFalse(container.isSetUp());
    }

    @Test
    @DisplayName("Missing requirement fails setup")
    void missingRequirement() {
      container.registerType(GreeterConsumer.class);

      UnknownComponentException ex = assertThrows(UnknownComponentException.class, () -> container.setup());
      assertTrue(ex.getMessage().contains(Greeter.class.getName()));
    }

    @Test
    @DisplayName("Failed setup leaves no component usable and can be retried")
    void failedSetupIsAllOrNothing() {
      container.registerType(SampleClass.class);
      container.registerType(GreeterConsumer.class);

      assertThrows(UnknownComponentException.class, () -> container.setup());
      assertFalse(container.isSetUp());
      // sample_class was resolved before the failure but must not have been wired
      assertThrows(InvalidStateException.class, () -> container.getComponent(SampleClass.class));

      container.registerType(EnglishGreeter.class);
      container.setup();

      assertTrue(container.isSetUp());
      assertInstanceOf(EnglishGreeter.class, container.getComponent(GreeterConsumer.class).greeter);
      assertNotNull(container.getComponent(SampleClass.class));
    }

    @Test
    @DisplayName("Named requirement bound to an incompatible type fails setup")
    void typeMismatch() {
      container.registerInstance(42, "text");
      container.registerType(TextHolder.class);

      TypeMismatchException ex = assertThrows(TypeMismatchException.class, () -> container.setup());
      assertTrue(ex.getMessage().contains("parameter #0"));
    }

    @Test
    @DisplayName("Explicit requirements bypass parameter introspection")
    void explicitRequirements() {
      container.registerInstance("from-config", "greeting_text");
      container.registerType(TextHolder.class, "holder", Scope.SINGLETON,
                             Requirements.of(Requirement.named("greeting_text", String.class)));
      container.setup();

      assertEquals("from-config", container.getComponent("holder", TextHolder.class).text);
    }

    @Test
    @DisplayName("Trailing varargs parameter receives an empty array")
    void varArgsConstructor() {
      container.registerType(SampleClass.class);
      container.registerType(VarArgsBean.class);
      container.setup();

      VarArgsBean bean = container.getComponent(VarArgsBean.class);
      assertNotNull(bean.sample);
      assertEquals(0, bean.tags.length);
    }
  }

  @Nested
  @DisplayName("Scopes")
  class ScopeTests {

    @Test
    @DisplayName("Singleton returns the same instance for each request")
    void singletonIdentity() {
      container.registerType(SampleClass.class);
      container.setup();

      assertSame(container.getComponent(SampleClass.class), container.getComponent(SampleClass.class));
      assertSame(container.getComponent("sample_class"), container.getComponent(SampleClass.class));
    }

    @Test
    @DisplayName("Prototype returns a new instance built from the same dependencies")
    void prototypeIdentity() {
      container.registerType(SampleClass.class);
      container.registerPrototype(PrototypeBean.class);
      container.setup();

      PrototypeBean bean1 = container.getComponent(PrototypeBean.class);
      PrototypeBean bean2 = container.getComponent(PrototypeBean.class);

      assertNotSame(bean1, bean2);
      assertNotEquals(bean1.id, bean2.id);
      assertSame(bean1.sample, bean2.sample, "Singleton dependency must be shared between prototypes");
    }
  }

  @Nested
  @DisplayName("Cycles and failures")
  class CycleTests {

    @Test
    @DisplayName("A -> B -> C -> A is reported with its full path")
    void cyclicReference() {
      container.registerTypes(A.class, B.class, C.class).setup();

      CyclicDependencyException ex = assertThrows(CyclicDependencyException.class, () -> container.getComponent(A.class));
      assertEquals(List.of("a", "b", "c", "a"), ex.cycle());
      assertEquals("Cyclic dependency detected: a -> b -> c -> a", ex.getMessage());
    }

    @Test
    @DisplayName("The cycle starts at whichever component was requested")
    void cycleFromEveryEntryPoint() {
      container.registerTypes(A.class, B.class, C.class).setup();

      assertEquals(List.of("b", "c", "a", "b"),
                   assertThrows(CyclicDependencyException.class, () -> container.getComponent("b")).cycle());
      assertEquals(List.of("c", "a", "b", "c"),
                   assertThrows(CyclicDependencyException.class, () -> container.getComponent(C.class)).cycle());
    }

    @Test
    @DisplayName("A component looking itself up while being built is a cycle")
    void selfLookup() {
      container.registerType(SelfLookupBean.class).setup();

      CyclicDependencyException ex =
          assertThrows(CyclicDependencyException.class, () -> container.getComponent(SelfLookupBean.class));
      assertEquals(List.of("self_lookup_bean", "self_lookup_bean"), ex.cycle());
    }

    @Test
    @DisplayName("A failed resolution does not leak into the next one")
    void guardsReleasedAfterFailure() {
      container.registerTypes(A.class, B.class, C.class, SampleClass.class, UncheckedFailureBean.class).setup();

      assertThrows(CyclicDependencyException.class, () -> container.getComponent(A.class));
      assertNotNull(container.getComponent(SampleClass.class));

      IllegalStateException first =
          assertThrows(IllegalStateException.class, () -> container.getComponent(UncheckedFailureBean.class));
      assertEquals("refusing to start", first.getMessage());
      // a second attempt builds again instead of reporting a cycle
      assertThrows(IllegalStateException.class, () -> container.getComponent(UncheckedFailureBean.class));
    }

    @Test
    @DisplayName("Checked constructor exceptions are wrapped")
    void checkedConstructorFailure() {
      container.registerType(CheckedFailureBean.class).setup();

      ComponentCreationException ex =
          assertThrows(ComponentCreationException.class, () -> container.getComponent(CheckedFailureBean.class));
      assertEquals("disk unavailable", ex.getCause().getMessage());
      assertTrue(ex.getMessage().contains("checked_failure_bean"));
    }
  }
}
