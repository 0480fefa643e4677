package ca.gc.cra.patmat.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.patmat.domain.dispatch.DispatchKey;
import ca.gc.cra.patmat.domain.dispatch.Implementation;
import java.util.List;
import org.junit.jupiter.api.Test;

class MethodRegistryTest {

  @Test
  void registrationOrderIsPreserved() {
    MethodRegistry<String> registry = new MethodRegistry<>("f");
    registry.register(DispatchKey.positional("a"), args -> "a");
    registry.register(DispatchKey.positional("b"), args -> "b");
    registry.register(DispatchKey.positional("c"), args -> "c");

    assertEquals(
        List.of(DispatchKey.positional("a"), DispatchKey.positional("b"), DispatchKey.positional("c")),
        registry.keys());
  }

  @Test
  void reRegistrationReplacesInPlace() {
    MethodRegistry<String> registry = new MethodRegistry<>("f");
    Implementation<String> replacement = args -> "a2";
    assertFalse(registry.register(DispatchKey.positional("a"), args -> "a1"));
    registry.register(DispatchKey.positional("b"), args -> "b");

    assertTrue(registry.register(DispatchKey.positional("a"), replacement));

    assertEquals(2, registry.size());
    assertEquals(DispatchKey.positional("a"), registry.entries().get(0).key());
    assertSame(replacement, registry.entries().get(0).implementation());
    assertSame(replacement, registry.lookup(DispatchKey.positional("a")).orElseThrow());
  }

  @Test
  void lookupMissesUnknownKeys() {
    MethodRegistry<String> registry = new MethodRegistry<>("f");
    registry.register(DispatchKey.positional("a"), args -> "a");
    assertTrue(registry.lookup(DispatchKey.positional("b")).isEmpty());
  }

  @Test
  void snapshotsAreUnaffectedByLaterRegistrations() {
    MethodRegistry<String> registry = new MethodRegistry<>("f");
    registry.register(DispatchKey.positional("a"), args -> "a");
    List<MethodRegistry.Entry<String>> snapshot = registry.entries();

    registry.register(DispatchKey.positional("b"), args -> "b");

    assertEquals(1, snapshot.size());
    assertEquals(2, registry.size());
  }
}
