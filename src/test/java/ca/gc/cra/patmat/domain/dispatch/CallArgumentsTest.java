package ca.gc.cra.patmat.domain.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CallArgumentsTest {

  @Test
  void positionalArgumentsAcceptNull() {
    CallArguments arguments = CallArguments.of(1, null, "x");
    assertEquals(3, arguments.size());
    assertNull(arguments.get(1));
    assertEquals("(1, <null>, \"x\")", arguments.toString());
  }

  @Test
  void builderKeepsKeywordOrder() {
    CallArguments arguments = CallArguments.builder()
        .add(1)
        .keyword("scale", 2)
        .keyword("unit", null)
        .build();
    assertTrue(arguments.hasKeyword("unit"));
    assertNull(arguments.keyword("unit"));
    assertFalse(arguments.hasKeyword("missing"));
    assertEquals("(1, scale=2, unit=<null>)", arguments.toString());
  }

  @Test
  void argumentsAreImmutableCopies() {
    List<Object> source = new ArrayList<>(List.of(1, 2));
    CallArguments arguments = new CallArguments(source, null);
    source.add(3);
    assertEquals(2, arguments.size());
    assertThrows(UnsupportedOperationException.class, () -> arguments.positional().add(4));
  }

  @Test
  void emptyCallHasNoArguments() {
    assertTrue(CallArguments.of().isEmpty());
    assertEquals("()", CallArguments.of().toString());
  }

  @Test
  void builderRejectsBlankKeywords() {
    assertThrows(IllegalArgumentException.class, () -> CallArguments.builder().keyword(" ", 1));
  }
}
