package ca.gc.cra.patmat.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.patmat.domain.pattern.Pattern;
import ca.gc.cra.patmat.domain.pattern.Patterns;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PatternConstructorsTest {

  record Shape(String kind) {}

  @Test
  void identityUsesPatternsAsIsAndEqualityOtherwise() {
    Pattern key = Patterns.key("a");
    assertSame(key, PatternConstructors.identity().construct(key));
    assertTrue(PatternConstructors.identity().construct(3).matches(3));
    assertFalse(PatternConstructors.identity().construct(3).matches(4));
    assertTrue(PatternConstructors.identity().construct(null).matches(null));
  }

  @Test
  void byTypeAcceptsClassTokens() {
    PatternConstructor byType = PatternConstructors.byType();
    assertTrue(byType.construct(Number.class).matches(1));
    assertFalse(byType.construct(String.class).matches(1));
    assertTrue(byType.construct(Patterns.equal(1)).matches(1));
    assertThrows(IllegalArgumentException.class, () -> byType.construct("int"));
  }

  @Test
  void byKeyComparesSubscriptAndKeepsArgument() {
    Map<String, String> particle = Map.of("type", "particle");
    Pattern pattern = PatternConstructors.byKey("type").construct("particle");
    assertEquals(particle, pattern.attempt(particle).value());
    assertFalse(pattern.matches(Map.of("type", "triangle")));
    assertFalse(pattern.matches(Map.of()));
  }

  @Test
  void byAttributeComparesAttribute() {
    Pattern pattern = PatternConstructors.byAttribute("kind").construct("circle");
    assertTrue(pattern.matches(new Shape("circle")));
    assertFalse(pattern.matches(new Shape("square")));
  }

  @Test
  void byAttributeDoesNotConsumeTheArgument() {
    ArrayDeque<String> queue = new ArrayDeque<>(List.of("circle", "square"));
    PatternConstructor byPop = PatternConstructors.byAttribute("pop");
    assertFalse(byPop.construct("circle").matches(queue));
    assertFalse(byPop.construct("square").matches(queue));
    assertEquals(List.of("circle", "square"), new ArrayList<>(queue));
  }
}
