package ca.gc.cra.patmat.domain.pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MatchResultTest {

  @Test
  void matchedNullIsDistinctFromFailure() {
    MatchResult matchedNull = MatchResult.of(null);
    assertTrue(matchedNull.matched());
    assertNull(matchedNull.value());
    assertFalse(MatchResult.none().matched());
    assertSame(MatchResult.none(), MatchResult.none());
  }

  @Test
  void failureHasNoValue() {
    assertThrows(IllegalStateException.class, () -> MatchResult.none().value());
    assertEquals("fallback", MatchResult.none().orElse("fallback"));
  }

  @Test
  void mapAndThenSkipFailures() {
    assertEquals(4, MatchResult.of(2).map(v -> (Integer) v * 2).value());
    assertSame(MatchResult.none(), MatchResult.none().map(v -> v));
    assertEquals(2, MatchResult.of(2).then(Patterns.type(Integer.class)).value());
    assertFalse(MatchResult.of(2).then(Patterns.type(String.class)).matched());
  }
}
