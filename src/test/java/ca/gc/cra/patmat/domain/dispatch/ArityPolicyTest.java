package ca.gc.cra.patmat.domain.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ArityPolicyTest {

  @Test
  void parsesNamesCaseInsensitively() {
    assertEquals(ArityPolicy.STRICT, ArityPolicy.from(" Strict "));
    assertEquals(ArityPolicy.LENIENT, ArityPolicy.from("lenient"));
    assertEquals(ArityPolicy.LENIENT, ArityPolicy.from(""));
    assertEquals(ArityPolicy.LENIENT, ArityPolicy.from(null));
  }

  @Test
  void rejectsUnknownNames() {
    assertThrows(IllegalArgumentException.class, () -> ArityPolicy.from("loose"));
  }
}
