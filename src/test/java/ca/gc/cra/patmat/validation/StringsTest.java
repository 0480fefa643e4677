package ca.gc.cra.patmat.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertEquals("name must not be blank", ex.getMessage());
  }

  @Test
  void requireNonBlankRejectsNull() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }
}
