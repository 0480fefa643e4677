package ca.gc.cra.patmat.domain.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DispatchKeyTest {

  @Test
  void keywordOrderDoesNotAffectEquality() {
    Map<String, Object> first = new LinkedHashMap<>();
    first.put("b", 2);
    first.put("a", 1);
    Map<String, Object> second = new LinkedHashMap<>();
    second.put("a", 1);
    second.put("b", 2);

    DispatchKey left = DispatchKey.of(List.of(Integer.class), first);
    DispatchKey right = DispatchKey.of(List.of(Integer.class), second);

    assertEquals(left, right);
    assertEquals(left.hashCode(), right.hashCode());
    assertEquals("a", left.keywords().get(0).name());
  }

  @Test
  void positionalTokensMayBeNull() {
    DispatchKey key = DispatchKey.of(Arrays.asList(null, "x"), null);
    assertEquals(DispatchKey.positional(null, "x"), key);
    assertEquals("[<null>, \"x\"]", key.toString());
  }

  @Test
  void keysDifferByKeywordSpecs() {
    assertNotEquals(DispatchKey.positional(1), DispatchKey.of(List.of(1), Map.of("k", 1)));
  }

  @Test
  void duplicateKeywordSpecsAreRejected() {
    List<DispatchKey.KeywordSpec> specs = List.of(
        new DispatchKey.KeywordSpec("k", 1), new DispatchKey.KeywordSpec("k", 2));
    assertThrows(IllegalArgumentException.class, () -> new DispatchKey(List.of(), specs));
  }
}
