package ca.gc.cra.patmat.domain.pattern;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Subscript and named-field extraction patterns.
 *
 * <p>Every lookup error, whether the key is absent or the value has no such shape, ends as
 * {@link MatchResult#none()}.</p>
 *
 * @since 0.1.0
 */
final class Lookups {

  private Lookups() {
    // Utility
  }

  static final class Key implements Pattern {
    private final Object key;

    Key(Object key) {
      this.key = key;
    }

    @Override
    public MatchResult attempt(Object value) {
      return subscript(value, key);
    }

    @Override
    public String toString() {
      return "Key(" + key + ")";
    }
  }

  static final class Keys implements Pattern {
    private final List<Object> keys;

    Keys(List<Object> keys) {
      this.keys = keys;
    }

    @Override
    public MatchResult attempt(Object value) {
      List<Object> values = new ArrayList<>(keys.size());
      for (Object key : keys) {
        MatchResult result = subscript(value, key);
        if (!result.matched()) {
          return result;
        }
        values.add(result.value());
      }
      return MatchResult.of(new Tuple(values));
    }

    @Override
    public String toString() {
      return "Keys" + keys;
    }
  }

  static final class Attr implements Pattern {
    private final String name;

    Attr(String name) {
      this.name = name;
    }

    @Override
    public MatchResult attempt(Object value) {
      return attribute(value, name);
    }

    @Override
    public String toString() {
      return "Attr(" + name + ")";
    }
  }

  static final class Attrs implements Pattern {
    private final List<String> names;

    Attrs(List<String> names) {
      this.names = names;
    }

    @Override
    public MatchResult attempt(Object value) {
      List<Object> values = new ArrayList<>(names.size());
      for (String name : names) {
        MatchResult result = attribute(value, name);
        if (!result.matched()) {
          return result;
        }
        values.add(result.value());
      }
      return MatchResult.of(new Tuple(values));
    }

    @Override
    public String toString() {
      return "Attrs" + names;
    }
  }

  static MatchResult subscript(Object target, Object key) {
    if (target == null) {
      return MatchResult.none();
    }
    try {
      if (target instanceof Subscriptable subscriptable) {
        return Objects.requireNonNullElse(subscriptable.subscript(key), MatchResult.none());
      }
      if (target instanceof Map<?, ?> map) {
        return map.containsKey(key) ? MatchResult.of(map.get(key)) : MatchResult.none();
      }
      Integer index = toIndex(key);
      if (index == null) {
        return MatchResult.none();
      }
      if (target instanceof List<?> list) {
        int position = normalize(index, list.size());
        return position < 0 ? MatchResult.none() : MatchResult.of(list.get(position));
      }
      if (target instanceof CharSequence text) {
        int position = normalize(index, text.length());
        return position < 0 ? MatchResult.none() : MatchResult.of(String.valueOf(text.charAt(position)));
      }
      if (target.getClass().isArray()) {
        int position = normalize(index, Array.getLength(target));
        return position < 0 ? MatchResult.none() : MatchResult.of(Array.get(target, position));
      }
      return MatchResult.none();
    } catch (RuntimeException ex) {
      // Maps that reject null or foreign keys, and custom subscript implementations, fail the match.
      return MatchResult.none();
    }
  }

  static MatchResult attribute(Object target, String name) {
    if (target == null) {
      return MatchResult.none();
    }
    Class<?> type = target.getClass();
    try {
      if (type.isRecord()) {
        for (RecordComponent component : type.getRecordComponents()) {
          if (component.getName().equals(name)) {
            return invoke(component.getAccessor(), target);
          }
        }
      }
      Method getter = findGetter(type, name);
      if (getter != null) {
        return invoke(getter, target);
      }
      Field field = type.getField(name);
      if (Modifier.isStatic(field.getModifiers())) {
        return MatchResult.none();
      }
      if (!field.canAccess(target) && !field.trySetAccessible()) {
        return MatchResult.none();
      }
      return MatchResult.of(field.get(target));
    } catch (NoSuchFieldException | IllegalAccessException | RuntimeException ex) {
      return MatchResult.none();
    }
  }

  // Only JavaBean getters qualify. Bare methods such as pop() or next() and the atomic getAndX
  // read-modify-write family would change the value being matched.
  private static Method findGetter(Class<?> type, String name) {
    String capitalized = name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    if (!isReadModifyWrite(capitalized)) {
      Method getter = findAccessor(type, "get" + capitalized);
      if (getter != null) {
        return getter;
      }
    }
    Method predicate = findAccessor(type, "is" + capitalized);
    if (predicate != null
        && (predicate.getReturnType() == boolean.class || predicate.getReturnType() == Boolean.class)) {
      return predicate;
    }
    return null;
  }

  private static boolean isReadModifyWrite(String capitalized) {
    return capitalized.length() > 3
        && capitalized.startsWith("And")
        && Character.isUpperCase(capitalized.charAt(3));
  }

  private static Method findAccessor(Class<?> type, String name) {
    try {
      Method method = type.getMethod(name);
      if (Modifier.isStatic(method.getModifiers()) || method.getReturnType() == void.class) {
        return null;
      }
      return method;
    } catch (NoSuchMethodException ex) {
      return null;
    }
  }

  private static MatchResult invoke(Method accessor, Object target) throws IllegalAccessException {
    Method callable = accessible(accessor, target);
    if (callable == null) {
      return MatchResult.none();
    }
    try {
      return MatchResult.of(callable.invoke(target));
    } catch (InvocationTargetException ex) {
      return MatchResult.none();
    }
  }

  // Public methods declared on non-public classes (JDK immutable collections, private nested types) are
  // reachable through a public supertype declaring the same method.
  private static Method accessible(Method method, Object target) {
    if (method.canAccess(target) || method.trySetAccessible()) {
      return method;
    }
    Deque<Class<?>> pending = new ArrayDeque<>();
    pending.add(target.getClass());
    while (!pending.isEmpty()) {
      Class<?> owner = pending.poll();
      if (Modifier.isPublic(owner.getModifiers())) {
        Method candidate = findAccessor(owner, method.getName());
        if (candidate != null && candidate.canAccess(target)) {
          return candidate;
        }
      }
      if (owner.getSuperclass() != null) {
        pending.add(owner.getSuperclass());
      }
      pending.addAll(Arrays.asList(owner.getInterfaces()));
    }
    return null;
  }

  private static Integer toIndex(Object key) {
    if (key instanceof Integer || key instanceof Short || key instanceof Byte) {
      return ((Number) key).intValue();
    }
    if (key instanceof Long value && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
      return value.intValue();
    }
    return null;
  }

  private static int normalize(int index, int length) {
    int position = index < 0 ? length + index : index;
    return position >= 0 && position < length ? position : -1;
  }
}
