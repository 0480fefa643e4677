package ca.gc.cra.patmat.application.dispatch;

import ca.gc.cra.patmat.domain.dispatch.DispatchKey;
import ca.gc.cra.patmat.domain.dispatch.Implementation;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ordered table of the methods registered under one generic function.
 * <p><strong>Why:</strong> Dispatch order is registration order, so the table must remember insertion
 * position while still allowing a method to be replaced by registering the same key again.</p>
 * <p><strong>Role:</strong> Application-layer state owned by {@link GenericFunction} and read by
 * {@link DispatchEngine}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append new keys at the end; replace the implementation of an existing key in place.</li>
 *   <li>Publish immutable snapshots so a dispatch iterates a consistent view.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Registrations are serialized; readers never lock and see either the
 * previous or the next snapshot.</p>
 * <p><strong>Observability:</strong> Logs registrations and replacements at DEBUG.</p>
 *
 * @param <V> result type of the registered implementations
 * @since 0.1.0
 */
public final class MethodRegistry<V> {
  private static final Logger log = LoggerFactory.getLogger(MethodRegistry.class);

  private final String owner;
  private final AtomicReference<Snapshot<V>> snapshot = new AtomicReference<>(Snapshot.empty());
  private final Object writeLock = new Object();

  /**
   * Creates an empty registry.
   *
   * @param owner name of the owning generic function, used in log messages
   */
  public MethodRegistry(String owner) {
    this.owner = Objects.requireNonNull(owner, "owner");
  }

  /**
   * Registers {@code implementation} under {@code key}.
   *
   * @param key dispatch key
   * @param implementation method body
   * @return {@code true} when an existing method was replaced in place
   */
  public boolean register(DispatchKey key, Implementation<V> implementation) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(implementation, "implementation");
    synchronized (writeLock) {
      Snapshot<V> current = snapshot.get();
      List<Entry<V>> entries = new ArrayList<>(current.entries());
      Map<DispatchKey, Integer> index = new HashMap<>(current.index());
      Integer position = index.get(key);
      Entry<V> entry = new Entry<>(key, implementation);
      if (position != null) {
        entries.set(position, entry);
      } else {
        index.put(key, entries.size());
        entries.add(entry);
      }
      snapshot.set(new Snapshot<>(List.copyOf(entries), Map.copyOf(index)));
      if (position != null) {
        log.debug("Replaced method {} of generic '{}' at position {}", key, owner, position);
      } else {
        log.debug("Registered method {} of generic '{}' at position {}", key, owner, entries.size() - 1);
      }
      return position != null;
    }
  }

  /**
   * Finds the implementation registered under exactly {@code key}.
   *
   * @param key dispatch key
   * @return implementation, or empty when the key was never registered
   */
  public Optional<Implementation<V>> lookup(DispatchKey key) {
    Objects.requireNonNull(key, "key");
    Snapshot<V> current = snapshot.get();
    Integer position = current.index().get(key);
    return position == null ? Optional.empty() : Optional.of(current.entries().get(position).implementation());
  }

  /**
   * Returns the current entries in registration order.
   *
   * @return immutable snapshot; later registrations do not affect it
   */
  public List<Entry<V>> entries() {
    return snapshot.get().entries();
  }

  /**
   * Returns the registered keys in registration order.
   *
   * @return immutable key list
   */
  public List<DispatchKey> keys() {
    return entries().stream().map(Entry::key).toList();
  }

  public int size() {
    return snapshot.get().entries().size();
  }

  /**
   * Registered method: key plus implementation.
   *
   * @param key dispatch key
   * @param implementation method body
   * @param <V> result type
   */
  public record Entry<V>(DispatchKey key, Implementation<V> implementation) {
    /**
     * Validates components.
     */
    public Entry {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(implementation, "implementation");
    }
  }

  private record Snapshot<V>(List<Entry<V>> entries, Map<DispatchKey, Integer> index) {
    static <V> Snapshot<V> empty() {
      return new Snapshot<>(List.of(), Map.of());
    }
  }
}
