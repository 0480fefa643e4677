package ca.gc.cra.patmat.application.dispatch;

import ca.gc.cra.patmat.domain.dispatch.ArityPolicy;
import ca.gc.cra.patmat.domain.dispatch.CallArguments;
import ca.gc.cra.patmat.domain.dispatch.Candidate;
import ca.gc.cra.patmat.domain.dispatch.DispatchKey;
import ca.gc.cra.patmat.domain.pattern.MatchResult;
import ca.gc.cra.patmat.domain.pattern.Pattern;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Evaluates the registered methods of a generic function against one call.
 * <p><strong>Why:</strong> Method combiners need the applicable methods in registration order, each paired
 * with the arguments its patterns derived, and must be able to stop after the first one.</p>
 * <p><strong>Role:</strong> Application service used by {@link GenericFunction}; stateless apart from its
 * configuration.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the pattern constructor, statically or from the call arguments.</li>
 *   <li>Pair spec tokens with arguments by position and by keyword name.</li>
 *   <li>Yield candidates lazily from a single registry snapshot.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent calls; each call reads one immutable snapshot.</p>
 * <p><strong>Observability:</strong> Logs constructor resolution at DEBUG and every entry decision at TRACE.</p>
 *
 * @implNote Patterns are constructed from spec tokens on every evaluation; nothing is cached.
 * @param <V> result type of the registered implementations
 * @since 0.1.0
 */
public final class DispatchEngine<V> {
  private static final Logger log = LoggerFactory.getLogger(DispatchEngine.class);

  private final String genericName;
  private final MethodRegistry<V> registry;
  private final PatternConstructor patternConstructor;
  private final PatternConstructorSource constructorSource;
  private final ArityPolicy arityPolicy;

  /**
   * Creates an engine. Exactly one of {@code patternConstructor} and {@code constructorSource} is set.
   *
   * @param genericName owning generic function name
   * @param registry method table
   * @param patternConstructor static constructor, or {@code null} when {@code constructorSource} is used
   * @param constructorSource per-call constructor source, or {@code null} for a static constructor
   * @param arityPolicy policy for calls with fewer arguments than spec tokens
   */
  DispatchEngine(
      String genericName,
      MethodRegistry<V> registry,
      PatternConstructor patternConstructor,
      PatternConstructorSource constructorSource,
      ArityPolicy arityPolicy) {
    this.genericName = Objects.requireNonNull(genericName, "genericName");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.arityPolicy = Objects.requireNonNull(arityPolicy, "arityPolicy");
    if ((patternConstructor == null) == (constructorSource == null)) {
      throw new IllegalArgumentException(
          "Exactly one of patternConstructor and constructorSource must be set");
    }
    this.patternConstructor = patternConstructor;
    this.constructorSource = constructorSource;
  }

  /**
   * Resolves the pattern constructor for one call.
   *
   * @param arguments actual call arguments
   * @return static constructor, the source's constructor, or the identity constructor
   */
  public PatternConstructor resolveConstructor(CallArguments arguments) {
    if (patternConstructor != null) {
      return patternConstructor;
    }
    Optional<PatternConstructor> resolved = constructorSource.resolve(arguments);
    if (resolved == null || resolved.isEmpty()) {
      log.debug("Generic '{}' resolved no constructor for {}; using identity", genericName, arguments);
      return PatternConstructors.identity();
    }
    return resolved.get();
  }

  /**
   * Returns the applicable methods for {@code arguments} in registration order.
   *
   * <p>The stream is lazy: an entry is evaluated only when the consumer pulls it.</p>
   *
   * @param arguments actual call arguments
   * @return lazy candidate stream
   */
  public Stream<Candidate<V>> candidates(CallArguments arguments) {
    Objects.requireNonNull(arguments, "arguments");
    PatternConstructor constructor = resolveConstructor(arguments);
    List<MethodRegistry.Entry<V>> entries = registry.entries();
    return entries.stream()
        .map(entry -> evaluate(entry, arguments, constructor))
        .flatMap(Optional::stream);
  }

  ArityPolicy arityPolicy() {
    return arityPolicy;
  }

  private Optional<Candidate<V>> evaluate(
      MethodRegistry.Entry<V> entry, CallArguments arguments, PatternConstructor constructor) {
    DispatchKey key = entry.key();
    List<Object> specs = key.positional();
    if (arguments.size() < specs.size() && arityPolicy == ArityPolicy.STRICT) {
      log.trace("Generic '{}' skips {}: {} arguments for {} specs", genericName, key, arguments.size(),
          specs.size());
      return Optional.empty();
    }

    List<Object> positional = new ArrayList<>(arguments.positional());
    int paired = Math.min(specs.size(), positional.size());
    for (int i = 0; i < paired; i++) {
      MatchResult result = build(constructor, specs.get(i)).attempt(positional.get(i));
      if (!result.matched()) {
        log.trace("Generic '{}' skips {}: argument {} does not match", genericName, key, i);
        return Optional.empty();
      }
      positional.set(i, result.value());
    }

    Map<String, Object> keywords = new LinkedHashMap<>(arguments.keywords());
    for (DispatchKey.KeywordSpec spec : key.keywords()) {
      if (!arguments.hasKeyword(spec.name())) {
        log.trace("Generic '{}' skips {}: keyword '{}' missing", genericName, key, spec.name());
        return Optional.empty();
      }
      MatchResult result = build(constructor, spec.spec()).attempt(arguments.keyword(spec.name()));
      if (!result.matched()) {
        log.trace("Generic '{}' skips {}: keyword '{}' does not match", genericName, key, spec.name());
        return Optional.empty();
      }
      keywords.put(spec.name(), result.value());
    }

    log.trace("Generic '{}' selects {}", genericName, key);
    return Optional.of(new Candidate<>(key, entry.implementation(), new CallArguments(positional, keywords)));
  }

  private Pattern build(PatternConstructor constructor, Object spec) {
    Pattern pattern = constructor.construct(spec);
    if (pattern == null) {
      throw new IllegalStateException(
          "Pattern constructor of generic '" + genericName + "' returned null for spec " + spec);
    }
    return pattern;
  }
}
