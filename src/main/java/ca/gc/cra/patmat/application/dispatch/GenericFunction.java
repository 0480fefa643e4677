package ca.gc.cra.patmat.application.dispatch;

import ca.gc.cra.patmat.application.port.MetricsPort;
import ca.gc.cra.patmat.config.DispatchConfig;
import ca.gc.cra.patmat.domain.dispatch.ArityPolicy;
import ca.gc.cra.patmat.domain.dispatch.CallArguments;
import ca.gc.cra.patmat.domain.dispatch.Candidate;
import ca.gc.cra.patmat.domain.dispatch.DispatchCall;
import ca.gc.cra.patmat.domain.dispatch.DispatchFailure;
import ca.gc.cra.patmat.domain.dispatch.DispatchKey;
import ca.gc.cra.patmat.domain.dispatch.Implementation;
import ca.gc.cra.patmat.logging.LoggingConfigurator;
import ca.gc.cra.patmat.validation.Strings;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Named function whose implementation is chosen per call by matching the actual
 * arguments against the patterns of its registered methods.
 * <p><strong>Why:</strong> Lets behaviour be extended by registering further methods rather than editing a
 * central conditional.</p>
 * <p><strong>Role:</strong> Application entry point tying together the {@link MethodRegistry}, the
 * {@link DispatchEngine} and a {@link MethodCombiner}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Register methods under spec tokens; re-registration replaces in place.</li>
 *   <li>Dispatch calls and combine the applicable methods' results.</li>
 *   <li>Emit {@code <prefix>.<name>.calls}, {@code .candidates}, {@code .failures} and
 *   {@code .latencyNanos} metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Registration and invocation may run concurrently from any thread.</p>
 * <p><strong>Observability:</strong> Logs dispatch failures at DEBUG before rethrowing them.</p>
 *
 * @param <V> result type of the registered implementations
 * @param <R> result type of the generic function, as produced by its combiner
 * @since 0.1.0
 */
public final class GenericFunction<V, R> {
  private static final Logger log = LoggerFactory.getLogger(GenericFunction.class);

  private final String name;
  private final MethodRegistry<V> registry;
  private final DispatchEngine<V> engine;
  private final MethodCombiner<V, R> combiner;
  private final MetricsPort metrics;
  private final int maxDiagnosticBytes;
  private final String callsMetric;
  private final String candidatesMetric;
  private final String failuresMetric;
  private final String latencyMetric;

  private GenericFunction(Builder<V, R> builder) {
    this.name = builder.name;
    this.registry = new MethodRegistry<>(builder.name);
    PatternConstructor constructor = builder.patternConstructor;
    if (constructor == null && builder.constructorSource == null) {
      constructor = PatternConstructors.identity();
    }
    this.engine = new DispatchEngine<>(
        builder.name, registry, constructor, builder.constructorSource, builder.config.arityPolicy());
    this.combiner = builder.combiner;
    this.metrics = builder.config.metricsEnabled() ? builder.metrics : MetricsPort.NO_OP;
    this.maxDiagnosticBytes = builder.config.maxDiagnosticBytes();
    String prefix = builder.config.metricPrefix() + "." + builder.name;
    this.callsMetric = prefix + ".calls";
    this.candidatesMetric = prefix + ".candidates";
    this.failuresMetric = prefix + ".failures";
    this.latencyMetric = prefix + ".latencyNanos";
    if (builder.config.traceDispatch()) {
      LoggingConfigurator.enableDispatchTracing();
    }
  }

  /**
   * Starts a builder. The default combiner is {@link MethodCombiners#first()} and the default pattern
   * constructor is {@link PatternConstructors#identity()}.
   *
   * @param name generic function name; must not be blank
   * @param <V> result type of the implementations
   * @return builder
   */
  public static <V> Builder<V, V> builder(String name) {
    return new Builder<>(Strings.requireNonBlank("name", name), MethodCombiners.first());
  }

  /**
   * Declares an apply-first generic function with a static pattern constructor.
   *
   * @param name generic function name
   * @param constructor pattern constructor applied to every spec token
   * @param <V> result type
   * @return generic function without methods
   */
  public static <V> GenericFunction<V, V> declare(String name, PatternConstructor constructor) {
    return GenericFunction.<V>builder(name).patternConstructor(constructor).build();
  }

  /**
   * Declares an apply-first generic function whose pattern constructor is computed per call.
   *
   * @param name generic function name
   * @param source per-call constructor source
   * @param <V> result type
   * @return generic function without methods
   */
  public static <V> GenericFunction<V, V> declareDynamic(String name, PatternConstructorSource source) {
    return GenericFunction.<V>builder(name).patternConstructorSource(source).build();
  }

  public String name() {
    return name;
  }

  /**
   * Registers a method under positional and keyword spec tokens.
   *
   * @param positionalSpecs positional spec tokens; may be {@code null} for none
   * @param keywordSpecs keyword spec tokens; may be {@code null} for none
   * @param implementation method body
   * @return this generic function
   */
  public GenericFunction<V, R> register(
      List<?> positionalSpecs, Map<String, ?> keywordSpecs, Implementation<V> implementation) {
    registry.register(DispatchKey.of(positionalSpecs, keywordSpecs), implementation);
    return this;
  }

  /**
   * Registers a method under positional spec tokens only.
   *
   * @param implementation method body
   * @param positionalSpecs positional spec tokens
   * @return this generic function
   */
  public GenericFunction<V, R> register(Implementation<V> implementation, Object... positionalSpecs) {
    return register(asList(positionalSpecs), Map.of(), implementation);
  }

  /**
   * Starts a method declaration for registrations that also carry keyword specs.
   *
   * @param positionalSpecs positional spec tokens
   * @return declaration to complete with {@link MethodDeclaration#register(Implementation)}
   */
  public MethodDeclaration method(Object... positionalSpecs) {
    return new MethodDeclaration(asList(positionalSpecs));
  }

  /**
   * Finds the method registered under exactly these positional spec tokens and no keyword specs.
   *
   * @param positionalSpecs positional spec tokens
   * @return implementation, or empty
   */
  public Optional<Implementation<V>> lookup(Object... positionalSpecs) {
    return lookup(asList(positionalSpecs), Map.of());
  }

  /**
   * Finds the method registered under exactly this key.
   *
   * @param positionalSpecs positional spec tokens
   * @param keywordSpecs keyword spec tokens
   * @return implementation, or empty
   */
  public Optional<Implementation<V>> lookup(List<?> positionalSpecs, Map<String, ?> keywordSpecs) {
    return registry.lookup(DispatchKey.of(positionalSpecs, keywordSpecs));
  }

  /**
   * Returns the registered keys in dispatch order.
   *
   * @return immutable key list
   */
  public List<DispatchKey> methods() {
    return registry.keys();
  }

  /**
   * Invokes the generic function with positional arguments.
   *
   * <p>Java varargs rules apply: a lone {@code Object[]} (or any reference-type array) is spread into
   * separate arguments. To pass one array as a single argument, build the call explicitly with
   * {@code CallArguments.builder().add(array).build()} and use {@link #invoke(CallArguments)}.</p>
   *
   * @param arguments positional arguments
   * @return combined result
   * @throws DispatchFailure when no method applies
   */
  public R invoke(Object... arguments) {
    return invoke(CallArguments.of(arguments));
  }

  /**
   * Invokes the generic function.
   *
   * @param arguments positional and keyword arguments
   * @return combined result
   * @throws DispatchFailure when no method applies
   */
  public R invoke(CallArguments arguments) {
    Objects.requireNonNull(arguments, "arguments");
    DispatchCall call = new DispatchCall(name, arguments, maxDiagnosticBytes);
    AtomicInteger consumed = new AtomicInteger();
    long start = System.nanoTime();
    metrics.increment(callsMetric);
    try {
      Stream<Candidate<V>> candidates = engine.candidates(arguments).peek(candidate -> consumed.incrementAndGet());
      return combiner.combine(call, candidates);
    } catch (DispatchFailure failure) {
      if (failure.call() == call) {
        metrics.increment(failuresMetric);
        log.debug("Generic '{}' found no applicable method for {}", name, arguments);
      }
      throw failure;
    } finally {
      metrics.observe(candidatesMetric, consumed.get());
      metrics.observe(latencyMetric, System.nanoTime() - start);
    }
  }

  /**
   * Returns the applicable methods for a call without invoking them.
   *
   * @param arguments positional and keyword arguments
   * @return lazy candidate stream in registration order
   */
  public Stream<Candidate<V>> candidates(CallArguments arguments) {
    return engine.candidates(arguments);
  }

  /**
   * Returns the applicable methods for a positional call without invoking them.
   *
   * @param arguments positional arguments
   * @return lazy candidate stream in registration order
   */
  public Stream<Candidate<V>> candidates(Object... arguments) {
    return candidates(CallArguments.of(arguments));
  }

  public ArityPolicy arityPolicy() {
    return engine.arityPolicy();
  }

  @Override
  public String toString() {
    return "GenericFunction[" + name + ", methods=" + registry.size() + "]";
  }

  private static List<Object> asList(Object[] values) {
    return values == null ? List.of() : Arrays.asList(values);
  }

  /** Pending registration collecting keyword spec tokens. */
  public final class MethodDeclaration {
    private final List<Object> positionalSpecs;
    private final Map<String, Object> keywordSpecs = new LinkedHashMap<>();

    private MethodDeclaration(List<Object> positionalSpecs) {
      this.positionalSpecs = positionalSpecs;
    }

    /**
     * Adds a keyword spec token.
     *
     * @param keyword keyword argument name; must not be blank
     * @param spec spec token
     * @return this declaration
     */
    public MethodDeclaration keyword(String keyword, Object spec) {
      keywordSpecs.put(Strings.requireNonBlank("keyword", keyword), spec);
      return this;
    }

    /**
     * Registers the declared method.
     *
     * @param implementation method body
     * @return owning generic function
     */
    public GenericFunction<V, R> register(Implementation<V> implementation) {
      return GenericFunction.this.register(positionalSpecs, keywordSpecs, implementation);
    }
  }

  /**
   * Builder for {@link GenericFunction}.
   *
   * @param <V> result type of the implementations
   * @param <R> result type of the generic function
   */
  public static final class Builder<V, R> {
    private final String name;
    private final MethodCombiner<V, R> combiner;
    private PatternConstructor patternConstructor;
    private PatternConstructorSource constructorSource;
    private DispatchConfig config = DispatchConfig.defaults();
    private MetricsPort metrics = MetricsPort.NO_OP;

    private Builder(String name, MethodCombiner<V, R> combiner) {
      this.name = name;
      this.combiner = Objects.requireNonNull(combiner, "combiner");
    }

    /**
     * Replaces the method combiner, possibly changing the generic function's result type.
     *
     * @param combiner combiner to use
     * @param <R2> new result type
     * @return builder carrying over every other setting
     */
    public <R2> Builder<V, R2> combiner(MethodCombiner<V, R2> combiner) {
      Builder<V, R2> next = new Builder<>(name, combiner);
      next.patternConstructor = patternConstructor;
      next.constructorSource = constructorSource;
      next.config = config;
      next.metrics = metrics;
      return next;
    }

    public Builder<V, R> patternConstructor(PatternConstructor patternConstructor) {
      this.patternConstructor = Objects.requireNonNull(patternConstructor, "patternConstructor");
      return this;
    }

    public Builder<V, R> patternConstructorSource(PatternConstructorSource constructorSource) {
      this.constructorSource = Objects.requireNonNull(constructorSource, "constructorSource");
      return this;
    }

    /**
     * Applies dispatch settings (arity policy, metrics switch and prefix, diagnostics budget, tracing).
     *
     * @param config dispatch configuration
     * @return this builder
     */
    public Builder<V, R> config(DispatchConfig config) {
      this.config = Objects.requireNonNull(config, "config");
      return this;
    }

    /**
     * Overrides only the arity policy of the current configuration.
     *
     * @param arityPolicy policy for calls with fewer arguments than spec tokens
     * @return this builder
     */
    public Builder<V, R> arityPolicy(ArityPolicy arityPolicy) {
      this.config = config.withArityPolicy(Objects.requireNonNull(arityPolicy, "arityPolicy"));
      return this;
    }

    public Builder<V, R> metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    /**
     * Builds the generic function.
     *
     * @return generic function without methods
     * @throws IllegalStateException when both a static constructor and a constructor source were set
     */
    public GenericFunction<V, R> build() {
      if (patternConstructor != null && constructorSource != null) {
        throw new IllegalStateException(
            "Generic '" + name + "' cannot have both a pattern constructor and a constructor source");
      }
      return new GenericFunction<>(this);
    }
  }
}
