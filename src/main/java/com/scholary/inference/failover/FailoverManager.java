package com.scholary.inference.failover;

import com.scholary.inference.config.InferenceProperties;
import com.scholary.inference.config.InferenceProperties.FailoverProperties;
import com.scholary.inference.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Tracks model health and picks alternates for models that fail.
 *
 * <p>Configurations are declared per model family. Every model id mentioned in a configuration
 * gets a {@link ModelStatus}, created lazily and never removed. Alternates are chosen uniformly at
 * random among those eligible for retry; selection is not load-aware.
 */
@Component
public class FailoverManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(FailoverManager.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ConcurrentMap<String, FailoverConfig> configs = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, ModelStatus> statuses = new ConcurrentHashMap<>();

  private final Deque<FailoverEvent> history = new ArrayDeque<>();
  private final int historySize;

  private final AtomicLong totalFailovers = new AtomicLong();
  private final AtomicLong successfulFailovers = new AtomicLong();
  private final AtomicLong failedFailovers = new AtomicLong();
  private final AtomicLong modelsRecovered = new AtomicLong();

  private final Clock clock;
  private final Random random;

  @Autowired
  public FailoverManager(InferenceProperties properties, Clock clock) {
    this(clock, properties.failover().historySize(), new Random());

    FailoverProperties failover = properties.failover();
    Duration cooldown = Duration.ofSeconds(failover.cooldownSeconds());
    failover
        .alternatives()
        .forEach((type, alternates) -> registerConfig(type, alternates, cooldown));
  }

  FailoverManager(Clock clock, int historySize, Random random) {
    this.clock = clock;
    this.historySize = historySize;
    this.random = random;
  }

  /**
   * Declare the alternates of every primary model in a family, replacing any earlier declaration
   * for that family.
   */
  public void registerConfig(
      String modelType, Map<String, List<String>> alternatesByPrimary, Duration cooldownBase) {
    FailoverConfig config = new FailoverConfig(modelType, alternatesByPrimary, cooldownBase);
    configs.put(modelType, config);
    config
        .alternatives()
        .forEach(
            (primary, alternates) -> {
              ensureStatus(primary);
              alternates.forEach(this::ensureStatus);
            });
    LOGGER.info(
        "Registered failover config: type={}, primaries={}, cooldown={}s",
        modelType,
        config.alternatives().size(),
        cooldownBase.toSeconds());
  }

  /** Add or replace the alternates of a single primary model. */
  public void configureAlternatives(
      String modelType, String modelId, List<String> alternates, Duration cooldownBase) {
    configs.compute(
        modelType,
        (type, existing) ->
            existing == null
                ? new FailoverConfig(type, Map.of(modelId, alternates), cooldownBase)
                : existing.withAlternatives(modelId, alternates, cooldownBase));
    ensureStatus(modelId);
    alternates.forEach(this::ensureStatus);
    LOGGER.info(
        "Configured failover: type={}, model={}, alternates={}", modelType, modelId, alternates);
  }

  /**
   * Pick a healthy alternate for a model that failed.
   *
   * @return an alternate eligible for retry, or empty if the family or model has no configuration
   *     or every alternate is cooling down
   */
  public Optional<String> getAlternative(String modelType, String originalModel) {
    FailoverConfig config = configs.get(modelType);
    if (config == null) {
      LOGGER.warn("No failover configuration for model type: {}", modelType);
      return Optional.empty();
    }
    List<String> alternates = config.alternatives().get(originalModel);
    if (alternates == null || alternates.isEmpty()) {
      LOGGER.warn("No alternatives configured for model: {}", originalModel);
      return Optional.empty();
    }

    List<String> eligible =
        alternates.stream()
            .filter(alt -> shouldRetry(alt, config.cooldownBase()))
            .collect(Collectors.toList());
    if (eligible.isEmpty()) {
      LOGGER.warn("No available alternatives for {}", originalModel);
      return Optional.empty();
    }
    return Optional.of(eligible.get(random.nextInt(eligible.size())));
  }

  public void markFailure(String modelId) {
    markFailure(modelId, null);
  }

  /** Record a failed use of a model, with the error that caused it for the log. */
  public void markFailure(String modelId, String error) {
    int failures = ensureStatus(modelId).markFailure(clock.instant());
    structuredLogger.logModelFailure(modelId, failures, error);
  }

  public void markSuccess(String modelId) {
    if (ensureStatus(modelId).markSuccess()) {
      modelsRecovered.incrementAndGet();
      LOGGER.info("Model recovered: {}", modelId);
    }
  }

  /**
   * Manually mark a known model healthy.
   *
   * @return false if the model id was never referenced
   */
  public boolean resetModel(String modelId) {
    if (!statuses.containsKey(modelId)) {
      return false;
    }
    markSuccess(modelId);
    LOGGER.info("Model status reset: {}", modelId);
    return true;
  }

  /** Append a failover attempt to the bounded history and update the counters. */
  public void recordFailoverEvent(
      String originalModel, String alternativeModel, boolean success, String error) {
    FailoverEvent event =
        new FailoverEvent(clock.instant(), originalModel, alternativeModel, success, error);
    synchronized (history) {
      history.addLast(event);
      while (history.size() > historySize) {
        history.removeFirst();
      }
    }

    totalFailovers.incrementAndGet();
    if (success) {
      successfulFailovers.incrementAndGet();
    } else {
      failedFailovers.incrementAndGet();
    }
    structuredLogger.logFailover(originalModel, alternativeModel, success);
  }

  public ModelHealthReport healthReport() {
    ModelHealthReport.Metrics metrics =
        new ModelHealthReport.Metrics(
            totalFailovers.get(),
            successfulFailovers.get(),
            failedFailovers.get(),
            modelsRecovered.get());

    Map<String, ModelStatus.Snapshot> models = new TreeMap<>();
    statuses.forEach((id, status) -> models.put(id, status.snapshot()));

    List<FailoverEvent> events;
    synchronized (history) {
      events = new ArrayList<>(history);
    }
    return new ModelHealthReport(metrics, models, events);
  }

  /** Configured families and, for each, its primary models with their alternates. */
  public Map<String, Map<String, List<String>>> configuredModels() {
    Map<String, Map<String, List<String>>> view = new TreeMap<>();
    configs.forEach((type, config) -> view.put(type, config.alternatives()));
    return view;
  }

  Optional<ModelStatus.Snapshot> status(String modelId) {
    return Optional.ofNullable(statuses.get(modelId)).map(ModelStatus::snapshot);
  }

  private boolean shouldRetry(String modelId, Duration cooldownBase) {
    ModelStatus status = statuses.get(modelId);
    return status != null && status.shouldRetry(cooldownBase, clock.instant());
  }

  private ModelStatus ensureStatus(String modelId) {
    return statuses.computeIfAbsent(modelId, ModelStatus::new);
  }
}
