package com.audience.segments.service;

import com.audience.segments.enums.RuleStatus;
import com.audience.segments.enums.SetOperation;
import com.audience.segments.model.RuleDto;
import com.audience.segments.pipeline.materialize.SegmentCatalogRepository;
import com.audience.segments.pipeline.scheduler.RuleSchedule;
import com.audience.segments.pipeline.scheduler.RuleSource;
import com.audience.segments.repository.RuleEntity;
import com.audience.segments.repository.RuleRepository;
import com.audience.segments.ruleengine.condition.ConditionModel;
import com.audience.segments.ruleengine.condition.ConditionParser;
import com.audience.segments.ruleengine.dependency.DependencyResolution;
import com.audience.segments.ruleengine.dependency.DependencyResolver;
import com.audience.segments.ruleengine.dependency.ResolvableRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rule CRUD. Saving a rule normalizes its condition tree and works out which existing
 * segments it can be derived from, unless the caller supplied the dependencies.
 */
@Service
public class RuleService implements RuleSource {

  private static final Logger log = LoggerFactory.getLogger(RuleService.class);

  private final RuleRepository repository;
  private final ConditionParser conditionParser;
  private final DependencyResolver dependencyResolver;
  private final SegmentCatalogRepository catalogRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public RuleService(RuleRepository repository,
                     ConditionParser conditionParser,
                     DependencyResolver dependencyResolver,
                     SegmentCatalogRepository catalogRepository,
                     ObjectMapper objectMapper,
                     Clock clock) {
    this.repository = repository;
    this.conditionParser = conditionParser;
    this.dependencyResolver = dependencyResolver;
    this.catalogRepository = catalogRepository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Transactional
  public RuleDto createRule(RuleDto request) {
    validateAttributes(request);
    if (repository.existsByName(request.name())) {
      throw new RuleConflictException("A rule named '" + request.name() + "' already exists");
    }
    ConditionModel model = conditionParser.normalize(request.conditions());

    Instant now = Instant.now(clock);
    RuleEntity entity = new RuleEntity();
    entity.setName(request.name());
    entity.setCreatedAt(now);
    applyAttributes(entity, request, model, now);
    entity.setStatus(request.status() != null ? request.status() : RuleStatus.ACTIVE);
    RuleEntity saved = repository.save(entity);

    if (saved.getStatus() == RuleStatus.ACTIVE) {
      applyDependencies(saved, model, request);
    }
    log.info("Created rule {} '{}'", saved.getId(), saved.getName());
    return toDto(repository.save(saved));
  }

  @Transactional(readOnly = true)
  public List<RuleDto> listRules(RuleStatus status) {
    List<RuleEntity> entities = status != null
        ? repository.findByStatusOrderByIdAsc(status)
        : repository.findAllByOrderByIdAsc();
    return entities.stream().map(this::toDto).toList();
  }

  /** One page of rules ordered by id; {@code page} starts at 1. */
  @Transactional(readOnly = true)
  public Page<RuleDto> listRules(RuleStatus status, int page, int perPage) {
    Pageable pageable = Paging.request(page, perPage, Sort.by("id"));
    Page<RuleEntity> entities = status != null
        ? repository.findByStatus(status, pageable)
        : repository.findAll(pageable);
    return entities.map(this::toDto);
  }

  @Transactional(readOnly = true)
  public Optional<RuleDto> getRule(Long ruleId) {
    return repository.findById(ruleId).map(this::toDto);
  }

  @Transactional
  public Optional<RuleDto> updateRule(Long ruleId, RuleDto request) {
    validateAttributes(request);
    return repository.findById(ruleId).map(existing -> {
      repository.findByName(request.name())
          .filter(other -> !other.getId().equals(ruleId))
          .ifPresent(other -> {
            throw new RuleConflictException("A rule named '" + request.name() + "' already exists");
          });
      ConditionModel model = conditionParser.normalize(request.conditions());
      existing.setName(request.name());
      applyAttributes(existing, request, model, Instant.now(clock));
      if (request.status() != null) {
        existing.setStatus(request.status());
      }
      if (existing.getStatus() == RuleStatus.ACTIVE) {
        applyDependencies(existing, model, request);
      }
      RuleEntity saved = repository.save(existing);
      log.info("Updated rule {} '{}'", saved.getId(), saved.getName());
      reresolveDependents(saved.getId(), new LinkedHashSet<>());
      return toDto(saved);
    });
  }

  /**
   * Deletes the rule and drops its segment.
   *
   * @throws RuleConflictException if another rule is derived from this one
   */
  @Transactional
  public boolean deleteRule(Long ruleId) {
    Optional<RuleEntity> found = repository.findById(ruleId);
    if (found.isEmpty()) {
      return false;
    }
    List<Long> dependents = repository.findAllByOrderByIdAsc().stream()
        .filter(rule -> rule.getDependsOn().contains(ruleId))
        .map(RuleEntity::getId)
        .toList();
    if (!dependents.isEmpty()) {
      throw new RuleConflictException(
          "Rule " + ruleId + " cannot be deleted; rules " + dependents + " depend on it");
    }
    repository.delete(found.get());
    catalogRepository.deleteByRuleId(ruleId);
    log.info("Deleted rule {} and its segment", ruleId);
    return true;
  }

  /** Activation re-runs dependency resolution against the currently active rules. */
  @Transactional
  public Optional<RuleDto> setRuleStatus(Long ruleId, RuleStatus status) {
    return repository.findById(ruleId).map(existing -> {
      existing.setStatus(status);
      existing.setUpdatedAt(Instant.now(clock));
      if (status == RuleStatus.ACTIVE) {
        ConditionModel model = conditionParser.normalize(readJson(existing.getConditionsJson()));
        applyDependencies(existing, model, toDto(existing));
      }
      log.info("Rule {} is now {}", ruleId, status);
      return toDto(repository.save(existing));
    });
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<RuleDto> findRule(Long ruleId) {
    return getRule(ruleId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<RuleDto> activeRules() {
    return listRules(RuleStatus.ACTIVE);
  }

  @Override
  @Transactional
  public void recordRun(Long ruleId, Instant finishedAt) {
    repository.findById(ruleId).ifPresent(rule -> {
      rule.setLastRunAt(finishedAt);
      repository.save(rule);
    });
  }

  private void validateAttributes(RuleDto request) {
    if (request.name() == null || request.name().isBlank()) {
      throw new IllegalArgumentException("Rule name is required");
    }
    if (request.startDate() != null && request.endDate() != null
        && request.startDate().isAfter(request.endDate())) {
      throw new IllegalArgumentException("Rule start date must not be after its end date");
    }
    if (!RuleSchedule.isValid(request.schedule())) {
      throw new IllegalArgumentException("Invalid schedule '" + request.schedule() + "'");
    }
  }

  private void applyAttributes(RuleEntity entity, RuleDto request, ConditionModel model, Instant now) {
    entity.setDescription(request.description());
    entity.setConditionsJson(writeJson(conditionParser.toJson(model.root())));
    entity.setSchedule(request.schedule());
    entity.setStartDate(request.startDate());
    entity.setEndDate(request.endDate());
    entity.setDependencyOverride(request.dependencyOverride());
    entity.setUpdatedAt(now);
  }

  private void applyDependencies(RuleEntity entity, ConditionModel model, RuleDto request) {
    List<ResolvableRule> stored = resolvables(entity.getId(), false);
    if (request.dependencyOverride()) {
      List<Long> dependsOn = List.copyOf(new LinkedHashSet<>(request.dependsOn()));
      if (request.operation() == SetOperation.UNION && !dependsOn.isEmpty()) {
        throw new IllegalArgumentException(
            "Manually chosen dependencies only support INTERSECTION; rule " + entity.getId()
                + " would otherwise include every user of its dependencies");
      }
      dependencyResolver.validateOverride(entity.getId(), dependsOn, stored);
      for (Long dep : dependsOn) {
        RuleEntity dependency = repository.findById(dep).orElseThrow();
        if (dependency.getStatus() != RuleStatus.ACTIVE) {
          throw new IllegalArgumentException(
              "Rule " + entity.getId() + " cannot depend on inactive rule " + dep);
        }
      }
      entity.setDependsOn(new ArrayList<>(dependsOn));
      if (dependsOn.isEmpty()) {
        entity.setOperation(null);
        entity.setResidualConditionJson(null);
      } else {
        entity.setOperation(SetOperation.INTERSECTION);
        entity.setResidualConditionJson(entity.getConditionsJson());
      }
      log.info("Rule {} uses manually chosen dependencies {}", entity.getId(), dependsOn);
      return;
    }

    ResolvableRule candidate = new ResolvableRule(entity.getId(), model.dnf(),
        entity.getStartDate(), entity.getEndDate(), List.of());
    List<ResolvableRule> active = resolvables(entity.getId(), true);
    DependencyResolution resolution =
        dependencyResolver.resolve(candidate, active, stored, catalogRepository::rowCount);
    entity.setDependsOn(new ArrayList<>(resolution.dependsOn()));
    entity.setOperation(resolution.operation());
    if (!resolution.reusesSegments() || resolution.residual().isEmpty()) {
      entity.setResidualConditionJson(null);
    } else {
      ConditionModel residual = conditionParser.fromDnf(resolution.residual());
      entity.setResidualConditionJson(writeJson(conditionParser.toJson(residual.root())));
    }
  }

  /** Re-derives automatically resolved rules built on top of a changed rule. */
  private void reresolveDependents(Long ruleId, Set<Long> visited) {
    for (RuleEntity dependent : repository.findByStatusOrderByIdAsc(RuleStatus.ACTIVE)) {
      if (!dependent.getDependsOn().contains(ruleId) || !visited.add(dependent.getId())) {
        continue;
      }
      if (!dependent.isDependencyOverride()) {
        ConditionModel model = conditionParser.normalize(readJson(dependent.getConditionsJson()));
        applyDependencies(dependent, model, toDto(dependent));
        repository.save(dependent);
        log.info("Re-resolved rule {} after rule {} changed; now depends on {}",
            dependent.getId(), ruleId, dependent.getDependsOn());
      }
      reresolveDependents(dependent.getId(), visited);
    }
  }

  private List<ResolvableRule> resolvables(Long excludeId, boolean activeOnly) {
    List<RuleEntity> entities = activeOnly
        ? repository.findByStatusOrderByIdAsc(RuleStatus.ACTIVE)
        : repository.findAllByOrderByIdAsc();
    List<ResolvableRule> rules = new ArrayList<>();
    for (RuleEntity rule : entities) {
      if (rule.getId().equals(excludeId)) {
        continue;
      }
      ConditionModel model = conditionParser.normalize(readJson(rule.getConditionsJson()));
      rules.add(new ResolvableRule(rule.getId(), model.dnf(), rule.getStartDate(),
          rule.getEndDate(), rule.getDependsOn()));
    }
    return rules;
  }

  private String writeJson(JsonNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize condition tree", e);
    }
  }

  private JsonNode readJson(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to deserialize condition tree", e);
    }
  }

  private RuleDto toDto(RuleEntity entity) {
    return new RuleDto(
        entity.getId(),
        entity.getName(),
        entity.getDescription(),
        readJson(entity.getConditionsJson()),
        entity.getSchedule(),
        entity.getStartDate(),
        entity.getEndDate(),
        entity.getDependsOn(),
        entity.getOperation(),
        readJson(entity.getResidualConditionJson()),
        entity.isDependencyOverride(),
        entity.getStatus(),
        entity.getLastRunAt(),
        entity.getCreatedAt(),
        entity.getUpdatedAt()
    );
  }
}
