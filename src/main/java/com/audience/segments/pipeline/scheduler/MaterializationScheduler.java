package com.audience.segments.pipeline.scheduler;

import com.audience.segments.enums.JobState;
import com.audience.segments.enums.TriggerKind;
import com.audience.segments.model.MaterializationJob;
import com.audience.segments.model.RuleDto;
import com.audience.segments.model.SegmentCatalogEntry;
import com.audience.segments.pipeline.engine.BatchEngine;
import com.audience.segments.pipeline.engine.BatchQuery;
import com.audience.segments.pipeline.engine.BatchSubmissionException;
import com.audience.segments.pipeline.engine.BatchTask;
import com.audience.segments.pipeline.engine.SegmentResult;
import com.audience.segments.pipeline.materialize.MaterializationWriter;
import com.audience.segments.pipeline.materialize.SegmentCatalogRepository;
import com.audience.segments.pipeline.plan.ExecutionPlanner;
import com.audience.segments.warehouse.SegmentTables;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns materialization jobs from admission to completion.
 *
 * <p>A job is admitted as QUEUED and held back until every rule it depends on has a
 * published segment and no job of its own in flight; only then is it handed to the work
 * queue. Dependencies that were never published are admitted automatically. Workers run
 * the rule's query on the batch engine, wait for it with a timeout and publish the result.
 * Transient engine failures go back to QUEUED with exponential backoff; everything else
 * ends the job as FAILED.
 *
 * <p>At most one job per rule is QUEUED or RUNNING at any time. Admission, completion and
 * dispatch are serialized on one monitor; queries and publishes run outside it.
 */
public class MaterializationScheduler {

  private static final Logger log = LoggerFactory.getLogger(MaterializationScheduler.class);

  private final RuleSource rules;
  private final ExecutionPlanner planner;
  private final BatchEngine engine;
  private final MaterializationWriter writer;
  private final SegmentCatalogRepository catalog;
  private final JobQueue queue;
  private final JobHistory history;
  private final RetryPolicy retryPolicy;
  private final SchedulerSettings settings;
  private final Clock clock;

  private final Object lock = new Object();
  private final Map<UUID, MaterializationJob> activeJobs = new ConcurrentHashMap<>();
  private final Map<Long, UUID> inFlightByRule = new ConcurrentHashMap<>();
  // QUEUED jobs not yet handed to the work queue; guarded by lock
  private final Map<UUID, MaterializationJob> held = new LinkedHashMap<>();
  private final Map<Long, MaterializationJob> lastFinishedByRule = new ConcurrentHashMap<>();
  private final Map<Long, ScheduledFire> nextFireByRule = new ConcurrentHashMap<>();

  private final List<MaterializationWorker> workers = new ArrayList<>();
  private final List<Thread> threads = new ArrayList<>();

  public MaterializationScheduler(RuleSource rules,
                                  ExecutionPlanner planner,
                                  BatchEngine engine,
                                  MaterializationWriter writer,
                                  SegmentCatalogRepository catalog,
                                  JobQueue queue,
                                  JobHistory history,
                                  RetryPolicy retryPolicy,
                                  SchedulerSettings settings,
                                  Clock clock) {
    this.rules = rules;
    this.planner = planner;
    this.engine = engine;
    this.writer = writer;
    this.catalog = catalog;
    this.queue = queue;
    this.history = history;
    this.retryPolicy = retryPolicy;
    this.settings = settings;
    this.clock = clock;
  }

  public void start() {
    for (int i = 0; i < settings.workerCount(); i++) {
      MaterializationWorker worker = new MaterializationWorker(queue, this);
      Thread thread = new Thread(worker, "materialization-worker-" + i);
      thread.setDaemon(true);
      workers.add(worker);
      threads.add(thread);
      thread.start();
    }
    log.info("Started {} materialization worker threads", settings.workerCount());
  }

  public void stop() {
    workers.forEach(MaterializationWorker::shutdown);
    threads.forEach(Thread::interrupt);
  }

  /**
   * Admits a job for the rule.
   *
   * @return the new job's id, or for a manual trigger the id of the job already in flight
   * @throws SchedulerBusyException for a scheduled trigger while a job is in flight
   * @throws IllegalArgumentException if the rule does not exist
   * @throws IllegalStateException if the rule is inactive
   */
  public UUID enqueue(Long ruleId, TriggerKind trigger) {
    RuleDto rule = rules.findRule(ruleId)
        .orElseThrow(() -> new IllegalArgumentException("Unknown rule " + ruleId));
    if (!rule.isActive()) {
      throw new IllegalStateException("Rule " + ruleId + " is inactive");
    }
    UUID jobId;
    synchronized (lock) {
      jobId = admit(ruleId, trigger);
    }
    dispatchReady();
    return jobId;
  }

  /** Cancels a job that has not started. Running jobs cannot be cancelled. */
  public boolean cancel(UUID jobId) {
    synchronized (lock) {
      MaterializationJob job = activeJobs.get(jobId);
      if (job == null || job.state() != JobState.QUEUED) {
        return false;
      }
      finish(job.cancel(Instant.now(clock)));
    }
    dispatchReady();
    return true;
  }

  /**
   * Admits a SCHEDULED job for every active rule whose schedule is due and whose active
   * window contains today, in dependency order, then releases held jobs that became ready.
   */
  public void tick(Instant now) {
    List<RuleDto> active = rules.activeRules();
    LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
    int admitted = 0;
    for (RuleDto rule : inTickOrder(active)) {
      if (!rule.isActiveOn(today)) {
        continue;
      }
      RuleSchedule schedule;
      try {
        schedule = RuleSchedule.parse(rule.schedule());
      } catch (IllegalArgumentException e) {
        log.warn("Rule {} has an invalid schedule '{}'", rule.id(), rule.schedule(), e);
        continue;
      }
      if (schedule.isManual() || !isDue(rule, schedule, now)) {
        continue;
      }
      try {
        enqueue(rule.id(), TriggerKind.SCHEDULED);
        admitted++;
      } catch (SchedulerBusyException e) {
        log.warn("Rule {} is still materializing as job {}; skipping this run",
            rule.id(), e.getExistingJobId());
      } catch (RuntimeException e) {
        log.error("Could not schedule rule {}", rule.id(), e);
      }
    }
    dispatchReady();
    log.debug("Tick at {} admitted {} scheduled job(s); {} in flight, {} in work queue",
        now, admitted, activeJobs.size(), queue.size());
  }

  /** Runs the next job from the work queue on the calling thread. */
  public boolean runNext() {
    UUID jobId = queue.poll();
    if (jobId == null) {
      return false;
    }
    execute(jobId);
    return true;
  }

  public Optional<MaterializationJob> findJob(UUID jobId) {
    MaterializationJob active = activeJobs.get(jobId);
    return active != null ? Optional.of(active) : history.find(jobId);
  }

  public Optional<MaterializationJob> activeJobFor(Long ruleId) {
    UUID jobId = inFlightByRule.get(ruleId);
    return jobId != null ? Optional.ofNullable(activeJobs.get(jobId)) : Optional.empty();
  }

  /** In-flight jobs first, then finished ones, newest first within each group. */
  public List<MaterializationJob> recentJobs(int limit) {
    List<MaterializationJob> jobs = new ArrayList<>(activeJobs.values());
    jobs.sort(Comparator.comparing(MaterializationJob::createdAt).reversed());
    jobs.addAll(history.recent(limit));
    return jobs.stream().limit(limit).toList();
  }

  void execute(UUID jobId) {
    MaterializationJob job;
    synchronized (lock) {
      MaterializationJob current = activeJobs.get(jobId);
      if (current == null || current.state() != JobState.QUEUED) {
        log.debug("Skipping job {}; it is no longer queued", jobId);
        return;
      }
      job = current.start(Instant.now(clock));
      activeJobs.put(jobId, job);
    }
    log.info("Job {} for rule {} started (attempt {})", job.id(), job.ruleId(), job.attempts());
    run(job);
    dispatchReady();
  }

  private void run(MaterializationJob job) {
    Optional<RuleDto> found = rules.findRule(job.ruleId());
    if (found.isEmpty()) {
      complete(job.fail(Instant.now(clock), "rule no longer exists"));
      return;
    }
    RuleDto rule = found.get();
    BatchTask task = null;
    try {
      String sql = planner.queryFor(rule);
      task = engine.submit(new BatchQuery(rule.id(), sql, settings.dataSourceUrl(),
          SegmentTables.outputTable(rule.id())));
      SegmentResult result = task.completion()
          .get(settings.jobTimeout().toMillis(), TimeUnit.MILLISECONDS);
      SegmentCatalogEntry entry = writer.publish(rule, sql, result);
      Instant finishedAt = Instant.now(clock);
      recordRun(rule.id(), finishedAt);
      complete(job.succeed(finishedAt));
      log.info("Job {} for rule {} succeeded; {} now holds {} row(s)",
          job.id(), rule.id(), entry.tableName(), entry.rowCount());
    } catch (TimeoutException e) {
      task.terminate().run();
      log.error("Job {} for rule {} timed out after {}", job.id(), rule.id(), settings.jobTimeout());
      complete(job.fail(Instant.now(clock), "timed out after " + settings.jobTimeout()));
    } catch (ExecutionException e) {
      handleFailure(job, e.getCause());
    } catch (CancellationException e) {
      complete(job.fail(Instant.now(clock), "batch task was terminated"));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (task != null) {
        task.terminate().run();
      }
      complete(job.fail(Instant.now(clock), "interrupted while waiting for the batch engine"));
    } catch (RuntimeException e) {
      handleFailure(job, e);
    }
  }

  private void handleFailure(MaterializationJob job, Throwable cause) {
    Instant now = Instant.now(clock);
    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    MaterializationJob failed = job.fail(now, message);
    if (cause instanceof BatchSubmissionException && retryPolicy.canRetry(job.attempts())) {
      MaterializationJob retry = failed.retryAt(now.plus(retryPolicy.backoff(job.attempts())));
      synchronized (lock) {
        activeJobs.put(retry.id(), retry);
        held.put(retry.id(), retry);
      }
      log.warn("Job {} for rule {} failed transiently (attempt {}/{}); retrying at {}",
          job.id(), job.ruleId(), job.attempts(), retryPolicy.maxAttempts(),
          retry.nextAttemptAt(), cause);
      return;
    }
    log.error("Job {} for rule {} failed: {}", job.id(), job.ruleId(), message, cause);
    complete(failed);
  }

  private void recordRun(Long ruleId, Instant finishedAt) {
    try {
      rules.recordRun(ruleId, finishedAt);
    } catch (RuntimeException e) {
      log.warn("Segment of rule {} was published but its last run time was not recorded", ruleId, e);
    }
  }

  private void complete(MaterializationJob job) {
    synchronized (lock) {
      finish(job);
    }
  }

  // Caller holds lock.
  private UUID admit(Long ruleId, TriggerKind trigger) {
    UUID existing = inFlightByRule.get(ruleId);
    if (existing != null) {
      if (trigger == TriggerKind.MANUAL) {
        log.info("Rule {} already has job {} in flight; returning it", ruleId, existing);
        return existing;
      }
      throw new SchedulerBusyException(ruleId, existing);
    }
    MaterializationJob job = MaterializationJob.queued(ruleId, trigger, Instant.now(clock));
    activeJobs.put(job.id(), job);
    inFlightByRule.put(ruleId, job.id());
    held.put(job.id(), job);
    log.info("Queued job {} for rule {} ({})", job.id(), ruleId, trigger);
    return job.id();
  }

  // Caller holds lock.
  private void finish(MaterializationJob job) {
    activeJobs.remove(job.id());
    held.remove(job.id());
    queue.remove(job.id());
    inFlightByRule.remove(job.ruleId(), job.id());
    lastFinishedByRule.put(job.ruleId(), job);
    history.record(job);
    if (job.state() == JobState.SUCCEEDED) {
      log.info("Job {} for rule {} finished as {}", job.id(), job.ruleId(), job.state());
    } else {
      log.warn("Job {} for rule {} finished as {}: {}", job.id(), job.ruleId(), job.state(),
          job.lastError());
    }
  }

  /** Moves held jobs whose dependencies are ready and whose backoff elapsed to the work queue. */
  void dispatchReady() {
    Instant now = Instant.now(clock);
    synchronized (lock) {
      boolean changed = true;
      while (changed) {
        changed = false;
        for (MaterializationJob job : new ArrayList<>(held.values())) {
          if (held.containsKey(job.id()) && job.isDue(now)) {
            changed |= release(job, now);
          }
        }
      }
    }
  }

  // Caller holds lock. Returns true if the set of held or active jobs changed.
  private boolean release(MaterializationJob job, Instant now) {
    Optional<RuleDto> rule = rules.findRule(job.ruleId());
    if (rule.isEmpty()) {
      finish(job.fail(now, "rule no longer exists"));
      return true;
    }
    boolean waiting = false;
    boolean changed = false;
    for (Long dep : rule.get().dependsOn()) {
      if (inFlightByRule.containsKey(dep)) {
        waiting = true;
        continue;
      }
      if (catalog.existsForRule(dep)) {
        continue;
      }
      MaterializationJob lastDepJob = lastFinishedByRule.get(dep);
      boolean depGaveUp = lastDepJob != null
          && lastDepJob.state() != JobState.SUCCEEDED
          && !lastDepJob.finishedAt().isBefore(job.createdAt());
      Optional<RuleDto> depRule = rules.findRule(dep);
      if (depGaveUp || depRule.isEmpty() || !depRule.get().isActive()) {
        finish(job.fail(now, "missing dependency table " + SegmentTables.outputTable(dep)));
        return true;
      }
      log.info("Rule {} depends on rule {}, which has no segment yet; queueing it first",
          job.ruleId(), dep);
      admit(dep, job.trigger());
      waiting = true;
      changed = true;
    }
    if (waiting) {
      return changed;
    }
    if (!queue.offer(job.id())) {
      log.warn("Work queue is full; job {} for rule {} stays held", job.id(), job.ruleId());
      return changed;
    }
    held.remove(job.id());
    log.debug("Job {} for rule {} handed to workers", job.id(), job.ruleId());
    return true;
  }

  private List<RuleDto> inTickOrder(List<RuleDto> active) {
    Map<Long, RuleDto> byId = new LinkedHashMap<>();
    active.forEach(rule -> byId.put(rule.id(), rule));
    List<Long> order;
    try {
      order = planner.order(active);
    } catch (RuntimeException e) {
      log.error("Could not order active rules; falling back to id order", e);
      order = byId.keySet().stream().sorted().toList();
    }
    return order.stream().map(byId::get).toList();
  }

  private boolean isDue(RuleDto rule, RuleSchedule schedule, Instant now) {
    ScheduledFire fire = nextFireByRule.get(rule.id());
    if (fire == null || !fire.schedule().equals(rule.schedule())) {
      Instant first = rule.lastRunAt() == null ? now : schedule.nextAfter(rule.lastRunAt());
      fire = new ScheduledFire(rule.schedule(), first);
    }
    if (now.isBefore(fire.next())) {
      nextFireByRule.put(rule.id(), fire);
      return false;
    }
    nextFireByRule.put(rule.id(), new ScheduledFire(rule.schedule(), schedule.nextAfter(now)));
    return true;
  }

  private record ScheduledFire(String schedule, Instant next) {}
}
