package io.github.byzatic.jobscheduler.store;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobscheduler.UuidProvider;
import io.github.byzatic.jobscheduler.exceptions.ConcurrentJobModificationException;
import io.github.byzatic.jobscheduler.exceptions.InvalidScheduleSpecException;
import io.github.byzatic.jobscheduler.exceptions.JobNotFoundException;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.model.JobDefinition;
import io.github.byzatic.jobscheduler.model.JobFilter;
import io.github.byzatic.jobscheduler.model.JobStatus;
import io.github.byzatic.jobscheduler.model.ScheduleSpec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Job store on a {@link ConcurrentHashMap}. Mutations are lock-free compare-and-set operations on immutable
 * {@link Job} snapshots; the version check is the only synchronisation between writers.
 */
@ThreadSafe
public class InMemoryJobStore implements JobStoreInterface {
    private final static Logger logger = LoggerFactory.getLogger(InMemoryJobStore.class);

    private final Map<UUID, Job> jobs = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ZoneId defaultTimezone;

    public InMemoryJobStore(@NotNull Clock clock, @NotNull ZoneId defaultTimezone) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultTimezone = Objects.requireNonNull(defaultTimezone, "defaultTimezone");
    }

    @Override
    public @NotNull Job create(@NotNull JobDefinition definition) throws InvalidScheduleSpecException {
        Objects.requireNonNull(definition, "definition");
        Instant now = clock.instant();
        ZoneId zone = definition.getTimezone() != null ? definition.getTimezone() : defaultTimezone;
        ScheduleSpec schedule = definition.getSchedule();
        schedule.validate(now, zone);

        Job job = Job.newBuilder()
                .setId(UuidProvider.generateUuid())
                .setName(definition.getName())
                .setSchedule(schedule)
                .setTimezone(zone)
                .setPriority(definition.getPriority())
                .setMaxRetries(definition.getMaxRetries())
                .setTimeout(definition.getTimeout())
                .setBaseRetryDelay(definition.getBaseRetryDelay())
                .setMaxRetryDelay(definition.getMaxRetryDelay())
                .setHandlerRef(definition.getHandlerRef())
                .setStatus(JobStatus.SCHEDULED)
                .setNextRunAt(schedule.firstRunAt(now, zone))
                .setCreatedAt(now)
                .setUpdatedAt(now)
                .setVersion(1)
                .build();
        jobs.put(job.getId(), job);
        logger.debug("Job {} '{}' stored, {} next run at {}", job.getId(), job.getName(), schedule, job.getNextRunAt());
        return job;
    }

    @Override
    public @NotNull Job get(@NotNull UUID id) throws JobNotFoundException {
        Job job = jobs.get(id);
        if (job == null) throw new JobNotFoundException(id);
        return job;
    }

    @Override
    public @NotNull Optional<Job> find(@NotNull UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public @NotNull List<Job> list(@NotNull JobFilter filter) {
        return jobs.values().stream()
                .filter(filter::matches)
                .sorted(Comparator.comparing(Job::getCreatedAt).thenComparing(Job::getId))
                .collect(Collectors.toList());
    }

    @Override
    public @NotNull Job update(@NotNull Job modified) throws JobNotFoundException, ConcurrentJobModificationException {
        UUID id = modified.getId();
        Job current = get(id);
        if (current.getVersion() != modified.getVersion()) {
            throw new ConcurrentJobModificationException(id, modified.getVersion(), current.getVersion());
        }
        if (current.getScheduleKind() != modified.getScheduleKind()) {
            throw new IllegalArgumentException("Schedule kind of job " + id + " is immutable");
        }
        if (!current.getCreatedAt().equals(modified.getCreatedAt())) {
            throw new IllegalArgumentException("Creation time of job " + id + " is immutable");
        }
        Job next = modified.toBuilder()
                .setVersion(current.getVersion() + 1)
                .setUpdatedAt(clock.instant())
                .build();
        // replace() сравнивает по equals(): id + version
        if (!jobs.replace(id, current, next)) {
            Job actual = jobs.get(id);
            if (actual == null) throw new JobNotFoundException(id);
            throw new ConcurrentJobModificationException(id, modified.getVersion(), actual.getVersion());
        }
        return next;
    }

    @Override
    public @NotNull Job updateStatus(@NotNull UUID id, long expectedVersion, @NotNull JobStatus newStatus)
            throws JobNotFoundException, ConcurrentJobModificationException {
        Objects.requireNonNull(newStatus, "newStatus");
        Job current = checkedVersion(id, expectedVersion);
        Job.Builder builder = current.toBuilder().setStatus(newStatus);
        if (newStatus.isTerminal()) {
            builder.setNextRunAt(null).setRequestedStatus(null);
        }
        return update(builder.build());
    }

    @Override
    public @NotNull Job updateSchedule(@NotNull UUID id, long expectedVersion, @NotNull ScheduleSpec schedule, @Nullable ZoneId timezone)
            throws InvalidScheduleSpecException, JobNotFoundException, ConcurrentJobModificationException {
        Objects.requireNonNull(schedule, "schedule");
        Job current = checkedVersion(id, expectedVersion);
        if (current.getScheduleKind() != schedule.getKind()) {
            throw new InvalidScheduleSpecException("Job " + id + " is a " + current.getScheduleKind()
                    + " job; changing the kind of schedule requires delete and recreate");
        }
        ZoneId zone = timezone != null ? timezone : current.getTimezone();
        Instant now = clock.instant();
        schedule.validate(now, zone);
        Job.Builder builder = current.toBuilder().setSchedule(schedule).setTimezone(zone);
        if (!current.getStatus().isTerminal()) {
            builder.setNextRunAt(schedule.firstRunAt(now, zone));
        }
        return update(builder.build());
    }

    @Override
    public void delete(@NotNull UUID id) throws JobNotFoundException {
        if (jobs.remove(id) == null) throw new JobNotFoundException(id);
    }

    @Override
    public int size() {
        return jobs.size();
    }

    private Job checkedVersion(UUID id, long expectedVersion) throws JobNotFoundException, ConcurrentJobModificationException {
        Job current = get(id);
        if (current.getVersion() != expectedVersion) {
            throw new ConcurrentJobModificationException(id, expectedVersion, current.getVersion());
        }
        return current;
    }
}
