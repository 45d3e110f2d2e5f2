package io.github.byzatic.jobscheduler.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Criteria for listing jobs. Empty sets and {@code null} values match anything.
 */
public final class JobFilter {
    private static final JobFilter ALL = newBuilder().build();

    private final Set<JobStatus> statuses;
    private final Set<ScheduleKind> kinds;
    private final Set<JobPriority> priorities;
    private final Instant dueAt;
    private final String nameContains;
    private final String handlerRef;

    private JobFilter(Builder builder) {
        statuses = Collections.unmodifiableSet(EnumSet.copyOf(builder.statuses));
        kinds = Collections.unmodifiableSet(EnumSet.copyOf(builder.kinds));
        priorities = Collections.unmodifiableSet(EnumSet.copyOf(builder.priorities));
        dueAt = builder.dueAt;
        nameContains = builder.nameContains;
        handlerRef = builder.handlerRef;
    }

    public static @NotNull JobFilter all() {
        return ALL;
    }

    /**
     * Jobs the scheduler loop should dispatch at {@code now}.
     */
    public static @NotNull JobFilter due(@NotNull Instant now) {
        return newBuilder().setStatuses(JobStatus.SCHEDULED).setDueAt(now).build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public boolean matches(@NotNull Job job) {
        if (!statuses.isEmpty() && !statuses.contains(job.getStatus())) return false;
        if (!kinds.isEmpty() && !kinds.contains(job.getScheduleKind())) return false;
        if (!priorities.isEmpty() && !priorities.contains(job.getPriority())) return false;
        if (dueAt != null && !job.isDue(dueAt)) return false;
        if (nameContains != null
                && !job.getName().toLowerCase(Locale.ROOT).contains(nameContains.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return handlerRef == null || handlerRef.equals(job.getHandlerRef());
    }

    public @NotNull Set<JobStatus> getStatuses() {
        return statuses;
    }

    public @Nullable Instant getDueAt() {
        return dueAt;
    }

    @Override
    public String toString() {
        return "JobFilter{statuses=" + statuses + ", kinds=" + kinds + ", priorities=" + priorities +
                ", dueAt=" + dueAt + ", nameContains=" + nameContains + ", handlerRef=" + handlerRef + '}';
    }

    public static final class Builder {
        private final Set<JobStatus> statuses = EnumSet.noneOf(JobStatus.class);
        private final Set<ScheduleKind> kinds = EnumSet.noneOf(ScheduleKind.class);
        private final Set<JobPriority> priorities = EnumSet.noneOf(JobPriority.class);
        private Instant dueAt;
        private String nameContains;
        private String handlerRef;

        private Builder() {
        }

        public Builder setStatuses(JobStatus... statuses) {
            this.statuses.clear();
            this.statuses.addAll(Arrays.asList(statuses));
            return this;
        }

        public Builder setKinds(ScheduleKind... kinds) {
            this.kinds.clear();
            this.kinds.addAll(Arrays.asList(kinds));
            return this;
        }

        public Builder setPriorities(JobPriority... priorities) {
            this.priorities.clear();
            this.priorities.addAll(Arrays.asList(priorities));
            return this;
        }

        /**
         * Only jobs that are due at the given instant, see {@link Job#isDue(Instant)}.
         */
        public Builder setDueAt(@Nullable Instant dueAt) {
            this.dueAt = dueAt;
            return this;
        }

        /**
         * Case-insensitive substring of the job name.
         */
        public Builder setNameContains(@Nullable String nameContains) {
            this.nameContains = nameContains;
            return this;
        }

        public Builder setHandlerRef(@Nullable String handlerRef) {
            this.handlerRef = handlerRef;
            return this;
        }

        public JobFilter build() {
            return new JobFilter(this);
        }
    }
}
