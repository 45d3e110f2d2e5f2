package io.github.byzatic.jobscheduler.model;

public enum ScheduleKind {CRON, ONCE, INTERVAL}
