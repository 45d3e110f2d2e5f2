package io.github.byzatic.jobscheduler.model;

/**
 * Dispatch priority, highest first in declaration order.
 */
public enum JobPriority {CRITICAL, HIGH, NORMAL, LOW}
