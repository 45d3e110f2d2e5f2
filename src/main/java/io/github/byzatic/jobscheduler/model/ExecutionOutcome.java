package io.github.byzatic.jobscheduler.model;

public enum ExecutionOutcome {SUCCESS, FAILURE, TIMEOUT, CANCELLED}
