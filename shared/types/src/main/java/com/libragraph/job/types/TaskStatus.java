package com.libragraph.job.types;

/**
 * Lifecycle state of a single task instance.
 * <p>
 * Transitions only move forward: {@code PENDING -> RUNNING -> SUCCESS | FAILED},
 * plus {@code PENDING -> FAILED} when a task is rejected before it runs.
 * {@link #SUCCESS} and {@link #FAILED} are terminal.
 */
public enum TaskStatus {
    PENDING("PENDING"),
    RUNNING("RUNNING"),
    SUCCESS("SUCCESS"),
    FAILED("FAILED");

    private final String label;

    TaskStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    /**
     * Returns whether a task in this state may move to {@code next}.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == SUCCESS || next == FAILED;
            case SUCCESS, FAILED -> false;
        };
    }

    /**
     * Parses a status label. Unknown or {@code null} labels map to {@link #PENDING}.
     */
    public static TaskStatus fromLabel(String label) {
        if (label == null) return PENDING;
        for (TaskStatus s : values()) {
            if (s.label.equalsIgnoreCase(label)) return s;
        }
        return PENDING;
    }

    @Override
    public String toString() {
        return label;
    }
}
