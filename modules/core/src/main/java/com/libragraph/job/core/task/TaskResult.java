package com.libragraph.job.core.task;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of a task execution: return code, captured output and a map of
 * return values.
 * <p>
 * Immutable. Stages produce a new result through the {@code with*} methods or
 * {@link #merge(TaskResult)} instead of mutating a shared one.
 */
public record TaskResult(
        UUID uuid,
        int retcode,
        String stdout,
        String stderr,
        Map<String, Object> retval
) {
    public static final String ERROR_KIND = "errorKind";

    public TaskResult {
        Objects.requireNonNull(uuid, "uuid cannot be null");
        if (retcode < 0) {
            throw new IllegalArgumentException("retcode must be >= 0, got: " + retcode);
        }
        retval = retval == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(retval));
    }

    public static TaskResult empty(UUID uuid) {
        return new TaskResult(uuid, 0, null, null, Map.of());
    }

    /**
     * Builds the failure result for {@code error}: its code as retcode, its
     * message on stderr, and its details plus its kind (under
     * {@value #ERROR_KIND}) as return values.
     */
    public static TaskResult from(UUID uuid, TaskError error) {
        Map<String, Object> values = new LinkedHashMap<>(error.details());
        values.put(ERROR_KIND, error.kind());
        return new TaskResult(uuid, error.code(), null, error.message(), values);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A result is an error when its retcode is 1 or HTTP-style (>= 300).
     */
    @JsonIgnore
    public boolean isError() {
        return retcode >= 300 || retcode == 1;
    }

    public Optional<Object> retvalue(String key) {
        return Optional.ofNullable(retval.get(key));
    }

    /**
     * Combines this result with {@code other}: other's uuid, the highest
     * retcode, other's stdout/stderr when set (ours otherwise), and both
     * retval maps with other's entries winning on key clashes.
     */
    public TaskResult merge(TaskResult other) {
        Map<String, Object> merged = new LinkedHashMap<>(retval);
        merged.putAll(other.retval);
        return new TaskResult(
                other.uuid,
                Math.max(retcode, other.retcode),
                other.stdout != null ? other.stdout : stdout,
                other.stderr != null ? other.stderr : stderr,
                merged
        );
    }

    public TaskResult withUuid(UUID newUuid) {
        return new TaskResult(newUuid, retcode, stdout, stderr, retval);
    }

    public TaskResult withRetcode(int newRetcode) {
        return new TaskResult(uuid, newRetcode, stdout, stderr, retval);
    }

    public TaskResult withStdout(String newStdout) {
        return new TaskResult(uuid, retcode, newStdout, stderr, retval);
    }

    public TaskResult withStderr(String newStderr) {
        return new TaskResult(uuid, retcode, stdout, newStderr, retval);
    }

    public TaskResult withRetval(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(retval);
        updated.put(key, value);
        return new TaskResult(uuid, retcode, stdout, stderr, updated);
    }

    @Override
    public String toString() {
        return isError()
                ? "Err(" + retcode + ", stderr: " + stderr + ")"
                : "Ok(" + retcode + ", stdout: " + stdout + ")";
    }

    public static final class Builder {

        private UUID uuid;
        private int retcode;
        private String stdout;
        private String stderr;
        private final Map<String, Object> retval = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder uuid(UUID uuid) {
            this.uuid = uuid;
            return this;
        }

        public Builder retcode(int retcode) {
            this.retcode = retcode;
            return this;
        }

        public Builder stdout(String stdout) {
            this.stdout = stdout;
            return this;
        }

        public Builder stderr(String stderr) {
            this.stderr = stderr;
            return this;
        }

        public Builder retval(String key, Object value) {
            this.retval.put(key, value);
            return this;
        }

        public Builder retval(Map<String, ?> values) {
            this.retval.putAll(values);
            return this;
        }

        /** Builds the result; a missing uuid is replaced by a random one. */
        public TaskResult build() {
            return new TaskResult(uuid != null ? uuid : UUID.randomUUID(),
                    retcode, stdout, stderr, retval);
        }
    }
}
