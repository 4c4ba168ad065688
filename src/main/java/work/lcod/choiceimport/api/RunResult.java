package work.lcod.choiceimport.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.choiceimport.engine.ResolutionIssue;

/**
 * Outcome of an {@link ImportRunner} execution.
 *
 * <p>An import that ran to the end is {@link Status#SUCCESS} when every selection was carried
 * over and {@link Status#INCOMPLETE} when some were reported as issues. Both exit with 0; only a
 * run that could not import at all is a {@link Status#FAILURE}.
 */
public record RunResult(
    Status status,
    Map<String, Object> metadata,
    List<ResolutionIssue> issues,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static RunResult completed(Map<String, Object> metadata, List<ResolutionIssue> issues, Instant startedAt, Instant finishedAt) {
        var status = issues.isEmpty() ? Status.SUCCESS : Status.INCOMPLETE;
        return new RunResult(status, metadata, issues, startedAt, finishedAt);
    }

    public static RunResult failure(String message, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message == null ? "unknown error" : message);
        return new RunResult(Status.FAILURE, meta, List.of(), startedAt, finishedAt);
    }

    public int issueCount() {
        return issues.size();
    }

    public boolean hasIssues(ResolutionIssue.Kind kind) {
        return issues.stream().anyMatch(issue -> issue.kind() == kind);
    }

    public RunResult withSerializedPayload(String payload) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("payload", payload);
        return new RunResult(status, meta, issues, startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("issueCount", issueCount());
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        INCOMPLETE(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
