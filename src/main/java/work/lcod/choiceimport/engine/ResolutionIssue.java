package work.lcod.choiceimport.engine;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A selection or section that could not be carried over. Issues never abort an import.
 */
public record ResolutionIssue(Kind kind, String subject, String message) {
    public ResolutionIssue {
        Objects.requireNonNull(kind, "kind");
        subject = subject == null ? "" : subject;
        message = message == null ? "" : message;
    }

    public static ResolutionIssue unresolvedName(String name, String table) {
        return new ResolutionIssue(Kind.UNRESOLVED_NAME, name, "No [" + table + "] entry named [" + name + "]");
    }

    public static ResolutionIssue unmatchedSlot(String name, String slotType) {
        return new ResolutionIssue(Kind.UNMATCHED_SLOT, name, "No " + slotType + " slot accepts [" + name + "]");
    }

    public static ResolutionIssue malformedSection(String section, String message) {
        return new ResolutionIssue(Kind.MALFORMED_SECTION, section, message);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("kind", kind.name().toLowerCase(Locale.ROOT));
        map.put("subject", subject);
        map.put("message", message);
        return map;
    }

    public enum Kind {
        UNRESOLVED_NAME,
        UNMATCHED_SLOT,
        MALFORMED_SECTION,
        AMBIGUOUS_FALLBACK,
        DEPTH_EXCEEDED
    }
}
