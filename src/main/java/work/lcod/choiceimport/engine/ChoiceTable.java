package work.lcod.choiceimport.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Slot guid to selected option id(s). A slot holds a plain {@code String} until it receives a
 * second distinct value, then an ordered {@code List<String>}.
 *
 * <p>A slot never holds the same id twice. This holds for {@link #add}, {@link #append} and
 * {@link #mergeFrom} alike, so recording a value twice in one pass gives the same table as
 * recording it once in each of two passes.
 */
public final class ChoiceTable {
    private final Map<String, Object> entries = new LinkedHashMap<>();

    /**
     * Records a value, promoting the slot to a list on its second distinct contribution.
     */
    public void add(String guid, String value) {
        Objects.requireNonNull(guid, "guid");
        Objects.requireNonNull(value, "value");
        var current = entries.get(guid);
        if (current == null) {
            entries.put(guid, value);
        } else if (asList(current).contains(value)) {
            return;
        } else if (current instanceof List<?>) {
            listAt(guid).add(value);
        } else {
            var promoted = new ArrayList<String>();
            promoted.add((String) current);
            promoted.add(value);
            entries.put(guid, promoted);
        }
    }

    /**
     * Records a value in list form even for the first contribution.
     */
    public void append(String guid, String value) {
        Objects.requireNonNull(guid, "guid");
        Objects.requireNonNull(value, "value");
        if (entries.containsKey(guid)) {
            add(guid, value);
        } else {
            entries.put(guid, new ArrayList<>(List.of(value)));
        }
    }

    /**
     * Merges another pass into this table. New keys are copied as-is and values already held are
     * skipped. Other values accumulate in list form so earlier passes are never clobbered.
     */
    public void mergeFrom(ChoiceTable other) {
        other.entries.forEach((guid, value) -> {
            var current = entries.get(guid);
            if (current == null) {
                entries.put(guid, copyOf(value));
                return;
            }
            if (current.equals(value)) {
                return;
            }
            var merged = new ArrayList<String>(asList(current));
            for (String candidate : asList(value)) {
                if (!merged.contains(candidate)) {
                    merged.add(candidate);
                }
            }
            entries.put(guid, merged);
        });
    }

    public Object get(String guid) {
        var value = entries.get(guid);
        return value instanceof List<?> list ? List.copyOf(list) : value;
    }

    public List<String> values(String guid) {
        var value = entries.get(guid);
        return value == null ? List.of() : List.copyOf(asList(value));
    }

    public boolean containsKey(String guid) {
        return entries.containsKey(guid);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Detached snapshot suitable for serialization.
     */
    public Map<String, Object> toMap() {
        var snapshot = new LinkedHashMap<String, Object>();
        entries.forEach((guid, value) -> snapshot.put(guid, copyOf(value)));
        return snapshot;
    }

    @SuppressWarnings("unchecked")
    private List<String> listAt(String guid) {
        return (List<String>) entries.get(guid);
    }

    @SuppressWarnings("unchecked")
    private static List<String> asList(Object value) {
        return value instanceof List<?> ? (List<String>) value : List.of((String) value);
    }

    private static Object copyOf(Object value) {
        return value instanceof List<?> ? new ArrayList<>(asList(value)) : value;
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
