package work.lcod.choiceimport.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Read-only node of the source selection tree.
 */
public record SourceFeatureNode(
    String id,
    SourceKind kind,
    String rawType,
    String name,
    String description,
    List<SelectedValue> selectedValues,
    List<String> selectedIds,
    List<String> listOptions,
    List<SourceFeatureNode> children
) {
    public SourceFeatureNode {
        Objects.requireNonNull(kind, "kind");
        selectedValues = selectedValues == null ? List.of() : List.copyOf(selectedValues);
        selectedIds = selectedIds == null ? List.of() : List.copyOf(selectedIds);
        listOptions = listOptions == null ? List.of() : List.copyOf(listOptions);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Builder builder(SourceKind kind) {
        return new Builder(kind);
    }

    public SourceFeatureNode withSelectedValues(List<SelectedValue> values) {
        return new SourceFeatureNode(id, kind, rawType, name, description, values, selectedIds, listOptions, children);
    }

    public List<String> selectedNames() {
        return selectedValues.stream().map(SelectedValue::name).filter(Objects::nonNull).toList();
    }

    /**
     * True when the node or one of its children carries a pick the engine would try to place.
     */
    public boolean hasSelections() {
        if (kind == SourceKind.KIT || kind == SourceKind.UNKNOWN) {
            return false;
        }
        return !selectedValues.isEmpty() || !selectedIds.isEmpty()
            || children.stream().anyMatch(SourceFeatureNode::hasSelections);
    }

    public String label() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        if (id != null && !id.isBlank()) {
            return id;
        }
        return kind.tag().isEmpty() ? "unnamed" : kind.tag();
    }

    public static final class Builder {
        private final SourceKind kind;
        private String id;
        private String rawType;
        private String name;
        private String description;
        private List<SelectedValue> selectedValues = List.of();
        private List<String> selectedIds = List.of();
        private List<String> listOptions = List.of();
        private List<SourceFeatureNode> children = List.of();

        private Builder(SourceKind kind) {
            this.kind = kind;
            this.rawType = kind.tag();
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder rawType(String rawType) {
            this.rawType = rawType;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder selected(List<SelectedValue> selectedValues) {
            this.selectedValues = selectedValues;
            return this;
        }

        public Builder selectedNames(String... names) {
            this.selectedValues = Arrays.stream(names).map(SelectedValue::ofName).toList();
            return this;
        }

        public Builder selectedIds(List<String> selectedIds) {
            this.selectedIds = selectedIds;
            return this;
        }

        public Builder listOptions(List<String> listOptions) {
            this.listOptions = listOptions;
            return this;
        }

        public Builder children(List<SourceFeatureNode> children) {
            this.children = children;
            return this;
        }

        public SourceFeatureNode build() {
            return new SourceFeatureNode(id, kind, rawType, name, description, selectedValues, selectedIds, listOptions, children);
        }
    }
}
