package work.lcod.choiceimport.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.choiceimport.model.TargetFeatureNode;

/**
 * Output of one resolution pass: the choices table, the matched slot nodes keyed by guid, and
 * every issue met along the way. Owned by a single pass; callers merge it into a longer-lived
 * result.
 */
public final class ResolutionResult {
    private final ChoiceTable choices = new ChoiceTable();
    private final Map<String, TargetFeatureNode> featureData = new LinkedHashMap<>();
    private final List<ResolutionIssue> issues = new ArrayList<>();

    public ChoiceTable choices() {
        return choices;
    }

    public Map<String, TargetFeatureNode> featureData() {
        return Collections.unmodifiableMap(featureData);
    }

    public List<ResolutionIssue> issues() {
        return Collections.unmodifiableList(issues);
    }

    void recordMatch(TargetFeatureNode node) {
        if (node.guid() != null) {
            featureData.put(node.guid(), node);
        }
    }

    public void addIssue(ResolutionIssue issue) {
        issues.add(issue);
    }

    public boolean hasIssues(ResolutionIssue.Kind kind) {
        return issues.stream().anyMatch(issue -> issue.kind() == kind);
    }

    public ResolutionResult mergeFrom(ResolutionResult other) {
        choices.mergeFrom(other.choices);
        featureData.putAll(other.featureData);
        issues.addAll(other.issues);
        return this;
    }
}
