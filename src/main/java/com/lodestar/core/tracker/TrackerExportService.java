package com.lodestar.core.tracker;

import com.lodestar.core.model.ResolvedSpecification;
import com.lodestar.core.model.ResolvedWorkItem;
import com.lodestar.core.model.StructuredArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drafts every work item of a finished specification in the tracker, in dependency order.
 */
@Service
public class TrackerExportService {

    private static final Logger log = LoggerFactory.getLogger(TrackerExportService.class);

    private final WorkItemTracker tracker;

    public TrackerExportService(WorkItemTracker tracker) {
        this.tracker = tracker;
    }

    public List<ExportedWorkItem> export(String runId, ResolvedSpecification specification) {
        List<ExportedWorkItem> exported = new ArrayList<>();
        for (ResolvedWorkItem item : specification.workItems()) {
            TrackerDraft draft = toDraft(runId, item);
            String reference = tracker.draft(draft);
            String status = tracker.queryStatus(runId, draft.workItemId()).orElse(MarkdownDraftTracker.DEFAULT_STATUS);
            exported.add(new ExportedWorkItem(draft.workItemId(), reference, status));
        }
        log.info("Exported {} work item(s) of run {} to the tracker", exported.size(), runId);
        return exported;
    }

    public Optional<String> queryStatus(String runId, String workItemId) {
        return tracker.queryStatus(runId, workItemId);
    }

    static TrackerDraft toDraft(String runId, ResolvedWorkItem item) {
        StructuredArtifact wi = item.workItem();
        List<String> labels = new ArrayList<>();
        wi.implementsIds().forEach(id -> labels.add("implements:" + id));
        labels.add("layer:" + (wi.field("layer").isBlank() ? "unspecified" : wi.field("layer")));
        labels.add("run:" + runId);

        var body = new StringBuilder();
        if (!wi.field("description").isBlank()) {
            body.append(wi.field("description")).append("\n\n");
        } else if (wi.summary() != null && !wi.summary().isBlank()) {
            body.append(wi.summary()).append("\n\n");
        }
        if (!item.implementsArtifacts().isEmpty()) {
            body.append("## Implements\n");
            item.implementsArtifacts().forEach(a -> body.append("- ").append(a.shortForm()).append('\n'));
            body.append('\n');
        }
        String criteria = wi.field("acceptanceCriteria");
        if (!criteria.isBlank()) {
            body.append("## Acceptance Criteria\n");
            criteria.lines().filter(l -> !l.isBlank()).forEach(l -> body.append("- [ ] ").append(l.strip()).append('\n'));
            body.append('\n');
        }
        if (!item.dependsOn().isEmpty()) {
            body.append("**Depends on:** ")
                    .append(String.join(", ", item.dependsOn().stream().map(StructuredArtifact::id).toList()))
                    .append('\n');
        }
        return new TrackerDraft(runId, wi.id(), wi.title(), body.toString(), labels);
    }
}
