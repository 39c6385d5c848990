package com.lodestar.core.tracker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Default tracker: one Markdown file per work item with a small front-matter header,
 * under {@code <draft-directory>/<runId>/}. A status someone edited into an existing
 * draft survives a re-export.
 */
@Component
public class MarkdownDraftTracker implements WorkItemTracker {

    private static final Logger log = LoggerFactory.getLogger(MarkdownDraftTracker.class);

    static final String DEFAULT_STATUS = "draft";

    private final Path root;

    public MarkdownDraftTracker(TrackerProperties properties) {
        this.root = Path.of(properties.getDraftDirectory());
    }

    @Override
    public String draft(TrackerDraft draft) {
        Path file = fileFor(draft.runId(), draft.workItemId());
        String status = readStatus(file).orElse(DEFAULT_STATUS);
        var sb = new StringBuilder();
        sb.append("---\n");
        sb.append("id: ").append(draft.workItemId()).append('\n');
        sb.append("status: ").append(status).append('\n');
        sb.append("labels: [").append(String.join(", ", draft.labels())).append("]\n");
        sb.append("---\n\n");
        sb.append("# ").append(draft.workItemId()).append(": ").append(draft.title()).append("\n\n");
        sb.append(draft.body().strip()).append('\n');
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write tracker draft " + file, e);
        }
        log.debug("Drafted {} to {}", draft.workItemId(), file);
        return file.toString();
    }

    @Override
    public Optional<String> queryStatus(String runId, String workItemId) {
        return readStatus(fileFor(runId, workItemId));
    }

    private Path fileFor(String runId, String workItemId) {
        return root.resolve(runId).resolve(workItemId + ".md");
    }

    private static Optional<String> readStatus(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tracker draft " + file, e);
        }
        return lines.stream()
                .takeWhile(line -> !line.isBlank())
                .filter(line -> line.startsWith("status:"))
                .map(line -> line.substring("status:".length()).trim())
                .filter(s -> !s.isEmpty())
                .findFirst();
    }
}
