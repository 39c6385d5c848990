package com.lodestar.core.nodes;

import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.model.StageOutput;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

final class Outputs {

    private Outputs() {}

    static <T extends StageOutput> T require(T output, String stage) {
        return require(output, stage, o -> List.of());
    }

    /**
     * Rejects a missing output, one without the summary every stage must write, or one
     * failing the stage's own checks.
     */
    static <T extends StageOutput> T require(T output, String stage, Function<T, List<String>> checks) {
        if (output == null) {
            throw new SchemaValidationException(stage + " returned no output", List.of("no output"), null);
        }
        List<String> problems = new ArrayList<>();
        if (output.summary() == null || output.summary().isBlank()) {
            problems.add("summary is missing");
        }
        problems.addAll(checks.apply(output));
        if (!problems.isEmpty()) {
            throw new SchemaValidationException(stage + " output is incomplete", problems, ArtifactDrafts.toJson(output));
        }
        return output;
    }
}
