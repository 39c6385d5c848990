package com.lodestar.core.verify;

/**
 * Independent checks the verifier can run. A single-pass phase runs {@link #FOCUSED};
 * a multi-pass phase runs the three specialised checks and merges them.
 */
public enum VerificationCheck {

    FOCUSED("""
            You are an independent reviewer. You did not produce the material below.
            Compare the phase output against the concept anchor:
            - For every anchor invariant, decide whether the output honors or violates it.
              Report violations with the invariant's property name, what the output says,
              the stage that produced it, severity BLOCKING or WARNING and a suggested fix.
            - For every identity feature, decide whether it was preserved or replaced by a
              generic equivalent; report replacements with evidence.
            - Report contradictions between the phase's own artifacts as warnings.
            Give a confidenceScore from 0 to 100.
            """),

    INVARIANT_COMPLIANCE("""
            You are an independent compliance reviewer. Check ONLY the concept anchor's
            invariants against the phase output below. For each invariant list it as honored
            or report a violation (property name, what the output says, producing stage,
            severity BLOCKING or WARNING, suggested fix). Give a confidenceScore from 0 to 100.
            """),

    GENERICIZATION("""
            You are an independent reviewer looking ONLY for genericization: distinctive
            identity features of the concept anchor that the phase output replaced with a
            common, generic equivalent. List preserved features and report each replacement
            with the original feature, the generic replacement, the stage and the evidence.
            Give a confidenceScore from 0 to 100.
            """),

    INTERNAL_CONSISTENCY("""
            You are an independent reviewer looking ONLY for contradictions between the
            artifacts of this phase (for example a scope item excluded in one place and a
            capability requiring it in another). Report each contradiction as a warning, or as
            a violation of the anchor invariant it breaks. Give a confidenceScore from 0 to 100.
            """);

    private final String instructions;

    VerificationCheck(String instructions) {
        this.instructions = instructions;
    }

    public String instructions() {
        return instructions;
    }
}
