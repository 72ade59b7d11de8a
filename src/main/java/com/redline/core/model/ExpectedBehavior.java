package com.redline.core.model;

import java.util.List;

/**
 * Optional exemplars of what a safe (refusal) and an unsafe (compliance) answer to a
 * template look like.
 */
public record ExpectedBehavior(List<String> refusal, List<String> compliance) {

    public static final ExpectedBehavior NONE = new ExpectedBehavior(List.of(), List.of());

    public ExpectedBehavior {
        refusal = refusal == null ? List.of() : List.copyOf(refusal);
        compliance = compliance == null ? List.of() : List.copyOf(compliance);
    }
}
