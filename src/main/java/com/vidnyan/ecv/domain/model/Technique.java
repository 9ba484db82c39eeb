package com.vidnyan.ecv.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Technique tag recording which strategy produced a test case.
 */
public enum Technique {
    METAMORPHIC("metamorphic"),
    SYMBOLIC("symbolic"),
    ADVERSARIAL("adversarial"),
    CAUSAL("causal"),
    LLM("llm");

    private final String tag;

    Technique(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<Technique> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.tag.equals(normalized))
                .findFirst();
    }
}
