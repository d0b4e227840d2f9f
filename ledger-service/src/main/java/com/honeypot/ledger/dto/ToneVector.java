package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inferred emotional state of the scammer at one turn. Every dimension is optional and,
 * when present, lies in [0.0, 1.0].
 */
public record ToneVector(
    @JsonProperty("confusion")     Double confusion,
    @JsonProperty("anxiety")       Double anxiety,
    @JsonProperty("urgency")       Double urgency,
    @JsonProperty("compliance")    Double compliance,
    @JsonProperty("cognitiveLoad") Double cognitiveLoad
) {
    public static final ToneVector EMPTY = new ToneVector(null, null, null, null, null);

    public ToneVector {
        checkUnit("confusion", confusion);
        checkUnit("anxiety", anxiety);
        checkUnit("urgency", urgency);
        checkUnit("compliance", compliance);
        checkUnit("cognitiveLoad", cognitiveLoad);
    }

    private static void checkUnit(String name, Double value) {
        if (value != null && (value < 0.0 || value > 1.0)) {
            throw new IllegalArgumentException("Tone " + name + " out of [0,1]: " + value);
        }
    }
}
