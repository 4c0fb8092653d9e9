package com.nevis.dataroom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum PipelineStage {
    DISCOVER,
    NORMALIZE,
    RASTERIZE,
    SUMMARIZE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PipelineStage fromCode(String code) {
        return Arrays.stream(values())
            .filter(stage -> stage.code().equalsIgnoreCase(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown pipeline stage: " + code));
    }
}
