package com.nevis.dataroom.controller;

import com.nevis.dataroom.pipeline.RunMode;

public record IndexRunRequest(
    RunMode mode
) {}
