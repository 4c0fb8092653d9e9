package com.nevis.dataroom.event;

import java.util.UUID;

public record IndexRunRequestedEvent(UUID runId) {}
