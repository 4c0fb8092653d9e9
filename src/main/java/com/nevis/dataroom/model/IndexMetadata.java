package com.nevis.dataroom.model;

import java.time.OffsetDateTime;

public record IndexMetadata(
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt,
    String modelUsed,
    long version
) {

    public static IndexMetadata initial(OffsetDateTime now, String modelUsed) {
        return new IndexMetadata(now, now, modelUsed, 0);
    }

    public IndexMetadata nextVersion(OffsetDateTime now, String model) {
        return new IndexMetadata(createdAt, now, model, version + 1);
    }
}
