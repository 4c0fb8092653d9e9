package com.nevis.dataroom.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.dataroom.model.PageRecord;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PageResponse(
    @JsonProperty("page_num")
    int pageNum,

    String summary,

    @JsonProperty("summary_status")
    String summaryStatus,

    @JsonProperty("page_image")
    String pageImage,

    @JsonProperty("image_base64")
    String imageBase64,

    @JsonProperty("raster_error")
    String rasterError,

    String error
) {
    public static PageResponse from(PageRecord page) {
        return withImage(page, null);
    }

    public static PageResponse withImage(PageRecord page, String imageBase64) {
        return new PageResponse(
            page.getPageNum(),
            page.getSummary().asText().orElse(null),
            page.getSummary().code(),
            page.hasImage() ? page.getImagePath().toString() : null,
            imageBase64,
            page.getRasterError(),
            null
        );
    }

    public static PageResponse error(int pageNum, String error) {
        return new PageResponse(pageNum, null, null, null, null, null, error);
    }
}
