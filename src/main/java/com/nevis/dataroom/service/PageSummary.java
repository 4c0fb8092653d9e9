package com.nevis.dataroom.service;

public record PageSummary(int pageNum, String text) {
}
