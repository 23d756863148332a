package com.kmg.analysis.model;

public record ContentItem(long id, String title, String summary) {
}
