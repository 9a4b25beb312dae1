package net.findmyaisle.model;

/**
 * A search result the primary source reports alongside its answer.
 */
public record RelatedResult(String url, String title) {
}
