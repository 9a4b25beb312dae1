package net.findmyaisle.model;

import java.util.List;

/**
 * Unparsed answer from the primary source together with the URLs it cited.
 */
public record RawSourceResponse(String text, List<String> citations, List<RelatedResult> relatedResults) {

    public RawSourceResponse {
        text = text == null ? "" : text;
        citations = citations == null ? List.of() : List.copyOf(citations);
        relatedResults = relatedResults == null ? List.of() : List.copyOf(relatedResults);
    }

    public static RawSourceResponse textOnly(String text) {
        return new RawSourceResponse(text, List.of(), List.of());
    }
}
