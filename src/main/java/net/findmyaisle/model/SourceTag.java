package net.findmyaisle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance marker attached to every offer.
 */
public enum SourceTag {
    PERPLEXITY_SONAR("perplexity_sonar"),
    SERPER_SHOPPING("serper_shopping");

    private final String tag;

    SourceTag(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static SourceTag fromTag(String tag) {
        for (SourceTag value : values()) {
            if (value.tag.equalsIgnoreCase(tag)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown source tag: " + tag);
    }
}
