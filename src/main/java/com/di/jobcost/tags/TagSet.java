package com.di.jobcost.tags;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered {@code key:value} metric tags. Immutable.
 */
@EqualsAndHashCode
public final class TagSet {

    private static final TagSet EMPTY = new TagSet(List.of());

    private final List<String> tags;

    private TagSet(List<String> tags) {
        this.tags = Collections.unmodifiableList(new ArrayList<>(tags));
    }

    public static TagSet of(List<String> tags) {
        return tags == null || tags.isEmpty() ? EMPTY : new TagSet(tags);
    }

    public static TagSet empty() {
        return EMPTY;
    }

    @JsonValue
    public List<String> asList() {
        return tags;
    }

    public int size() {
        return tags.size();
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    /** Tag values by key, in tag order. A tag without ':' maps to an empty value. */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (String tag : tags) {
            int idx = tag.indexOf(':');
            if (idx < 0) {
                map.put(tag, "");
            } else {
                map.put(tag.substring(0, idx), tag.substring(idx + 1));
            }
        }
        return map;
    }

    @Override
    public String toString() {
        return tags.toString();
    }
}
