package org.unicitylabs.hydrator.protocol;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Nostr subscription filter as defined in NIP-01.
 * Tag-value filters are serialized as "#&lt;letter&gt;" keys.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Filter {

    /** Event IDs to match */
    @JsonProperty("ids")
    private List<String> ids;

    /** Author public keys to match */
    @JsonProperty("authors")
    private List<String> authors;

    /** Event kinds to match */
    @JsonProperty("kinds")
    private List<Integer> kinds;

    /** Minimum creation timestamp (inclusive) */
    @JsonProperty("since")
    private Long since;

    /** Maximum creation timestamp (inclusive) */
    @JsonProperty("until")
    private Long until;

    /** Maximum number of events to return */
    @JsonProperty("limit")
    private Integer limit;

    /** Tag-value filters keyed by single-letter tag name (without the '#') */
    @JsonIgnore
    private final Map<String, List<String>> tagValues = new LinkedHashMap<>();

    /**
     * Default constructor for Jackson.
     */
    public Filter() {}

    // Getters
    public List<String> getIds() { return ids; }
    public List<String> getAuthors() { return authors; }
    public List<Integer> getKinds() { return kinds; }
    public Long getSince() { return since; }
    public Long getUntil() { return until; }
    public Integer getLimit() { return limit; }

    // Setters
    public void setIds(List<String> ids) { this.ids = ids; }
    public void setAuthors(List<String> authors) { this.authors = authors; }
    public void setKinds(List<Integer> kinds) { this.kinds = kinds; }
    public void setSince(Long since) { this.since = since; }
    public void setUntil(Long until) { this.until = until; }
    public void setLimit(Integer limit) { this.limit = limit; }

    /**
     * Values required for a tag (e.g. "d", "e", "p"), or null when unconstrained.
     */
    public List<String> getTagValues(String tagName) {
        return tagValues.get(tagName);
    }

    public void setTagValues(String tagName, List<String> values) {
        if (values == null) {
            tagValues.remove(tagName);
        } else {
            tagValues.put(tagName, new ArrayList<>(values));
        }
    }

    @JsonAnyGetter
    public Map<String, List<String>> tagFilters() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : tagValues.entrySet()) {
            out.put("#" + entry.getKey(), entry.getValue());
        }
        return out;
    }

    @JsonAnySetter
    public void tagFilter(String key, List<String> values) {
        if (key.startsWith("#") && key.length() > 1) {
            setTagValues(key.substring(1), values);
        }
    }

    /**
     * Create a builder for constructing filters.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Filter construction.
     */
    public static class Builder {
        private final Filter filter = new Filter();

        public Builder ids(String... ids) {
            filter.ids = Arrays.asList(ids);
            return this;
        }

        public Builder ids(List<String> ids) {
            filter.ids = new ArrayList<>(ids);
            return this;
        }

        public Builder authors(String... authors) {
            filter.authors = Arrays.asList(authors);
            return this;
        }

        public Builder authors(List<String> authors) {
            filter.authors = new ArrayList<>(authors);
            return this;
        }

        public Builder kinds(int... kinds) {
            LinkedHashSet<Integer> unique = new LinkedHashSet<>();
            for (int kind : kinds) {
                unique.add(kind);
            }
            filter.kinds = new ArrayList<>(unique);
            return this;
        }

        public Builder kinds(Collection<Integer> kinds) {
            filter.kinds = new ArrayList<>(new LinkedHashSet<>(kinds));
            return this;
        }

        public Builder tag(String tagName, String... values) {
            filter.setTagValues(tagName, Arrays.asList(values));
            return this;
        }

        public Builder since(long since) {
            filter.since = since;
            return this;
        }

        public Builder until(long until) {
            filter.until = until;
            return this;
        }

        public Builder limit(int limit) {
            filter.limit = limit;
            return this;
        }

        public Filter build() {
            return filter;
        }
    }

    @Override
    public String toString() {
        return "Filter{" +
                "ids=" + (ids != null ? ids.size() : 0) +
                ", authors=" + (authors != null ? authors.size() : 0) +
                ", kinds=" + kinds +
                ", tags=" + tagValues.keySet() +
                ", since=" + since +
                ", until=" + until +
                ", limit=" + limit +
                '}';
    }
}
