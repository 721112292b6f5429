package io.github.hotbrkm.autobulk.dispatcher.job;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Where a job's recipients come from: an embedded address list or a filter over the recipient cache.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RecipientSpec.StaticList.class, name = "static_list"),
        @JsonSubTypes.Type(value = RecipientSpec.CacheFilter.class, name = "filter")
})
public sealed interface RecipientSpec permits RecipientSpec.StaticList, RecipientSpec.CacheFilter {

    /**
     * Fixed addresses stored with the job.
     */
    record StaticList(List<String> addresses) implements RecipientSpec {
        public StaticList {
            addresses = addresses == null ? List.of() : addresses.stream().filter(Objects::nonNull).toList();
        }
    }

    /**
     * Cache records whose fields equal every criterion. No criteria selects the whole cache.
     */
    record CacheFilter(Map<String, String> criteria) implements RecipientSpec {
        public CacheFilter {
            criteria = criteria == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(criteria));
        }

        public static CacheFilter of(String field, String value) {
            return new CacheFilter(Map.of(field, value));
        }
    }
}
