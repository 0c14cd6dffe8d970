package com.presencebridge.common.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Start/end of an activity, epoch milliseconds once normalized.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "start", "end" })
public class ActivityTimestamps {
    private Long start;
    private Long end;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> unknownFields;

    public ActivityTimestamps(Long start, Long end) {
        this.start = start;
        this.end = end;
    }

    public static ActivityTimestamps startingAt(long start) {
        return new ActivityTimestamps(start, null);
    }

    @JsonAnySetter
    public void putUnknownField(String key, Object value) {
        if (unknownFields == null) {
            unknownFields = new LinkedHashMap<>();
        }
        unknownFields.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> unknownFields() {
        return unknownFields != null ? unknownFields : Map.of();
    }
}
