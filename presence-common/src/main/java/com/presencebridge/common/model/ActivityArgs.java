package com.presencebridge.common.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Argument bundle of an activity command: the reporting process and the
 * activity it wants shown (absent means "clear").
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "pid", "activity" })
public class ActivityArgs {

    private Long pid;
    private Activity activity;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> unknownFields;

    public ActivityArgs(Long pid, Activity activity) {
        this.pid = pid;
        this.activity = activity;
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
