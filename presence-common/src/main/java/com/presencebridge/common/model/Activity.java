package com.presencebridge.common.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rich presence activity as displayed by clients.
 *
 * <p>
 * Fields the bridge does not model are kept in {@link #unknownFields()} and
 * written back out unchanged.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "application_id", "name", "details", "state", "timestamps", "type", "assets", "buttons",
        "metadata", "flags", "instance" })
public class Activity {

    @JsonProperty("application_id")
    private String applicationId;

    private String name;
    private String details;
    private String state;
    private ActivityTimestamps timestamps;

    /** Activity kind; 0 is "Playing". */
    private Integer type;

    private JsonNode assets;

    /** {label, url} objects on input, labels only once normalized. */
    private List<JsonNode> buttons;

    private Map<String, Object> metadata;
    private Integer flags;
    private Boolean instance;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> unknownFields;

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
