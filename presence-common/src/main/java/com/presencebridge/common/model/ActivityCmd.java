package com.presencebridge.common.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
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
 * Command produced by the IPC source and the socket command source.
 *
 * <p>
 * Only {@value #SET_ACTIVITY} is interpreted; any other command is relayed as
 * it was received, unknown top-level fields included.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "cmd", "args", "nonce", "application_id" })
public class ActivityCmd {

    public static final String SET_ACTIVITY = "SET_ACTIVITY";

    private String cmd;
    private ActivityArgs args;
    private String nonce;

    @JsonProperty("application_id")
    private String applicationId;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> unknownFields;

    public ActivityCmd(String cmd, ActivityArgs args, String nonce, String applicationId) {
        this.cmd = cmd;
        this.args = args;
        this.nonce = nonce;
        this.applicationId = applicationId;
    }

    public static ActivityCmd setActivity(String applicationId, Long pid, Activity activity) {
        return new ActivityCmd(SET_ACTIVITY, new ActivityArgs(pid, activity), null, applicationId);
    }

    @JsonIgnore
    public boolean isSetActivity() {
        return SET_ACTIVITY.equals(cmd);
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
