package com.presencebridge.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The record broadcast to every connected client:
 * {@code {activity, pid, socketId}}.
 *
 * <p>
 * {@code activity} is always written, as {@code null} for the empty form that
 * tells clients to clear whatever they display for {@code socketId}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({ "activity", "pid", "socketId" })
public class ActivityPayload {

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Activity activity;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Long pid;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String socketId;

    public static ActivityPayload empty(long pid, String socketId) {
        return new ActivityPayload(null, pid, socketId);
    }

    public static ActivityPayload of(Activity activity, Long pid, String socketId) {
        return new ActivityPayload(activity, pid, socketId);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return activity == null;
    }
}
