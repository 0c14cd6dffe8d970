package com.presencebridge.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Report from the process watcher: the detected application's session id,
 * display name, optional start time and pid.
 *
 * @param id        session identifier, {@value #NONE_ID} when nothing is detected
 * @param name      human readable name
 * @param timestamp start time as reported by the watcher, may be null
 * @param pid       process id, may be null
 */
public record ProcessDetectedEvent(String id, String name, String timestamp, Long pid) {

    /** Session id the watcher reports when no known process is running. */
    public static final String NONE_ID = "null";

    public static ProcessDetectedEvent none() {
        return new ProcessDetectedEvent(NONE_ID, null, null, null);
    }

    public static ProcessDetectedEvent detected(String id, String name, String timestamp, Long pid) {
        return new ProcessDetectedEvent(id, name, timestamp, pid);
    }

    /**
     * A missing id is treated like the sentinel.
     */
    @JsonIgnore
    public boolean isNone() {
        return id == null || NONE_ID.equals(id);
    }
}
