package com.presencebridge.connector.payload;

import com.presencebridge.common.model.Activity;
import com.presencebridge.common.model.ActivityArgs;
import com.presencebridge.common.model.ActivityCmd;
import com.presencebridge.common.model.ActivityPayload;
import com.presencebridge.common.model.ActivityTimestamps;
import com.presencebridge.common.model.ProcessDetectedEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;

/**
 * Builds outbound payloads from producer events.
 */
@Slf4j
public final class ActivityPayloads {

    private ActivityPayloads() {
    }

    /**
     * Payload for a normalized {@code SET_ACTIVITY} bundle: the empty form keyed
     * by pid when no activity is given, otherwise the activity stamped with the
     * command's application id.
     */
    public static ActivityPayload fromCommand(ActivityCmd cmd, ActivityArgs args) {
        long pid = args.getPid() != null ? args.getPid() : 0L;
        Activity activity = args.getActivity();
        if (activity == null) {
            return ActivityPayload.empty(pid, Long.toString(pid));
        }
        Activity stamped = activity.toBuilder()
                .applicationId(cmd.getApplicationId())
                .build();
        return ActivityPayload.of(stamped, args.getPid(), Long.toString(pid));
    }

    /**
     * Populated payload for a detected process; the session id doubles as
     * application id and socket id.
     */
    public static ActivityPayload fromProcess(ProcessDetectedEvent event) {
        Activity activity = Activity.builder()
                .applicationId(event.id())
                .name(event.name())
                .timestamps(ActivityTimestamps.startingAt(parseTimestamp(event.timestamp())))
                .type(0)
                .metadata(new LinkedHashMap<>())
                .flags(0)
                .build();
        long pid = event.pid() != null ? event.pid() : 0L;
        return ActivityPayload.of(activity, pid, event.id());
    }

    /**
     * Empty payload closing {@code socketId}.
     */
    public static ActivityPayload closing(Long lastProcessId, String socketId) {
        return ActivityPayload.empty(lastProcessId != null ? lastProcessId : 0L, socketId != null ? socketId : "");
    }

    static long parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            log.debug("ignoring non-numeric process timestamp '{}'", timestamp);
            return 0L;
        }
    }
}
