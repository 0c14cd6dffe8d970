package com.presencebridge.common.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.presencebridge.common.model.Activity;
import com.presencebridge.common.model.ActivityArgs;
import com.presencebridge.common.model.ActivityCmd;
import com.presencebridge.common.model.ActivityTimestamps;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills defaults on an inbound activity command before it is dispatched.
 *
 * <p>
 * Field by field:
 * <ul>
 * <li>{@code application_id}: absent → {@code ""}</li>
 * <li>{@code args.pid}: absent → {@code 0}</li>
 * <li>{@code activity.type}: absent → {@code 0}</li>
 * <li>{@code activity.flags}: absent → {@code 1} for an instanced activity,
 * otherwise {@code 0}</li>
 * <li>{@code activity.metadata}: absent → {@code {}}</li>
 * <li>{@code activity.buttons}: {@code {label,url}} objects → labels, urls
 * move to {@code metadata.button_urls}</li>
 * <li>{@code activity.timestamps}: second-resolution values → milliseconds</li>
 * </ul>
 * A missing {@code args} bundle is left missing. The input is never modified.
 */
public class ActivityNormalizer {

    /** Largest value still read as epoch seconds (10 digits). */
    static final long MAX_EPOCH_SECONDS = 9_999_999_999L;

    public static final int INSTANCE_FLAG = 1;

    private final ObjectMapper mapper;

    public ActivityNormalizer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ActivityCmd normalize(ActivityCmd input) {
        ActivityCmd cmd = copy(input);
        if (cmd.getApplicationId() == null) {
            cmd.setApplicationId("");
        }
        ActivityArgs args = cmd.getArgs();
        if (args == null) {
            return cmd;
        }
        if (args.getPid() == null) {
            args.setPid(0L);
        }
        if (args.getActivity() != null) {
            normalizeActivity(args.getActivity());
        }
        return cmd;
    }

    private void normalizeActivity(Activity activity) {
        if (activity.getType() == null) {
            activity.setType(0);
        }
        if (activity.getFlags() == null) {
            activity.setFlags(Boolean.TRUE.equals(activity.getInstance()) ? INSTANCE_FLAG : 0);
        }
        Map<String, Object> metadata = activity.getMetadata() != null
                ? new LinkedHashMap<>(activity.getMetadata())
                : new LinkedHashMap<>();

        List<JsonNode> buttons = activity.getButtons();
        if (buttons != null && buttons.stream().anyMatch(JsonNode::isObject)) {
            List<JsonNode> labels = new ArrayList<>();
            List<String> urls = new ArrayList<>();
            for (JsonNode button : buttons) {
                if (button.isObject()) {
                    labels.add(TextNode.valueOf(button.path("label").asText("")));
                    urls.add(button.path("url").asText(""));
                } else {
                    labels.add(button);
                }
            }
            activity.setButtons(labels);
            metadata.put("button_urls", urls);
        }
        activity.setMetadata(metadata);

        ActivityTimestamps timestamps = activity.getTimestamps();
        if (timestamps != null) {
            timestamps.setStart(toMillis(timestamps.getStart()));
            timestamps.setEnd(toMillis(timestamps.getEnd()));
        }
    }

    static Long toMillis(Long value) {
        if (value == null || value <= 0 || value > MAX_EPOCH_SECONDS) {
            return value;
        }
        return value * 1000;
    }

    private ActivityCmd copy(ActivityCmd input) {
        try {
            return mapper.treeToValue(mapper.valueToTree(input), ActivityCmd.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("activity command is not copyable: " + e.getMessage(), e);
        }
    }
}
