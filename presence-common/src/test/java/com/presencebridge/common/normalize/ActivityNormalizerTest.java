package com.presencebridge.common.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.presencebridge.common.model.Activity;
import com.presencebridge.common.model.ActivityCmd;
import com.presencebridge.common.model.ActivityTimestamps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActivityNormalizerTest {

    private ObjectMapper mapper;
    private ActivityNormalizer normalizer;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        normalizer = new ActivityNormalizer(mapper);
    }

    private ActivityCmd parse(String json) throws Exception {
        return mapper.readValue(json, ActivityCmd.class);
    }

    @Nested
    class Defaults {
        @Test
        void fillsMissingApplicationIdPidTypeFlagsAndMetadata() throws Exception {
            ActivityCmd cmd = normalizer.normalize(parse(
                    "{\"cmd\":\"SET_ACTIVITY\",\"args\":{\"activity\":{\"name\":\"Game\"}}}"));

            assertEquals("", cmd.getApplicationId());
            assertEquals(0L, cmd.getArgs().getPid());
            Activity activity = cmd.getArgs().getActivity();
            assertEquals(0, activity.getType());
            assertEquals(0, activity.getFlags());
            assertEquals(Map.of(), activity.getMetadata());
        }

        @Test
        void instancedActivityGetsInstanceFlag() throws Exception {
            ActivityCmd cmd = normalizer.normalize(parse(
                    "{\"cmd\":\"SET_ACTIVITY\",\"args\":{\"pid\":7,\"activity\":{\"instance\":true}}}"));
            assertEquals(ActivityNormalizer.INSTANCE_FLAG, cmd.getArgs().getActivity().getFlags());
        }

        @Test
        void keepsExplicitValues() throws Exception {
            ActivityCmd cmd = normalizer.normalize(parse(
                    "{\"cmd\":\"SET_ACTIVITY\",\"application_id\":\"42\",\"args\":{\"pid\":9,"
                            + "\"activity\":{\"type\":2,\"flags\":4,\"metadata\":{\"k\":\"v\"}}}}"));
            assertEquals("42", cmd.getApplicationId());
            assertEquals(9L, cmd.getArgs().getPid());
            assertEquals(2, cmd.getArgs().getActivity().getType());
            assertEquals(4, cmd.getArgs().getActivity().getFlags());
            assertEquals("v", cmd.getArgs().getActivity().getMetadata().get("k"));
        }

        @Test
        void missingArgsStayMissing() throws Exception {
            ActivityCmd cmd = normalizer.normalize(parse("{\"cmd\":\"SET_ACTIVITY\"}"));
            assertNull(cmd.getArgs());
            assertEquals("", cmd.getApplicationId());
        }

        @Test
        void absentActivityIsNotInvented() throws Exception {
            ActivityCmd cmd = normalizer.normalize(parse("{\"cmd\":\"SET_ACTIVITY\",\"args\":{\"pid\":3}}"));
            assertNull(cmd.getArgs().getActivity());
            assertEquals(3L, cmd.getArgs().getPid());
        }
    }

    @Nested
    class Buttons {
        @Test
        void splitsLabelsAndUrls() throws Exception {
            ActivityCmd cmd = normalizer.normalize(parse(
                    "{\"cmd\":\"SET_ACTIVITY\",\"args\":{\"activity\":{\"buttons\":["
                            + "{\"label\":\"Join\",\"url\":\"https://a.example\"},"
                            + "{\"label\":\"Watch\",\"url\":\"https://b.example\"}]}}}"));

            Activity activity = cmd.getArgs().getActivity();
            assertEquals(List.of("Join", "Watch"),
                    activity.getButtons().stream().map(b -> b.asText()).toList());
            assertEquals(List.of("https://a.example", "https://b.example"),
                    activity.getMetadata().get("button_urls"));
        }

        @Test
        void labelOnlyButtonsAreLeftAlone() throws Exception {
            ActivityCmd cmd = normalizer.normalize(parse(
                    "{\"cmd\":\"SET_ACTIVITY\",\"args\":{\"activity\":{\"buttons\":[\"Join\"]}}}"));
            Activity activity = cmd.getArgs().getActivity();
            assertEquals("Join", activity.getButtons().get(0).asText());
            assertFalse(activity.getMetadata().containsKey("button_urls"));
        }
    }

    @Nested
    class Timestamps {
        @Test
        void secondsBecomeMilliseconds() {
            Activity activity = Activity.builder()
                    .timestamps(new ActivityTimestamps(1_700_000_000L, 1_700_000_600L))
                    .build();
            ActivityCmd cmd = normalizer.normalize(ActivityCmd.setActivity("1", 5L, activity));

            ActivityTimestamps ts = cmd.getArgs().getActivity().getTimestamps();
            assertEquals(1_700_000_000_000L, ts.getStart());
            assertEquals(1_700_000_600_000L, ts.getEnd());
        }

        @Test
        void extraTimestampFieldsAreKept() throws Exception {
            ActivityCmd cmd = normalizer.normalize(parse(
                    "{\"cmd\":\"SET_ACTIVITY\",\"args\":{\"activity\":"
                            + "{\"timestamps\":{\"start\":1700000000,\"tz\":\"UTC\"}}}}"));

            String json = mapper.writeValueAsString(cmd.getArgs().getActivity().getTimestamps());
            assertEquals("{\"start\":1700000000000,\"tz\":\"UTC\"}", json);
        }

        @Test
        void millisecondsAreKept() {
            assertEquals(1_700_000_000_000L, ActivityNormalizer.toMillis(1_700_000_000_000L));
            assertNull(ActivityNormalizer.toMillis(null));
            assertEquals(0L, ActivityNormalizer.toMillis(0L));
        }
    }

    @Test
    void inputIsNotModified() {
        Activity activity = Activity.builder().name("Game").build();
        ActivityCmd input = ActivityCmd.setActivity(null, null, activity);

        ActivityCmd out = normalizer.normalize(input);

        assertNotSame(input, out);
        assertNull(input.getApplicationId());
        assertNull(input.getArgs().getPid());
        assertNull(activity.getType());
        assertNull(activity.getMetadata());
    }

    @Test
    void normalizingTwiceIsStable() throws Exception {
        ActivityCmd once = normalizer.normalize(parse(
                "{\"cmd\":\"SET_ACTIVITY\",\"args\":{\"activity\":{\"timestamps\":{\"start\":1700000000}}}}"));
        ActivityCmd twice = normalizer.normalize(once);
        assertEquals(mapper.writeValueAsString(once), mapper.writeValueAsString(twice));
    }
}
