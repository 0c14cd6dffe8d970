package com.presencebridge.common.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActivityCmdTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parsesSetActivity() throws Exception {
        ActivityCmd cmd = mapper.readValue(
                "{\"cmd\":\"SET_ACTIVITY\",\"args\":{\"pid\":12,\"activity\":{\"name\":\"Game\"}},"
                        + "\"nonce\":\"n-1\",\"application_id\":\"99\"}",
                ActivityCmd.class);

        assertTrue(cmd.isSetActivity());
        assertEquals(12L, cmd.getArgs().getPid());
        assertEquals("Game", cmd.getArgs().getActivity().getName());
        assertEquals("n-1", cmd.getNonce());
        assertEquals("99", cmd.getApplicationId());
    }

    @Test
    void otherCommandSerializesUnchanged() throws Exception {
        String in = "{\"cmd\":\"INVITE_BROWSER\",\"args\":{\"code\":\"abc\"},\"nonce\":\"7\"}";
        ActivityCmd cmd = mapper.readValue(in, ActivityCmd.class);

        assertFalse(cmd.isSetActivity());
        assertEquals(in, mapper.writeValueAsString(cmd));
    }

    @Test
    void topLevelUnknownFieldsAreKept() throws Exception {
        String in = "{\"cmd\":\"DEEP_LINK\",\"args\":{\"type\":\"CHANNEL\"},\"evt\":\"READY\",\"extra\":1}";
        ActivityCmd cmd = mapper.readValue(in, ActivityCmd.class);

        assertEquals("{\"cmd\":\"DEEP_LINK\",\"args\":{\"type\":\"CHANNEL\"},\"evt\":\"READY\",\"extra\":1}",
                mapper.writeValueAsString(cmd));
    }

    @Test
    void setActivityFactory() {
        ActivityCmd cmd = ActivityCmd.setActivity("1", 5L, null);
        assertEquals(ActivityCmd.SET_ACTIVITY, cmd.getCmd());
        assertEquals(5L, cmd.getArgs().getPid());
        assertNull(cmd.getArgs().getActivity());
    }
}
