package com.presencebridge.app;

import com.presencebridge.connector.ClientConnector;
import com.presencebridge.common.model.ActivityCmd;
import com.presencebridge.connector.ConnectorSettings;
import com.presencebridge.connector.ProducerChannels;
import com.presencebridge.connector.transport.PresenceSocketServer;
import com.presencebridge.connector.transport.TransportBindException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "presence.bridge.port=0",
        "presence.bridge.strict-invariants=true"
})
class PresenceBridgeApplicationTest {

    @Autowired
    private PresenceSocketServer server;

    @Autowired
    private ClientConnector connector;

    @Autowired
    private ConnectorSettings settings;

    @Autowired
    private ProducerChannels producers;

    @Test
    void contextStartsListenerAndConnector() {
        assertTrue(server.isRunning());
        assertNotEquals(0, server.getBoundPort());
        assertTrue(connector.isRunning());
        assertTrue(settings.isStrictInvariants());
        assertEquals(ConnectorSettings.DEFAULT_WELCOME_PAYLOAD, settings.getWelcomePayload());
    }

    @Test
    void clientReceivesWelcomePayload() throws Exception {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        WebSocket ws = connect(received);

        assertEquals("{\"activity\":null,\"pid\":0,\"socketId\":\"0\"}", received.poll(5, TimeUnit.SECONDS));
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").get(5, TimeUnit.SECONDS);
    }

    @Test
    void embedderIpcCommandReachesClient() throws Exception {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        WebSocket ws = connect(received);
        assertNotNull(received.poll(5, TimeUnit.SECONDS), "no welcome payload");

        // registration follows the welcome, so retry until the relay reaches this client
        String relayed = null;
        long deadline = System.currentTimeMillis() + 5_000;
        while (relayed == null && System.currentTimeMillis() < deadline) {
            assertTrue(producers.ipc().send(ActivityCmd.setActivity("app", 9L, null)));
            relayed = received.poll(100, TimeUnit.MILLISECONDS);
        }

        assertEquals("{\"activity\":null,\"pid\":9,\"socketId\":\"9\"}", relayed);
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").get(5, TimeUnit.SECONDS);
    }

    private WebSocket connect(BlockingQueue<String> received) throws Exception {
        return HttpClient.newHttpClient().newWebSocketBuilder()
                .buildAsync(URI.create("ws://127.0.0.1:" + server.getBoundPort() + "/"), new WebSocket.Listener() {
                    @Override
                    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                        received.add(data.toString());
                        webSocket.request(1);
                        return null;
                    }
                })
                .get(5, TimeUnit.SECONDS);
    }

    @Test
    void bindFailureIsFoundInCauseChain() {
        TransportBindException bind = new TransportBindException("127.0.0.1", 1337,
                new java.net.BindException("Address already in use"));
        RuntimeException wrapped = new IllegalStateException("context failed", new RuntimeException(bind));

        assertSame(bind, PresenceBridgeApplication.findBindFailure(wrapped));
        assertNull(PresenceBridgeApplication.findBindFailure(new RuntimeException("other")));
    }
}
