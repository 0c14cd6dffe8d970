package com.presencebridge.connector;

import com.presencebridge.common.channel.EventChannel;
import com.presencebridge.common.model.ActivityCmd;
import com.presencebridge.common.model.ProcessDetectedEvent;

/**
 * The three inbound channels the embedding application writes to; the
 * connector owns the receiving ends.
 *
 * <p>
 * The bundled application only feeds {@link #process()} from its process
 * watcher. Embedders that bridge an IPC server or a socket command endpoint
 * send their decoded commands to {@link #ipc()} and {@link #socketCommands()}.
 *
 * @param ipc            commands from the inter-process command source
 * @param process        reports from the process watcher
 * @param socketCommands commands arriving over the socket control channel
 */
public record ProducerChannels(
        EventChannel<ActivityCmd> ipc,
        EventChannel<ProcessDetectedEvent> process,
        EventChannel<ActivityCmd> socketCommands) {

    public static ProducerChannels create() {
        return new ProducerChannels(
                new EventChannel<>("ipc"),
                new EventChannel<>("process"),
                new EventChannel<>("socket-commands"));
    }

    public void closeAll() {
        ipc.close();
        process.close();
        socketCommands.close();
    }
}
