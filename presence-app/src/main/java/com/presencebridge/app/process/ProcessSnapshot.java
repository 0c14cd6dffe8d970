package com.presencebridge.app.process;

import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A running process as the watcher sees it.
 *
 * @param pid         operating system process id
 * @param executable  full command path
 * @param startMillis start time in epoch milliseconds, 0 when unknown
 */
public record ProcessSnapshot(long pid, String executable, long startMillis) {

    /**
     * Processes visible to this JVM that expose a command path.
     */
    public static Stream<ProcessSnapshot> listRunning() {
        return ProcessHandle.allProcesses()
                .map(ProcessSnapshot::of)
                .flatMap(Optional::stream);
    }

    static Optional<ProcessSnapshot> of(ProcessHandle handle) {
        ProcessHandle.Info info = handle.info();
        return info.command().map(command -> new ProcessSnapshot(
                handle.pid(),
                command,
                info.startInstant().map(Instant::toEpochMilli).orElse(0L)));
    }
}
