package com.presencebridge.app;

import com.presencebridge.connector.transport.TransportBindException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Presence bridge entry point.
 */
@Slf4j
@SpringBootApplication
public class PresenceBridgeApplication {

    public static void main(String[] args) {
        try {
            SpringApplication.run(PresenceBridgeApplication.class, args);
        } catch (RuntimeException e) {
            TransportBindException bindFailure = findBindFailure(e);
            if (bindFailure != null) {
                log.error("Cannot listen on {}:{}: {}", bindFailure.getHost(), bindFailure.getPort(),
                        bindFailure.getCause() != null ? bindFailure.getCause().getMessage() : "bind failed");
                System.exit(1);
            }
            throw e;
        }
    }

    static TransportBindException findBindFailure(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof TransportBindException bind) {
                return bind;
            }
            if (cur.getCause() == cur) {
                break;
            }
        }
        return null;
    }
}
