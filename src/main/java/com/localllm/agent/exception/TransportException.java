package com.localllm.agent.exception;

/**
 * Transport-level failure talking to a tool-provider: process died, socket
 * reset, timeout, unparseable frame. Demotes the connection; always transient.
 */
public class TransportException extends AgentException {

    public TransportException(String message) {
        super(message, null, true);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
