package com.flagship.fraud_decisions.consumer;

/**
 * The dead-letter topic did not acknowledge a message. The source offset must not be committed.
 */
public class DeadLetterPublishException extends RuntimeException {

    public DeadLetterPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
