package com.flagship.fraud_decisions.consumer;

import lombok.Value;

import java.time.Duration;

/**
 * What the listener should do with the record it just handed to the processor.
 */
@Value
public class ProcessingOutcome {

    public enum Action {
        /** Durably handled (stored or dead-lettered): commit the offset. */
        COMMIT,
        /** Not handled: seek back and pause the partition before redelivery. */
        RETRY_LATER
    }

    private static final ProcessingOutcome COMMIT = new ProcessingOutcome(Action.COMMIT, Duration.ZERO);

    Action action;
    Duration pause;

    public static ProcessingOutcome commit() {
        return COMMIT;
    }

    public static ProcessingOutcome retryLater(Duration pause) {
        return new ProcessingOutcome(Action.RETRY_LATER, pause);
    }

    public boolean isCommit() {
        return action == Action.COMMIT;
    }
}
