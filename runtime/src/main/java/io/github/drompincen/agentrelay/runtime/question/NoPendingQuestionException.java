package io.github.drompincen.agentrelay.runtime.question;

import io.github.drompincen.agentrelay.protocol.api.JobKey;

public class NoPendingQuestionException extends RuntimeException {

    public NoPendingQuestionException(JobKey key) {
        super("No pending question for " + key);
    }
}
