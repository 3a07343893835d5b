package io.github.drompincen.agentrelay.runtime.question;

/**
 * What a new job needs to continue after a question was answered.
 */
public record ResumePlan(String prompt, String sessionId) {}
