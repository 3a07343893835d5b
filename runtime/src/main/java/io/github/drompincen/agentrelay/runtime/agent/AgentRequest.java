package io.github.drompincen.agentrelay.runtime.agent;

import java.nio.file.Path;

/**
 * One agent run. {@code sessionId} resumes a prior agent conversation when present; {@code cwd} is
 * the project directory, or {@code null} for the process default.
 */
public record AgentRequest(String prompt, String sessionId, Path cwd) {}
