package io.github.drompincen.agentrelay.runtime.project;

public class ProjectNotFoundException extends RuntimeException {

    public ProjectNotFoundException(String projectId) {
        super("Unknown project: " + projectId);
    }
}
