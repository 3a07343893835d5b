package io.github.drompincen.agentrelay.gateway.controller;

import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.runtime.project.ProjectNotFoundException;
import io.github.drompincen.agentrelay.runtime.project.ProjectResolver;
import io.github.drompincen.agentrelay.runtime.session.SessionOrchestrator;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final ProjectResolver projects;
    private final SessionOrchestrator orchestrator;
    private final BearerPinGuard guard;

    public ProjectController(ProjectResolver projects, SessionOrchestrator orchestrator, BearerPinGuard guard) {
        this.projects = projects;
        this.orchestrator = orchestrator;
        this.guard = guard;
    }

    @GetMapping
    public ResponseEntity<?> list(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                  HttpServletRequest request) {
        ResponseEntity<?> denied = guard.reject(request, authorization);
        if (denied != null) return denied;
        return ResponseEntity.ok(Map.of("projects", projects.list()));
    }

    /**
     * Cancels the project's job. With {@code deviceId} only that device's job is cancelled,
     * otherwise the job on every device.
     */
    @PostMapping("/{projectId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String projectId,
                                    @RequestParam(required = false) String deviceId,
                                    @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                    HttpServletRequest request) {
        ResponseEntity<?> denied = guard.reject(request, authorization);
        if (denied != null) return denied;
        String project = JobKey.GLOBAL_PROJECT.equals(projectId) ? null : projectId;
        try {
            projects.resolve(project);
        } catch (ProjectNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
        int cancelled;
        if (deviceId != null && !deviceId.isBlank()) {
            cancelled = orchestrator.cancel(deviceId, project) ? 1 : 0;
        } else {
            cancelled = orchestrator.cancelProject(project);
        }
        log.info("REST cancel of {} stopped {} job(s)", projectId, cancelled);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }
}
