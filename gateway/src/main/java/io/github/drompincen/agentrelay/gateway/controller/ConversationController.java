package io.github.drompincen.agentrelay.gateway.controller;

import io.github.drompincen.agentrelay.protocol.api.ConversationMessage;
import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.protocol.api.PartialResponse;
import io.github.drompincen.agentrelay.runtime.conversation.ConversationStore;
import io.github.drompincen.agentrelay.runtime.project.ProjectNotFoundException;
import io.github.drompincen.agentrelay.runtime.project.ProjectResolver;
import io.github.drompincen.agentrelay.runtime.session.SessionOrchestrator;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversation history and in-flight response of a project, for clients that load state over HTTP.
 * {@code __global__} addresses the global conversation. Requests carry the PIN as a bearer token.
 */
@RestController
@RequestMapping("/api/projects/{projectId}")
public class ConversationController {

    private static final Logger log = LoggerFactory.getLogger(ConversationController.class);

    private final ConversationStore conversations;
    private final SessionOrchestrator orchestrator;
    private final ProjectResolver projects;
    private final BearerPinGuard guard;

    public ConversationController(ConversationStore conversations, SessionOrchestrator orchestrator,
                                  ProjectResolver projects, BearerPinGuard guard) {
        this.conversations = conversations;
        this.orchestrator = orchestrator;
        this.projects = projects;
        this.guard = guard;
    }

    @GetMapping("/conversation")
    public ResponseEntity<?> conversation(@PathVariable String projectId,
                                          @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                          HttpServletRequest request) {
        ResponseEntity<?> denied = guard.reject(request, authorization);
        if (denied != null) return denied;
        String project = normalize(projectId);
        try {
            projects.resolve(project);
        } catch (ProjectNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
        List<ConversationMessage> messages = conversations.load(project);
        return ResponseEntity.ok(Map.of("messages", messages));
    }

    @DeleteMapping("/conversation")
    public ResponseEntity<?> clear(@PathVariable String projectId,
                                   @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                   HttpServletRequest request) {
        ResponseEntity<?> denied = guard.reject(request, authorization);
        if (denied != null) return denied;
        String project = normalize(projectId);
        try {
            projects.resolve(project);
        } catch (ProjectNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
        if (orchestrator.isProjectActive(project)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "A job is running for this project"));
        }
        conversations.clear(project);
        log.info("Cleared conversation of {}", projectId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/streaming")
    public ResponseEntity<?> streaming(@PathVariable String projectId,
                                       @RequestParam(required = false) String deviceId,
                                       @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                   HttpServletRequest request) {
        ResponseEntity<?> denied = guard.reject(request, authorization);
        if (denied != null) return denied;
        String project = normalize(projectId);
        try {
            projects.resolve(project);
        } catch (ProjectNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
        Map<String, Object> body = new HashMap<>();
        body.put("active", orchestrator.isProjectActive(project));
        PartialResponse partial = deviceId == null || deviceId.isBlank() ? null
                : orchestrator.partial(JobKey.of(deviceId, project)).orElse(null);
        body.put("partial", partial);
        return ResponseEntity.ok(body);
    }

    private static String normalize(String projectId) {
        return JobKey.GLOBAL_PROJECT.equals(projectId) ? null : projectId;
    }
}
