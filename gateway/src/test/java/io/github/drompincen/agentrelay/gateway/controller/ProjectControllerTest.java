package io.github.drompincen.agentrelay.gateway.controller;

import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.protocol.api.ProjectSummary;
import io.github.drompincen.agentrelay.runtime.auth.AuthResult;
import io.github.drompincen.agentrelay.runtime.auth.AuthService;
import io.github.drompincen.agentrelay.runtime.project.ProjectNotFoundException;
import io.github.drompincen.agentrelay.runtime.project.ProjectResolver;
import io.github.drompincen.agentrelay.runtime.session.SessionOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProjectControllerTest {

    private static final String AUTH = "Bearer 1234";

    @Mock private ProjectResolver projects;
    @Mock private SessionOrchestrator orchestrator;
    @Mock private AuthService authService;

    private final MockHttpServletRequest request = new MockHttpServletRequest();
    private ProjectController controller;

    @BeforeEach
    void setUp() {
        request.setRemoteAddr("10.0.0.9");
        controller = new ProjectController(projects, orchestrator, new BearerPinGuard(authService));
        when(authService.verifyPin(any(), any())).thenReturn(AuthResult.invalidPin());
        when(authService.verifyPin(eq("10.0.0.9"), eq("1234"))).thenReturn(AuthResult.ok());
        when(projects.resolve("missing")).thenThrow(new ProjectNotFoundException("missing"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void listReturnsProjectsUnderTheRoot() {
        ProjectSummary app = new ProjectSummary("app", "/srv/projects/app", "app", Instant.parse("2026-04-01T09:00:00Z"));
        when(projects.list()).thenReturn(List.of(app));

        ResponseEntity<?> response = controller.list(AUTH, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((List<ProjectSummary>) ((Map<String, Object>) response.getBody()).get("projects")).containsExactly(app);
    }

    @Test
    void listNeedsThePin() {
        assertThat(controller.list("Bearer 0000", request).getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        verify(projects, never()).list();
    }

    @Test
    void cancelWithoutDeviceStopsEveryDevicesJob() {
        when(orchestrator.cancelProject("app")).thenReturn(2);

        ResponseEntity<?> response = controller.cancel("app", null, AUTH, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(Map.of("cancelled", 2));
        verify(orchestrator, never()).cancel(anyString(), any());
    }

    @Test
    void cancelWithDeviceStopsOnlyThatJob() {
        when(orchestrator.cancel("dev-a", "app")).thenReturn(true);

        ResponseEntity<?> response = controller.cancel("app", "dev-a", AUTH, request);

        assertThat(response.getBody()).isEqualTo(Map.of("cancelled", 1));
        verify(orchestrator, never()).cancelProject(any());
    }

    @Test
    void cancelOfGlobalChatUsesNullProject() {
        controller.cancel(JobKey.GLOBAL_PROJECT, null, AUTH, request);

        verify(orchestrator).cancelProject(null);
    }

    @Test
    void cancelOfUnknownProjectIsNotFound() {
        assertThat(controller.cancel("missing", null, AUTH, request).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        verifyNoInteractions(orchestrator);
    }
}
