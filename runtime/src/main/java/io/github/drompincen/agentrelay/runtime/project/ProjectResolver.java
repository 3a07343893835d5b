package io.github.drompincen.agentrelay.runtime.project;

import io.github.drompincen.agentrelay.protocol.api.ProjectSummary;
import io.github.drompincen.agentrelay.runtime.config.RelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Maps a project id to its working directory: a direct child directory of {@code projects-root}.
 */
@Service
public class ProjectResolver {

    private static final Logger log = LoggerFactory.getLogger(ProjectResolver.class);
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path projectsRoot;

    public ProjectResolver(RelayProperties properties) {
        this.projectsRoot = properties.projectsRoot().toAbsolutePath().normalize();
    }

    /**
     * @return the project directory, or {@code null} for the global project
     * @throws ProjectNotFoundException when the id is malformed or no such directory exists
     */
    public Path resolve(String projectId) {
        if (projectId == null) {
            return null;
        }
        if (!VALID_ID.matcher(projectId).matches() || projectId.equals(".") || projectId.equals("..")) {
            throw new ProjectNotFoundException(projectId);
        }
        Path dir = projectsRoot.resolve(projectId).normalize();
        if (!dir.getParent().equals(projectsRoot) || !Files.isDirectory(dir)) {
            throw new ProjectNotFoundException(projectId);
        }
        return dir;
    }

    /**
     * Lists the directories that {@link #resolve} accepts, by name. A missing projects root lists nothing.
     *
     * @throws UncheckedIOException when the projects root cannot be read
     */
    public List<ProjectSummary> list() {
        if (!Files.isDirectory(projectsRoot)) {
            log.warn("Projects root {} does not exist", projectsRoot);
            return List.of();
        }
        try (Stream<Path> children = Files.list(projectsRoot)) {
            return children
                    .filter(Files::isDirectory)
                    .map(dir -> dir.getFileName().toString())
                    .filter(name -> !name.startsWith(".") && VALID_ID.matcher(name).matches())
                    .sorted(Comparator.comparing(String::toLowerCase))
                    .map(this::summary)
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list projects under " + projectsRoot, e);
        }
    }

    private ProjectSummary summary(String name) {
        Path dir = projectsRoot.resolve(name);
        Instant modified = null;
        try {
            modified = Files.getLastModifiedTime(dir).toInstant();
        } catch (IOException e) {
            log.debug("No modification time for {}: {}", dir, e.getMessage());
        }
        return new ProjectSummary(name, dir.toString(), name, modified);
    }
}
