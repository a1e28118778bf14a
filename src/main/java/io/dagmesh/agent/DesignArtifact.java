package io.dagmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.util.Jsons;

import java.time.Instant;
import java.util.List;

public record DesignArtifact(
        String id,
        String type,
        JsonNode content,
        String version,
        Instant createdAt,
        List<String> validatedBy
) {
    public DesignArtifact {
        content = Jsons.copy(content);
        validatedBy = validatedBy == null ? List.of() : List.copyOf(validatedBy);
    }
}
