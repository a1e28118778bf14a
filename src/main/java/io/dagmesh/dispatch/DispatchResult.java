package io.dagmesh.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.util.Jsons;

public record DispatchResult(boolean success, JsonNode output, String error) {
    public DispatchResult {
        output = Jsons.copy(output);
    }

    public static DispatchResult ok(JsonNode output) {
        return new DispatchResult(true, output, null);
    }

    public static DispatchResult fail(String error) {
        return new DispatchResult(false, null, error);
    }
}
