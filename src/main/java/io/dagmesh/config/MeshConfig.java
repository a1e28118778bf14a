package io.dagmesh.config;

import io.dagmesh.model.RetryPolicy;
import io.dagmesh.model.ValidationResult;
import io.dagmesh.util.Jsons;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class MeshConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String SETTINGS_FILE = "dagmesh-settings.json";
    public static final int DEFAULT_MAX_CONCURRENCY = 10;
    public static final long DEFAULT_EVENT_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_WORKFLOW_TIMEOUT_MS = 300_000L;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_INITIAL_DELAY_MS = 100L;
    public static final long DEFAULT_RETRY_MAX_DELAY_MS = 10_000L;
    public static final int DEFAULT_MAX_EVENT_HISTORY = 1_000;
    public static final int DEFAULT_MAX_INTERACTIONS = 1_000;
    public static final String DEFAULT_AGENT_ID = "workflow-engine";

    private final Path rootDir;
    private final String namespace;
    private final Settings settings;

    private MeshConfig(Path rootDir, String namespace, Settings settings) {
        this.rootDir = rootDir;
        this.namespace = namespace;
        this.settings = settings;
    }

    /**
     * Purely in-memory configuration: audit rows stay in the in-memory ring, snapshots are never exported.
     */
    public static MeshConfig inMemory() {
        return new MeshConfig(null, DEFAULT_NAMESPACE, Settings.defaults());
    }

    public static MeshConfig inMemory(Settings settings) {
        return new MeshConfig(null, DEFAULT_NAMESPACE, Settings.sanitize(settings, Settings.defaults()));
    }

    public static MeshConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    /**
     * Resolves the root directory and overlays {@value #SETTINGS_FILE} from it when present.
     * Missing or out-of-range values fall back to the defaults.
     */
    public static MeshConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path settingsFile = base.resolve(SETTINGS_FILE);
        Settings settings = Settings.defaults();
        if (Files.isRegularFile(settingsFile)) {
            settings = Settings.sanitize(Jsons.read(settingsFile, Settings.class), settings);
        }
        return new MeshConfig(base, safeNamespace, settings);
    }

    public MeshConfig withSettings(Settings next) {
        return new MeshConfig(rootDir, namespace, Settings.sanitize(next, settings));
    }

    private static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        return value.isBlank() ? DEFAULT_NAMESPACE : value;
    }

    public boolean persistent() {
        return rootDir != null;
    }

    public Path rootDir() {
        return rootDir;
    }

    public String namespace() {
        return namespace;
    }

    public Settings settings() {
        return settings;
    }

    public Path auditFile() {
        return rootDir == null ? null : rootDir.resolve("audit").resolve("audit.log");
    }

    public Path snapshotRoot() {
        return rootDir == null ? null : rootDir.resolve("snapshots");
    }

    public RetryPolicy defaultRetryPolicy(int retries) {
        return RetryPolicy.ofRetries(retries, settings.retryInitialDelayMs(), settings.retryMaxDelayMs());
    }

    /**
     * Tunables read from {@value #SETTINGS_FILE}. Boxed so that absent JSON fields can be told apart
     * from explicit values; {@link #sanitize} fills the gaps.
     */
    public record Settings(
            Integer maxConcurrency,
            Long eventTimeoutMs,
            Long workflowTimeoutMs,
            Integer retryAttempts,
            Long retryInitialDelayMs,
            Long retryMaxDelayMs,
            Boolean tracingEnabled,
            Integer maxEventHistory,
            Integer maxInteractions,
            String defaultAgentId,
            Map<String, List<String>> roleSubscriptions
    ) {
        public Settings {
            roleSubscriptions = roleSubscriptions == null ? Map.of() : copySubscriptions(roleSubscriptions);
        }

        public static Settings defaults() {
            return new Settings(
                    DEFAULT_MAX_CONCURRENCY,
                    DEFAULT_EVENT_TIMEOUT_MS,
                    DEFAULT_WORKFLOW_TIMEOUT_MS,
                    DEFAULT_RETRY_ATTEMPTS,
                    DEFAULT_RETRY_INITIAL_DELAY_MS,
                    DEFAULT_RETRY_MAX_DELAY_MS,
                    true,
                    DEFAULT_MAX_EVENT_HISTORY,
                    DEFAULT_MAX_INTERACTIONS,
                    DEFAULT_AGENT_ID,
                    Map.of(
                            "DAG Orchestrator", List.of("workflow.start", "workflow.pause", "workflow.resume",
                                    "workflow.cancel", "task.execute"),
                            "Integrity Guardian", List.of("integrity.validate", "snapshot.create")
                    )
            );
        }

        static Settings sanitize(Settings raw, Settings defaults) {
            if (raw == null) {
                return defaults;
            }
            long initialDelay = sanitizeLong(raw.retryInitialDelayMs(), defaults.retryInitialDelayMs(), 0L);
            long maxDelay = sanitizeLong(raw.retryMaxDelayMs(), defaults.retryMaxDelayMs(), initialDelay);
            String agentId = raw.defaultAgentId() == null || raw.defaultAgentId().isBlank()
                    ? defaults.defaultAgentId()
                    : raw.defaultAgentId().trim();
            return new Settings(
                    sanitizeInt(raw.maxConcurrency(), defaults.maxConcurrency(), 1),
                    sanitizeLong(raw.eventTimeoutMs(), defaults.eventTimeoutMs(), 1L),
                    sanitizeLong(raw.workflowTimeoutMs(), defaults.workflowTimeoutMs(), 1L),
                    sanitizeInt(raw.retryAttempts(), defaults.retryAttempts(), 0),
                    initialDelay,
                    Math.max(initialDelay, maxDelay),
                    raw.tracingEnabled() == null ? defaults.tracingEnabled() : raw.tracingEnabled(),
                    sanitizeInt(raw.maxEventHistory(), defaults.maxEventHistory(), 1),
                    sanitizeInt(raw.maxInteractions(), defaults.maxInteractions(), 1),
                    agentId,
                    raw.roleSubscriptions().isEmpty() ? defaults.roleSubscriptions() : raw.roleSubscriptions()
            );
        }

        /**
         * Checks values as supplied, before sanitizing; used to reject bad runtime updates.
         */
        public ValidationResult validate() {
            if (maxConcurrency == null || maxConcurrency <= 0) {
                return ValidationResult.fail("maxConcurrency must be greater than 0",
                        "configuration_validation", Map.of("field", "maxConcurrency"));
            }
            if (eventTimeoutMs == null || eventTimeoutMs <= 0) {
                return ValidationResult.fail("eventTimeout must be greater than 0",
                        "configuration_validation", Map.of("field", "eventTimeoutMs"));
            }
            if (workflowTimeoutMs != null && workflowTimeoutMs <= 0) {
                return ValidationResult.fail("workflowTimeout must be greater than 0",
                        "configuration_validation", Map.of("field", "workflowTimeoutMs"));
            }
            if (retryAttempts != null && retryAttempts < 0) {
                return ValidationResult.fail("retryAttempts cannot be negative",
                        "configuration_validation", Map.of("field", "retryAttempts"));
            }
            return ValidationResult.ok("Configuration validation passed", Map.of("type", "configuration_validation"));
        }

        public Settings withMaxConcurrency(int value) {
            return new Settings(value, eventTimeoutMs, workflowTimeoutMs, retryAttempts, retryInitialDelayMs,
                    retryMaxDelayMs, tracingEnabled, maxEventHistory, maxInteractions, defaultAgentId, roleSubscriptions);
        }

        public Settings withEventTimeoutMs(long value) {
            return new Settings(maxConcurrency, value, workflowTimeoutMs, retryAttempts, retryInitialDelayMs,
                    retryMaxDelayMs, tracingEnabled, maxEventHistory, maxInteractions, defaultAgentId, roleSubscriptions);
        }

        public Settings withRetryDelays(long initialDelayMs, long maxDelayMs) {
            return new Settings(maxConcurrency, eventTimeoutMs, workflowTimeoutMs, retryAttempts, initialDelayMs,
                    maxDelayMs, tracingEnabled, maxEventHistory, maxInteractions, defaultAgentId, roleSubscriptions);
        }

        public Settings withTracingEnabled(boolean value) {
            return new Settings(maxConcurrency, eventTimeoutMs, workflowTimeoutMs, retryAttempts, retryInitialDelayMs,
                    retryMaxDelayMs, value, maxEventHistory, maxInteractions, defaultAgentId, roleSubscriptions);
        }

        private static Map<String, List<String>> copySubscriptions(Map<String, List<String>> raw) {
            Map<String, List<String>> out = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> e : raw.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    out.put(e.getKey(), List.copyOf(e.getValue()));
                }
            }
            return Map.copyOf(out);
        }

        private static int sanitizeInt(Integer raw, int fallback, int min) {
            if (raw == null || raw < min) {
                return fallback;
            }
            return raw;
        }

        private static long sanitizeLong(Long raw, long fallback, long min) {
            if (raw == null || raw < min) {
                return fallback;
            }
            return raw;
        }
    }
}
