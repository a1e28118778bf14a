package io.dagmesh.observability;

import io.dagmesh.engine.WorkflowEngine;
import io.dagmesh.mesh.AgentMesh;
import io.dagmesh.routing.RouterStats;
import io.dagmesh.scheduler.TaskScheduler;

import java.util.Locale;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(AgentMesh.MeshMetrics metrics) {
        return format(metrics, null);
    }

    public static String format(AgentMesh.MeshMetrics metrics, String namespace) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "dagmesh_agents_total", "Registered agents", null, null, metrics.agents());
        appendGauge(sb, "dagmesh_uptime_ms", "Mesh uptime in milliseconds", null, null, metrics.uptimeMs());

        WorkflowEngine.EngineMetrics workflows = metrics.workflows();
        appendGauge(sb, "dagmesh_workflows_total", "Workflows grouped by state", "state", "active", workflows.activeWorkflows());
        appendGauge(sb, "dagmesh_workflows_total", "Workflows grouped by state", "state", "completed", workflows.completedWorkflows());
        appendGauge(sb, "dagmesh_workflows_total", "Workflows grouped by state", "state", "failed", workflows.failedWorkflows());
        appendGauge(sb, "dagmesh_workflows_total", "Workflows grouped by state", "state", "cancelled", workflows.cancelledWorkflows());
        appendGauge(sb, "dagmesh_workflows_total_all", "Total workflows known to the engine", null, null, workflows.totalWorkflows());
        appendGauge(sb, "dagmesh_node_executions_total", "Node executions grouped by result", "result", "succeeded", workflows.tasksSucceeded());
        appendGauge(sb, "dagmesh_node_executions_total", "Node executions grouped by result", "result", "failed", workflows.tasksFailed());
        appendRatio(sb, "dagmesh_workflow_success_ratio", "Completed share of settled workflows", workflows.successRate());
        appendRatio(sb, "dagmesh_workflow_duration_avg_ms", "Average workflow duration in milliseconds", workflows.averageExecutionMs());
        appendGauge(sb, "dagmesh_workflow_throughput_per_minute", "Workflows settled in the last minute", null, null, workflows.throughputPerMinute());

        RouterStats routing = metrics.routing();
        appendGauge(sb, "dagmesh_events_total", "Routed events grouped by result", "result", "delivered", routing.routed());
        appendGauge(sb, "dagmesh_events_total", "Routed events grouped by result", "result", "failed", routing.failed());
        appendGauge(sb, "dagmesh_broadcasts_total", "Broadcasts issued", null, null, routing.broadcasts());
        appendGauge(sb, "dagmesh_subscribed_agents", "Agents with at least one event subscription", null, null, routing.subscribedAgents());

        TaskScheduler.SchedulerStats tasks = metrics.tasks();
        appendGauge(sb, "dagmesh_scheduled_tasks", "Scheduled tasks grouped by status", "status", "pending", tasks.pending());
        appendGauge(sb, "dagmesh_scheduled_tasks", "Scheduled tasks grouped by status", "status", "running", tasks.running());
        appendGauge(sb, "dagmesh_scheduled_tasks", "Scheduled tasks grouped by status", "status", "succeeded", tasks.succeeded());
        appendGauge(sb, "dagmesh_scheduled_tasks", "Scheduled tasks grouped by status", "status", "failed", tasks.failed());
        appendRatio(sb, "dagmesh_event_error_ratio", "Failed share of routed events", metrics.errorRate());

        String base = sb.toString();
        String normalizedNamespace = namespace == null ? "" : namespace.trim();
        if (normalizedNamespace.isBlank()) {
            return base;
        }
        String escapedNs = escapeLabel(normalizedNamespace);
        StringBuilder withNamespace = new StringBuilder(base.length() * 2);
        for (String line : base.split("\\r?\\n")) {
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith("#")) {
                withNamespace.append(line).append('\n');
                continue;
            }
            int sep = line.lastIndexOf(' ');
            String sample = line.substring(0, sep);
            String value = line.substring(sep + 1);
            int brace = sample.indexOf('{');
            if (brace >= 0 && sample.endsWith("}")) {
                sample = sample.substring(0, brace + 1) + "namespace=\"" + escapedNs + "\"," + sample.substring(brace + 1);
            } else {
                sample = sample + "{namespace=\"" + escapedNs + "\"}";
            }
            withNamespace.append(sample).append(' ').append(value).append('\n');
        }
        withNamespace.append("# HELP dagmesh_namespace_info Mesh namespace marker\n");
        withNamespace.append("# TYPE dagmesh_namespace_info gauge\n");
        withNamespace.append("dagmesh_namespace_info{namespace=\"").append(escapedNs).append("\"} 1\n");
        return withNamespace.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendHeader(sb, metric, help);
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static void appendRatio(StringBuilder sb, String metric, String help, double value) {
        appendHeader(sb, metric, help);
        sb.append(metric).append(' ').append(String.format(Locale.ROOT, "%.4f", value)).append('\n');
    }

    private static void appendHeader(StringBuilder sb, String metric, String help) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
