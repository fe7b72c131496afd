package com.mk.fx.qa.evidence.metrics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/** Renders collected series in Grafana JSON and Prometheus text exposition formats. */
final class MetricsExporter {

  /** One Grafana data point; {@code timestamp} is epoch milliseconds. */
  record GrafanaPoint(String name, double value, long timestamp, Map<String, String> tags) {}

  List<GrafanaPoint> grafana(Collection<ContextSeries> contexts) {
    List<GrafanaPoint> points = new ArrayList<>();
    for (ContextSeries ctx : contexts) {
      for (SystemSample s : ctx.system.snapshot()) {
        long ts = s.timestamp().toEpochMilli();
        points.add(systemPoint(ctx.contextId, "cpu.usage", s.cpu().usage(), ts));
        points.add(systemPoint(ctx.contextId, "memory.usage", s.memory().percent(), ts));
        points.add(systemPoint(ctx.contextId, "disk.usage", s.disk().usage(), ts));
      }
      for (StepMetric step : ctx.steps.snapshot()) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("scenarioId", step.scenarioId());
        tags.put("metric", "step.duration");
        tags.put("stepId", step.stepId());
        points.add(
            new GrafanaPoint(
                step.scenarioId() + ".step.duration",
                step.durationMs(),
                step.timestamp().toEpochMilli(),
                tags));
      }
    }
    return points;
  }

  String prometheus(Collection<ContextSeries> contexts) {
    var sb = new StringBuilder();
    gauge(sb, contexts, "cpu_usage", "CPU usage percentage", s -> s.cpu().usage());
    gauge(sb, contexts, "memory_usage", "Memory usage percentage", s -> s.memory().percent());
    gauge(sb, contexts, "disk_usage", "Disk usage percentage", s -> s.disk().usage());

    sb.append("# HELP test_duration Test step duration in milliseconds\n");
    sb.append("# TYPE test_duration gauge\n");
    for (ContextSeries ctx : contexts) {
      for (StepMetric step : ctx.steps.snapshot()) {
        sb.append("test_duration{scenario=\"")
            .append(escape(step.scenarioId()))
            .append("\",step=\"")
            .append(escape(step.stepId()))
            .append("\",status=\"")
            .append(step.status().key())
            .append("\"} ")
            .append(step.durationMs())
            .append(' ')
            .append(step.timestamp().toEpochMilli())
            .append('\n');
      }
    }
    return sb.toString();
  }

  private static void gauge(
      StringBuilder sb,
      Collection<ContextSeries> contexts,
      String name,
      String help,
      ToDoubleFunction<SystemSample> value) {
    sb.append("# HELP ").append(name).append(' ').append(help).append('\n');
    sb.append("# TYPE ").append(name).append(" gauge\n");
    for (ContextSeries ctx : contexts) {
      Optional<SystemSample> latest = ctx.system.latest();
      latest.ifPresent(
          s ->
              sb.append(name)
                  .append("{context=\"")
                  .append(escape(ctx.contextId))
                  .append("\"} ")
                  .append(value.applyAsDouble(s))
                  .append(' ')
                  .append(s.timestamp().toEpochMilli())
                  .append('\n'));
    }
  }

  private static GrafanaPoint systemPoint(String contextId, String metric, double value, long ts) {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("contextId", contextId);
    tags.put("metric", metric);
    return new GrafanaPoint(contextId + "." + metric, value, ts, tags);
  }

  static String escape(String labelValue) {
    if (labelValue == null) return "";
    return labelValue.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
  }
}
