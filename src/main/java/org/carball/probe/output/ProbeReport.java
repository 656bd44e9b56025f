package org.carball.probe.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.probe.model.QueryResult;
import org.carball.probe.model.ResultRow;
import org.carball.probe.model.profile.MetricStats;
import org.carball.probe.model.profile.ProfileReport;
import org.carball.probe.model.profile.RunRecord;
import org.carball.probe.model.profile.TimingSummary;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a query result or a profile report as JSON or Markdown.
 */
@Slf4j
public class ProbeReport {

    static final int MARKDOWN_ROW_LIMIT = 50;

    private final QueryResult queryResult;
    private final ProfileReport profileReport;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    private ProbeReport(QueryResult queryResult, ProfileReport profileReport) {
        this.queryResult = queryResult;
        this.profileReport = profileReport;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public static ProbeReport forQuery(QueryResult result) {
        return new ProbeReport(result, null);
    }

    public static ProbeReport forProfile(ProfileReport report) {
        return new ProbeReport(null, report);
    }

    public String toJson() {
        Map<String, Object> reportData = new LinkedHashMap<>();
        reportData.put("generated_at", timestamp);
        if (queryResult != null) {
            reportData.put("query_result", queryResult);
        }
        if (profileReport != null) {
            reportData.put("profile", profileReport);
        }

        try {
            return objectMapper.writeValueAsString(reportData);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        md.append("# Model Probe Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n\n");

        if (queryResult != null) {
            appendQueryResult(md, queryResult);
        }
        if (profileReport != null) {
            appendProfile(md, profileReport);
        }
        return md.toString();
    }

    private void appendQueryResult(StringBuilder md, QueryResult result) {
        md.append("## Query\n\n");
        md.append("```\n").append(result.getQuery()).append("\n```\n\n");

        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Success | ").append(result.isSuccess() ? "yes" : "no").append(" |\n");
        if (result.getSource() != null) {
            md.append("| Source | ").append(result.getSource().getWireName()).append(" |\n");
        }
        md.append("| Elapsed | ").append(String.format("%.2f ms", result.getElapsedMs())).append(" |\n");
        md.append("| Rows | ").append(result.getRowCount()).append(result.isTruncated() ? " (truncated)" : "")
                .append(" |\n");
        if (result.isCacheHit()) {
            md.append("| Cache age | ").append(String.format("%.1f s", result.getCacheAgeSeconds())).append(" |\n");
        }
        if (result.isClientFiltered()) {
            md.append("| Client filtered | yes |\n");
        }
        md.append("\n");

        if (!result.isSuccess()) {
            md.append("### Error\n\n");
            md.append("- **Kind:** ").append(result.getErrorKind()).append("\n");
            md.append("- **Message:** ").append(result.getError()).append("\n\n");
            if (!result.getSuggestions().isEmpty()) {
                md.append("**Suggestions:**\n");
                result.getSuggestions().forEach(s -> md.append("- ").append(s).append("\n"));
                md.append("\n");
            }
            return;
        }

        appendRows(md, result.getColumns(), result.getRows());
    }

    private void appendRows(StringBuilder md, List<String> columns, List<ResultRow> rows) {
        if (rows.isEmpty()) {
            md.append("_No rows returned._\n\n");
            return;
        }
        List<String> header = columns.isEmpty() ? rows.get(0).columns() : columns;

        md.append("| ").append(String.join(" | ", header)).append(" |\n");
        md.append("|").append("---|".repeat(header.size())).append("\n");
        rows.stream().limit(MARKDOWN_ROW_LIMIT).forEach(row -> {
            md.append("|");
            for (String column : header) {
                md.append(" ").append(cell(row.get(column))).append(" |");
            }
            md.append("\n");
        });
        if (rows.size() > MARKDOWN_ROW_LIMIT) {
            md.append("\n_").append(rows.size() - MARKDOWN_ROW_LIMIT).append(" more rows not shown._\n");
        }
        md.append("\n");
    }

    private void appendProfile(StringBuilder md, ProfileReport report) {
        TimingSummary summary = report.getSummary();

        md.append("## Profile\n\n");
        md.append("```\n").append(report.getQuery()).append("\n```\n\n");
        md.append("- **Runs:** ").append(report.getRuns().size()).append("\n");
        md.append("- **Trace:** ").append(report.isTraceAvailable() ? report.getTraceSource() : "unavailable")
                .append("\n");
        md.append("- **Engine metrics available:** ").append(summary.isMetricsAvailable() ? "yes" : "no")
                .append("\n");
        if (report.isDeadlineReached()) {
            md.append("- **Deadline reached:** remaining runs skipped\n");
        }
        md.append("\n");

        md.append("### Summary\n\n");
        md.append("| Metric | Min (ms) | Mean (ms) | Max (ms) |\n");
        md.append("|--------|----------|-----------|----------|\n");
        appendStats(md, "Wall clock", summary.getWall());
        appendStats(md, "Storage engine", summary.getStorageEngine());
        appendStats(md, "Formula engine", summary.getFormulaEngine());
        md.append("\n");

        if (summary.getStorageEnginePercent() != null) {
            md.append("Storage engine ").append(summary.getStorageEnginePercent()).append("% / formula engine ")
                    .append(summary.getFormulaEnginePercent()).append("%\n\n");
        }
        if (!summary.isMetricsAvailable()) {
            md.append("_Engine breakdown unavailable; timings are wall-clock only._\n\n");
        }

        md.append("### Runs\n\n");
        md.append("| Run | Cache | Wall (ms) | SE (ms) | FE (ms) | CPU (ms) | SE queries | Rows | Status |\n");
        md.append("|-----|-------|-----------|---------|---------|----------|------------|------|--------|\n");
        for (RunRecord run : report.getRuns()) {
            md.append("| ").append(run.runNumber())
                    .append(" | ").append(run.cacheState().getLabel())
                    .append(" | ").append(String.format("%.2f", run.wallMs()))
                    .append(" | ").append(run.seMs() == null ? "-" : String.format("%.2f", run.seMs()))
                    .append(" | ").append(run.feMs() == null ? "-" : String.format("%.2f", run.feMs()))
                    .append(" | ").append(run.engineCpuMs() == null ? "-" : String.format("%.2f", run.engineCpuMs()))
                    .append(" | ").append(run.seQueryCount())
                    .append(" | ").append(run.rowCount())
                    .append(" | ").append(runStatus(run))
                    .append(" |\n");
        }
        md.append("\n");
    }

    private static void appendStats(StringBuilder md, String label, MetricStats stats) {
        md.append("| ").append(label).append(" | ");
        if (stats == null) {
            md.append("- | - | - |\n");
            return;
        }
        md.append(String.format("%.2f | %.2f | %.2f |\n", stats.min(), stats.mean(), stats.max()));
    }

    private static String cell(Object value) {
        if (value == null) {
            return "";
        }
        return String.valueOf(value).replace("|", "\\|").replace("\n", " ");
    }

    private static String runStatus(RunRecord run) {
        if (!run.success()) {
            return "failed";
        }
        // Events arrived but the end event did not
        return run.eventCount() > 0 && !run.traceComplete() ? "ok (partial trace)" : "ok";
    }
}
