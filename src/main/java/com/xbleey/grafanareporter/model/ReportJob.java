package com.xbleey.grafanareporter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.xbleey.grafanareporter.enums.ReportFormat;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A scheduled report definition. The JSON shape is the one stored in the jobs file:
 * dashboard, time range and render options are flattened onto the record.
 */
@Getter
@Setter
@NoArgsConstructor
public class ReportJob {

    private String id;

    @JsonProperty("cron")
    private String cronExpression;

    @JsonUnwrapped
    private DashboardRef dashboardRef = new DashboardRef();

    @JsonProperty("panelId")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Integer panelRef;

    @JsonUnwrapped
    private TimeRange timeRange = new TimeRange();

    @JsonUnwrapped
    private RenderOptions renderOptions = new RenderOptions();

    private String format;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonDeserialize(using = VariablesDeserializer.class)
    private Map<String, List<String>> variables = new LinkedHashMap<>();

    private List<String> recipients = new ArrayList<>();

    private String subject;

    private String body;

    @JsonIgnore
    public boolean isPanelReport() {
        return panelRef != null;
    }

    @JsonIgnore
    public Optional<ReportFormat> reportFormat() {
        return ReportFormat.fromValue(format);
    }

    public void setDashboardRef(DashboardRef dashboardRef) {
        this.dashboardRef = dashboardRef == null ? new DashboardRef() : dashboardRef;
    }

    public void setTimeRange(TimeRange timeRange) {
        this.timeRange = timeRange == null ? new TimeRange() : timeRange;
    }

    public void setRenderOptions(RenderOptions renderOptions) {
        this.renderOptions = renderOptions == null ? new RenderOptions() : renderOptions;
    }

    public void setVariables(Map<String, List<String>> variables) {
        this.variables = variables == null ? new LinkedHashMap<>() : variables;
    }

    public void setRecipients(List<String> recipients) {
        this.recipients = recipients == null ? new ArrayList<>() : recipients;
    }

    /**
     * Deep copy. Stores hand out copies and the scheduler captures one per registration,
     * so edits to a returned job never reach stored or scheduled state.
     */
    public ReportJob copy() {
        ReportJob copy = new ReportJob();
        copy.id = id;
        copy.cronExpression = cronExpression;
        copy.dashboardRef = new DashboardRef(dashboardRef.getUid(), dashboardRef.getSlug());
        copy.panelRef = panelRef;
        copy.timeRange = new TimeRange(timeRange.getFrom(), timeRange.getTo());
        copy.renderOptions = new RenderOptions(
                renderOptions.getWidth(),
                renderOptions.getHeight(),
                renderOptions.getScale()
        );
        copy.format = format;
        Map<String, List<String>> variablesCopy = new LinkedHashMap<>();
        variables.forEach((name, values) -> variablesCopy.put(name,
                values == null ? new ArrayList<>() : new ArrayList<>(values)));
        copy.variables = variablesCopy;
        copy.recipients = new ArrayList<>(recipients);
        copy.subject = subject;
        copy.body = body;
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ReportJob job)) {
            return false;
        }
        return Objects.equals(id, job.id)
                && Objects.equals(cronExpression, job.cronExpression)
                && Objects.equals(dashboardRef, job.dashboardRef)
                && Objects.equals(panelRef, job.panelRef)
                && Objects.equals(timeRange, job.timeRange)
                && Objects.equals(renderOptions, job.renderOptions)
                && Objects.equals(format, job.format)
                && Objects.equals(variables, job.variables)
                && Objects.equals(recipients, job.recipients)
                && Objects.equals(subject, job.subject)
                && Objects.equals(body, job.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, cronExpression, dashboardRef, panelRef, timeRange, renderOptions,
                format, variables, recipients, subject, body);
    }

    @Override
    public String toString() {
        return "ReportJob{id=" + id + ", cron=" + cronExpression + ", dashboard=" + dashboardRef.getUid()
                + ", panel=" + panelRef + ", format=" + format + "}";
    }
}
