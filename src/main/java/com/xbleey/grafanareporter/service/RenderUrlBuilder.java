package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.exception.ConfigurationMissingException;
import com.xbleey.grafanareporter.model.ReportJob;
import okhttp3.HttpUrl;

import java.util.List;
import java.util.Map;

/**
 * Grafana image renderer URLs:
 * {@code /render/d-solo/{uid}/{slug}?panelId=..} for one panel and
 * {@code /render/d/{uid}/{slug}?..&kiosk} for a whole dashboard.
 */
public final class RenderUrlBuilder {

    private RenderUrlBuilder() {
    }

    public static HttpUrl build(String grafanaUrl, ReportJob job) {
        HttpUrl base = grafanaUrl == null ? null : HttpUrl.parse(grafanaUrl.trim());
        if (base == null) {
            throw new ConfigurationMissingException("Grafana URL is not configured or not a valid http(s) URL: "
                    + grafanaUrl);
        }
        HttpUrl.Builder builder = base.newBuilder()
                .addPathSegment("render")
                .addPathSegment(job.isPanelReport() ? "d-solo" : "d")
                .addPathSegment(job.getDashboardRef().getUid())
                .addPathSegment(job.getDashboardRef().getSlug());
        if (job.isPanelReport()) {
            builder.addQueryParameter("panelId", String.valueOf(job.getPanelRef()));
        }
        builder.addQueryParameter("from", job.getTimeRange().getFrom())
                .addQueryParameter("to", job.getTimeRange().getTo())
                .addQueryParameter("width", String.valueOf(job.getRenderOptions().getWidth()))
                .addQueryParameter("height", String.valueOf(job.getRenderOptions().getHeight()))
                .addQueryParameter("scale", String.valueOf(job.getRenderOptions().getScale()));
        if (!job.isPanelReport()) {
            builder.addQueryParameter("kiosk", null);
        }
        builder.addQueryParameter("tz", "UTC");
        for (Map.Entry<String, List<String>> variable : job.getVariables().entrySet()) {
            List<String> values = variable.getValue();
            if (values == null) {
                continue;
            }
            for (String value : values) {
                builder.addQueryParameter("var-" + variable.getKey(), value);
            }
        }
        return builder.build();
    }
}
