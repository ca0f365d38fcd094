package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.config.ReportProperties;
import com.xbleey.grafanareporter.exception.ConfigurationMissingException;
import com.xbleey.grafanareporter.exception.DashboardListingException;
import com.xbleey.grafanareporter.model.ReporterConfig;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Passthrough to Grafana's dashboard search, used by the job editor to pick a dashboard.
 */
@Service
public class GrafanaDashboardClient {

    private final OkHttpClient httpClient;
    private final ReporterConfigStore configStore;

    public GrafanaDashboardClient(OkHttpClient okHttpClient, ReporterConfigStore configStore,
                                  ReportProperties properties) {
        this.httpClient = okHttpClient.newBuilder()
                .callTimeout(properties.getDashboardsTimeout())
                .build();
        this.configStore = configStore;
    }

    public String listDashboards() {
        ReporterConfig config = configStore.current();
        String grafanaUrl = config.getGrafanaUrl();
        if (grafanaUrl == null || grafanaUrl.isBlank()) {
            throw new ConfigurationMissingException("Grafana URL not configured");
        }
        String apiKey = config.getGrafanaApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationMissingException("Grafana API key not configured");
        }
        HttpUrl base = HttpUrl.parse(grafanaUrl.trim());
        if (base == null) {
            throw new ConfigurationMissingException("Grafana URL is not a valid http(s) URL: " + grafanaUrl);
        }
        HttpUrl url = base.newBuilder()
                .addPathSegments("api/search")
                .addQueryParameter("type", "dash-db")
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + apiKey)
                .header("Accept", "application/json")
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new DashboardListingException(
                        "Grafana API returned status " + response.code() + ": " + payload);
            }
            return payload;
        } catch (IOException ex) {
            throw new DashboardListingException("Failed to fetch dashboards: " + ex.getMessage(), ex);
        }
    }
}
