package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.config.ReportDefaultsProperties;
import com.xbleey.grafanareporter.config.ReportProperties;
import com.xbleey.grafanareporter.exception.ConfigurationMissingException;
import com.xbleey.grafanareporter.exception.DashboardListingException;
import com.xbleey.grafanareporter.model.ReporterConfig;
import com.xbleey.grafanareporter.support.InMemoryReporterConfigRepository;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrafanaDashboardClientTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private GrafanaDashboardClient client(String apiKey) {
        ReporterConfig config = ReporterConfig.builder()
                .grafanaUrl(server.url("/").toString())
                .grafanaApiKey(apiKey)
                .build();
        ReporterConfigStore configStore = new ReporterConfigStore(
                new InMemoryReporterConfigRepository(config), new ReportDefaultsProperties());
        configStore.reload();
        return new GrafanaDashboardClient(new OkHttpClient(), configStore, new ReportProperties());
    }

    @Test
    void relaysSearchResponse() throws Exception {
        String payload = "[{\"uid\":\"abc123\",\"title\":\"Ops\",\"type\":\"dash-db\"}]";
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody(payload));

        assertThat(client("key").listDashboards()).isEqualTo(payload);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/search?type=dash-db");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer key");
    }

    @Test
    void missingApiKeyIsConfigurationError() {
        assertThatThrownBy(() -> client(null).listDashboards())
                .isInstanceOf(ConfigurationMissingException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void downstreamErrorIsReported() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"message\":\"Invalid API key\"}"));

        assertThatThrownBy(() -> client("bad").listDashboards())
                .isInstanceOf(DashboardListingException.class)
                .hasMessageContaining("401");
    }
}
