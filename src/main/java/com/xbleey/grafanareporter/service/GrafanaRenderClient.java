package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.config.ReportProperties;
import com.xbleey.grafanareporter.enums.ReportFormat;
import com.xbleey.grafanareporter.exception.RenderException;
import com.xbleey.grafanareporter.model.ReportJob;
import com.xbleey.grafanareporter.model.ReporterConfig;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Service
public class GrafanaRenderClient {

    private static final Logger log = LoggerFactory.getLogger(GrafanaRenderClient.class);
    private static final int MAX_ERROR_BODY_LENGTH = 2048;

    private final OkHttpClient httpClient;
    private final ReporterConfigStore configStore;

    public GrafanaRenderClient(OkHttpClient okHttpClient, ReporterConfigStore configStore, ReportProperties properties) {
        this.httpClient = okHttpClient.newBuilder()
                .callTimeout(properties.getRenderTimeout())
                .readTimeout(properties.getRenderTimeout())
                .build();
        this.configStore = configStore;
    }

    /**
     * Fetches the rendered snapshot for {@code job}. One request, no retry.
     */
    public RenderedReport render(ReportJob job) {
        ReporterConfig config = configStore.current();
        ReportFormat format = job.reportFormat().orElse(ReportFormat.PNG);
        HttpUrl url = RenderUrlBuilder.build(config.getGrafanaUrl(), job);
        Request.Builder request = new Request.Builder().url(url).get();
        String apiKey = config.getGrafanaApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }
        log.debug("Rendering report job={} url={} format={}", job.getId(), url, format.getValue());
        try (Response response = httpClient.newCall(request.build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                String detail = body == null ? "" : truncate(body.string());
                throw new RenderException(response.code(), detail);
            }
            if (body == null) {
                throw new RenderException(response.code(), "empty body");
            }
            byte[] content = body.bytes();
            log.debug("Rendered job={} bytes={} contentType={}", job.getId(), content.length, body.contentType());
            return new RenderedReport(content, format);
        } catch (IOException ex) {
            throw new RenderException("render request to " + url.host() + " failed: " + ex.getMessage(), ex);
        }
    }

    private static String truncate(String value) {
        if (value.length() <= MAX_ERROR_BODY_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }
}
