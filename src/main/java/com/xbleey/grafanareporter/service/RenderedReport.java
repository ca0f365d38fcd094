package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.enums.ReportFormat;

/**
 * Raw render output. The MIME type used downstream always comes from {@code format}.
 */
public record RenderedReport(byte[] content, ReportFormat format) {
}
