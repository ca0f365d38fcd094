package com.xbleey.grafanareporter.service;

import java.util.List;

public record EmailEnvelope(String from, List<String> recipients, String subject, String body) {
}
