package com.xbleey.grafanareporter.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dashboard identity. {@code slug} is the readable fragment of the dashboard URI and
 * travels with {@code uid}; both are persisted flat on the job record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DashboardRef {

    @JsonProperty("dashboardUid")
    private String uid;

    @JsonProperty("slug")
    private String slug;
}
