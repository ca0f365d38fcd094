package com.xbleey.grafanareporter.controller;

import com.xbleey.grafanareporter.model.ReportJob;
import com.xbleey.grafanareporter.service.ExecutionAcknowledgement;
import com.xbleey.grafanareporter.service.ReportJobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/jobs")
public class ReportJobController {

    private final ReportJobService jobService;

    public ReportJobController(ReportJobService jobService) {
        this.jobService = jobService;
    }

    @GetMapping
    public List<ReportJob> listJobs() {
        return jobService.list();
    }

    @PostMapping
    public ResponseEntity<ReportJob> createJob(@RequestBody ReportJob job) {
        return ResponseEntity.status(HttpStatus.CREATED).body(jobService.create(job));
    }

    @GetMapping("/{id}")
    public ReportJob getJob(@PathVariable("id") String id) {
        return jobService.get(id);
    }

    @PutMapping("/{id}")
    public ReportJob updateJob(@PathVariable("id") String id, @RequestBody ReportJob job) {
        return jobService.update(id, job);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteJob(@PathVariable("id") String id) {
        jobService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/execute")
    public ResponseEntity<Map<String, Object>> executeJob(@PathVariable("id") String id) {
        ExecutionAcknowledgement acknowledgement = jobService.execute(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", acknowledgement.message());
        body.put("jobId", acknowledgement.jobId());
        body.put("submittedAt", acknowledgement.submittedAt().toString());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }
}
