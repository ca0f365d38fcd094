package com.xbleey.grafanareporter.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.grafanareporter.config.ReportProperties;
import com.xbleey.grafanareporter.exception.PersistenceException;
import com.xbleey.grafanareporter.model.ReportJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Component
public class JsonFileReportJobRepository implements ReportJobRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileReportJobRepository.class);
    private static final TypeReference<List<ReportJob>> JOB_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path jobsFile;

    @Autowired
    public JsonFileReportJobRepository(ObjectMapper objectMapper, ReportProperties properties) {
        this(objectMapper, properties.getJobsFile());
    }

    public JsonFileReportJobRepository(ObjectMapper objectMapper, Path jobsFile) {
        this.objectMapper = objectMapper;
        this.jobsFile = jobsFile;
    }

    @Override
    public List<ReportJob> loadAll() {
        try {
            if (Files.notExists(jobsFile)) {
                JsonFiles.writeReplacing(jobsFile, "[]".getBytes(StandardCharsets.UTF_8),
                        PosixFilePermissions.fromString("rw-r--r--"));
                log.info("Created empty jobs file {}", jobsFile);
                return new ArrayList<>();
            }
            List<ReportJob> jobs = objectMapper.readValue(jobsFile.toFile(), JOB_LIST);
            return jobs == null ? new ArrayList<>() : jobs;
        } catch (IOException ex) {
            throw new PersistenceException("failed to read jobs file " + jobsFile, ex);
        }
    }

    @Override
    public void saveAll(Collection<ReportJob> jobs) {
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter()
                    .forType(JOB_LIST)
                    .writeValueAsBytes(new ArrayList<>(jobs));
            JsonFiles.writeReplacing(jobsFile, content, PosixFilePermissions.fromString("rw-r--r--"));
        } catch (IOException ex) {
            throw new PersistenceException("failed to write jobs file " + jobsFile, ex);
        }
    }
}
