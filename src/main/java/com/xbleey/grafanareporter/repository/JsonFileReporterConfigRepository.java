package com.xbleey.grafanareporter.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.grafanareporter.config.ReportProperties;
import com.xbleey.grafanareporter.exception.PersistenceException;
import com.xbleey.grafanareporter.model.ReporterConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

@Component
public class JsonFileReporterConfigRepository implements ReporterConfigRepository {

    private final ObjectMapper objectMapper;
    private final Path configFile;

    @Autowired
    public JsonFileReporterConfigRepository(ObjectMapper objectMapper, ReportProperties properties) {
        this(objectMapper, properties.getConfigFile());
    }

    public JsonFileReporterConfigRepository(ObjectMapper objectMapper, Path configFile) {
        this.objectMapper = objectMapper;
        this.configFile = configFile;
    }

    @Override
    public Optional<ReporterConfig> load() {
        if (Files.notExists(configFile)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(configFile.toFile(), ReporterConfig.class));
        } catch (IOException ex) {
            throw new PersistenceException("failed to read config file " + configFile, ex);
        }
    }

    @Override
    public void save(ReporterConfig config) {
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(config);
            // holds cleartext secrets
            JsonFiles.writeReplacing(configFile, content, PosixFilePermissions.fromString("rw-------"));
        } catch (IOException ex) {
            throw new PersistenceException("failed to write config file " + configFile, ex);
        }
    }
}
