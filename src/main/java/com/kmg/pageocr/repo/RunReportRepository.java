package com.kmg.pageocr.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.pageocr.model.ArtifactLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.Map;

@Repository
public class RunReportRepository {
    private static final Logger log = LoggerFactory.getLogger(RunReportRepository.class);

    private final ObjectMapper objectMapper;

    public RunReportRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(ArtifactLayout layout, Map<String, Object> report) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(layout.runReportPath().toFile(), report);
        } catch (IOException e) {
            log.warn("Failed to write run report {}: {}", layout.runReportPath(), e.getMessage());
        }
    }
}
