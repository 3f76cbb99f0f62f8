package com.labassist.orchestration.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labassist.config.LabAssistantProperties;
import com.labassist.entity.Incident;
import com.labassist.repository.IncidentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Loads the bundled incident catalog into an empty incident table at startup.
 */
@Component
@ConditionalOnProperty(prefix = "labassist.incidents", name = "seed-on-startup", havingValue = "true", matchIfMissing = true)
@Slf4j
public class IncidentSeeder implements ApplicationRunner {

    private final IncidentRepository incidentRepository;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String seedLocation;

    public IncidentSeeder(IncidentRepository incidentRepository, ResourceLoader resourceLoader,
                          ObjectMapper objectMapper, LabAssistantProperties properties) {
        this.incidentRepository = incidentRepository;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.seedLocation = properties.getIncidents().getSeedLocation();
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (incidentRepository.count() > 0) {
            log.debug("Incident table already populated, skipping seed.");
            return;
        }
        Resource resource = resourceLoader.getResource(seedLocation);
        if (!resource.exists()) {
            log.warn("Incident seed {} not found.", seedLocation);
            return;
        }
        List<IncidentSeed> seeds;
        try (InputStream in = resource.getInputStream()) {
            seeds = objectMapper.readValue(in, new TypeReference<List<IncidentSeed>>() { });
        }
        incidentRepository.saveAll(seeds.stream().map(IncidentSeed::toEntity).toList());
        log.info("Seeded {} incidents from {}.", seeds.size(), seedLocation);
    }

    record IncidentSeed(String id, String title, String description, String resolution, String severity,
                        OffsetDateTime occurredAt) {

        Incident toEntity() {
            return Incident.builder()
                    .id(id)
                    .title(title)
                    .description(description)
                    .resolution(resolution)
                    .severity(severity)
                    .occurredAt(occurredAt)
                    .build();
        }
    }
}
