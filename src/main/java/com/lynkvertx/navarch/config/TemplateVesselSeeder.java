package com.lynkvertx.navarch.config;

import com.lynkvertx.navarch.dto.VesselDTO;
import com.lynkvertx.navarch.service.TemplateVesselService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeds the template vessels at startup when {@code navarch.templates.seed-on-startup} is true.
 * A failed seed is logged and does not stop the application.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "navarch.templates", name = "seed-on-startup", havingValue = "true")
public class TemplateVesselSeeder implements ApplicationRunner {

    private final TemplateVesselService templateService;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Seeding template vessels...");
        try {
            List<VesselDTO> created = templateService.seedMissingTemplates();
            log.info("Seeded {} template vessel(s)", created.size());
        } catch (RuntimeException e) {
            log.error("Failed to seed template vessels", e);
        }
    }
}
