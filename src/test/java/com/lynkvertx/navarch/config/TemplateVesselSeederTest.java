package com.lynkvertx.navarch.config;

import com.lynkvertx.navarch.dto.VesselDTO;
import com.lynkvertx.navarch.service.TemplateVesselService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TemplateVesselSeederTest {

    @Mock
    private TemplateVesselService templateService;

    @InjectMocks
    private TemplateVesselSeeder seeder;

    @Test
    void seedsMissingTemplatesOnStartup() {
        when(templateService.seedMissingTemplates())
            .thenReturn(Collections.singletonList(VesselDTO.builder().id(1L).build()));

        seeder.run(new DefaultApplicationArguments());

        verify(templateService).seedMissingTemplates();
    }

    @Test
    void failedSeedDoesNotStopStartup() {
        when(templateService.seedMissingTemplates()).thenThrow(new IllegalStateException("database is read-only"));

        assertDoesNotThrow(() -> seeder.run(new DefaultApplicationArguments()));
    }
}
