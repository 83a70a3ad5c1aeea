package com.lynkvertx.navarch.controller;

import com.lynkvertx.navarch.dto.HullGeometryDTO;
import com.lynkvertx.navarch.dto.HullProjectionsDTO;
import com.lynkvertx.navarch.dto.HullProjectionsDTO.ButtockCurve;
import com.lynkvertx.navarch.dto.HullProjectionsDTO.ProfilePoint;
import com.lynkvertx.navarch.dto.ValidationResultDTO;
import com.lynkvertx.navarch.dto.ValidationResultDTO.ValidationError;
import com.lynkvertx.navarch.exception.GeometryIncompleteException;
import com.lynkvertx.navarch.exception.ValidationFailedException;
import com.lynkvertx.navarch.service.HullGeometryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = HullGeometryController.class,
    excludeAutoConfiguration = {
        DataSourceAutoConfiguration.class,
        JpaRepositoriesAutoConfiguration.class,
        HibernateJpaAutoConfiguration.class
    })
class HullGeometryControllerTest {

    private static final String GEOMETRY = "{"
        + "\"stations\": [{\"index\": 0, \"x\": 0}, {\"index\": 1, \"x\": 0}],"
        + "\"waterlines\": [{\"index\": 0, \"z\": 0}, {\"index\": 1, \"z\": 5}],"
        + "\"offsets\": [{\"stationIndex\": 0, \"waterlineIndex\": 0, \"halfBreadth\": 3}]}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HullGeometryService geometryService;

    @Test
    void rejectedGeometryListsErrorsByRowAndColumn() throws Exception {
        given(geometryService.replaceGeometry(eq(1L), any(HullGeometryDTO.class)))
            .willThrow(new ValidationFailedException("Hull geometry of vessel 1", invalid()));

        mockMvc.perform(put("/api/vessels/1/geometry")
                .contentType(MediaType.APPLICATION_JSON)
                .content(GEOMETRY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400))
            .andExpect(jsonPath("$.message").value("Hull geometry of vessel 1: 2 error(s)"))
            .andExpect(jsonPath("$.data.valid").value(false))
            .andExpect(jsonPath("$.data.errors[0].field").value("stations"))
            .andExpect(jsonPath("$.data.errors[0].row").value(1))
            .andExpect(jsonPath("$.data.errors[0].column").doesNotExist())
            .andExpect(jsonPath("$.data.errors[1].row").value(1))
            .andExpect(jsonPath("$.data.errors[1].column").value(0));
    }

    @Test
    void validateReturnsFindingsWithOk() throws Exception {
        given(geometryService.validateGeometry(eq(1L), any(HullGeometryDTO.class))).willReturn(invalid());

        mockMvc.perform(post("/api/vessels/1/geometry/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(GEOMETRY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Hull geometry has errors"))
            .andExpect(jsonPath("$.data.errors.length()").value(2));
    }

    @Test
    void projectionsPassButtockCount() throws Exception {
        HullProjectionsDTO projections = HullProjectionsDTO.builder()
            .vesselId(1L)
            .buttocks(Collections.singletonList(new ButtockCurve(0, new BigDecimal("4"),
                Collections.singletonList(new ProfilePoint(new BigDecimal("50"), new BigDecimal("4"))))))
            .build();
        given(geometryService.getProjections(1L, 1)).willReturn(projections);

        mockMvc.perform(get("/api/vessels/1/geometry/projections").param("buttocks", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.buttocks[0].y").value(4))
            .andExpect(jsonPath("$.data.buttocks[0].points[0].x").value(50))
            .andExpect(jsonPath("$.data.waterlines.length()").value(0));
    }

    @Test
    void projectionsWithoutGeometryAreRejected() throws Exception {
        given(geometryService.getProjections(eq(2L), isNull()))
            .willThrow(new GeometryIncompleteException("Vessel 2 has no hull geometry"));

        mockMvc.perform(get("/api/vessels/2/geometry/projections"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Vessel 2 has no hull geometry"));
    }

    private static ValidationResultDTO invalid() {
        return ValidationResultDTO.builder()
            .valid(false)
            .errors(Arrays.asList(
                new ValidationError("stations", "Station x must increase with index: 0 at index 0, 0 at index 1", 1, null),
                new ValidationError("offsets", "Half-breadth must be non-negative at station 1, waterline 0, found -1",
                    1, 0)))
            .build();
    }
}
