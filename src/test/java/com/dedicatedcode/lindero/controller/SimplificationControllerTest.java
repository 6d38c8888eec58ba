package com.dedicatedcode.lindero.controller;

import com.dedicatedcode.lindero.config.LinderoConfiguration;
import com.dedicatedcode.lindero.service.FeatureCollectionProcessor;
import com.dedicatedcode.lindero.service.GeoJsonGeometryMapper;
import com.dedicatedcode.lindero.service.GeometrySimplificationService;
import com.dedicatedcode.lindero.service.SimplificationJob;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SimplificationController.class)
@Import({FeatureCollectionProcessor.class, GeometrySimplificationService.class, GeoJsonGeometryMapper.class,
        LinderoConfiguration.class, SimplificationJob.class})
class SimplificationControllerTest {

    private static final String COLLECTION = """
            {"type": "FeatureCollection", "features": [
              {"type": "Feature",
               "properties": {"DPTOMPIO": "05001", "MPIO_CNMBR": "Medellin", "SHAPE_LEN": 0.88},
               "geometry": {"type": "Polygon", "coordinates": [[[0, 0], [0, 5.001], [0, 10], [10, 10], [10, 0], [0, 0]]]}}
            ]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testSimplify() throws Exception {
        mockMvc.perform(post("/api/v1/simplify").contentType(MediaType.APPLICATION_JSON).content(COLLECTION))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Feature-Count", "1"))
                .andExpect(header().string("X-Coordinates-Before", "6"))
                .andExpect(header().string("X-Coordinates-After", "5"))
                .andExpect(header().string("X-Skipped-Features", "0"))
                .andExpect(jsonPath("$.type").value("FeatureCollection"))
                .andExpect(jsonPath("$.features[0].properties.id").value("05001"))
                .andExpect(jsonPath("$.features[0].properties.label").value("Medellin"))
                .andExpect(jsonPath("$.features[0].properties.SHAPE_LEN").doesNotExist())
                .andExpect(jsonPath("$.features[0].geometry.coordinates[0]", hasSize(5)));
    }

    @Test
    void testSimplifyWithSmallTolerance() throws Exception {
        mockMvc.perform(post("/api/v1/simplify").param("tolerance", "0.0001").param("precision", "4")
                                .contentType(MediaType.APPLICATION_JSON).content(COLLECTION.replace("[0, 5.001]", "[0.001, 5]")))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Coordinates-After", "6"))
                .andExpect(jsonPath("$.features[0].geometry.coordinates[0][1][0]").value(0.001));
    }

    @Test
    void testInvalidGeometryRejected() throws Exception {
        String lineString = COLLECTION.replace("\"Polygon\"", "\"LineString\"");

        mockMvc.perform(post("/api/v1/simplify").contentType(MediaType.APPLICATION_JSON).content(lineString))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Feature Processing Failed"))
                .andExpect(jsonPath("$.path").value("/api/v1/simplify"));
    }

    @Test
    void testNegativeToleranceRejected() throws Exception {
        mockMvc.perform(post("/api/v1/simplify").param("tolerance", "-1")
                                .contentType(MediaType.APPLICATION_JSON).content(COLLECTION))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Parameter"));
    }

    @Test
    void testUnreadableBody() throws Exception {
        mockMvc.perform(post("/api/v1/simplify").contentType(MediaType.APPLICATION_JSON).content("{\"type\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unreadable Request Body"));
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.tolerance").value(0.008))
                .andExpect(jsonPath("$.precision").value(3))
                .andExpect(jsonPath("$.errorPolicy").value("STRICT"));
    }
}
