package com.georep.lookup.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
    "lookup.data.ac-boundaries=classpath:fixtures/missing.geojson",
    "lookup.data.pc-boundaries=classpath:fixtures/missing.geojson",
    "lookup.data.ac-representatives=classpath:fixtures/missing.json",
    "lookup.data.pc-representatives=classpath:fixtures/missing.json"
})
@AutoConfigureMockMvc
class DatasetNotLoadedIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldStillAnswerRoot() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk());
    }

    @Test
    void shouldReportUnavailableHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.detail").exists());
    }

    @Test
    void shouldRejectLookupsUntilDataIsLoaded() throws Exception {
        mockMvc.perform(get("/api/v1/lookup").param("lat", "12.9716").param("lon", "77.5946"))
                .andExpect(status().isServiceUnavailable());
        mockMvc.perform(get("/api/v1/constituencies"))
                .andExpect(status().isServiceUnavailable());
        mockMvc.perform(get("/api/v1/constituencies/geojson/{name}", "Shivajinagar"))
                .andExpect(status().isServiceUnavailable());
    }
}
