package com.georep.lookup.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
    "lookup.data.ac-boundaries=classpath:fixtures/ac_boundaries.geojson",
    "lookup.data.pc-boundaries=classpath:fixtures/pc_boundaries.geojson",
    "lookup.data.ac-representatives=classpath:fixtures/ac_data.json",
    "lookup.data.pc-representatives=classpath:fixtures/pc_data.json",
    "lookup.cors.allowed-origins=http://localhost:[*]"
})
@AutoConfigureMockMvc
class CorsIntegrationTest {

    private static final String FRONTEND = "http://localhost:5500";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldAllowLookupFromFrontendOrigin() throws Exception {
        mockMvc.perform(get("/api/v1/lookup")
                        .param("lat", "12.9716").param("lon", "77.5946")
                        .header(HttpHeaders.ORIGIN, FRONTEND))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, FRONTEND))
                .andExpect(jsonPath("$.mla.name").value("Rizwan Arshad"));
    }

    @Test
    void shouldAllowHealthFromFrontendOrigin() throws Exception {
        mockMvc.perform(get("/health").header(HttpHeaders.ORIGIN, FRONTEND))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, FRONTEND));
    }

    @Test
    void shouldAnswerPreflightForGet() throws Exception {
        mockMvc.perform(options("/api/v1/lookup")
                        .header(HttpHeaders.ORIGIN, FRONTEND)
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, FRONTEND))
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, containsString("GET")));
    }

    @Test
    void shouldRejectPreflightForCacheClear() throws Exception {
        mockMvc.perform(options("/api/v1/cache/clear")
                        .header(HttpHeaders.ORIGIN, FRONTEND)
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
                .andExpect(status().isForbidden());
    }

    @Test
    void shouldRejectUnlistedOrigin() throws Exception {
        mockMvc.perform(get("/api/v1/lookup")
                        .param("lat", "12.9716").param("lon", "77.5946")
                        .header(HttpHeaders.ORIGIN, "https://elsewhere.example"))
                .andExpect(status().isForbidden())
                .andExpect(header().doesNotExist(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN));
    }
}
