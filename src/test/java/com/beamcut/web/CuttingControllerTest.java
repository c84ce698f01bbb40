package com.beamcut.web;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.beamcut.engine.GeneticCuttingOptimizer;
import com.beamcut.engine.ResultReporter;
import com.beamcut.service.CuttingReportRepository;
import com.beamcut.service.CuttingService;
import com.beamcut.service.CuttingStatistics;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CuttingController.class)
@Import({CuttingService.class, GeneticCuttingOptimizer.class, ResultReporter.class, CuttingStatistics.class,
        CuttingReportRepository.class})
class CuttingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void returnsReportWithTemplateFieldNames() throws Exception {
        String body = """
                {
                  "raw_length": 100,
                  "parts": [
                    {"length": 50, "quantity": 2},
                    {"length": 30, "quantity": 1},
                    {"length": 20, "quantity": 1}
                  ],
                  "params": {"random_seed": 7, "max_generations": 30}
                }
                """;

        mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.raw_length").value(100.0))
                .andExpect(jsonPath("$.beam_count").value(2))
                .andExpect(jsonPath("$.genotype_waste").value(50.0))
                .andExpect(jsonPath("$.all_elements_length").value(150.0))
                .andExpect(jsonPath("$.surowca_utilization").value(75.0))
                .andExpect(jsonPath("$.unique_element_lengths_and_count_dict['50']").value(2))
                .andExpect(jsonPath("$.patterns.length()").value(2))
                .andExpect(jsonPath("$.patterns[0].cuts").isArray())
                .andExpect(jsonPath("$.pattern_usages").isArray())
                .andExpect(jsonPath("$.random_seed").value(7))
                .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    void infeasiblePartIsUnprocessable() throws Exception {
        String body = """
                {"raw_length": 10, "parts": [{"length": 11, "quantity": 1}]}
                """;

        mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INFEASIBLE_PART"))
                .andExpect(jsonPath("$.message").value("Part length 11 exceeds raw stock length 10"));
    }

    @Test
    void emptyPartListIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"raw_length\": 10, \"parts\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test
    void missingRawLengthIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"parts\": [{\"length\": 5, \"quantity\": 1}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("raw_length is required"));
    }

    @Test
    void fractionalQuantityIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"raw_length\": 10, \"parts\": [{\"length\": 5, \"quantity\": 2.5}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test
    void invalidParamsAreBadRequest() throws Exception {
        String body = """
                {"raw_length": 10, "parts": [{"length": 5, "quantity": 1}], "params": {"mutation_probability": 2}}
                """;

        mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test
    @DirtiesContext(methodMode = DirtiesContext.MethodMode.BEFORE_METHOD)
    void statsCountServedRequests() throws Exception {
        mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"raw_length\": 10, \"parts\": [{\"length\": 5, \"quantity\": 2}], \"profile\": \"QUICK\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/cutting/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_requests").value(1))
                .andExpect(jsonPath("$.completed_runs").value(1))
                .andExpect(jsonPath("$.total_beams").value(1));
    }

    @Test
    void quantityOverflowIsBadRequest() throws Exception {
        String body = """
                {"raw_length": 100, "parts": [{"length": 1, "quantity": 2147483647}, {"length": 1, "quantity": 1}]}
                """;

        mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.message").value(containsString("100000")));
    }

    @Test
    void singleHugeQuantityIsBadRequest() throws Exception {
        String body = """
                {"raw_length": 100, "parts": [{"length": 1, "quantity": 2147483646}]}
                """;

        mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test
    void lowerBoundStopCanBeSwitchedOff() throws Exception {
        String body = """
                {
                  "raw_length": 10,
                  "parts": [{"length": 5, "quantity": 2}],
                  "params": {"stop_at_lower_bound": false, "verify_genotypes": true,
                             "max_generations": 5, "stall_limit": 0, "random_seed": 1}
                }
                """;

        mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stop_reason").value("MAX_GENERATIONS"))
                .andExpect(jsonPath("$.generations").value(5));
    }

    @Test
    void fractionalLengthsKeepTheirFractionInHistogram() throws Exception {
        mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"raw_length\": 100, \"parts\": [{\"length\": 12.5, \"quantity\": 2}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unique_element_lengths_and_count_dict['12.5']").value(2));
    }

    @Test
    void storedReportIsServedById() throws Exception {
        String response = mockMvc.perform(post("/api/v1/cutting").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"raw_length\": 10, \"parts\": [{\"length\": 4, \"quantity\": 3}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.request_id").isNumber())
                .andReturn().getResponse().getContentAsString();
        long id = JsonPath.parse(response).read("$.request_id", Long.class);

        mockMvc.perform(get("/api/v1/cutting/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.request_id").value((int) id))
                .andExpect(jsonPath("$.beam_count").value(2))
                .andExpect(jsonPath("$.all_elements_length").value(12.0));
    }

    @Test
    void unknownReportIdIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/cutting/{id}", 987654))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("REPORT_NOT_FOUND"));
    }
}
