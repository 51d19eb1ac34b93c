package org.mides.pooling.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mides.pooling.model.GraspResult;
import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.statistics.PoolingStatistics;
import org.mides.pooling.service.IGraspService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
public class PoolingControllerTest {

    private static final String TRIPS = "\"trips\": ["
        + "{\"pickup_time\": \"08:00:00\","
        + " \"pickup\": {\"latitude\": 40.7500, \"longitude\": -73.9900},"
        + " \"dropoff\": {\"latitude\": 40.7700, \"longitude\": -73.9800},"
        + " \"fare\": 12.5},"
        + "{\"pickup_time\": 28860,"
        + " \"pickup\": {\"latitude\": 40.7501, \"longitude\": -73.9900},"
        + " \"dropoff\": {\"latitude\": 40.7700, \"longitude\": -73.9800}}"
        + "]";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IGraspService graspService;

    @BeforeEach
    void setUp() {
        when(graspService.defaultParameters()).thenReturn(PoolingParameters.defaults());
    }

    private static GraspResult emptyResult(int requestCount) {
        var statistics = PoolingStatistics.builder()
            .initialObjectives(List.of())
            .eliteHistory(List.of())
            .requests(List.of())
            .build();
        return GraspResult.empty(requestCount, statistics);
    }

    @Test
    void contextLoads() {
    }

    @Test
    void solve_validProblem_shouldReturnResult() throws Exception {
        // Arrange
        when(graspService.solve(anyList(), any(PoolingParameters.class))).thenReturn(emptyResult(2));

        // Act
        var mvcResult = mockMvc.perform(post("/pooling/v1/solve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{" + TRIPS + "}"))
            .andExpect(request().asyncStarted())
            .andReturn();

        // Assert
        mockMvc.perform(asyncDispatch(mvcResult))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.request_count").value(2))
            .andExpect(jsonPath("$.has_solution").value(false))
            .andExpect(jsonPath("$.all_served").value(false));

        verify(graspService).solve(
            argThat(requests -> requests.size() == 2
                && requests.get(0).getId() == 1
                && requests.get(0).getDirectFare() == 12.5),
            any(PoolingParameters.class));
    }

    @Test
    void solve_customParameters_shouldBePassedToSolver() throws Exception {
        when(graspService.solve(anyList(), any(PoolingParameters.class))).thenReturn(emptyResult(2));

        var mvcResult = mockMvc.perform(post("/pooling/v1/solve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{" + TRIPS + ", \"parameters\": {\"alpha\": 1.8, \"capacity\": 3, \"insertion_method\": \"IB\"}}"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(mvcResult)).andExpect(status().isOk());

        verify(graspService).solve(anyList(), argThat(parameters -> parameters.getAlpha() == 1.8
            && parameters.getCapacity() == 3
            && parameters.getBeta() == PoolingParameters.DEFAULT_BETA));
    }

    @Test
    void solve_noTrips_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/pooling/v1/solve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"trips\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));

        verify(graspService, never()).solve(anyList(), any(PoolingParameters.class));
    }

    @Test
    void solve_invalidParameters_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/pooling/v1/solve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{" + TRIPS + ", \"parameters\": {\"alpha\": 0.9}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400))
            .andExpect(jsonPath("$.message").value(containsString("alpha")));
    }
}
