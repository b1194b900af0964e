package com.epiccharts.dispatch.api;

import com.epiccharts.core.config.BotProperties;
import com.epiccharts.core.pipeline.MentionPoller;
import com.epiccharts.core.pipeline.MentionProcessor;
import com.epiccharts.core.scheduler.MentionScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BotAdminController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class BotAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MentionScheduler scheduler;

    @MockitoBean
    private MentionPoller poller;

    @MockitoBean
    private MentionProcessor processor;

    @MockitoBean
    private BotProperties properties;

    @Test
    @DisplayName("GET /status reports running flag, cursor and processed count")
    void reportsStatus() throws Exception {
        when(scheduler.isRunning()).thenReturn(true);
        when(poller.getCursor()).thenReturn("1854000000000000001");
        when(processor.processedCount()).thenReturn(3);
        when(properties.getPollIntervalMs()).thenReturn(60000L);

        mockMvc.perform(get("/api/v1/bot/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.cursor").value("1854000000000000001"))
                .andExpect(jsonPath("$.processedCount").value(3))
                .andExpect(jsonPath("$.pollIntervalMs").value(60000));
    }

    @Test
    @DisplayName("POST /processed/clear empties the processed set")
    void clearProcessed() throws Exception {
        when(processor.clearProcessed()).thenReturn(5);

        mockMvc.perform(post("/api/v1/bot/processed/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared").value(5));

        verify(processor).clearProcessed();
    }

    @Test
    @DisplayName("PUT /cursor seeds a forward cursor")
    void seedCursor() throws Exception {
        when(poller.seedCursor("500")).thenReturn(true);
        when(poller.getCursor()).thenReturn("500");

        mockMvc.perform(put("/api/v1/bot/cursor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sinceId\":\"500\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cursor").value("500"));
    }

    @Test
    @DisplayName("PUT /cursor backwards returns 409 with the current cursor")
    void seedCursorBackwards() throws Exception {
        when(poller.seedCursor("10")).thenReturn(false);
        when(poller.getCursor()).thenReturn("500");

        mockMvc.perform(put("/api/v1/bot/cursor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sinceId\":\"10\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.cursor").value("500"));
    }

    @Test
    @DisplayName("PUT /cursor with a non-numeric id returns 400")
    void seedCursorInvalid() throws Exception {
        mockMvc.perform(put("/api/v1/bot/cursor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sinceId\":\"latest\"}"))
                .andExpect(status().isBadRequest());

        verify(poller, never()).seedCursor(anyString());
    }
}
