package com.example.clipnotes_backend.controller;

import com.example.clipnotes_backend.dto.insight.InsightSnapshot;
import com.example.clipnotes_backend.dto.insight.SeverityTotals;
import com.example.clipnotes_backend.dto.insight.ShareResponse;
import com.example.clipnotes_backend.service.insight.InsightService;
import com.example.clipnotes_backend.service.insight.InsightWindow;
import com.example.clipnotes_backend.service.insight.InvalidWindowException;
import com.example.clipnotes_backend.service.insight.ShareTokenNotFoundException;
import com.example.clipnotes_backend.service.insight.ShareUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = InsightController.class)
@AutoConfigureMockMvc(addFilters = false)
class InsightControllerTest {

    private static final Instant GENERATED = Instant.parse("2025-11-07T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private InsightService insightService;

    @Test
    void snapshotDefaultsToDayWindowAndSetsCacheHeader() throws Exception {
        when(insightService.getSnapshot("24h")).thenReturn(snapshot(InsightWindow.LAST_24_HOURS));
        when(insightService.cacheTtlSeconds()).thenReturn(60);

        mockMvc.perform(get("/v1/insights"))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "max-age=60, public"))
                .andExpect(jsonPath("$.window").value("24h"))
                .andExpect(jsonPath("$.summarySource").value("fallback"))
                .andExpect(jsonPath("$.severityTotals.high").value(1))
                .andExpect(jsonPath("$.topLabels").isEmpty());
    }

    @Test
    void zeroTtlDisablesClientCaching() throws Exception {
        when(insightService.getSnapshot("7d")).thenReturn(snapshot(InsightWindow.LAST_7_DAYS));
        when(insightService.cacheTtlSeconds()).thenReturn(0);

        mockMvc.perform(get("/v1/insights").param("window", "7d"))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "no-store"))
                .andExpect(jsonPath("$.window").value("7d"));
    }

    @Test
    void invalidWindowIsBadRequest() throws Exception {
        when(insightService.getSnapshot("30d"))
                .thenThrow(new InvalidWindowException("30d", "Unsupported window '30d'. Expected one of: 24h, 7d"));

        mockMvc.perform(get("/v1/insights").param("window", "30d"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("INVALID_WINDOW"))
                .andExpect(jsonPath("$.detail").value("Unsupported window '30d'. Expected one of: 24h, 7d"));
    }

    @Test
    void emptyWindowParameterIsValidatedNotDefaulted() throws Exception {
        when(insightService.getSnapshot("")).thenThrow(new InvalidWindowException("", "Window value is required"));

        mockMvc.perform(get("/v1/insights").param("window", ""))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("INVALID_WINDOW"));

        verify(insightService).getSnapshot("");
        verify(insightService, never()).getSnapshot("24h");
    }

    @Test
    void regenerateReadsWindowFromBody() throws Exception {
        when(insightService.regenerateSnapshot("7d")).thenReturn(snapshot(InsightWindow.LAST_7_DAYS));
        when(insightService.cacheTtlSeconds()).thenReturn(60);

        mockMvc.perform(post("/v1/insights/regenerate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"window\":\"7d\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.window").value("7d"));

        verify(insightService).regenerateSnapshot("7d");
    }

    @Test
    void regenerateWithoutBodyUsesDayWindow() throws Exception {
        when(insightService.regenerateSnapshot("24h")).thenReturn(snapshot(InsightWindow.LAST_24_HOURS));

        mockMvc.perform(post("/v1/insights/regenerate"))
                .andExpect(status().isOk());

        verify(insightService).regenerateSnapshot("24h");
    }

    @Test
    void shareReturnsTokenAndUrl() throws Exception {
        when(insightService.createShare("24h")).thenReturn(new ShareResponse("abc123",
                "https://clipnotes.example.com/share/abc123", InsightWindow.LAST_24_HOURS, GENERATED, GENERATED.plusSeconds(60)));

        mockMvc.perform(post("/v1/insights/share")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").value("abc123"))
                .andExpect(jsonPath("$.url").value("https://clipnotes.example.com/share/abc123"))
                .andExpect(jsonPath("$.window").value("24h"));
    }

    @Test
    void shareUnavailableIsServiceUnavailable() throws Exception {
        when(insightService.createShare("24h")).thenThrow(new ShareUnavailableException("Insight sharing is not configured"));

        mockMvc.perform(post("/v1/insights/share"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.title").value("SHARE_UNAVAILABLE"));
    }

    @Test
    void sharedSnapshotPassesOptionalWindow() throws Exception {
        when(insightService.getSharedSnapshot("tok", null)).thenReturn(snapshot(InsightWindow.LAST_24_HOURS));
        when(insightService.cacheTtlSeconds()).thenReturn(60);

        mockMvc.perform(get("/v1/insights/share/{token}", "tok"))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "max-age=60, public"));

        verify(insightService).getSharedSnapshot("tok", null);
    }

    @Test
    void unknownShareTokenIsNotFound() throws Exception {
        when(insightService.getSharedSnapshot("missing", null)).thenThrow(new ShareTokenNotFoundException());

        mockMvc.perform(get("/v1/insights/share/{token}", "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("SHARE_NOT_FOUND"));
    }

    @Test
    void mismatchedShareWindowIsBadRequest() throws Exception {
        when(insightService.getSharedSnapshot("tok", "7d"))
                .thenThrow(new InvalidWindowException("7d", "Requested window does not match share token"));

        mockMvc.perform(get("/v1/insights/share/{token}", "tok").param("window", "7d"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Requested window does not match share token"));
    }

    @Test
    void unexpectedFailureIsInternalError() throws Exception {
        when(insightService.getSharedSnapshot("tok", null)).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/v1/insights/share/{token}", "tok"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.title").value("INTERNAL_ERROR"));
    }

    private static InsightSnapshot snapshot(InsightWindow window) {
        return new InsightSnapshot(window, GENERATED, "1 notable moments were recorded over " + window.phrase() + ".",
                InsightSnapshot.SOURCE_FALLBACK, new SeverityTotals(0, 0, 1), List.of(), List.of(), null,
                GENERATED.plusSeconds(60));
    }
}
