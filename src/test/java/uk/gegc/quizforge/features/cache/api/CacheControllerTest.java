package uk.gegc.quizforge.features.cache.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.quizforge.features.cache.application.CacheStats;
import uk.gegc.quizforge.features.cache.application.QuestionCacheService;

import java.time.Instant;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CacheController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("CacheController")
class CacheControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QuestionCacheService cacheService;

    @Test
    @DisplayName("GET /api/cache/stats returns the cache statistics")
    void stats() throws Exception {
        when(cacheService.stats()).thenReturn(new CacheStats(12, 30, 2.5,
                Instant.parse("2026-05-01T09:30:00Z"), Instant.parse("2026-04-20T07:00:00Z"),
                1000, 30, true, 18, 12));

        mockMvc.perform(get("/api/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEntries").value(12))
                .andExpect(jsonPath("$.avgAccesses").value(2.5))
                .andExpect(jsonPath("$.lastAccess").value("2026-05-01T09:30:00Z"))
                .andExpect(jsonPath("$.enabled").value(true));
    }

    @Test
    @DisplayName("DELETE /api/cache reports how many entries were removed")
    void clear() throws Exception {
        when(cacheService.clear()).thenReturn(7);

        mockMvc.perform(delete("/api/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(7));
    }
}
