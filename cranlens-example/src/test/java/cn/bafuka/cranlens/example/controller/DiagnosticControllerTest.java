package cn.bafuka.cranlens.example.controller;

import cn.bafuka.cranlens.engine.impl.LruMemoryCacheEngine;
import cn.bafuka.cranlens.model.CacheOptions;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.Assert.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * DiagnosticController 单元测试
 */
public class DiagnosticControllerTest {

    private LruMemoryCacheEngine cacheEngine;

    private MockMvc mockMvc;

    @Before
    public void setUp() {
        cacheEngine = new LruMemoryCacheEngine(CacheOptions.builder().maxSize(10_000).build());
        mockMvc = MockMvcBuilders.standaloneSetup(new DiagnosticController(cacheEngine)).build();
    }

    @After
    public void tearDown() {
        cacheEngine.destroy();
    }

    @Test
    public void testCacheStats() throws Exception {
        cacheEngine.set("a", "1");
        cacheEngine.get("a");
        cacheEngine.get("b");

        mockMvc.perform(get("/api/diagnostic/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.engine").value("LruMemoryCacheEngine"))
                .andExpect(jsonPath("$.stats.size").value(1))
                .andExpect(jsonPath("$.stats.maxSize").value(10_000))
                .andExpect(jsonPath("$.stats.hitCount").value(1))
                .andExpect(jsonPath("$.stats.missCount").value(1))
                .andExpect(jsonPath("$.stats.hitRate").value(0.5));
    }

    @Test
    public void testClearCache() throws Exception {
        cacheEngine.set("a", "1");
        cacheEngine.set("b", "2");

        mockMvc.perform(delete("/api/diagnostic/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.removed").value(2));

        assertEquals(0, cacheEngine.size());
    }
}
