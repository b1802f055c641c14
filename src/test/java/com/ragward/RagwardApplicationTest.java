package com.ragward;

import com.ragward.cache.ResponseCacheStore;
import com.ragward.provider.AbstractWebClientProvider;
import com.ragward.service.QueryDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Context wiring with the default (in-memory, Azure OpenAI) configuration.
 */
@SpringBootTest(properties = {
        "ragward.provider.endpoint=https://example.openai.azure.com",
        "ragward.provider.api-key=test-key"
})
class RagwardApplicationTest {

    @Autowired
    private QueryDispatcher dispatcher;

    @Autowired
    private ResponseCacheStore cacheStore;

    @Autowired
    private AbstractWebClientProvider provider;

    @Test
    void testContextLoads() {
        assertNotNull(dispatcher);
        assertEquals("memory", cacheStore.getName());
        assertEquals("azure-openai", provider.getName());
    }
}
