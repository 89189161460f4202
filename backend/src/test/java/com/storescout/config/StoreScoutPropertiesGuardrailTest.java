package com.storescout.config;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoreScoutPropertiesGuardrailTest {

    @Test
    void userAgentsFallBackToBrowserDefault() {
        StoreScoutProperties properties = new StoreScoutProperties();
        properties.setUserAgents(Arrays.asList("  ", null));
        List<String> agents = properties.getUserAgents();
        assertEquals(1, agents.size());
        assertTrue(agents.get(0).startsWith("Mozilla/5.0"));
    }

    @Test
    void retriesWorkersAndIntervalsAreClamped() {
        StoreScoutProperties properties = new StoreScoutProperties();
        properties.setRequestMaxRetries(0);
        properties.setRequestTimeoutSeconds(-3);
        properties.getWorkers().setDirect(0);
        properties.getWorkers().setProxied(-1);
        properties.getProgress().setInterval(0);
        assertEquals(1, properties.getRequestMaxRetries());
        assertEquals(1, properties.getRequestTimeoutSeconds());
        assertEquals(1, properties.getWorkers().getDirect());
        assertEquals(1, properties.getWorkers().getProxied());
        assertEquals(1, properties.getProgress().getInterval());
    }

    @Test
    void waitsAreNeverNegative() {
        StoreScoutProperties properties = new StoreScoutProperties();
        assertEquals(300_000, properties.getBlockedWaitMs());
        properties.setBlockedWaitMs(-5);
        properties.setRateLimitBaseWaitMs(-1);
        assertEquals(0, properties.getBlockedWaitMs());
        assertEquals(0, properties.getRateLimitBaseWaitMs());
    }

    @Test
    void maxRequestDelayNeverBelowMin() {
        StoreScoutProperties properties = new StoreScoutProperties();
        properties.setMinRequestDelayMs(800);
        properties.setMaxRequestDelayMs(100);
        assertEquals(800, properties.getMaxRequestDelayMs());
    }

    @Test
    void retailerDefaultsCoverContinentalUs() {
        RetailerProperties retailer = new RetailerProperties();
        assertEquals(24.5, retailer.getBounds().getLatMin());
        assertEquals(49.4, retailer.getBounds().getLatMax());
        assertEquals(-125.0, retailer.getBounds().getLngMin());
        assertEquals(-66.9, retailer.getBounds().getLngMax());
        assertEquals("US", retailer.getDefaultCountry());
        assertFalse(retailer.getProxy().isProxied());
    }
}
