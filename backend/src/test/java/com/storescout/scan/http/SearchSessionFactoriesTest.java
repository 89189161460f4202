package com.storescout.scan.http;

import com.storescout.config.RetailerProperties;
import com.storescout.config.StoreScoutProperties;
import com.storescout.scan.service.ScanConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchSessionFactoriesTest {
    private final SearchSessionFactories factories = new SearchSessionFactories(new StoreScoutProperties());

    @Test
    void directModeOpensIndependentSessions() {
        SearchSessionFactory factory = factories.forRetailer("cricket", new RetailerProperties());

        JdkSearchSession first = (JdkSearchSession) factory.open();
        JdkSearchSession second = (JdkSearchSession) factory.open();
        first.close();

        assertThat(first.isClosed()).isTrue();
        assertThat(second.isClosed()).isFalse();
        second.close();
    }

    @Test
    void proxiedModeRequiresHostAndPort() {
        RetailerProperties retailer = new RetailerProperties();
        retailer.getProxy().setMode(RetailerProperties.ProxyMode.PROXIED);
        retailer.getProxy().setHost("proxy.example");

        assertThatThrownBy(() -> factories.forRetailer("cricket", retailer))
            .isInstanceOf(ScanConfigurationException.class)
            .hasMessageContaining("proxy host and port");
    }

    @Test
    void proxiedModeWithEndpointBuildsFactory() {
        RetailerProperties retailer = new RetailerProperties();
        retailer.getProxy().setMode(RetailerProperties.ProxyMode.PROXIED);
        retailer.getProxy().setHost("proxy.example");
        retailer.getProxy().setPort(8080);
        retailer.getProxy().setUsername("scout");
        retailer.getProxy().setPassword("secret");

        try (SearchSession session = factories.forRetailer("cricket", retailer).open()) {
            assertThat(session).isInstanceOf(JdkSearchSession.class);
        }
    }

    @Test
    void closedSessionReportsErrorInsteadOfThrowing() {
        JdkSearchSession session = (JdkSearchSession) factories.forRetailer("cricket", new RetailerProperties()).open();
        session.close();

        assertThat(session.get("https://api.example/", Map.of(), Duration.ofSeconds(1)).errorCode())
            .isEqualTo("session_closed");
        try (SearchSession open = factories.forRetailer("cricket", new RetailerProperties()).open()) {
            assertThat(open.get("not a url", Map.of(), Duration.ofSeconds(1)).errorCode()).isEqualTo("invalid_url");
        }
    }
}
