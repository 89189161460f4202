package com.storescout.scan.http;

import com.storescout.config.RetailerProperties;
import com.storescout.config.StoreScoutProperties;
import com.storescout.scan.service.ScanConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Builds the per-retailer session factory. Proxy misconfiguration is a setup failure and is
 * raised here, before any grid point is dispatched.
 */
@Component
public class SearchSessionFactories {
    private static final Logger log = LoggerFactory.getLogger(SearchSessionFactories.class);

    private final StoreScoutProperties properties;

    public SearchSessionFactories(StoreScoutProperties properties) {
        this.properties = properties;
    }

    public SearchSessionFactory forRetailer(String retailer, RetailerProperties retailerProperties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1);

        RetailerProperties.Proxy proxy = retailerProperties.getProxy();
        if (proxy != null && proxy.isProxied()) {
            if (proxy.getHost() == null || proxy.getHost().isBlank() || proxy.getPort() == null || proxy.getPort() <= 0) {
                throw new ScanConfigurationException("Proxy mode for " + retailer + " requires proxy host and port");
            }
            builder.proxy(ProxySelector.of(new InetSocketAddress(proxy.getHost().trim(), proxy.getPort())));
            if (proxy.getUsername() != null && !proxy.getUsername().isBlank()) {
                builder.authenticator(proxyAuthenticator(proxy.getUsername(), proxy.getPassword()));
            }
            log.info("[{}] Sessions routed through proxy {}:{}", retailer, proxy.getHost(), proxy.getPort());
        }
        HttpClient client = builder.build();
        return () -> new JdkSearchSession(client);
    }

    private Authenticator proxyAuthenticator(String username, String password) {
        char[] secret = password == null ? new char[0] : password.toCharArray();
        return new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                if (getRequestorType() != RequestorType.PROXY) {
                    return null;
                }
                return new PasswordAuthentication(username, secret);
            }
        };
    }
}
