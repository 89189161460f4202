package com.storescout.scan.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storescout.config.RetailerProperties;
import com.storescout.config.StoreScoutProperties;
import com.storescout.scan.http.SearchSession;
import com.storescout.scan.http.SearchSessionFactories;
import com.storescout.scan.http.SearchSessionFactory;
import com.storescout.scan.model.GridPoint;
import com.storescout.scan.model.HttpFetchResult;
import com.storescout.scan.model.ScanRequest;
import com.storescout.scan.model.ScanResult;
import com.storescout.scan.model.StoreRecord;
import com.storescout.scan.normalize.StoreNormalizer;
import com.storescout.scan.search.PointFetcher;
import com.storescout.scan.validation.StoreValidator;
import com.storescout.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GridScanServiceTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    private StoreScoutProperties properties;
    private RetailerProperties cricket;
    private PointFetcher pointFetcher;
    private SearchSessionFactories sessionFactories;
    private GridScanService service;
    private CountingSessions sessions;

    @BeforeEach
    void setUp() {
        properties = new StoreScoutProperties();
        properties.getProgress().setInterval(1);

        cricket = TestFixtures.cricket();
        // 3 latitude rows x 2 longitude columns
        cricket.getBounds().setLatMin(40.0);
        cricket.getBounds().setLatMax(41.0);
        cricket.getBounds().setLngMin(-100.0);
        cricket.getBounds().setLngMax(-99.0);
        cricket.setGridSpacingMiles(34.5);
        properties.getRetailers().put("cricket", cricket);

        pointFetcher = Mockito.mock(PointFetcher.class);
        sessionFactories = Mockito.mock(SearchSessionFactories.class);
        sessions = new CountingSessions();
        when(sessionFactories.forRetailer(anyString(), any())).thenReturn(sessions);

        service = new GridScanService(
            properties,
            pointFetcher,
            new StoreNormalizer(Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC)),
            new StoreValidator(properties),
            sessionFactories
        );
    }

    @Test
    void overlappingPointsAreDeduplicatedByStoreId() {
        when(pointFetcher.fetch(any(), any(), anyString(), any(), anyBoolean()))
            .thenAnswer(invocation -> List.of(store("A-1")));

        ScanResult result = service.run("cricket", ScanRequest.defaults());

        assertThat(result.gridPoints()).isEqualTo(6);
        assertThat(result.pointsCompleted()).isEqualTo(6);
        assertThat(result.count()).isEqualTo(1);
        assertThat(result.stores()).extracting(StoreRecord::storeId).containsExactly("A-1");
        assertThat(result.limitReached()).isFalse();
        assertThat(result.checkpointsUsed()).isFalse();
        assertThat(result.validation().total()).isEqualTo(1);
        assertThat(result.validation().valid()).isEqualTo(1);
    }

    @Test
    void distinctStoresFromEveryPointAreKept() {
        when(pointFetcher.fetch(any(), any(), anyString(), any(), anyBoolean()))
            .thenAnswer(invocation -> {
                GridPoint point = invocation.getArgument(1);
                return List.of(store("P-" + point.latitude() + "-" + point.longitude()), store("SHARED"));
            });

        ScanResult result = service.run("cricket", ScanRequest.defaults());

        assertThat(result.count()).isEqualTo(7);
        assertThat(result.stores()).extracting(StoreRecord::storeId).doesNotHaveDuplicates();
    }

    @Test
    void limitCapsResultAndFlagsIt() {
        when(pointFetcher.fetch(any(), any(), anyString(), any(), anyBoolean()))
            .thenAnswer(invocation -> {
                GridPoint point = invocation.getArgument(1);
                String prefix = point.latitude() + "/" + point.longitude();
                return List.of(store(prefix + "-a"), store(prefix + "-b"));
            });

        ScanResult result = service.run("cricket", new ScanRequest(3, false, false));

        assertThat(result.count()).isEqualTo(3);
        assertThat(result.stores()).hasSize(3);
        assertThat(result.limitReached()).isTrue();
        assertThat(result.pointsCompleted()).isLessThanOrEqualTo(result.gridPoints());
        assertThat(result.validation().total()).isEqualTo(3);
    }

    @Test
    void reachingLimitCancelsQueuedPoints() {
        RetailerProperties us = TestFixtures.cricket();
        us.setParallelWorkers(1);
        AtomicInteger fetchCalls = new AtomicInteger();
        when(pointFetcher.fetch(any(), any(), anyString(), any(), anyBoolean()))
            .thenAnswer(invocation -> {
                fetchCalls.incrementAndGet();
                Thread.sleep(20);
                GridPoint point = invocation.getArgument(1);
                return List.of(store("S-" + point));
            });

        ScanResult result = service.scan("cricket", us, new ScanRequest(1, true, false), sessions);

        assertThat(result.gridPoints()).isEqualTo(144);
        assertThat(result.count()).isEqualTo(1);
        assertThat(result.limitReached()).isTrue();
        assertThat(result.pointsCompleted()).isEqualTo(1);
        assertThat(fetchCalls.get()).isLessThanOrEqualTo(10);
    }

    @Test
    void nonPositiveLimitMeansUnlimited() {
        when(pointFetcher.fetch(any(), any(), anyString(), any(), anyBoolean()))
            .thenAnswer(invocation -> {
                GridPoint point = invocation.getArgument(1);
                return List.of(store("S-" + point));
            });

        ScanResult result = service.run("cricket", new ScanRequest(0, false, false));

        assertThat(result.count()).isEqualTo(6);
        assertThat(result.limitReached()).isFalse();
    }

    @Test
    void failingPointDoesNotStopTheScan() {
        when(pointFetcher.fetch(any(), any(), anyString(), any(), anyBoolean()))
            .thenAnswer(invocation -> {
                GridPoint point = invocation.getArgument(1);
                if (point.latitude() == 40.5) {
                    throw new IllegalStateException("boom");
                }
                return List.of(store("S-" + point));
            });

        ScanResult result = service.run("cricket", ScanRequest.defaults());

        assertThat(result.pointsCompleted()).isEqualTo(6);
        assertThat(result.count()).isEqualTo(4);
    }

    @Test
    void unreadableRecordsAreSkippedIndividually() {
        when(pointFetcher.fetch(any(), any(), anyString(), any(), anyBoolean()))
            .thenAnswer(invocation -> List.of(objectMapper.readTree("{\"data\":{\"id\":\"BAD\",\"hours\":[1]}}"), store("OK-1")));

        ScanResult result = service.run("cricket", ScanRequest.defaults());

        assertThat(result.stores()).extracting(StoreRecord::storeId).containsExactly("OK-1");
    }

    @Test
    void everySessionIsClosed() {
        when(pointFetcher.fetch(any(), any(), anyString(), any(), anyBoolean())).thenReturn(List.of());

        ScanResult result = service.run("cricket", ScanRequest.defaults());

        assertThat(result.count()).isZero();
        assertThat(result.validation().total()).isZero();
        assertThat(sessions.opened.get()).isEqualTo(6);
        assertThat(sessions.closed.get()).isEqualTo(6);
    }

    @Test
    void testModeUsesWideSpacingOverDefaultBounds() {
        RetailerProperties us = TestFixtures.cricket();
        when(pointFetcher.fetch(any(), any(), anyString(), any(), anyBoolean())).thenReturn(List.of());

        ScanResult result = service.scan("cricket", us, new ScanRequest(null, true, false), sessions);

        assertThat(result.gridPoints()).isEqualTo(144);
        verify(pointFetcher, times(144)).fetch(any(), any(), eq("cricket"), eq(us), eq(false));
    }

    @Test
    void refreshFlagReachesFetcher() {
        when(pointFetcher.fetch(any(), any(), anyString(), any(), anyBoolean())).thenReturn(List.of());

        service.run("cricket", new ScanRequest(null, false, true));

        verify(pointFetcher, times(6)).fetch(any(), any(), eq("cricket"), any(), eq(true));
    }

    @Test
    void invalidSpacingFailsBeforeAnyFetch() {
        cricket.setGridSpacingMiles(0);

        assertThatThrownBy(() -> service.run("cricket", ScanRequest.defaults()))
            .isInstanceOf(ScanConfigurationException.class);
        verify(pointFetcher, never()).fetch(any(), any(), anyString(), any(), anyBoolean());
    }

    @Test
    void invalidRadiusFailsBeforeAnyFetch() {
        cricket.setSearchRadiusMiles(-1);

        assertThatThrownBy(() -> service.run("cricket", ScanRequest.defaults()))
            .isInstanceOf(ScanConfigurationException.class);
        verify(pointFetcher, never()).fetch(any(), any(), anyString(), any(), anyBoolean());
    }

    @Test
    void blankBaseUrlFailsBeforeAnyFetch() {
        cricket.getApi().setBaseUrl(" ");

        assertThatThrownBy(() -> service.run("cricket", ScanRequest.defaults()))
            .isInstanceOf(ScanConfigurationException.class)
            .hasMessageContaining("base URL");
        verify(pointFetcher, never()).fetch(any(), any(), anyString(), any(), anyBoolean());
        assertThat(sessions.opened.get()).isZero();
    }

    @Test
    void blankApiKeyFailsBeforeAnyFetch() {
        cricket.getApi().setApiKey("");

        assertThatThrownBy(() -> service.run("cricket", ScanRequest.defaults()))
            .isInstanceOf(ScanConfigurationException.class)
            .hasMessageContaining("API key");
        verify(pointFetcher, never()).fetch(any(), any(), anyString(), any(), anyBoolean());
        assertThat(sessions.opened.get()).isZero();
    }

    @Test
    void unknownRetailerIsRejected() {
        assertThatThrownBy(() -> service.run("sprint", ScanRequest.defaults()))
            .isInstanceOf(UnknownRetailerException.class)
            .hasMessageContaining("sprint");
    }

    @Test
    void workerCountFollowsProxyModeUnlessOverridden() {
        RetailerProperties retailer = new RetailerProperties();
        assertThat(service.resolveWorkerCount(retailer)).isEqualTo(4);

        retailer.getProxy().setMode(RetailerProperties.ProxyMode.PROXIED);
        assertThat(service.resolveWorkerCount(retailer)).isEqualTo(10);

        retailer.setParallelWorkers(2);
        assertThat(service.resolveWorkerCount(retailer)).isEqualTo(2);
    }

    private JsonNode store(String id) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("id", id);
        data.put("name", "Store " + id);
        data.put("mainPhone", "+15555550100");
        data.put("websiteUrl", "https://stores.example/" + id);
        ObjectNode address = data.putObject("address");
        address.put("line1", "1 Main St");
        address.put("city", "Town");
        address.put("region", "KS");
        address.put("postalCode", "67000");
        ObjectNode coordinate = data.putObject("geocodedCoordinate");
        coordinate.put("latitude", 40.2);
        coordinate.put("longitude", -99.5);
        ObjectNode wrapper = objectMapper.createObjectNode();
        wrapper.set("data", data);
        return wrapper;
    }

    private static final class CountingSessions implements SearchSessionFactory {
        private final AtomicInteger opened = new AtomicInteger();
        private final AtomicInteger closed = new AtomicInteger();

        @Override
        public SearchSession open() {
            opened.incrementAndGet();
            return new SearchSession() {
                @Override
                public HttpFetchResult get(String url, Map<String, String> headers, Duration timeout) {
                    throw new UnsupportedOperationException("fetcher is mocked");
                }

                @Override
                public void close() {
                    closed.incrementAndGet();
                }
            };
        }
    }
}
