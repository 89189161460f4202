package com.storescout.scan.api;

import com.storescout.config.StoreScoutProperties;
import com.storescout.scan.cache.ScanCaches;
import com.storescout.scan.cache.TtlCache;
import com.storescout.scan.model.CacheMetadata;
import com.storescout.scan.model.ScanRequest;
import com.storescout.scan.model.ScanResult;
import com.storescout.scan.service.GridScanService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class ScanController {
    private final GridScanService gridScanService;
    private final ScanCaches caches;
    private final StoreScoutProperties properties;

    public ScanController(GridScanService gridScanService, ScanCaches caches, StoreScoutProperties properties) {
        this.gridScanService = gridScanService;
        this.caches = caches;
        this.properties = properties;
    }

    @GetMapping("/retailers")
    public List<String> retailers() {
        return properties.getRetailers().keySet().stream().sorted().toList();
    }

    @PostMapping("/scans/{retailer}")
    public ScanResult scan(
        @PathVariable("retailer") String retailer,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "test", required = false, defaultValue = "false") boolean test,
        @RequestParam(name = "refresh", required = false, defaultValue = "false") boolean refresh
    ) {
        return gridScanService.run(retailer, new ScanRequest(limit, test, refresh));
    }

    @GetMapping("/cache/{retailer}/{flavor}")
    public ResponseEntity<CacheMetadata> cacheMetadata(
        @PathVariable("retailer") String retailer,
        @PathVariable("flavor") String flavor
    ) {
        String name = knownRetailer(retailer);
        return ResponseEntity.of(cacheFor(name, flavor).metadata(name));
    }

    @DeleteMapping("/cache/{retailer}/{flavor}")
    public ResponseEntity<Void> clearCache(
        @PathVariable("retailer") String retailer,
        @PathVariable("flavor") String flavor
    ) {
        String name = knownRetailer(retailer);
        cacheFor(name, flavor).clear(name);
        return ResponseEntity.noContent().build();
    }

    private String knownRetailer(String retailer) {
        gridScanService.retailerConfig(retailer);
        return retailer.trim().toLowerCase(Locale.ROOT);
    }

    private TtlCache<?> cacheFor(String retailer, String flavor) {
        return switch (flavor.toLowerCase(Locale.ROOT)) {
            case "urls" -> caches.urlLists(retailer);
            case "rich_urls" -> caches.richUrlLists(retailer);
            default -> throw new ResponseStatusException(BAD_REQUEST, "Unknown cache flavor: " + flavor);
        };
    }
}
