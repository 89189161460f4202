package com.storescout.scan.service;

import com.storescout.config.StoreScoutProperties;
import com.storescout.scan.model.ScanRequest;
import com.storescout.scan.model.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ScanCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScanCliRunner.class);

    private final StoreScoutProperties properties;
    private final GridScanService gridScanService;
    private final StoreSink storeSink;
    private final ConfigurableApplicationContext applicationContext;

    public ScanCliRunner(
        StoreScoutProperties properties,
        GridScanService gridScanService,
        StoreSink storeSink,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.gridScanService = gridScanService;
        this.storeSink = storeSink;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        StoreScoutProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        ScanRequest request = new ScanRequest(cli.getLimit(), cli.isTest(), cli.isRefresh());
        ScanResult result = gridScanService.run(cli.getRetailer(), request);
        log.info(
            "Scan {} completed: stores={}, points={}/{}, limitReached={}, invalid={}",
            result.retailer(),
            result.count(),
            result.pointsCompleted(),
            result.gridPoints(),
            result.limitReached(),
            result.validation().invalid()
        );
        storeSink.accept(result.retailer(), result.stores(), result.count());

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
