package com.storescout.scan.service;

import com.storescout.scan.model.StoreRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
public class LoggingStoreSink implements StoreSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingStoreSink.class);

    @Override
    public void accept(String retailer, List<StoreRecord> stores, int count) {
        Map<String, Integer> byType = new TreeMap<>();
        for (StoreRecord store : stores) {
            byType.merge(store.storeType(), 1, Integer::sum);
        }
        log.info("[{}] Handing off {} stores, types={}", retailer, count, byType);
    }
}
