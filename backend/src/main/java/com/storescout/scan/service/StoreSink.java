package com.storescout.scan.service;

import com.storescout.scan.model.StoreRecord;

import java.util.List;

/**
 * Receives the final store list of a scan run.
 */
public interface StoreSink {

    void accept(String retailer, List<StoreRecord> stores, int count);
}
