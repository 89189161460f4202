package com.storescout.scan.service;

public enum ScanPhase {
    IDLE,
    GENERATING,
    SCANNING,
    FINALIZING,
    DONE
}
