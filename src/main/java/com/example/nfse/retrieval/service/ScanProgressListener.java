package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.model.ScanProgress;

@FunctionalInterface
interface ScanProgressListener {
    void onProgress(ScanProgress progress, String event);
}
