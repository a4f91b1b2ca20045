package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.TransferTask;

/**
 * Receives every task once it reaches a terminal status.
 */
@FunctionalInterface
public interface TransferHistory {

    TransferHistory NONE = task -> {
    };

    void record(TransferTask task);
}
