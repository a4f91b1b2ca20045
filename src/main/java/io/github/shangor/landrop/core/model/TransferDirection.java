package io.github.shangor.landrop.core.model;

public enum TransferDirection {
    OUTBOUND,
    INBOUND
}
