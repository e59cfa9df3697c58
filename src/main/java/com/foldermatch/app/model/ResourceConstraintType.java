package com.foldermatch.app.model;

public enum ResourceConstraintType {
    MEMORY,
    DISK_SPACE,
    FILE_HANDLES,
    NETWORK_BANDWIDTH,
    CPU_USAGE
}
