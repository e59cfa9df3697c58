package com.foldermatch.app.model;

public enum RecoveryActionType {
    SKIP,
    RETRY,
    RETRY_WITH_ELEVATION,
    REDUCE_PARALLELISM,
    PAUSE_AND_WAIT,
    ABORT
}
