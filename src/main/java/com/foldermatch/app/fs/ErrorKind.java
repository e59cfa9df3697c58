package com.foldermatch.app.fs;

public enum ErrorKind {
    ACCESS_DENIED,
    NOT_FOUND,
    LOCKED,
    PATH_TOO_LONG,
    NETWORK_UNREACHABLE,
    RESOURCE_CONSTRAINED,
    CANCELLED,
    UNKNOWN
}
