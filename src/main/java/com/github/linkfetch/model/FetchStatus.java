package com.github.linkfetch.model;

public enum FetchStatus {
    PENDING,
    SUCCEEDED,
    FAILED
}
