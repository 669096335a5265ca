package com.aegis.governance.model;

/** Kind of downstream a governed service relies on. */
public enum DependencyType {
    DATABASE,
    CACHE,
    MESSAGE_QUEUE,
    EXTERNAL_API,
    INTERNAL_SERVICE,
    STORAGE,
    CDN,
    AUTH_PROVIDER
}
