package com.example.tieredcache.remote;

public enum RemoteState {
    /** No endpoint configured, the remote tier is permanently skipped. */
    UNCONFIGURED,
    CONNECTING,
    CONNECTED,
    /** The probe failed; this instance never retries. */
    UNAVAILABLE
}
