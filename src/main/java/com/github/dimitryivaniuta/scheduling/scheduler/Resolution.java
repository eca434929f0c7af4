package com.github.dimitryivaniuta.scheduling.scheduler;

/** Which polling loop scans an entry. */
public enum Resolution {
    FINE,
    COARSE
}
