package com.capitolsync.domain;

/**
 * Origin of an imported record.
 */
public enum DataSource {
    CONGRESS_GOV,
    MANUAL
}
