package com.capitolsync.domain;

public enum Chamber {
    HOUSE,
    SENATE
}
