package com.capitolsync.domain;

/**
 * Party affiliation. O covers any party without its own code.
 */
public enum Party {
    D,
    R,
    I,
    L,
    G,
    O
}
