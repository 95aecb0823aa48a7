package com.gt.practice.composer;

public enum CompositionOrder {
    // Sorted by item id, then shuffled with the supplied random source
    Shuffled,
    // Sorted by item id only
    Stable
}
