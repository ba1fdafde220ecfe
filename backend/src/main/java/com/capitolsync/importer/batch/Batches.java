package com.capitolsync.importer.batch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Groups an iterator into consecutive fixed-size lists; the last list may be shorter.
 * Elements are pulled from the source only as each batch is requested.
 */
final class Batches<T> implements Iterator<List<T>> {

    private final Iterator<T> source;
    private final int size;

    private Batches(Iterator<T> source, int size) {
        this.source = source;
        this.size = size;
    }

    static <T> Batches<T> of(Iterator<T> source, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("batch size must be positive: " + size);
        }
        return new Batches<>(source, size);
    }

    @Override
    public boolean hasNext() {
        return source.hasNext();
    }

    @Override
    public List<T> next() {
        if (!source.hasNext()) {
            throw new NoSuchElementException();
        }
        List<T> batch = new ArrayList<>(size);
        while (batch.size() < size && source.hasNext()) {
            batch.add(source.next());
        }
        return batch;
    }
}
