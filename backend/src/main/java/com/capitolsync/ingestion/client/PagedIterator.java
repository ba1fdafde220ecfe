package com.capitolsync.ingestion.client;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.IntFunction;

/**
 * Iterates a limit/offset paginated resource, fetching the next page only when the current one is drained.
 * Iteration ends when a page reports no next page. A page whose items were all filtered out does not end it.
 */
class PagedIterator<T> implements Iterator<T> {

    private final IntFunction<Page<T>> pageFetcher;
    private final int pageSize;

    private Iterator<T> current = Collections.emptyIterator();
    private int nextOffset;
    private boolean exhausted;

    PagedIterator(IntFunction<Page<T>> pageFetcher, int pageSize) {
        this.pageFetcher = pageFetcher;
        this.pageSize = pageSize;
    }

    @Override
    public boolean hasNext() {
        while (!current.hasNext()) {
            if (exhausted) {
                return false;
            }
            Page<T> page = pageFetcher.apply(nextOffset);
            if (!page.hasNext()) {
                exhausted = true;
            }
            nextOffset += pageSize;
            current = page.items().iterator();
        }
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }
}
