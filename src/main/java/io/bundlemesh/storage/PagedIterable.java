package io.bundlemesh.storage;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Lazy keyset-paged sequence. Each {@link #iterator()} starts from the first
 * page; at most one page is held in memory per iterator.
 */
final class PagedIterable<T> implements Iterable<T> {
    private final int pageSize;
    private final Function<T, List<T>> pageAfter;

    /**
     * @param pageAfter loads the page following the given item, or the first page for {@code null}
     */
    PagedIterable(int pageSize, Function<T, List<T>> pageAfter) {
        this.pageSize = Math.max(1, pageSize);
        this.pageAfter = pageAfter;
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private List<T> page = List.of();
            private int index;
            private T last;
            private boolean exhausted;

            @Override
            public boolean hasNext() {
                if (index < page.size()) {
                    return true;
                }
                if (exhausted) {
                    return false;
                }
                page = pageAfter.apply(last);
                index = 0;
                if (page.size() < pageSize) {
                    exhausted = true;
                }
                return !page.isEmpty();
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                last = page.get(index++);
                return last;
            }
        };
    }
}
