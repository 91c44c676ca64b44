/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.util;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * @hidden
 * An iterator that defers creating its source, and so any request to the
 * service, until the first call to hasNext() or next().
 *
 * @param <T> the element type
 */
public class LazyIterator<T> implements Iterator<T> {

    private final Supplier<Iterator<T>> source;
    private Iterator<T> delegate;

    public LazyIterator(Supplier<Iterator<T>> source) {
        this.source = source;
    }

    private Iterator<T> delegate() {
        if (delegate == null) {
            delegate = source.get();
        }
        return delegate;
    }

    @Override
    public boolean hasNext() {
        return delegate().hasNext();
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more results");
        }
        return delegate.next();
    }
}
