package io.sequences.transform;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Base for the pull state machine behind each stage. Subclasses implement {@link #advance()},
 * which either hands exactly one element to {@link #emit(Object)} and returns true, or returns
 * false once the stage is exhausted. {@code null} elements are carried like any other value.
 * <p>
 * {@link #advance()} is only invoked from {@link #hasNext()}, so nothing is pulled from upstream
 * until the downstream consumer asks for it, and a stage that returned false is never asked again.
 */
public abstract class StageIterator<T> implements Iterator<T> {
    private enum State { NOT_READY, READY, DONE }

    private State state = State.NOT_READY;
    private T pending;

    protected abstract boolean advance();

    protected final void emit(T value) {
        this.pending = value;
    }

    @Override
    public final boolean hasNext() {
        if (state == State.READY) return true;
        if (state == State.DONE) return false;
        if (advance()) {
            state = State.READY;
            return true;
        }
        state = State.DONE;
        pending = null;
        return false;
    }

    @Override
    public final T next() {
        if (!hasNext()) throw new NoSuchElementException();
        state = State.NOT_READY;
        T value = pending;
        pending = null;
        return value;
    }
}
