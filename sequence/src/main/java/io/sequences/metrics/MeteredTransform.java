package io.sequences.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.sequences.core.PullSequence;
import io.sequences.transform.StageIterator;

import java.util.Iterator;
import java.util.Objects;

/**
 * Pass-through stage that marks a meter per element, times each upstream pull (which includes all
 * work done by the stages above it) and counts traversals that ran to exhaustion.
 */
public class MeteredTransform<T> implements PullSequence<T> {
    private final PullSequence<T> upstream;
    private final Meter rate;
    private final Timer pullTimer;
    private final Counter exhausted;

    public MeteredTransform(PullSequence<T> upstream, Metrics metrics, String stage) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        Objects.requireNonNull(stage, "stage");
        this.rate = metrics.rate(stage);
        this.pullTimer = metrics.pullTimer(stage);
        this.exhausted = metrics.exhausted(stage);
    }

    @Override
    public Iterator<T> iterator() {
        Iterator<T> it = upstream.iterator();
        return new StageIterator<>() {
            @Override
            protected boolean advance() {
                T x;
                Timer.Context ctx = pullTimer.time();
                try {
                    if (!it.hasNext()) {
                        exhausted.inc();
                        return false;
                    }
                    x = it.next();
                } finally {
                    ctx.stop();
                }
                rate.mark();
                emit(x);
                return true;
            }
        };
    }
}
