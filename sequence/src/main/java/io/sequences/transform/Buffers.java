package io.sequences.transform;

import java.util.ArrayList;
import java.util.List;

final class Buffers {
    private Buffers() {}

    static <T> List<T> drain(Iterable<T> upstream) {
        List<T> out = new ArrayList<>();
        for (T x : upstream) out.add(x);
        return out;
    }
}
