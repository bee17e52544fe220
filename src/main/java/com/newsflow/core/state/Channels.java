package com.newsflow.core.state;

import java.util.List;
import java.util.function.Supplier;

/**
 * Factory methods for declaring state schemas.
 */
public final class Channels {

    private Channels() {}

    public static Channel overwrite() {
        return new Channel(Channel.Discipline.OVERWRITE, null);
    }

    public static Channel overwrite(Supplier<?> defaultValue) {
        return new Channel(Channel.Discipline.OVERWRITE, defaultValue);
    }

    public static Channel append() {
        return new Channel(Channel.Discipline.APPEND, List::of);
    }
}
