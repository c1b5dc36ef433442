package info.isaksson.erland.hackoutline.ast;

/** Whether a function or method is async and/or a generator. */
public enum FunKind {
    SYNC,
    ASYNC,
    GENERATOR,
    ASYNC_GENERATOR;

    public static FunKind of(boolean isAsync, boolean isGenerator) {
        if (isAsync) return isGenerator ? ASYNC_GENERATOR : ASYNC;
        return isGenerator ? GENERATOR : SYNC;
    }

    public boolean isAsync() {
        return this == ASYNC || this == ASYNC_GENERATOR;
    }
}
