package io.pipe.core.store;

/** What {@link AtomicJsonStore} does when the file on disk is not valid JSON. */
public enum CorruptPolicy {
    /** Substitute the caller's default document. */
    USE_DEFAULT,
    /** Raise {@link CorruptDataException}. */
    FAIL
}
