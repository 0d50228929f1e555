package io.pipe.cli;

import io.pipe.core.store.NotFoundException;

/** Maps command failures to exit codes: 2 for a missing session, 3 for a bad index, 1 otherwise. */
final class CommandFailures {
    static final int GENERIC = 1;
    static final int NOT_FOUND = 2;
    static final int OUT_OF_RANGE = 3;

    private CommandFailures() {
    }

    static int report(String command, Exception e) {
        System.err.println(command + " failed: " + e.getMessage());
        if (e instanceof NotFoundException) {
            return NOT_FOUND;
        }
        if (e instanceof IndexOutOfBoundsException) {
            return OUT_OF_RANGE;
        }
        return GENERIC;
    }
}
