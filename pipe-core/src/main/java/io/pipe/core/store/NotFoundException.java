package io.pipe.core.store;

import java.io.IOException;

public final class NotFoundException extends IOException {
    public NotFoundException(String message) {
        super(message);
    }
}
