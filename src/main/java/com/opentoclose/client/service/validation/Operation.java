package com.opentoclose.client.service.validation;

import java.util.Locale;

/**
 * The write operations a resource payload is validated for.
 */
public enum Operation {
    CREATE,
    UPDATE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
