package com.phillippitts.speechmaker.service.resource;

/**
 * How eagerly a resource is resolved.
 */
public enum ResolveMode {
    /** Regular timeouts. */
    NORMAL,
    /** Shorter timeouts for the startup path, so the first screen is not held up. */
    FAST_START
}
