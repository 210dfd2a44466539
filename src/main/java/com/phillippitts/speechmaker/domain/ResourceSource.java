package com.phillippitts.speechmaker.domain;

/**
 * Where a resolved resource came from.
 */
public enum ResourceSource {
    BUNDLED,
    SYSTEM,
    ENGINE,
    NONE
}
