package com.phillippitts.speechmaker.domain;

import java.util.Objects;

/**
 * A synthesis voice offered by the voice engine.
 *
 * @param id engine identifier, e.g. {@code en-US-AriaNeural}
 * @param displayName human readable name, e.g. {@code Aria (en-US)}
 * @param locale BCP-47 style locale derived from the id, e.g. {@code en-US}
 * @param gender engine-reported gender, may be empty
 */
public record Voice(String id, String displayName, String locale, String gender) {
    public Voice {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Voice id must not be blank");
        }
        displayName = displayName == null || displayName.isBlank() ? id : displayName;
        locale = locale == null ? "" : locale;
        gender = gender == null ? "" : gender;
    }
}
