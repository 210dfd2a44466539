package com.phillippitts.speechmaker.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable remedy attached to every error record, for the UI to act on
 * (offer a retry button, switch to WAV, open the folder picker...).
 */
public enum SuggestedAction {
    INSTALL_VOICES("install_voices"),
    SELECT_VOICE("select_voice"),
    RETRY("retry"),
    BROWSE_FILE("browse_file"),
    CHECK_PERMISSIONS("check_permissions"),
    RESTART_APP("restart_app"),
    CONVERT_FILE("convert_file"),
    SPLIT_FILE("split_file"),
    CHECK_CONTENT("check_content"),
    ADD_TEXT("add_text"),
    USE_WAV("use_wav"),
    INSTALL_CONVERTER("install_converter"),
    RETRY_SMALLER("retry_smaller"),
    SELECT_FOLDER("select_folder"),
    NONE("none");

    private final String wireName;

    SuggestedAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
