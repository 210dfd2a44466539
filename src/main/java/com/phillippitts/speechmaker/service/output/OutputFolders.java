package com.phillippitts.speechmaker.service.output;

import com.phillippitts.speechmaker.config.properties.ConversionProperties;
import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.SpeechMakerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Resolves and prepares output and scratch folders.
 */
@Component
public class OutputFolders {

    private static final Logger LOG = LogManager.getLogger(OutputFolders.class);

    static final String APP_FOLDER = "SpeechMaker";

    private final ConversionProperties properties;
    private final String userHome;
    private final String tempDir;

    @Autowired
    public OutputFolders(ConversionProperties properties) {
        this(properties, System.getProperty("user.home"), System.getProperty("java.io.tmpdir"));
    }

    OutputFolders(ConversionProperties properties, String userHome, String tempDir) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.userHome = userHome;
        this.tempDir = tempDir;
    }

    /**
     * {@code conversion.default-output-path}, else {@code <user.home>/Documents/SpeechMaker};
     * null when neither is known.
     */
    public Path defaultFolder() {
        String configured = properties.getDefaultOutputPath();
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured.trim());
        }
        if (userHome == null || userHome.isBlank()) {
            return null;
        }
        return Paths.get(userHome, "Documents", APP_FOLDER);
    }

    /** Root for per-session chunk directories. */
    public Path workRoot() {
        String configured = properties.getWorkDir();
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured.trim());
        }
        return Paths.get(tempDir, "speechmaker");
    }

    /**
     * Creates the folder if needed and checks it is writable.
     *
     * @throws SpeechMakerException with {@code OUTPUT_PATH} otherwise
     */
    public Path ensure(Path folder) {
        Objects.requireNonNull(folder, "folder");
        try {
            Files.createDirectories(folder);
        } catch (IOException e) {
            throw new SpeechMakerException("Output path cannot be created: " + folder, ErrorCodes.OUTPUT_PATH, e);
        }
        if (!Files.isWritable(folder)) {
            throw new SpeechMakerException("Output path is not writable: " + folder, ErrorCodes.OUTPUT_PATH);
        }
        LOG.debug("Output folder ready: {}", folder);
        return folder;
    }
}
