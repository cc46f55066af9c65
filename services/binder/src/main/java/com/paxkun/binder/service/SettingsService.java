package com.paxkun.binder.service;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.paxkun.binder.service.merge.ImageFormat;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Read-only defaults for merge requests.
 * <p>
 * Values come from {@code binder.*} properties. A JSON settings file written
 * by the desktop client ({@code settings.json} under the work root unless
 * {@code binder.settings-file} says otherwise) overrides the output folder,
 * ZIP formats, strict mode and metadata flag when present.
 */
@Service
@RequiredArgsConstructor
public class SettingsService implements InitializingBean {

    static final String SETTINGS_FILE_NAME = "settings.json";

    private final LoggerService logger;
    private final Gson gson = new Gson();

    @Value("${binder.default-formats:jpg}")
    private String defaultFormats;

    @Value("${binder.default-output-dir:}")
    private String defaultOutputDir;

    @Value("${binder.strict-mode:false}")
    private boolean strictMode;

    @Value("${binder.include-comic-info:true}")
    private boolean includeComicInfo;

    @Value("${binder.staging-dir:}")
    private String stagingDir;

    @Value("${binder.settings-file:}")
    private String settingsFile;

    @Value("${binder.progress-batch-size:10}")
    private int progressBatchSize;

    private UserSettings overlay = new UserSettings();
    private Path settingsPath;

    @Override
    public void afterPropertiesSet() {
        settingsPath = resolveSettingsPath();
        if (settingsPath == null || !Files.isRegularFile(settingsPath)) {
            logger.debug("SETTINGS", "No settings file found, using property defaults");
            return;
        }

        try (Reader reader = Files.newBufferedReader(settingsPath, StandardCharsets.UTF_8)) {
            UserSettings loaded = gson.fromJson(reader, UserSettings.class);
            if (loaded != null) {
                overlay = loaded;
            }
            logger.info("SETTINGS", "📄 Loaded settings from " + settingsPath);
        } catch (IOException | JsonParseException e) {
            logger.warn("SETTINGS", "⚠️ Ignoring unreadable settings file " + settingsPath + ": " + e.getMessage());
        }
    }

    private Path resolveSettingsPath() {
        if (settingsFile != null && !settingsFile.isBlank()) {
            return Path.of(settingsFile);
        }
        Path workRoot = logger.getWorkRoot();
        return workRoot != null ? workRoot.resolve(SETTINGS_FILE_NAME) : null;
    }

    /**
     * Formats kept from ZIP sources when a request names none.
     */
    public Set<ImageFormat> getDefaultFormats() {
        if (overlay.zipImageFormats != null && !overlay.zipImageFormats.isEmpty()) {
            return ImageFormat.parse(overlay.zipImageFormats);
        }
        return ImageFormat.parse(defaultFormats);
    }

    public Path getDefaultOutputDir() {
        if (overlay.lastOutputDir != null && !overlay.lastOutputDir.isBlank()) {
            return Path.of(overlay.lastOutputDir);
        }
        if (defaultOutputDir != null && !defaultOutputDir.isBlank()) {
            return Path.of(defaultOutputDir);
        }
        Path workRoot = logger.getWorkRoot();
        if (workRoot != null) {
            return workRoot.resolve("merged");
        }
        return Path.of(System.getProperty("user.home"));
    }

    public boolean isStrictMode() {
        return overlay.strictMode != null ? overlay.strictMode : strictMode;
    }

    public boolean isIncludeComicInfo() {
        return overlay.preserveMetadata != null ? overlay.preserveMetadata : includeComicInfo;
    }

    /**
     * Parent directory for staging areas; the system temp directory is used when unset.
     */
    public Path getStagingRoot() {
        if (stagingDir != null && !stagingDir.isBlank()) {
            return Path.of(stagingDir);
        }
        Path workRoot = logger.getWorkRoot();
        return workRoot != null ? workRoot.resolve("staging") : null;
    }

    public int getProgressBatchSize() {
        return Math.max(1, progressBatchSize);
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    /**
     * Keys the desktop client persists.
     */
    static class UserSettings {

        @SerializedName("last_output_dir")
        String lastOutputDir;

        @SerializedName("zip_image_formats")
        List<String> zipImageFormats;

        @SerializedName("strict_mode")
        Boolean strictMode;

        @SerializedName("preserve_metadata")
        Boolean preserveMetadata;
    }
}
