package com.paxkun.binder.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Tagged logger for the binder service. Lines go to the console and to
 * {@code logs/latest.log} under the work root; the previous log is archived
 * on startup and only the newest {@value #MAX_LOGS} files are kept.
 */
@Slf4j
@Service
public class LoggerService implements InitializingBean, DisposableBean {

    static final String LATEST_LOG = "latest.log";
    static final int MAX_LOGS = 5;
    private static final DateTimeFormatter FILE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    private static final DateTimeFormatter LOG_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Path CONTAINER_FALLBACK = Path.of("/app", "binder");

    private Path workRoot;
    private Path logsPath;
    private BufferedWriter writer;

    @Override
    public void afterPropertiesSet() {
        workRoot = initializeWorkRoot();

        if (workRoot == null) {
            log.warn("⚠️ LoggerService initialized without a writable work root. Console output only.");
            return;
        }

        logsPath = workRoot.resolve("logs");
        try {
            Files.createDirectories(logsPath);
            log.info("📂 Logs directory ready at {}", logsPath.toAbsolutePath());
        } catch (IOException e) {
            log.warn("⚠️ Failed to create logs directory at {}. Console output only.", logsPath.toAbsolutePath(), e);
            logsPath = null;
            return;
        }

        try {
            rotateLogs();
        } catch (IOException e) {
            log.warn("⚠️ Failed to rotate logs at {}. Keeping existing files.", logsPath.toAbsolutePath(), e);
        }

        Path latestLogPath = logsPath.resolve(LATEST_LOG);
        try {
            writer = Files.newBufferedWriter(latestLogPath, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            logSystemEnvironment();
            log.info("📝 LoggerService initialized. Logging to {}", latestLogPath.toAbsolutePath());
        } catch (IOException e) {
            log.warn("⚠️ Failed to open {}. Console output only.", latestLogPath.toAbsolutePath(), e);
            writer = null;
        }
    }

    @Override
    public synchronized void destroy() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("⚠️ Failed to close log writer", e);
        }
        writer = null;
    }

    private Path initializeWorkRoot() {
        Path resolved = tryInitialize(resolveAppDataWorkRoot(),
                "📁 Using APPDATA work root at {}",
                "⚠️ Failed to create APPDATA work root at {}. Falling back to user home.");
        if (resolved != null) {
            return resolved;
        }

        resolved = tryInitialize(resolveUserHomeWorkRoot(),
                "📁 Using user home work root at {}",
                "⚠️ Failed to create user home work root at {}. Falling back to container path.");
        if (resolved != null) {
            return resolved;
        }

        resolved = tryInitialize(resolveContainerFallbackPath(),
                "📁 Using container work root at {}",
                "⚠️ Failed to create container work root at {}.");
        if (resolved != null) {
            return resolved;
        }

        log.warn("⚠️ No writable work root found.");
        return null;
    }

    private Path tryInitialize(Path path, String successMessage, String failureMessage) {
        if (path == null) {
            return null;
        }
        try {
            Path created = createDirectories(path);
            log.info(successMessage, created.toAbsolutePath());
            return created;
        } catch (IOException e) {
            log.warn(failureMessage, path.toAbsolutePath(), e);
            return null;
        }
    }

    protected Path createDirectories(Path path) throws IOException {
        return Files.createDirectories(path);
    }

    protected Path resolveAppDataWorkRoot() {
        String appData = System.getenv("APPDATA");
        if (appData != null && !appData.isBlank()) {
            return Path.of(appData, "Noona", "binder");
        }
        return null;
    }

    protected Path resolveUserHomeWorkRoot() {
        String userHome = System.getProperty("user.home");
        if (userHome != null && !userHome.isBlank()) {
            return Path.of(userHome, ".noona", "binder");
        }
        return Path.of(".noona", "binder");
    }

    protected Path resolveContainerFallbackPath() {
        return CONTAINER_FALLBACK;
    }

    private void rotateLogs() throws IOException {
        Path latestLog = logsPath.resolve(LATEST_LOG);
        if (Files.exists(latestLog) && Files.size(latestLog) > 0) {
            Path archivedLog = logsPath.resolve(LocalDateTime.now().format(FILE_FORMATTER) + ".log");
            Files.move(latestLog, archivedLog, StandardCopyOption.REPLACE_EXISTING);
            log.info("🔄 Rotated log to {}", archivedLog.getFileName());
        }

        try (Stream<Path> files = Files.list(logsPath)) {
            files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .filter(p -> !p.getFileName().toString().equals(LATEST_LOG))
                    .sorted(Comparator.comparingLong(this::getFileModifiedTime).reversed())
                    .skip(MAX_LOGS - 1)
                    .forEach(p -> {
                        try {
                            Files.delete(p);
                            log.info("🗑️ Deleted old log file: {}", p.getFileName());
                        } catch (IOException e) {
                            log.warn("⚠️ Failed to delete old log file: {}", p.getFileName(), e);
                        }
                    });
        }
    }

    private long getFileModifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    private synchronized void write(String level, String tag, String message) {
        String logLine = String.format("%s [%s] [%s] %s%n", LocalDateTime.now().format(LOG_FORMATTER), level, tag, message);
        if (writer != null) {
            try {
                writer.write(logLine);
                writer.flush();
            } catch (IOException e) {
                log.error("❌ Failed to write to log file", e);
                writer = null;
            }
        }
        System.out.print(logLine);
    }

    public void info(String tag, String message) {
        write("INFO", tag, message);
    }

    public void warn(String tag, String message) {
        write("WARN", tag, message);
    }

    public void error(String tag, String message, Throwable throwable) {
        write("ERROR", tag, message + " | Exception: " + throwable.getMessage());
    }

    public void debug(String tag, String message) {
        write("DEBUG", tag, message);
    }

    /**
     * @return writable service directory, or {@code null} in console-only mode
     */
    public Path getWorkRoot() {
        return workRoot;
    }

    public Path getLogsPath() {
        return logsPath;
    }

    private void logSystemEnvironment() {
        write("SYSTEM", "USER", System.getProperty("user.name"));
        write("SYSTEM", "OS", System.getProperty("os.name") + " " + System.getProperty("os.version"));
        write("SYSTEM", "JAVA", System.getProperty("java.version"));
        write("SYSTEM", "WORK_ROOT", workRoot.toAbsolutePath().toString());
    }
}
