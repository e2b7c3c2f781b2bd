package com.scriptflow;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: workspace layout, log location, HTTP port.
 */
public class AppConfig {

    private static final String APP_NAME = "ScriptFlow";
    public static final int DEFAULT_PORT = 7070;

    private final Path workspacePath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path workspacePath, Path logPath, int port, boolean devMode) {
        this.workspacePath = workspacePath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getWorkspacePath() {
        return workspacePath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Forest documents, one JSON file per script.
     */
    public static Path scriptsDirectory(Path workspace) {
        return workspace.resolve("scripts");
    }

    /**
     * Node positions and collapsed/selection state, stored apart from the
     * forests.
     */
    public static Path layoutDirectory(Path workspace) {
        return workspace.resolve("layout");
    }

    public static Path templatesFile(Path workspace) {
        return workspace.resolve(".scriptflow").resolve("templates.json");
    }

    /**
     * Default workspace path per operating system.
     * Windows: %USERPROFILE%\Documents\ScriptFlow\workspace
     * macOS: ~/Documents/ScriptFlow/workspace
     * Linux: ~/ScriptFlow/workspace
     */
    public static Path getDefaultWorkspacePath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME, "workspace");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "workspace");
        }
        return Paths.get(userHome, APP_NAME, "workspace");
    }

    /**
     * Log directory per operating system.
     * Windows: %APPDATA%\ScriptFlow\logs
     * macOS: ~/Library/Logs/ScriptFlow
     * Linux: ~/.local/share/ScriptFlow/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        }
        return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("scriptflow.log");
    }

    /**
     * The preferred port when free, otherwise any free port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }

        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }

        // let the server fail later with a clear bind error
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    public static class Builder {
        private Path workspacePath = null;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;

        public Builder workspacePath(String path) {
            if (path != null && !path.isEmpty()) {
                this.workspacePath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        /**
         * Accepts {@code --workspace}, {@code --port} (both as
         * {@code --flag=value} and {@code --flag value}) and {@code --dev}.
         * Unparseable ports keep the default.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--workspace=")) {
                    workspacePath(arg.substring("--workspace=".length()));
                } else if ("--workspace".equals(arg) && i + 1 < args.length) {
                    workspacePath(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    this.preferredPort = parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    this.preferredPort = parsePort(args[++i]);
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        Path resolvedWorkspace() {
            return workspacePath != null ? workspacePath : getDefaultWorkspacePath();
        }

        int preferredPort() {
            return preferredPort;
        }

        boolean devMode() {
            return devMode;
        }

        private int parsePort(String value) {
            try {
                int port = Integer.parseInt(value.trim());
                return port > 0 && port < 65536 ? port : preferredPort;
            } catch (NumberFormatException e) {
                return preferredPort;
            }
        }

        public AppConfig build() throws IOException {
            Path workspace = resolvedWorkspace();
            Files.createDirectories(scriptsDirectory(workspace));
            Files.createDirectories(layoutDirectory(workspace));
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            return new AppConfig(workspace, logPath, port, devMode);
        }
    }
}
