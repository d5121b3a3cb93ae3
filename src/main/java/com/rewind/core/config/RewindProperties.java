package com.rewind.core.config;

import com.rewind.core.model.CheckpointStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "rewind")
public class RewindProperties {

    private Storage storage = new Storage();
    private Checkpoint checkpoint = new Checkpoint();
    private String sessionsDir = Path.of(System.getProperty("user.home"), ".claude", "projects").toString();

    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public Checkpoint getCheckpoint() { return checkpoint; }
    public void setCheckpoint(Checkpoint checkpoint) { this.checkpoint = checkpoint; }
    public String getSessionsDir() { return sessionsDir; }
    public void setSessionsDir(String sessionsDir) { this.sessionsDir = sessionsDir; }

    public static class Storage {
        /** "filesystem" or "jdbc". */
        private String type = "filesystem";
        private String root = Path.of(System.getProperty("user.home"), ".rewind", "checkpoints").toString();
        private Jdbc jdbc = new Jdbc();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public Jdbc getJdbc() { return jdbc; }
        public void setJdbc(Jdbc jdbc) { this.jdbc = jdbc; }
    }

    public static class Jdbc {
        private String url = "";
        private String username = "";
        private String password = "";
        private int maximumPoolSize = 4;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public int getMaximumPoolSize() { return maximumPoolSize; }
        public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    }

    public static class Checkpoint {
        private boolean autoCheckpointEnabled = false;
        private CheckpointStrategy defaultStrategy = CheckpointStrategy.MANUAL;
        private long maxFileSizeBytes = 10L * 1024 * 1024;
        /** Directories skipped in addition to the scanner's built-in list. */
        private List<String> ignoreDirs = new ArrayList<>();
        private Restore restore = new Restore();
        private Smart smart = new Smart();

        public boolean isAutoCheckpointEnabled() { return autoCheckpointEnabled; }
        public void setAutoCheckpointEnabled(boolean autoCheckpointEnabled) { this.autoCheckpointEnabled = autoCheckpointEnabled; }
        public CheckpointStrategy getDefaultStrategy() { return defaultStrategy; }
        public void setDefaultStrategy(CheckpointStrategy defaultStrategy) { this.defaultStrategy = defaultStrategy; }
        public long getMaxFileSizeBytes() { return maxFileSizeBytes; }
        public void setMaxFileSizeBytes(long maxFileSizeBytes) { this.maxFileSizeBytes = maxFileSizeBytes; }
        public List<String> getIgnoreDirs() { return ignoreDirs; }
        public void setIgnoreDirs(List<String> ignoreDirs) { this.ignoreDirs = ignoreDirs; }
        public Restore getRestore() { return restore; }
        public void setRestore(Restore restore) { this.restore = restore; }
        public Smart getSmart() { return smart; }
        public void setSmart(Smart smart) { this.smart = smart; }
    }

    public static class Restore {
        /**
         * When true, a restore also deletes working-tree files the target checkpoint did not
         * capture. Ignored directories are never touched.
         */
        private boolean deleteUntrackedFiles = false;

        public boolean isDeleteUntrackedFiles() { return deleteUntrackedFiles; }
        public void setDeleteUntrackedFiles(boolean deleteUntrackedFiles) { this.deleteUntrackedFiles = deleteUntrackedFiles; }
    }

    public static class Smart {
        private int messageThreshold = 20;
        private int fileThreshold = 5;
        private Duration elapsedThreshold = Duration.ofMinutes(10);

        public int getMessageThreshold() { return messageThreshold; }
        public void setMessageThreshold(int messageThreshold) { this.messageThreshold = messageThreshold; }
        public int getFileThreshold() { return fileThreshold; }
        public void setFileThreshold(int fileThreshold) { this.fileThreshold = fileThreshold; }
        public Duration getElapsedThreshold() { return elapsedThreshold; }
        public void setElapsedThreshold(Duration elapsedThreshold) { this.elapsedThreshold = elapsedThreshold; }
    }
}
