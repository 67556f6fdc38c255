package com.pickshot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app")
public class AppConfig {

    /** Base data directory */
    private String dataDir = "./data";

    /** Folder under the data directory holding the ratings database */
    private String storeDirName = "pickshot";

    /** Earlier-generation folder name, adopted when the current one is absent */
    private String legacyStoreDirName = "photo-selector";

    /** Directory where generated renditions are stored */
    private String thumbDir = "./data/thumbnails";

    /** Directory where HEIF sources are re-encoded for decoding */
    private String transcodeDir = "./data/transcoded";

    /** Rendition widths in pixels */
    private int thumbBaseWidth = 320;
    private int thumbRetinaWidth = 480;

    /** Rendition JPEG quality (0..1) */
    private double thumbQuality = 0.80;

    /** Number of thumbnail jobs allowed to run at once */
    private int thumbConcurrency = 2;

    /** External HEIF converter executable (libheif) */
    private String heifConverterCommand = "heif-convert";

    private long heifConverterTimeoutMs = 120_000;

    /** Master switch for mirroring ratings into file metadata */
    private boolean metadataEnabled = true;

    private String exiftoolCommand = "exiftool";

    private long metadataTaskTimeoutMs = 45_000;

    private int metadataTaskRetries = 2;

    /** Non-timeout failures tolerated before metadata sync is switched off */
    private int metadataFailureTolerance = 0;

    private long slowVolumeThresholdMs = 2_000;

    // ───────────── getters / setters ─────────────

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getStoreDirName() {
        return storeDirName;
    }

    public void setStoreDirName(String storeDirName) {
        this.storeDirName = storeDirName;
    }

    public String getLegacyStoreDirName() {
        return legacyStoreDirName;
    }

    public void setLegacyStoreDirName(String legacyStoreDirName) {
        this.legacyStoreDirName = legacyStoreDirName;
    }

    public String getThumbDir() {
        return thumbDir;
    }

    public void setThumbDir(String thumbDir) {
        this.thumbDir = thumbDir;
    }

    public String getTranscodeDir() {
        return transcodeDir;
    }

    public void setTranscodeDir(String transcodeDir) {
        this.transcodeDir = transcodeDir;
    }

    public int getThumbBaseWidth() {
        return thumbBaseWidth;
    }

    public void setThumbBaseWidth(int thumbBaseWidth) {
        this.thumbBaseWidth = thumbBaseWidth;
    }

    public int getThumbRetinaWidth() {
        return thumbRetinaWidth;
    }

    public void setThumbRetinaWidth(int thumbRetinaWidth) {
        this.thumbRetinaWidth = thumbRetinaWidth;
    }

    public double getThumbQuality() {
        return thumbQuality;
    }

    public void setThumbQuality(double thumbQuality) {
        this.thumbQuality = thumbQuality;
    }

    public int getThumbConcurrency() {
        return thumbConcurrency;
    }

    public void setThumbConcurrency(int thumbConcurrency) {
        this.thumbConcurrency = thumbConcurrency;
    }

    public String getHeifConverterCommand() {
        return heifConverterCommand;
    }

    public void setHeifConverterCommand(String heifConverterCommand) {
        this.heifConverterCommand = heifConverterCommand;
    }

    public long getHeifConverterTimeoutMs() {
        return heifConverterTimeoutMs;
    }

    public void setHeifConverterTimeoutMs(long heifConverterTimeoutMs) {
        this.heifConverterTimeoutMs = heifConverterTimeoutMs;
    }

    public boolean isMetadataEnabled() {
        return metadataEnabled;
    }

    public void setMetadataEnabled(boolean metadataEnabled) {
        this.metadataEnabled = metadataEnabled;
    }

    public String getExiftoolCommand() {
        return exiftoolCommand;
    }

    public void setExiftoolCommand(String exiftoolCommand) {
        this.exiftoolCommand = exiftoolCommand;
    }

    public long getMetadataTaskTimeoutMs() {
        return metadataTaskTimeoutMs;
    }

    public void setMetadataTaskTimeoutMs(long metadataTaskTimeoutMs) {
        this.metadataTaskTimeoutMs = metadataTaskTimeoutMs;
    }

    public int getMetadataTaskRetries() {
        return metadataTaskRetries;
    }

    public void setMetadataTaskRetries(int metadataTaskRetries) {
        this.metadataTaskRetries = metadataTaskRetries;
    }

    public int getMetadataFailureTolerance() {
        return metadataFailureTolerance;
    }

    public void setMetadataFailureTolerance(int metadataFailureTolerance) {
        this.metadataFailureTolerance = metadataFailureTolerance;
    }

    public long getSlowVolumeThresholdMs() {
        return slowVolumeThresholdMs;
    }

    public void setSlowVolumeThresholdMs(long slowVolumeThresholdMs) {
        this.slowVolumeThresholdMs = slowVolumeThresholdMs;
    }
}
