package com.pickshot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves where the ratings database lives.
 *
 * The current location is {@code <data-dir>/<store-dir-name>/ratings}. When
 * that database does not exist yet but one is found under the
 * earlier-generation folder name, the legacy location is used as-is; no data
 * is copied.
 */
public class RatingStoreLocator {

    private static final Logger log = LoggerFactory.getLogger(RatingStoreLocator.class);

    static final String DB_NAME = "ratings";
    // H2 appends this to the database name
    static final String DB_FILE_SUFFIX = ".mv.db";

    private final Path dataDir;
    private final String storeDirName;
    private final String legacyStoreDirName;

    public RatingStoreLocator(Path dataDir, String storeDirName, String legacyStoreDirName) {
        this.dataDir = dataDir;
        this.storeDirName = storeDirName;
        this.legacyStoreDirName = legacyStoreDirName;
    }

    public static RatingStoreLocator from(AppConfig appConfig) {
        return new RatingStoreLocator(Paths.get(appConfig.getDataDir()),
                appConfig.getStoreDirName(), appConfig.getLegacyStoreDirName());
    }

    /**
     * Returns the database base path (without H2's file suffix).
     */
    public Path resolve() {
        Path current = dataDir.resolve(storeDirName).resolve(DB_NAME);
        Path legacy = dataDir.resolve(legacyStoreDirName).resolve(DB_NAME);
        if (exists(current) || !exists(legacy)) {
            return current.toAbsolutePath().normalize();
        }
        log.info("Using ratings database from legacy location {}", legacy.getParent());
        return legacy.toAbsolutePath().normalize();
    }

    private static boolean exists(Path basePath) {
        return Files.exists(basePath.resolveSibling(basePath.getFileName() + DB_FILE_SUFFIX));
    }
}
