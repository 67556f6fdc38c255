package com.pickshot;

import com.pickshot.service.RatingStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

import java.io.File;
import java.sql.SQLException;

@SpringBootApplication
@EnableAsync
public class PickShotApplication {

    private static final Logger log = LoggerFactory.getLogger(PickShotApplication.class);

    static final int EXIT_STORE_UNAVAILABLE = 2;

    public static void main(String[] args) {
        // Ensure required data directories exist before Spring context loads
        ensureDirectories();
        try {
            SpringApplication.run(PickShotApplication.class, args);
        } catch (RuntimeException e) {
            Throwable storeFailure = findStoreFailure(e);
            if (storeFailure == null) {
                throw e;
            }
            log.error("==========================================================");
            log.error("  The ratings database could not be opened.");
            log.error("  {}", storeFailure.getMessage());
            log.error("  Check that the data directory is writable and not in use");
            log.error("  by another PickShot instance, then start again.");
            log.error("==========================================================");
            System.exit(EXIT_STORE_UNAVAILABLE);
            return;
        }
        log.info("==========================================================");
        log.info("  PickShot is running at http://localhost:8080");
        log.info("  POST a directory to /api/photos/open to get started.");
        log.info("==========================================================");
    }

    /**
     * Walks the cause chain of a failed startup looking for a ratings store
     * failure.
     */
    static Throwable findStoreFailure(Throwable error) {
        Throwable sqlFailure = null;
        Throwable current = error;
        for (int depth = 0; current != null && depth < 20; depth++) {
            if (current instanceof RatingStoreUnavailableException) {
                return current;
            }
            if (sqlFailure == null && current instanceof SQLException) {
                sqlFailure = current;
            }
            current = current.getCause();
        }
        return sqlFailure;
    }

    private static void ensureDirectories() {
        String[] dirs = { "./data", "./data/thumbnails", "./data/transcoded" };
        for (String dir : dirs) {
            File f = new File(dir);
            if (!f.exists()) {
                f.mkdirs();
            }
        }
    }
}
