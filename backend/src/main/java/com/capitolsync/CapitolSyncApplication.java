package com.capitolsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Bulk importer entry point. The import itself is driven by {@link com.capitolsync.importer.run.ImportRunner};
 * the process exit code is taken from it.
 */
@SpringBootApplication
public class CapitolSyncApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CapitolSyncApplication.class, args)));
    }
}
