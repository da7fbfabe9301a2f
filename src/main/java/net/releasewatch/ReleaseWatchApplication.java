/**
 * Main application class for Release Watch
 *
 * Features:
 * - Runs a single collection cycle per process start (triggered by an external scheduler)
 * - Exits with the cycle's exit code
 * - Configuration bound from {@code release-watch.*}
 */

package net.releasewatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReleaseWatchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ReleaseWatchApplication.class, args)));
    }
}
