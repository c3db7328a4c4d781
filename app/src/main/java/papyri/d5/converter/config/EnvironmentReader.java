package papyri.d5.converter.config;

import java.util.Optional;

/**
 * Source of environment fallbacks for options not given on the command line.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
