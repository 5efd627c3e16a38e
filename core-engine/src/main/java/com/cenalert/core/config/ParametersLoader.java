package com.cenalert.core.config;

import com.cenalert.core.model.DetectorParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads {@link DetectorParameters} from a YAML source.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * algorithm: chebyshev
 * parameters: [60, 3, 6, 1, 0.05]
 * </pre>
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Environment variable {@value #ENV_PARAMETERS_PATH} via
 * {@link #load(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}, by default
 * {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * The algorithm may be left out of the file and supplied by the caller as an
 * override. Validation is left to the caller, after any override is applied.
 * </p>
 *
 * @since 1.0.0
 */
public final class ParametersLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ParametersLoader.class);

    /** Environment variable that can supply the parameters file. */
    public static final String ENV_PARAMETERS_PATH = "CENALERT_PARAMETERS_PATH";

    /** Bundled Chebyshev parameters with the algorithm defaults. */
    public static final String DEFAULT_RESOURCE = "cenalert-parameters.yml";

    private ParametersLoader() {
        // utility class, not instantiable
    }

    /**
     * Load parameters using automatic resolution: {@value #ENV_PARAMETERS_PATH}
     * if it names an existing file, else the classpath resource.
     *
     * @param classpathFallback classpath resource used when the environment
     *                          variable is unset
     * @return parsed parameters
     */
    public static DetectorParameters load(String classpathFallback) {
        return load(System.getenv(ENV_PARAMETERS_PATH), classpathFallback);
    }

    static DetectorParameters load(String envPath, String classpathFallback) {
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading parameters from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading parameters from classpath: {}", classpathFallback);
        return fromClasspath(classpathFallback);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed parameters
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or parsing fails
     */
    public static DetectorParameters fromFile(String path) {
        Objects.requireNonNull(path, "Parameters file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parse(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Parameters file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read parameters file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed parameters
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or parsing fails
     */
    public static DetectorParameters fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ParametersLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static DetectorParameters parse(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectorParameters.class, options));
        DetectorParameters parameters;
        try {
            parameters = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed parameters: " + e.getMessage(), e);
        }

        if (parameters == null) {
            LOG.warn("Empty parameters file, using algorithm defaults");
            parameters = new DetectorParameters();
        }
        LOG.debug("Loaded {}", parameters);
        return parameters;
    }
}
