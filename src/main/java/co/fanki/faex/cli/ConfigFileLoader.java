package co.fanki.faex.cli;

import co.fanki.faex.analysis.application.AnalysisOptions;
import co.fanki.faex.shared.DomainException;
import co.fanki.faex.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Reads analysis defaults from a {@code .properties} or YAML file.
 *
 * <p>Recognized keys are {@code faex.analysis.max-depth} and
 * {@code faex.analysis.ignore}. The ignore value is either a comma
 * separated string or a YAML list.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ConfigFileLoader {

    private static final Logger LOG = LoggerFactory.getLogger(
            ConfigFileLoader.class);

    static final String MAX_DEPTH_KEY = "faex.analysis.max-depth";

    static final String IGNORE_KEY = "faex.analysis.ignore";

    /**
     * Loads the file and merges it over the given options.
     *
     * @param file the configuration file
     * @param defaults the options for keys the file does not set
     * @return the merged options
     * @throws DomainException with code {@code PATH_NOT_FOUND} if the file
     *         does not exist, or {@code INVALID_CONFIG} if it cannot be read
     *         or holds a non numeric depth
     */
    public AnalysisOptions load(final Path file,
            final AnalysisOptions defaults) {
        Preconditions.requireNonNull(defaults, "Defaults are required");
        Preconditions.requireExistingPath(file);

        final Properties properties = read(file);
        LOG.debug("Loaded {} configuration keys from {}", properties.size(),
                file);

        return defaults.override(maxDepth(properties, file),
                ignore(properties));
    }

    private Properties read(final Path file) {
        final FileSystemResource resource = new FileSystemResource(file);
        final String name = file.getFileName().toString()
                .toLowerCase(Locale.ROOT);

        try {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                final YamlPropertiesFactoryBean yaml =
                        new YamlPropertiesFactoryBean();
                yaml.setResources(resource);
                final Properties properties = yaml.getObject();
                return properties != null ? properties : new Properties();
            }
            return PropertiesLoaderUtils.loadProperties(resource);
        } catch (final IOException | IllegalStateException e) {
            throw new DomainException("Cannot read configuration file "
                    + file + ": " + e.getMessage(), "INVALID_CONFIG");
        }
    }

    private Integer maxDepth(final Properties properties, final Path file) {
        final String value = properties.getProperty(MAX_DEPTH_KEY);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (final NumberFormatException e) {
            throw new DomainException("Invalid " + MAX_DEPTH_KEY + " in "
                    + file + ": " + value, "INVALID_CONFIG");
        }
    }

    private List<String> ignore(final Properties properties) {
        final String joined = properties.getProperty(IGNORE_KEY);
        if (joined != null) {
            return Arrays.stream(joined.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }

        final List<String> names = new ArrayList<>();
        for (int i = 0; properties.containsKey(IGNORE_KEY + "[" + i + "]");
                i++) {
            names.add(properties.getProperty(IGNORE_KEY + "[" + i + "]")
                    .trim());
        }
        return names.isEmpty() ? null : names;
    }

}
