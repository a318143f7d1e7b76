package org.sagebionetworks.mutex.config;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

import com.google.common.base.StandardSystemProperty;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;
import org.springframework.util.PropertyPlaceholderHelper;

/**
 * Config backed by Java properties.
 * <p>
 * Values are layered, later layers winning:
 * <ol>
 * <li>the template, usually bundled as a classpath resource such as <code>conf/mutex.conf</code></li>
 * <li>an optional local file, e.g. in the user's home directory</li>
 * <li>keys prefixed with the current environment, e.g. <code>prod.redis.url</code></li>
 * <li>environment variables, named by upper-casing the key and replacing dots with underscores</li>
 * <li>system properties</li>
 * </ol>
 * Only keys present in the template or local file can be overridden. Values may reference other keys with
 * <code>${key}</code>; unresolvable references are left as they are.
 */
public class PropertiesConfig implements Config {

    private static final PropertyPlaceholderHelper RESOLVER = new PropertyPlaceholderHelper("${", "}");

    /**
     * Default user when user is not specified in the config.
     */
    public static final String DEFAULT_USER = StandardSystemProperty.USER_NAME.value();

    /**
     * Default environment when environment is not specified in the config.
     */
    public static final Environment DEFAULT_ENV = Environment.LOCAL;

    /**
     * Comma surrounded by optional whitespace. Default delimiter to separate a list of values.
     */
    public static final String DEFAULT_LIST_DELIMITER = "\\s*,\\s*";

    static final String USER_KEY = "mutex.user";
    static final String ENV_KEY = "mutex.env";

    private final String user;
    private final Environment environment;
    private final Properties properties;
    private final Pattern delimiter;

    /**
     * Loads config from a classpath resource, e.g. <code>"conf/mutex.conf"</code>.
     */
    public PropertiesConfig(final String classpathTemplate) throws IOException {
        this(classpathTemplate, null);
    }

    /**
     * Loads config from a classpath resource and a local config file. The local file is skipped if it does not
     * exist.
     */
    public PropertiesConfig(final String classpathTemplate, final Path localConfig) throws IOException {
        this(PropertiesLoaderUtils.loadProperties(new ClassPathResource(classpathTemplate)), localConfig,
                DEFAULT_LIST_DELIMITER);
    }

    /**
     * Loads config from a template file on disk.
     */
    public PropertiesConfig(final Path configTemplate) throws IOException {
        this(configTemplate, null);
    }

    /**
     * Loads config from a template file on disk and a local config file. The local file is skipped if it does not
     * exist.
     */
    public PropertiesConfig(final Path configTemplate, final Path localConfig) throws IOException {
        this(load(configTemplate), localConfig, DEFAULT_LIST_DELIMITER);
    }

    /**
     * @param properties
     *            template properties; modified in place by the local config
     * @param localConfig
     *            optional local config file, may be null
     * @param delimiterRegex
     *            the regular expression separating the values of a list
     */
    public PropertiesConfig(final Properties properties, final Path localConfig, final String delimiterRegex)
            throws IOException {
        checkNotNull(properties);
        checkNotNull(delimiterRegex);

        if (localConfig != null && Files.exists(localConfig)) {
            try (Reader reader = Files.newBufferedReader(localConfig, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
        }

        user = readUser(properties);
        environment = readEnvironment(properties);
        this.properties = collapse(properties, environment.name().toLowerCase());
        delimiter = Pattern.compile(delimiterRegex);
    }

    private static Properties load(final Path path) throws IOException {
        final Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return properties;
    }

    @Override
    public String getUser() {
        return user;
    }

    @Override
    public Environment getEnvironment() {
        return environment;
    }

    @Override
    public String get(final String key) {
        checkNotNull(key);
        String value = properties.getProperty(key);
        return value == null ? null : RESOLVER.replacePlaceholders(value, properties);
    }

    @Override
    public int getInt(final String key) {
        return Integer.parseInt(required(key));
    }

    @Override
    public long getLong(final String key) {
        return Long.parseLong(required(key));
    }

    @Override
    public boolean getBoolean(final String key) {
        return Boolean.parseBoolean(Strings.nullToEmpty(get(key)).trim());
    }

    @Override
    public List<String> getList(final String key) {
        final String value = Strings.nullToEmpty(get(key)).trim();
        if (value.isEmpty()) {
            return ImmutableList.of();
        }
        return ImmutableList.copyOf(delimiter.split(value));
    }

    private String required(final String key) {
        final String value = get(key);
        if (value == null) {
            throw new IllegalStateException("Missing config entry '" + key + "'.");
        }
        return value.trim();
    }

    private final UnaryOperator<String> envReader = name -> {
        // Change to a valid environment variable name
        final String envName = name.toUpperCase().replace('.', '_');
        try {
            return System.getenv(envName);
        } catch (SecurityException e) {
            throw new ConfigReadException("environment variable", envName, e);
        }
    };

    private final UnaryOperator<String> sysReader = name -> {
        try {
            return System.getProperty(name);
        } catch (SecurityException e) {
            throw new ConfigReadException("system property", name, e);
        }
    };

    private String readUser(final Properties properties) {
        String user = read(USER_KEY, properties);
        return Strings.isNullOrEmpty(user) ? DEFAULT_USER : user;
    }

    private Environment readEnvironment(final Properties properties) {
        final String envName = read(ENV_KEY, properties);
        if (Strings.isNullOrEmpty(envName)) {
            return DEFAULT_ENV;
        }
        for (Environment env : Environment.values()) {
            if (env.name().toLowerCase().equals(envName)) {
                return env;
            }
        }
        throw new InvalidEnvironmentException(envName);
    }

    private String read(final String key, final Properties properties) {
        final String envVal = envReader.apply(key);
        if (envVal != null) {
            return envVal;
        }
        final String sysVal = sysReader.apply(key);
        if (sysVal != null) {
            return sysVal;
        }
        return properties.getProperty(key);
    }

    // Flattens the layers described in the class doc into one set of unprefixed keys.
    private Properties collapse(final Properties properties, final String envName) {
        final String envPrefix = envName + ".";
        Properties collapsed = new Properties();
        for (final String key : properties.stringPropertyNames()) {
            if (isDefaultProperty(key)) {
                collapsed.setProperty(key, properties.getProperty(key));
            }
        }
        for (final String key : properties.stringPropertyNames()) {
            if (key.startsWith(envPrefix)) {
                collapsed.setProperty(key.substring(envPrefix.length()), properties.getProperty(key));
            }
        }
        for (final String key : properties.stringPropertyNames()) {
            String value = envReader.apply(key);
            if (value == null) {
                value = sysReader.apply(key);
            }
            if (value != null) {
                collapsed.setProperty(key.startsWith(envPrefix) ? key.substring(envPrefix.length()) : key, value);
            }
        }
        return collapsed;
    }

    /**
     * When the property is not bound to a particular environment.
     */
    private static boolean isDefaultProperty(final String propName) {
        for (Environment env : Environment.values()) {
            if (propName.startsWith(env.name().toLowerCase() + ".")) {
                return false;
            }
        }
        return true;
    }
}
