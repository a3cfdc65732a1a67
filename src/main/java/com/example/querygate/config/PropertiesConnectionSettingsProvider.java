package com.example.querygate.config;

import com.example.querygate.util.InstallLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Reads connection settings from a properties file every time {@link #current()} is called.
 * <pre>
 * database.default=main
 * database.connections.main.url=jdbc:h2:mem:main
 * database.connections.main.username=sa
 * database.connections.main.password=
 * database.connections.main.prefix=arpg_
 * </pre>
 */
public class PropertiesConnectionSettingsProvider implements ConnectionSettingsProvider {
    public static final String CONFIG_PROPERTY = "querygate.config";
    public static final String CONFIG_FILE_NAME = "query-gate.properties";

    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesConnectionSettingsProvider.class);
    private static final String DEFAULT_KEY = "database.default";
    private static final String CONNECTIONS_PREFIX = "database.connections.";

    private final Path file;

    /**
     * @param file properties file to read, or {@code null} to read {@value #CONFIG_FILE_NAME} from the classpath
     */
    public PropertiesConnectionSettingsProvider(Path file) {
        this.file = file;
    }

    /**
     * Uses the {@value #CONFIG_PROPERTY} system property, then a file next to the jar, then the classpath.
     */
    public static PropertiesConnectionSettingsProvider locate() {
        String configured = System.getProperty(CONFIG_PROPERTY);
        if (configured != null && !configured.isBlank()) {
            return new PropertiesConnectionSettingsProvider(Path.of(configured));
        }
        Path besideJar = InstallLocation.resolve(PropertiesConnectionSettingsProvider.class, CONFIG_FILE_NAME);
        if (besideJar != null && Files.isRegularFile(besideJar)) {
            return new PropertiesConnectionSettingsProvider(besideJar);
        }
        return new PropertiesConnectionSettingsProvider(null);
    }

    public Path getFile() {
        return file;
    }

    @Override
    public ConnectionSettings current() {
        return parse(load());
    }

    private Properties load() {
        Properties properties = new Properties();
        if (file != null) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IOException e) {
                throw new IllegalStateException("Unable to read connection settings from " + file + ": " + e.getMessage(), e);
            }
            return properties;
        }
        try (InputStream input = PropertiesConnectionSettingsProvider.class.getClassLoader()
                .getResourceAsStream(CONFIG_FILE_NAME)) {
            if (input == null) {
                throw new IllegalStateException("Unable to find " + CONFIG_FILE_NAME + " on the classpath");
            }
            properties.load(input);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read " + CONFIG_FILE_NAME + ": " + e.getMessage(), e);
        }
        return properties;
    }

    static ConnectionSettings parse(Properties properties) {
        String defaultConnection = properties.getProperty(DEFAULT_KEY);
        if (defaultConnection == null || defaultConnection.isBlank()) {
            throw new IllegalStateException("Missing '" + DEFAULT_KEY + "' in connection settings");
        }

        Map<String, Map<String, String>> fieldsByConnection = new LinkedHashMap<>();
        for (String key : new TreeSet<>(properties.stringPropertyNames())) {
            if (!key.startsWith(CONNECTIONS_PREFIX)) {
                continue;
            }
            String remainder = key.substring(CONNECTIONS_PREFIX.length());
            int dot = remainder.lastIndexOf('.');
            if (dot <= 0) {
                LOGGER.warn("Ignoring malformed connection setting '{}'", key);
                continue;
            }
            fieldsByConnection
                    .computeIfAbsent(remainder.substring(0, dot), name -> new LinkedHashMap<>())
                    .put(remainder.substring(dot + 1), properties.getProperty(key));
        }

        Map<String, ConnectionSettings.Connection> connections = new LinkedHashMap<>();
        fieldsByConnection.forEach((name, fields) -> connections.put(name, new ConnectionSettings.Connection(
                name,
                fields.get("url"),
                fields.getOrDefault("username", ""),
                fields.getOrDefault("password", ""),
                fields.getOrDefault("prefix", "")
        )));
        return new ConnectionSettings(defaultConnection.trim(), connections);
    }
}
