// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver;

import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/// Settings for one listener, read from a Java properties file. Every getter fails loudly with the
/// offending key when a required value is missing or malformed, so misconfiguration shows up at
/// startup rather than as odd behavior later.
///
/// ```
/// transport=websocket
/// port=8080
/// tls-enabled=true
/// tls-cert-file=conf/cert.pem
/// tls-key-file=conf/key.pem
/// ```
public class Configuration {

    public static final Path DEFAULT_PATH = Path.of("conf", "conf.properties");

    public static final String TRANSPORT = "transport";
    public static final String PORT = "port";
    public static final String TLS_ENABLED = "tls-enabled";
    public static final String TLS_CERT_FILE = "tls-cert-file";
    public static final String TLS_KEY_FILE = "tls-key-file";
    public static final String ENABLE_SNI = "enable-sni";
    public static final String WEBSOCKET_ENVELOPE = "websocket-envelope";
    public static final String WEBSOCKET_IDLE_TIMEOUT_SECONDS = "websocket-idle-timeout-seconds";

    private static final Set<String> KNOWN_KEYS = Set.of(TRANSPORT, PORT, TLS_ENABLED, TLS_CERT_FILE,
        TLS_KEY_FILE, ENABLE_SNI, WEBSOCKET_ENVELOPE, WEBSOCKET_IDLE_TIMEOUT_SECONDS);

    private final Properties properties;

    public Configuration (Properties properties) {
        this.properties = properties;
        for (String key : properties.stringPropertyNames()) {
            // Most likely a misspelling, which would otherwise silently fall back to a default.
            if (!KNOWN_KEYS.contains(key)) {
                throw new RuntimeException("Unknown configuration key: " + key);
            }
        }
    }

    public static Configuration load (Path path) {
        Properties properties = new Properties();
        try (FileReader reader = new FileReader(path.toFile(), StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new RuntimeException("Cannot read configuration file " + path, e);
        }
        return new Configuration(properties);
    }

    public String stringVal (String key) {
        String val = properties.getProperty(key);
        if (val == null) throw new RuntimeException("Missing configuration key: " + key);
        return val.trim();
    }

    public String stringVal (String key, String defaultVal) {
        return properties.containsKey(key) ? stringVal(key) : defaultVal;
    }

    public int intVal (String key) {
        String val = stringVal(key);
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new RuntimeException(message, e);
        }
    }

    public int intVal (String key, int defaultVal) {
        return properties.containsKey(key) ? intVal(key) : defaultVal;
    }

    public boolean boolVal (String key) {
        String val = stringVal(key);
        if (val.equalsIgnoreCase("true")) return true;
        if (val.equalsIgnoreCase("yes")) return true;
        if (val.equalsIgnoreCase("false")) return false;
        if (val.equalsIgnoreCase("no")) return false;
        var message = String.format("Boolean value '%s' for configuration key '%s' must be true/false/yes/no.", val, key);
        throw new RuntimeException(message);
    }

    public boolean boolVal (String key, boolean defaultVal) {
        return properties.containsKey(key) ? boolVal(key) : defaultVal;
    }

    /// Case-insensitive match of the value against the constant names of an enum.
    public <E extends Enum<E>> E enumVal (String key, Class<E> enumType, E defaultVal) {
        if (!properties.containsKey(key)) return defaultVal;
        String val = stringVal(key);
        try {
            return Enum.valueOf(enumType, val.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            var message = String.format("Value '%s' for configuration key '%s' must be one of %s.",
                val, key, Arrays.toString(enumType.getEnumConstants()).toLowerCase(Locale.ROOT));
            throw new RuntimeException(message, e);
        }
    }

    public Path pathVal (String key) {
        return Path.of(stringVal(key));
    }

}
