package com.github.dominikschlosser.federation.trust;

import com.github.dominikschlosser.federation.representations.FederationConfigRepresentation;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jboss.logging.Logger;
import org.keycloak.util.JsonSerialization;

/** Reads versioned federation configuration documents (JSON). */
public final class ConfigurationLoader {

    private static final Logger logger = Logger.getLogger(ConfigurationLoader.class);

    private ConfigurationLoader() {}

    public static FederationConfigRepresentation load(Path path) {
        logger.debugf("Loading federation configuration from %s", path);
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read federation configuration " + path, e);
        }
    }

    public static FederationConfigRepresentation loadResource(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = ConfigurationLoader.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Federation configuration resource not found: " + resource);
            }
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read federation configuration resource " + resource, e);
        }
    }

    public static FederationConfigRepresentation load(InputStream in) {
        try {
            FederationConfigRepresentation rep = JsonSerialization.readValue(in, FederationConfigRepresentation.class);
            if (rep == null) {
                throw new ConfigurationException("Federation configuration document is empty");
            }
            return rep;
        } catch (IOException e) {
            throw new ConfigurationException("Federation configuration is not valid JSON: " + e.getMessage(), e);
        }
    }
}
