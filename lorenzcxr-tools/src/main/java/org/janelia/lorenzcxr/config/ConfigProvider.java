package org.janelia.lorenzcxr.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Config} from layered sources; properties loaded later override the earlier ones.
 */
public class ConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/lorenzcxr.properties";

    private final Properties properties = new Properties();

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    private ConfigProvider() {
    }

    public ConfigProvider fromDefaultResources() {
        try (InputStream configStream = ConfigProvider.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (configStream == null) {
                LOG.warn("Default configuration {} not found", DEFAULT_CONFIG_RESOURCE);
            } else {
                properties.load(configStream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + DEFAULT_CONFIG_RESOURCE, e);
        }
        return this;
    }

    public ConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        try (InputStream configStream = Files.newInputStream(Paths.get(fileName))) {
            LOG.info("Read configuration from {}", fileName);
            properties.load(configStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading configuration from " + fileName, e);
        }
        return this;
    }

    public ConfigProvider fromProperties(Map<String, String> props) {
        properties.putAll(props);
        return this;
    }

    public Config get() {
        Properties configProperties = new Properties();
        configProperties.putAll(properties);
        return new Config(configProperties);
    }
}
