/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.tracecore.configuration.source;

import co.tracecore.sdk.logging.Logger;
import co.tracecore.sdk.logging.LoggerFactory;
import org.stagemonitor.configuration.source.AbstractConfigurationSource;

import javax.annotation.Nullable;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Options from a properties file.
 * <p>
 * Files on the file system are re-read on every {@link #reload()}, keeping the previous options if the file can't be read.
 * Classpath resources are read once.
 * </p>
 */
public final class PropertiesConfigurationSource extends AbstractConfigurationSource {

    private static final Logger logger = LoggerFactory.getLogger(PropertiesConfigurationSource.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    private final String name;
    @Nullable
    private final String file;
    private volatile Properties properties;

    private PropertiesConfigurationSource(String name, @Nullable String file, Properties properties) {
        this.name = name;
        this.file = file;
        this.properties = properties;
    }

    /**
     * @return the source, or {@code null} if there is no such resource or it can't be read
     */
    @Nullable
    public static PropertiesConfigurationSource fromClasspath(String resource, ClassLoader classLoader) {
        try (InputStream resourceStream = classLoader.getResourceAsStream(resource)) {
            if (resourceStream == null) {
                return null;
            }
            Properties properties = new Properties();
            properties.load(resourceStream);
            return new PropertiesConfigurationSource(CLASSPATH_PREFIX + resource, null, properties);
        } catch (IOException e) {
            logger.error("Failed to read configuration from " + CLASSPATH_PREFIX + resource, e);
            return null;
        }
    }

    /**
     * @return the source, or {@code null} if {@code file} is {@code null}, does not exist or can't be read
     */
    @Nullable
    public static PropertiesConfigurationSource fromFileSystem(@Nullable String file) {
        if (file == null) {
            return null;
        }
        Properties properties = readFile(file);
        if (properties == null) {
            return null;
        }
        return new PropertiesConfigurationSource(file, file, properties);
    }

    @Nullable
    private static Properties readFile(String file) {
        Properties properties = new Properties();
        try (InputStream input = new FileInputStream(file)) {
            properties.load(input);
            return properties;
        } catch (FileNotFoundException e) {
            logger.warn("Configuration file {} does not exist", file);
        } catch (IOException e) {
            logger.error("Failed to read configuration file " + file, e);
        }
        return null;
    }

    @Override
    public void reload() {
        if (file == null) {
            return;
        }
        Properties newProperties = readFile(file);
        if (newProperties != null && !newProperties.equals(properties)) {
            logger.info("Configuration file {} has changed", file);
            properties = newProperties;
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getValue(String key) {
        return properties.getProperty(key);
    }
}
