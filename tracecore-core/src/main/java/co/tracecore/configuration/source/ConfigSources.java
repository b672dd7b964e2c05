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

import org.stagemonitor.configuration.source.ConfigurationSource;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Static factory class for configuration sources
 */
public class ConfigSources {

    /**
     * The key of the option naming an additional properties file.
     * It can only be set by the system property {@code tracecore.config_file} or the environment variable {@code TRACECORE_CONFIG_FILE}.
     */
    public static final String CONFIG_FILE_KEY = "config_file";
    public static final String DEFAULT_CLASSPATH_CONFIG = "tracecore.properties";

    private ConfigSources() {
    }

    /**
     * Returns the default sources, highest priority first:
     * system properties, environment variables, the file named by {@value #CONFIG_FILE_KEY} and
     * {@value #DEFAULT_CLASSPATH_CONFIG} on the classpath.
     */
    public static List<ConfigurationSource> getDefaultSources(ClassLoader classLoader) {
        PrefixedConfigurationSource systemProperties = PrefixedConfigurationSource.systemProperties();
        PrefixedConfigurationSource environmentVariables = PrefixedConfigurationSource.environmentVariables();
        List<ConfigurationSource> result = new ArrayList<>();
        result.add(systemProperties);
        result.add(environmentVariables);

        ConfigurationSource fileSource = PropertiesConfigurationSource.fromFileSystem(getConfigFile(systemProperties, environmentVariables));
        if (fileSource != null) {
            result.add(fileSource);
        }
        ConfigurationSource classpathSource = PropertiesConfigurationSource.fromClasspath(DEFAULT_CLASSPATH_CONFIG, classLoader);
        if (classpathSource != null) {
            result.add(classpathSource);
        }
        return result;
    }

    @Nullable
    private static String getConfigFile(ConfigurationSource systemProperties, ConfigurationSource environmentVariables) {
        String configFile = systemProperties.getValue(CONFIG_FILE_KEY);
        return configFile != null ? configFile : environmentVariables.getValue(CONFIG_FILE_KEY);
    }
}
