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
import org.stagemonitor.configuration.source.EnvironmentVariableConfigurationSource;
import org.stagemonitor.configuration.source.SystemPropertyConfigurationSource;

import java.io.IOException;
import java.util.Locale;

/**
 * Reads option keys from process wide settings shared with other libraries, so the keys carry a tracecore prefix.
 * <ul>
 *     <li>System properties: {@code max_links} is read from {@code tracecore.max_links}</li>
 *     <li>Environment variables: {@code max_links} is read from {@code TRACECORE_MAX_LINKS}</li>
 * </ul>
 * These sources are read-only.
 */
public final class PrefixedConfigurationSource implements ConfigurationSource {

    public static final String SYSTEM_PROPERTY_PREFIX = "tracecore.";
    public static final String ENVIRONMENT_VARIABLE_PREFIX = "TRACECORE_";

    private final ConfigurationSource delegate;
    private final boolean environmentVariables;

    PrefixedConfigurationSource(ConfigurationSource delegate, boolean environmentVariables) {
        this.delegate = delegate;
        this.environmentVariables = environmentVariables;
    }

    public static PrefixedConfigurationSource systemProperties() {
        return new PrefixedConfigurationSource(new SystemPropertyConfigurationSource(), false);
    }

    public static PrefixedConfigurationSource environmentVariables() {
        return new PrefixedConfigurationSource(new EnvironmentVariableConfigurationSource(), true);
    }

    public static String toSystemPropertyName(String key) {
        return SYSTEM_PROPERTY_PREFIX + key;
    }

    public static String toEnvironmentVariableName(String key) {
        return ENVIRONMENT_VARIABLE_PREFIX + key.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    @Override
    public String getValue(String key) {
        return delegate.getValue(environmentVariables ? toEnvironmentVariableName(key) : toSystemPropertyName(key));
    }

    @Override
    public void reload() throws IOException {
        delegate.reload();
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public boolean isSavingPossible() {
        return false;
    }

    @Override
    public boolean isSavingPersistent() {
        return false;
    }

    @Override
    public void save(String key, String value) {
        throw new UnsupportedOperationException(getName() + " can't be modified, tried to set " + key);
    }

    @Override
    public String toString() {
        return getName() + (environmentVariables ? " (" + ENVIRONMENT_VARIABLE_PREFIX + "*)" : " (" + SYSTEM_PROPERTY_PREFIX + "*)");
    }
}
