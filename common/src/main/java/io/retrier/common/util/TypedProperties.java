/**
 * Copyright Pravega Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.retrier.common.util;

import com.google.common.base.Preconditions;
import io.retrier.common.Exceptions;
import java.time.Duration;
import java.time.temporal.TemporalUnit;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only view over the entries of a java.util.Properties object that belong to one namespace: "retry.maxAttempts"
 * is the "maxAttempts" Property of the "retry" namespace.
 */
@Slf4j
public class TypedProperties {
    private final Properties properties;
    private final String namespace;

    /**
     * Creates a new instance of the TypedProperties class.
     *
     * @param properties The java.util.Properties to read from.
     * @param namespace  The namespace of this instance.
     */
    public TypedProperties(Properties properties, String namespace) {
        this.properties = Preconditions.checkNotNull(properties, "properties");
        this.namespace = Exceptions.checkNotNullOrEmpty(namespace, "namespace");
    }

    /**
     * Gets the value of a Property: the one under its legacy name if that is set, else the one under its name, else
     * its default value.
     *
     * @param property The Property to get.
     * @param <T>      The type of the value.
     * @return The value.
     * @throws ConfigurationException If there is no value and no default, or the value is not valid for the Property.
     */
    public <T> T get(Property<T> property) throws ConfigurationException {
        String key = property.getFullName(this.namespace);
        if (property.getLegacyName() != null) {
            String legacyKey = this.namespace + "." + property.getLegacyName();
            String legacyValue = this.properties.getProperty(legacyKey);
            if (legacyValue != null) {
                log.warn("Property '{}' is deprecated; use '{}' instead.", legacyKey, key);
                return property.parse(legacyKey, legacyValue);
            }
        }

        String value = this.properties.getProperty(key);
        if (value != null) {
            return property.parse(key, value);
        }

        if (property.getDefaultValue() == null) {
            throw ConfigurationException.missing(key);
        }
        return property.check(key, property.getDefaultValue());
    }

    /**
     * Gets the value of a Long Property as a Duration.
     *
     * @param property The Property to get.
     * @param unit     The unit the value is expressed in.
     * @return The Duration.
     * @throws ConfigurationException If there is no value and no default, or the value is not valid for the Property.
     */
    public Duration getDuration(Property<Long> property, TemporalUnit unit) throws ConfigurationException {
        return Duration.of(get(property), unit);
    }
}
