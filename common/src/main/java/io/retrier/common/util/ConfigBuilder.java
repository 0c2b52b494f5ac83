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
import java.util.Properties;

/**
 * Collects the values of a namespace's Properties and turns them into a configuration object.
 *
 * @param <T> Type of the configuration.
 */
public class ConfigBuilder<T> {
    private final String namespace;
    private final ConfigConstructor<T> constructor;
    private final Properties properties = new Properties();

    /**
     * Creates a new instance of the ConfigBuilder class.
     *
     * @param namespace   The namespace whose Properties this builder collects.
     * @param constructor Creates the configuration object from the collected values.
     */
    public ConfigBuilder(String namespace, ConfigConstructor<T> constructor) {
        this.namespace = Exceptions.checkNotNullOrEmpty(namespace, "namespace");
        this.constructor = Preconditions.checkNotNull(constructor, "constructor");
    }

    /**
     * Copies all the entries of the given Properties into this builder. Entries of other namespaces are copied too,
     * but are ignored. The given object is not modified.
     *
     * @param source The entries to copy.
     * @return This instance.
     */
    public ConfigBuilder<T> withProperties(Properties source) {
        Preconditions.checkNotNull(source, "source");
        source.stringPropertyNames().forEach(key -> this.properties.setProperty(key, source.getProperty(key)));
        return this;
    }

    /**
     * Sets the value of a Property, replacing any previous one. The value is validated when {@link #build()} runs.
     *
     * @param property The Property to set.
     * @param value    The value.
     * @param <V>      Type of the Property.
     * @return This instance.
     */
    public <V> ConfigBuilder<T> with(Property<V> property, V value) {
        Preconditions.checkNotNull(value, "value");
        this.properties.setProperty(property.getFullName(this.namespace), value.toString());
        return this;
    }

    /**
     * Creates the configuration object.
     *
     * @return The newly created instance.
     * @throws ConfigurationException If a value is missing or invalid.
     */
    public T build() throws ConfigurationException {
        return this.constructor.apply(new TypedProperties(this.properties, this.namespace));
    }

    @FunctionalInterface
    public interface ConfigConstructor<R> {
        R apply(TypedProperties properties) throws ConfigurationException;
    }
}
