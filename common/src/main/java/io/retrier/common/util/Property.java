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
import java.util.function.Function;
import java.util.function.Predicate;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A typed configuration setting: its name within a namespace, how to parse it from text, the value to use when it is
 * absent, and an optional constraint on the parsed value.
 * <p>
 * Instances are immutable; {@link #withLegacyName} and {@link #requiring} return new ones.
 *
 * @param <T> Type of the value.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Property<T> {
    @Getter
    private final String name;
    @Getter
    private final T defaultValue;
    /**
     * A name that was used before, still read (with a warning) when present.
     */
    @Getter
    private final String legacyName;
    private final Function<String, T> parser;
    private final Predicate<T> constraint;
    private final String constraintDescription;

    public static Property<Integer> ofInt(String name, Integer defaultValue) {
        return create(name, defaultValue, Integer::parseInt);
    }

    public static Property<Long> ofLong(String name, Long defaultValue) {
        return create(name, defaultValue, Long::parseLong);
    }

    public static Property<Double> ofDouble(String name, Double defaultValue) {
        return create(name, defaultValue, Double::parseDouble);
    }

    /**
     * Creates a Property holding a constant of the given Enum. Values are matched regardless of case.
     */
    public static <E extends Enum<E>> Property<E> ofEnum(String name, Class<E> enumClass, E defaultValue) {
        Preconditions.checkNotNull(enumClass, "enumClass");
        return create(name, defaultValue, s -> Enum.valueOf(enumClass, s.toUpperCase()));
    }

    private static <T> Property<T> create(String name, T defaultValue, Function<String, T> parser) {
        Exceptions.checkNotNullOrEmpty(name, "name");
        return new Property<>(name, defaultValue, null, parser, v -> true, null);
    }

    public Property<T> withLegacyName(String legacyName) {
        Exceptions.checkNotNullOrEmpty(legacyName, "legacyName");
        return new Property<>(this.name, this.defaultValue, legacyName, this.parser, this.constraint, this.constraintDescription);
    }

    /**
     * Creates a copy of this Property which only accepts values matching the given constraint.
     *
     * @param constraint  The constraint.
     * @param description What the constraint requires, to complete "it must be ..." in error messages.
     * @return The new Property.
     */
    public Property<T> requiring(Predicate<T> constraint, String description) {
        Preconditions.checkNotNull(constraint, "constraint");
        Exceptions.checkNotNullOrEmpty(description, "description");
        return new Property<>(this.name, this.defaultValue, this.legacyName, this.parser, constraint, description);
    }

    /**
     * Parses and checks a raw value.
     *
     * @param key      The full key the value was found under, for error messages.
     * @param rawValue The text to parse. Surrounding whitespace is ignored.
     * @return The value.
     * @throws ConfigurationException If the value cannot be parsed or does not meet the constraint.
     */
    T parse(String key, String rawValue) {
        T value;
        try {
            value = this.parser.apply(rawValue.trim());
        } catch (IllegalArgumentException ex) {
            throw ConfigurationException.unparseable(key, rawValue, ex);
        }
        return check(key, value);
    }

    T check(String key, T value) {
        if (!this.constraint.test(value)) {
            throw ConfigurationException.constraintViolated(key, value, this.constraintDescription);
        }
        return value;
    }

    String getFullName(String namespace) {
        return namespace + "." + this.name;
    }

    @Override
    public String toString() {
        return this.name;
    }
}
