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

/**
 * Thrown when a configuration value is missing, cannot be parsed, or breaks the constraint of its Property.
 */
public class ConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    static ConfigurationException missing(String key) {
        return new ConfigurationException(String.format("No value for '%s' and no default.", key));
    }

    static ConfigurationException unparseable(String key, String value, Throwable cause) {
        return new ConfigurationException(String.format("'%s' is not a valid value for '%s'.", value, key), cause);
    }

    static ConfigurationException constraintViolated(String key, Object value, String constraint) {
        return new ConfigurationException(String.format("'%s' has value %s; it must be %s.", key, value, constraint));
    }
}
