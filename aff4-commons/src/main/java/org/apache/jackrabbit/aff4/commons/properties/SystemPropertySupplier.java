/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.aff4.commons.properties;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed access to a configuration value held in a system property.
 * <p>
 * Reading the property is logged at TRACE, a value that does not parse or
 * fails validation is logged at ERROR and replaced with the default, and a
 * value that differs from the default is logged at INFO.
 * <p>
 * The supported types are: {@link Boolean}, {@link Integer}, {@link Long}
 * and {@link String}.
 */
public class SystemPropertySupplier<T> implements Supplier<T> {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplier.class);

    private final String propName;
    private final T defaultValue;
    private final Function<String, T> parser;

    private Logger log = LOG;
    private Predicate<T> validator = (a) -> true;
    private Function<String, String> sysPropReader = System::getProperty;

    private SystemPropertySupplier(@Nonnull String propName, @Nonnull T defaultValue) {
        this.propName = checkNotNull(propName, "propertyName must be non-null");
        this.defaultValue = checkNotNull(defaultValue, "defaultValue must be non-null");
        this.parser = getValueParser(defaultValue);
    }

    /**
     * Create it for a given property name and default value.
     */
    public static <U> SystemPropertySupplier<U> create(@Nonnull String propName, @Nonnull U defaultValue) {
        return new SystemPropertySupplier<U>(propName, defaultValue);
    }

    /**
     * Specify the {@link Logger} to log to (defaults to this classes logger otherwise).
     */
    public SystemPropertySupplier<T> loggingTo(@Nonnull Logger log) {
        this.log = checkNotNull(log);
        return this;
    }

    /**
     * Specify a validation expression.
     */
    public SystemPropertySupplier<T> validateWith(@Nonnull Predicate<T> validator) {
        this.validator = checkNotNull(validator);
        return this;
    }

    /**
     * <em>For unit testing</em>: specify a function to read system properties
     * (overriding default of {@code System.getProperty(String}).
     */
    public SystemPropertySupplier<T> usingSystemPropertyReader(@Nonnull Function<String, String> sysPropReader) {
        this.sysPropReader = checkNotNull(sysPropReader);
        return this;
    }

    /**
     * @return the property name
     */
    public String getName() {
        return propName;
    }

    /**
     * Obtains the value of the system property, or the default if it is not
     * set or not valid.
     *
     * @return value of system property
     */
    @Override
    public T get() {
        String value = sysPropReader.apply(propName);
        if (value == null) {
            log.trace("System property {} not set", propName);
            return defaultValue;
        }
        log.trace("System property {} set to '{}'", propName, value);
        T returnValue = defaultValue;
        try {
            T v = parser.apply(value);
            if (validator.test(v)) {
                returnValue = v;
            } else {
                log.error("Ignoring invalid value '{}' for system property {}", value, propName);
            }
        } catch (NumberFormatException ex) {
            log.error("Ignoring malformed value '{}' for system property {}", value, propName);
        }
        if (!returnValue.equals(defaultValue)) {
            log.info("System property {} found to be '{}'", propName, returnValue);
        }
        return returnValue;
    }

    @SuppressWarnings("unchecked")
    private static <T> Function<String, T> getValueParser(T defaultValue) {
        if (defaultValue instanceof Boolean) {
            return v -> (T) Boolean.valueOf(v);
        } else if (defaultValue instanceof Integer) {
            return v -> (T) Integer.valueOf(v);
        } else if (defaultValue instanceof Long) {
            return v -> (T) Long.valueOf(v);
        } else if (defaultValue instanceof String) {
            return v -> (T) v;
        } else {
            throw new IllegalArgumentException(
                    String.format("expects a defaultValue of Boolean, Integer, Long, or String, but got: %s",
                            defaultValue.getClass()));
        }
    }

    @Override
    public String toString() {
        return propName + "=" + defaultValue;
    }
}
