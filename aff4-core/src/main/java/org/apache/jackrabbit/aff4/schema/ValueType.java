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
package org.apache.jackrabbit.aff4.schema;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.util.List;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import org.apache.jackrabbit.aff4.api.Urn;

/**
 * The semantic type of an attribute value, together with the codec that
 * turns a value into the string stored in an attribute record and back.
 * <p>
 * Two values of a type are considered equal iff their serialized forms are
 * equal. Structured values are serialized as JSON with a stable property
 * order, so this holds for them as well.
 *
 * @param <T> the Java type of the values
 */
public abstract class ValueType<T> {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() {};

    public static final ValueType<String> STRING = new ValueType<String>("String", String.class) {
        @Override
        protected String encode(String value) {
            return value;
        }

        @Override
        protected String decode(String serialized) {
            return serialized;
        }
    };

    public static final ValueType<Long> LONG = new ValueType<Long>("Long", Long.class) {
        @Override
        protected String encode(Long value) {
            return value.toString();
        }

        @Override
        protected Long decode(String serialized) {
            return Long.valueOf(serialized);
        }
    };

    /**
     * A point in time, in milliseconds since the epoch.
     */
    public static final ValueType<Long> DATE = new ValueType<Long>("Date", Long.class) {
        @Override
        protected String encode(Long value) {
            return value.toString();
        }

        @Override
        protected Long decode(String serialized) {
            return Long.valueOf(serialized);
        }
    };

    public static final ValueType<Boolean> BOOLEAN = new ValueType<Boolean>("Boolean", Boolean.class) {
        @Override
        protected String encode(Boolean value) {
            return value.toString();
        }

        @Override
        protected Boolean decode(String serialized) {
            return Boolean.valueOf(serialized);
        }
    };

    public static final ValueType<byte[]> BINARY = new ValueType<byte[]>("Binary", byte[].class) {
        @Override
        protected String encode(byte[] value) {
            return BaseEncoding.base64().encode(value);
        }

        @Override
        protected byte[] decode(String serialized) {
            return BaseEncoding.base64().decode(serialized);
        }
    };

    public static final ValueType<Urn> URN = new ValueType<Urn>("URN", Urn.class) {
        @Override
        protected String encode(Urn value) {
            return value.toString();
        }

        @Override
        protected Urn decode(String serialized) {
            return Urn.parse(serialized);
        }
    };

    private final String name;

    private final Class<?> javaType;

    protected ValueType(String name, Class<?> javaType) {
        this.name = checkNotNull(name);
        this.javaType = checkNotNull(javaType);
    }

    /**
     * A structured value, serialized as JSON with Jackson.
     *
     * @param name the name of the type
     * @param javaType the class of the values
     * @return the value type
     */
    public static <T> ValueType<T> json(String name, final Class<T> javaType) {
        return new ValueType<T>(name, javaType) {
            @Override
            protected String encode(T value) throws IOException {
                return MAPPER.writeValueAsString(value);
            }

            @Override
            protected T decode(String serialized) throws IOException {
                return MAPPER.readValue(serialized, javaType);
            }
        };
    }

    /**
     * An ordered sequence of values, stored as one record. The elements are
     * serialized with the element type and kept as a JSON array of strings.
     *
     * @param elementType the type of the elements
     * @return the value type
     */
    public static <E> ValueType<List<E>> listOf(final ValueType<E> elementType) {
        return new ValueType<List<E>>("List<" + elementType.getName() + ">", List.class) {
            @Override
            protected String encode(List<E> value) throws IOException {
                ImmutableList.Builder<String> elements = ImmutableList.builder();
                for (E e : value) {
                    elements.add(elementType.serialize(e));
                }
                return MAPPER.writeValueAsString(elements.build());
            }

            @Override
            protected List<E> decode(String serialized) throws IOException {
                ImmutableList.Builder<E> elements = ImmutableList.builder();
                for (String e : MAPPER.readValue(serialized, STRING_LIST)) {
                    elements.add(elementType.deserialize(e));
                }
                return elements.build();
            }

            @Override
            public boolean isInstance(Object value) {
                if (!(value instanceof List)) {
                    return false;
                }
                for (Object e : (List<?>) value) {
                    if (!elementType.isInstance(e)) {
                        return false;
                    }
                }
                return true;
            }
        };
    }

    protected abstract String encode(T value) throws IOException;

    protected abstract T decode(String serialized) throws IOException;

    /**
     * Serializes a value.
     *
     * @param value the value
     * @return the serialized form
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    @Nonnull
    public final String serialize(@Nonnull T value) {
        checkNotNull(value);
        try {
            return encode(value);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot serialize " + name + " value: " + value, e);
        }
    }

    /**
     * Deserializes a stored value.
     *
     * @param serialized the serialized form
     * @return the value
     * @throws IllegalStateException if the stored form is not a value of
     *          this type
     */
    @Nonnull
    public final T deserialize(@Nonnull String serialized) {
        checkNotNull(serialized);
        try {
            return decode(serialized);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt " + name + " value: " + serialized, e);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Corrupt " + name + " value: " + serialized, e);
        }
    }

    /**
     * @param value a value of unknown type
     * @return whether the value can be stored as this type
     */
    public boolean isInstance(Object value) {
        return javaType.isInstance(value);
    }

    public String getName() {
        return name;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    @Override
    public String toString() {
        return name;
    }
}
