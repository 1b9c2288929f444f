/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
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
package io.kubeauth.common.configuration;

import static java.util.Objects.requireNonNull;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link KubeAuthConfiguration} from properties.
 */
public class KubeAuthConfigurationLoader {

    /**
     * Creates a configuration loaded with the attribute values of the provided property file.
     *
     * @param configFile path of the property file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file contains a value of the wrong type
     */
    public static KubeAuthConfiguration create(String configFile) throws IOException, IllegalArgumentException {
        requireNonNull(configFile);
        try (InputStream inputStream = new FileInputStream(configFile)) {
            return create(inputStream);
        }
    }

    /**
     * Creates a configuration loaded with the attribute values of the provided property stream.
     * The stream is closed.
     */
    public static KubeAuthConfiguration create(InputStream inStream) throws IOException, IllegalArgumentException {
        requireNonNull(inStream);
        try (InputStream in = inStream) {
            Properties properties = new Properties();
            properties.load(in);
            return create(properties);
        }
    }

    /**
     * Creates a configuration loaded with the attribute values of the provided Properties object.
     * Unknown keys are ignored.
     */
    public static KubeAuthConfiguration create(Properties properties) throws IllegalArgumentException {
        requireNonNull(properties);
        KubeAuthConfiguration configuration = new KubeAuthConfiguration();
        for (Field field : KubeAuthConfiguration.class.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers()) || !properties.containsKey(field.getName())) {
                continue;
            }
            String value = StringUtils.trim(properties.getProperty(field.getName()));
            field.setAccessible(true);
            try {
                field.set(configuration, convert(field, value));
            } catch (IllegalAccessException e) {
                throw new IllegalArgumentException("Failed to set " + field.getName(), e);
            }
        }
        return configuration;
    }

    private static Object convert(Field field, String value) {
        Class<?> type = field.getType();
        try {
            if (type == String.class) {
                return value;
            } else if (type == int.class || type == Integer.class) {
                return Integer.parseInt(value);
            } else if (type == long.class || type == Long.class) {
                return Long.parseLong(value);
            } else if (type == boolean.class || type == Boolean.class) {
                if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                    throw new IllegalArgumentException("not a boolean");
                }
                return Boolean.parseBoolean(value);
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid value '%s' for %s of type %s", value, field.getName(), type.getSimpleName()),
                    e);
        }
        throw new IllegalArgumentException("Unsupported type " + type.getName() + " of " + field.getName());
    }

    /**
     * Validates {@link FieldContext} annotation on each field of the class element. If element is annotated required
     * and value of the element is null or number value is not in a provided (min,max) range then consider as incomplete
     * object and throws exception with incomplete parameters.
     *
     * @throws IllegalArgumentException
     *             if object is field values are not completed according to {@link FieldContext} constraints.
     */
    public static boolean isComplete(Object obj) throws IllegalArgumentException {
        requireNonNull(obj);
        Field[] fields = obj.getClass().getDeclaredFields();
        StringBuilder error = new StringBuilder();
        for (Field field : fields) {
            if (field.isAnnotationPresent(FieldContext.class)) {
                field.setAccessible(true);
                Object value;

                try {
                    value = field.get(obj);
                } catch (IllegalAccessException e) {
                    throw new RuntimeException(e);
                }

                if (log.isDebugEnabled()) {
                    log.debug("Validating configuration field '{}' = '{}'", field.getName(), value);
                }
                FieldContext context = field.getAnnotation(FieldContext.class);
                if (context.required() && isEmpty(value)) {
                    error.append(String.format("Required %s is null,", field.getName()));
                }

                if (value instanceof Number) {
                    long fieldVal = ((Number) value).longValue();
                    if (fieldVal < context.minValue() || fieldVal > context.maxValue()) {
                        error.append(String.format("%s value %d doesn't fit in given range (%d, %d),", field.getName(),
                                fieldVal, context.minValue(), context.maxValue()));
                    }
                }
            }
        }
        if (error.length() > 0) {
            throw new IllegalArgumentException(error.substring(0, error.length() - 1));
        }
        return true;
    }

    private static boolean isEmpty(Object obj) {
        if (obj == null) {
            return true;
        } else if (obj instanceof String) {
            return StringUtils.isBlank((String) obj);
        } else {
            return false;
        }
    }

    private static final Logger log = LoggerFactory.getLogger(KubeAuthConfigurationLoader.class);
}
