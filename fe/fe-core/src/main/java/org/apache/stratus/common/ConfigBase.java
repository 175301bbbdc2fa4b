// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.stratus.common;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * 配置加载基类。
 *
 * 子类以 public static 字段声明配置项，并用 {@link ConfField} 标注。
 * init() 读取 fe.conf 格式（key = value，# 开头为注释）的文件，按字段名通过反射赋值。
 */
public class ConfigBase {
    private static final Logger LOG = LogManager.getLogger(ConfigBase.class);

    // config class -> name of the annotated field -> field
    private static final Map<Class<?>, Map<String, Field>> confFields = Maps.newHashMap();

    /**
     * Load config items from the given properties file. Keys that do not match a field are ignored.
     */
    public void init(String confFile) throws IOException {
        Preconditions.checkArgument(StringUtils.isNotEmpty(confFile), "confFile can not be empty");
        try (InputStream in = Files.newInputStream(Paths.get(confFile))) {
            init(in);
        }
        LOG.info("loaded config from {}", confFile);
    }

    /** load config items from an already opened stream, the stream is not closed */
    public void init(InputStream in) throws IOException {
        Properties props = new Properties();
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        props.load(reader);
        Map<String, Field> fields = getConfFields(getClass());
        for (String key : props.stringPropertyNames()) {
            Field field = fields.get(key);
            if (field == null) {
                LOG.warn("ignore unknown config item '{}'", key);
                continue;
            }
            setConfigField(field, props.getProperty(key).trim());
        }
    }

    /**
     * 运行时修改配置项，只允许修改 mutable = true 的字段。
     */
    public static synchronized void setMutableConfig(String key, String value) {
        Field field = getConfFields(Config.class).get(key);
        if (field == null) {
            throw new IllegalArgumentException("Config '" + key + "' does not exist");
        }
        ConfField anno = field.getAnnotation(ConfField.class);
        if (!anno.mutable()) {
            throw new IllegalArgumentException("Config '" + key + "' is not mutable");
        }
        setConfigField(field, value);
        LOG.info("set config {} to {}", key, value);
    }

    /** current value of the config item, as string */
    public static String getConfigValue(String key) {
        Field field = getConfFields(Config.class).get(key);
        if (field == null) {
            throw new IllegalArgumentException("Config '" + key + "' does not exist");
        }
        try {
            return String.valueOf(field.get(null));
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("can not read config " + key, e);
        }
    }

    private static synchronized Map<String, Field> getConfFields(Class<?> confClass) {
        return confFields.computeIfAbsent(confClass, clazz -> {
            Map<String, Field> fields = Maps.newHashMap();
            for (Field field : clazz.getFields()) {
                if (Modifier.isStatic(field.getModifiers()) && field.isAnnotationPresent(ConfField.class)) {
                    fields.put(field.getName(), field);
                }
            }
            return ImmutableMap.copyOf(fields);
        });
    }

    private static void setConfigField(Field field, String value) {
        Class<?> type = field.getType();
        try {
            if (type == int.class) {
                field.setInt(null, Integer.parseInt(value));
            } else if (type == long.class) {
                field.setLong(null, Long.parseLong(value));
            } else if (type == boolean.class) {
                if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                    throw new IllegalArgumentException("invalid boolean value '" + value + "' for " + field.getName());
                }
                field.setBoolean(null, Boolean.parseBoolean(value));
            } else if (type == String.class) {
                field.set(null, value);
            } else {
                throw new IllegalArgumentException("unsupported config type " + type + " of " + field.getName());
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value '" + value + "' for " + field.getName(), e);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("can not set config " + field.getName(), e);
        }
    }
}
