package com.energyforecast.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * 读取 classpath 下的 properties 配置文件
 */
public class ConfigReaderUtil {
    public static final String DEFAULT_RESOURCE = "forecast.properties";

    private final Properties properties = new Properties();

    public ConfigReaderUtil() {
        this(DEFAULT_RESOURCE);
    }

    public ConfigReaderUtil(String resourceName) {
        try (InputStream inputStream = ConfigReaderUtil.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new IllegalStateException("Configuration resource not found: " + resourceName);
            }
            properties.load(inputStream);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration resource " + resourceName, e);
        }
    }

    public String getValue(String keyName) {
        String value = properties.getProperty(keyName);
        return value == null ? null : value.trim();
    }

    public String getValue(String keyName, String defaultValue) {
        String value = getValue(keyName);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    public int getInt(String keyName, int defaultValue) {
        String value = getValue(keyName);
        return value == null || value.isEmpty() ? defaultValue : Integer.parseInt(value);
    }

    public long getLong(String keyName, long defaultValue) {
        String value = getValue(keyName);
        return value == null || value.isEmpty() ? defaultValue : Long.parseLong(value);
    }

    public double getDouble(String keyName, double defaultValue) {
        String value = getValue(keyName);
        return value == null || value.isEmpty() ? defaultValue : Double.parseDouble(value);
    }

    public boolean getBoolean(String keyName, boolean defaultValue) {
        String value = getValue(keyName);
        return value == null || value.isEmpty() ? defaultValue : Boolean.parseBoolean(value);
    }

    /**
     * 逗号分隔的字符串列表
     */
    public List<String> getList(String keyName) {
        List<String> result = new ArrayList<>();
        String value = getValue(keyName);
        if (value == null || value.isEmpty()) {
            return result;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    public List<Integer> getIntList(String keyName, List<Integer> defaultValue) {
        List<String> parts = getList(keyName);
        if (parts.isEmpty()) {
            return defaultValue;
        }
        List<Integer> result = new ArrayList<>();
        for (String part : parts) {
            result.add(Integer.parseInt(part));
        }
        return result;
    }

    public List<Double> getDoubleList(String keyName, List<Double> defaultValue) {
        List<String> parts = getList(keyName);
        if (parts.isEmpty()) {
            return defaultValue;
        }
        List<Double> result = new ArrayList<>();
        for (String part : parts) {
            result.add(Double.parseDouble(part));
        }
        return result;
    }
}
