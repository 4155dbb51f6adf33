package edu.yu.blockvfs.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Process-wide settings of the block file layer.
 * <p>
 * A value is resolved from, in order: the properties passed to
 * {@link #setConfiguration(Properties)}, system properties,
 * {@code blockvfs.properties} on the classpath, and finally the defaults.
 */
public enum VfsConfiguration {

    INSTANCE;

    public static final String BLOCK_SIZE = "blockvfs.blockSize";
    public static final String WRITE_CACHE_CAPACITY = "blockvfs.writeCacheCapacity";
    public static final String LOCK_WAIT_MILLIS = "blockvfs.lockWaitMillis";

    public static final int DEFAULT_BLOCK_SIZE = 8192;
    public static final int DEFAULT_WRITE_CACHE_CAPACITY = 2048;
    public static final long DEFAULT_LOCK_WAIT_MILLIS = 5000;

    private static final String PROPERTIES_FILE = "blockvfs.properties";
    private static final Logger logger = LogManager.getLogger(VfsConfiguration.class);

    private final Properties fileProperties = loadPropertiesFile();
    private volatile Properties configured = new Properties();

    public VfsConfiguration get() {
        return this;
    }

    /**
     * Replace the programmatic settings. A null clears them.
     *
     * @param props
     */
    public void setConfiguration(Properties props) {
        Properties copy = new Properties();
        if (props != null) {
            copy.putAll(props);
        }
        this.configured = copy;
    }

    public int blockSize() {
        int size = (int) resolve(BLOCK_SIZE, DEFAULT_BLOCK_SIZE, Integer.MAX_VALUE);
        if (size <= 0) {
            throw new IllegalStateException("Configured block size must be positive: " + size);
        }
        return size;
    }

    public int writeCacheCapacity() {
        int capacity = (int) resolve(WRITE_CACHE_CAPACITY, DEFAULT_WRITE_CACHE_CAPACITY, Integer.MAX_VALUE);
        if (capacity <= 0) {
            throw new IllegalStateException("Configured write cache capacity must be positive: " + capacity);
        }
        return capacity;
    }

    public long lockWaitMillis() {
        return resolve(LOCK_WAIT_MILLIS, DEFAULT_LOCK_WAIT_MILLIS, Long.MAX_VALUE);
    }

    private long resolve(String key, long defaultValue, long max) {
        Long value = parse(key, this.configured.getProperty(key), max);
        if (value == null) {
            value = parse(key, System.getProperty(key), max);
        }
        if (value == null) {
            value = parse(key, this.fileProperties.getProperty(key), max);
        }
        return value != null ? value : defaultValue;
    }

    private static Long parse(String key, String raw, long max) {
        if (raw == null || raw.isBlank()) {
            return null;
        }

        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value for {}: '{}'", key, raw);
            return null;
        }
        if (value > max) {
            logger.warn("Ignoring out of range value for {}: '{}' (max {})", key, raw, max);
            return null;
        }
        return value;
    }

    private static Properties loadPropertiesFile() {
        Properties props = new Properties();
        try (InputStream is = VfsConfiguration.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException e) {
            // runs while INSTANCE is built, before the static logger is set
            LogManager.getLogger(VfsConfiguration.class).warn("Couldn't read {} from the classpath", PROPERTIES_FILE, e);
        }
        return props;
    }

}
