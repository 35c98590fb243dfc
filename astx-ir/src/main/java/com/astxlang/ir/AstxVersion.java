package com.astxlang.ir;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 版本信息，读取 classpath 上的 astx-version.properties
 */
public final class AstxVersion {
    private static final Logger LOG = Logger.getLogger(AstxVersion.class.getName());

    static final String RESOURCE = "/astx-version.properties";
    static final String FALLBACK = "0.17.0";

    private static volatile String cached;

    private AstxVersion() {}

    public static String get() {
        String v = cached;
        if (v == null) {
            v = load();
            cached = v;
        }
        return v;
    }

    static String load() {
        InputStream in = AstxVersion.class.getResourceAsStream(RESOURCE);
        if (in == null) {
            return FALLBACK;
        }
        try (InputStream stream = in) {
            Properties props = new Properties();
            props.load(stream);
            String v = props.getProperty("version");
            if (v == null || v.trim().isEmpty() || v.startsWith("${")) {
                return FALLBACK;
            }
            return v.trim();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读取版本信息失败: " + RESOURCE, e);
            return FALLBACK;
        }
    }
}
