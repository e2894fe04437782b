package com.github.lusitano;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConfigReader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigReader.class);

    static final String CONFIG_FILE = "lusitano.cfg";

    static Config readConfig() {
        return readConfig(Path.of(CONFIG_FILE));
    }

    static Config readConfig(Path path) {
        var config = new Config();
        if (!Files.isRegularFile(path)) {
            LOG.debug("no {} found, using defaults", path);
            return config;
        }
        Properties properties = new Properties();
        try (var in = new FileInputStream(path.toFile())) {
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + path, e);
        }

        config.target = properties.getProperty("target", config.target).trim();
        config.entryPoint = Boolean.parseBoolean(properties.getProperty("entryPoint", Boolean.toString(config.entryPoint)).trim());
        config.header = Boolean.parseBoolean(properties.getProperty("header", Boolean.toString(config.header)).trim());
        return config;
    }

    static class Config {
        String target = ".";
        boolean entryPoint = true;
        boolean header = true;

        public void applyConfig(ConfigTarget ct) {
            ct.setTarget(target);
            ct.setEntryPoint(entryPoint);
            ct.setHeader(header);
        }
    }

    interface ConfigTarget {
        void setTarget(String target);
        void setEntryPoint(boolean entryPoint);
        void setHeader(boolean header);
    }

}
