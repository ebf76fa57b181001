package com.github.anirbanmu.wisp.config;

public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }
}
