package com.bko.healthexport.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.stereotype.Component;

@Component
public class EnvConfig {
    private final Dotenv dotenv;

    public EnvConfig() {
        this(Dotenv.configure()
                .ignoreIfMissing()
                .load());
    }

    EnvConfig(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    public String get(String key) {
        String envKey = key.toUpperCase()
                .replace(".", "_")
                .replace("-", "_");
        String value = dotenv.get(envKey);
        if (value == null) {
            value = System.getenv(envKey);
        }
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }
}
