package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    @JsonAlias({"database_path", "path"}) String databasePath
) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.mnemo/mnemo.db");
    }
}
