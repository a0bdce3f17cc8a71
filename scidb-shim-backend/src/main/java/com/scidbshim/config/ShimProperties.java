package com.scidbshim.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "shim")
public class ShimProperties {

    @Valid
    @NotNull(message = "scidb settings are required")
    private Scidb scidb = new Scidb();

    @Valid
    @NotNull(message = "client settings are required")
    private Client client = new Client();

    @Valid
    @NotNull(message = "arrays settings are required")
    private Arrays arrays = new Arrays();

    /**
     * Capacity in bytes of the error buffer used by the int-coded client API.
     */
    @Min(value = 2, message = "error buffer must hold at least one byte of text")
    private int errorBufferSize = 4096;

    @Data
    public static class Scidb {
        @NotBlank(message = "SciDB host is required")
        private String host = "localhost";

        @Min(1)
        @Max(65535)
        private int port = 1239;

        private String username;
        private String password;
        private boolean admin = false;
    }

    @Data
    public static class Client {
        private boolean autoLoad = true;
        private String dir = "scidb_client";
    }

    @Data
    public static class Arrays {
        /**
         * Path of the YAML file listing the arrays to load. Loading is skipped when blank.
         */
        private String config;

        /**
         * Seconds between catalog refreshes; 0 disables the refresher.
         */
        @Min(0)
        private int refreshIntervalSec = 0;
    }
}
