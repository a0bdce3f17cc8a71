package com.scidbshim.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Represents the {@code client.json} manifest located next to a client plugin's jars.
 *
 * The manifest names the {@link ScidbClient} implementation class to instantiate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientManifest {
    @JsonProperty("name")
    private String name;

    @JsonProperty("clientClass")
    private String clientClass;

    @JsonProperty("version")
    private String version;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getClientClass() {
        return clientClass;
    }

    public void setClientClass(String clientClass) {
        this.clientClass = clientClass;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }
}
