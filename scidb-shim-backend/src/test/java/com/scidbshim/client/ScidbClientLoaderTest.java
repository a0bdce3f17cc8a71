package com.scidbshim.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scidbshim.config.ShimProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

import static org.assertj.core.api.Assertions.assertThat;

class ScidbClientLoaderTest {

    private ShimProperties properties;
    private ClientRegistry registry;
    private ScidbClientLoader loader;

    @BeforeEach
    void setUp() {
        properties = new ShimProperties();
        registry = new ClientRegistry();
        loader = new ScidbClientLoader(properties, new ObjectMapper(), registry);
    }

    @Test
    @DisplayName("A client registered on the classpath is used first")
    void classpathClientWins() {
        ScidbClient client = loader.load();

        assertThat(client).isInstanceOf(ScidbClientShim.class);
        assertThat(((ScidbClientShim) client).getDelegate()).isInstanceOf(FakeScidbClient.class);
        assertThat(registry.find("FakeScidbClient"))
                .hasValueSatisfying(e -> assertThat(e.getSource()).isEqualTo(ClientRegistry.Source.CLASSPATH));
    }

    @Nested
    @DisplayName("directory loading")
    class Directory {

        @TempDir
        Path root;

        @Test
        @DisplayName("Missing directory is a warning, not an error")
        void missingDirectory() {
            ScidbClientLoader.LoadResult result = new ScidbClientLoader.LoadResult();

            ScidbClient client = loader.loadFromDirectory(root.resolve("absent"), result);

            assertThat(client).isNull();
            assertThat(result.getWarnings()).singleElement().asString().contains("does not exist");
        }

        @Test
        @DisplayName("Plugin without client.json is skipped with a warning")
        void missingManifest() throws IOException {
            Files.createDirectories(root.resolve("scidb-22"));
            ScidbClientLoader.LoadResult result = new ScidbClientLoader.LoadResult();

            assertThat(loader.loadFromDirectory(root, result)).isNull();
            assertThat(result.getWarnings()).singleElement().asString().contains("Missing client.json");
        }

        @Test
        @DisplayName("Plugin without jars is skipped with a warning")
        void missingJars() throws IOException {
            Path plugin = Files.createDirectories(root.resolve("scidb-22"));
            Files.writeString(plugin.resolve("client.json"),
                    "{\"name\":\"scidb-22\",\"clientClass\":\"com.scidbshim.client.FakeScidbClient\"}");
            ScidbClientLoader.LoadResult result = new ScidbClientLoader.LoadResult();

            assertThat(loader.loadFromDirectory(root, result)).isNull();
            assertThat(result.getWarnings()).singleElement().asString().contains("No JARs found");
        }

        @Test
        @DisplayName("Manifest class is instantiated and registered")
        void loadsManifestClass() throws IOException {
            Path plugin = Files.createDirectories(root.resolve("scidb-22"));
            Files.writeString(plugin.resolve("client.json"),
                    "{\"name\":\"scidb-22\",\"clientClass\":\"com.scidbshim.client.FakeScidbClient\","
                            + "\"version\":\"22.5\",\"unknown\":true}");
            writeEmptyJar(plugin.resolve("lib").resolve("scidb-client.jar"));
            ScidbClientLoader.LoadResult result = new ScidbClientLoader.LoadResult();

            ScidbClient client = loader.loadFromDirectory(root, result);

            assertThat(client).isInstanceOf(ScidbClientShim.class);
            assertThat(result.getWarnings()).isEmpty();
            ClientRegistry.Entry entry = registry.find("scidb-22").orElseThrow();
            assertThat(entry.getSource()).isEqualTo(ClientRegistry.Source.DIRECTORY);
            assertThat(entry.getVersion()).isEqualTo("22.5");
            assertThat(entry.getJarPaths()).hasSize(1);
        }

        @Test
        @DisplayName("A class that is not a client is reported")
        void wrongClass() throws IOException {
            Path plugin = Files.createDirectories(root.resolve("bad"));
            Files.writeString(plugin.resolve("client.json"), "{\"clientClass\":\"java.lang.Object\"}");
            writeEmptyJar(plugin.resolve("x.jar"));
            ScidbClientLoader.LoadResult result = new ScidbClientLoader.LoadResult();

            assertThat(loader.loadFromDirectory(root, result)).isNull();
            assertThat(result.getWarnings()).singleElement().asString().contains("not a ScidbClient");
        }

        private void writeEmptyJar(Path jar) throws IOException {
            Files.createDirectories(jar.getParent());
            try (OutputStream out = Files.newOutputStream(jar);
                 JarOutputStream ignored = new JarOutputStream(out, new Manifest())) {
                // manifest only
            }
        }
    }
}
