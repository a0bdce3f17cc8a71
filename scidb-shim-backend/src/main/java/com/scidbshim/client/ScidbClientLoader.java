package com.scidbshim.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scidbshim.config.ShimProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates the {@link ScidbClient} implementation to use.
 *
 * <p>An implementation on the application classpath (registered through
 * {@code META-INF/services/com.scidbshim.client.ScidbClient}) wins. Otherwise the loader scans
 * {@code <shim.client.dir>/<name>/} directories, reads {@code client.json}, loads the JARs and
 * instantiates the manifest's {@code clientClass}.
 */
@Service
public class ScidbClientLoader {

    private static final Logger log = LoggerFactory.getLogger(ScidbClientLoader.class);

    private static final String MANIFEST_FILE = "client.json";

    private final ShimProperties properties;
    private final ObjectMapper objectMapper;
    private final ClientRegistry clientRegistry;

    /**
     * Create a client loader.
     *
     * @param properties shim configuration
     * @param objectMapper Jackson object mapper
     * @param clientRegistry registry
     */
    public ScidbClientLoader(ShimProperties properties, ObjectMapper objectMapper, ClientRegistry clientRegistry) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clientRegistry = clientRegistry;
    }

    /**
     * Load the client to use for all sessions.
     *
     * @return client wrapped in a {@link ScidbClientShim}
     * @throws IllegalStateException if no implementation can be found
     */
    public ScidbClient load() {
        LoadResult result = new LoadResult();

        ScidbClient client = loadFromClasspath(result);
        if (client == null) {
            if (properties.getClient().isAutoLoad()) {
                client = loadFromDirectory(Paths.get(properties.getClient().getDir()), result);
            } else {
                log.info("SciDB client directory auto-load is DISABLED");
            }
        }

        for (String w : result.getWarnings()) {
            log.warn("SciDB client load warning: {}", w);
        }

        if (client == null) {
            throw new IllegalStateException(
                    "No SciDB client implementation found on the classpath or under: " + properties.getClient().getDir()
            );
        }
        return client;
    }

    ScidbClient loadFromClasspath(LoadResult result) {
        ClassLoader loader = ScidbClientLoader.class.getClassLoader();
        ScidbClient client = firstService(loader, result);
        if (client == null) {
            return null;
        }

        String clientClass = client.getClass().getName();
        clientRegistry.upsert(new ClientRegistry.Entry(
                client.getClass().getSimpleName(),
                ClientRegistry.Source.CLASSPATH,
                clientClass,
                null,
                List.of(),
                OffsetDateTime.now()
        ));
        log.info("Using SciDB client from classpath (clientClass={})", clientClass);
        return new ScidbClientShim(client, loader);
    }

    ScidbClient loadFromDirectory(Path root, LoadResult result) {
        if (root == null || !Files.isDirectory(root)) {
            result.addWarning("SciDB client directory does not exist or is not a directory: " + root);
            return null;
        }

        List<Path> pluginDirs;
        try (Stream<Path> stream = Files.list(root)) {
            pluginDirs = stream.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            result.addWarning("Failed to list SciDB client directory: " + e.getMessage());
            return null;
        }

        for (Path pluginDir : pluginDirs) {
            String name = pluginDir.getFileName() != null ? pluginDir.getFileName().toString() : "";
            if (name.isBlank()) {
                continue;
            }
            try {
                ScidbClient client = loadPluginDirectory(name, pluginDir, result);
                if (client != null) {
                    return client;
                }
            } catch (Exception e) {
                result.addWarning("Failed to load SciDB client directory '" + name + "': " + e.getMessage());
            }
        }
        return null;
    }

    private ScidbClient loadPluginDirectory(String name, Path pluginDir, LoadResult result) throws Exception {
        Path manifestPath = pluginDir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifestPath)) {
            result.addWarning("Missing " + MANIFEST_FILE + " for SciDB client '" + name + "' under: " + manifestPath);
            return null;
        }

        ClientManifest manifest;
        try (InputStream in = Files.newInputStream(manifestPath)) {
            manifest = objectMapper.readValue(in, ClientManifest.class);
        }
        if (manifest == null || manifest.getClientClass() == null || manifest.getClientClass().isBlank()) {
            result.addWarning("Missing clientClass in " + MANIFEST_FILE + " for SciDB client '" + name + "'");
            return null;
        }

        List<Path> jarFiles = listJarFiles(pluginDir);
        if (jarFiles.isEmpty()) {
            result.addWarning("No JARs found for SciDB client '" + name + "' under: " + pluginDir);
            return null;
        }

        List<URL> urls = new ArrayList<>();
        for (Path jar : jarFiles) {
            urls.add(jar.toUri().toURL());
        }
        URLClassLoader loader = new URLClassLoader(urls.toArray(new URL[0]), ScidbClientLoader.class.getClassLoader());

        Class<?> clazz = Class.forName(manifest.getClientClass(), true, loader);
        Object obj = clazz.getDeclaredConstructor().newInstance();
        if (!(obj instanceof ScidbClient)) {
            throw new IllegalArgumentException("Configured clientClass is not a ScidbClient: " + manifest.getClientClass());
        }

        String entryName = manifest.getName() != null && !manifest.getName().isBlank() ? manifest.getName() : name;
        clientRegistry.upsert(new ClientRegistry.Entry(
                entryName,
                ClientRegistry.Source.DIRECTORY,
                manifest.getClientClass(),
                manifest.getVersion(),
                jarFiles.stream().map(p -> p.toAbsolutePath().toString()).toList(),
                OffsetDateTime.now()
        ));
        log.info("Loaded SciDB client (name={}, clientClass={}, jars={})", entryName, manifest.getClientClass(), jarFiles.size());
        return new ScidbClientShim((ScidbClient) obj, loader);
    }

    private ScidbClient firstService(ClassLoader loader, LoadResult result) {
        try {
            Iterator<ScidbClient> it = ServiceLoader.load(ScidbClient.class, loader).iterator();
            if (it.hasNext()) {
                return it.next();
            }
        } catch (ServiceConfigurationError e) {
            result.addWarning("Invalid ScidbClient service registration: " + e.getMessage());
        }
        return null;
    }

    private List<Path> listJarFiles(Path dir) throws IOException {
        try (Stream<Path> stream = Files.walk(dir, 2)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName() != null)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".jar"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Warnings collected during one load.
     */
    public static class LoadResult {
        private final List<String> warnings = new ArrayList<>();

        public void addWarning(String warning) {
            if (warning != null && !warning.isBlank()) {
                warnings.add(warning);
            }
        }

        public List<String> getWarnings() {
            return List.copyOf(warnings);
        }
    }
}
