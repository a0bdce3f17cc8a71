package com.scidbshim.refresh;

import com.scidbshim.config.ShimProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Operator-supplied list of arrays to load, read from the YAML file at {@code shim.arrays.config}:
 *
 * <pre>
 * arrays:
 *   - name: temperatures
 *     afl: filter(readings, kind = 'temp')
 * </pre>
 */
@Component
public class ArrayCatalog {
    private static final Logger log = LoggerFactory.getLogger(ArrayCatalog.class);

    private final ShimProperties properties;

    private volatile List<ArrayDefinition> arrays = List.of();

    public ArrayCatalog(ShimProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void loadConfig() {
        reload();
    }

    /**
     * Re-read the catalog file. The new list replaces the old one in a single swap; if the
     * file cannot be read or is invalid the previous list stays in place.
     */
    public void reload() {
        String config = properties.getArrays().getConfig();
        if (config == null || config.isBlank()) {
            log.info("No arrays catalog configured (shim.arrays.config is blank)");
            arrays = List.of();
            return;
        }

        try {
            List<ArrayDefinition> loaded = load(Paths.get(config));
            arrays = loaded;
            log.info("Loaded arrays catalog: path={}, arrays={}", config, loaded.size());
        } catch (Exception e) {
            log.error("Failed to load arrays catalog: path={}", config, e);
        }
    }

    /**
     * Parse and validate a catalog file.
     *
     * @param path YAML file
     * @return array definitions in file order
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if an entry has no name or AFL, or a name repeats
     */
    public List<ArrayDefinition> load(Path path) throws IOException {
        ArrayCatalogFile file;
        try (InputStream in = Files.newInputStream(path)) {
            file = new org.yaml.snakeyaml.Yaml().loadAs(in, ArrayCatalogFile.class);
        }
        if (file == null || file.getArrays() == null) {
            return List.of();
        }

        Set<String> names = new HashSet<>();
        for (ArrayDefinition def : file.getArrays()) {
            if (def == null || def.getName() == null || def.getName().isBlank()) {
                throw new IllegalArgumentException("Array entry without a name in " + path);
            }
            if (def.getAfl() == null || def.getAfl().isBlank()) {
                throw new IllegalArgumentException("Array '" + def.getName() + "' has no afl in " + path);
            }
            if (!names.add(def.getName())) {
                throw new IllegalArgumentException("Duplicate array name '" + def.getName() + "' in " + path);
            }
        }
        return List.copyOf(file.getArrays());
    }

    public List<ArrayDefinition> getArrays() {
        return arrays;
    }
}
