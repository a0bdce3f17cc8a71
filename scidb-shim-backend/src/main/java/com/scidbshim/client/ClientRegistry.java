package com.scidbshim.client;

import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of SciDB client implementations known to the backend.
 *
 * Entries are populated from:
 * - Implementations visible on the application classpath
 * - Directory-provided plugins under {@code <shim.client.dir>/<name>/}
 */
@Component
public class ClientRegistry {

    /**
     * Describes where a client came from.
     */
    public enum Source {
        CLASSPATH,
        DIRECTORY
    }

    /**
     * A registry entry for one client implementation.
     */
    public static class Entry {
        private final String name;
        private final Source source;
        private final String clientClass;
        private final String version;
        private final List<String> jarPaths;
        private final OffsetDateTime loadedAt;

        /**
         * Create a registry entry.
         *
         * @param name client name
         * @param source source
         * @param clientClass implementation class name
         * @param version version from the manifest (may be null)
         * @param jarPaths jar paths (empty for classpath clients)
         * @param loadedAt load timestamp
         */
        public Entry(
                String name,
                Source source,
                String clientClass,
                String version,
                List<String> jarPaths,
                OffsetDateTime loadedAt
        ) {
            this.name = name;
            this.source = source;
            this.clientClass = clientClass;
            this.version = version;
            this.jarPaths = jarPaths != null ? List.copyOf(jarPaths) : List.of();
            this.loadedAt = loadedAt;
        }

        public String getName() {
            return name;
        }

        public Source getSource() {
            return source;
        }

        public String getClientClass() {
            return clientClass;
        }

        public String getVersion() {
            return version;
        }

        public List<String> getJarPaths() {
            return jarPaths;
        }

        public OffsetDateTime getLoadedAt() {
            return loadedAt;
        }
    }

    private final Map<String, Entry> entriesByName = new ConcurrentHashMap<>();

    /**
     * Insert or replace an entry.
     *
     * @param entry entry
     */
    public void upsert(Entry entry) {
        if (entry == null || entry.getName() == null) {
            return;
        }
        entriesByName.put(entry.getName().toLowerCase(Locale.ROOT), entry);
    }

    /**
     * List all entries ordered by name.
     *
     * @return entries
     */
    public List<Entry> list() {
        List<Entry> entries = new ArrayList<>(entriesByName.values());
        entries.sort((a, b) -> a.getName().compareToIgnoreCase(b.getName()));
        return Collections.unmodifiableList(entries);
    }

    public Optional<Entry> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entriesByName.get(name.toLowerCase(Locale.ROOT)));
    }
}
