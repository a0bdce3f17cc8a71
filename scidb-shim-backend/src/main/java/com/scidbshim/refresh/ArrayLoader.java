package com.scidbshim.refresh;

import com.scidbshim.model.QueryId;
import com.scidbshim.service.AioQuery;
import com.scidbshim.service.ScidbConnection;
import com.scidbshim.service.ScidbConnectionFactory;
import com.scidbshim.service.ShimQueryException;
import com.scidbshim.service.ShimStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every catalog array's AFL through {@code aio_save} on one session.
 *
 * <p>Arrays are loaded in catalog order. A failing array is recorded and the rest still run;
 * if the session cannot be opened every array is recorded with the connect failure.
 */
@Component
public class ArrayLoader {
    private static final Logger log = LoggerFactory.getLogger(ArrayLoader.class);

    private final ScidbConnectionFactory connectionFactory;

    public ArrayLoader(ScidbConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    /**
     * Load the given arrays with the configured connection settings.
     *
     * @param arrays array definitions
     * @return one result per array, in the same order
     */
    public List<ArrayLoadResult> loadAll(List<ArrayDefinition> arrays) {
        if (arrays == null || arrays.isEmpty()) {
            return List.of();
        }

        long start = System.nanoTime();
        List<ArrayLoadResult> results = new ArrayList<>();
        try (ScidbConnection conn = connectionFactory.openDefault()) {
            for (ArrayDefinition def : arrays) {
                results.add(loadOne(conn, def));
            }
        } catch (ShimQueryException e) {
            log.error("Cannot open SciDB session for array load: status={}, error={}", e.getStatus(), e.getMessage());
            for (ArrayDefinition def : arrays.subList(results.size(), arrays.size())) {
                results.add(ArrayLoadResult.builder()
                        .name(def.getName())
                        .status(e.getStatus())
                        .queryId(QueryId.NONE)
                        .message(e.getMessage())
                        .build());
            }
        }
        log.info("Array load finished: arrays={}, elapsed_ms={}", arrays.size(), elapsedMs(start));
        return results;
    }

    ArrayLoadResult loadOne(ScidbConnection conn, ArrayDefinition def) {
        long start = System.nanoTime();
        try {
            AioQuery aio = conn.executeAioQuery(def.getAfl());
            long elapsed = elapsedMs(start);
            log.info("Executed SciDB query {} for array {} in {} ms", aio.getQueryId(), def.getName(), elapsed);
            return ArrayLoadResult.builder()
                    .name(def.getName())
                    .status(ShimStatus.COMPLETION_SUCCESS)
                    .queryId(aio.getQueryId())
                    .message("")
                    .elapsedMs(elapsed)
                    .aioQuery(aio)
                    .build();
        } catch (ShimQueryException e) {
            log.error("Array load failed: array={}, status={}, error={}", def.getName(), e.getStatus(), e.getMessage());
            return ArrayLoadResult.builder()
                    .name(def.getName())
                    .status(e.getStatus())
                    .queryId(QueryId.NONE)
                    .message(e.getMessage())
                    .elapsedMs(elapsedMs(start))
                    .build();
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
