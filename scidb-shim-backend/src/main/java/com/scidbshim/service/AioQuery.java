package com.scidbshim.service;

import com.scidbshim.model.QueryId;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A query whose output the backend saves as an Arrow stream into a local buffer file through
 * the {@code aio_save} operator.
 *
 * <p>The buffer file is created up front and deleted by {@link #close()}. Reading the Arrow
 * data is left to the consumer.
 */
@Slf4j
public class AioQuery implements AutoCloseable {
    private final Path bufferPath;
    private volatile QueryId queryId = QueryId.NONE;

    AioQuery(Path bufferPath) {
        this.bufferPath = bufferPath;
    }

    /**
     * Create a query with a fresh temporary buffer file.
     *
     * @return new AIO query
     * @throws ShimQueryException with {@link ShimStatus#IO_ERROR} if the buffer file cannot be created
     */
    public static AioQuery create() {
        try {
            return new AioQuery(Files.createTempFile("scidb-shim-", ".arrow"));
        } catch (IOException e) {
            throw new ShimQueryException(ShimStatus.IO_ERROR, "cannot create buffer file: " + e.getMessage(), e);
        }
    }

    /**
     * Wrap an AFL expression so its output lands in the buffer file.
     *
     * @param afl AFL expression producing an array
     * @return {@code aio_save} query text
     */
    public String wrap(String afl) {
        return "aio_save(" + afl + ", '" + bufferPath.toAbsolutePath() + "', format:'arrow')";
    }

    public Path getBufferPath() {
        return bufferPath;
    }

    public QueryId getQueryId() {
        return queryId;
    }

    void setQueryId(QueryId queryId) {
        this.queryId = queryId != null ? queryId : QueryId.NONE;
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(bufferPath);
        } catch (IOException e) {
            log.warn("Failed to delete AIO buffer file: path={}", bufferPath, e);
        }
    }
}
