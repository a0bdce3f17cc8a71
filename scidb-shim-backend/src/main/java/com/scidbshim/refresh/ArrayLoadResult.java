package com.scidbshim.refresh;

import com.scidbshim.model.QueryId;
import com.scidbshim.service.AioQuery;
import com.scidbshim.service.ShimStatus;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Outcome of loading one catalog array. A successful load owns the AIO buffer file until
 * {@link #discard()} is called.
 */
@Data
@Builder
public class ArrayLoadResult {
    private String name;
    private ShimStatus status;
    private QueryId queryId;
    private String message;
    private long elapsedMs;
    private AioQuery aioQuery;

    public boolean isLoaded() {
        return aioQuery != null;
    }

    public Path getBufferPath() {
        return aioQuery != null ? aioQuery.getBufferPath() : null;
    }

    /**
     * Delete the buffer file, if any.
     */
    public void discard() {
        if (aioQuery != null) {
            aioQuery.close();
        }
    }
}
