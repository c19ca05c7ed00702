package com.tcrimer.db.pool;

import com.tcrimer.db.BackendKind;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class PoolStats {
    BackendKind backend;
    int idle;
    int inUse;
    int maxSize;
    long opened;
    long retired;
    long waitTimeouts;

    public Map<String, Object> toFields() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("backend", backend.name());
        out.put("idle", idle);
        out.put("in_use", inUse);
        out.put("max_size", maxSize);
        out.put("opened", opened);
        out.put("retired", retired);
        out.put("wait_timeouts", waitTimeouts);
        return out;
    }
}
