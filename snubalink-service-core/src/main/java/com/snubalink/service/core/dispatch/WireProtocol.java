package com.snubalink.service.core.dispatch;

import java.util.List;

/** How a batch of requests is put on the wire. One batch always uses a single protocol. */
public enum WireProtocol {
    /** Positional JSON body posted to {@code /query}. */
    LEGACY_JSON,
    /** Structured query built by the caller, posted to {@code /{dataset}/snql}. */
    SNQL,
    /** Legacy query converted to a structured one and posted with {@code legacy: true}. */
    LEGACY_AS_SNQL;

    /**
     * @throws IllegalArgumentException when the batch mixes legacy and structured requests
     */
    public static WireProtocol forBatch(List<SnubaRequest> requests, boolean useSnql) {
        if (requests.isEmpty()) {
            return useSnql ? LEGACY_AS_SNQL : LEGACY_JSON;
        }
        boolean structured = requests.get(0).isSnql();
        for (SnubaRequest request : requests) {
            if (request.isSnql() != structured) {
                throw new IllegalArgumentException("Cannot mix legacy and SnQL queries in one batch");
            }
        }
        if (structured) {
            return SNQL;
        }
        return useSnql ? LEGACY_AS_SNQL : LEGACY_JSON;
    }
}
