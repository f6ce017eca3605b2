package com.snubalink.service.core.dispatch;

import com.snubalink.service.core.params.PreparedQuery;
import com.snubalink.service.core.snql.SnqlQuery;
import java.util.Objects;

/** One query of a batch, either a prepared legacy query or a structured one. */
public final class SnubaRequest {

    private final PreparedQuery legacy;
    private final SnqlQuery snql;

    private SnubaRequest(PreparedQuery legacy, SnqlQuery snql) {
        this.legacy = legacy;
        this.snql = snql;
    }

    public static SnubaRequest legacy(PreparedQuery prepared) {
        return new SnubaRequest(Objects.requireNonNull(prepared, "prepared"), null);
    }

    public static SnubaRequest snql(SnqlQuery query) {
        return new SnubaRequest(null, Objects.requireNonNull(query, "query"));
    }

    public boolean isSnql() {
        return snql != null;
    }

    /** @throws IllegalStateException for structured requests */
    public PreparedQuery legacyQuery() {
        if (legacy == null) {
            throw new IllegalStateException("Not a legacy request");
        }
        return legacy;
    }

    /** @throws IllegalStateException for legacy requests */
    public SnqlQuery snqlQuery() {
        if (snql == null) {
            throw new IllegalStateException("Not a SnQL request");
        }
        return snql;
    }

    public String dataset() {
        return snql != null ? snql.getDataset() : legacy.dataset().value();
    }

    @Override
    public String toString() {
        return snql != null ? "SnubaRequest{snql=" + snql.toSnql() + '}' : "SnubaRequest{legacy=" + legacy.body() + '}';
    }
}
