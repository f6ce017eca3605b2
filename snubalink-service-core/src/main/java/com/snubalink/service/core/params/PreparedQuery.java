package com.snubalink.service.core.params;

import com.snubalink.query.Dataset;
import com.snubalink.query.SnubaQueryParams;
import com.snubalink.query.condition.Condition;
import com.snubalink.service.core.translate.SnubaTranslators;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A query ready to send: the legacy request body plus everything needed to rebuild it in another
 * wire form and to translate its results.
 *
 * @param conditions the caller's conditions followed by the ones derived from filter keys
 */
public record PreparedQuery(
        SnubaQueryParams params,
        Map<String, Object> body,
        SnubaTranslators translators,
        OrganizationScope scope,
        List<Condition> conditions,
        Instant start,
        Instant end) {

    public PreparedQuery {
        body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
        conditions = List.copyOf(conditions);
    }

    public Dataset dataset() {
        return params.getDataset();
    }
}
