package com.snubalink.query;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Public field name to physical column tables, one per dataset. Names missing from a table are
 * treated as tags by {@link ColumnResolvers}.
 */
final class DatasetColumns {

    static final String MEASUREMENTS_KEY = "measurements_key";
    static final String SPAN_OP_BREAKDOWNS_KEY = "span_op_breakdowns_key";

    /** Columns every dataset exposes under their own name. */
    static final Set<String> ALWAYS_NATIVE = Set.of("group_id", "project_id", "start", "end");

    private static final Map<Dataset, Map<String, String>> ALIASES = new EnumMap<>(Dataset.class);

    static {
        Map<String, String> events = new LinkedHashMap<>();
        events.put("id", "event_id");
        events.put("project.id", "project_id");
        events.put("issue.id", "group_id");
        events.put("timestamp", "timestamp");
        events.put("time", "time");
        events.put("platform", "platform");
        events.put("message", "message");
        events.put("title", "title");
        events.put("location", "location");
        events.put("culprit", "culprit");
        events.put("type", "type");
        events.put("event.type", "type");
        events.put("version", "version");
        events.put("environment", "environment");
        events.put("transaction", "transaction");
        events.put("release", "tags[sentry:release]");
        events.put("dist", "tags[sentry:dist]");
        events.put("user", "tags[sentry:user]");
        events.put("user.id", "user_id");
        events.put("user.email", "email");
        events.put("user.username", "username");
        events.put("user.ip", "ip_address");
        events.put("sdk.name", "sdk_name");
        events.put("sdk.version", "sdk_version");
        events.put("http.method", "http_method");
        events.put("http.referer", "http_referer");
        events.put("http.url", "tags[url]");
        events.put("os.build", "os_build");
        events.put("os.kernel_version", "os_kernel_version");
        events.put("device.name", "device_name");
        events.put("device.brand", "device_brand");
        events.put("device.locale", "device_locale");
        events.put("device.uuid", "device_uuid");
        events.put("device.arch", "device_arch");
        events.put("device.battery_level", "device_battery_level");
        events.put("device.orientation", "device_orientation");
        events.put("device.simulator", "device_simulator");
        events.put("device.online", "device_online");
        events.put("device.charging", "device_charging");
        events.put("geo.country_code", "geo_country_code");
        events.put("geo.region", "geo_region");
        events.put("geo.city", "geo_city");
        events.put("error.type", "exception_stacks.type");
        events.put("error.value", "exception_stacks.value");
        events.put("error.mechanism", "exception_stacks.mechanism_type");
        events.put("error.handled", "exception_stacks.mechanism_handled");
        events.put("stack.abs_path", "exception_frames.abs_path");
        events.put("stack.filename", "exception_frames.filename");
        events.put("stack.package", "exception_frames.package");
        events.put("stack.module", "exception_frames.module");
        events.put("stack.function", "exception_frames.function");
        events.put("stack.in_app", "exception_frames.in_app");
        events.put("stack.colno", "exception_frames.colno");
        events.put("stack.lineno", "exception_frames.lineno");
        events.put("stack.stack_level", "exception_frames.stack_level");
        events.put("contexts.key", "contexts.key");
        events.put("contexts.value", "contexts.value");

        Map<String, String> transactions = new LinkedHashMap<>();
        transactions.put("id", "event_id");
        transactions.put("project.id", "project_id");
        transactions.put("title", "transaction_name");
        transactions.put("message", "transaction_name");
        transactions.put("transaction", "transaction_name");
        transactions.put("transaction.op", "transaction_op");
        transactions.put("transaction.hash", "transaction_hash");
        transactions.put("transaction.duration", "duration");
        transactions.put("transaction.status", "transaction_status");
        transactions.put("timestamp", "finish_ts");
        transactions.put("time", "bucketed_end");
        transactions.put("trace", "trace_id");
        transactions.put("trace.span", "span_id");
        transactions.put("trace.parent_span", "parent_span_id");
        transactions.put("environment", "environment");
        transactions.put("release", "release");
        transactions.put("dist", "dist");
        transactions.put("platform", "platform");
        transactions.put("user", "user");
        transactions.put("user.id", "user_id");
        transactions.put("user.email", "user_email");
        transactions.put("user.username", "user_name");
        transactions.put("user.ip", "ip_address");
        transactions.put("sdk.name", "sdk_name");
        transactions.put("sdk.version", "sdk_version");
        transactions.put("http.method", "http_method");
        transactions.put("http.referer", "http_referer");
        transactions.put("contexts.key", "contexts.key");
        transactions.put("contexts.value", "contexts.value");
        transactions.put(MEASUREMENTS_KEY, "measurements.key");
        transactions.put("measurements_value", "measurements.value");
        transactions.put(SPAN_OP_BREAKDOWNS_KEY, "span_op_breakdowns.key");
        transactions.put("span_op_breakdowns_value", "span_op_breakdowns.value");
        transactions.put("spans_op", "spans.op");
        transactions.put("spans_group", "spans.group");
        transactions.put("spans_exclusive_time", "spans.exclusive_time");

        // Discover reads both entities: transaction names win where the two tables disagree.
        Map<String, String> discover = new LinkedHashMap<>(events);
        discover.putAll(transactions);
        discover.put("issue.id", "group_id");
        discover.put("timestamp", "timestamp");
        discover.put("time", "time");
        discover.put("event.type", "type");

        Map<String, String> sessions = new LinkedHashMap<>();
        sessions.put("project_id", "project_id");
        sessions.put("project", "project_id");
        sessions.put("environment", "environment");
        sessions.put("release", "release");
        sessions.put("timestamp", "started");
        sessions.put("bucketed_started", "bucketed_started");
        sessions.put("duration_quantiles", "duration_quantiles");
        sessions.put("duration_avg", "duration_avg");
        sessions.put("sessions", "sessions");
        sessions.put("sessions_crashed", "sessions_crashed");
        sessions.put("sessions_abnormal", "sessions_abnormal");
        sessions.put("sessions_errored", "sessions_errored");
        sessions.put("users", "users");
        sessions.put("users_crashed", "users_crashed");
        sessions.put("users_abnormal", "users_abnormal");
        sessions.put("users_errored", "users_errored");

        Map<String, String> outcomes = new LinkedHashMap<>();
        outcomes.put("org_id", "org_id");
        outcomes.put("project_id", "project_id");
        outcomes.put("key_id", "key_id");
        outcomes.put("timestamp", "timestamp");
        outcomes.put("time", "time");
        outcomes.put("outcome", "outcome");
        outcomes.put("reason", "reason");
        outcomes.put("category", "category");
        outcomes.put("quantity", "quantity");
        outcomes.put("times_seen", "times_seen");

        Map<String, String> outcomesRaw = new LinkedHashMap<>(outcomes);
        outcomesRaw.remove("times_seen");
        outcomesRaw.put("event_id", "event_id");

        register(Dataset.EVENTS, events);
        register(Dataset.TRANSACTIONS, transactions);
        register(Dataset.DISCOVER, discover);
        register(Dataset.SESSIONS, sessions);
        register(Dataset.OUTCOMES, outcomes);
        register(Dataset.OUTCOMES_RAW, outcomesRaw);
    }

    private DatasetColumns() {}

    private static void register(Dataset dataset, Map<String, String> aliases) {
        ALIASES.put(dataset, Collections.unmodifiableMap(aliases));
    }

    static Map<String, String> aliases(Dataset dataset) {
        return ALIASES.get(dataset);
    }
}
