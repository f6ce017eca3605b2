package com.snubalink.query;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registry of column resolvers, one per dataset.
 *
 * <p>Resolution order: tagged names and quoted literals pass through, then the dataset alias
 * table, then the few columns every dataset exposes natively, then the measurement and span-op
 * breakdown namespaces, and finally the generic {@code tags[...]} form. A customer tag named like
 * some other physical column still resolves to {@code tags[...]}.
 */
public final class ColumnResolvers {

    static final Pattern QUOTED_LITERAL = Pattern.compile("^'.*'$");
    static final Pattern MEASUREMENT = Pattern.compile("^measurements\\.([a-zA-Z0-9-_.]+)$");
    static final Pattern SPAN_OP_BREAKDOWN = Pattern.compile("^spans\\.([a-zA-Z0-9-_.]+)$");

    private static final Map<Dataset, ColumnResolver> RESOLVERS = new EnumMap<>(Dataset.class);

    static {
        for (Dataset dataset : Dataset.values()) {
            RESOLVERS.put(dataset, name -> resolve(dataset, name));
        }
    }

    private ColumnResolvers() {}

    public static ColumnResolver forDataset(Dataset dataset) {
        ColumnResolver resolver = RESOLVERS.get(dataset);
        if (resolver == null) {
            throw new IllegalArgumentException("No column resolver for dataset " + dataset);
        }
        return resolver;
    }

    public static boolean isQuotedLiteral(String name) {
        return name != null && QUOTED_LITERAL.matcher(name).matches();
    }

    /** Returns the lower-cased measurement name of {@code measurements.<name>}, or null. */
    public static String measurementName(String name) {
        Matcher m = MEASUREMENT.matcher(name);
        return m.matches() ? m.group(1).toLowerCase(Locale.ROOT) : null;
    }

    /** Returns {@code ops.<name>} for {@code spans.<name>}, or null. */
    public static String spanOpBreakdownName(String name) {
        Matcher m = SPAN_OP_BREAKDOWN.matcher(name);
        return m.matches() ? "ops." + m.group(1).toLowerCase(Locale.ROOT) : null;
    }

    static String resolve(Dataset dataset, String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        if (name.startsWith("tags[") || isQuotedLiteral(name)) {
            return name;
        }
        String aliased = dataset.aliases().get(name);
        if (aliased != null) {
            return aliased;
        }
        // No customer tag may shadow these, whatever the dataset.
        if (DatasetColumns.ALWAYS_NATIVE.contains(name)) {
            return name;
        }
        if (dataset.supportsMeasurements()) {
            String measurement = measurementName(name);
            if (measurement != null) {
                return "measurements[" + measurement + "]";
            }
        }
        if (dataset.supportsSpanOpBreakdowns()) {
            String breakdown = spanOpBreakdownName(name);
            if (breakdown != null) {
                return "span_op_breakdowns[" + breakdown + "]";
            }
        }
        // Already rewritten measurement / breakdown columns.
        if (name.startsWith("measurements[") || name.startsWith("span_op_breakdowns[")) {
            return name;
        }
        return "tags[" + name + "]";
    }
}
