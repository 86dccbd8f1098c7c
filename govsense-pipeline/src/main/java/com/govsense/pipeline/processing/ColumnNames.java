package com.govsense.pipeline.processing;

import com.govsense.pipeline.exception.SchemaMismatchException;
import com.govsense.pipeline.model.ColumnSpec;
import com.govsense.pipeline.model.DatasetSpec;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Header name normalisation shared by ingestion and cleaning.
 *
 * "  Code Région " → "code_region", "Superficie (km²)" → "superficie_km2"
 */
public final class ColumnNames {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private ColumnNames() {
    }

    public static String normalize(String header) {
        if (header == null) return "";
        String stripped = header.replace("\uFEFF", "").trim();
        String decomposed = Normalizer.normalize(stripped, Normalizer.Form.NFKD);
        String ascii = DIACRITICS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
        String snake = NON_ALNUM.matcher(ascii).replaceAll("_");
        return snake.replaceAll("^_+|_+$", "");
    }

    /** Canonical name plus every alias, all normalised */
    public static Set<String> acceptedNames(ColumnSpec column) {
        Set<String> names = new LinkedHashSet<>();
        names.add(normalize(column.getName()));
        column.getAliases().forEach(alias -> names.add(normalize(alias)));
        return names;
    }

    /**
     * Canonical column name to the source header carrying it. An exact
     * canonical match wins over an alias; aliases are tried in declared order.
     *
     * @throws SchemaMismatchException when a required column has no matching header
     */
    public static Map<String, String> mapHeader(DatasetSpec spec, Collection<String> headers) {
        Map<String, String> byNormalized = new LinkedHashMap<>();
        for (String header : headers) {
            byNormalized.putIfAbsent(normalize(header), header);
        }

        Map<String, String> headerFor = new HashMap<>();
        List<String> missing = new ArrayList<>();
        for (ColumnSpec column : spec.getColumns()) {
            String source = acceptedNames(column).stream()
                    .map(byNormalized::get)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElse(null);
            if (source != null) {
                headerFor.put(column.getName(), source);
            } else if (column.isRequired()) {
                missing.add(column.getName());
            }
        }

        if (!missing.isEmpty()) {
            throw new SchemaMismatchException("Dataset " + spec.getId() + " is missing required columns "
                    + missing + " (header: " + headers + ")");
        }
        return headerFor;
    }
}
