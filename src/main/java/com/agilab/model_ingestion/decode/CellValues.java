package com.agilab.model_ingestion.decode;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Type inference for text cells: integer, then decimal, then boolean, else the text itself.
 */
final class CellValues {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d{1,18}");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private CellValues() {
    }

    static Object infer(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        var text = raw.trim();
        if (INTEGER.matcher(text).matches()) {
            return Long.parseLong(text);
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        if ("true".equals(text) || "TRUE".equals(text)) {
            return Boolean.TRUE;
        }
        if ("false".equals(text) || "FALSE".equals(text)) {
            return Boolean.FALSE;
        }
        return text;
    }
}
