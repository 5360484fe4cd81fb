package com.ctdl.scout.cli;

import com.ctdl.scout.service.catalog.ExtensionCatalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a catalog as {@code <extensions>: <name>} rows, extensions left-aligned in four columns.
 */
public final class FileTypeTable {

    private FileTypeTable() {
    }

    public static List<String> render(ExtensionCatalog catalog) {
        List<String> rows = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : catalog.entries().entrySet()) {
            rows.add(String.format("%-4s: %s", String.join(", ", entry.getValue()), entry.getKey()));
        }
        return rows;
    }
}
