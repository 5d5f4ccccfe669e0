package org.oldskooler.pgschema4j.query;

import org.oldskooler.pgschema4j.mapping.Table;

import java.util.ArrayList;
import java.util.List;

public final class Identifiers {
    private Identifiers() {}

    public static String quote(String ident) {
        return "\"" + ident.replace("\"", "\"\"") + "\"";
    }

    /** {@code "search_path"."name"} */
    public static String qualified(Table table) {
        return qualified(table.getSearchPath(), table.getName());
    }

    public static String qualified(String searchPath, String name) {
        return quote(searchPath) + "." + quote(name);
    }

    public static String quoteAll(List<String> idents) {
        List<String> out = new ArrayList<>(idents.size());
        for (String s : idents) out.add(quote(s));
        return String.join(", ", out);
    }
}
