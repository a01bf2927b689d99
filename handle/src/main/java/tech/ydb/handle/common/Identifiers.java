package tech.ydb.handle.common;

/**
 * Quoted identifier rules for column names.
 */
public final class Identifiers {
    private static final char QUOTE = '"';

    private Identifiers() { }

    public static String quote(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 2);
        sb.append(QUOTE);
        for (int idx = 0; idx < name.length(); idx += 1) {
            char ch = name.charAt(idx);
            if (ch == QUOTE) {
                sb.append(QUOTE);
            }
            sb.append(ch);
        }
        return sb.append(QUOTE).toString();
    }

    /**
     * Converts an identifier to the column name it refers to. Quoted parts are kept as is with doubled quotes
     * collapsed, unquoted parts are folded to lower case.
     *
     * @param identifier identifier to convert
     * @return column name
     */
    public static String unquote(String identifier) {
        StringBuilder sb = new StringBuilder(identifier.length());
        boolean inQuotes = false;
        int idx = 0;
        while (idx < identifier.length()) {
            char ch = identifier.charAt(idx);
            if (inQuotes) {
                if (ch == QUOTE) {
                    if (idx + 1 < identifier.length() && identifier.charAt(idx + 1) == QUOTE) {
                        sb.append(QUOTE);
                        idx += 1;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    sb.append(ch);
                }
            } else if (ch == QUOTE) {
                inQuotes = true;
            } else {
                sb.append(Character.toLowerCase(ch));
            }
            idx += 1;
        }
        return sb.toString();
    }
}
