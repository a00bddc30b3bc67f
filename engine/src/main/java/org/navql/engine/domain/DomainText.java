package org.navql.engine.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Quoting and splitting of container literals.
 *
 * <p>Items are written as quoted strings with doubled quotes, {@code null}
 * for a missing item, and nested containers in their own brackets.
 */
final class DomainText {

    private DomainText() {
    }

    static String quote(String text) {
        if (text == null) {
            return "null";
        }
        return "'" + text.replace("'", "''") + "'";
    }

    /**
     * Splits the content of a container literal enclosed by {@code open}
     * and {@code close} into raw item strings. A {@code null} entry stands
     * for a missing item.
     */
    static List<String> split(String text, char open, char close) {
        String trimmed = text.trim();
        if (trimmed.length() < 2 || trimmed.charAt(0) != open || trimmed.charAt(trimmed.length() - 1) != close) {
            throw new DomainException("expected a literal enclosed in " + open + close + "; got '" + text + "'");
        }
        String body = trimmed.substring(1, trimmed.length() - 1).trim();
        List<String> items = new ArrayList<>();
        if (body.isEmpty()) {
            return items;
        }
        int pos = 0;
        while (true) {
            while (pos < body.length() && body.charAt(pos) == ' ') {
                pos++;
            }
            if (pos >= body.length()) {
                throw new DomainException("missing item in '" + text + "'");
            }
            char c = body.charAt(pos);
            if (c == '\'') {
                StringBuilder sb = new StringBuilder();
                pos++;
                while (true) {
                    if (pos >= body.length()) {
                        throw new DomainException("unterminated quoted item in '" + text + "'");
                    }
                    char d = body.charAt(pos);
                    if (d == '\'') {
                        if (pos + 1 < body.length() && body.charAt(pos + 1) == '\'') {
                            sb.append('\'');
                            pos += 2;
                            continue;
                        }
                        pos++;
                        break;
                    }
                    sb.append(d);
                    pos++;
                }
                items.add(sb.toString());
            } else if (c == '(' || c == '[') {
                char end = c == '(' ? ')' : ']';
                int depth = 0;
                int start = pos;
                boolean quoted = false;
                for (; pos < body.length(); pos++) {
                    char d = body.charAt(pos);
                    if (d == '\'') {
                        quoted = !quoted;
                    } else if (!quoted && d == c) {
                        depth++;
                    } else if (!quoted && d == end) {
                        depth--;
                        if (depth == 0) {
                            pos++;
                            break;
                        }
                    }
                }
                if (depth != 0) {
                    throw new DomainException("unbalanced brackets in '" + text + "'");
                }
                items.add(body.substring(start, pos));
            } else {
                int start = pos;
                while (pos < body.length() && body.charAt(pos) != ',') {
                    pos++;
                }
                String raw = body.substring(start, pos).trim();
                items.add(raw.equals("null") ? null : raw);
            }
            while (pos < body.length() && body.charAt(pos) == ' ') {
                pos++;
            }
            if (pos >= body.length()) {
                break;
            }
            if (body.charAt(pos) != ',') {
                throw new DomainException("expected ',' in '" + text + "' at position " + pos);
            }
            pos++;
        }
        return items;
    }
}
