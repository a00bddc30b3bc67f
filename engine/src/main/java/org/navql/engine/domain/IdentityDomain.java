package org.navql.engine.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The type of row identities: a dot-separated sequence of labels,
 * where a label is a value of its own domain or a nested identity
 * in parentheses, e.g. {@code ns.(ns.astro).'a b'}.
 *
 * @param labels The domains of the labels
 */
public record IdentityDomain(List<Domain> labels) implements Domain {

    private static final Pattern PLAIN = Pattern.compile("[A-Za-z0-9_-]+");

    public IdentityDomain {
        Objects.requireNonNull(labels, "Identity labels cannot be null");
        labels = List.copyOf(labels);
    }

    @Override
    public String family() {
        return "id";
    }

    public int width() {
        int width = 0;
        for (Domain label : labels) {
            width += label instanceof IdentityDomain nested ? nested.width() : 1;
        }
        return width;
    }

    @Override
    public Object parse(String text) {
        if (text == null) {
            return null;
        }
        List<String> chunks = splitLabels(text.trim());
        if (chunks.size() != labels.size()) {
            throw new DomainException("ill-formed locator: expected " + labels.size() + " labels; got '" + text + "'");
        }
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            String chunk = chunks.get(i);
            Domain label = labels.get(i);
            if (label instanceof IdentityDomain) {
                if (!chunk.startsWith("(") || !chunk.endsWith(")")) {
                    throw new DomainException("ill-formed locator: expected a nested identity; got '" + chunk + "'");
                }
                values.add(label.parse(chunk.substring(1, chunk.length() - 1)));
            } else if (chunk.startsWith("'")) {
                values.add(label.parse(chunk.substring(1, chunk.length() - 1).replace("''", "'")));
            } else {
                values.add(label.parse(chunk));
            }
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        List<?> values = (List<?>) value;
        List<String> chunks = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            Domain label = labels.get(i);
            String text = label.dump(values.get(i));
            if (label instanceof IdentityDomain) {
                chunks.add("(" + text + ")");
            } else if (PLAIN.matcher(text).matches()) {
                chunks.add(text);
            } else {
                chunks.add(DomainText.quote(text));
            }
        }
        return String.join(".", chunks);
    }

    private static List<String> splitLabels(String text) {
        List<String> chunks = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
            } else if (!quoted && depth == 0 && c == '.') {
                chunks.add(text.substring(start, i));
                start = i + 1;
            }
        }
        if (quoted || depth != 0) {
            throw new DomainException("ill-formed locator: '" + text + "'");
        }
        chunks.add(text.substring(start));
        return chunks;
    }
}
