package org.navql.engine.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A variable-size sequence of values of the same domain,
 * written as {@code ['a', 'b', null]}.
 *
 * @param itemDomain The domain of the items
 */
public record ListDomain(Domain itemDomain) implements Domain {

    public ListDomain {
        Objects.requireNonNull(itemDomain, "List item domain cannot be null");
    }

    @Override
    public String family() {
        return "list";
    }

    @Override
    public Object parse(String text) {
        if (text == null) {
            return null;
        }
        List<Object> values = new ArrayList<>();
        for (String item : DomainText.split(text, '[', ']')) {
            values.add(itemDomain.parse(item));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        List<String> chunks = new ArrayList<>();
        for (Object item : (List<?>) value) {
            chunks.add(dumpItem(itemDomain, item));
        }
        return "[" + String.join(", ", chunks) + "]";
    }

    static String dumpItem(Domain domain, Object item) {
        if (item == null) {
            return "null";
        }
        String text = domain.dump(item);
        if (domain instanceof ListDomain || domain instanceof RecordDomain) {
            return text;
        }
        return DomainText.quote(text);
    }
}
