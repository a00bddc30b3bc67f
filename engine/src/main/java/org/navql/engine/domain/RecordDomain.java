package org.navql.engine.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A fixed-shape tuple of named fields, written as {@code ('a', 1)}.
 *
 * @param fields Field names and domains, in order
 */
public record RecordDomain(List<Field> fields) implements Domain {

    /**
     * A named slot of a record.
     */
    public record Field(String name, Domain domain) {
        public Field {
            Objects.requireNonNull(domain, "Field domain cannot be null");
        }
    }

    public RecordDomain {
        Objects.requireNonNull(fields, "Record fields cannot be null");
        fields = List.copyOf(fields);
    }

    @Override
    public String family() {
        return "record";
    }

    @Override
    public Object parse(String text) {
        if (text == null) {
            return null;
        }
        List<String> items = DomainText.split(text, '(', ')');
        if (items.size() != fields.size()) {
            throw new DomainException("expected " + fields.size() + " fields; got " + items.size());
        }
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            values.add(fields.get(i).domain().parse(items.get(i)));
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
            chunks.add(ListDomain.dumpItem(fields.get(i).domain(), values.get(i)));
        }
        return "(" + String.join(", ", chunks) + ")";
    }
}
