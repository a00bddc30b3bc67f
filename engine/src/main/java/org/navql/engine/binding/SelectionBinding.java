package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.RecordDomain;
import org.navql.engine.error.Mark;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The output columns of the base: {@code base {elements}}.
 */
public record SelectionBinding(Binding base, List<Binding> elements, List<String> titles, Mark mark)
        implements Binding {

    public SelectionBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        elements = List.copyOf(elements);
        titles = List.copyOf(titles);
        if (elements.size() != titles.size()) {
            throw new IllegalArgumentException("Every element needs a title");
        }
    }

    @Override
    public Domain domain() {
        List<RecordDomain.Field> fields = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            fields.add(new RecordDomain.Field(titles.get(i), elements.get(i).domain()));
        }
        return new RecordDomain(fields);
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitSelection(this);
    }
}
