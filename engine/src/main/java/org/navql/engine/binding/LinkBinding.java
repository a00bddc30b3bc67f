package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;

/**
 * {@code larm -> rarm}: the seed rows whose image equals the image of
 * each scope row.
 */
public record LinkBinding(Binding base, Binding seed, List<Image> images, Mark mark) implements Binding {

    /**
     * An expression evaluated over the scope ({@code lop}) and over the
     * seed ({@code rop}).
     */
    public record Image(Binding lop, Binding rop) {
        public Image {
            Objects.requireNonNull(lop, "Left image cannot be null");
            Objects.requireNonNull(rop, "Right image cannot be null");
        }
    }

    public LinkBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(seed, "Seed cannot be null");
        images = List.copyOf(images);
    }

    @Override
    public Domain domain() {
        return new EntityDomain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitLink(this);
    }
}
