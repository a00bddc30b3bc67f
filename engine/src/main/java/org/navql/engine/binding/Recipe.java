package org.navql.engine.binding;

import org.navql.engine.entity.ColumnEntity;
import org.navql.engine.entity.Join;
import org.navql.engine.entity.TableEntity;

import java.util.List;
import java.util.Objects;

/**
 * The result of looking up a name in a scope: how to build the binding it
 * refers to.
 */
public sealed interface Recipe {

    record TableRecipe(TableEntity table) implements Recipe {
        public TableRecipe {
            Objects.requireNonNull(table, "Table cannot be null");
        }
    }

    /**
     * @param link The joins to follow when the column is used as a scope, or null
     */
    record ColumnRecipe(ColumnEntity column, List<Join> link) implements Recipe {
        public ColumnRecipe {
            Objects.requireNonNull(column, "Column cannot be null");
            link = link != null ? List.copyOf(link) : null;
        }
    }

    record ChainRecipe(List<Join> joins) implements Recipe {
        public ChainRecipe {
            joins = List.copyOf(joins);
        }
    }

    record KernelRecipe(QuotientBinding quotient, int index) implements Recipe {
    }

    record ComplementRecipe(QuotientBinding quotient) implements Recipe {
    }

    /**
     * A name with two or more equally valid targets.
     */
    record AmbiguousRecipe(String name, List<String> alternatives) implements Recipe {
        public AmbiguousRecipe {
            alternatives = List.copyOf(alternatives);
        }
    }
}
