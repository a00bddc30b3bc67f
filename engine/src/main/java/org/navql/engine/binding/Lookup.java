package org.navql.engine.binding;

import org.navql.engine.entity.Catalog;
import org.navql.engine.entity.ColumnEntity;
import org.navql.engine.entity.DirectJoin;
import org.navql.engine.entity.Join;
import org.navql.engine.entity.TableEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves names against a scope.
 *
 * <p>Names are matched case-insensitively:
 * <ul>
 *   <li>in the root scope and in {@code @} scopes, to tables;</li>
 *   <li>in a table scope, to columns and to links, where a link is named
 *       after the table it leads to;</li>
 *   <li>in a quotient scope, to kernels by title and to the complement by
 *       the name of the seed table.</li>
 * </ul>
 * A column hides a link of the same name only when the link is the
 * single-column foreign key over that very column. Any other collision is
 * reported as an {@link Recipe.AmbiguousRecipe}.
 */
final class Lookup {

    private final Catalog catalog;

    Lookup(Catalog catalog) {
        this.catalog = catalog;
    }

    Optional<Recipe> lookup(Binding scope, String name) {
        Binding target = target(scope);
        if (target instanceof RootBinding || target instanceof HomeBinding) {
            return lookupTable(name);
        }
        if (target instanceof QuotientBinding quotient) {
            return lookupKernel(quotient, name);
        }
        TableEntity table = tableOf(target);
        if (table != null) {
            return lookupAttribute(table, name);
        }
        return Optional.empty();
    }

    /**
     * The scope that determines which names are visible: sieves, sorts,
     * selections and forks are transparent.
     */
    static Binding target(Binding scope) {
        while (scope instanceof SieveBinding || scope instanceof SortBinding
                || scope instanceof SelectionBinding || scope instanceof ForkBinding) {
            scope = scope.base();
        }
        if (scope instanceof ColumnBinding column && column.link() != null) {
            return column.link();
        }
        return scope;
    }

    /**
     * The table whose rows the scope ranges over, or null.
     */
    static TableEntity tableOf(Binding scope) {
        Binding target = target(scope);
        if (target instanceof TableBinding table) {
            return table.table();
        }
        if (target instanceof ChainBinding chain) {
            return chain.table();
        }
        if (target instanceof CoverBinding cover) {
            return tableOf(cover.seed());
        }
        if (target instanceof LinkBinding link) {
            return tableOf(link.seed());
        }
        if (target instanceof ComplementBinding complement
                && target(complement.base()) instanceof QuotientBinding quotient) {
            return tableOf(quotient.seed());
        }
        return null;
    }

    private Optional<Recipe> lookupTable(String name) {
        List<TableEntity> tables = new ArrayList<>();
        for (TableEntity table : catalog.tables()) {
            if (matches(table.name(), name)) {
                tables.add(table);
            }
        }
        if (tables.isEmpty()) {
            return Optional.empty();
        }
        if (tables.size() > 1) {
            List<String> alternatives = new ArrayList<>();
            for (TableEntity table : tables) {
                alternatives.add("table " + table.qualifiedName());
            }
            return Optional.of(new Recipe.AmbiguousRecipe(name, alternatives));
        }
        return Optional.of(new Recipe.TableRecipe(tables.get(0)));
    }

    private Optional<Recipe> lookupAttribute(TableEntity table, String name) {
        List<Join> joins = catalog.joins(table);
        ColumnEntity column = null;
        for (ColumnEntity candidate : table.columns()) {
            if (matches(candidate.name(), name)) {
                column = candidate;
                break;
            }
        }
        List<Join> links = new ArrayList<>();
        for (Join join : joins) {
            if (matches(join.target().name(), name)) {
                links.add(join);
            }
        }
        if (column != null) {
            Join columnLink = linkOf(column, joins);
            links.remove(columnLink);
            if (links.isEmpty()) {
                return Optional.of(new Recipe.ColumnRecipe(column, columnLink != null ? List.of(columnLink) : null));
            }
            List<String> alternatives = new ArrayList<>();
            alternatives.add("column " + column.name());
            links.forEach(link -> alternatives.add(describe(link)));
            return Optional.of(new Recipe.AmbiguousRecipe(name, alternatives));
        }
        if (links.isEmpty()) {
            return Optional.empty();
        }
        if (links.size() > 1) {
            List<String> alternatives = new ArrayList<>();
            links.forEach(link -> alternatives.add(describe(link)));
            return Optional.of(new Recipe.AmbiguousRecipe(name, alternatives));
        }
        return Optional.of(new Recipe.ChainRecipe(links));
    }

    private Optional<Recipe> lookupKernel(QuotientBinding quotient, String name) {
        List<Recipe> recipes = new ArrayList<>();
        List<String> alternatives = new ArrayList<>();
        for (int i = 0; i < quotient.titles().size(); i++) {
            if (matches(quotient.titles().get(i), name)) {
                recipes.add(new Recipe.KernelRecipe(quotient, i));
                alternatives.add("kernel " + quotient.titles().get(i));
            }
        }
        TableEntity seed = tableOf(quotient.seed());
        if (seed != null && matches(seed.name(), name)) {
            recipes.add(new Recipe.ComplementRecipe(quotient));
            alternatives.add("complement " + seed.name());
        }
        if (recipes.isEmpty()) {
            return Optional.empty();
        }
        if (recipes.size() > 1) {
            return Optional.of(new Recipe.AmbiguousRecipe(name, alternatives));
        }
        return Optional.of(recipes.get(0));
    }

    /**
     * The direct join over a single-column foreign key on the given column.
     */
    private static Join linkOf(ColumnEntity column, List<Join> joins) {
        for (Join join : joins) {
            if (join instanceof DirectJoin && join.originColumns().size() == 1
                    && join.originColumns().get(0).equals(column)) {
                return join;
            }
        }
        return null;
    }

    private static String describe(Join join) {
        String columns = join instanceof DirectJoin
                ? join.originColumns().toString()
                : join.targetColumns().toString();
        return "link to " + join.target().qualifiedName() + " via " + columns;
    }

    private static boolean matches(String candidate, String name) {
        return candidate.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT));
    }
}
