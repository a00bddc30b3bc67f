package org.navql.engine.frame;

import org.navql.engine.domain.Domain;

/**
 * A scalar SQL expression.
 *
 * <p>Phrases are compared by value, so that structurally identical
 * expressions occupy a single position in a {@code SELECT} list.
 */
public sealed interface Phrase
        permits LiteralPhrase, ParameterPhrase, CastPhrase, FormulaPhrase, ExportPhrase {

    Domain domain();

    boolean isNullable();

    <T> T accept(PhraseVisitor<T> visitor);
}
