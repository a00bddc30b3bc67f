package org.navql.engine.frame;

/**
 * A value exported by another frame: a table column, a position in the
 * select list of a subquery, or a correlated subquery.
 */
public sealed interface ExportPhrase extends Phrase permits ColumnPhrase, ReferencePhrase, EmbeddingPhrase {

    /**
     * @return The tag of the frame producing the value
     */
    int tag();
}
