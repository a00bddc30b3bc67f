package org.navql.engine.frame;

public interface PhraseVisitor<T> {

    T visitLiteral(LiteralPhrase phrase);

    T visitParameter(ParameterPhrase phrase);

    T visitCast(CastPhrase phrase);

    T visitFormula(FormulaPhrase phrase);

    T visitColumn(ColumnPhrase phrase);

    T visitReference(ReferencePhrase phrase);

    T visitEmbedding(EmbeddingPhrase phrase);
}
