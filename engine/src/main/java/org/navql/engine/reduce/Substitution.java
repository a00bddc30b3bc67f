package org.navql.engine.reduce;

import org.navql.engine.frame.CastPhrase;
import org.navql.engine.frame.ColumnPhrase;
import org.navql.engine.frame.EmbeddingPhrase;
import org.navql.engine.frame.FormulaPhrase;
import org.navql.engine.frame.LiteralPhrase;
import org.navql.engine.frame.ParameterPhrase;
import org.navql.engine.frame.Phrase;
import org.navql.engine.frame.PhraseVisitor;
import org.navql.engine.frame.ReferencePhrase;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replaces references to absorbed frames with the phrases those frames
 * exported. Replacement is not applied to the substituted phrases again.
 */
final class Substitution implements PhraseVisitor<Phrase> {

    private final Map<Slot, Phrase> substitutes;

    Substitution(Map<Slot, Phrase> substitutes) {
        this.substitutes = substitutes;
    }

    List<Phrase> apply(List<Phrase> phrases) {
        List<Phrase> result = new ArrayList<>(phrases.size());
        for (Phrase phrase : phrases) {
            result.add(phrase.accept(this));
        }
        return result;
    }

    @Override
    public Phrase visitLiteral(LiteralPhrase phrase) {
        return phrase;
    }

    @Override
    public Phrase visitParameter(ParameterPhrase phrase) {
        return phrase;
    }

    @Override
    public Phrase visitCast(CastPhrase phrase) {
        return phrase.withBase(phrase.base().accept(this));
    }

    @Override
    public Phrase visitFormula(FormulaPhrase phrase) {
        return phrase.withArguments(apply(phrase.arguments()));
    }

    @Override
    public Phrase visitColumn(ColumnPhrase phrase) {
        return phrase;
    }

    @Override
    public Phrase visitReference(ReferencePhrase phrase) {
        Phrase substitute = substitutes.get(new Slot(phrase.tag(), phrase.index()));
        return substitute != null ? substitute : phrase;
    }

    @Override
    public Phrase visitEmbedding(EmbeddingPhrase phrase) {
        return phrase;
    }
}
