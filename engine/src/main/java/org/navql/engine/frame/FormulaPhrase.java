package org.navql.engine.frame;

import org.navql.engine.domain.Domain;
import org.navql.engine.signature.Signature;

import java.util.List;
import java.util.Objects;

/**
 * An operator or function applied to argument phrases; the argument layout
 * is the one of the corresponding formula code.
 */
public record FormulaPhrase(Signature signature, Domain domain, boolean isNullable, List<Phrase> arguments)
        implements Phrase {

    public FormulaPhrase {
        Objects.requireNonNull(signature, "Signature cannot be null");
        Objects.requireNonNull(domain, "Domain cannot be null");
        arguments = List.copyOf(arguments);
    }

    public FormulaPhrase(Signature signature, Domain domain, boolean isNullable, Phrase... arguments) {
        this(signature, domain, isNullable, List.of(arguments));
    }

    public Phrase argument(int index) {
        return arguments.get(index);
    }

    public FormulaPhrase withArguments(List<Phrase> arguments) {
        return new FormulaPhrase(signature, domain, isNullable, arguments);
    }

    @Override
    public <T> T accept(PhraseVisitor<T> visitor) {
        return visitor.visitFormula(this);
    }
}
