package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A node of the query syntax tree.
 *
 * <p>Syntax nodes are produced by {@link QueryParser} and consumed by the
 * binder. Each node records the {@link Mark} of the text it was parsed from.
 */
public sealed interface Syntax permits QuerySyntax, FilterSyntax, ProjectSyntax, SelectSyntax,
        RecordSyntax, DirectSyntax, OperatorSyntax, PrefixSyntax, LinkSyntax, ComposeSyntax,
        DetachSyntax, ComplementSyntax, GroupSyntax, ApplySyntax, IdentifierSyntax, ReferenceSyntax,
        StringSyntax, NumberSyntax {

    Mark mark();

    <T> T accept(SyntaxVisitor<T> visitor);
}
