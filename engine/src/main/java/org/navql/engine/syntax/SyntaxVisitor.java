package org.navql.engine.syntax;

/**
 * Visitor over the syntax tree.
 *
 * @param <T> The result type
 */
public interface SyntaxVisitor<T> {

    T visitQuery(QuerySyntax syntax);

    T visitFilter(FilterSyntax syntax);

    T visitProject(ProjectSyntax syntax);

    T visitSelect(SelectSyntax syntax);

    T visitRecord(RecordSyntax syntax);

    T visitDirect(DirectSyntax syntax);

    T visitOperator(OperatorSyntax syntax);

    T visitPrefix(PrefixSyntax syntax);

    T visitLink(LinkSyntax syntax);

    T visitCompose(ComposeSyntax syntax);

    T visitDetach(DetachSyntax syntax);

    T visitComplement(ComplementSyntax syntax);

    T visitGroup(GroupSyntax syntax);

    T visitApply(ApplySyntax syntax);

    T visitIdentifier(IdentifierSyntax syntax);

    T visitReference(ReferenceSyntax syntax);

    T visitString(StringSyntax syntax);

    T visitNumber(NumberSyntax syntax);
}
