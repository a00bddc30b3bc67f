package org.navql.engine.syntax;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.navql.engine.error.Mark;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that converts the parse tree into {@link Syntax} nodes.
 */
final class SyntaxBuilder extends NavqlBaseVisitor<Syntax> {

    private final String input;

    SyntaxBuilder(String input) {
        this.input = input;
    }

    @Override
    public Syntax visitQuery(NavqlParser.QueryContext ctx) {
        Syntax arm = ctx.flow() != null ? visit(ctx.flow()) : null;
        return new QuerySyntax(arm, mark(ctx));
    }

    @Override
    public Syntax visitFlow(NavqlParser.FlowContext ctx) {
        Syntax syntax = ctx.disjunction() != null ? visit(ctx.disjunction()) : visit(ctx.selection());
        int start = ctx.getStart().getStartIndex();
        for (NavqlParser.FlowTailContext tail : ctx.flowTail()) {
            Mark mark = mark(start, tail.getStop());
            if (tail instanceof NavqlParser.SieveTailContext sieve) {
                syntax = new FilterSyntax(syntax, visit(sieve.disjunction()), mark);
            } else if (tail instanceof NavqlParser.ProjectTailContext project) {
                Syntax kernel = project.selection() != null
                        ? visit(project.selection())
                        : visit(project.disjunction());
                syntax = new ProjectSyntax(syntax, kernel, mark);
            } else if (tail instanceof NavqlParser.ComposeTailContext compose) {
                syntax = new ComposeSyntax(syntax, visit(compose.atom()), mark);
            } else {
                NavqlParser.SelectTailContext select = (NavqlParser.SelectTailContext) tail;
                syntax = new SelectSyntax(syntax, (RecordSyntax) visit(select.selection()), mark);
            }
        }
        return syntax;
    }

    @Override
    public Syntax visitSelection(NavqlParser.SelectionContext ctx) {
        List<Syntax> arms = new ArrayList<>();
        for (NavqlParser.ArgumentContext argument : ctx.argument()) {
            arms.add(visit(argument));
        }
        return new RecordSyntax(arms, mark(ctx));
    }

    @Override
    public Syntax visitArgument(NavqlParser.ArgumentContext ctx) {
        Syntax arm = visit(ctx.flow());
        if (ctx.direction != null) {
            return new DirectSyntax(ctx.direction.getText(), arm, mark(ctx));
        }
        return arm;
    }

    @Override
    public Syntax visitDisjunction(NavqlParser.DisjunctionContext ctx) {
        return foldOperators("|", ctx.conjunction(), ctx);
    }

    @Override
    public Syntax visitConjunction(NavqlParser.ConjunctionContext ctx) {
        return foldOperators("&", ctx.negation(), ctx);
    }

    @Override
    public Syntax visitNotNegation(NavqlParser.NotNegationContext ctx) {
        return new PrefixSyntax("!", visit(ctx.negation()), mark(ctx));
    }

    @Override
    public Syntax visitPlainNegation(NavqlParser.PlainNegationContext ctx) {
        return visit(ctx.comparison());
    }

    @Override
    public Syntax visitComparison(NavqlParser.ComparisonContext ctx) {
        Syntax larm = visit(ctx.expression(0));
        if (ctx.op == null) {
            return larm;
        }
        return new OperatorSyntax(ctx.op.getText(), larm, visit(ctx.expression(1)), mark(ctx));
    }

    @Override
    public Syntax visitExpression(NavqlParser.ExpressionContext ctx) {
        Syntax syntax = visit(ctx.term(0));
        int start = ctx.getStart().getStartIndex();
        for (int i = 1; i < ctx.term().size(); i++) {
            NavqlParser.TermContext term = ctx.term(i);
            syntax = new OperatorSyntax(ctx.ops.get(i - 1).getText(), syntax, visit(term),
                    mark(start, term.getStop()));
        }
        return syntax;
    }

    @Override
    public Syntax visitTerm(NavqlParser.TermContext ctx) {
        Syntax syntax = visit(ctx.factor(0));
        int start = ctx.getStart().getStartIndex();
        for (int i = 1; i < ctx.factor().size(); i++) {
            NavqlParser.FactorContext factor = ctx.factor(i);
            syntax = new OperatorSyntax(ctx.ops.get(i - 1).getText(), syntax, visit(factor),
                    mark(start, factor.getStop()));
        }
        return syntax;
    }

    @Override
    public Syntax visitPrefixFactor(NavqlParser.PrefixFactorContext ctx) {
        return new PrefixSyntax(ctx.op.getText(), visit(ctx.factor()), mark(ctx));
    }

    @Override
    public Syntax visitPlainFactor(NavqlParser.PlainFactorContext ctx) {
        return visit(ctx.linking());
    }

    @Override
    public Syntax visitLinking(NavqlParser.LinkingContext ctx) {
        Syntax larm = visit(ctx.composition(0));
        if (ctx.composition().size() == 1) {
            return larm;
        }
        return new LinkSyntax(larm, visit(ctx.composition(1)), mark(ctx));
    }

    @Override
    public Syntax visitComposition(NavqlParser.CompositionContext ctx) {
        Syntax syntax = visit(ctx.atom(0));
        int start = ctx.getStart().getStartIndex();
        for (int i = 1; i < ctx.atom().size(); i++) {
            NavqlParser.AtomContext atom = ctx.atom(i);
            syntax = new ComposeSyntax(syntax, visit(atom), mark(start, atom.getStop()));
        }
        return syntax;
    }

    @Override
    public Syntax visitDetachAtom(NavqlParser.DetachAtomContext ctx) {
        return new DetachSyntax(visit(ctx.atom()), mark(ctx));
    }

    @Override
    public Syntax visitComplementAtom(NavqlParser.ComplementAtomContext ctx) {
        return new ComplementSyntax(mark(ctx));
    }

    @Override
    public Syntax visitGroupAtom(NavqlParser.GroupAtomContext ctx) {
        return new GroupSyntax(visit(ctx.flow()), mark(ctx));
    }

    @Override
    public Syntax visitApplyAtom(NavqlParser.ApplyAtomContext ctx) {
        List<Syntax> arguments = new ArrayList<>();
        for (NavqlParser.ArgumentContext argument : ctx.argument()) {
            arguments.add(visit(argument));
        }
        return new ApplySyntax(ctx.IDENTIFIER().getText(), arguments, mark(ctx));
    }

    @Override
    public Syntax visitIdentifierAtom(NavqlParser.IdentifierAtomContext ctx) {
        return new IdentifierSyntax(ctx.IDENTIFIER().getText(), mark(ctx));
    }

    @Override
    public Syntax visitReferenceAtom(NavqlParser.ReferenceAtomContext ctx) {
        return new ReferenceSyntax(ctx.IDENTIFIER().getText(), mark(ctx));
    }

    @Override
    public Syntax visitStringAtom(NavqlParser.StringAtomContext ctx) {
        String text = ctx.STRING().getText();
        String value = text.substring(1, text.length() - 1).replace("''", "'");
        return new StringSyntax(value, mark(ctx));
    }

    @Override
    public Syntax visitIntegerAtom(NavqlParser.IntegerAtomContext ctx) {
        return new NumberSyntax(ctx.getText(), NumberSyntax.Kind.INTEGER, mark(ctx));
    }

    @Override
    public Syntax visitDecimalAtom(NavqlParser.DecimalAtomContext ctx) {
        return new NumberSyntax(ctx.getText(), NumberSyntax.Kind.DECIMAL, mark(ctx));
    }

    @Override
    public Syntax visitFloatAtom(NavqlParser.FloatAtomContext ctx) {
        return new NumberSyntax(ctx.getText(), NumberSyntax.Kind.FLOAT, mark(ctx));
    }

    private Syntax foldOperators(String symbol, List<? extends ParserRuleContext> arms, ParserRuleContext ctx) {
        Syntax syntax = visit(arms.get(0));
        int start = ctx.getStart().getStartIndex();
        for (int i = 1; i < arms.size(); i++) {
            ParserRuleContext arm = arms.get(i);
            syntax = new OperatorSyntax(symbol, syntax, visit(arm), mark(start, arm.getStop()));
        }
        return syntax;
    }

    private Mark mark(ParserRuleContext ctx) {
        return mark(ctx.getStart().getStartIndex(), ctx.getStop());
    }

    private Mark mark(int start, Token stop) {
        int end = stop != null && stop.getType() != Token.EOF ? stop.getStopIndex() + 1 : input.length();
        start = Math.max(0, Math.min(start, input.length()));
        end = Math.max(start, Math.min(end, input.length()));
        return new Mark(input, start, end);
    }
}
