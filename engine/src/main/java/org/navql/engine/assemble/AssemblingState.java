package org.navql.engine.assemble;

import org.navql.engine.code.AggregateUnit;
import org.navql.engine.code.CastCode;
import org.navql.engine.code.Code;
import org.navql.engine.code.CodeVisitor;
import org.navql.engine.code.ColumnUnit;
import org.navql.engine.code.ComplementUnit;
import org.navql.engine.code.CorrelatedUnit;
import org.navql.engine.code.CorrelationCode;
import org.navql.engine.code.FormulaCode;
import org.navql.engine.code.KernelUnit;
import org.navql.engine.code.LiteralCode;
import org.navql.engine.code.ParameterCode;
import org.navql.engine.code.ScalarUnit;
import org.navql.engine.code.Unit;
import org.navql.engine.frame.CastPhrase;
import org.navql.engine.frame.FormulaPhrase;
import org.navql.engine.frame.LiteralPhrase;
import org.navql.engine.frame.ParameterPhrase;
import org.navql.engine.frame.Phrase;
import org.navql.engine.signature.ExistsSig;
import org.navql.engine.signature.IfNullSig;
import org.navql.engine.signature.IfSig;
import org.navql.engine.signature.IsNullSig;
import org.navql.engine.signature.IsTotallyEqualSig;
import org.navql.engine.signature.NullIfSig;
import org.navql.engine.signature.Signature;
import org.navql.engine.term.SegmentTerm;
import org.navql.engine.term.Term;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The claim ledger of one assembly.
 *
 * <p>Every claim is demanded against a broker frame and must be supplied
 * exactly once, with the phrase the broker exports for it, before the
 * top-level frame is returned. The ledger stays readable after assembly.
 */
public final class AssemblingState {

    private final Deque<Gate> gates = new ArrayDeque<>();
    private final Deque<Map<Code, Phrase>> correlationStack = new ArrayDeque<>();
    private final Set<Claim> claims = new LinkedHashSet<>();
    private final Map<Integer, List<Claim>> claimsByBroker = new HashMap<>();
    private final Map<Claim, Phrase> phraseByClaim = new LinkedHashMap<>();
    private Map<Code, Phrase> correlations = Map.of();
    private Gate gate;

    /**
     * @return Every claim demanded so far, in order of demand
     */
    public Set<Claim> claims() {
        return Collections.unmodifiableSet(claims);
    }

    /**
     * @return The phrase supplied for each resolved claim
     */
    public Map<Claim, Phrase> supplied() {
        return Collections.unmodifiableMap(phraseByClaim);
    }

    void setTree(SegmentTerm term) {
        if (gate != null) {
            throw new IllegalStateException("A state assembles a single segment");
        }
        gate = new Gate(false, term.offsprings(), term.routes());
        claimsByBroker.put(term.tag(), new ArrayList<>());
        for (Integer offspring : term.offsprings().keySet()) {
            claimsByBroker.put(offspring, new ArrayList<>());
        }
    }

    boolean isNullable() {
        return gate.isNullable();
    }

    List<Claim> claimsOf(Term term) {
        return claimsByBroker.get(term.tag());
    }

    void pushGate(Boolean isNullable, Term dispatcher, Term router) {
        boolean nullable = isNullable != null ? isNullable : gate.isNullable();
        Map<Integer, Integer> dispatches = dispatcher != null ? dispatcher.offsprings() : gate.dispatches();
        if (router == null) {
            router = dispatcher;
        }
        Map<Unit, Integer> routes = router != null ? router.routes() : gate.routes();
        gates.push(gate);
        gate = new Gate(nullable, dispatches, routes);
    }

    void popGate() {
        gate = gates.pop();
    }

    void pushCorrelations(Map<Code, Phrase> correlations) {
        correlationStack.push(this.correlations);
        this.correlations = correlations;
    }

    void popCorrelations() {
        correlations = correlationStack.pop();
    }

    Claim appoint(Unit unit) {
        Integer target = gate.routes().get(unit);
        if (target == null) {
            throw new IllegalStateException("No route for " + unit);
        }
        Integer broker = gate.dispatches().get(target);
        if (broker == null) {
            throw new IllegalStateException("No dispatch for term #" + target);
        }
        return new Claim(unit, broker, target);
    }

    Claim forward(Claim claim) {
        Integer broker = gate.dispatches().get(claim.target());
        if (broker == null) {
            throw new IllegalStateException("No dispatch for term #" + claim.target());
        }
        return new Claim(claim.unit(), broker, claim.target());
    }

    void schedule(Code code, Term dispatcher, Term router) {
        pushGate(null, dispatcher, router);
        try {
            for (Unit unit : code.units()) {
                demand(appoint(unit));
            }
        } finally {
            popGate();
        }
    }

    void schedule(Code code) {
        schedule(code, null, null);
    }

    Phrase evaluate(Code code, Term dispatcher, Term router) {
        pushGate(null, dispatcher, router);
        try {
            return code.accept(new Evaluate());
        } finally {
            popGate();
        }
    }

    Phrase evaluate(Code code) {
        return evaluate(code, null, null);
    }

    void demand(Claim claim) {
        if (claims.add(claim)) {
            List<Claim> brokered = claimsByBroker.get(claim.broker());
            if (brokered == null) {
                throw new IllegalStateException("Unknown broker for " + claim);
            }
            brokered.add(claim);
        }
    }

    void supply(Claim claim, Phrase phrase) {
        if (!claims.contains(claim)) {
            throw new IllegalStateException("Supplying a claim that was never demanded: " + claim);
        }
        if (phraseByClaim.putIfAbsent(claim, phrase) != null) {
            throw new IllegalStateException("Claim supplied twice: " + claim);
        }
    }

    Phrase supplied(Claim claim) {
        Phrase phrase = phraseByClaim.get(claim);
        if (phrase == null) {
            throw new IllegalStateException("Unresolved claim: " + claim);
        }
        return phrase;
    }

    /**
     * @throws IllegalStateException if some demanded claim was never supplied
     */
    void verify() {
        for (Claim claim : claims) {
            supplied(claim);
        }
    }

    private final class Evaluate implements CodeVisitor<Phrase> {

        @Override
        public Phrase visitLiteral(LiteralCode code) {
            return new LiteralPhrase(code.value(), code.domain());
        }

        @Override
        public Phrase visitParameter(ParameterCode code) {
            return new ParameterPhrase(code.name(), code.value(), code.domain());
        }

        @Override
        public Phrase visitCast(CastCode code) {
            Phrase base = code.base().accept(this);
            return new CastPhrase(base, code.domain(), base.isNullable());
        }

        @Override
        public Phrase visitFormula(FormulaCode code) {
            List<Phrase> arguments = new ArrayList<>();
            for (Code argument : code.arguments()) {
                arguments.add(argument.accept(this));
            }
            return new FormulaPhrase(code.signature(), code.domain(), isNullable(code.signature(), arguments),
                    arguments);
        }

        private boolean isNullable(Signature signature, List<Phrase> arguments) {
            if (signature instanceof IsTotallyEqualSig || signature instanceof IsNullSig
                    || signature instanceof ExistsSig) {
                return false;
            }
            if (signature instanceof NullIfSig || signature instanceof IfSig) {
                return true;
            }
            if (signature instanceof IfNullSig) {
                return arguments.stream().allMatch(Phrase::isNullable);
            }
            return arguments.stream().anyMatch(Phrase::isNullable);
        }

        @Override
        public Phrase visitCorrelation(CorrelationCode code) {
            Phrase phrase = correlations.get(code.code());
            if (phrase == null) {
                throw new IllegalStateException("Unknown correlation: " + code.code());
            }
            return phrase;
        }

        private Phrase unit(Unit unit) {
            return supplied(appoint(unit));
        }

        @Override
        public Phrase visitColumn(ColumnUnit unit) {
            return unit(unit);
        }

        @Override
        public Phrase visitScalar(ScalarUnit unit) {
            return unit(unit);
        }

        @Override
        public Phrase visitAggregate(AggregateUnit unit) {
            return unit(unit);
        }

        @Override
        public Phrase visitCorrelated(CorrelatedUnit unit) {
            return unit(unit);
        }

        @Override
        public Phrase visitKernel(KernelUnit unit) {
            return unit(unit);
        }

        @Override
        public Phrase visitComplement(ComplementUnit unit) {
            return unit(unit);
        }
    }
}
