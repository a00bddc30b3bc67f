package org.navql.engine.plan;

import org.navql.engine.domain.Domain;
import org.navql.engine.frame.SegmentOutput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A translated query.
 *
 * @param sql          The statement text, or null when the query has no segment
 * @param domains      Domains of the select list, in order
 * @param placeholders The domain of each parameter marker, keyed by position from 1
 * @param parameters   The values bound to the markers, in order
 * @param outputs      Where each profile field is read from
 * @param profile      The shape of the output records
 */
public record Plan(
        String sql,
        List<Domain> domains,
        Map<Integer, Domain> placeholders,
        List<Object> parameters,
        List<SegmentOutput> outputs,
        Profile profile
) {
    public Plan {
        Objects.requireNonNull(profile, "Profile cannot be null");
        domains = List.copyOf(domains);
        placeholders = Map.copyOf(placeholders);
        // parameter values may be null
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        outputs = List.copyOf(outputs);
    }

    /**
     * The plan of a query that has nothing to execute.
     */
    public static Plan empty() {
        return new Plan(null, List.of(), Map.of(), List.of(), List.of(), new Profile(List.of()));
    }

    public boolean hasStatement() {
        return sql != null;
    }
}
