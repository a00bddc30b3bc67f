package org.navql.engine.execution;

import org.navql.engine.frame.SegmentOutput;
import org.navql.engine.plan.Permissions;
import org.navql.engine.plan.Plan;
import org.navql.engine.plan.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A translated query ready to run against a connection.
 */
public final class Pipe {

    private static final Logger LOG = LoggerFactory.getLogger(Pipe.class);

    private final Plan plan;
    private final Permissions permissions;

    public Pipe(Plan plan, Permissions permissions) {
        this.plan = Objects.requireNonNull(plan, "Plan cannot be null");
        this.permissions = Objects.requireNonNull(permissions, "Permissions cannot be null");
    }

    public Plan plan() {
        return plan;
    }

    /**
     * Runs the query and shapes its rows into output records.
     *
     * @throws org.navql.engine.error.PermissionException if reading is not allowed;
     *                                                    nothing is sent to the connection
     * @throws org.navql.engine.error.EngineException     if the database fails
     */
    public Product execute(QueryConnection connection) {
        permissions.checkRead();
        if (!plan.hasStatement()) {
            return new Product(plan.profile(), null);
        }
        List<List<Object>> rows = connection.execute(plan.sql(), plan.parameters(), plan.domains());
        List<List<Object>> records = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Object[] record = new Object[plan.outputs().size()];
            for (int i = 0; i < record.length; i++) {
                SegmentOutput output = plan.outputs().get(i);
                record[i] = output.isConstant() ? output.value() : row.get(output.index());
            }
            records.add(Arrays.asList(record));
        }
        LOG.debug("Produced {} record(s)", records.size());
        return new Product(plan.profile(), records);
    }
}
