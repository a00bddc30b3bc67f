package org.navql.engine.plan;

import org.navql.engine.error.PermissionException;

/**
 * The capabilities granted to a translation.
 */
public record Permissions(boolean mayRead, boolean mayWrite) {

    public static Permissions all() {
        return new Permissions(true, true);
    }

    public static Permissions readOnly() {
        return new Permissions(true, false);
    }

    public static Permissions none() {
        return new Permissions(false, false);
    }

    /**
     * @throws PermissionException if reading is not allowed
     */
    public void checkRead() {
        if (!mayRead) {
            throw new PermissionException("No read permission");
        }
    }
}
