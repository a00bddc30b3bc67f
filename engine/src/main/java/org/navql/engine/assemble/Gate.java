package org.navql.engine.assemble;

import org.navql.engine.code.Unit;

import java.util.Map;

/**
 * The context in which units are resolved: whether the rows may be
 * null-extended by an outer join, the kid of the current term containing
 * each descendant tag, and the term responsible for each unit.
 */
record Gate(boolean isNullable, Map<Integer, Integer> dispatches, Map<Unit, Integer> routes) {
}
