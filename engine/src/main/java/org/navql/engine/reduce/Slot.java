package org.navql.engine.reduce;

/**
 * Addresses a column of the select list of a frame.
 */
record Slot(int tag, int index) {
}
