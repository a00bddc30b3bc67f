package org.navql.engine.frame;

public interface FrameVisitor<T> {

    T visitScalar(ScalarFrame frame);

    T visitTable(TableFrame frame);

    T visitNested(NestedFrame frame);

    T visitSegment(SegmentFrame frame);
}
