package org.navql.engine.signature;

/**
 * {@code null_if(op, value)}: null when the operands are equal, otherwise the first operand.
 */
public record NullIfSig() implements Signature {

    @Override
    public int arity() {
        return 2;
    }
}
