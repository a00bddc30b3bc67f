package org.navql.engine.domain;

/**
 * The domain with no values.
 */
public record VoidDomain() implements Domain {

    @Override
    public String family() {
        return "void";
    }

    @Override
    public Object parse(String text) {
        if (text != null) {
            throw new DomainException("the void domain has no values");
        }
        return null;
    }

    @Override
    public String dump(Object value) {
        return null;
    }

    @Override
    public boolean isScalar() {
        return false;
    }
}
