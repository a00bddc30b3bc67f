package org.navql.engine.domain;

/**
 * The type of a table-valued expression; its values are rows.
 */
public record EntityDomain() implements Domain {

    @Override
    public String family() {
        return "entity";
    }

    @Override
    public Object parse(String text) {
        throw new DomainException("entity values have no literal form");
    }

    @Override
    public String dump(Object value) {
        throw new DomainException("entity values have no literal form");
    }

    @Override
    public boolean isScalar() {
        return false;
    }
}
