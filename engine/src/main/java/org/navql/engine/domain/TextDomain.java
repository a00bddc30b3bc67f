package org.navql.engine.domain;

/**
 * The character string type.
 */
public record TextDomain() implements Domain {

    @Override
    public String family() {
        return "text";
    }

    @Override
    public Object parse(String text) {
        if (text != null && text.indexOf('\0') >= 0) {
            throw new DomainException("NUL character is not allowed in a text literal");
        }
        return text;
    }

    @Override
    public String dump(Object value) {
        return value == null ? null : (String) value;
    }

    @Override
    public Object fromDatabase(Object value) {
        return value == null ? null : value.toString();
    }
}
