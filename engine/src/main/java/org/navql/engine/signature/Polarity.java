package org.navql.engine.signature;

final class Polarity {

    private Polarity() {
    }

    static void check(int polarity) {
        if (polarity != 1 && polarity != -1) {
            throw new IllegalArgumentException("Polarity must be +1 or -1, got " + polarity);
        }
    }
}
