package com.astrophot.model;

public class ShapeMismatchException extends PhotometryException {
    public ShapeMismatchException(String message) { super(message); }

    public static void check(PixelFrame expected, PixelFrame actual, String what) {
        if (!expected.sameShape(actual)) {
            throw new ShapeMismatchException(String.format("%s: forma %s, se esperaba %s",
                    what, actual.shapeString(), expected.shapeString()));
        }
    }
}
