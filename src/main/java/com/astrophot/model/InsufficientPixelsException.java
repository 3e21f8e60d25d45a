package com.astrophot.model;

public class InsufficientPixelsException extends PhotometryException {
    public InsufficientPixelsException(String message) { super(message); }
}
