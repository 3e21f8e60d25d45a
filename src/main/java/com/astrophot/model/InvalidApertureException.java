package com.astrophot.model;

public class InvalidApertureException extends PhotometryException {
    public InvalidApertureException(String message) { super(message); }
}
