package com.astrophot.model;

public enum CalibrationRole { BIAS, DARK, FLAT }
