package com.astrophot.model;

public enum CombineMethod { MEDIAN, MEAN, SIGMA_CLIPPED_MEAN }
