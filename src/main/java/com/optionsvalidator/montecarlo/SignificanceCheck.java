package com.optionsvalidator.montecarlo;

import java.util.List;

/** Pass/fail verdict of a Monte Carlo run against significance thresholds. */
public record SignificanceCheck(boolean significant, List<String> failures) {}
