package com.metarwatch.core.model;

public enum VisibilityQualifier {
    EXACT,
    AT_LEAST,
    AT_MOST
}
