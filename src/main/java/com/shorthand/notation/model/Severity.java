package com.shorthand.notation.model;

public enum Severity {
    ERROR,
    WARNING
}
