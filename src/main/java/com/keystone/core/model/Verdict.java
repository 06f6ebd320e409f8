package com.keystone.core.model;

/** Outcome of quality verification. */
public enum Verdict {
    ACCEPT,
    REJECT
}
