package org.iceforge.hugin.semantic.compiler;

/**
 * How filter values are written into SQL text.
 */
public enum LiteralPolicy {
    /**
     * Values come from trusted configuration: strings are wrapped in single quotes as-is,
     * HAVING values are inserted raw.
     */
    TRUSTED,
    /**
     * Values may come from end users: embedded single quotes are doubled and string
     * HAVING values are quoted too.
     */
    ESCAPED
}
