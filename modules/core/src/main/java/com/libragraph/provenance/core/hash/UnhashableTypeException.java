package com.libragraph.provenance.core.hash;

/**
 * Thrown when a value's runtime type has no structural hashing rule.
 */
public class UnhashableTypeException extends IllegalArgumentException {

    private final Class<?> valueType;

    public UnhashableTypeException(Class<?> valueType) {
        super("Value of type " + valueType.getName() + " cannot be hashed");
        this.valueType = valueType;
    }

    public Class<?> valueType() {
        return valueType;
    }
}
