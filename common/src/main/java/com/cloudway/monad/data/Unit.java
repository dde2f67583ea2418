/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.data;

/**
 * The unit type which has only one value.
 */
public enum Unit {
    /**
     * The only value of the unit type.
     */
    U;

    /**
     * Returns the string representation of the unit value.
     *
     * @return the string representation of the unit value
     */
    public String toString() {
        return "()";
    }
}
