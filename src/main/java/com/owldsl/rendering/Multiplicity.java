// com/owldsl/rendering/Multiplicity.java
package com.owldsl.rendering;

/**
 * Grammatical number used to pick a phrase template
 */
public enum Multiplicity {
    SINGULAR,
    PLURAL
}
