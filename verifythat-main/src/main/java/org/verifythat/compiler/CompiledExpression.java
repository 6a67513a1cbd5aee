package org.verifythat.compiler;

/**
 * An expression tree compiled to a closure. Each call re-runs the whole tree, side effects included.
 */
@FunctionalInterface
public interface CompiledExpression {

    Object evaluate();
}
