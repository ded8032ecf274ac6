package org.udb.condition;

/**
 * Visitatore dei tipi di {@link Clause}.
 */
public interface ClauseVisitor<R> {

    R visitAllOf(Clause.AllOf clause);

    R visitAnyOf(Clause.AnyOf clause);

    R visitOneOf(Clause.OneOf clause);

    R visitNoneOf(Clause.NoneOf clause);

    R visitNot(Clause.Not clause);

    R visitIfThen(Clause.IfThen clause);

    R visitExtension(Clause.ExtensionClause clause);

    R visitParam(Clause.ParamClause clause);

    R visitXlen(Clause.XlenClause clause);

    R visitConstant(Clause.Constant clause);
}
