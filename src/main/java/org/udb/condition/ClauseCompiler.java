package org.udb.condition;

import org.udb.logic.LogicNode;
import org.udb.term.ExtensionTerm;
import org.udb.term.ParameterTerm;
import org.udb.term.XlenTerm;

import java.util.ArrayList;
import java.util.List;

/**
 * Traduzione letterale di una clausola in albero logico, senza espansione.
 * noneOf diventa sempre NOR.
 */
final class ClauseCompiler implements ClauseVisitor<LogicNode> {

    static final ClauseCompiler INSTANCE = new ClauseCompiler();

    private ClauseCompiler() {
    }

    static LogicNode compile(Clause clause) {
        return clause.accept(INSTANCE);
    }

    private List<LogicNode> compileAll(List<Clause> clauses) {
        List<LogicNode> out = new ArrayList<>(clauses.size());
        for (Clause c : clauses) {
            out.add(c.accept(this));
        }
        return out;
    }

    @Override
    public LogicNode visitAllOf(Clause.AllOf clause) {
        return LogicNode.conjunction(compileAll(clause.clauses()));
    }

    @Override
    public LogicNode visitAnyOf(Clause.AnyOf clause) {
        return LogicNode.disjunction(compileAll(clause.clauses()));
    }

    @Override
    public LogicNode visitOneOf(Clause.OneOf clause) {
        List<LogicNode> children = compileAll(clause.clauses());
        if (children.size() == 1) {
            return children.get(0);
        }
        return LogicNode.xor(children);
    }

    @Override
    public LogicNode visitNoneOf(Clause.NoneOf clause) {
        List<LogicNode> children = compileAll(clause.clauses());
        if (children.size() == 1) {
            return LogicNode.not(children.get(0));
        }
        return LogicNode.none(children);
    }

    @Override
    public LogicNode visitNot(Clause.Not clause) {
        return LogicNode.not(clause.clause().accept(this));
    }

    @Override
    public LogicNode visitIfThen(Clause.IfThen clause) {
        return LogicNode.implies(clause.condition().accept(this), clause.consequent().accept(this));
    }

    @Override
    public LogicNode visitExtension(Clause.ExtensionClause clause) {
        try {
            return LogicNode.term(ExtensionTerm.fromRequirement(clause.name(), clause.requirement()));
        } catch (IllegalArgumentException e) {
            throw new MalformedConditionException("Requisito di estensione non valido", clause, e);
        }
    }

    @Override
    public LogicNode visitParam(Clause.ParamClause clause) {
        try {
            return LogicNode.term(new ParameterTerm(clause.comparison()));
        } catch (IllegalArgumentException e) {
            throw new MalformedConditionException("Confronto su parametro non valido", clause, e);
        }
    }

    @Override
    public LogicNode visitXlen(Clause.XlenClause clause) {
        return clause.xlen() == 32 ? LogicNode.XLEN32 : LogicNode.XLEN64;
    }

    @Override
    public LogicNode visitConstant(Clause.Constant clause) {
        return clause.value() ? LogicNode.TRUE : LogicNode.FALSE;
    }
}
