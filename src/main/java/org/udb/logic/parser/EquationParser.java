package org.udb.logic.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.udb.logic.LogicNode;
import org.udb.term.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * PARSER EQUAZIONI - Da testo eqntott ad albero logico
 *
 * Visitor sull'albero sintattico della grammatica Eqn. I nomi vengono risolti
 * attraverso la mappa nome → termine prodotta da {@link LogicNode#toEqntott()}.
 *
 * Operatori (precedenza crescente): '|' (OR), '&' (AND), '!' (NOT).
 * Costanti: ZERO/0, ONE/1, e "()" che vale vero.
 */
public class EquationParser extends EqnBaseVisitor<LogicNode> {

    private static final Logger LOGGER = Logger.getLogger(EquationParser.class.getName());

    private final Map<String, Term> termMap;

    private EquationParser(Map<String, Term> termMap) {
        this.termMap = termMap;
    }

    /**
     * @throws IllegalArgumentException se il testo non è sintatticamente valido
     *         o riferisce un nome assente dalla mappa
     */
    public static LogicNode parse(String text, Map<String, Term> termMap) {
        EqnLexer lexer = new EqnLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailingErrorListener.INSTANCE);
        EqnParser parser = new EqnParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailingErrorListener.INSTANCE);

        LogicNode result = new EquationParser(termMap).visit(parser.equation());
        LOGGER.finest(() -> "Equazione interpretata: " + text + " → " + result);
        return result;
    }

    //region REGOLE

    @Override
    public LogicNode visitEquation(EqnParser.EquationContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public LogicNode visitExpression(EqnParser.ExpressionContext ctx) {
        List<LogicNode> operands = new ArrayList<>();
        for (EqnParser.ConjunctionContext c : ctx.conjunction()) {
            operands.add(visit(c));
        }
        return LogicNode.disjunction(operands);
    }

    @Override
    public LogicNode visitConjunction(EqnParser.ConjunctionContext ctx) {
        List<LogicNode> operands = new ArrayList<>();
        for (EqnParser.UnaryContext u : ctx.unary()) {
            operands.add(visit(u));
        }
        return LogicNode.conjunction(operands);
    }

    @Override
    public LogicNode visitEmptyParen(EqnParser.EmptyParenContext ctx) {
        return LogicNode.TRUE;
    }

    @Override
    public LogicNode visitParen(EqnParser.ParenContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public LogicNode visitNot(EqnParser.NotContext ctx) {
        return LogicNode.not(visit(ctx.unary()));
    }

    @Override
    public LogicNode visitZero(EqnParser.ZeroContext ctx) {
        return LogicNode.FALSE;
    }

    @Override
    public LogicNode visitOne(EqnParser.OneContext ctx) {
        return LogicNode.TRUE;
    }

    @Override
    public LogicNode visitName(EqnParser.NameContext ctx) {
        String name = ctx.NAME().getText();
        Term term = termMap.get(name);
        if (term == null) {
            throw new IllegalArgumentException("Nome sconosciuto nell'equazione: '" + name + "'");
        }
        return LogicNode.term(term);
    }

    //endregion

    /** Trasforma gli errori sintattici in eccezioni invece di stamparli su stderr. */
    private static final class FailingErrorListener extends BaseErrorListener {

        static final FailingErrorListener INSTANCE = new FailingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new IllegalArgumentException(
                    "Equazione non valida alla posizione " + line + ":" + charPositionInLine + ": " + msg, e);
        }
    }
}
