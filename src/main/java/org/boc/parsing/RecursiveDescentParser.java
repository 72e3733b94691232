package org.boc.parsing;

import org.boc.belief.DecayCurve;
import org.boc.helper.Tuple;
import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.Expressions;
import org.boc.parsing.ast.Program;
import org.boc.parsing.ast.Statement;
import org.boc.parsing.ast.expressions.ArrayExpression;
import org.boc.parsing.ast.expressions.EntityExpression;
import org.boc.parsing.ast.expressions.Identifier;
import org.boc.parsing.ast.expressions.Literal;
import org.boc.parsing.ast.expressions.ObjectExpression;
import org.boc.parsing.ast.expressions.UncertaintyExpression;
import org.boc.parsing.ast.statements.AgentCoordination;
import org.boc.parsing.ast.statements.Assignment;
import org.boc.parsing.ast.statements.Belief;
import org.boc.parsing.ast.statements.BodyEntry;
import org.boc.parsing.ast.statements.CalculateWithUncertainty;
import org.boc.parsing.ast.statements.ConfidenceDecay;
import org.boc.parsing.ast.statements.Intent;
import org.boc.parsing.ast.statements.Provenance;
import org.boc.parsing.ast.statements.ReasoningContext;
import org.boc.parsing.ast.statements.SelfCapability;
import org.boc.parsing.ast.statements.SharedState;
import org.boc.parsing.ast.statements.StructuredKnowledge;
import org.boc.parsing.ast.statements.UpdateBelief;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Program} from the tokens of a {@link Lexer}, one token of lookahead, no backtracking.
 *
 * There is no error recovery: the first token that does not fit raises a {@link ParseException} and
 * the whole parse is abandoned.
 */
public class RecursiveDescentParser {

    private static final Logger LOG = LoggerFactory.getLogger(RecursiveDescentParser.class);

    private final Lexer lexer;
    private final Clock clock;
    private Token current;

    public RecursiveDescentParser(Lexer lexer) {
        this(lexer, Clock.systemUTC());
    }

    public RecursiveDescentParser(Lexer lexer, Clock clock) {
        this.lexer = lexer;
        this.clock = clock;
    }

    /**
     * Parses and returns every statement up to EOF.
     *
     * @throws LexException on input the lexer rejects
     * @throws ParseException on the first token out of place
     */
    public Program parseProgram() {
        current = lexer.nextToken();
        List<Statement> statements = new ArrayList<Statement>();
        while (!current.is(TokenType.EOF)) {
            Statement statement = parseStatement();
            LOG.debug("Parsed {} statement ending before {}", statement.getType(), current);
            statements.add(statement);
        }
        return new Program(statements);
    }

    public static Program parse(String source) {
        return new RecursiveDescentParser(new Lexer(source)).parseProgram();
    }

    private Token eat(TokenType type) {
        if (!current.is(type)) {
            throw new ParseException(ParserErrors.UnexpectedToken, type.name(), current);
        }
        Token eaten = current;
        current = lexer.nextToken();
        return eaten;
    }

    // an identifier whose text selects an optional clause, e.g. "evidence:"
    private boolean atWord(String word) {
        return current.is(TokenType.IDENTIFIER) && current.getText().equals(word);
    }

    private Statement parseStatement() {
        switch (current.getType()) {
            case BELIEF:
                return parseBelief();
            case REASONING_CONTEXT:
                eat(TokenType.REASONING_CONTEXT);
                return new ReasoningContext(parseAttributes(), parseBlockContent());
            case INTENT:
                return parseIntent();
            case SHARED_STATE:
                eat(TokenType.SHARED_STATE);
                return new SharedState(parseAttributes(), parseBlockContent());
            case SELF_CAPABILITY:
                eat(TokenType.SELF_CAPABILITY);
                return new SelfCapability(parseAttributes(), parseBlockContent());
            case CALCULATE_WITH_UNCERTAINTY:
                eat(TokenType.CALCULATE_WITH_UNCERTAINTY);
                return new CalculateWithUncertainty(parseAttributes(), parseBlockContent());
            case STRUCTURED_KNOWLEDGE:
                eat(TokenType.STRUCTURED_KNOWLEDGE);
                return new StructuredKnowledge(parseAttributes(), parseBlockContent());
            case UPDATE_BELIEF:
                return parseUpdateBelief();
            case CONFIDENCE_DECAY:
                return parseConfidenceDecay();
            case AGENT_COORDINATION:
                return parseAgentCoordination();
            case PROVENANCE:
                return parseProvenance();
            case IDENTIFIER:
                return parseAssignment();
            default:
                throw new ParseException(ParserErrors.UnexpectedStatement, "statement keyword or identifier", current);
        }
    }

    private Belief parseBelief() {
        eat(TokenType.BELIEF);
        Map<String, Expression> attributes = new LinkedHashMap<String, Expression>();
        if (atWord(Belief.CONFIDENCE)) {
            eat(TokenType.IDENTIFIER);
            eat(TokenType.ASSIGN);
            attributes.put(Belief.CONFIDENCE, parseExpression());
        }
        attributes.putAll(parseAttributes());
        return new Belief(attributes, parseBlockContent());
    }

    private Intent parseIntent() {
        eat(TokenType.INTENT);
        Expression action = null;
        if (atWord(Intent.TO_PERFORM)) {
            eat(TokenType.IDENTIFIER);
            eat(TokenType.COLON);
            action = parseExpression();
        }
        return new Intent(action, parseAttributes(), parseBlockContent());
    }

    private UpdateBelief parseUpdateBelief() {
        eat(TokenType.UPDATE_BELIEF);
        String beliefName = eat(TokenType.IDENTIFIER).getText();
        eat(TokenType.LPAREN);
        Expression confidence = parseExpression();
        eat(TokenType.RPAREN);

        Expression evidence = null;
        if (atWord(UpdateBelief.EVIDENCE)) {
            eat(TokenType.IDENTIFIER);
            eat(TokenType.COLON);
            evidence = parseExpression();
        }
        return new UpdateBelief(beliefName, confidence, evidence, clock.instant());
    }

    private ConfidenceDecay parseConfidenceDecay() {
        eat(TokenType.CONFIDENCE_DECAY);
        String beliefName = eat(TokenType.IDENTIFIER).getText();
        eat(TokenType.LPAREN);
        Expression decaySpec = parseExpression();
        eat(TokenType.RPAREN);

        Expression periodSpec = null;
        if (atWord(ConfidenceDecay.PERIOD)) {
            eat(TokenType.IDENTIFIER);
            eat(TokenType.COLON);
            periodSpec = parseExpression();
        }

        Tuple<DecayCurve, Double> curve = DecaySpecification.parseCurve(Expressions.asFreeText(decaySpec));
        Duration period = DecaySpecification.parsePeriod(Expressions.asFreeText(periodSpec));
        return new ConfidenceDecay(beliefName, decaySpec, periodSpec, curve.getA(), curve.getB(), period);
    }

    private AgentCoordination parseAgentCoordination() {
        eat(TokenType.AGENT_COORDINATION);
        Expression coordinator = null;
        if (atWord(AgentCoordination.COORDINATOR)) {
            eat(TokenType.IDENTIFIER);
            eat(TokenType.COLON);
            coordinator = parseExpression();
        }

        List<BodyEntry> body = parseBlockContent();
        Expression participants = null;
        Expression coordinationType = null;
        Expression constraints = null;
        for (BodyEntry entry : body) {
            if (!entry.isKeyValue()) {
                continue;
            }
            if (AgentCoordination.PARTICIPANTS.equals(entry.getKey())) {
                participants = entry.getValue();
            }
            else if (AgentCoordination.TYPE.equals(entry.getKey())) {
                coordinationType = entry.getValue();
            }
            else if (AgentCoordination.CONSTRAINTS.equals(entry.getKey())) {
                constraints = entry.getValue();
            }
            else if (coordinator == null && AgentCoordination.COORDINATOR.equals(entry.getKey())) {
                coordinator = entry.getValue();
            }
        }
        return new AgentCoordination(coordinator, body, Expressions.asItems(participants), coordinationType,
                Expressions.asItems(constraints));
    }

    private Provenance parseProvenance() {
        eat(TokenType.PROVENANCE);
        List<BodyEntry> body = parseBlockContent();
        Expression source = null;
        Expression timestamp = null;
        Expression chain = null;
        for (BodyEntry entry : body) {
            if (!entry.isKeyValue()) {
                continue;
            }
            if (Provenance.SOURCE.equals(entry.getKey())) {
                source = entry.getValue();
            }
            else if (Provenance.TIMESTAMP.equals(entry.getKey())) {
                timestamp = entry.getValue();
            }
            else if (Provenance.CHAIN_OF_CUSTODY.equals(entry.getKey())) {
                chain = entry.getValue();
            }
        }
        return new Provenance(body, source, timestamp, Expressions.asItems(chain));
    }

    private Assignment parseAssignment() {
        String key = eat(TokenType.IDENTIFIER).getText();
        eat(TokenType.ASSIGN);
        return new Assignment(key, parseExpression());
    }

    // {'@' <identifier> ['(' <expression> ')']}
    private Map<String, Expression> parseAttributes() {
        Map<String, Expression> attributes = new LinkedHashMap<String, Expression>();
        while (current.is(TokenType.AT)) {
            eat(TokenType.AT);
            String name = eat(TokenType.IDENTIFIER).getText();
            Expression value;
            if (current.is(TokenType.LPAREN)) {
                eat(TokenType.LPAREN);
                value = parseExpression();
                eat(TokenType.RPAREN);
            }
            else {
                value = Literal.bool(true);
            }
            attributes.put(name, value);
        }
        return attributes;
    }

    // '{' {<identifier> ':' <expression> | <expression>} '}'
    private List<BodyEntry> parseBlockContent() {
        eat(TokenType.LBRACE);
        List<BodyEntry> body = new ArrayList<BodyEntry>();
        while (!current.is(TokenType.RBRACE)) {
            if (current.is(TokenType.IDENTIFIER)) {
                String key = eat(TokenType.IDENTIFIER).getText();
                eat(TokenType.COLON);
                body.add(BodyEntry.keyValue(key, parseExpression()));
            }
            else {
                body.add(BodyEntry.bare(parseExpression()));
            }
        }
        eat(TokenType.RBRACE);
        return body;
    }

    private Expression parseExpression() {
        switch (current.getType()) {
            case LBRACKET:
                return parseArray();
            case LBRACE:
                return parseObject();
            case ENTITY:
                return parseEntity();
            case UNCERTAINTY: {
                Token bound = eat(TokenType.UNCERTAINTY);
                return new UncertaintyExpression(null, toNumber(bound, bound.getText().substring(1)));
            }
            case NUMBER: {
                Token number = eat(TokenType.NUMBER);
                double value = toNumber(number, number.getText());
                // 22.5 ±0.1 is a single measured value
                if (current.is(TokenType.UNCERTAINTY)) {
                    Token bound = eat(TokenType.UNCERTAINTY);
                    return new UncertaintyExpression(value, toNumber(bound, bound.getText().substring(1)));
                }
                return Literal.number(number.getText());
            }
            case STRING:
                return Literal.string(eat(TokenType.STRING).getText());
            case BOOLEAN:
                return Literal.bool(Boolean.parseBoolean(eat(TokenType.BOOLEAN).getText()));
            case IDENTIFIER:
                return new Identifier(eat(TokenType.IDENTIFIER).getText());
            default:
                throw new ParseException(ParserErrors.UnexpectedExpression, "expression", current);
        }
    }

    private ArrayExpression parseArray() {
        eat(TokenType.LBRACKET);
        List<Expression> items = new ArrayList<Expression>();
        if (!current.is(TokenType.RBRACKET)) {
            items.add(parseExpression());
            while (!current.is(TokenType.RBRACKET)) {
                if (!current.is(TokenType.COMMA)) {
                    throw new ParseException(ParserErrors.MissingSeparator, "COMMA or RBRACKET", current);
                }
                eat(TokenType.COMMA);
                items.add(parseExpression());
            }
        }
        eat(TokenType.RBRACKET);
        return new ArrayExpression(items);
    }

    private ObjectExpression parseObject() {
        eat(TokenType.LBRACE);
        Map<String, Expression> properties = new LinkedHashMap<String, Expression>();
        while (!current.is(TokenType.RBRACE)) {
            String key;
            if (current.is(TokenType.IDENTIFIER) || current.is(TokenType.STRING)) {
                key = eat(current.getType()).getText();
            }
            else {
                throw new ParseException(ParserErrors.InvalidObjectKey, "IDENTIFIER or STRING", current);
            }
            eat(TokenType.COLON);
            properties.put(key, parseExpression());
            if (current.is(TokenType.COMMA)) {
                eat(TokenType.COMMA);
            }
        }
        eat(TokenType.RBRACE);
        return new ObjectExpression(properties);
    }

    private EntityExpression parseEntity() {
        eat(TokenType.ENTITY);
        eat(TokenType.LPAREN);
        Expression name = parseExpression();
        eat(TokenType.COMMA);
        ObjectExpression properties = parseObject();
        eat(TokenType.RPAREN);
        return new EntityExpression(name, properties);
    }

    private static double toNumber(Token token, String text) {
        try {
            return Double.parseDouble(text);
        }
        catch (NumberFormatException e) {
            throw new ParseException(ParserErrors.MalformedNumber, "number", token, e);
        }
    }
}
