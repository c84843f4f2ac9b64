package co.fanki.faex.analysis.domain.python;

import co.fanki.faex.analysis.domain.python.PythonAst.Attribute;
import co.fanki.faex.analysis.domain.python.PythonAst.Call;
import co.fanki.faex.analysis.domain.python.PythonAst.ClassDef;
import co.fanki.faex.analysis.domain.python.PythonAst.Constant;
import co.fanki.faex.analysis.domain.python.PythonAst.ConstantKind;
import co.fanki.faex.analysis.domain.python.PythonAst.Expression;
import co.fanki.faex.analysis.domain.python.PythonAst.FunctionDef;
import co.fanki.faex.analysis.domain.python.PythonAst.GenericExpression;
import co.fanki.faex.analysis.domain.python.PythonAst.GenericStatement;
import co.fanki.faex.analysis.domain.python.PythonAst.Keyword;
import co.fanki.faex.analysis.domain.python.PythonAst.ListDisplay;
import co.fanki.faex.analysis.domain.python.PythonAst.Module;
import co.fanki.faex.analysis.domain.python.PythonAst.Name;
import co.fanki.faex.analysis.domain.python.PythonAst.Node;
import co.fanki.faex.analysis.domain.python.PythonAst.Raise;
import co.fanki.faex.analysis.domain.python.PythonAst.Statement;
import co.fanki.faex.analysis.domain.python.PythonToken.Type;
import co.fanki.faex.shared.Preconditions;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser for Python 3 source files.
 *
 * <p>The parser accepts the statement and expression grammar of current
 * Python versions, including decorators, async functions, structural
 * pattern matching, parenthesized context managers, walrus assignments and
 * comprehensions, and builds the reduced tree described in
 * {@link PythonAst}. It validates structure, not semantics: assignment
 * targets, {@code return} outside functions and similar compile-time
 * checks are not enforced.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * Module module = PythonParser.parse(source);
 * for (FunctionDef function : PythonAst.functions(module)) {
 *     ...
 * }
 * }</pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonParser {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else",
            "except", "finally", "for", "from", "global", "if", "import",
            "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    /** Keywords that may start an expression. */
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
            "None", "True", "False", "not", "lambda", "await", "yield");

    /** Operators that may start an expression. */
    private static final Set<String> EXPRESSION_OPERATORS = Set.of(
            "(", "[", "{", "-", "+", "~", "*", "...");

    private static final Set<String> AUGMENTED_ASSIGNMENTS = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=",
            ">>=", "<<=", "**=");

    private static final Set<String> COMPARISONS = Set.of(
            "<", ">", "==", ">=", "<=", "!=");

    /** Binary operators by precedence, loosest first. */
    private static final List<Set<String>> BINARY_LEVELS = List.of(
            Set.of("|"),
            Set.of("^"),
            Set.of("&"),
            Set.of("<<", ">>"),
            Set.of("+", "-"),
            Set.of("*", "/", "//", "%", "@"));

    /** Deepest chain of nested expressions, unary operators included. */
    private static final int MAX_NESTING = 500;

    private final List<PythonToken> tokens;

    private int index;

    /** Expressions currently open on the parse stack. */
    private int nesting;

    private PythonParser(final List<PythonToken> theTokens) {
        this.tokens = theTokens;
    }

    /**
     * Parses a complete source file.
     *
     * @param source the decoded source text
     * @return the module tree
     * @throws PythonSyntaxException if the source is not valid Python
     */
    public static Module parse(final String source)
            throws PythonSyntaxException {
        Preconditions.requireNonNull(source, "Source is required");
        final List<PythonToken> tokens;
        try {
            tokens = PythonTokenizer.tokenize(source);
        } catch (final StackOverflowError e) {
            throw new PythonSyntaxException("too many nested f-strings", 1,
                    0);
        }

        final PythonParser parser = new PythonParser(tokens);
        try {
            return parser.parseModule();
        } catch (final StackOverflowError e) {
            throw error("too many nested statements or expressions",
                    parser.peek());
        }
    }

    private Module parseModule() throws PythonSyntaxException {
        final List<Statement> body = new ArrayList<>();
        while (peek().type() != Type.END_MARKER) {
            body.addAll(parseStatement());
        }
        return new Module(body);
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private List<Statement> parseStatement() throws PythonSyntaxException {
        final PythonToken token = peek();

        if (token.type() == Type.INDENT) {
            throw error("unexpected indent", token);
        }
        if (token.isOperator("@")) {
            return List.of(parseDecorated());
        }
        if (token.type() != Type.NAME) {
            return parseSimpleStatements();
        }

        switch (token.text()) {
            case "def":
                return List.of(parseFunction(List.of()));
            case "class":
                return List.of(parseClass(List.of()));
            case "if":
                return List.of(parseIf());
            case "while":
                return List.of(parseWhile());
            case "for":
                return List.of(parseFor());
            case "try":
                return List.of(parseTry());
            case "with":
                return List.of(parseWith());
            case "async":
                return List.of(parseAsync());
            case "match":
                if (looksLikeMatch()) {
                    return List.of(parseMatch());
                }
                return parseSimpleStatements();
            default:
                return parseSimpleStatements();
        }
    }

    private Statement parseAsync() throws PythonSyntaxException {
        final PythonToken after = peek(1);
        if (after.isName("def")) {
            return parseFunction(List.of());
        }
        if (after.isName("for")) {
            return parseFor();
        }
        if (after.isName("with")) {
            return parseWith();
        }
        throw error("invalid syntax", after);
    }

    private Statement parseDecorated() throws PythonSyntaxException {
        final List<Expression> decorators = new ArrayList<>();
        while (acceptOperator("@")) {
            decorators.add(parseNamedExpression());
            expectNewline();
        }

        final PythonToken token = peek();
        if (token.isName("def")
                || (token.isName("async") && peek(1).isName("def"))) {
            return parseFunction(decorators);
        }
        if (token.isName("class")) {
            return parseClass(decorators);
        }
        throw error("invalid syntax", token);
    }

    private FunctionDef parseFunction(final List<Expression> decorators)
            throws PythonSyntaxException {
        final PythonToken start = peek();
        final boolean async = acceptName("async");
        expectName("def");
        final PythonToken name = expectIdentifier();

        final List<Node> signature = new ArrayList<>();
        parseTypeParameters(signature);
        expectOperator("(");
        parseParameters(")", true, signature);
        expectOperator(")");
        if (acceptOperator("->")) {
            signature.add(parseExpression());
        }
        expectOperator(":");
        final List<Statement> body = parseBlock();

        return new FunctionDef(name.text(), decorators, signature, body,
                async, start.line(), start.column());
    }

    private ClassDef parseClass(final List<Expression> decorators)
            throws PythonSyntaxException {
        final PythonToken start = expectName("class");
        final PythonToken name = expectIdentifier();

        final List<Node> bases = new ArrayList<>();
        parseTypeParameters(bases);
        if (acceptOperator("(")) {
            final List<Expression> args = new ArrayList<>();
            final List<Keyword> keywords = new ArrayList<>();
            parseArguments(args, keywords);
            expectOperator(")");
            bases.addAll(args);
            bases.addAll(keywords);
        }
        expectOperator(":");
        final List<Statement> body = parseBlock();

        return new ClassDef(name.text(), decorators, bases, body,
                start.line(), start.column());
    }

    /** Parses an optional {@code [T, *Ts, **P]} type parameter list. */
    private void parseTypeParameters(final List<Node> into)
            throws PythonSyntaxException {
        if (!acceptOperator("[")) {
            return;
        }
        while (!atOperator("]")) {
            if (!acceptOperator("**")) {
                acceptOperator("*");
            }
            expectIdentifier();
            if (acceptOperator(":")) {
                into.add(parseExpression());
            }
            if (acceptOperator("=")) {
                into.add(parseExpression());
            }
            if (!acceptOperator(",")) {
                break;
            }
        }
        expectOperator("]");
    }

    /**
     * Parses a parameter list up to (not including) {@code closer}, adding
     * defaults and, when allowed, annotations to {@code signature}.
     */
    private void parseParameters(final String closer,
            final boolean annotations, final List<Node> signature)
            throws PythonSyntaxException {
        while (!atOperator(closer)) {
            if (acceptOperator("/")) {
                // positional-only marker
            } else if (acceptOperator("*")) {
                if (peek().type() == Type.NAME) {
                    parseParameterName(annotations, signature);
                }
            } else if (acceptOperator("**")) {
                parseParameterName(annotations, signature);
            } else {
                parseParameterName(annotations, signature);
                if (acceptOperator("=")) {
                    signature.add(parseExpression());
                }
            }
            if (!acceptOperator(",")) {
                break;
            }
        }
    }

    private void parseParameterName(final boolean annotations,
            final List<Node> signature) throws PythonSyntaxException {
        expectIdentifier();
        if (annotations && acceptOperator(":")) {
            signature.add(parseStarOrExpression());
        }
    }

    private Statement parseIf() throws PythonSyntaxException {
        // consumes either "if" or "elif"
        final PythonToken start = next();
        final List<Node> children = new ArrayList<>();
        children.add(parseNamedExpression());
        expectOperator(":");
        children.addAll(parseBlock());

        if (atName("elif")) {
            children.add(parseIf());
        } else if (acceptName("else")) {
            expectOperator(":");
            children.addAll(parseBlock());
        }
        return statement("If", children, start);
    }

    private Statement parseWhile() throws PythonSyntaxException {
        final PythonToken start = expectName("while");
        final List<Node> children = new ArrayList<>();
        children.add(parseNamedExpression());
        expectOperator(":");
        children.addAll(parseBlock());
        parseElseClause(children);
        return statement("While", children, start);
    }

    private Statement parseFor() throws PythonSyntaxException {
        final PythonToken start = peek();
        final boolean async = acceptName("async");
        expectName("for");

        final List<Node> children = new ArrayList<>();
        children.add(parseTargetList());
        expectName("in");
        children.add(parseStarExpressions());
        expectOperator(":");
        children.addAll(parseBlock());
        parseElseClause(children);
        return statement(async ? "AsyncFor" : "For", children, start);
    }

    private void parseElseClause(final List<Node> children)
            throws PythonSyntaxException {
        if (acceptName("else")) {
            expectOperator(":");
            children.addAll(parseBlock());
        }
    }

    private Statement parseTry() throws PythonSyntaxException {
        final PythonToken start = expectName("try");
        expectOperator(":");
        final List<Node> children = new ArrayList<>(parseBlock());

        boolean handled = false;
        while (atName("except")) {
            final PythonToken handler = next();
            acceptOperator("*");
            final List<Node> handlerChildren = new ArrayList<>();
            if (!atOperator(":")) {
                handlerChildren.add(parseExpression());
                while (acceptOperator(",")) {
                    handlerChildren.add(parseExpression());
                }
                if (acceptName("as")) {
                    expectIdentifier();
                }
            }
            expectOperator(":");
            handlerChildren.addAll(parseBlock());
            children.add(statement("ExceptHandler", handlerChildren,
                    handler));
            handled = true;
        }

        if (handled) {
            parseElseClause(children);
        }
        if (acceptName("finally")) {
            expectOperator(":");
            children.addAll(parseBlock());
            handled = true;
        }
        if (!handled) {
            throw error("expected 'except' or 'finally' block", peek());
        }
        return statement("Try", children, start);
    }

    private Statement parseWith() throws PythonSyntaxException {
        final PythonToken start = peek();
        final boolean async = acceptName("async");
        expectName("with");

        List<Node> items = null;
        if (atOperator("(")) {
            final int mark = index;
            try {
                next();
                items = parseWithItems(true);
                expectOperator(")");
                expectOperator(":");
            } catch (final PythonSyntaxException e) {
                // a parenthesized expression, not an item list
                index = mark;
                items = null;
            }
        }
        if (items == null) {
            items = parseWithItems(false);
            expectOperator(":");
        }

        final List<Node> children = new ArrayList<>(items);
        children.addAll(parseBlock());
        return statement(async ? "AsyncWith" : "With", children, start);
    }

    private List<Node> parseWithItems(final boolean parenthesized)
            throws PythonSyntaxException {
        final List<Node> items = new ArrayList<>();
        do {
            if (parenthesized && atOperator(")")) {
                break;
            }
            items.add(parseExpression());
            if (acceptName("as")) {
                items.add(parseStarTarget());
            }
        } while (acceptOperator(","));
        return items;
    }

    /**
     * Decides whether a statement starting with the soft keyword
     * {@code match} is a match statement rather than an expression.
     */
    private boolean looksLikeMatch() {
        final int mark = index;
        try {
            next();
            if (!canStartExpression(peek())) {
                return false;
            }
            parseStarExpressions();
            return atOperator(":") && peek(1).type() == Type.NEWLINE;
        } catch (final PythonSyntaxException e) {
            return false;
        } finally {
            index = mark;
        }
    }

    private Statement parseMatch() throws PythonSyntaxException {
        final PythonToken start = next();
        final List<Node> children = new ArrayList<>();
        children.add(parseStarExpressions());
        expectOperator(":");
        expectNewline();
        if (peek().type() != Type.INDENT) {
            throw error("expected an indented block", peek());
        }
        next();

        while (peek().type() != Type.DEDENT) {
            final PythonToken caseToken = peek();
            if (!caseToken.isName("case")) {
                throw error("expected 'case' block", caseToken);
            }
            next();
            skipPattern();
            final List<Node> caseChildren = new ArrayList<>();
            if (acceptName("if")) {
                caseChildren.add(parseNamedExpression());
            }
            expectOperator(":");
            caseChildren.addAll(parseBlock());
            children.add(statement("MatchCase", caseChildren, caseToken));
        }
        next();
        return statement("Match", children, start);
    }

    /** Skips a case pattern up to its guard or its colon. */
    private void skipPattern() throws PythonSyntaxException {
        int depth = 0;
        while (true) {
            final PythonToken token = peek();
            if (token.type() == Type.NEWLINE
                    || token.type() == Type.END_MARKER) {
                throw error("expected ':'", token);
            }
            if (depth == 0 && (token.isOperator(":") || token.isName("if"))) {
                return;
            }
            if (token.isOperator("(") || token.isOperator("[")
                    || token.isOperator("{")) {
                depth++;
            } else if (token.isOperator(")") || token.isOperator("]")
                    || token.isOperator("}")) {
                depth--;
            }
            next();
        }
    }

    /** Parses the body after a colon: an indented block or a simple line. */
    private List<Statement> parseBlock() throws PythonSyntaxException {
        if (peek().type() != Type.NEWLINE) {
            return parseSimpleStatements();
        }
        next();
        if (peek().type() != Type.INDENT) {
            throw error("expected an indented block", peek());
        }
        next();

        final List<Statement> body = new ArrayList<>();
        while (peek().type() != Type.DEDENT) {
            body.addAll(parseStatement());
        }
        next();
        return body;
    }

    private List<Statement> parseSimpleStatements()
            throws PythonSyntaxException {
        final List<Statement> statements = new ArrayList<>();
        statements.add(parseSimpleStatement());
        while (acceptOperator(";")) {
            if (peek().type() == Type.NEWLINE) {
                break;
            }
            statements.add(parseSimpleStatement());
        }
        expectNewline();
        return statements;
    }

    private Statement parseSimpleStatement() throws PythonSyntaxException {
        final PythonToken token = peek();
        if (token.type() != Type.NAME) {
            return parseExpressionStatement();
        }

        switch (token.text()) {
            case "pass":
                next();
                return statement("Pass", List.of(), token);
            case "break":
                next();
                return statement("Break", List.of(), token);
            case "continue":
                next();
                return statement("Continue", List.of(), token);
            case "return":
                next();
                return statement("Return", atSimpleStatementEnd()
                        ? List.of() : List.of(parseStarExpressions()), token);
            case "raise":
                return parseRaise();
            case "global":
            case "nonlocal":
                next();
                do {
                    expectIdentifier();
                } while (acceptOperator(","));
                return statement("Global", List.of(), token);
            case "del":
                next();
                return statement("Delete", List.of(parseStarExpressions()),
                        token);
            case "assert":
                return parseAssert();
            case "import":
                return parseImport();
            case "from":
                return parseFromImport();
            case "type":
                if (peek(1).type() == Type.NAME && (peek(2).isOperator("=")
                        || peek(2).isOperator("["))) {
                    return parseTypeAlias();
                }
                return parseExpressionStatement();
            default:
                return parseExpressionStatement();
        }
    }

    private Statement parseRaise() throws PythonSyntaxException {
        final PythonToken start = expectName("raise");
        if (atSimpleStatementEnd()) {
            return new Raise(null, null, start.line(), start.column());
        }
        final Expression exception = parseExpression();
        Expression cause = null;
        if (acceptName("from")) {
            cause = parseExpression();
        }
        return new Raise(exception, cause, start.line(), start.column());
    }

    private Statement parseAssert() throws PythonSyntaxException {
        final PythonToken start = expectName("assert");
        final List<Node> children = new ArrayList<>();
        children.add(parseExpression());
        if (acceptOperator(",")) {
            children.add(parseExpression());
        }
        return statement("Assert", children, start);
    }

    private Statement parseImport() throws PythonSyntaxException {
        final PythonToken start = expectName("import");
        do {
            parseDottedName();
            if (acceptName("as")) {
                expectIdentifier();
            }
        } while (acceptOperator(","));
        return statement("Import", List.of(), start);
    }

    private Statement parseFromImport() throws PythonSyntaxException {
        final PythonToken start = expectName("from");
        boolean relative = false;
        while (acceptOperator(".") || acceptOperator("...")) {
            relative = true;
        }
        if (!relative || !atName("import")) {
            parseDottedName();
        }
        expectName("import");

        if (acceptOperator("*")) {
            return statement("ImportFrom", List.of(), start);
        }
        final boolean parenthesized = acceptOperator("(");
        do {
            if (parenthesized && atOperator(")")) {
                break;
            }
            expectIdentifier();
            if (acceptName("as")) {
                expectIdentifier();
            }
        } while (acceptOperator(","));
        if (parenthesized) {
            expectOperator(")");
        }
        return statement("ImportFrom", List.of(), start);
    }

    private void parseDottedName() throws PythonSyntaxException {
        expectIdentifier();
        while (acceptOperator(".")) {
            expectIdentifier();
        }
    }

    private Statement parseTypeAlias() throws PythonSyntaxException {
        final PythonToken start = next();
        expectIdentifier();
        final List<Node> children = new ArrayList<>();
        parseTypeParameters(children);
        expectOperator("=");
        children.add(parseExpression());
        return statement("TypeAlias", children, start);
    }

    private Statement parseExpressionStatement() throws PythonSyntaxException {
        final PythonToken start = peek();
        final Expression first = atName("yield")
                ? parseYield() : parseStarExpressions();

        final List<Node> children = new ArrayList<>();
        children.add(first);

        if (acceptOperator(":")) {
            children.add(parseExpression());
            if (acceptOperator("=")) {
                children.add(parseAssignedValue());
            }
            return statement("AnnAssign", children, start);
        }

        final PythonToken operator = peek();
        if (operator.type() == Type.OPERATOR
                && AUGMENTED_ASSIGNMENTS.contains(operator.text())) {
            next();
            children.add(parseAssignedValue());
            return statement("AugAssign", children, start);
        }

        if (atOperator("=")) {
            while (acceptOperator("=")) {
                children.add(parseAssignedValue());
            }
            return statement("Assign", children, start);
        }

        return statement("Expr", children, start);
    }

    private Expression parseAssignedValue() throws PythonSyntaxException {
        if (atName("yield")) {
            return parseYield();
        }
        return parseStarExpressions();
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    private Expression parseYield() throws PythonSyntaxException {
        final PythonToken start = expectName("yield");
        final List<Node> children = new ArrayList<>();
        if (acceptName("from")) {
            children.add(parseExpression());
        } else if (canStartExpression(peek())) {
            children.add(parseStarExpressions());
        }
        return expression("Yield", children, start);
    }

    /** Parses an expression list, building a tuple when commas appear. */
    private Expression parseStarExpressions() throws PythonSyntaxException {
        final PythonToken start = peek();
        final Expression first = parseStarOrNamed();
        if (!atOperator(",")) {
            return first;
        }

        final List<Node> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOperator(",")) {
            if (!canStartExpression(peek())) {
                break;
            }
            elements.add(parseStarOrNamed());
        }
        return expression("Tuple", elements, start);
    }

    /** Parses the target list of a {@code for} loop or comprehension. */
    private Expression parseTargetList() throws PythonSyntaxException {
        final PythonToken start = peek();
        final Expression first = parseStarTarget();
        if (!atOperator(",")) {
            return first;
        }

        final List<Node> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOperator(",")) {
            if (!canStartExpression(peek())) {
                break;
            }
            elements.add(parseStarTarget());
        }
        return expression("Tuple", elements, start);
    }

    private Expression parseStarTarget() throws PythonSyntaxException {
        final PythonToken start = peek();
        if (acceptOperator("*")) {
            return expression("Starred", List.of(parseBinary(0)), start);
        }
        return parseBinary(0);
    }

    private Expression parseStarOrNamed() throws PythonSyntaxException {
        final PythonToken start = peek();
        if (acceptOperator("*")) {
            return expression("Starred", List.of(parseBinary(0)), start);
        }
        return parseNamedExpression();
    }

    private Expression parseStarOrExpression() throws PythonSyntaxException {
        final PythonToken start = peek();
        if (acceptOperator("*")) {
            return expression("Starred", List.of(parseBinary(0)), start);
        }
        return parseExpression();
    }

    private Expression parseNamedExpression() throws PythonSyntaxException {
        final PythonToken start = peek();
        if (start.type() == Type.NAME && !KEYWORDS.contains(start.text())
                && peek(1).isOperator(":=")) {
            next();
            next();
            final Expression value = parseExpression();
            return expression("NamedExpr", List.of(
                    new Name(start.text(), start.line(), start.column()),
                    value), start);
        }
        return parseExpression();
    }

    private Expression parseExpression() throws PythonSyntaxException {
        enter();
        try {
            return parseConditional();
        } finally {
            nesting--;
        }
    }

    private Expression parseConditional() throws PythonSyntaxException {
        if (atName("lambda")) {
            return parseLambda();
        }

        final Expression body = parseDisjunction();
        if (!acceptName("if")) {
            return body;
        }
        final Expression test = parseDisjunction();
        expectName("else");
        final Expression orElse = parseExpression();
        return new GenericExpression("IfExp", List.of(body, test, orElse),
                body.line(), body.column());
    }

    private Expression parseLambda() throws PythonSyntaxException {
        final PythonToken start = expectName("lambda");
        final List<Node> children = new ArrayList<>();
        parseParameters(":", false, children);
        expectOperator(":");
        children.add(parseExpression());
        return expression("Lambda", children, start);
    }

    private Expression parseDisjunction() throws PythonSyntaxException {
        final Expression first = parseConjunction();
        if (!atName("or")) {
            return first;
        }
        final List<Node> operands = new ArrayList<>();
        operands.add(first);
        while (acceptName("or")) {
            operands.add(parseConjunction());
        }
        return new GenericExpression("BoolOp", operands, first.line(),
                first.column());
    }

    private Expression parseConjunction() throws PythonSyntaxException {
        final Expression first = parseInversion();
        if (!atName("and")) {
            return first;
        }
        final List<Node> operands = new ArrayList<>();
        operands.add(first);
        while (acceptName("and")) {
            operands.add(parseInversion());
        }
        return new GenericExpression("BoolOp", operands, first.line(),
                first.column());
    }

    private Expression parseInversion() throws PythonSyntaxException {
        final PythonToken start = peek();
        if (!acceptName("not")) {
            return parseComparison();
        }
        enter();
        try {
            return expression("UnaryOp", List.of(parseInversion()), start);
        } finally {
            nesting--;
        }
    }

    private Expression parseComparison() throws PythonSyntaxException {
        final Expression first = parseBinary(0);
        final List<Node> operands = new ArrayList<>();
        operands.add(first);

        while (acceptComparisonOperator()) {
            operands.add(parseBinary(0));
        }
        if (operands.size() == 1) {
            return first;
        }
        return new GenericExpression("Compare", operands, first.line(),
                first.column());
    }

    private boolean acceptComparisonOperator() {
        final PythonToken token = peek();
        if (token.type() == Type.OPERATOR
                && COMPARISONS.contains(token.text())) {
            next();
            return true;
        }
        if (token.isName("in")) {
            next();
            return true;
        }
        if (token.isName("not") && peek(1).isName("in")) {
            next();
            next();
            return true;
        }
        if (token.isName("is")) {
            next();
            acceptName("not");
            return true;
        }
        return false;
    }

    private Expression parseBinary(final int level)
            throws PythonSyntaxException {
        if (level == BINARY_LEVELS.size()) {
            return parseFactor();
        }

        Expression left = parseBinary(level + 1);
        while (peek().type() == Type.OPERATOR
                && BINARY_LEVELS.get(level).contains(peek().text())) {
            next();
            final Expression right = parseBinary(level + 1);
            left = new GenericExpression("BinOp", List.of(left, right),
                    left.line(), left.column());
        }
        return left;
    }

    private Expression parseFactor() throws PythonSyntaxException {
        final PythonToken start = peek();
        if (!acceptOperator("+") && !acceptOperator("-")
                && !acceptOperator("~")) {
            return parsePower();
        }
        enter();
        try {
            return expression("UnaryOp", List.of(parseFactor()), start);
        } finally {
            nesting--;
        }
    }

    private Expression parsePower() throws PythonSyntaxException {
        final Expression base = parseAwaitPrimary();
        if (!acceptOperator("**")) {
            return base;
        }
        final Expression exponent = parseFactor();
        return new GenericExpression("BinOp", List.of(base, exponent),
                base.line(), base.column());
    }

    private Expression parseAwaitPrimary() throws PythonSyntaxException {
        final PythonToken start = peek();
        if (acceptName("await")) {
            return expression("Await", List.of(parsePrimary()), start);
        }
        return parsePrimary();
    }

    private Expression parsePrimary() throws PythonSyntaxException {
        Expression expression = parseAtom();

        while (true) {
            if (acceptOperator(".")) {
                final PythonToken attribute = expectIdentifier();
                expression = new Attribute(expression, attribute.text(),
                        expression.line(), expression.column());
            } else if (acceptOperator("(")) {
                final List<Expression> args = new ArrayList<>();
                final List<Keyword> keywords = new ArrayList<>();
                parseArguments(args, keywords);
                expectOperator(")");
                expression = new Call(expression, args, keywords,
                        expression.line(), expression.column());
            } else if (acceptOperator("[")) {
                final Expression slice = parseSlices();
                expectOperator("]");
                expression = new GenericExpression("Subscript",
                        List.of(expression, slice), expression.line(),
                        expression.column());
            } else {
                return expression;
            }
        }
    }

    /** Parses call arguments up to (not including) the closing paren. */
    private void parseArguments(final List<Expression> args,
            final List<Keyword> keywords) throws PythonSyntaxException {
        while (!atOperator(")")) {
            final PythonToken start = peek();

            if (acceptOperator("*")) {
                args.add(expression("Starred", List.of(parseExpression()),
                        start));
            } else if (acceptOperator("**")) {
                keywords.add(new Keyword(null, parseExpression(),
                        start.line(), start.column()));
            } else if (start.type() == Type.NAME
                    && !KEYWORDS.contains(start.text())
                    && peek(1).isOperator("=")) {
                next();
                next();
                keywords.add(new Keyword(start.text(), parseExpression(),
                        start.line(), start.column()));
            } else {
                Expression argument = parseNamedExpression();
                if (atComprehension()) {
                    argument = parseComprehension("GeneratorExp",
                            List.of(argument), argument.line(),
                            argument.column());
                }
                args.add(argument);
            }

            if (!acceptOperator(",")) {
                break;
            }
        }
    }

    private Expression parseSlices() throws PythonSyntaxException {
        final PythonToken start = peek();
        final Expression first = parseSlice();
        if (!atOperator(",")) {
            return first;
        }

        final List<Node> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOperator(",")) {
            if (atOperator("]")) {
                break;
            }
            elements.add(parseSlice());
        }
        return expression("Tuple", elements, start);
    }

    private Expression parseSlice() throws PythonSyntaxException {
        final PythonToken start = peek();
        final List<Node> children = new ArrayList<>();

        if (!atOperator(":")) {
            final Expression lower = parseStarOrNamed();
            if (!atOperator(":")) {
                return lower;
            }
            children.add(lower);
        }

        expectOperator(":");
        if (!atSliceEnd()) {
            children.add(parseExpression());
        }
        if (acceptOperator(":") && !atSliceEnd()) {
            children.add(parseExpression());
        }
        return expression("Slice", children, start);
    }

    private boolean atSliceEnd() {
        return atOperator(":") || atOperator("]") || atOperator(",");
    }

    private Expression parseAtom() throws PythonSyntaxException {
        final PythonToken token = peek();

        switch (token.type()) {
            case NAME:
                return parseNameAtom(token);
            case NUMBER:
                next();
                return new Constant(ConstantKind.NUMBER,
                        renderNumber(token), token.line(), token.column());
            case STRING:
                return parseStrings();
            case OPERATOR:
                if (token.isOperator("(")) {
                    return parseParenthesized();
                }
                if (token.isOperator("[")) {
                    return parseList();
                }
                if (token.isOperator("{")) {
                    return parseDictOrSet();
                }
                if (token.isOperator("...")) {
                    next();
                    return new Constant(ConstantKind.ELLIPSIS, "...",
                            token.line(), token.column());
                }
                throw error("invalid syntax", token);
            default:
                throw error("invalid syntax", token);
        }
    }

    private Expression parseNameAtom(final PythonToken token)
            throws PythonSyntaxException {
        switch (token.text()) {
            case "None":
                next();
                return new Constant(ConstantKind.NONE, "None", token.line(),
                        token.column());
            case "True":
                next();
                return new Constant(ConstantKind.TRUE, "True", token.line(),
                        token.column());
            case "False":
                next();
                return new Constant(ConstantKind.FALSE, "False",
                        token.line(), token.column());
            default:
                if (KEYWORDS.contains(token.text())) {
                    throw error("invalid syntax", token);
                }
                next();
                return new Name(token.text(), token.line(), token.column());
        }
    }

    private Expression parseParenthesized() throws PythonSyntaxException {
        final PythonToken start = expectOperator("(");
        if (acceptOperator(")")) {
            return expression("Tuple", List.of(), start);
        }
        if (atName("yield")) {
            final Expression yield = parseYield();
            expectOperator(")");
            return yield;
        }

        final Expression first = parseStarOrNamed();
        if (atComprehension()) {
            final Expression generator = parseComprehension("GeneratorExp",
                    List.of(first), start.line(), start.column());
            expectOperator(")");
            return generator;
        }
        if (acceptOperator(")")) {
            return first;
        }

        final List<Node> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOperator(",")) {
            if (atOperator(")")) {
                break;
            }
            elements.add(parseStarOrNamed());
        }
        expectOperator(")");
        return expression("Tuple", elements, start);
    }

    private Expression parseList() throws PythonSyntaxException {
        final PythonToken start = expectOperator("[");
        final List<Expression> elements = new ArrayList<>();
        if (acceptOperator("]")) {
            return new ListDisplay(elements, start.line(), start.column());
        }

        final Expression first = parseStarOrNamed();
        if (atComprehension()) {
            final Expression comprehension = parseComprehension("ListComp",
                    List.of(first), start.line(), start.column());
            expectOperator("]");
            return comprehension;
        }

        elements.add(first);
        while (acceptOperator(",")) {
            if (atOperator("]")) {
                break;
            }
            elements.add(parseStarOrNamed());
        }
        expectOperator("]");
        return new ListDisplay(elements, start.line(), start.column());
    }

    private Expression parseDictOrSet() throws PythonSyntaxException {
        final PythonToken start = expectOperator("{");
        final List<Node> children = new ArrayList<>();
        if (acceptOperator("}")) {
            return expression("Dict", children, start);
        }

        final boolean dict;
        if (acceptOperator("**")) {
            children.add(parseBinary(0));
            dict = true;
        } else {
            final Expression key = parseStarOrNamed();
            children.add(key);
            dict = acceptOperator(":");
            if (dict) {
                children.add(parseExpression());
            }
            if (atComprehension()) {
                final Expression comprehension = parseComprehension(
                        dict ? "DictComp" : "SetComp", children,
                        start.line(), start.column());
                expectOperator("}");
                return comprehension;
            }
        }

        while (acceptOperator(",")) {
            if (atOperator("}")) {
                break;
            }
            if (!dict) {
                children.add(parseStarOrNamed());
            } else if (acceptOperator("**")) {
                children.add(parseBinary(0));
            } else {
                children.add(parseExpression());
                expectOperator(":");
                children.add(parseExpression());
            }
        }
        expectOperator("}");
        return expression(dict ? "Dict" : "Set", children, start);
    }

    private boolean atComprehension() {
        return atName("for")
                || (atName("async") && peek(1).isName("for"));
    }

    private Expression parseComprehension(final String kind,
            final List<Node> head, final int line, final int column)
            throws PythonSyntaxException {
        final List<Node> children = new ArrayList<>(head);
        while (atComprehension()) {
            acceptName("async");
            expectName("for");
            children.add(parseTargetList());
            expectName("in");
            children.add(parseDisjunction());
            while (acceptName("if")) {
                children.add(parseDisjunction());
            }
        }
        return new GenericExpression(kind, children, line, column);
    }

    // ------------------------------------------------------------------
    // Literals
    // ------------------------------------------------------------------

    /**
     * Parses one or more adjacent string literals. Any f-string part turns
     * the whole literal into a {@code JoinedStr} node without children.
     */
    private Expression parseStrings() throws PythonSyntaxException {
        final PythonToken start = peek();
        final StringBuilder value = new StringBuilder();
        boolean formatted = false;
        Boolean bytes = null;

        while (peek().type() == Type.STRING) {
            final PythonToken token = next();
            final String prefix = prefixOf(token.text());
            final boolean isBytes = prefix.contains("b");

            if (bytes != null && bytes != isBytes) {
                throw error("cannot mix bytes and nonbytes literals", token);
            }
            bytes = isBytes;

            if (prefix.contains("f")) {
                formatted = true;
            } else {
                value.append(decodeString(token, prefix));
            }
        }

        if (formatted) {
            return expression("JoinedStr", List.of(), start);
        }
        return new Constant(bytes ? ConstantKind.BYTES : ConstantKind.STRING,
                value.toString(), start.line(), start.column());
    }

    private static String prefixOf(final String literal) {
        int i = 0;
        while (literal.charAt(i) != '"' && literal.charAt(i) != '\'') {
            i++;
        }
        return literal.substring(0, i).toLowerCase(Locale.ROOT);
    }

    private String decodeString(final PythonToken token, final String prefix)
            throws PythonSyntaxException {
        final String text = token.text();
        final int quoteStart = prefix.length();
        final char quote = text.charAt(quoteStart);
        final boolean triple = text.startsWith(
                String.valueOf(quote).repeat(3), quoteStart);
        final int quoteLength = triple ? 3 : 1;
        final String body = text.substring(quoteStart + quoteLength,
                text.length() - quoteLength);

        if (prefix.contains("r")) {
            return body;
        }
        return unescape(body, prefix.contains("b"), token);
    }

    private String unescape(final String body, final boolean bytes,
            final PythonToken token) throws PythonSyntaxException {
        final StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            final char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }

            final char escaped = body.charAt(i + 1);
            i += 2;
            switch (escaped) {
                case '\n':
                    break;
                case '\r':
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                    break;
                case '\\':
                case '\'':
                case '"':
                    out.append(escaped);
                    break;
                case 'n':
                    out.append('\n');
                    break;
                case 't':
                    out.append('\t');
                    break;
                case 'r':
                    out.append('\r');
                    break;
                case 'a':
                    out.append('\u0007');
                    break;
                case 'b':
                    out.append('\b');
                    break;
                case 'f':
                    out.append('\f');
                    break;
                case 'v':
                    out.append('\u000B');
                    break;
                case 'x':
                    i = appendCodePoint(out, body, i, 2, token);
                    break;
                case 'u':
                case 'U':
                    if (bytes) {
                        out.append('\\').append(escaped);
                    } else {
                        i = appendCodePoint(out, body, i,
                                escaped == 'u' ? 4 : 8, token);
                    }
                    break;
                default:
                    if (escaped >= '0' && escaped <= '7') {
                        int end = i;
                        while (end < body.length() && end < i + 2
                                && body.charAt(end) >= '0'
                                && body.charAt(end) <= '7') {
                            end++;
                        }
                        out.appendCodePoint(Integer.parseInt(
                                body.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        // unknown escapes keep their backslash
                        out.append('\\').append(escaped);
                    }
                    break;
            }
        }
        return out.toString();
    }

    private int appendCodePoint(final StringBuilder out, final String body,
            final int from, final int digits, final PythonToken token)
            throws PythonSyntaxException {
        final int end = from + digits;
        if (end > body.length()) {
            throw error("truncated \\x, \\u or \\U escape", token);
        }
        try {
            out.appendCodePoint(Integer.parseInt(body.substring(from, end),
                    16));
        } catch (final IllegalArgumentException e) {
            throw error("invalid \\x, \\u or \\U escape", token);
        }
        return end;
    }

    /** Renders an integer literal in decimal, as Python's str() does. */
    private String renderNumber(final PythonToken token)
            throws PythonSyntaxException {
        final String digits = token.text().replace("_", "");
        final String lower = digits.toLowerCase(Locale.ROOT);
        try {
            if (lower.startsWith("0x")) {
                return new BigInteger(digits.substring(2), 16).toString();
            }
            if (lower.startsWith("0o")) {
                return new BigInteger(digits.substring(2), 8).toString();
            }
            if (lower.startsWith("0b")) {
                return new BigInteger(digits.substring(2), 2).toString();
            }
            if (lower.chars().allMatch(Character::isDigit)) {
                return new BigInteger(digits).toString();
            }
        } catch (final NumberFormatException e) {
            throw error("invalid number literal", token);
        }
        return digits;
    }

    // ------------------------------------------------------------------
    // Token helpers
    // ------------------------------------------------------------------

    private PythonToken peek() {
        return tokens.get(index);
    }

    private PythonToken peek(final int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    private PythonToken next() {
        final PythonToken token = tokens.get(index);
        if (token.type() != Type.END_MARKER) {
            index++;
        }
        return token;
    }

    private boolean atOperator(final String operator) {
        return peek().isOperator(operator);
    }

    private boolean atName(final String name) {
        return peek().isName(name);
    }

    private boolean acceptOperator(final String operator) {
        if (atOperator(operator)) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptName(final String name) {
        if (atName(name)) {
            next();
            return true;
        }
        return false;
    }

    private PythonToken expectOperator(final String operator)
            throws PythonSyntaxException {
        if (!atOperator(operator)) {
            throw error("expected '" + operator + "'", peek());
        }
        return next();
    }

    private PythonToken expectName(final String name)
            throws PythonSyntaxException {
        if (!atName(name)) {
            throw error("expected '" + name + "'", peek());
        }
        return next();
    }

    private PythonToken expectIdentifier() throws PythonSyntaxException {
        final PythonToken token = peek();
        if (token.type() != Type.NAME || KEYWORDS.contains(token.text())) {
            throw error("invalid syntax", token);
        }
        return next();
    }

    private void enter() throws PythonSyntaxException {
        if (++nesting > MAX_NESTING) {
            throw error("too many nested expressions", peek());
        }
    }

    private void expectNewline() throws PythonSyntaxException {
        if (peek().type() != Type.NEWLINE) {
            throw error("invalid syntax", peek());
        }
        next();
    }

    private boolean atSimpleStatementEnd() {
        return peek().type() == Type.NEWLINE || atOperator(";");
    }

    private static boolean canStartExpression(final PythonToken token) {
        switch (token.type()) {
            case NAME:
                return !KEYWORDS.contains(token.text())
                        || EXPRESSION_KEYWORDS.contains(token.text());
            case NUMBER:
            case STRING:
                return true;
            case OPERATOR:
                return EXPRESSION_OPERATORS.contains(token.text());
            default:
                return false;
        }
    }

    private static PythonSyntaxException error(final String reason,
            final PythonToken token) {
        if (token.type() == Type.INDENT) {
            return new PythonSyntaxException("unexpected indent",
                    token.line(), token.column());
        }
        if (token.type() == Type.END_MARKER) {
            return new PythonSyntaxException("unexpected end of file",
                    token.line(), token.column());
        }
        return new PythonSyntaxException(reason, token.line(),
                token.column());
    }

    private static Statement statement(final String kind,
            final List<Node> children, final PythonToken start) {
        return new GenericStatement(kind, children, start.line(),
                start.column());
    }

    private static Expression expression(final String kind,
            final List<Node> children, final PythonToken start) {
        return new GenericExpression(kind, children, start.line(),
                start.column());
    }

}
