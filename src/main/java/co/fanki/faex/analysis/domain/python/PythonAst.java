package co.fanki.faex.analysis.domain.python;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Syntax tree produced by {@link PythonParser}.
 *
 * <p>Only the shapes the exception analysis looks at get their own record:
 * function and class definitions, raise statements, calls, names,
 * attribute chains, literal constants, list displays and keyword
 * arguments. Every other statement or expression is kept as a generic
 * node with a kind label and its children in source order, so a walk over
 * the tree still reaches calls and raises nested anywhere inside them.</p>
 *
 * <p>Lines are 1-based, columns are 0-based character offsets within the
 * line.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonAst {

    private PythonAst() {
    }

    /** A node of the tree. */
    public interface Node {

        /** @return the 1-based line where the node starts */
        int line();

        /** @return the 0-based column where the node starts */
        int column();

        /** @return the direct children in source order, never null */
        List<Node> children();
    }

    /** Marker for statement nodes. */
    public interface Statement extends Node {
    }

    /** Marker for expression nodes. */
    public interface Expression extends Node {
    }

    /** The kinds of literal constants. */
    public enum ConstantKind {
        STRING,
        BYTES,
        NUMBER,
        NONE,
        TRUE,
        FALSE,
        ELLIPSIS
    }

    /**
     * The root of a parsed file.
     *
     * @param body the top level statements
     */
    public record Module(List<Statement> body) implements Node {

        @Override
        public int line() {
            return 1;
        }

        @Override
        public int column() {
            return 0;
        }

        @Override
        public List<Node> children() {
            return new ArrayList<>(body);
        }
    }

    /**
     * A {@code def} or {@code async def} statement.
     *
     * @param name the bare function name
     * @param decorators the decorator expressions, outermost first
     * @param signature parameter defaults, annotations and return annotation
     * @param body the statements of the function body
     * @param async whether the function was declared {@code async}
     * @param line the line of the {@code def} (or {@code async}) keyword
     * @param column the column of that keyword
     */
    public record FunctionDef(
            String name,
            List<Expression> decorators,
            List<Node> signature,
            List<Statement> body,
            boolean async,
            int line,
            int column) implements Statement {

        @Override
        public List<Node> children() {
            final List<Node> children = new ArrayList<>(decorators);
            children.addAll(signature);
            children.addAll(body);
            return children;
        }
    }

    /**
     * A {@code class} statement.
     *
     * @param name the class name
     * @param decorators the decorator expressions
     * @param bases base class expressions and class keywords
     * @param body the statements of the class body
     * @param line the line of the {@code class} keyword
     * @param column the column of that keyword
     */
    public record ClassDef(
            String name,
            List<Expression> decorators,
            List<Node> bases,
            List<Statement> body,
            int line,
            int column) implements Statement {

        @Override
        public List<Node> children() {
            final List<Node> children = new ArrayList<>(decorators);
            children.addAll(bases);
            children.addAll(body);
            return children;
        }
    }

    /**
     * A {@code raise} statement.
     *
     * @param exception the raised expression, null for a bare re-raise
     * @param cause the {@code from} expression, or null
     * @param line the line of the {@code raise} keyword
     * @param column the column of that keyword
     */
    public record Raise(
            Expression exception,
            Expression cause,
            int line,
            int column) implements Statement {

        /** @return true for a bare {@code raise} without operand */
        public boolean isReRaise() {
            return exception == null;
        }

        @Override
        public List<Node> children() {
            final List<Node> children = new ArrayList<>(2);
            if (exception != null) {
                children.add(exception);
            }
            if (cause != null) {
                children.add(cause);
            }
            return children;
        }
    }

    /**
     * Any other statement: assignments, loops, conditionals, imports...
     *
     * @param kind a label such as {@code If}, {@code Assign}, {@code Try}
     * @param children expressions and nested statements in source order
     * @param line the start line
     * @param column the start column
     */
    public record GenericStatement(
            String kind,
            List<Node> children,
            int line,
            int column) implements Statement {
    }

    /**
     * A bare identifier.
     *
     * @param id the identifier
     * @param line the line
     * @param column the column
     */
    public record Name(String id, int line, int column) implements Expression {

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * An attribute access {@code value.attr}.
     *
     * @param value the receiver expression
     * @param attr the attribute name
     * @param line the start line of the whole expression
     * @param column the start column of the whole expression
     */
    public record Attribute(
            Expression value,
            String attr,
            int line,
            int column) implements Expression {

        @Override
        public List<Node> children() {
            return List.of(value);
        }
    }

    /**
     * A call expression.
     *
     * @param func the called expression
     * @param args the positional arguments, starred ones included
     * @param keywords the keyword arguments and {@code **} unpackings
     * @param line the start line of the whole expression
     * @param column the start column of the whole expression
     */
    public record Call(
            Expression func,
            List<Expression> args,
            List<Keyword> keywords,
            int line,
            int column) implements Expression {

        @Override
        public List<Node> children() {
            final List<Node> children = new ArrayList<>();
            children.add(func);
            children.addAll(args);
            children.addAll(keywords);
            return children;
        }
    }

    /**
     * A keyword argument of a call or class definition.
     *
     * @param arg the keyword, null for a {@code **mapping} unpacking
     * @param value the argument value
     * @param line the line
     * @param column the column
     */
    public record Keyword(
            String arg,
            Expression value,
            int line,
            int column) implements Node {

        @Override
        public List<Node> children() {
            return List.of(value);
        }
    }

    /**
     * A literal constant.
     *
     * <p>For strings and bytes {@code value} is the decoded content of all
     * implicitly concatenated parts; for numbers it is the literal text.</p>
     *
     * @param kind the constant kind
     * @param value the rendered value
     * @param line the line
     * @param column the column
     */
    public record Constant(
            ConstantKind kind,
            String value,
            int line,
            int column) implements Expression {

        /**
         * Renders the constant the way Python's {@code str()} would for the
         * common cases.
         *
         * @return the rendered constant
         */
        public String asText() {
            return switch (kind) {
                case STRING, NUMBER -> value;
                case BYTES -> "b'" + value + "'";
                case NONE -> "None";
                case TRUE -> "True";
                case FALSE -> "False";
                case ELLIPSIS -> "Ellipsis";
            };
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * A list display {@code [a, b, c]}; comprehensions are generic nodes.
     *
     * @param elements the elements
     * @param line the line of the opening bracket
     * @param column the column of the opening bracket
     */
    public record ListDisplay(
            List<Expression> elements,
            int line,
            int column) implements Expression {

        @Override
        public List<Node> children() {
            return new ArrayList<>(elements);
        }
    }

    /**
     * Any other expression: operators, tuples, subscripts, lambdas,
     * comprehensions, f-strings...
     *
     * @param kind a label such as {@code BinOp}, {@code Tuple}, {@code Lambda}
     * @param children the sub-expressions in source order
     * @param line the start line
     * @param column the start column
     */
    public record GenericExpression(
            String kind,
            List<Node> children,
            int line,
            int column) implements Expression {
    }

    /**
     * Visits the node and all of its descendants in source pre-order.
     *
     * @param root the node to start from
     * @param visitor the callback, invoked once per node
     */
    public static void walk(final Node root, final Consumer<Node> visitor) {
        final Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final Node node = stack.pop();
            visitor.accept(node);
            final List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Visits every statement of a body and all of their descendants in
     * source pre-order.
     *
     * @param body the statements to walk
     * @param visitor the callback, invoked once per node
     */
    public static void walkBody(final List<Statement> body,
            final Consumer<Node> visitor) {
        for (final Statement statement : body) {
            walk(statement, visitor);
        }
    }

    /**
     * Collects every function definition of the tree, nested ones included,
     * in source order.
     *
     * @param root the node to search
     * @return the function definitions found
     */
    public static List<FunctionDef> functions(final Node root) {
        final List<FunctionDef> functions = new ArrayList<>();
        walk(root, node -> {
            if (node instanceof FunctionDef function) {
                functions.add(function);
            }
        });
        return functions;
    }

}
