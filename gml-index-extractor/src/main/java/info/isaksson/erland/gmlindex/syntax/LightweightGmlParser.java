package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.DeclarationRef;
import info.isaksson.erland.gmlindex.model.IdentifierRole;
import info.isaksson.erland.gmlindex.model.SourceLocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for the part of GML the project index needs.
 *
 * <p>It understands statements, expressions, {@code #macro}, {@code enum}, {@code var},
 * {@code globalvar}, {@code global.name}, named and anonymous functions (including
 * constructors), {@code new}, calls, assignments and {@code with} blocks. Identifiers are
 * classified with a per-file scope tracker:</p>
 * <ul>
 *   <li>{@code scope-0} is the file's top level; every function body opens {@code scope-N}.</li>
 *   <li>{@code var}, {@code static}, parameters and {@code catch} variables belong to the
 *       enclosing function (or the top level).</li>
 *   <li>Macros, enums, {@code globalvar}s and top-level functions belong to the file-wide
 *       table.</li>
 *   <li>{@code global.name} assignments go to a separate table that only {@code global.name}
 *       reads; they do not make a bare {@code name} global.</li>
 *   <li>Names resolve against the current function first, then the file-wide table; GML
 *       functions do not capture their caller's locals.</li>
 * </ul>
 *
 * <p>The token stream is parsed twice: the first run only collects declarations, so the second
 * can resolve references that appear before their declaration.</p>
 */
public final class LightweightGmlParser implements GmlParser {

    private static final String PROGRAM_SCOPE = "scope-0";

    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "var", "globalvar", "static", "enum", "if", "then", "else", "while", "do", "until", "for",
            "repeat", "with", "switch", "case", "default", "return", "exit", "break", "continue", "throw",
            "delete", "try", "catch", "finally", "begin", "end", "constructor"
    );

    private static final Set<String> WORD_OPERATORS = Set.of("and", "or", "xor", "not", "div", "mod");

    private static final Set<String> VALUE_KEYWORDS = Set.of("true", "false", "undefined", "self", "other", "all", "noone");

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", ":=", "+=", "-=", "*=", "/=", "%=", "|=", "&=", "^=", "??=", "<<=", ">>="
    );

    private static final Set<String> INDEX_OPENERS = Set.of("[", "[@", "[?", "[|", "[#", "[$");

    private static final String[][] BINARY_LEVELS = {
            {"??"},
            {"||", "or"},
            {"^^", "xor"},
            {"&&", "and"},
            {"|"},
            {"^"},
            {"&"},
            {"==", "!=", "<>", "="},
            {"<", "<=", ">", ">="},
            {"<<", ">>"},
            {"+", "-"},
            {"*", "/", "%", "div", "mod"},
    };

    @Override
    public SyntaxTree parse(String sourceText, ParseOptions options) {
        ParseOptions opts = options == null ? ParseOptions.forIndexing(null) : options;
        List<GmlToken> tokens = new GmlLexer(sourceText, opts.filePath).tokenize();

        Declarations declarations = new Declarations();
        new Run(tokens, declarations, true, opts).parseProgram();
        ContainerNode root = new Run(tokens, declarations, false, opts).parseProgram();
        return new SyntaxTree(opts.filePath, root);
    }

    private static final class Decl {
        final String name;
        final SourceLocation start;
        final SourceLocation end;
        final String scopeId;
        final EnumSet<IdentifierRole> kinds;
        final Map<String, Decl> members = new LinkedHashMap<>();

        Decl(String name, SourceLocation start, SourceLocation end, String scopeId, EnumSet<IdentifierRole> kinds) {
            this.name = name;
            this.start = start;
            this.end = end;
            this.scopeId = scopeId;
            this.kinds = kinds;
        }

        DeclarationRef ref() {
            return new DeclarationRef(start, end, scopeId);
        }
    }

    private static final class Declarations {
        final Map<String, Decl> fileWide = new HashMap<>();
        final Map<String, Decl> globalMembers = new HashMap<>();
        final Map<String, Map<String, Decl>> locals = new HashMap<>();

        Map<String, Decl> localsOf(String scopeId) {
            return locals.computeIfAbsent(scopeId, k -> new HashMap<>());
        }
    }

    /** One pass over the token stream. */
    private static final class Run {
        private final List<GmlToken> tokens;
        private final Declarations decls;
        private final boolean collecting;
        private final ParseOptions options;
        private final Deque<String> scopes = new ArrayDeque<>();
        private int p;
        private int scopeCounter;
        private boolean equalsIsComparison = true;

        Run(List<GmlToken> tokens, Declarations decls, boolean collecting, ParseOptions options) {
            this.tokens = tokens;
            this.decls = decls;
            this.collecting = collecting;
            this.options = options;
            this.scopes.push(PROGRAM_SCOPE);
        }

        ContainerNode parseProgram() {
            SourceLocation start = peek().start;
            List<GmlNode> body = new ArrayList<>();
            while (peek().type != GmlToken.Type.EOF) {
                addIfPresent(body, parseStatement());
            }
            return new ContainerNode(ContainerNode.PROGRAM, body, start, peek().end);
        }

        // ---------------------------------------------------------------- statements

        private GmlNode parseStatement() {
            GmlToken t = peek();
            if (t.type == GmlToken.Type.MACRO) return parseMacro();
            if (t.type == GmlToken.Type.MACRO_END) {
                next();
                return null;
            }
            if (t.isPunct(";")) {
                next();
                return null;
            }
            if (t.isPunct("{") || t.isWord("begin")) return parseBlock();
            if (t.type == GmlToken.Type.IDENTIFIER) {
                switch (t.text) {
                    case "var": return parseVariableDeclaration(true, EnumSet.of(IdentifierRole.VARIABLE, IdentifierRole.LOCAL));
                    case "static": return parseVariableDeclaration(true, EnumSet.of(IdentifierRole.VARIABLE));
                    case "globalvar": return parseGlobalVar();
                    case "enum": return parseEnum();
                    case "function":
                        if (peek(1).type == GmlToken.Type.IDENTIFIER) return parseFunction();
                        break;
                    case "if": return parseIf();
                    case "while": return parseLoop("WhileStatement");
                    case "repeat": return parseLoop("RepeatStatement");
                    case "with": return parseLoop("WithStatement");
                    case "do": return parseDo();
                    case "for": return parseFor();
                    case "switch": return parseSwitch();
                    case "return": return parseReturn();
                    case "exit":
                    case "break":
                    case "continue": {
                        GmlToken kw = next();
                        skipSemicolon();
                        return new ContainerNode(capitalize(kw.text) + "Statement", List.of(), kw.start, kw.end);
                    }
                    case "throw":
                    case "delete": {
                        GmlToken kw = next();
                        GmlNode arg = parseExpression();
                        skipSemicolon();
                        return new ContainerNode(capitalize(kw.text) + "Statement", List.of(arg), kw.start, prevEnd());
                    }
                    case "try": return parseTry();
                    default:
                        if (STATEMENT_KEYWORDS.contains(t.text)) throw error("Unexpected '" + t.text + "'", t);
                }
            }
            GmlNode stmt = parseSimpleStatement();
            skipSemicolon();
            return stmt;
        }

        private ContainerNode parseBlock() {
            GmlToken open = next();
            boolean words = open.isWord("begin");
            List<GmlNode> body = new ArrayList<>();
            while (!(words ? peek().isWord("end") : peek().isPunct("}"))) {
                if (peek().type == GmlToken.Type.EOF) throw error("Unterminated block", open);
                addIfPresent(body, parseStatement());
            }
            next();
            return new ContainerNode("Block", body, open.start, prevEnd());
        }

        private GmlNode parseMacro() {
            GmlToken kw = next();
            GmlToken nameTok = expectIdentifier();
            if (peek().isPunct(":") && peek(1).type == GmlToken.Type.IDENTIFIER) {
                // Configuration-specific macro: #macro Config:NAME value
                next();
                nameTok = next();
            }
            declareFileWide(nameTok, EnumSet.of(IdentifierRole.MACRO));
            List<GmlNode> children = new ArrayList<>();
            children.add(declaration(nameTok, fileWideDecl(nameTok.text), EnumSet.of(IdentifierRole.MACRO)));

            GmlToken previous = nameTok;
            while (peek().type != GmlToken.Type.MACRO_END && peek().type != GmlToken.Type.EOF) {
                GmlToken t = next();
                if (t.type == GmlToken.Type.IDENTIFIER && !previous.isPunct(".") && isPlainName(t.text)) {
                    children.add(reference(t));
                }
                previous = t;
            }
            if (peek().type == GmlToken.Type.MACRO_END) next();
            return new ContainerNode("MacroDeclaration", children, kw.start, prevEnd());
        }

        private GmlNode parseVariableDeclaration(boolean consumeSemicolon, EnumSet<IdentifierRole> kinds) {
            GmlToken kw = next();
            List<GmlNode> declarators = new ArrayList<>();
            do {
                GmlToken nameTok = expectIdentifier();
                declareLocal(nameTok, kinds);
                IdentifierNode name = declaration(nameTok, localDecl(nameTok.text), kinds);
                GmlNode init = null;
                if (peek().isPunct("=") || peek().isPunct(":=")) {
                    next();
                    init = parseExpression();
                }
                declarators.add(new ContainerNode("VariableDeclarator", nonNullList(name, init), nameTok.start, prevEnd()));
            } while (acceptPunct(","));
            if (consumeSemicolon) skipSemicolon();
            return new ContainerNode("VariableDeclaration", declarators, kw.start, prevEnd());
        }

        private GmlNode parseGlobalVar() {
            GmlToken kw = next();
            EnumSet<IdentifierRole> kinds = EnumSet.of(IdentifierRole.VARIABLE, IdentifierRole.GLOBAL);
            List<GmlNode> names = new ArrayList<>();
            do {
                GmlToken nameTok = expectIdentifier();
                declareFileWide(nameTok, kinds);
                names.add(declaration(nameTok, fileWideDecl(nameTok.text), kinds));
            } while (acceptPunct(","));
            skipSemicolon();
            return new ContainerNode("GlobalVarDeclaration", names, kw.start, prevEnd());
        }

        private GmlNode parseEnum() {
            GmlToken kw = next();
            GmlToken nameTok = expectIdentifier();
            EnumSet<IdentifierRole> enumKinds = EnumSet.of(IdentifierRole.ENUM);
            declareFileWide(nameTok, enumKinds);
            Decl enumDecl = fileWideDecl(nameTok.text);
            IdentifierNode name = declaration(nameTok, enumDecl, enumKinds);

            expectPunct("{");
            List<EnumMemberNode> members = new ArrayList<>();
            while (!peek().isPunct("}")) {
                GmlToken memberTok = expectIdentifier();
                EnumSet<IdentifierRole> memberKinds = EnumSet.of(IdentifierRole.ENUM_MEMBER);
                if (collecting && enumDecl != null && enumDecl.start == nameTok.start) {
                    enumDecl.members.putIfAbsent(memberTok.text,
                            new Decl(memberTok.text, memberTok.start, memberTok.end, PROGRAM_SCOPE, memberKinds));
                }
                Decl memberDecl = enumDecl == null ? null : enumDecl.members.get(memberTok.text);
                IdentifierNode memberName = declaration(memberTok, memberDecl, memberKinds);
                GmlNode init = null;
                if (acceptPunct("=")) init = parseExpression();
                members.add(new EnumMemberNode(memberName, init, memberTok.start, prevEnd()));
                if (!acceptPunct(",")) break;
            }
            expectPunct("}");
            return new EnumDeclarationNode(name, members, kw.start, prevEnd());
        }

        /** Named or anonymous function; the keyword is the current token. */
        private FunctionDeclarationNode parseFunction() {
            GmlToken kw = next();
            GmlToken nameTok = peek().type == GmlToken.Type.IDENTIFIER ? next() : null;
            boolean atTopLevel = scopes.size() == 1;

            String functionScope = enterFunction();
            expectPunct("(");
            List<IdentifierNode> params = new ArrayList<>();
            List<GmlNode> defaults = new ArrayList<>();
            EnumSet<IdentifierRole> paramKinds = EnumSet.of(IdentifierRole.VARIABLE, IdentifierRole.PARAMETER);
            while (!peek().isPunct(")")) {
                GmlToken paramTok = expectIdentifier();
                declareLocal(paramTok, paramKinds);
                params.add(declaration(paramTok, localDecl(paramTok.text), paramKinds));
                if (acceptPunct("=")) defaults.add(parseExpression());
                if (!acceptPunct(",")) break;
            }
            expectPunct(")");

            GmlNode inherits = null;
            if (acceptPunct(":")) inherits = parsePostfix();
            boolean isConstructor = false;
            if (peek().isWord("constructor")) {
                next();
                isConstructor = true;
            }
            ContainerNode block = parseBlock();
            exitFunction(functionScope);

            IdentifierNode name = null;
            if (nameTok != null) {
                EnumSet<IdentifierRole> kinds = isConstructor
                        ? EnumSet.of(IdentifierRole.SCRIPT, IdentifierRole.CONSTRUCTOR, IdentifierRole.STRUCT)
                        : EnumSet.of(IdentifierRole.SCRIPT);
                Decl decl;
                if (atTopLevel) {
                    declareFileWide(nameTok, kinds);
                    decl = fileWideDecl(nameTok.text);
                } else {
                    declareLocal(nameTok, kinds);
                    decl = localDecl(nameTok.text);
                }
                name = declaration(nameTok, decl, kinds);
            }

            List<GmlNode> bodyParts = new ArrayList<>(defaults);
            if (inherits != null) bodyParts.add(inherits);
            GmlNode body = block;
            if (!bodyParts.isEmpty()) {
                bodyParts.add(block);
                body = new ContainerNode("FunctionBody", bodyParts, bodyParts.get(0).start, block.end);
            }
            return new FunctionDeclarationNode(name, params, body, isConstructor, kw.start, prevEnd());
        }

        private GmlNode parseIf() {
            GmlToken kw = next();
            GmlNode test = parseExpression();
            if (peek().isWord("then")) next();
            List<GmlNode> parts = new ArrayList<>();
            parts.add(test);
            addIfPresent(parts, parseStatement());
            if (peek().isWord("else")) {
                next();
                addIfPresent(parts, parseStatement());
            }
            return new ContainerNode("IfStatement", parts, kw.start, prevEnd());
        }

        /** {@code while}, {@code repeat} and {@code with}: keyword, expression, body. */
        private GmlNode parseLoop(String label) {
            GmlToken kw = next();
            GmlNode subject = parseExpression();
            if (peek().isWord("do")) next();
            List<GmlNode> parts = new ArrayList<>();
            parts.add(subject);
            addIfPresent(parts, parseStatement());
            return new ContainerNode(label, parts, kw.start, prevEnd());
        }

        private GmlNode parseDo() {
            GmlToken kw = next();
            List<GmlNode> parts = new ArrayList<>();
            addIfPresent(parts, parseStatement());
            if (peek().isWord("until") || peek().isWord("while")) {
                next();
                parts.add(parseExpression());
            } else {
                throw error("Expected 'until'", peek());
            }
            skipSemicolon();
            return new ContainerNode("DoUntilStatement", parts, kw.start, prevEnd());
        }

        private GmlNode parseFor() {
            GmlToken kw = next();
            expectPunct("(");
            List<GmlNode> parts = new ArrayList<>();
            if (!peek().isPunct(";")) {
                if (peek().isWord("var")) {
                    parts.add(parseVariableDeclaration(false, EnumSet.of(IdentifierRole.VARIABLE, IdentifierRole.LOCAL)));
                } else {
                    parts.add(parseSimpleStatement());
                }
            }
            expectPunct(";");
            if (!peek().isPunct(";")) parts.add(parseExpression());
            expectPunct(";");
            if (!peek().isPunct(")")) parts.add(parseSimpleStatement());
            expectPunct(")");
            addIfPresent(parts, parseStatement());
            return new ContainerNode("ForStatement", parts, kw.start, prevEnd());
        }

        private GmlNode parseSwitch() {
            GmlToken kw = next();
            List<GmlNode> parts = new ArrayList<>();
            parts.add(parseExpression());
            expectPunct("{");
            while (!peek().isPunct("}")) {
                GmlToken t = peek();
                if (t.type == GmlToken.Type.EOF) throw error("Unterminated switch", kw);
                if (t.isWord("case")) {
                    next();
                    parts.add(parseExpression());
                    expectPunct(":");
                } else if (t.isWord("default")) {
                    next();
                    expectPunct(":");
                } else {
                    addIfPresent(parts, parseStatement());
                }
            }
            next();
            return new ContainerNode("SwitchStatement", parts, kw.start, prevEnd());
        }

        private GmlNode parseReturn() {
            GmlToken kw = next();
            List<GmlNode> parts = new ArrayList<>();
            GmlToken t = peek();
            if (!t.isPunct(";") && !t.isPunct("}") && !t.isWord("end") && t.type != GmlToken.Type.EOF
                    && !(t.type == GmlToken.Type.IDENTIFIER && STATEMENT_KEYWORDS.contains(t.text))) {
                parts.add(parseExpression());
            }
            skipSemicolon();
            return new ContainerNode("ReturnStatement", parts, kw.start, prevEnd());
        }

        private GmlNode parseTry() {
            GmlToken kw = next();
            List<GmlNode> parts = new ArrayList<>();
            parts.add(parseBlock());
            if (peek().isWord("catch")) {
                next();
                boolean parens = acceptPunct("(");
                if (peek().type == GmlToken.Type.IDENTIFIER) {
                    GmlToken errTok = next();
                    EnumSet<IdentifierRole> kinds = EnumSet.of(IdentifierRole.VARIABLE, IdentifierRole.LOCAL);
                    declareLocal(errTok, kinds);
                    parts.add(declaration(errTok, localDecl(errTok.text), kinds));
                }
                if (parens) expectPunct(")");
                parts.add(parseBlock());
            }
            if (peek().isWord("finally")) {
                next();
                parts.add(parseBlock());
            }
            return new ContainerNode("TryStatement", parts, kw.start, prevEnd());
        }

        /** Assignment or expression statement, without the trailing semicolon. */
        private GmlNode parseSimpleStatement() {
            boolean saved = equalsIsComparison;
            equalsIsComparison = false;
            GmlNode target;
            try {
                target = parseTernary();
            } finally {
                equalsIsComparison = saved;
            }

            GmlToken op = peek();
            if (op.type == GmlToken.Type.PUNCTUATOR && ASSIGNMENT_OPERATORS.contains(op.text) && isAssignable(target)) {
                next();
                GmlNode value = parseExpression();
                if (collecting) recordGlobalAssignment(target);
                String operator = op.text.equals(":=") ? "=" : op.text;
                return new AssignmentNode(operator, target, value, target.start, prevEnd());
            }
            return new ContainerNode("ExpressionStatement", List.of(target), target.start, prevEnd());
        }

        // ---------------------------------------------------------------- expressions

        private GmlNode parseExpression() {
            boolean saved = equalsIsComparison;
            equalsIsComparison = true;
            try {
                return parseTernary();
            } finally {
                equalsIsComparison = saved;
            }
        }

        private GmlNode parseTernary() {
            GmlNode test = parseBinary(0);
            if (!peek().isPunct("?")) return test;
            next();
            GmlNode consequent = parseExpression();
            expectPunct(":");
            GmlNode alternate = parseExpression();
            return new ContainerNode("ConditionalExpression", List.of(test, consequent, alternate), test.start, prevEnd());
        }

        private GmlNode parseBinary(int level) {
            if (level == BINARY_LEVELS.length) return parseUnary();
            GmlNode left = parseBinary(level + 1);
            while (isBinaryOperator(peek(), level)) {
                next();
                GmlNode right = parseBinary(level + 1);
                left = new ContainerNode("BinaryExpression", List.of(left, right), left.start, prevEnd());
            }
            return left;
        }

        private boolean isBinaryOperator(GmlToken t, int level) {
            if (t.type != GmlToken.Type.PUNCTUATOR && !(t.type == GmlToken.Type.IDENTIFIER && WORD_OPERATORS.contains(t.text))) {
                return false;
            }
            if (t.isPunct("=") && !equalsIsComparison) return false;
            for (String op : BINARY_LEVELS[level]) {
                if (op.equals(t.text)) return true;
            }
            return false;
        }

        private GmlNode parseUnary() {
            GmlToken t = peek();
            if (t.isPunct("!") || t.isPunct("-") || t.isPunct("+") || t.isPunct("~")
                    || t.isPunct("++") || t.isPunct("--") || t.isWord("not")) {
                next();
                GmlNode operand = parseUnary();
                return new ContainerNode("UnaryExpression", List.of(operand), t.start, prevEnd());
            }
            return parsePostfix();
        }

        private GmlNode parsePostfix() {
            GmlNode expr = parsePrimary();
            while (true) {
                GmlToken t = peek();
                if (t.isPunct("(")) {
                    List<GmlNode> args = parseArguments();
                    expr = new CallExpressionNode(expr, args, expr.start, prevEnd());
                } else if (t.isPunct(".")) {
                    next();
                    GmlToken propTok = expectIdentifier();
                    expr = new MemberExpressionNode(expr, memberProperty(expr, propTok), false, expr.start, prevEnd());
                } else if (t.type == GmlToken.Type.PUNCTUATOR && INDEX_OPENERS.contains(t.text)) {
                    next();
                    List<GmlNode> keys = parseList("]");
                    GmlNode index = new ContainerNode("Index", keys, t.start, prevEnd());
                    expr = new MemberExpressionNode(expr, index, true, expr.start, prevEnd());
                } else if (t.isPunct("++") || t.isPunct("--")) {
                    next();
                    expr = new ContainerNode("UpdateExpression", List.of(expr), expr.start, prevEnd());
                } else {
                    return expr;
                }
            }
        }

        private GmlNode parsePrimary() {
            GmlToken t = peek();
            switch (t.type) {
                case NUMBER:
                case STRING:
                    next();
                    return new ContainerNode("Literal", List.of(), t.start, t.end);
                case PUNCTUATOR:
                    if (t.isPunct("(")) {
                        next();
                        GmlNode inner = parseExpression();
                        expectPunct(")");
                        return inner;
                    }
                    if (t.isPunct("[")) {
                        next();
                        List<GmlNode> items = parseList("]");
                        return new ContainerNode("ArrayExpression", items, t.start, prevEnd());
                    }
                    if (t.isPunct("{")) return parseStructLiteral();
                    throw error("Unexpected '" + t.text + "'", t);
                case IDENTIFIER:
                    if (t.text.equals("function")) return parseFunction();
                    if (t.text.equals("new")) return parseNew();
                    if (t.text.equals("global")) {
                        next();
                        return new ContainerNode("GlobalKeyword", List.of(), t.start, t.end);
                    }
                    if (VALUE_KEYWORDS.contains(t.text)) {
                        next();
                        return new ContainerNode("Keyword", List.of(), t.start, t.end);
                    }
                    if (!isPlainName(t.text)) throw error("Unexpected '" + t.text + "'", t);
                    next();
                    return reference(t);
                default:
                    throw error("Unexpected end of input", t);
            }
        }

        private GmlNode parseNew() {
            GmlToken kw = next();
            GmlToken nameTok = expectIdentifier();
            GmlNode callee = nameTok.text.equals("global")
                    ? new ContainerNode("GlobalKeyword", List.of(), nameTok.start, nameTok.end)
                    : reference(nameTok);
            while (peek().isPunct(".")) {
                next();
                GmlToken propTok = expectIdentifier();
                callee = new MemberExpressionNode(callee, memberProperty(callee, propTok), false, callee.start, prevEnd());
            }
            List<GmlNode> args = peek().isPunct("(") ? parseArguments() : List.of();
            return new NewExpressionNode(callee, args, kw.start, prevEnd());
        }

        private GmlNode parseStructLiteral() {
            GmlToken open = next();
            List<GmlNode> entries = new ArrayList<>();
            boolean saved = equalsIsComparison;
            equalsIsComparison = true;
            try {
                while (!peek().isPunct("}")) {
                    GmlToken keyTok = next();
                    if (keyTok.type != GmlToken.Type.IDENTIFIER && keyTok.type != GmlToken.Type.STRING) {
                        throw error("Expected struct key", keyTok);
                    }
                    if (acceptPunct(":")) {
                        GmlNode key = keyTok.type == GmlToken.Type.IDENTIFIER
                                ? unclassified(keyTok)
                                : new ContainerNode("Literal", List.of(), keyTok.start, keyTok.end);
                        GmlNode value = parseExpression();
                        entries.add(new ContainerNode("Property", List.of(key, value), keyTok.start, prevEnd()));
                    } else if (keyTok.type == GmlToken.Type.IDENTIFIER && isPlainName(keyTok.text)) {
                        entries.add(new ContainerNode("Property", List.of(reference(keyTok)), keyTok.start, keyTok.end));
                    } else {
                        throw error("Expected ':'", peek());
                    }
                    if (!acceptPunct(",")) break;
                }
                expectPunct("}");
            } finally {
                equalsIsComparison = saved;
            }
            return new ContainerNode("StructExpression", entries, open.start, prevEnd());
        }

        private List<GmlNode> parseArguments() {
            expectPunct("(");
            return parseList(")");
        }

        /** Comma-separated expressions up to {@code close}; a trailing comma is allowed. */
        private List<GmlNode> parseList(String close) {
            List<GmlNode> items = new ArrayList<>();
            while (!peek().isPunct(close)) {
                items.add(parseExpression());
                if (!acceptPunct(",")) break;
            }
            expectPunct(close);
            return items;
        }

        /** Classifies {@code .name}: enum members and {@code global.name}; everything else stays unclassified. */
        private IdentifierNode memberProperty(GmlNode object, GmlToken propTok) {
            if (object instanceof ContainerNode && "GlobalKeyword".equals(((ContainerNode) object).label)) {
                EnumSet<IdentifierRole> kinds = EnumSet.of(IdentifierRole.VARIABLE, IdentifierRole.GLOBAL);
                Decl decl = globalDecl(propTok.text);
                if (decl != null && decl.start.index == propTok.start.index) {
                    return declaration(propTok, decl, kinds);
                }
                EnumSet<IdentifierRole> roles = EnumSet.of(IdentifierRole.REFERENCE);
                roles.addAll(kinds);
                return identifier(propTok, roles, decl == null ? null : decl.ref(), true);
            }
            if (object instanceof IdentifierNode && ((IdentifierNode) object).hasRole(IdentifierRole.ENUM)) {
                Decl enumDecl = resolve(((IdentifierNode) object).name);
                Decl member = enumDecl == null ? null : enumDecl.members.get(propTok.text);
                if (member != null) {
                    return identifier(propTok, EnumSet.of(IdentifierRole.REFERENCE, IdentifierRole.ENUM_MEMBER), member.ref(), false);
                }
            }
            return unclassified(propTok);
        }

        // ---------------------------------------------------------------- scope tracking

        private String currentScope() {
            return scopes.peek();
        }

        private String enterFunction() {
            String id = "scope-" + (++scopeCounter);
            scopes.push(id);
            return id;
        }

        private void exitFunction(String id) {
            String popped = scopes.pop();
            if (!popped.equals(id)) throw new IllegalStateException("Scope stack out of balance: " + popped + " != " + id);
        }

        private void declareLocal(GmlToken nameTok, EnumSet<IdentifierRole> kinds) {
            if (!collecting) return;
            decls.localsOf(currentScope()).putIfAbsent(nameTok.text,
                    new Decl(nameTok.text, nameTok.start, nameTok.end, currentScope(), EnumSet.copyOf(kinds)));
        }

        private void declareFileWide(GmlToken nameTok, EnumSet<IdentifierRole> kinds) {
            if (!collecting) return;
            decls.fileWide.putIfAbsent(nameTok.text,
                    new Decl(nameTok.text, nameTok.start, nameTok.end, PROGRAM_SCOPE, EnumSet.copyOf(kinds)));
        }

        private void recordGlobalAssignment(GmlNode target) {
            if (!(target instanceof MemberExpressionNode)) return;
            MemberExpressionNode member = (MemberExpressionNode) target;
            if (member.computed || !(member.object instanceof ContainerNode)) return;
            if (!"GlobalKeyword".equals(((ContainerNode) member.object).label)) return;
            IdentifierNode prop = (IdentifierNode) member.property;
            decls.globalMembers.putIfAbsent(prop.name, new Decl(prop.name, prop.start, prop.end, PROGRAM_SCOPE,
                    EnumSet.of(IdentifierRole.VARIABLE, IdentifierRole.GLOBAL)));
        }

        private Decl localDecl(String name) {
            Map<String, Decl> locals = decls.locals.get(currentScope());
            return locals == null ? null : locals.get(name);
        }

        private Decl fileWideDecl(String name) {
            return decls.fileWide.get(name);
        }

        /** Target of {@code global.name}: a {@code globalvar} wins over an assigned member. */
        private Decl globalDecl(String name) {
            Decl decl = fileWideDecl(name);
            if (decl != null && decl.kinds.contains(IdentifierRole.GLOBAL)) return decl;
            return decls.globalMembers.get(name);
        }

        private Decl resolve(String name) {
            Decl local = localDecl(name);
            return local != null ? local : fileWideDecl(name);
        }

        // ---------------------------------------------------------------- identifier nodes

        private IdentifierNode declaration(GmlToken tok, Decl decl, EnumSet<IdentifierRole> kinds) {
            EnumSet<IdentifierRole> roles = EnumSet.of(IdentifierRole.DECLARATION);
            roles.addAll(kinds);
            // A redeclaration (second `var x`) is still a declaration site, linked back to the first one.
            DeclarationRef back = decl != null && decl.start.index != tok.start.index ? decl.ref() : null;
            return identifier(tok, roles, back, kinds.contains(IdentifierRole.GLOBAL));
        }

        private IdentifierNode reference(GmlToken tok) {
            Decl decl = resolve(tok.text);
            EnumSet<IdentifierRole> roles = EnumSet.of(IdentifierRole.REFERENCE);
            if (decl == null) {
                roles.add(IdentifierRole.VARIABLE);
                return identifier(tok, roles, null, false);
            }
            roles.addAll(decl.kinds);
            return identifier(tok, roles, decl.ref(), decl.kinds.contains(IdentifierRole.GLOBAL));
        }

        private IdentifierNode unclassified(GmlToken tok) {
            return new IdentifierNode(tok.text, tok.start, tok.end, currentScope(), null, null, false);
        }

        private IdentifierNode identifier(GmlToken tok, Set<IdentifierRole> roles, DeclarationRef declaration, boolean global) {
            if (!options.requestIdentifierRoles) {
                return new IdentifierNode(tok.text, tok.start, tok.end, currentScope(), null, null, false);
            }
            return new IdentifierNode(tok.text, tok.start, tok.end, currentScope(), roles, declaration, global);
        }

        // ---------------------------------------------------------------- token helpers

        private GmlToken peek() {
            return tokens.get(p);
        }

        private GmlToken peek(int ahead) {
            int i = Math.min(p + ahead, tokens.size() - 1);
            return tokens.get(i);
        }

        private GmlToken next() {
            GmlToken t = tokens.get(p);
            if (t.type != GmlToken.Type.EOF) p++;
            return t;
        }

        private SourceLocation prevEnd() {
            return p == 0 ? tokens.get(0).start : tokens.get(p - 1).end;
        }

        private boolean acceptPunct(String s) {
            if (peek().isPunct(s)) {
                next();
                return true;
            }
            return false;
        }

        private void expectPunct(String s) {
            if (!acceptPunct(s)) throw error("Expected '" + s + "' but found '" + peek().text + "'", peek());
        }

        private GmlToken expectIdentifier() {
            GmlToken t = peek();
            if (t.type != GmlToken.Type.IDENTIFIER) throw error("Expected identifier but found '" + t.text + "'", t);
            return next();
        }

        private void skipSemicolon() {
            while (peek().isPunct(";")) next();
        }

        private GmlParseException error(String message, GmlToken at) {
            return new GmlParseException(message, options.filePath, at.start);
        }
    }

    private static boolean isAssignable(GmlNode node) {
        return node instanceof IdentifierNode || node instanceof MemberExpressionNode;
    }

    private static boolean isPlainName(String word) {
        return !STATEMENT_KEYWORDS.contains(word)
                && !WORD_OPERATORS.contains(word)
                && !VALUE_KEYWORDS.contains(word)
                && !word.equals("global")
                && !word.equals("function")
                && !word.equals("new");
    }

    private static void addIfPresent(List<GmlNode> out, GmlNode node) {
        if (node != null) out.add(node);
    }

    private static List<GmlNode> nonNullList(GmlNode a, GmlNode b) {
        List<GmlNode> out = new ArrayList<>(2);
        addIfPresent(out, a);
        addIfPresent(out, b);
        return Collections.unmodifiableList(out);
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
