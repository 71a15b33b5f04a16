package com.sattline.lint.loader;

import com.sattline.lint.loader.ast.AssignmentNode;
import com.sattline.lint.loader.ast.BinaryExpressionNode;
import com.sattline.lint.loader.ast.BinaryOperator;
import com.sattline.lint.loader.ast.CallExpressionNode;
import com.sattline.lint.loader.ast.CallStatementNode;
import com.sattline.lint.loader.ast.CodeSequenceKind;
import com.sattline.lint.loader.ast.CodeSequenceNode;
import com.sattline.lint.loader.ast.ConditionalBranchNode;
import com.sattline.lint.loader.ast.DatatypeNode;
import com.sattline.lint.loader.ast.ExpressionNode;
import com.sattline.lint.loader.ast.FieldNode;
import com.sattline.lint.loader.ast.IfStatementNode;
import com.sattline.lint.loader.ast.LiteralKind;
import com.sattline.lint.loader.ast.LiteralNode;
import com.sattline.lint.loader.ast.ModuleBodyNode;
import com.sattline.lint.loader.ast.ModuleTypeNode;
import com.sattline.lint.loader.ast.Names;
import com.sattline.lint.loader.ast.ParameterConnectionNode;
import com.sattline.lint.loader.ast.ProgramNode;
import com.sattline.lint.loader.ast.SequenceStepNode;
import com.sattline.lint.loader.ast.SourceLocation;
import com.sattline.lint.loader.ast.StatementNode;
import com.sattline.lint.loader.ast.SubmoduleNode;
import com.sattline.lint.loader.ast.TransitionNode;
import com.sattline.lint.loader.ast.TypeReference;
import com.sattline.lint.loader.ast.UnaryExpressionNode;
import com.sattline.lint.loader.ast.UnaryOperator;
import com.sattline.lint.loader.ast.VariableNode;
import com.sattline.lint.loader.ast.VariableQualifier;
import com.sattline.lint.loader.ast.VariableReferenceNode;
import com.sattline.lint.loader.ast.WhileStatementNode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the syntax model from a {@link ParseNode} tree. The builder is a pure function of its
 * input: it never reads files and keeps no state between calls.
 *
 * <p>Rule nodes the builder does not know at a given position make the whole file fail with a
 * {@link SattLineParseException}; punctuation and keyword tokens it does not need are skipped.</p>
 */
public final class TreeBuilder {

    public TreeBuildResult build(ParseNode root, String sourceName) throws SattLineParseException {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(sourceName, "sourceName");
        return new Construction(sourceName).build(root);
    }

    private static final class Construction {
        private final String sourceName;
        private final Map<String, String> declared = new LinkedHashMap<>();
        private final Map<String, String> referenced = new LinkedHashMap<>();

        Construction(String sourceName) {
            this.sourceName = sourceName;
        }

        TreeBuildResult build(ParseNode root) throws SattLineParseException {
            expect(root, "sourceFile");
            List<DatatypeNode> datatypes = new ArrayList<>();
            List<ModuleTypeNode> moduleTypes = new ArrayList<>();
            ModuleBodyNode body = ModuleBodyNode.empty(location(root));
            for (ParseNode child : root.getChildren()) {
                switch (child.getTag()) {
                    case "typeDefinitions" -> buildTypeDefinitions(child, datatypes, moduleTypes);
                    case "moduleBody" -> body = buildModuleBody(child, null);
                    default -> skipToken(child, "sourceFile");
                }
            }
            ProgramNode program = new ProgramNode(sourceName, location(root), datatypes, moduleTypes, body);

            Set<String> referencedNames = new LinkedHashSet<>();
            for (Map.Entry<String, String> entry : referenced.entrySet()) {
                if (!declared.containsKey(entry.getKey())) {
                    referencedNames.add(entry.getValue());
                }
            }
            return new TreeBuildResult(program, new LinkedHashSet<>(declared.values()), referencedNames);
        }

        // Type definitions

        private void buildTypeDefinitions(
                ParseNode node, List<DatatypeNode> datatypes, List<ModuleTypeNode> moduleTypes)
                throws SattLineParseException {
            for (ParseNode child : node.getChildren()) {
                if (!child.getTag().equals("typeDefinition")) {
                    skipToken(child, "typeDefinitions");
                    continue;
                }
                ParseNode definition = singleRule(child);
                switch (definition.getTag()) {
                    case "recordDefinition" -> datatypes.add(buildRecord(definition));
                    case "aliasDefinition" -> datatypes.add(buildAlias(definition));
                    case "moduleTypeDefinition" -> moduleTypes.add(buildModuleType(definition));
                    default -> throw unexpected(definition, "typeDefinition");
                }
            }
        }

        private DatatypeNode buildRecord(ParseNode node) throws SattLineParseException {
            String name = declare(identifier(node));
            List<FieldNode> fields = new ArrayList<>();
            for (ParseNode child : node.getChildren()) {
                if (child.getTag().equals("fieldDeclaration")) {
                    fields.add(buildField(child));
                } else {
                    skipToken(child, "recordDefinition");
                }
            }
            return DatatypeNode.record(name, fields, location(node));
        }

        private FieldNode buildField(ParseNode node) throws SattLineParseException {
            TypeReference type = typeReference(requireChild(node, "typeReference"), null);
            LiteralNode defaultValue = null;
            ParseNode literal = node.findChild("literal").orElse(null);
            if (literal != null) {
                defaultValue = buildLiteral(literal);
            }
            return new FieldNode(identifier(node), type, defaultValue, location(node));
        }

        private DatatypeNode buildAlias(ParseNode node) throws SattLineParseException {
            String name = declare(identifier(node));
            TypeReference target = typeReference(requireChild(node, "typeReference"), null);
            return DatatypeNode.alias(name, target, location(node));
        }

        private ModuleTypeNode buildModuleType(ParseNode node) throws SattLineParseException {
            String name = declare(identifier(node));
            Map<String, String> uses = new LinkedHashMap<>();
            List<VariableNode> parameters = new ArrayList<>();
            ModuleBodyNode body = ModuleBodyNode.empty(location(node));
            for (ParseNode child : node.getChildren()) {
                switch (child.getTag()) {
                    case "parameterSection" -> parameters.addAll(buildDeclarations(child, uses));
                    case "moduleBody" -> body = buildModuleBody(child, uses);
                    default -> skipToken(child, "moduleTypeDefinition");
                }
            }
            return new ModuleTypeNode(
                    name, parameters, body, new LinkedHashSet<>(uses.values()), location(node));
        }

        // Module bodies

        private ModuleBodyNode buildModuleBody(ParseNode node, Map<String, String> uses)
                throws SattLineParseException {
            List<VariableNode> variables = new ArrayList<>();
            List<SubmoduleNode> submodules = new ArrayList<>();
            List<CodeSequenceNode> sequences = new ArrayList<>();
            for (ParseNode child : node.getChildren()) {
                switch (child.getTag()) {
                    case "variableSection" -> variables.addAll(buildDeclarations(child, uses));
                    case "submoduleSection" -> {
                        for (ParseNode instance : child.getChildren("submoduleInstance")) {
                            submodules.add(buildSubmodule(instance, uses));
                        }
                        rejectUnknownRules(child, "submoduleInstance");
                    }
                    case "moduleCode" -> {
                        for (ParseNode block : child.getChildren("codeBlock")) {
                            sequences.add(buildCodeBlock(singleRule(block)));
                        }
                        rejectUnknownRules(child, "codeBlock");
                    }
                    default -> skipToken(child, "moduleBody");
                }
            }
            return new ModuleBodyNode(variables, submodules, sequences, location(node));
        }

        private List<VariableNode> buildDeclarations(ParseNode section, Map<String, String> uses)
                throws SattLineParseException {
            List<VariableNode> variables = new ArrayList<>();
            for (ParseNode child : section.getChildren()) {
                if (child.getTag().equals("variableDeclaration")) {
                    variables.addAll(buildVariableDeclaration(child, uses));
                } else {
                    skipToken(child, section.getTag());
                }
            }
            return variables;
        }

        private List<VariableNode> buildVariableDeclaration(ParseNode node, Map<String, String> uses)
                throws SattLineParseException {
            TypeReference type = typeReference(requireChild(node, "typeReference"), uses);
            Set<VariableQualifier> qualifiers = EnumSet.noneOf(VariableQualifier.class);
            for (ParseNode qualifier : node.getChildren("qualifier")) {
                ParseNode keyword = singleToken(qualifier);
                try {
                    qualifiers.add(VariableQualifier.fromKeyword(keyword.getTag()));
                } catch (IllegalArgumentException ex) {
                    throw new SattLineParseException(
                            "Unknown variable qualifier '" + keyword.getText() + "'", location(keyword), ex);
                }
            }
            ExpressionNode initialValue = null;
            ParseNode expression = node.findChild("expression").orElse(null);
            if (expression != null) {
                initialValue = buildExpression(expression);
            }
            List<ParseNode> names = node.getChildren("IDENTIFIER");
            if (names.isEmpty()) {
                throw new SattLineParseException("Variable declaration without a name", location(node));
            }
            List<VariableNode> variables = new ArrayList<>(names.size());
            for (ParseNode name : names) {
                variables.add(new VariableNode(name.getText(), type, qualifiers, initialValue, location(name)));
            }
            return variables;
        }

        private SubmoduleNode buildSubmodule(ParseNode node, Map<String, String> uses)
                throws SattLineParseException {
            TypeReference type = typeReference(requireChild(node, "typeReference"), uses);
            List<ParameterConnectionNode> connections = new ArrayList<>();
            ParseNode connectionList = node.findChild("parameterConnections").orElse(null);
            if (connectionList != null) {
                for (ParseNode connection : connectionList.getChildren("parameterConnection")) {
                    connections.add(
                            new ParameterConnectionNode(
                                    identifier(connection),
                                    buildExpression(requireChild(connection, "expression")),
                                    location(connection)));
                }
                rejectUnknownRules(connectionList, "parameterConnection");
            }
            return new SubmoduleNode(identifier(node), type, connections, location(node));
        }

        // Code

        private CodeSequenceNode buildCodeBlock(ParseNode node) throws SattLineParseException {
            return switch (node.getTag()) {
                case "equationBlock" -> new CodeSequenceNode(
                        identifier(node),
                        CodeSequenceKind.EQUATION_BLOCK,
                        buildStatements(node),
                        location(node));
                case "sequenceBlock" -> buildSequence(node);
                default -> throw unexpected(node, "codeBlock");
            };
        }

        private CodeSequenceNode buildSequence(ParseNode node) throws SattLineParseException {
            CodeSequenceKind kind =
                    node.hasChild("OPENSEQUENCE") ? CodeSequenceKind.OPEN_SEQUENCE : CodeSequenceKind.SEQUENCE;
            List<StatementNode> elements = new ArrayList<>();
            for (ParseNode child : node.getChildren()) {
                if (!child.getTag().equals("sequenceElement")) {
                    skipToken(child, "sequenceBlock");
                    continue;
                }
                ParseNode element = singleRule(child);
                switch (element.getTag()) {
                    case "sequenceStep" -> elements.add(
                            new SequenceStepNode(
                                    identifier(element),
                                    element.hasChild("SEQINITSTEP"),
                                    buildStatements(element),
                                    location(element)));
                    case "sequenceTransition" -> {
                        ParseNode name = element.findChild("IDENTIFIER").orElse(null);
                        elements.add(
                                new TransitionNode(
                                        name == null ? null : name.getText(),
                                        buildExpression(requireChild(element, "expression")),
                                        location(element)));
                    }
                    default -> throw unexpected(element, "sequenceElement");
                }
            }
            return new CodeSequenceNode(identifier(node), kind, elements, location(node));
        }

        /** Builds the {@code statement} children of a node, ignoring every other child. */
        private List<StatementNode> buildStatements(ParseNode parent) throws SattLineParseException {
            List<StatementNode> statements = new ArrayList<>();
            for (ParseNode child : parent.getChildren("statement")) {
                statements.add(buildStatement(child));
            }
            return statements;
        }

        private StatementNode buildStatement(ParseNode node) throws SattLineParseException {
            ParseNode statement = singleRule(node);
            return switch (statement.getTag()) {
                case "assignmentStatement" -> new AssignmentNode(
                        buildVariableReference(requireChild(statement, "variableReference")),
                        buildExpression(requireChild(statement, "expression")),
                        location(statement));
                case "ifStatement" -> buildIf(statement);
                case "whileStatement" -> new WhileStatementNode(
                        buildExpression(requireChild(statement, "expression")),
                        buildStatements(statement),
                        location(statement));
                case "callStatement" -> new CallStatementNode(buildCall(statement));
                default -> throw unexpected(statement, "statement");
            };
        }

        private IfStatementNode buildIf(ParseNode node) throws SattLineParseException {
            List<ConditionalBranchNode> branches = new ArrayList<>();
            branches.add(
                    new ConditionalBranchNode(
                            buildExpression(requireChild(node, "expression")),
                            buildStatements(node),
                            location(node)));
            List<StatementNode> elseStatements = List.of();
            for (ParseNode child : node.getChildren()) {
                switch (child.getTag()) {
                    case "elsifClause" -> branches.add(
                            new ConditionalBranchNode(
                                    buildExpression(requireChild(child, "expression")),
                                    buildStatements(child),
                                    location(child)));
                    case "elseClause" -> elseStatements = buildStatements(child);
                    case "expression", "statement" -> {
                        // consumed above
                    }
                    default -> skipToken(child, "ifStatement");
                }
            }
            return new IfStatementNode(branches, elseStatements, location(node));
        }

        // Expressions

        private ExpressionNode buildExpression(ParseNode node) throws SattLineParseException {
            return switch (node.getTag()) {
                case "expression" -> buildExpression(singleRule(node));
                case "orExpression",
                        "andExpression",
                        "comparisonExpression",
                        "additiveExpression",
                        "multiplicativeExpression" -> buildBinaryChain(node);
                case "unaryExpression" -> buildUnary(node);
                case "primaryExpression" -> buildPrimary(node);
                case "callExpression" -> buildCall(node);
                case "variableReference" -> buildVariableReference(node);
                case "literal" -> buildLiteral(node);
                default -> throw unexpected(node, "expression");
            };
        }

        /** Left-associative fold over {@code operand (operator operand)*}. */
        private ExpressionNode buildBinaryChain(ParseNode node) throws SattLineParseException {
            List<ParseNode> parts = node.getChildren();
            if (parts.isEmpty() || parts.size() % 2 == 0) {
                throw new SattLineParseException(
                        "Malformed " + node.getTag() + " with " + parts.size() + " parts", location(node));
            }
            ExpressionNode result = buildExpression(parts.get(0));
            for (int i = 1; i < parts.size(); i += 2) {
                BinaryOperator operator = binaryOperator(parts.get(i));
                result = new BinaryExpressionNode(operator, result, buildExpression(parts.get(i + 1)));
            }
            return result;
        }

        private BinaryOperator binaryOperator(ParseNode node) throws SattLineParseException {
            ParseNode token = node.isToken() ? node : singleToken(node);
            try {
                return BinaryOperator.fromSymbol(token.getText());
            } catch (IllegalArgumentException ex) {
                throw new SattLineParseException(
                        "Unknown operator '" + token.getText() + "'", location(token), ex);
            }
        }

        private ExpressionNode buildUnary(ParseNode node) throws SattLineParseException {
            ParseNode first = node.getChildren().isEmpty() ? null : node.getChildren().get(0);
            if (first == null) {
                throw new SattLineParseException("Empty unaryExpression", location(node));
            }
            if (!first.isToken()) {
                return buildExpression(singleRule(node));
            }
            UnaryOperator operator =
                    switch (first.getTag()) {
                        case "NOT" -> UnaryOperator.NOT;
                        case "MINUS" -> UnaryOperator.NEGATE;
                        default -> throw unexpected(first, "unaryExpression");
                    };
            return new UnaryExpressionNode(
                    operator, buildExpression(requireChild(node, "unaryExpression")), location(first));
        }

        private ExpressionNode buildPrimary(ParseNode node) throws SattLineParseException {
            // parentheses only group; the inner expression is the value
            return buildExpression(singleRule(node));
        }

        private CallExpressionNode buildCall(ParseNode node) throws SattLineParseException {
            List<ExpressionNode> arguments = new ArrayList<>();
            ParseNode argumentList = node.findChild("argumentList").orElse(null);
            if (argumentList != null) {
                for (ParseNode argument : argumentList.getChildren("expression")) {
                    arguments.add(buildExpression(argument));
                }
                rejectUnknownRules(argumentList, "expression");
            }
            return new CallExpressionNode(identifier(node), arguments, location(node));
        }

        private VariableReferenceNode buildVariableReference(ParseNode node) throws SattLineParseException {
            expect(node, "variableReference");
            List<String> path = new ArrayList<>();
            for (ParseNode segment : node.getChildren("IDENTIFIER")) {
                path.add(segment.getText());
            }
            if (path.isEmpty()) {
                throw new SattLineParseException("Empty variable reference", location(node));
            }
            return new VariableReferenceNode(path, location(node));
        }

        private LiteralNode buildLiteral(ParseNode node) throws SattLineParseException {
            expect(node, "literal");
            ParseNode token = singleToken(node);
            SourceLocation location = location(token);
            String text = token.getText();
            try {
                return switch (token.getTag()) {
                    case "INTEGER_LITERAL" -> new LiteralNode(LiteralKind.INTEGER, Long.parseLong(text), location);
                    case "REAL_LITERAL" -> new LiteralNode(LiteralKind.REAL, Double.parseDouble(text), location);
                    case "STRING_LITERAL" -> new LiteralNode(LiteralKind.STRING, unquote(text), location);
                    case "TRUE" -> new LiteralNode(LiteralKind.BOOLEAN, Boolean.TRUE, location);
                    case "FALSE" -> new LiteralNode(LiteralKind.BOOLEAN, Boolean.FALSE, location);
                    default -> throw unexpected(token, "literal");
                };
            } catch (NumberFormatException ex) {
                throw new SattLineParseException("Invalid numeric literal '" + text + "'", location, ex);
            }
        }

        // Names

        private TypeReference typeReference(ParseNode node, Map<String, String> uses)
                throws SattLineParseException {
            expect(node, "typeReference");
            String name = identifier(node);
            TypeReference reference = new TypeReference(name, location(node));
            if (!reference.isBuiltin()) {
                referenced.putIfAbsent(Names.key(name), name);
                if (uses != null) {
                    uses.putIfAbsent(Names.key(name), name);
                }
            }
            return reference;
        }

        private String declare(String name) {
            declared.putIfAbsent(Names.key(name), name);
            return name;
        }

        private String identifier(ParseNode node) throws SattLineParseException {
            return requireChild(node, "IDENTIFIER").getText();
        }

        // Shape checks

        private void expect(ParseNode node, String tag) throws SattLineParseException {
            if (!node.getTag().equals(tag)) {
                throw unexpected(node, tag);
            }
        }

        private ParseNode requireChild(ParseNode node, String tag) throws SattLineParseException {
            ParseNode child = node.findChild(tag).orElse(null);
            if (child == null) {
                throw new SattLineParseException(
                        "Missing '" + tag + "' in '" + node.getTag() + "'", location(node));
            }
            return child;
        }

        private ParseNode singleRule(ParseNode node) throws SattLineParseException {
            ParseNode found = null;
            for (ParseNode child : node.getChildren()) {
                if (child.isToken()) {
                    continue;
                }
                if (found != null) {
                    throw new SattLineParseException(
                            "Expected a single construct in '" + node.getTag() + "'", location(child));
                }
                found = child;
            }
            if (found == null) {
                throw new SattLineParseException("Empty '" + node.getTag() + "'", location(node));
            }
            return found;
        }

        private ParseNode singleToken(ParseNode node) throws SattLineParseException {
            if (node.getChildren().size() != 1 || !node.getChildren().get(0).isToken()) {
                throw new SattLineParseException(
                        "Expected a single token in '" + node.getTag() + "'", location(node));
            }
            return node.getChildren().get(0);
        }

        private void skipToken(ParseNode node, String context) throws SattLineParseException {
            if (!node.isToken()) {
                throw unexpected(node, context);
            }
        }

        private void rejectUnknownRules(ParseNode node, String allowed) throws SattLineParseException {
            for (ParseNode child : node.getChildren()) {
                if (!child.isToken() && !child.getTag().equals(allowed)) {
                    throw unexpected(child, node.getTag());
                }
            }
        }

        private SattLineParseException unexpected(ParseNode node, String context) {
            return new SattLineParseException(
                    "Unrecognised '" + node.getTag() + "' in '" + context + "'", location(node));
        }

        private SourceLocation location(ParseNode node) {
            return new SourceLocation(sourceName, node.getLine(), node.getColumn());
        }

        private static String unquote(String text) {
            if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
                return text.substring(1, text.length() - 1).replace("\"\"", "\"");
            }
            return text;
        }
    }
}
