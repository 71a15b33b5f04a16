package com.sattline.lint.loader.analysis;

import com.sattline.lint.diagnostics.DiagnosticsSink;
import com.sattline.lint.diagnostics.TraceEvent;
import com.sattline.lint.loader.ast.AssignmentNode;
import com.sattline.lint.loader.ast.BinaryExpressionNode;
import com.sattline.lint.loader.ast.CallExpressionNode;
import com.sattline.lint.loader.ast.CallStatementNode;
import com.sattline.lint.loader.ast.CodeSequenceNode;
import com.sattline.lint.loader.ast.ConditionalBranchNode;
import com.sattline.lint.loader.ast.ExpressionNode;
import com.sattline.lint.loader.ast.IfStatementNode;
import com.sattline.lint.loader.ast.ModuleBodyNode;
import com.sattline.lint.loader.ast.ModuleTypeNode;
import com.sattline.lint.loader.ast.Names;
import com.sattline.lint.loader.ast.ParameterConnectionNode;
import com.sattline.lint.loader.ast.ProgramNode;
import com.sattline.lint.loader.ast.SequenceStepNode;
import com.sattline.lint.loader.ast.StatementNode;
import com.sattline.lint.loader.ast.SubmoduleNode;
import com.sattline.lint.loader.ast.TransitionNode;
import com.sattline.lint.loader.ast.UnaryExpressionNode;
import com.sattline.lint.loader.ast.VariableNode;
import com.sattline.lint.loader.ast.VariableReferenceNode;
import com.sattline.lint.loader.ast.WhileStatementNode;
import com.sattline.lint.loader.merge.BasePicture;
import com.sattline.lint.loader.merge.MergeEngine;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Counts reads and writes of every declared variable and classifies the ones that look wrong.
 *
 * <p>Globals are the root program's local variables; they are visible from the root body and from
 * every module type. Inside a module type its own locals come first, then its parameters (which hide
 * a global of the same name but are not classified themselves), then globals. The assignment target
 * is a write; every other variable reference is a read.
 */
public final class VariableUsageAnalyzer {

    private final DiagnosticsSink diagnostics;

    public VariableUsageAnalyzer() {
        this(DiagnosticsSink.NONE);
    }

    public VariableUsageAnalyzer(DiagnosticsSink diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public UsageReport analyze(BasePicture basePicture) {
        Objects.requireNonNull(basePicture, "basePicture");
        String rootName = basePicture.getRootName();

        Map<String, VariableUsage> globals = declare(basePicture.getGlobalVariables(), rootName);
        List<VariableUsage> ordered = new ArrayList<>(globals.values());

        Scope rootScope = new Scope(rootName, globals, Set.of(), Map.of());
        walkBody(basePicture.getBody(), rootScope);

        for (ModuleTypeNode moduleType : basePicture.getModuleTypes()) {
            Map<String, VariableUsage> locals =
                    declare(moduleType.getLocalVariables(), moduleType.getName());
            ordered.addAll(locals.values());
            Set<String> parameters = new HashSet<>();
            for (VariableNode parameter : moduleType.getParameters()) {
                parameters.add(Names.key(parameter.getName()));
            }
            walkBody(moduleType.getBody(), new Scope(moduleType.getName(), locals, parameters, globals));
        }

        return classify(ordered, rootName);
    }

    /** Analyses one file on its own: its body and its module types, without resolving references. */
    public UsageReport analyze(ProgramNode program) {
        Objects.requireNonNull(program, "program");
        return analyze(MergeEngine.single(program.getSourceName(), program));
    }

    private static Map<String, VariableUsage> declare(List<VariableNode> variables, String scopeName) {
        Map<String, VariableUsage> table = new LinkedHashMap<>();
        for (VariableNode variable : variables) {
            // A duplicate declaration in one scope keeps the first.
            table.putIfAbsent(Names.key(variable.getName()), new VariableUsage(variable, scopeName));
        }
        return table;
    }

    private UsageReport classify(List<VariableUsage> ordered, String rootName) {
        List<UsageEntry> unused = new ArrayList<>();
        List<UsageEntry> readOnly = new ArrayList<>();
        List<UsageEntry> writeOnly = new ArrayList<>();
        for (VariableUsage usage : ordered) {
            UsageCategory category =
                    UsageCategory.classify(
                            usage.getReads(), usage.getWrites(), usage.getVariable().isConstant());
            if (category == null) {
                continue;
            }
            UsageEntry entry = usage.toEntry();
            switch (category) {
                case UNUSED -> unused.add(entry);
                case READ_ONLY_NOT_CONST -> readOnly.add(entry);
                case WRITE_WITHOUT_READ -> writeOnly.add(entry);
            }
            diagnostics.trace(
                    TraceEvent.debug(
                            TraceEvent.Stage.ANALYZE,
                            category.getLabel() + ": " + entry,
                            entry.getLocation().getSourceName()));
        }
        diagnostics.trace(
                TraceEvent.info(
                        TraceEvent.Stage.ANALYZE,
                        "Analysed " + ordered.size() + " variables: " + unused.size() + " unused, "
                                + readOnly.size() + " read-only-not-const, " + writeOnly.size()
                                + " write-without-read",
                        rootName));
        return new UsageReport(unused, readOnly, writeOnly, ordered.size());
    }

    private void walkBody(ModuleBodyNode body, Scope scope) {
        for (VariableNode variable : body.getLocalVariables()) {
            variable.getInitialValue().ifPresent(value -> readExpression(value, scope));
        }
        for (SubmoduleNode submodule : body.getSubmodules()) {
            for (ParameterConnectionNode connection : submodule.getConnections()) {
                readExpression(connection.getValue(), scope);
            }
        }
        for (CodeSequenceNode sequence : body.getCodeSequences()) {
            walkStatements(sequence.getStatements(), scope);
        }
    }

    private void walkStatements(List<StatementNode> statements, Scope scope) {
        for (StatementNode statement : statements) {
            walkStatement(statement, scope);
        }
    }

    private void walkStatement(StatementNode statement, Scope scope) {
        if (statement instanceof AssignmentNode assignment) {
            readExpression(assignment.getValue(), scope);
            VariableUsage target = scope.lookup(assignment.getTarget().getRootName());
            if (target != null) {
                target.recordWrite();
            }
        } else if (statement instanceof IfStatementNode ifStatement) {
            for (ConditionalBranchNode branch : ifStatement.getBranches()) {
                readExpression(branch.getCondition(), scope);
                walkStatements(branch.getStatements(), scope);
            }
            walkStatements(ifStatement.getElseStatements(), scope);
        } else if (statement instanceof WhileStatementNode whileStatement) {
            readExpression(whileStatement.getCondition(), scope);
            walkStatements(whileStatement.getBody(), scope);
        } else if (statement instanceof CallStatementNode call) {
            readExpression(call.getCall(), scope);
        } else if (statement instanceof SequenceStepNode step) {
            walkStatements(step.getStatements(), scope);
        } else if (statement instanceof TransitionNode transition) {
            readExpression(transition.getCondition(), scope);
        }
    }

    private void readExpression(ExpressionNode expression, Scope scope) {
        if (expression instanceof VariableReferenceNode reference) {
            VariableUsage usage = scope.lookup(reference.getRootName());
            if (usage != null) {
                usage.recordRead();
            }
        } else if (expression instanceof UnaryExpressionNode unary) {
            readExpression(unary.getOperand(), scope);
        } else if (expression instanceof BinaryExpressionNode binary) {
            readExpression(binary.getLeft(), scope);
            readExpression(binary.getRight(), scope);
        } else if (expression instanceof CallExpressionNode call) {
            for (ExpressionNode argument : call.getArguments()) {
                readExpression(argument, scope);
            }
        }
    }

    private static final class Scope {
        private final String name;
        private final Map<String, VariableUsage> locals;
        private final Set<String> parameters;
        private final Map<String, VariableUsage> globals;

        Scope(
                String name,
                Map<String, VariableUsage> locals,
                Set<String> parameters,
                Map<String, VariableUsage> globals) {
            this.name = name;
            this.locals = locals;
            this.parameters = parameters;
            this.globals = globals;
        }

        /** Declaration a name refers to in this scope, or {@code null} for parameters and unknowns. */
        VariableUsage lookup(String variableName) {
            String key = Names.key(variableName);
            VariableUsage local = locals.get(key);
            if (local != null) {
                return local;
            }
            if (parameters.contains(key)) {
                return null;
            }
            return globals.get(key);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
