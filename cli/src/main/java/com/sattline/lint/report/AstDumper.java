package com.sattline.lint.report;

import com.sattline.lint.loader.ast.AssignmentNode;
import com.sattline.lint.loader.ast.CallStatementNode;
import com.sattline.lint.loader.ast.CodeSequenceNode;
import com.sattline.lint.loader.ast.ConditionalBranchNode;
import com.sattline.lint.loader.ast.DatatypeKind;
import com.sattline.lint.loader.ast.DatatypeNode;
import com.sattline.lint.loader.ast.FieldNode;
import com.sattline.lint.loader.ast.IfStatementNode;
import com.sattline.lint.loader.ast.ModuleBodyNode;
import com.sattline.lint.loader.ast.ModuleTypeNode;
import com.sattline.lint.loader.ast.ParameterConnectionNode;
import com.sattline.lint.loader.ast.ProgramNode;
import com.sattline.lint.loader.ast.SequenceStepNode;
import com.sattline.lint.loader.ast.StatementNode;
import com.sattline.lint.loader.ast.SubmoduleNode;
import com.sattline.lint.loader.ast.TransitionNode;
import com.sattline.lint.loader.ast.VariableNode;
import com.sattline.lint.loader.ast.WhileStatementNode;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** Indented text rendering of a {@link ProgramNode}, for {@code --dump-ast}. */
public final class AstDumper {

    private final StringBuilder out = new StringBuilder();

    private AstDumper() {}

    public static String dump(ProgramNode program) {
        AstDumper dumper = new AstDumper();
        dumper.line(0, "Program " + program.getSourceName());
        for (DatatypeNode datatype : program.getDatatypes()) {
            dumper.datatype(1, datatype);
        }
        for (ModuleTypeNode moduleType : program.getModuleTypes()) {
            dumper.moduleType(1, moduleType);
        }
        dumper.line(1, "Body");
        dumper.body(2, program.getBody());
        return dumper.out.toString();
    }

    private void datatype(int depth, DatatypeNode datatype) {
        if (datatype.getKind() == DatatypeKind.ALIAS) {
            line(depth, "Alias " + datatype.getName() + " = "
                    + datatype.getAliasOf().map(Object::toString).orElse("?"));
            return;
        }
        line(depth, "Record " + datatype.getName());
        for (FieldNode field : datatype.getFields()) {
            line(depth + 1, "Field " + field.getName() + ": " + field.getType()
                    + field.getDefaultValue().map(value -> " := " + value).orElse(""));
        }
    }

    private void moduleType(int depth, ModuleTypeNode moduleType) {
        line(depth, "ModuleType " + moduleType.getName());
        for (VariableNode parameter : moduleType.getParameters()) {
            line(depth + 1, "Parameter " + variable(parameter));
        }
        body(depth + 1, moduleType.getBody());
    }

    private void body(int depth, ModuleBodyNode body) {
        for (VariableNode variable : body.getLocalVariables()) {
            line(depth, "Variable " + variable(variable));
        }
        for (SubmoduleNode submodule : body.getSubmodules()) {
            line(depth, "Submodule " + submodule.getName() + ": " + submodule.getType());
            for (ParameterConnectionNode connection : submodule.getConnections()) {
                line(depth + 1, connection.getParameterName() + " => " + connection.getValue());
            }
        }
        for (CodeSequenceNode sequence : body.getCodeSequences()) {
            line(depth, sequence.getKind().name() + " " + sequence.getName());
            statements(depth + 1, sequence.getStatements());
        }
    }

    private void statements(int depth, List<StatementNode> statements) {
        for (StatementNode statement : statements) {
            if (statement instanceof AssignmentNode assignment) {
                line(depth, assignment.getTarget() + " = " + assignment.getValue());
            } else if (statement instanceof IfStatementNode ifStatement) {
                String keyword = "If";
                for (ConditionalBranchNode branch : ifStatement.getBranches()) {
                    line(depth, keyword + " " + branch.getCondition());
                    statements(depth + 1, branch.getStatements());
                    keyword = "ElsIf";
                }
                if (!ifStatement.getElseStatements().isEmpty()) {
                    line(depth, "Else");
                    statements(depth + 1, ifStatement.getElseStatements());
                }
            } else if (statement instanceof WhileStatementNode whileStatement) {
                line(depth, "While " + whileStatement.getCondition());
                statements(depth + 1, whileStatement.getBody());
            } else if (statement instanceof CallStatementNode call) {
                line(depth, "Call " + call.getCall());
            } else if (statement instanceof SequenceStepNode step) {
                line(depth, (step.isInitial() ? "InitStep " : "Step ") + step.getName());
                statements(depth + 1, step.getStatements());
            } else if (statement instanceof TransitionNode transition) {
                line(depth, "Transition " + transition.getName().orElse("") + " WaitFor "
                        + transition.getCondition());
            }
        }
    }

    private static String variable(VariableNode variable) {
        StringBuilder text = new StringBuilder(variable.getName()).append(": ").append(variable.getType());
        if (!variable.getQualifiers().isEmpty()) {
            text.append(' ')
                    .append(variable.getQualifiers().stream()
                            .map(qualifier -> qualifier.name().toLowerCase(Locale.ROOT))
                            .collect(Collectors.joining(" ")));
        }
        variable.getInitialValue().ifPresent(value -> text.append(" := ").append(value));
        return text.toString();
    }

    private void line(int depth, String text) {
        out.append("  ".repeat(depth)).append(text).append('\n');
    }
}
