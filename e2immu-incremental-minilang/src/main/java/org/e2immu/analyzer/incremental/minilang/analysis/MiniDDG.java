package org.e2immu.analyzer.incremental.minilang.analysis;

import org.e2immu.analyzer.incremental.common.syntax.Node;
import org.e2immu.analyzer.incremental.engine.IncrementalAnalyzer;
import org.e2immu.analyzer.incremental.engine.ddg.DDG;
import org.e2immu.analyzer.incremental.engine.entry.ProjectEntry;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.e2immu.analyzer.incremental.engine.unit.UnitKind;
import org.e2immu.analyzer.incremental.engine.value.AnalysisSet;
import org.e2immu.analyzer.incremental.engine.value.AnalysisValue;
import org.e2immu.analyzer.incremental.engine.value.FunctionValue;
import org.e2immu.analyzer.incremental.engine.variable.VariableDef;
import org.e2immu.analyzer.incremental.minilang.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The inference rules of the mini language. Statements are visited by {@link #walk(Node)}; expressions are
 * evaluated recursively by {@link #evaluate(Node)}. Function bodies and comprehensions are not visited as part
 * of the enclosing unit: they are analyzed by units of their own.
 */
public class MiniDDG extends DDG {
    private static final Logger LOGGER = LoggerFactory.getLogger(MiniDDG.class);

    private final IncrementalAnalyzer analyzer;

    public MiniDDG(IncrementalAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public boolean walk(Node node) {
        if (node instanceof Block) {
            return true;
        }
        AnalysisUnit unit = currentUnit();
        if (node instanceof VarStatement vs) {
            VariableDef variable = declare(vs, vs.name());
            if (vs.initializer() != null) {
                AnalysisSet values = evaluate(vs.initializer());
                if (variable != null) variable.addTypes(unit, values);
            }
        } else if (node instanceof AssignmentStatement as) {
            AnalysisSet values = evaluate(as.value());
            if (as.target() instanceof NameExpression ne) {
                assign(as, ne.name(), values);
            } else if (as.target() instanceof MemberExpression me) {
                for (AnalysisValue object : evaluate(me.object())) {
                    object.setMember(as, unit, me.member(), values);
                }
            }
        } else if (node instanceof FunctionDeclaration fd) {
            FunctionValue function = declareFunction(fd, fd.body(), fd.name(), fd.parameters());
            VariableDef variable = declare(fd, fd.name());
            if (function != null && variable != null) {
                variable.addTypes(unit, AnalysisSet.of(function));
            }
        } else if (node instanceof ReturnStatement rs) {
            if (rs.value() != null) {
                returnValues(rs, evaluate(rs.value()));
            }
        } else if (node instanceof ExportStatement es) {
            linkVariable(es, es.alias(), es.name());
        } else if (node instanceof ExpressionStatement es) {
            evaluate(es.expression());
        } else if (node instanceof ComprehensionExpression ce && node == unit.ast()
                   && unit.kind() == UnitKind.COMPREHENSION) {
            comprehensionBody(ce, unit);
        }
        return false;
    }

    @Override
    public AnalysisSet evaluate(Node expression) {
        if (expression instanceof NumberLiteral) return AnalysisSet.of(BuiltinTypes.NUMBER);
        if (expression instanceof StringLiteral) return AnalysisSet.of(BuiltinTypes.STRING);
        if (expression instanceof BooleanLiteral) return AnalysisSet.of(BuiltinTypes.BOOLEAN);
        if (expression instanceof NullLiteral) return AnalysisSet.of(BuiltinTypes.NULL);
        if (expression instanceof NameExpression ne) {
            return lookup(ne, ne.name());
        }
        AnalysisUnit unit = currentUnit();
        if (expression instanceof MemberExpression me) {
            AnalysisSet result = AnalysisSet.EMPTY;
            for (AnalysisValue object : evaluate(me.object())) {
                result = result.union(object.getMember(me, unit, me.member()));
            }
            return result;
        }
        if (expression instanceof CallExpression ce) {
            List<AnalysisSet> arguments = new ArrayList<>(ce.arguments().size());
            for (Node argument : ce.arguments()) {
                arguments.add(evaluate(argument));
            }
            AnalysisSet result = AnalysisSet.EMPTY;
            for (AnalysisValue callee : evaluate(ce.callee())) {
                result = result.union(callee.call(ce, unit, arguments));
            }
            return result;
        }
        if (expression instanceof RequireExpression re) {
            return require(re, unit);
        }
        if (expression instanceof ArrayLiteral al) {
            ArrayValue array = arrayValue(al, unit);
            for (Node element : al.elements()) {
                AnalysisSet values = evaluate(element);
                if (array != null) array.addElements(unit, values);
            }
            return array == null ? AnalysisSet.EMPTY : AnalysisSet.of(array);
        }
        if (expression instanceof ComprehensionExpression ce) {
            declareComprehension(ce, "comprehension@" + ce.position());
            ArrayValue array = arrayValue(ce, unit);
            return array == null ? AnalysisSet.EMPTY : AnalysisSet.of(array);
        }
        if (expression instanceof BinaryExpression be) {
            return plus(evaluate(be.left()), evaluate(be.right()));
        }
        throw new UnsupportedOperationException("Cannot evaluate " + expression.nodeType());
    }

    private void comprehensionBody(ComprehensionExpression ce, AnalysisUnit unit) {
        AnalysisSet elements = AnalysisSet.EMPTY;
        for (AnalysisValue iterable : evaluate(ce.source())) {
            elements = elements.union(iterable.iterate(ce, unit));
        }
        VariableDef loopVariable = declare(ce, ce.variable());
        if (loopVariable != null) {
            loopVariable.addTypes(unit, elements);
        }
        AnalysisSet values = evaluate(ce.body());
        ArrayValue array = arrayValue(ce, unit);
        if (array != null) array.addElements(unit, values);
    }

    private AnalysisSet require(RequireExpression re, AnalysisUnit unit) {
        ProjectEntry entry = analyzer.entry(re.module());
        if (entry == null) {
            LOGGER.debug("Module {} not (yet) in the project, required by {}", re.module(), unit);
            analyzer.awaitEntry(re.module(), unit);
            return AnalysisSet.EMPTY;
        }
        return AnalysisSet.of(entry.module());
    }

    // in eval mode, only an existing array value is returned
    private ArrayValue arrayValue(MiniNode node, AnalysisUnit unit) {
        if (unit.isForEval()) {
            return module().nodeValue(node, ArrayValue.class);
        }
        return module().getOrCreateNodeValue(node, ArrayValue.class, () -> new ArrayValue(node.position()));
    }

    private static AnalysisSet plus(AnalysisSet left, AnalysisSet right) {
        AnalysisSet result = AnalysisSet.EMPTY;
        for (AnalysisValue l : left) {
            for (AnalysisValue r : right) {
                boolean numeric = BuiltinTypes.NUMBER.equals(l) && BuiltinTypes.NUMBER.equals(r);
                result = result.add(numeric ? BuiltinTypes.NUMBER : BuiltinTypes.STRING);
            }
        }
        return result;
    }
}
