package org.pragmatica.pegvm.generator;

import com.google.common.base.Preconditions;
import org.pragmatica.pegvm.grammar.Expression;
import org.pragmatica.pegvm.grammar.Rule;
import org.pragmatica.pegvm.vm.AnyMatcher;
import org.pragmatica.pegvm.vm.CharClassMatcher;
import org.pragmatica.pegvm.vm.LiteralMatcher;
import org.pragmatica.pegvm.vm.Matcher;
import org.pragmatica.pegvm.vm.Opcode;
import org.pragmatica.pegvm.vm.StackId;
import org.pragmatica.pegvm.vm.ThunkInfo;

import java.util.List;
import java.util.Map;

/**
 * Lowers the expression tree of one rule into a relocatable fragment.
 *
 * <p>Every construct that goes on after a failed attempt (choice, repetition, optional,
 * lookahead, the rule itself) saves the cursor on the position stack before the attempt and
 * restores it afterwards, so terminals and sequences never save it themselves.
 *
 * <p>When an expression finishes, each label it declares is either bound by that attempt or
 * unbound, so a thunk never sees text left over from a backtracked alternative or an earlier
 * iteration.
 */
final class ExpressionCompiler {
    private final TableBuilder tables;
    private final Map<String, Integer> ruleIndices;
    private final int ruleIndex;

    ExpressionCompiler(TableBuilder tables, Map<String, Integer> ruleIndices, int ruleIndex) {
        this.tables = tables;
        this.ruleIndices = ruleIndices;
        this.ruleIndex = ruleIndex;
    }

    /**
     * {@code Push(pstack) body RestoreIfF Return}
     */
    Fragment compileRule(Rule rule) {
        return Fragment.builder()
                       .emitPush(StackId.POSITION)
                       .append(compile(rule.expression(), LabelScope.EMPTY))
                       .emit(Opcode.RESTORE_IF_F)
                       .emit(Opcode.RETURN)
                       .build();
    }

    Fragment compile(Expression expr, LabelScope scope) {
        if (expr instanceof Expression.Literal literal) {
            return match(new LiteralMatcher(literal.text(), literal.caseInsensitive()));
        }
        if (expr instanceof Expression.CharClass charClass) {
            return match(CharClassMatcher.of(charClass.pattern()));
        }
        if (expr instanceof Expression.AnyChar) {
            return match(new AnyMatcher());
        }
        if (expr instanceof Expression.RuleRef ref) {
            return compileRuleRef(ref);
        }
        if (expr instanceof Expression.Sequence sequence) {
            return compileSequence(sequence.elements(), scope);
        }
        if (expr instanceof Expression.Choice choice) {
            return compileChoice(choice.alternatives(), scope);
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return compileZeroOrMore(zom.expression(), scope);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return compileOneOrMore(oom.expression(), scope);
        }
        if (expr instanceof Expression.Optional opt) {
            return Fragment.builder()
                           .emitPush(StackId.POSITION)
                           .append(compile(opt.expression(), scope))
                           .emit(Opcode.RESTORE_IF_F)
                           .emit(Opcode.CLEAR_F)
                           .build();
        }
        if (expr instanceof Expression.AndPredicate and) {
            return lookahead(and.expression(), scope).build();
        }
        if (expr instanceof Expression.NotPredicate not) {
            var builder = lookahead(not.expression(), scope).emit(Opcode.FLIP_F);
            // operand matched only when the predicate fails
            return unbind(builder, declaredLabels(not.expression())).build();
        }
        if (expr instanceof Expression.Labeled labeled) {
            var label = tables.insertString(labeled.label());
            return Fragment.builder()
                           .emitPush(StackId.POSITION)
                           .append(compile(labeled.expression(), scope))
                           .emit(Opcode.STORE_IF_NOT_F, label)
                           .build();
        }
        if (expr instanceof Expression.Action action) {
            return compileAction(action, scope);
        }
        if (expr instanceof Expression.Predicate predicate) {
            var thunk = tables.insertPredicate(new ThunkInfo(predicate.code(),
                                                             scope.labels(),
                                                             ruleIndex,
                                                             predicate.span()));
            return Fragment.builder()
                           .emit(Opcode.CALL_B, thunk)
                           .build();
        }
        throw new IllegalArgumentException("Unsupported expression " + expr.getClass().getSimpleName());
    }

    private Fragment match(Matcher matcher) {
        return Fragment.builder()
                       .emit(Opcode.MATCH, tables.insertMatcher(matcher))
                       .build();
    }

    private Fragment compileRuleRef(Expression.RuleRef ref) {
        var target = ruleIndices.get(ref.ruleName());
        Preconditions.checkState(target != null, "Reference to undefined rule '%s'", ref.ruleName());
        return Fragment.builder()
                       .emitCall(target)
                       .build();
    }

    /**
     * {@code e1 JumpIfF end e2 JumpIfF end ... en}. When elements declare labels, failures jump to
     * {@code Unbind} instructions for all of them instead:
     * {@code e1 JumpIfF fail ... en JumpIfNotF end fail: Unbind l1 ... Unbind lk end:}
     */
    private Fragment compileSequence(List<Expression> elements, LabelScope scope) {
        var builder = Fragment.builder();
        if (elements.isEmpty()) {
            // matches the empty string
            return builder.emit(Opcode.CLEAR_F)
                          .build();
        }
        var labels = elements.size() > 1
                     ? declaredLabels(elements)
                     : LabelScope.EMPTY;
        var end = builder.newLabel();
        var fail = labels.labels().isEmpty()
                   ? end
                   : builder.newLabel();
        var visible = scope;
        for (int i = 0; i < elements.size(); i++) {
            var element = elements.get(i);
            builder.append(compile(element, visible));
            if (i < elements.size() - 1) {
                builder.emitJump(Opcode.JUMP_IF_F, fail);
            }
            visible = visible.withAll(declaredLabels(element));
        }
        if (fail != end) {
            builder.emitJump(Opcode.JUMP_IF_NOT_F, end)
                   .bind(fail);
            unbind(builder, labels);
        }
        return builder.bind(end)
                      .build();
    }

    /**
     * {@code Push(pstack) alt RestoreIfF JumpIfNotF end} for all but the last alternative, which is emitted bare.
     * Labels declared in any alternative are unbound first, so only those of the winner end up bound.
     */
    private Fragment compileChoice(List<Expression> alternatives, LabelScope scope) {
        Preconditions.checkArgument(!alternatives.isEmpty(), "Choice without alternatives");
        var builder = unbind(Fragment.builder(), declaredLabels(alternatives));
        var end = builder.newLabel();
        for (int i = 0; i < alternatives.size() - 1; i++) {
            builder.emitPush(StackId.POSITION)
                   .append(compile(alternatives.get(i), scope))
                   .emit(Opcode.RESTORE_IF_F)
                   .emitJump(Opcode.JUMP_IF_NOT_F, end);
        }
        return builder.append(compile(alternatives.get(alternatives.size() - 1), scope))
                      .bind(end)
                      .build();
    }

    /**
     * {@code loop: Push(pstack) e RestoreIfF JumpIfNotF loop ClearF}
     */
    private Fragment compileZeroOrMore(Expression child, LabelScope scope) {
        var builder = Fragment.builder();
        var loop = builder.newLabel();
        return builder.bind(loop)
                      .emitPush(StackId.POSITION)
                      .append(compile(child, scope))
                      .emit(Opcode.RESTORE_IF_F)
                      .emitJump(Opcode.JUMP_IF_NOT_F, loop)
                      .emit(Opcode.CLEAR_F)
                      .build();
    }

    /**
     * Same loop as zero-or-more, with a counter on the call stack that becomes 1 after the
     * first successful iteration; {@code CumulOrF} turns the final failure into success when it is set.
     */
    private Fragment compileOneOrMore(Expression child, LabelScope scope) {
        var builder = Fragment.builder();
        var loop = builder.newLabel();
        var done = builder.newLabel();
        return builder.emitPush(StackId.CALL, 0)
                      .bind(loop)
                      .emitPush(StackId.POSITION)
                      .append(compile(child, scope))
                      .emit(Opcode.RESTORE_IF_F)
                      .emitJump(Opcode.JUMP_IF_F, done)
                      .emit(Opcode.POP, StackId.CALL.id())
                      .emitPush(StackId.CALL, 1)
                      .emitJump(Opcode.JUMP, loop)
                      .bind(done)
                      .emit(Opcode.CUMUL_OR_F)
                      .build();
    }

    private static Fragment.Builder unbind(Fragment.Builder builder, LabelScope labels) {
        for (int i = 0; i < labels.labels().length(); i++) {
            builder.emit(Opcode.UNBIND, labels.labels().get(i));
        }
        return builder;
    }

    private Fragment.Builder lookahead(Expression child, LabelScope scope) {
        return Fragment.builder()
                       .emitPush(StackId.POSITION)
                       .append(compile(child, scope))
                       .emit(Opcode.RESTORE);
    }

    /**
     * {@code e JumpIfF end CallA(thunk)}. The thunk sees the labels of the enclosing scope plus those
     * declared inside the action's own expression.
     */
    private Fragment compileAction(Expression.Action action, LabelScope scope) {
        var params = scope.withAll(declaredLabels(action.expression()));
        var thunk = tables.insertAction(new ThunkInfo(action.code(), params.labels(), ruleIndex, action.span()));
        var builder = Fragment.builder();
        var end = builder.newLabel();
        return builder.append(compile(action.expression(), scope))
                      .emitJump(Opcode.JUMP_IF_F, end)
                      .emit(Opcode.CALL_A, thunk)
                      .bind(end)
                      .build();
    }

    /**
     * Labels an expression binds for the code that follows it. Nested actions open their own scope,
     * and labels inside a repetition stay local to its body.
     */
    private LabelScope declaredLabels(Expression expr) {
        if (expr instanceof Expression.Labeled labeled) {
            return LabelScope.EMPTY.with(tables.insertString(labeled.label()))
                                   .withAll(declaredLabels(labeled.expression()));
        }
        if (expr instanceof Expression.Sequence sequence) {
            return declaredLabels(sequence.elements());
        }
        if (expr instanceof Expression.Choice choice) {
            return declaredLabels(choice.alternatives());
        }
        if (expr instanceof Expression.Optional opt) {
            return declaredLabels(opt.expression());
        }
        if (expr instanceof Expression.AndPredicate and) {
            return declaredLabels(and.expression());
        }
        if (expr instanceof Expression.NotPredicate not) {
            return declaredLabels(not.expression());
        }
        return LabelScope.EMPTY;
    }

    private LabelScope declaredLabels(List<Expression> expressions) {
        var result = LabelScope.EMPTY;
        for (var expr : expressions) {
            result = result.withAll(declaredLabels(expr));
        }
        return result;
    }
}
