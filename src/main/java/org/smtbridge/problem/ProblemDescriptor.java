package org.smtbridge.problem;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import org.smtbridge.core.ConstantValue;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.Quantifier;
import org.smtbridge.core.SymRef;
import org.smtbridge.solver.SmtConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 编码器的输入：上游已经构造好的完整约束问题。本库只读取，从不修改。
 */
@Getter
@Builder
public final class ProblemDescriptor {

    @Singular
    private final Set<Kind> kinds;

    // true: 求可满足性；false: 证明有效性
    @Builder.Default
    private final boolean sat = true;

    @Singular
    private final List<String> comments;

    @Singular
    private final List<NamedSymVar> inputs;

    // 为空时由 inputs 按量词顺序推导
    @Singular("skolemEntry")
    private final List<SkolemEntry> skolemMap;

    @Singular
    private final Map<SymRef, ConstantValue> constants;

    @Singular
    private final List<LookupTable> tables;

    @Singular
    private final List<ArrayInfo> arrays;

    @Singular
    private final List<UninterpretedSignature> uninterpretedFunctions;

    @Singular
    private final List<Axiom> axioms;

    @Singular
    private final List<Assignment> assignments;

    @Singular
    private final List<SymRef> constraints;

    @NonNull
    private final SymRef output;

    @NonNull
    private final SmtConfig config;

    @Builder.Default
    private final CaseCondition caseCondition = CaseCondition.none();

    /**
     * 实际使用的斯科伦映射：给定时原样返回，否则按输入顺序推导。
     * 求可满足性时全称变量被 forall 绑定；证明时目标整体取反，被绑定的是存在变量。
     * 其余变量依赖于它之前出现的全部被绑定变量。
     */
    public List<SkolemEntry> getEffectiveSkolemMap() {
        if (!skolemMap.isEmpty()) {
            return skolemMap;
        }
        Quantifier bound = sat ? Quantifier.ALL : Quantifier.EX;
        List<SkolemEntry> result = new ArrayList<>();
        List<SymRef> boundSoFar = new ArrayList<>();
        for (NamedSymVar input : inputs) {
            if (input.getQuantifier() == bound) {
                boundSoFar.add(input.getRef());
                result.add(SkolemEntry.universal(input.getRef()));
            } else {
                result.add(SkolemEntry.existential(input.getRef(), boundSoFar));
            }
        }
        return result;
    }

    public boolean hasUniversals() {
        return inputs.stream().anyMatch(NamedSymVar::isUniversal);
    }
}
