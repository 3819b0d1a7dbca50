package org.smtbridge.result;

import org.smtbridge.core.ConstantValue;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.sexpr.SExpr;
import org.smtbridge.sexpr.SExprParseException;
import org.smtbridge.sexpr.SExprParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 从一行模型输出 {@code ((sN v))} 中取出输入的取值。
 * <p>
 * 值按 {@link ValueRule} 的顺序匹配。之后还有两条特殊规则：
 * <ol>
 *     <li>cvc4 会把未解释值打印成 {@code ((sN (LAMBDA ... last)))}，此时只看最后一个操作数；</li>
 *     <li>引用能解析、但值的形状无法识别时，严格模式报错，宽松模式（目标值解码使用）不产生绑定。</li>
 * </ol>
 * 不以输入引用开头的行不产生绑定，也不是错误。
 */
public final class ModelValueExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ModelValueExtractor.class);

    private static final String LAMBDA = "LAMBDA";

    private final InputResolver resolver;
    private final boolean strict;

    private ModelValueExtractor(InputResolver resolver, boolean strict) {
        this.resolver = resolver;
        this.strict = strict;
    }

    public static ModelValueExtractor strict(List<NamedSymVar> inputs) {
        return new ModelValueExtractor(new InputResolver(inputs), true);
    }

    public static ModelValueExtractor permissive(List<NamedSymVar> inputs) {
        return new ModelValueExtractor(new InputResolver(inputs), false);
    }

    static ModelValueExtractor permissive(InputResolver resolver) {
        return new ModelValueExtractor(resolver, false);
    }

    /**
     * 解析并解码一行模型输出（严格模式）。
     * @throws ModelExtractionException 行无法解析、引用不唯一，或值无法识别时。
     */
    public static List<ModelBinding<ConstantValue>> interpretModelLine(List<NamedSymVar> inputs, String line) {
        return strict(inputs).extract(parseLine(line), line);
    }

    static SExpr parseLine(String line) {
        try {
            return SExprParser.parse(line);
        } catch (SExprParseException e) {
            logger.error("无法解析求解器输出: {}", line);
            throw new ModelExtractionException("Failed to parse SMT-Lib2 model output from: " + line
                    + "\n*** Reason: " + e.getReason(), line, e);
        }
    }

    /**
     * @param tree 已解析的一行。
     * @param line 原始文本，用于报错。
     * @return 零个或一个绑定。
     */
    public List<ModelBinding<ConstantValue>> extract(SExpr tree, String line) {
        List<SExpr> outer = tree.asApp().orElse(List.of());
        if (outer.isEmpty()) {
            return List.of();
        }
        List<SExpr> binding = outer.get(0).asApp().orElse(List.of());
        if (binding.isEmpty()) {
            return List.of();
        }
        boolean single = outer.size() == 1;
        List<SExpr> lambdaOperands = binding.size() >= 2 ? lambdaOperands(binding.get(1)) : List.of();
        if (!single && lambdaOperands.isEmpty()) {
            return List.of();
        }

        SExpr reference = binding.get(0);
        Optional<NamedSymVar> resolved = resolver.identify(reference, line);
        if (resolved.isEmpty()) {
            logger.debug("{} 不是输入，忽略", reference);
            return List.of();
        }
        NamedSymVar input = resolved.get();

        if (single && binding.size() == 2) {
            SExpr value = binding.get(1);
            for (ValueRule rule : ValueRule.values()) {
                MatchResult<ConstantValue> result = rule.match(input.getKind(), value);
                switch (result.getOutcome()) {
                    case MATCH -> {
                        ConstantValue v = result.getValue().orElseThrow();
                        if (rule == ValueRule.REAL_CAST_FALLBACK) {
                            logger.warn("{} 的类型是 {}，但求解器给出了实数 {}，按实数绑定", input.getName(), input.getKind(), value);
                        }
                        logger.debug("{} = {}（规则 {}）", input.getName(), v, rule);
                        return List.of(ModelBinding.of(input.getRef().getId(), input.getName(), v));
                    }
                    case MALFORMED -> {
                        String reason = result.getReason().orElse("");
                        logger.error("{} 的取值非法: {}", input.getName(), reason);
                        throw new ModelExtractionException("Cannot extract value for " + input.getName()
                                + ": " + reason + "\n\tInput: " + line, line, value);
                    }
                    case NO_MATCH -> logger.trace("规则 {} 不匹配 {}", rule, value);
                }
            }
        }

        if (!lambdaOperands.isEmpty()) {
            SExpr last = lambdaOperands.get(lambdaOperands.size() - 1);
            logger.warn("{} 的取值被 LAMBDA 包裹，只取最后一个操作数 {}", input.getName(), last);
            return extract(SExpr.app(SExpr.app(reference, last)), line);
        }

        if (single && strict) {
            SExpr rest = SExpr.app(binding.subList(1, binding.size()));
            logger.error("无法识别 {} 的取值: {}", input.getName(), line);
            throw new ModelExtractionException("Cannot extract value for " + input.getName()
                    + "\n\tInput: " + line + "\n\tParse: " + rest, line, rest);
        }
        return List.of();
    }

    private static List<SExpr> lambdaOperands(SExpr value) {
        List<SExpr> items = value.asApp().orElse(List.of());
        if (items.isEmpty() || !items.get(0).isSymbol(LAMBDA)) {
            return List.of();
        }
        return items.subList(1, items.size());
    }
}
