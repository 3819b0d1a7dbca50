package org.smtbridge.result;

import org.smtbridge.core.ConstantValue;
import org.smtbridge.core.GeneralizedConstantValue;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.sexpr.SExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 解码 {@code (get-objectives)} 的回复 {@code (objectives item*)}。
 * 每一项先按普通模型值（宽松模式）解码，失败时再识别无穷和无穷小：
 * <pre>
 *   (sN oo)                          正无穷，整数或实数
 *   (sN (* -1 oo))                   负无穷，整数或实数
 *   (sN epsilon)                     正无穷小，实数
 *   (sN (* (to_real -1) epsilon))    负无穷小，实数
 * </pre>
 */
public final class ObjectiveValueExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ObjectiveValueExtractor.class);

    public static final String OBJECTIVES = "objectives";

    private final InputResolver resolver;
    private final ModelValueExtractor regular;

    public ObjectiveValueExtractor(List<NamedSymVar> inputs) {
        this.resolver = new InputResolver(inputs);
        this.regular = ModelValueExtractor.permissive(resolver);
    }

    /**
     * 解析并解码一行目标值输出。
     * @throws ModelExtractionException 行无法解析或某一项无法识别时。
     */
    public static List<ModelBinding<GeneralizedConstantValue>> interpretObjectiveLine(List<NamedSymVar> inputs, String line) {
        return new ObjectiveValueExtractor(inputs).extract(ModelValueExtractor.parseLine(line), line);
    }

    /**
     * 是否为 {@code (objectives ...)} 形式的树。
     */
    public static boolean isObjectives(SExpr tree) {
        return tree.asApp().filter(items -> !items.isEmpty()).map(items -> items.get(0).isSymbol(OBJECTIVES)).orElse(false);
    }

    public List<ModelBinding<GeneralizedConstantValue>> extract(SExpr tree, String line) {
        if (!isObjectives(tree)) {
            return List.of();
        }
        List<SExpr> items = tree.asApp().orElseThrow();
        List<ModelBinding<GeneralizedConstantValue>> result = new ArrayList<>();
        for (SExpr item : items.subList(1, items.size())) {
            List<ModelBinding<ConstantValue>> values = regular.extract(SExpr.app(item), line);
            if (values.isEmpty()) {
                result.add(unboundedValue(tree, item, line));
            } else {
                values.forEach(b -> result.add(ModelBinding.of(b.getRefId(), b.getName(),
                        GeneralizedConstantValue.regular(b.getValue()))));
            }
        }
        return result;
    }

    private ModelBinding<GeneralizedConstantValue> unboundedValue(SExpr tree, SExpr item, String line) {
        List<SExpr> pair = item.asApp().orElse(List.of());
        if (pair.size() == 2) {
            Optional<NamedSymVar> input = resolver.identify(pair.get(0), line);
            if (input.isPresent()) {
                Kind kind = input.get().getKind();
                GeneralizedConstantValue value = recognize(kind, pair.get(1));
                if (value != null) {
                    logger.debug("目标 {} = {}", input.get().getName(), value);
                    return ModelBinding.of(input.get().getRef().getId(), input.get().getName(), value);
                }
            }
        }
        logger.error("无法识别目标值: {}", item);
        throw new ModelExtractionException("Cannot extract objective value from solver output!"
                + "\n\tInput     : " + line
                + "\n\tParse     : " + tree
                + "\n\tItem Parse: " + item, line, item);
    }

    private static GeneralizedConstantValue recognize(Kind kind, SExpr v) {
        boolean integer = kind.isUnbounded();
        boolean real = kind.isReal();
        if (v.isSymbol("oo") && (integer || real)) {
            return GeneralizedConstantValue.infinite(integer ? Kind.UNBOUNDED : Kind.REAL, false);
        }
        if (isNegated(v, "oo") && (integer || real)) {
            return GeneralizedConstantValue.infinite(integer ? Kind.UNBOUNDED : Kind.REAL, true);
        }
        if (v.isSymbol("epsilon") && real) {
            return GeneralizedConstantValue.epsilon(Kind.REAL, false);
        }
        if (isNegatedRealCast(v) && real) {
            return GeneralizedConstantValue.epsilon(Kind.REAL, true);
        }
        return null;
    }

    // (* -1 name)
    private static boolean isNegated(SExpr v, String name) {
        List<SExpr> xs = v.asApp().orElse(List.of());
        return xs.size() == 3 && xs.get(0).isSymbol("*") && xs.get(1).isNum(-1) && xs.get(2).isSymbol(name);
    }

    // (* (to_real -1) epsilon)
    private static boolean isNegatedRealCast(SExpr v) {
        List<SExpr> xs = v.asApp().orElse(List.of());
        if (xs.size() != 3 || !xs.get(0).isSymbol("*") || !xs.get(2).isSymbol("epsilon")) {
            return false;
        }
        List<SExpr> cast = xs.get(1).asApp().orElse(List.of());
        return cast.size() == 2 && cast.get(0).isSymbol("to_real") && cast.get(1).isNum(-1);
    }
}
