package org.smtbridge.result;

import org.smtbridge.core.ConstantValue;
import org.smtbridge.core.GeneralizedConstantValue;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.sexpr.SExpr;
import org.smtbridge.solver.SmtConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 按回复的第一行判断求解结论。区分大小写，只认 unsat / unknown / sat / timeout，
 * 其余（包括空回复）一律是 PROOF_ERROR，原样保留回复。
 */
public final class ResultClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ResultClassifier.class);

    private ResultClassifier() {
    }

    /**
     * 使用默认的模型解码：{@code (objectives ...)} 行交给目标值解码，其余行按模型值解码。
     * @param config 本次求解的配置。
     * @param inputs 问题的输入。
     * @param lines 求解器的回复，按行拆分。
     */
    public static SmtResult classify(SmtConfig config, List<NamedSymVar> inputs, List<String> lines) {
        return classify(config, defaultExtractor(inputs), lines);
    }

    /**
     * @param extractor 把结论行之后的各行解码为模型。
     */
    public static SmtResult classify(SmtConfig config, Function<List<String>, SmtModel> extractor, List<String> lines) {
        String verdict = lines.isEmpty() ? "" : lines.get(0);
        List<String> rest = lines.isEmpty() ? List.of() : lines.subList(1, lines.size());
        SmtResult result = switch (verdict) {
            case "unsat" -> SmtResult.unsatisfiable(config);
            case "unknown" -> SmtResult.unknown(config, extractor.apply(rest));
            case "sat" -> SmtResult.satisfiable(config, extractor.apply(rest));
            case "timeout" -> SmtResult.timeout(config);
            default -> SmtResult.proofError(config, lines);
        };
        if (result.getType() == ResultType.PROOF_ERROR) {
            logger.warn("{} 的回复无法识别: {}", config.getSolverName(), lines);
        } else {
            logger.info("{} 返回 {}", config.getSolverName(), result.getType());
        }
        return result;
    }

    /**
     * 默认的模型解码。绑定按引用 id 排序，同一 id 保持行的顺序。
     * @throws ModelExtractionException 某一行无法解码时（在返回的函数被调用时抛出）。
     */
    public static Function<List<String>, SmtModel> defaultExtractor(List<NamedSymVar> inputs) {
        return lines -> {
            ModelValueExtractor models = ModelValueExtractor.strict(inputs);
            ObjectiveValueExtractor objectives = new ObjectiveValueExtractor(inputs);
            List<ModelBinding<ConstantValue>> values = new ArrayList<>();
            List<ModelBinding<GeneralizedConstantValue>> objectiveValues = new ArrayList<>();
            for (String line : lines) {
                if (line.isBlank()) {
                    continue;
                }
                SExpr tree = ModelValueExtractor.parseLine(line);
                if (ObjectiveValueExtractor.isObjectives(tree)) {
                    objectiveValues.addAll(objectives.extract(tree, line));
                } else {
                    values.addAll(models.extract(tree, line));
                }
            }
            return SmtModel.of(sorted(values), sorted(objectiveValues));
        };
    }

    private static <V> Map<String, V> sorted(List<ModelBinding<V>> bindings) {
        Map<String, V> result = new LinkedHashMap<>();
        bindings.stream()
                .sorted(Comparator.comparingInt(ModelBinding::getRefId))
                .forEach(b -> result.put(b.getName(), b.getValue()));
        return result;
    }
}
