package org.smtbridge.smtlib;

import org.smtbridge.core.ConstantValue;
import org.smtbridge.core.NamedSymVar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 枚举全部解时使用：为已经找到的每个模型生成一条断言，排除同一组取值再次出现。
 */
public final class ModelBlocker {

    private static final Logger logger = LoggerFactory.getLogger(ModelBlocker.class);

    private ModelBlocker() {
    }

    /**
     * @param inputs 问题的输入。
     * @param models 已找到的模型，键为输入的名字。
     * @return 每个模型一条 assert；存在全称输入时为空，表示不支持枚举全部解。
     */
    public static Optional<List<String>> blockModels(List<NamedSymVar> inputs, List<Map<String, ConstantValue>> models) {
        if (inputs.stream().anyMatch(NamedSymVar::isUniversal)) {
            logger.info("存在全称量化的输入，无法枚举全部解");
            return Optional.empty();
        }
        List<String> asserts = new ArrayList<>();
        for (Map<String, ConstantValue> model : models) {
            List<String> disequalities = new ArrayList<>();
            for (NamedSymVar input : inputs) {
                ConstantValue value = model.get(input.getName());
                if (value == null) {
                    continue;
                }
                // 宽松解码可能给整数输入绑定实数，写回去排序不一致
                if (!value.getKind().equals(input.getKind())) {
                    logger.debug("{} 的取值 {} 与输入类型 {} 不一致，不参与阻塞", input.getName(), value, input.getKind());
                    continue;
                }
                // 没有枚举下标的未解释元素是求解器内部名字，不能写回
                if (value.getKind().isUninterpreted() && value.getElementIndex().isEmpty()) {
                    continue;
                }
                disequalities.add("(not (= " + input.getRef() + " " + value.toSmtLib() + "))");
            }
            if (disequalities.isEmpty()) {
                logger.debug("模型 {} 没有可阻塞的取值，跳过", model);
                continue;
            }
            asserts.add(disequalities.size() == 1
                    ? "(assert " + disequalities.get(0) + ")"
                    : "(assert (or " + String.join(" ", disequalities) + "))");
        }
        return Optional.of(asserts);
    }
}
